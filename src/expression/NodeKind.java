package factorable;
/*

    Factorable
    Copyright (C) 2023-2025 The Factorable authors
    
    This file is part of Factorable.
    
    Factorable is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.
    
    Factorable is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.
    
    You should have received a copy of the GNU General Public License
    along with Factorable.  If not, see <http://www.gnu.org/licenses/>.

*/

import java.util.*;

//  Kinds of expression node. The first fourteen are the nonlinear operators
//  with their OSiL tag names; the rest are leaves.

public enum NodeKind {
    SUM("sum"),
    PRODUCT("product"),
    SQUARE("square"),
    POWER("power"),
    COSINE("cos"),
    SINE("sin"),
    NEGATE("negate"),
    DIVIDE("divide"),
    SQUAREROOT("sqrt"),
    EXP("exp"),
    ABS("abs"),
    LN("ln"),
    LOG10("log10"),
    SIGNPOWER("signpower"),
    
    SUMMAND(null),
    FACTOR(null),
    VARIABLE("variable"),
    NUMBER("number");
    
    private static final HashMap<String, NodeKind> operatorTags = new HashMap<String, NodeKind>();
    static {
        for(NodeKind k : values()) {
            if(k.isOperator()) {
                operatorTags.put(k.tag, k);
            }
        }
    }
    
    private final String tag;
    
    NodeKind(String _tag) {
        tag=_tag;
    }
    
    public String getTag() {
        return tag;
    }
    
    public boolean isOperator() {
        return ordinal()<=SIGNPOWER.ordinal();
    }
    
    //  Operator kind for an OSiL tag, or null if the tag is not one of the fourteen.
    public static NodeKind fromTag(String tag) {
        return operatorTags.get(tag);
    }
}
