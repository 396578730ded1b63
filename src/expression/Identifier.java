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
import java.util.function.IntFunction;

//  Reference to a decision variable in an operator argument position.
//  Any scaling lives on the operator's coefficient.

public final class Identifier extends NLNode {
    private final int varIndex;
    
    public Identifier(int _level, int _varIndex) {
        super(_level);
        if(_varIndex<0) {
            throw new ValidationException("Negative variable index "+_varIndex+".");
        }
        varIndex=_varIndex;
    }
    
    public int getVariableIndex() {
        return varIndex;
    }
    
    public NodeKind getKind() {
        return NodeKind.VARIABLE;
    }
    
    public List<NLNode> getChildren() {
        return Collections.emptyList();
    }
    
    public int maxVariableIndex() {
        return varIndex;
    }
    
    protected Interval propagate(List<Variable> variables) {
        Variable v=variables.get(varIndex);
        return new Interval(v.getLowerBound(), v.getUpperBound());
    }
    
    public NLNode copy() {
        return new Identifier(level, varIndex);
    }
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        return valuation.apply(varIndex);
    }
    
    @Override
    public boolean equals(Object other) {
        if(!(other instanceof Identifier)) {
            return false;
        }
        return ((Identifier) other).varIndex==varIndex;
    }
    
    @Override
    public int hashCode() {
        return varIndex;
    }
    
    public String toString() {
        return "x["+varIndex+"]";
    }
}
