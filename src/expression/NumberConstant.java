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

public final class NumberConstant extends NLNode {
    private final double value;
    
    public NumberConstant(int _level, double _value) {
        super(_level);
        value=checkCoefficient(_value);
    }
    
    public double getValue() {
        return value;
    }
    
    public NodeKind getKind() {
        return NodeKind.NUMBER;
    }
    
    public List<NLNode> getChildren() {
        return Collections.emptyList();
    }
    
    protected Interval propagate(List<Variable> variables) {
        return Interval.point(value);
    }
    
    public NLNode copy() {
        return new NumberConstant(level, value);
    }
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        return arith.constant(value);
    }
    
    @Override
    public boolean equals(Object other) {
        if(!(other instanceof NumberConstant)) {
            return false;
        }
        return Double.compare(((NumberConstant) other).value, value)==0;
    }
    
    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
    
    public String toString() {
        return String.valueOf(value);
    }
}
