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

//  Leaf of a Sum or Product: a variable times a coefficient, or a constant
//  equal to the coefficient when there is no variable.

public abstract class Atom extends NLNode {
    public static final int NO_VARIABLE = -1;
    
    protected final int varIndex;
    protected final double coef;
    
    protected Atom(int _level, int _varIndex, double _coef) {
        super(_level);
        if(_varIndex<0 && _varIndex!=NO_VARIABLE) {
            throw new ValidationException("Negative variable index "+_varIndex+".");
        }
        varIndex=_varIndex;
        coef=checkCoefficient(_coef);
    }
    
    public int getVariableIndex() {
        return varIndex;
    }
    public double getCoefficient() {
        return coef;
    }
    public boolean isConstant() {
        return varIndex==NO_VARIABLE;
    }
    
    public List<NLNode> getChildren() {
        return Collections.emptyList();
    }
    
    public int maxVariableIndex() {
        return varIndex;
    }
    
    protected Interval propagate(List<Variable> variables) {
        if(isConstant()) {
            return Interval.point(coef);
        }
        Variable v=variables.get(varIndex);
        return Interval.scaled(v.getLowerBound(), v.getUpperBound(), coef);
    }
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        if(isConstant()) {
            return arith.constant(coef);
        }
        return scaled(arith, coef, valuation.apply(varIndex));
    }
    
    public String toString() {
        if(isConstant()) {
            return String.valueOf(coef);
        }
        return scaledString(coef, new Identifier(0, varIndex));
    }
}
