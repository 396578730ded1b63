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

//  x*|x|^(p-1) for a variable x and constant p > 1. Monotone increasing.

public final class SignPower extends NLNode {
    private final Identifier base;
    private final double exponent;
    
    public SignPower(int _level, Identifier _base, double _exponent) {
        super(_level);
        checkChild(_base);
        checkCoefficient(_exponent);
        if(!(_exponent>1.0)) {
            throw new ValidationException("Exponent of signpower must be greater than 1, got "+_exponent+".");
        }
        base=_base;
        exponent=_exponent;
    }
    
    public NodeKind getKind() {
        return NodeKind.SIGNPOWER;
    }
    
    public Identifier getBase() {
        return base;
    }
    public double getExponent() {
        return exponent;
    }
    
    public List<NLNode> getChildren() {
        return Collections.singletonList(base);
    }
    
    protected Interval propagate(List<Variable> variables) {
        Interval b=base.computeBounds(variables);
        double lb=b.hasLower() ? b.lower*Math.pow(Math.abs(b.lower), exponent-1.0) : Double.NEGATIVE_INFINITY;
        double ub=b.hasUpper() ? b.upper*Math.pow(Math.abs(b.upper), exponent-1.0) : Double.POSITIVE_INFINITY;
        return new Interval(lb, ub);
    }
    
    public NLNode copy() {
        return new SignPower(level, (Identifier) base.copy(), exponent);
    }
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        return arith.signPower(base.evaluate(arith, valuation), exponent);
    }
    
    public String toString() {
        return "signpower("+base+", "+exponent+")";
    }
}
