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

//  base^exponent where both sides are a variable, a constant or an operator,
//  each scaled by its own coefficient.

public final class Power extends NLNode {
    private NLNode base;
    private NLNode exponent;
    private final double baseCoef;
    private final double exponentCoef;
    
    public Power(int _level, NLNode _base, double _baseCoef, NLNode _exponent, double _exponentCoef) {
        super(_level);
        baseCoef=checkCoefficient(_baseCoef);
        exponentCoef=checkCoefficient(_exponentCoef);
        checkBase(_base);
        checkExponent(_exponent);
        base=_base;
        exponent=_exponent;
    }
    public Power(int _level, NLNode _base, NLNode _exponent) {
        this(_level, _base, 1.0, _exponent, 1.0);
    }
    
    private void checkBase(NLNode b) {
        checkArgument(b, true);
        if(b instanceof NumberConstant && ((NumberConstant) b).getValue()<0.0) {
            throw new ValidationException("Constant base of a power must be non-negative, got "+b+".");
        }
    }
    private void checkExponent(NLNode e) {
        checkArgument(e, true);
        if(e instanceof NumberConstant && ((NumberConstant) e).getValue()==0.0) {
            throw new ValidationException("Constant exponent of a power must be non-zero.");
        }
    }
    
    public NodeKind getKind() {
        return NodeKind.POWER;
    }
    
    public NLNode getBase() {
        return base;
    }
    public NLNode getExponent() {
        return exponent;
    }
    public double getBaseCoefficient() {
        return baseCoef;
    }
    public double getExponentCoefficient() {
        return exponentCoef;
    }
    public void setBase(NLNode b) {
        checkBase(b);
        base=b;
        bounds=null;
    }
    public void setExponent(NLNode e) {
        checkExponent(e);
        exponent=e;
        bounds=null;
    }
    
    public List<NLNode> getChildren() {
        return Arrays.asList(base, exponent);
    }
    
    protected Interval propagate(List<Variable> variables) {
        Interval b=base.computeBounds(variables).scale(baseCoef);
        Interval e=exponent.computeBounds(variables).scale(exponentCoef);
        return powerBounds(b, e);
    }
    
    static Interval powerBounds(Interval b, Interval e) {
        if(e.isPoint() && Double.isFinite(e.lower) && e.lower==Math.rint(e.lower)) {
            return integerPowerBounds(b, e.lower);
        }
        //  Any non-integer exponent is undefined for a negative base. Math.pow
        //  gives no NaN for an infinite base, so test the base itself.
        if(b.lower<0.0) {
            CmdFlags.warning("Possibly negative base "+b+" in power with exponent "+e+", leaving it unbounded.");
            return Interval.UNBOUNDED;
        }
        double c1=Math.pow(b.lower, e.lower);
        double c2=Math.pow(b.lower, e.upper);
        double c3=Math.pow(b.upper, e.lower);
        double c4=Math.pow(b.upper, e.upper);
        if(Double.isNaN(c1) || Double.isNaN(c2) || Double.isNaN(c3) || Double.isNaN(c4)) {
            CmdFlags.warning("Power with base "+b+" and exponent "+e+" is undefined for part of its domain, leaving it unbounded.");
            return Interval.UNBOUNDED;
        }
        double lb=Math.min(Math.min(c1, c2), Math.min(c3, c4));
        double ub=Math.max(Math.max(c1, c2), Math.max(c3, c4));
        return new Interval(Interval.lowerOrUnbounded(lb), Interval.upperOrUnbounded(ub));
    }
    
    private static Interval integerPowerBounds(Interval b, double k) {
        if(k==0.0) {
            return Interval.point(1.0);
        }
        double pl=Math.pow(b.lower, k);
        double pu=Math.pow(b.upper, k);
        if(k<0.0) {
            //  1/x^|k| has a pole at 0.
            if(b.contains(0.0)) {
                return Interval.UNBOUNDED;
            }
            return new Interval(Math.min(pl, pu), Math.max(pl, pu));
        }
        if(k%2.0==0.0) {
            double lb=b.contains(0.0) ? 0.0 : Math.min(pl, pu);
            return new Interval(lb, Math.max(pl, pu));
        }
        return new Interval(pl, pu);
    }
    
    public NLNode copy() {
        return new Power(level, base.copy(), baseCoef, exponent.copy(), exponentCoef);
    }
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        T b=scaled(arith, baseCoef, base.evaluate(arith, valuation));
        T e=scaled(arith, exponentCoef, exponent.evaluate(arith, valuation));
        return arith.power(b, e);
    }
    
    public String toString() {
        return "("+scaledString(baseCoef, base)+")^("+scaledString(exponentCoef, exponent)+")";
    }
}
