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

//  numerator/denominator. The numerator may be a constant, the denominator
//  may not.

public final class Divide extends NLNode {
    private NLNode numerator;
    private NLNode denominator;
    private final double numCoef;
    private final double denCoef;
    
    public Divide(int _level, NLNode _numerator, double _numCoef, NLNode _denominator, double _denCoef) {
        super(_level);
        checkArgument(_numerator, true);
        checkArgument(_denominator, false);
        numerator=_numerator;
        denominator=_denominator;
        numCoef=checkCoefficient(_numCoef);
        denCoef=checkCoefficient(_denCoef);
    }
    public Divide(int _level, NLNode _numerator, NLNode _denominator) {
        this(_level, _numerator, 1.0, _denominator, 1.0);
    }
    
    public NodeKind getKind() {
        return NodeKind.DIVIDE;
    }
    
    public NLNode getNumerator() {
        return numerator;
    }
    public NLNode getDenominator() {
        return denominator;
    }
    public double getNumeratorCoefficient() {
        return numCoef;
    }
    public double getDenominatorCoefficient() {
        return denCoef;
    }
    public boolean isNumeratorConstant() {
        return numerator.getKind()==NodeKind.NUMBER;
    }
    public void setNumerator(NLNode n) {
        checkArgument(n, true);
        numerator=n;
        bounds=null;
    }
    public void setDenominator(NLNode d) {
        checkArgument(d, false);
        denominator=d;
        bounds=null;
    }
    
    public List<NLNode> getChildren() {
        return Arrays.asList(numerator, denominator);
    }
    
    protected Interval propagate(List<Variable> variables) {
        Interval n=numerator.computeBounds(variables).scale(numCoef);
        Interval d=denominator.computeBounds(variables).scale(denCoef);
        if(d.contains(0.0)) {
            return Interval.UNBOUNDED;
        }
        double[] range={Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
        ratio(n.lower, d.lower, range);
        ratio(n.lower, d.upper, range);
        ratio(n.upper, d.lower, range);
        ratio(n.upper, d.upper, range);
        return new Interval(Interval.lowerOrUnbounded(range[0]), Interval.upperOrUnbounded(range[1]));
    }
    
    //  Widen range by a/b. inf/inf stands for every value between 0 and the signed infinity.
    private static void ratio(double a, double b, double[] range) {
        if(Double.isInfinite(a) && Double.isInfinite(b)) {
            double inf=Math.signum(a)*Math.signum(b)*Double.POSITIVE_INFINITY;
            include(0.0, range);
            include(inf, range);
        }
        else {
            include(a/b, range);
        }
    }
    private static void include(double v, double[] range) {
        range[0]=Math.min(range[0], v);
        range[1]=Math.max(range[1], v);
    }
    
    public NLNode copy() {
        return new Divide(level, numerator.copy(), numCoef, denominator.copy(), denCoef);
    }
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        T n=scaled(arith, numCoef, numerator.evaluate(arith, valuation));
        T d=scaled(arith, denCoef, denominator.evaluate(arith, valuation));
        return arith.divide(n, d);
    }
    
    public String toString() {
        return "("+scaledString(numCoef, numerator)+")/("+scaledString(denCoef, denominator)+")";
    }
}
