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

//  Closed real interval used for bound propagation. An infinite endpoint
//  means the expression is unbounded on that side.

public final class Interval {
    public static final Interval UNBOUNDED = new Interval(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    public final double lower;
    public final double upper;

    public Interval(double l, double u) {
        assert !Double.isNaN(l) && !Double.isNaN(u);
        assert l != Double.POSITIVE_INFINITY && u != Double.NEGATIVE_INFINITY;
        lower=l;
        upper=u;
    }

    public static Interval point(double v) {
        return new Interval(v, v);
    }

    //  Interval of a variable with bounds lb..ub scaled by coef.
    //  A zero coefficient gives [0,0] even when the variable is unbounded.
    public static Interval scaled(double lb, double ub, double coef) {
        if(coef==0.0) {
            return point(0.0);
        }
        double a=coef*lb;
        double b=coef*ub;
        return new Interval(Math.min(a, b), Math.max(a, b));
    }

    public Interval scale(double coef) {
        return scaled(lower, upper, coef);
    }

    public boolean hasLower() {
        return lower!=Double.NEGATIVE_INFINITY;
    }
    public boolean hasUpper() {
        return upper!=Double.POSITIVE_INFINITY;
    }
    public boolean isUnbounded() {
        return !hasLower() && !hasUpper();
    }
    public boolean isPoint() {
        return lower==upper;
    }

    public boolean contains(double v) {
        return lower<=v && v<=upper;
    }

    //  True if other lies entirely inside this interval.
    public boolean encloses(Interval other) {
        return lower<=other.lower && other.upper<=upper;
    }

    //  Product of two endpoints where 0 times an infinity counts as 0.
    public static double mulEndpoints(double a, double b) {
        if(a==0.0 || b==0.0) {
            return 0.0;
        }
        return a*b;
    }

    //  Lower bound from a candidate value, mapping NaN and +inf to unbounded.
    static double lowerOrUnbounded(double v) {
        if(Double.isNaN(v) || v==Double.POSITIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }
        return v;
    }
    static double upperOrUnbounded(double v) {
        if(Double.isNaN(v) || v==Double.NEGATIVE_INFINITY) {
            return Double.POSITIVE_INFINITY;
        }
        return v;
    }

    @Override
    public boolean equals(Object other) {
        if(!(other instanceof Interval)) {
            return false;
        }
        Interval o=(Interval) other;
        return Double.compare(lower, o.lower)==0 && Double.compare(upper, o.upper)==0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(lower)*31+Double.hashCode(upper);
    }

    public String toString() {
        String l=hasLower() ? String.valueOf(lower) : "-inf";
        String u=hasUpper() ? String.valueOf(upper) : "inf";
        return "["+l+", "+u+"]";
    }
}
