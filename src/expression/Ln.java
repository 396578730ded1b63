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

public final class Ln extends UnaryOp {
    public Ln(int _level, NLNode _argument, double _coef) {
        super(_level, _argument, _coef);
    }
    public Ln(int _level, NLNode _argument) {
        this(_level, _argument, 1.0);
    }
    
    public NodeKind getKind() {
        return NodeKind.LN;
    }
    
    protected Interval apply(Interval a) {
        double lb=a.lower>0.0 ? Math.log(a.lower) : Double.NEGATIVE_INFINITY;
        double ub=(a.hasUpper() && a.upper>0.0) ? Math.log(a.upper) : Double.POSITIVE_INFINITY;
        return new Interval(lb, ub);
    }
    
    protected <T> T apply(Arithmetic<T> arith, T arg) {
        return arith.ln(arg);
    }
    
    protected String opName() {
        return "ln";
    }
    
    public NLNode copy() {
        return new Ln(level, argument.copy(), coef);
    }
}
