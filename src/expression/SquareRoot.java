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

public final class SquareRoot extends UnaryOp {
    public SquareRoot(int _level, NLNode _argument, double _coef) {
        super(_level, _argument, _coef);
    }
    public SquareRoot(int _level, NLNode _argument) {
        this(_level, _argument, 1.0);
    }
    
    public NodeKind getKind() {
        return NodeKind.SQUAREROOT;
    }
    
    protected Interval apply(Interval a) {
        double lb=a.lower>0.0 ? Math.sqrt(a.lower) : 0.0;
        double ub=(a.hasUpper() && a.upper>=0.0) ? Math.sqrt(a.upper) : Double.POSITIVE_INFINITY;
        return new Interval(lb, ub);
    }
    
    protected <T> T apply(Arithmetic<T> arith, T arg) {
        return arith.sqrt(arg);
    }
    
    protected String opName() {
        return "sqrt";
    }
    
    public NLNode copy() {
        return new SquareRoot(level, argument.copy(), coef);
    }
}
