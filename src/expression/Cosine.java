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

//  Minima of cos are at -pi+2k*pi and maxima at 2k*pi. If one of them lies
//  inside the argument interval the bound is -1 or 1, otherwise it is taken
//  at an endpoint.

public final class Cosine extends UnaryOp {
    public Cosine(int _level, NLNode _argument, double _coef) {
        super(_level, _argument, _coef);
    }
    public Cosine(int _level, NLNode _argument) {
        this(_level, _argument, 1.0);
    }
    
    public NodeKind getKind() {
        return NodeKind.COSINE;
    }
    
    protected Interval apply(Interval a) {
        double lb;
        if(Math.ceil((a.lower+Math.PI)/(2*Math.PI)) <= (a.upper+Math.PI)/(2*Math.PI)) {
            lb=-1.0;
        }
        else {
            lb=Math.min(Math.cos(a.lower), Math.cos(a.upper));
        }
        double ub;
        if(Math.ceil(a.lower/(2*Math.PI)) <= a.upper/(2*Math.PI)) {
            ub=1.0;
        }
        else {
            ub=Math.max(Math.cos(a.lower), Math.cos(a.upper));
        }
        return new Interval(lb, ub);
    }
    
    protected <T> T apply(Arithmetic<T> arith, T arg) {
        return arith.cos(arg);
    }
    
    protected String opName() {
        return "cos";
    }
    
    public NLNode copy() {
        return new Cosine(level, argument.copy(), coef);
    }
}
