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

//  Same scheme as Cosine with minima at -pi/2+2k*pi and maxima at -3pi/2+2k*pi.

public final class Sine extends UnaryOp {
    public Sine(int _level, NLNode _argument, double _coef) {
        super(_level, _argument, _coef);
    }
    public Sine(int _level, NLNode _argument) {
        this(_level, _argument, 1.0);
    }
    
    public NodeKind getKind() {
        return NodeKind.SINE;
    }
    
    protected Interval apply(Interval a) {
        double lb;
        if(Math.ceil((a.lower+Math.PI/2)/(2*Math.PI)) <= (a.upper+Math.PI/2)/(2*Math.PI)) {
            lb=-1.0;
        }
        else {
            lb=Math.min(Math.sin(a.lower), Math.sin(a.upper));
        }
        double ub;
        if(Math.ceil((a.lower+3*Math.PI/2)/(2*Math.PI)) <= (a.upper+3*Math.PI/2)/(2*Math.PI)) {
            ub=1.0;
        }
        else {
            ub=Math.max(Math.sin(a.lower), Math.sin(a.upper));
        }
        return new Interval(lb, ub);
    }
    
    protected <T> T apply(Arithmetic<T> arith, T arg) {
        return arith.sin(arg);
    }
    
    protected String opName() {
        return "sin";
    }
    
    public NLNode copy() {
        return new Sine(level, argument.copy(), coef);
    }
}
