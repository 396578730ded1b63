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

public final class Exp extends UnaryOp {
    public Exp(int _level, NLNode _argument, double _coef) {
        super(_level, _argument, _coef);
    }
    public Exp(int _level, NLNode _argument) {
        this(_level, _argument, 1.0);
    }
    
    public NodeKind getKind() {
        return NodeKind.EXP;
    }
    
    //  exp(-inf) is 0 and exp(inf) is inf, so no special cases.
    protected Interval apply(Interval a) {
        return new Interval(Math.exp(a.lower), Math.exp(a.upper));
    }
    
    protected <T> T apply(Arithmetic<T> arith, T arg) {
        return arith.exp(arg);
    }
    
    protected String opName() {
        return "exp";
    }
    
    public NLNode copy() {
        return new Exp(level, argument.copy(), coef);
    }
}
