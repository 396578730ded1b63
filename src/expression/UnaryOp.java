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

//  Operator with one argument scaled by a coefficient. The argument is a
//  variable or another operator; a lone constant is expected to have been
//  folded away before the tree is built.

public abstract class UnaryOp extends NLNode {
    protected NLNode argument;
    protected final double coef;
    
    protected UnaryOp(int _level, NLNode _argument, double _coef) {
        super(_level);
        checkArgument(_argument, false);
        argument=_argument;
        coef=checkCoefficient(_coef);
    }
    
    public NLNode getArgument() {
        return argument;
    }
    public void setArgument(NLNode a) {
        checkArgument(a, false);
        argument=a;
        bounds=null;
    }
    public double getCoefficient() {
        return coef;
    }
    
    public List<NLNode> getChildren() {
        return Collections.singletonList(argument);
    }
    
    protected Interval propagate(List<Variable> variables) {
        return apply(argument.computeBounds(variables).scale(coef));
    }
    
    //  Interval of the operator over the (already scaled) argument interval.
    protected abstract Interval apply(Interval arg);
    
    protected abstract <T> T apply(Arithmetic<T> arith, T arg);
    
    //  Name used when printing.
    protected abstract String opName();
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        return apply(arith, scaled(arith, coef, argument.evaluate(arith, valuation)));
    }
    
    public String toString() {
        return opName()+"("+scaledString(coef, argument)+")";
    }
}
