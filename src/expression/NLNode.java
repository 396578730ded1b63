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

//  Base class of the nonlinear expression tree. Every node knows its depth
//  in the tree (root is 0), computes an interval enclosing its value from the
//  bounds of the variables, and can be evaluated over any Arithmetic.

public abstract class NLNode {
    protected int level;
    
    //  Cached by computeBounds, null until then.
    protected Interval bounds;
    
    protected NLNode(int _level) {
        if(_level<0) {
            throw new ValidationException("Negative level "+_level+" in expression node.");
        }
        level=_level;
    }
    
    public int getLevel() {
        return level;
    }
    
    public abstract NodeKind getKind();
    
    public boolean isLeaf() {
        return !getKind().isOperator();
    }
    
    //  Direct children in argument order. Leaves have none.
    public abstract List<NLNode> getChildren();
    
    //  Set the level of this node to l and fix up the whole subtree.
    public void relevel(int l) {
        if(l<0) {
            throw new ValidationException("Negative level "+l+" in expression node.");
        }
        level=l;
        for(NLNode child : getChildren()) {
            child.relevel(l+1);
        }
    }
    
    //  Recompute the bounds of this subtree from the given variables and cache them.
    public final Interval computeBounds(List<Variable> variables) {
        bounds=propagate(variables);
        return bounds;
    }
    
    public Interval getBounds() {
        return bounds;
    }
    
    protected abstract Interval propagate(List<Variable> variables);
    
    public abstract NLNode copy();
    
    public abstract <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation);
    
    public double evaluate(double[] x) {
        return evaluate(DoubleArithmetic.INSTANCE, i -> x[i]);
    }
    
    //  Largest variable index referenced in the subtree, -1 if there is none.
    public int maxVariableIndex() {
        int max=-1;
        for(NLNode child : getChildren()) {
            max=Math.max(max, child.maxVariableIndex());
        }
        return max;
    }
    
    //  Number of nodes of each kind in the subtree, leaves included.
    public void countKinds(EnumMap<NodeKind, Integer> counts) {
        ArrayDeque<NLNode> todo=new ArrayDeque<NLNode>();
        todo.add(this);
        while(todo.size()>0) {
            NLNode cur=todo.removeFirst();
            counts.merge(cur.getKind(), 1, Integer::sum);
            todo.addAll(cur.getChildren());
        }
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Construction checks shared by the node classes
    
    protected static double checkCoefficient(double c) {
        if(!Double.isFinite(c)) {
            throw new ValidationException("Coefficient must be a finite number, got "+c+".");
        }
        return c;
    }
    
    protected void checkChild(NLNode child) {
        if(child==null) {
            throw new ValidationException("Missing child of "+getKind()+" node.");
        }
        if(child.level!=level+1) {
            throw new ValidationException("Child of "+getKind()+" node at level "+level+" has level "+child.level+".");
        }
    }
    
    //  An argument of a unary or binary operator: a variable, optionally a
    //  constant, or another operator.
    protected void checkArgument(NLNode arg, boolean allowConstant) {
        checkChild(arg);
        NodeKind k=arg.getKind();
        if(k==NodeKind.SUMMAND || k==NodeKind.FACTOR) {
            throw new ValidationException(k+" cannot be an argument of "+getKind()+".");
        }
        if(k==NodeKind.NUMBER && !allowConstant) {
            throw new ValidationException("Constant argument not allowed here in "+getKind()+".");
        }
    }
    
    protected static boolean isAtomicArgument(NLNode arg) {
        return arg.getKind()==NodeKind.VARIABLE || arg.getKind()==NodeKind.NUMBER;
    }
    
    protected static <T> T scaled(Arithmetic<T> arith, double coef, T value) {
        if(coef==1.0) {
            return value;
        }
        return arith.scale(coef, value);
    }
    
    protected static String scaledString(double coef, NLNode arg) {
        if(coef==1.0) {
            return arg.toString();
        }
        return coef+"*"+arg;
    }
}
