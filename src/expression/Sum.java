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

//  Sum of summands and nested operator nodes.

public final class Sum extends NLNode {
    private final ArrayList<NLNode> entities;
    
    public Sum(int _level, List<? extends NLNode> _entities) {
        super(_level);
        if(_entities==null || _entities.size()==0) {
            throw new ValidationException("Sum must have at least one entity.");
        }
        entities=new ArrayList<NLNode>(_entities.size());
        for(NLNode e : _entities) {
            checkEntity(e);
            entities.add(e);
        }
    }
    
    private void checkEntity(NLNode e) {
        checkChild(e);
        if(e.getKind()!=NodeKind.SUMMAND && !e.getKind().isOperator()) {
            throw new ValidationException("Sum entity must be a summand or an operator, got "+e.getKind()+".");
        }
    }
    
    public NodeKind getKind() {
        return NodeKind.SUM;
    }
    
    public List<NLNode> getChildren() {
        return Collections.unmodifiableList(entities);
    }
    
    public int numEntities() {
        return entities.size();
    }
    public NLNode getEntity(int i) {
        return entities.get(i);
    }
    public void setEntity(int i, NLNode e) {
        checkEntity(e);
        entities.set(i, e);
        bounds=null;
    }
    
    protected Interval propagate(List<Variable> variables) {
        double lb=0.0;
        double ub=0.0;
        for(NLNode e : entities) {
            Interval b=e.computeBounds(variables);
            lb+=b.lower;
            ub+=b.upper;
        }
        return new Interval(lb, ub);
    }
    
    public NLNode copy() {
        ArrayList<NLNode> c=new ArrayList<NLNode>(entities.size());
        for(NLNode e : entities) {
            c.add(e.copy());
        }
        return new Sum(level, c);
    }
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        T total=entities.get(0).evaluate(arith, valuation);
        for(int i=1; i<entities.size(); i++) {
            total=arith.add(total, entities.get(i).evaluate(arith, valuation));
        }
        return total;
    }
    
    public String toString() {
        StringBuilder b=new StringBuilder("(");
        for(int i=0; i<entities.size(); i++) {
            if(i>0) {
                b.append(" + ");
            }
            b.append(entities.get(i));
        }
        b.append(")");
        return b.toString();
    }
}
