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

//  Product of factors and nested operator nodes.

public final class Product extends NLNode {
    private final ArrayList<NLNode> factors;
    
    public Product(int _level, List<? extends NLNode> _factors) {
        super(_level);
        if(_factors==null || _factors.size()==0) {
            throw new ValidationException("Product must have at least one factor.");
        }
        factors=new ArrayList<NLNode>(_factors.size());
        for(NLNode f : _factors) {
            checkFactor(f);
            factors.add(f);
        }
    }
    
    private void checkFactor(NLNode f) {
        checkChild(f);
        if(f.getKind()!=NodeKind.FACTOR && !f.getKind().isOperator()) {
            throw new ValidationException("Product factor must be a factor or an operator, got "+f.getKind()+".");
        }
    }
    
    public NodeKind getKind() {
        return NodeKind.PRODUCT;
    }
    
    public List<NLNode> getChildren() {
        return Collections.unmodifiableList(factors);
    }
    
    public int numFactors() {
        return factors.size();
    }
    public NLNode getFactor(int i) {
        return factors.get(i);
    }
    public void setFactor(int i, NLNode f) {
        checkFactor(f);
        factors.set(i, f);
        bounds=null;
    }
    public void addFactor(NLNode f) {
        checkFactor(f);
        factors.add(f);
        bounds=null;
    }
    public NLNode removeLastFactor() {
        if(factors.size()==1) {
            throw new ValidationException("Cannot remove the only factor of a product.");
        }
        bounds=null;
        return factors.remove(factors.size()-1);
    }
    
    protected Interval propagate(List<Variable> variables) {
        double lb=1.0;
        double ub=1.0;
        for(NLNode f : factors) {
            Interval b=f.computeBounds(variables);
            double c1=Interval.mulEndpoints(lb, b.lower);
            double c2=Interval.mulEndpoints(lb, b.upper);
            double c3=Interval.mulEndpoints(ub, b.lower);
            double c4=Interval.mulEndpoints(ub, b.upper);
            lb=Math.min(Math.min(c1, c2), Math.min(c3, c4));
            ub=Math.max(Math.max(c1, c2), Math.max(c3, c4));
        }
        return new Interval(Interval.lowerOrUnbounded(lb), Interval.upperOrUnbounded(ub));
    }
    
    public NLNode copy() {
        ArrayList<NLNode> c=new ArrayList<NLNode>(factors.size());
        for(NLNode f : factors) {
            c.add(f.copy());
        }
        return new Product(level, c);
    }
    
    public <T> T evaluate(Arithmetic<T> arith, IntFunction<T> valuation) {
        T total=factors.get(0).evaluate(arith, valuation);
        for(int i=1; i<factors.size(); i++) {
            total=arith.multiply(total, factors.get(i).evaluate(arith, valuation));
        }
        return total;
    }
    
    public String toString() {
        StringBuilder b=new StringBuilder("(");
        for(int i=0; i<factors.size(); i++) {
            if(i>0) {
                b.append(" * ");
            }
            b.append(factors.get(i));
        }
        b.append(")");
        return b.toString();
    }
}
