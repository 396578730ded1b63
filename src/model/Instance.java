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

import gnu.trove.map.hash.*;

//  A mathematical programming instance: variables, objective, constraint
//  metadata and the linear, quadratic and nonlinear parts of each
//  constraint. The parts are keyed by constraint index; OBJECTIVE is the key
//  for the parts that belong to the objective.

public final class Instance {
    public static final int OBJECTIVE = -1;
    
    private String name="";
    
    private final ArrayList<Variable> variables=new ArrayList<Variable>();
    private Objective objective;
    private final ArrayList<ConstraintInfo> constraints=new ArrayList<ConstraintInfo>();
    
    private final TIntObjectHashMap<ArrayList<LinearTerm>> linear=new TIntObjectHashMap<ArrayList<LinearTerm>>();
    private final TIntObjectHashMap<ArrayList<QuadraticTerm>> quadratic=new TIntObjectHashMap<ArrayList<QuadraticTerm>>();
    private final TIntObjectHashMap<NLNode> nonlinear=new TIntObjectHashMap<NLNode>();
    
    private boolean complete=false;
    
    //  Operator counts taken when the instance was completed.
    private EnumMap<NodeKind, Integer> operatorCounts=new EnumMap<NodeKind, Integer>(NodeKind.class);
    
    public Instance() {
        linear.put(OBJECTIVE, new ArrayList<LinearTerm>());
        quadratic.put(OBJECTIVE, new ArrayList<QuadraticTerm>());
    }
    
    public String getName() {
        return name;
    }
    public void setName(String n) {
        name=(n==null) ? "" : n;
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Variables
    
    public int addVariable(Variable v) {
        variables.add(v);
        return variables.size()-1;
    }
    
    //  Continuous variable with the given bounds, returns its index.
    public int newAuxiliaryVariable(String auxname, Interval b) {
        return addVariable(new Variable(auxname, b.lower, b.upper, VarType.CONTINUOUS));
    }
    
    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }
    public Variable getVariable(int i) {
        return variables.get(i);
    }
    public int numVariables() {
        return variables.size();
    }
    
    //  Replace the bounds of variable i.
    public void setVariableBounds(int i, double lb, double ub) {
        variables.set(i, variables.get(i).withBounds(lb, ub));
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Objective
    
    public Objective getObjective() {
        return objective;
    }
    public void setObjective(Objective o) {
        if(objective!=null) {
            throw new ValidationException("Instance already has an objective.");
        }
        objective=o;
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Constraints
    
    //  Append a constraint with empty linear and quadratic parts, returns its index.
    public int addConstraint(ConstraintInfo c) {
        constraints.add(c);
        int idx=constraints.size()-1;
        linear.put(idx, new ArrayList<LinearTerm>());
        quadratic.put(idx, new ArrayList<QuadraticTerm>());
        return idx;
    }
    
    public ConstraintInfo getConstraint(int i) {
        return constraints.get(i);
    }
    public List<ConstraintInfo> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }
    public int numConstraints() {
        return constraints.size();
    }
    
    private void checkKey(int key) {
        if(key!=OBJECTIVE && (key<0 || key>=constraints.size())) {
            throw new ValidationException("No constraint with index "+key+".");
        }
    }
    private void checkVariable(int v) {
        if(v<0 || v>=variables.size()) {
            throw new ValidationException("Variable index "+v+" out of range, there are "+variables.size()+" variables.");
        }
    }
    
    public void addLinearTerm(int key, LinearTerm t) {
        checkKey(key);
        checkVariable(t.var);
        linear.get(key).add(t);
    }
    public void addQuadraticTerm(int key, QuadraticTerm t) {
        checkKey(key);
        checkVariable(t.var1);
        checkVariable(t.var2);
        quadratic.get(key).add(t);
    }
    
    public List<LinearTerm> getLinearTerms(int key) {
        checkKey(key);
        return Collections.unmodifiableList(linear.get(key));
    }
    public List<QuadraticTerm> getQuadraticTerms(int key) {
        checkKey(key);
        return Collections.unmodifiableList(quadratic.get(key));
    }
    
    public boolean hasNonlinear(int key) {
        return nonlinear.containsKey(key);
    }
    public NLNode getNonlinear(int key) {
        return nonlinear.get(key);
    }
    public void setNonlinear(int key, NLNode root) {
        checkKey(key);
        if(root.getLevel()!=0) {
            throw new ValidationException("Root of a nonlinear expression must have level 0, got "+root.getLevel()+".");
        }
        if(root.maxVariableIndex()>=variables.size()) {
            throw new ValidationException("Nonlinear expression "+root+" refers to variable "+root.maxVariableIndex()+", there are "+variables.size()+" variables.");
        }
        nonlinear.put(key, root);
    }
    public NLNode removeNonlinear(int key) {
        return nonlinear.remove(key);
    }
    
    //  Keys with a nonlinear part in ascending order, so OBJECTIVE comes first.
    public int[] nonlinearKeys() {
        int[] keys=nonlinear.keys();
        Arrays.sort(keys);
        return keys;
    }
    
    public void computeBounds() {
        for(int key : nonlinearKeys()) {
            nonlinear.get(key).computeBounds(variables);
        }
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Completion and statistics
    
    public boolean isComplete() {
        return complete;
    }
    
    public void markComplete() {
        complete=true;
        operatorCounts=countOperators();
    }
    
    public EnumMap<NodeKind, Integer> getOperatorCounts() {
        return new EnumMap<NodeKind, Integer>(operatorCounts);
    }
    
    public int getOperatorCount(NodeKind k) {
        Integer c=operatorCounts.get(k);
        return (c==null) ? 0 : c;
    }
    
    //  Nodes of each operator kind over all current nonlinear parts.
    public EnumMap<NodeKind, Integer> countOperators() {
        EnumMap<NodeKind, Integer> all=new EnumMap<NodeKind, Integer>(NodeKind.class);
        for(int key : nonlinearKeys()) {
            nonlinear.get(key).countKinds(all);
        }
        EnumMap<NodeKind, Integer> ops=new EnumMap<NodeKind, Integer>(NodeKind.class);
        for(Map.Entry<NodeKind, Integer> e : all.entrySet()) {
            if(e.getKey().isOperator()) {
                ops.put(e.getKey(), e.getValue());
            }
        }
        return ops;
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Evaluation at a point x (one value per variable)
    
    //  Linear plus quadratic plus nonlinear part of constraint key.
    public double constraintActivity(int key, double[] x) {
        checkKey(key);
        double total=0.0;
        for(LinearTerm t : linear.get(key)) {
            total+=t.coef*x[t.var];
        }
        for(QuadraticTerm t : quadratic.get(key)) {
            total+=t.coef*x[t.var1]*x[t.var2];
        }
        NLNode root=nonlinear.get(key);
        if(root!=null) {
            total+=root.evaluate(x);
        }
        return total;
    }
    
    public double objectiveValue(double[] x) {
        double total=(objective==null) ? 0.0 : objective.evaluate(x);
        return total+constraintActivity(OBJECTIVE, x);
    }
    
    public boolean isFeasible(double[] x, double tolerance) {
        if(x.length!=variables.size()) {
            throw new ValidationException("Point has "+x.length+" values, there are "+variables.size()+" variables.");
        }
        for(int i=0; i<variables.size(); i++) {
            Variable v=variables.get(i);
            if(!(x[i]>=v.getLowerBound()-tolerance && x[i]<=v.getUpperBound()+tolerance)) {
                return false;
            }
        }
        for(int i=0; i<constraints.size(); i++) {
            ConstraintInfo c=constraints.get(i);
            double act=constraintActivity(i, x);
            if(!(act>=c.getLower()-tolerance && act<=c.getUpper()+tolerance)) {
                return false;
            }
        }
        return true;
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Copy and printing
    
    public Instance copy() {
        Instance c=new Instance();
        c.name=name;
        c.variables.addAll(variables);
        c.objective=(objective==null) ? null : objective.copy();
        c.constraints.addAll(constraints);
        for(int key : linear.keys()) {
            c.linear.put(key, new ArrayList<LinearTerm>(linear.get(key)));
        }
        for(int key : quadratic.keys()) {
            c.quadratic.put(key, new ArrayList<QuadraticTerm>(quadratic.get(key)));
        }
        for(int key : nonlinear.keys()) {
            c.nonlinear.put(key, nonlinear.get(key).copy());
        }
        c.complete=complete;
        c.operatorCounts=new EnumMap<NodeKind, Integer>(operatorCounts);
        return c;
    }
    
    private void appendParts(StringBuilder b, int key) {
        for(LinearTerm t : linear.get(key)) {
            b.append(" + ").append(t);
        }
        for(QuadraticTerm t : quadratic.get(key)) {
            b.append(" + ").append(t);
        }
        if(nonlinear.containsKey(key)) {
            b.append(" + ").append(nonlinear.get(key));
        }
    }
    
    public String toString() {
        StringBuilder b=new StringBuilder();
        b.append("instance ").append(name).append("\n");
        b.append("variables:\n");
        for(int i=0; i<variables.size(); i++) {
            b.append("  x[").append(i).append("] ").append(variables.get(i)).append("\n");
        }
        b.append("objective:\n  ");
        if(objective!=null) {
            b.append(objective);
        }
        appendParts(b, OBJECTIVE);
        b.append("\n");
        b.append("constraints:\n");
        for(int i=0; i<constraints.size(); i++) {
            ConstraintInfo c=constraints.get(i);
            b.append("  ").append(c.getName()).append(": ").append(c.getLower()).append(" <= 0");
            appendParts(b, i);
            b.append(" <= ").append(c.getUpper()).append("\n");
        }
        return b.toString();
    }
}
