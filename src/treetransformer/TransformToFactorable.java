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

import gnu.trove.list.array.*;

//  Rewrites every nonlinear part of an instance into factorable form. Each
//  composite argument of an operator is replaced by a new auxiliary variable
//  and a new constraint aux == argument, products are reduced to two factors
//  and divisions are turned into bilinear equalities.
//
//  The input instance is copied, never changed. The new constraints go on the
//  end of a FIFO worklist so their own nonlinear parts get rewritten too.

public final class TransformToFactorable {
    private final Instance original;
    private final Instance inst;
    
    private final TIntArrayList worklist=new TIntArrayList();
    private final HashSet<String> varnames=new HashSet<String>();
    
    private int numNewVariables=0;
    private int auxvarcounter=1;
    private boolean done=false;
    
    public TransformToFactorable(Instance _original) {
        if(_original==null || !_original.isComplete()) {
            throw new ReformulationException("Cannot reformulate an instance that has not been completely read.");
        }
        original=_original;
        inst=_original.copy();
        for(Variable v : inst.getVariables()) {
            varnames.add(v.getName());
        }
    }
    
    //  Run the reformulation, returns the number of new variables.
    public int transform() {
        if(done) {
            return numNewVariables;
        }
        worklist.addAll(inst.nonlinearKeys());
        for(int pos=0; pos<worklist.size(); pos++) {
            int key=worklist.get(pos);
            NLNode root=inst.getNonlinear(key);
            if(root!=null) {
                processNode(key, root);
            }
        }
        inst.computeBounds();
        done=true;
        CmdFlags.printlnIfVerbose("Factorable reformulation added "+numNewVariables+" variables, instance now has "
            +inst.numVariables()+" variables and "+inst.numConstraints()+" constraints.");
        return numNewVariables;
    }
    
    public Instance getInstance() {
        return inst;
    }
    public Instance getOriginal() {
        return original;
    }
    public int getNumNewVariables() {
        return numNewVariables;
    }
    
    private void processNode(int key, NLNode curnode) {
        switch(curnode.getKind()) {
            case SUM: {
                Sum s=(Sum) curnode;
                for(int i=0; i<s.numEntities(); i++) {
                    NLNode e=s.getEntity(i);
                    if(e.getKind()!=NodeKind.SUMMAND) {
                        int lev=e.getLevel();
                        s.setEntity(i, new Summand(lev, substitute(e), 1.0));
                    }
                }
                break;
            }
            case PRODUCT: {
                Product p=(Product) curnode;
                for(int i=0; i<p.numFactors(); i++) {
                    NLNode f=p.getFactor(i);
                    if(f.getKind()!=NodeKind.FACTOR) {
                        int lev=f.getLevel();
                        p.setFactor(i, new Factor(lev, substitute(f), 1.0));
                    }
                }
                //  Split off the last two factors until the product is bilinear.
                while(p.numFactors()>2) {
                    NLNode f2=p.removeLastFactor();
                    NLNode f1=p.removeLastFactor();
                    Product pair=new Product(p.getLevel(), Arrays.asList(f1, f2));
                    p.addFactor(new Factor(p.getLevel()+1, substitute(pair), 1.0));
                }
                break;
            }
            case SQUARE:
            case COSINE:
            case SINE:
            case NEGATE:
            case SQUAREROOT:
            case EXP:
            case ABS:
            case LN:
            case LOG10: {
                UnaryOp op=(UnaryOp) curnode;
                if(!op.getArgument().isLeaf()) {
                    op.setArgument(new Identifier(op.getLevel()+1, substitute(op.getArgument())));
                }
                break;
            }
            case POWER: {
                Power pw=(Power) curnode;
                if(!pw.getBase().isLeaf()) {
                    pw.setBase(new Identifier(pw.getLevel()+1, substitute(pw.getBase())));
                }
                if(!pw.getExponent().isLeaf()) {
                    pw.setExponent(new Identifier(pw.getLevel()+1, substitute(pw.getExponent())));
                }
                break;
            }
            case DIVIDE: {
                Divide d=(Divide) curnode;
                if(!d.getNumerator().isLeaf()) {
                    d.setNumerator(new Identifier(d.getLevel()+1, substitute(d.getNumerator())));
                }
                if(!d.getDenominator().isLeaf()) {
                    d.setDenominator(new Identifier(d.getLevel()+1, substitute(d.getDenominator())));
                }
                fraction(key, d);
                break;
            }
            case SIGNPOWER:
                //  Variable base and constant exponent, nothing to do.
                break;
            default:
                throw new ReformulationException("No factorable rewrite for "+curnode.getKind()+" in "+constraintName(key)+".");
        }
    }
    
    //  New variable aux with the bounds of expr and new constraint aux == expr.
    //  The constraint is queued so that expr is rewritten in turn.
    private int substitute(NLNode expr) {
        Interval b=expr.computeBounds(inst.getVariables());
        expr.relevel(0);
        int aux=newAuxiliaryVariable(b);
        int con=inst.addConstraint(ConstraintInfo.equality(newConstraintName(), 0.0));
        inst.addLinearTerm(con, new LinearTerm(aux, -1.0));
        inst.setNonlinear(con, expr);
        worklist.add(con);
        CmdFlags.printlnIfVerbose("Substituted "+inst.getVariable(aux).getName()+" == "+expr);
        return aux;
    }
    
    //  Replace num/den in constraint key by a new variable z and add the
    //  constraint z*den == num.
    private void fraction(int key, Divide d) {
        if(!(d.getDenominator() instanceof Identifier)) {
            throw new ReformulationException("Denominator of "+d+" is not a variable.");
        }
        Interval b=d.computeBounds(inst.getVariables());
        int z=newAuxiliaryVariable(b);
        inst.addLinearTerm(key, new LinearTerm(z, 1.0));
        inst.removeNonlinear(key);
        
        int den=((Identifier) d.getDenominator()).getVariableIndex();
        int con;
        if(d.isNumeratorConstant()) {
            if(d.getNumeratorCoefficient()!=1.0) {
                throw new ReformulationException("Constant numerator with coefficient "+d.getNumeratorCoefficient()+" in "+d+" is not supported.");
            }
            double value=((NumberConstant) d.getNumerator()).getValue();
            con=inst.addConstraint(ConstraintInfo.equality(newConstraintName(), value));
        }
        else {
            con=inst.addConstraint(ConstraintInfo.equality(newConstraintName(), 0.0));
            int num=((Identifier) d.getNumerator()).getVariableIndex();
            inst.addLinearTerm(con, new LinearTerm(num, -d.getNumeratorCoefficient()));
        }
        inst.addQuadraticTerm(con, new QuadraticTerm(z, den, d.getDenominatorCoefficient()));
        CmdFlags.printlnIfVerbose("Replaced "+d+" in "+constraintName(key)+" by "+inst.getVariable(z).getName());
    }
    
    private int newAuxiliaryVariable(Interval b) {
        String auxname=newAuxId();
        varnames.add(auxname);
        numNewVariables++;
        return inst.newAuxiliaryVariable(auxname, b);
    }
    
    //  Find unused name for new auxiliary id.
    private String newAuxId() {
        String newname="aux"+auxvarcounter;
        while(varnames.contains(newname)) {
            auxvarcounter++;
            newname="aux"+auxvarcounter;
        }
        auxvarcounter++;
        return newname;
    }
    
    private String newConstraintName() {
        return "e"+(inst.numConstraints()+1);
    }
    
    private String constraintName(int key) {
        return key==Instance.OBJECTIVE ? "the objective" : "constraint "+inst.getConstraint(key).getName();
    }
}
