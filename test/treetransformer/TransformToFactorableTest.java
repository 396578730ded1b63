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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class TransformToFactorableTest {
    
    @AfterEach
    void resetFlags() {
        CmdFlags.reset();
    }
    
    //  Instance with the given variable bounds and one constraint c0 in [lo, hi]
    //  whose nonlinear part is root.
    private static Instance instance(double[][] bounds, double lo, double hi, NLNode root) {
        Instance inst=new Instance();
        for(int i=0; i<bounds.length; i++) {
            inst.addVariable(new Variable("v"+i, bounds[i][0], bounds[i][1], VarType.CONTINUOUS));
        }
        inst.setObjective(new Objective("obj", Objective.Sense.MIN, 0.0));
        int c=inst.addConstraint(new ConstraintInfo("c0", lo, hi));
        if(root!=null) {
            inst.setNonlinear(c, root);
        }
        inst.computeBounds();
        inst.markComplete();
        return inst;
    }
    
    @Test
    @DisplayName("x + sqr(y + 3): the square and then its sum argument are substituted")
    void testNestedSum() {
        NLNode inner=new Sum(2, Arrays.asList(new Summand(3, 1, 1.0), Summand.constant(3, 3.0)));
        NLNode root=new Sum(0, Arrays.asList(new Summand(1, 0, 1.0), new Square(1, inner)));
        Instance before=instance(new double[][]{{0, 1}, {0, 2}}, 0.0, 30.0, root);
        
        TransformToFactorable t=new TransformToFactorable(before);
        assertThat(t.transform()).isEqualTo(2);
        Instance after=t.getInstance();
        
        assertThat(after.numVariables()).isEqualTo(4);
        assertThat(after.getVariable(2).getName()).isEqualTo("aux1");
        assertThat(after.getVariable(2).getBounds()).isEqualTo(new Interval(9.0, 25.0));
        assertThat(after.getVariable(3).getName()).isEqualTo("aux2");
        assertThat(after.getVariable(3).getBounds()).isEqualTo(new Interval(3.0, 5.0));
        
        assertThat(after.getNonlinear(0).toString()).isEqualTo("(x[0] + x[2])");
        
        assertThat(after.numConstraints()).isEqualTo(3);
        ConstraintInfo e2=after.getConstraint(1);
        assertThat(e2.getName()).isEqualTo("e2");
        assertThat(e2.isEquality()).isTrue();
        assertThat(e2.getLower()).isEqualTo(0.0);
        assertThat(after.getLinearTerms(1)).containsExactly(new LinearTerm(2, -1.0));
        assertThat(after.getQuadraticTerms(1)).isEmpty();
        assertThat(after.getNonlinear(1).toString()).isEqualTo("sqr(x[3])");
        assertThat(after.getNonlinear(1).getLevel()).isEqualTo(0);
        
        assertThat(after.getConstraint(2).getName()).isEqualTo("e3");
        assertThat(after.getLinearTerms(2)).containsExactly(new LinearTerm(3, -1.0));
        assertThat(after.getNonlinear(2).toString()).isEqualTo("(x[1] + 3.0)");
        assertThat(after.getNonlinear(2).getLevel()).isEqualTo(0);
        
        assertThat(AuditFactorable.violations(after)).isEmpty();
    }
    
    @Test
    @DisplayName("x*y*z: the last two factors become one new variable")
    void testProductSplit() {
        NLNode root=new Product(0, Arrays.asList(new Factor(1, 0, 1.0), new Factor(1, 1, 1.0), new Factor(1, 2, 1.0)));
        Instance before=instance(new double[][]{{1, 2}, {1, 2}, {-1, 2}}, -10.0, 10.0, root);
        
        TransformToFactorable t=new TransformToFactorable(before);
        assertThat(t.transform()).isEqualTo(1);
        Instance after=t.getInstance();
        
        assertThat(after.getNonlinear(0).toString()).isEqualTo("(x[0] * x[3])");
        assertThat(after.getNonlinear(1).toString()).isEqualTo("(x[1] * x[2])");
        assertThat(after.getVariable(3).getBounds()).isEqualTo(new Interval(-2.0, 4.0));
        assertThat(after.getLinearTerms(1)).containsExactly(new LinearTerm(3, -1.0));
        assertThat(AuditFactorable.isFactorable(after)).isTrue();
    }
    
    @Test
    @DisplayName("Five factors are reduced pairwise from the end")
    void testLongProduct() {
        ArrayList<NLNode> factors=new ArrayList<NLNode>();
        for(int i=0; i<5; i++) {
            factors.add(new Factor(1, i, 1.0));
        }
        Instance before=instance(new double[][]{{1, 2}, {1, 2}, {1, 2}, {1, 2}, {1, 2}}, 0.0, 100.0, new Product(0, factors));
        
        TransformToFactorable t=new TransformToFactorable(before);
        assertThat(t.transform()).isEqualTo(3);
        Instance after=t.getInstance();
        
        assertThat(after.getNonlinear(0).toString()).isEqualTo("(x[0] * x[7])");
        assertThat(after.getNonlinear(1).toString()).isEqualTo("(x[3] * x[4])");
        assertThat(after.getNonlinear(2).toString()).isEqualTo("(x[2] * x[5])");
        assertThat(after.getNonlinear(3).toString()).isEqualTo("(x[1] * x[6])");
        assertThat(after.getVariable(7).getBounds()).isEqualTo(new Interval(1.0, 16.0));
        assertThat(AuditFactorable.isFactorable(after)).isTrue();
    }
    
    @Test
    @DisplayName("(x + 2y)/y: numerator substituted, then the quotient becomes z with z*y == num")
    void testDivideByVariable() {
        NLNode num=new Sum(1, Arrays.asList(new Summand(2, 0, 1.0), new Summand(2, 1, 2.0)));
        NLNode root=new Divide(0, num, 1.0, new Identifier(1, 1), 1.0);
        Instance before=instance(new double[][]{{0, 1}, {1, 2}}, 0.0, 10.0, root);
        
        TransformToFactorable t=new TransformToFactorable(before);
        assertThat(t.transform()).isEqualTo(2);
        Instance after=t.getInstance();
        
        //  aux1 == x + 2y, aux2 == aux1 / y
        assertThat(after.getVariable(2).getBounds()).isEqualTo(new Interval(2.0, 5.0));
        assertThat(after.getVariable(3).getBounds()).isEqualTo(new Interval(1.0, 5.0));
        
        assertThat(after.hasNonlinear(0)).isFalse();
        assertThat(after.getLinearTerms(0)).containsExactly(new LinearTerm(3, 1.0));
        
        assertThat(after.getNonlinear(1).toString()).isEqualTo("(x[0] + 2.0*x[1])");
        assertThat(after.getLinearTerms(1)).containsExactly(new LinearTerm(2, -1.0));
        
        ConstraintInfo e3=after.getConstraint(2);
        assertThat(e3.getName()).isEqualTo("e3");
        assertThat(e3.getLower()).isEqualTo(0.0);
        assertThat(e3.getUpper()).isEqualTo(0.0);
        assertThat(after.getLinearTerms(2)).containsExactly(new LinearTerm(2, -1.0));
        assertThat(after.getQuadraticTerms(2)).containsExactly(new QuadraticTerm(3, 1, 1.0));
        assertThat(after.hasNonlinear(2)).isFalse();
        
        assertThat(AuditFactorable.isFactorable(after)).isTrue();
    }
    
    @Test
    @DisplayName("5/(2y): the fraction constraint carries the constant as its bounds")
    void testConstantNumerator() {
        NLNode root=new Divide(0, new NumberConstant(1, 5.0), 1.0, new Identifier(1, 0), 2.0);
        Instance before=instance(new double[][]{{1, 2}}, 0.0, 10.0, root);
        
        TransformToFactorable t=new TransformToFactorable(before);
        assertThat(t.transform()).isEqualTo(1);
        Instance after=t.getInstance();
        
        assertThat(after.getVariable(1).getBounds()).isEqualTo(new Interval(1.25, 2.5));
        assertThat(after.getLinearTerms(0)).containsExactly(new LinearTerm(1, 1.0));
        ConstraintInfo e2=after.getConstraint(1);
        assertThat(e2.getLower()).isEqualTo(5.0);
        assertThat(e2.getUpper()).isEqualTo(5.0);
        assertThat(after.getLinearTerms(1)).isEmpty();
        assertThat(after.getQuadraticTerms(1)).containsExactly(new QuadraticTerm(1, 0, 2.0));
    }
    
    @Test
    void testScaledConstantNumerator() {
        NLNode root=new Divide(0, new NumberConstant(1, 5.0), 3.0, new Identifier(1, 0), 1.0);
        Instance before=instance(new double[][]{{1, 2}}, 0.0, 10.0, root);
        assertThatThrownBy(() -> new TransformToFactorable(before).transform())
            .isInstanceOf(ReformulationException.class)
            .hasMessageContaining("Constant numerator");
    }
    
    @Test
    @DisplayName("A division in the objective moves its quotient into the objective's linear part")
    void testObjectiveDivide() {
        Instance before=instance(new double[][]{{0, 1}, {1, 2}}, 0.0, 1.0, new Exp(0, new Identifier(1, 0)));
        Instance withobj=before.copy();
        withobj.setNonlinear(Instance.OBJECTIVE, new Divide(0, new Identifier(1, 0), new Identifier(1, 1)));
        withobj.computeBounds();
        
        TransformToFactorable t=new TransformToFactorable(withobj);
        assertThat(t.transform()).isEqualTo(1);
        Instance after=t.getInstance();
        
        assertThat(after.hasNonlinear(Instance.OBJECTIVE)).isFalse();
        assertThat(after.getLinearTerms(Instance.OBJECTIVE)).containsExactly(new LinearTerm(2, 1.0));
        assertThat(after.getLinearTerms(1)).containsExactly(new LinearTerm(0, -1.0));
        assertThat(after.getQuadraticTerms(1)).containsExactly(new QuadraticTerm(2, 1, 1.0));
        //  the already factorable constraint is left alone
        assertThat(after.getNonlinear(0).toString()).isEqualTo("exp(x[0])");
    }
    
    @Test
    @DisplayName("Operators with atomic arguments and signpower are left as they are")
    void testAlreadyFactorable() {
        NLNode root=new Power(0, new Identifier(1, 0), 2.0, new Identifier(1, 1), 1.0);
        Instance before=instance(new double[][]{{1, 2}, {0, 3}}, 0.0, 100.0, root);
        assertThat(new TransformToFactorable(before).transform()).isEqualTo(0);
        
        Instance sp=instance(new double[][]{{-1, 2}}, -1.0, 1.0, new SignPower(0, new Identifier(1, 0), 3.0));
        TransformToFactorable t=new TransformToFactorable(sp);
        assertThat(t.transform()).isEqualTo(0);
        assertThat(t.getInstance().toString()).isEqualTo(sp.toString());
    }
    
    @Test
    @DisplayName("x + x^1.5 with x unbounded below: the new variable does not cut off feasible points")
    void testFractionalPowerOfFreeVariable() {
        NLNode pw=new Power(1, new Identifier(2, 0), new NumberConstant(2, 1.5));
        NLNode root=new Sum(0, Arrays.asList(new Summand(1, 0, 1.0), pw));
        Instance before=instance(new double[][]{{Double.NEGATIVE_INFINITY, 4}}, Double.NEGATIVE_INFINITY, 10.0, root);
        assertThat(before.isFeasible(new double[]{1.0}, 1e-9)).isTrue();
        
        TransformToFactorable t=new TransformToFactorable(before);
        assertThat(t.transform()).isEqualTo(1);
        Instance after=t.getInstance();
        
        assertThat(after.getVariable(1).getBounds().isUnbounded()).isTrue();
        assertThat(after.isFeasible(new double[]{1.0, 1.0}, 1e-9)).isTrue();
        assertThat(after.isFeasible(new double[]{2.0, Math.pow(2.0, 1.5)}, 1e-9)).isTrue();
    }
    
    @Test
    @DisplayName("Base and exponent of a power are substituted independently")
    void testPowerBothSides() {
        NLNode base=new Exp(1, new Identifier(2, 0));
        NLNode exponent=new Sum(1, Arrays.asList(new Summand(2, 1, 1.0), Summand.constant(2, 1.0)));
        Instance before=instance(new double[][]{{0, 1}, {0, 1}}, 0.0, 100.0, new Power(0, base, exponent));
        
        TransformToFactorable t=new TransformToFactorable(before);
        assertThat(t.transform()).isEqualTo(2);
        assertThat(t.getInstance().getNonlinear(0).toString()).isEqualTo("(x[2])^(x[3])");
        assertThat(t.getInstance().getNonlinear(1).toString()).isEqualTo("exp(x[0])");
    }
    
    @Test
    void testRunningTwiceAddsNothing() {
        NLNode inner=new Sum(2, Arrays.asList(new Summand(3, 1, 1.0), new Cosine(3, new Identifier(4, 0))));
        NLNode root=new Sum(0, Arrays.asList(new Summand(1, 0, 1.0), new Ln(1, inner, 2.0)));
        Instance before=instance(new double[][]{{0, 1}, {2, 3}}, 0.0, 10.0, root);
        
        TransformToFactorable t=new TransformToFactorable(before);
        int n=t.transform();
        assertThat(n).isEqualTo(3);
        assertThat(t.transform()).isEqualTo(n);
        assertThat(t.getNumNewVariables()).isEqualTo(n);
        
        TransformToFactorable again=new TransformToFactorable(t.getInstance());
        assertThat(again.transform()).isEqualTo(0);
        assertThat(again.getInstance().toString()).isEqualTo(t.getInstance().toString());
    }
    
    @Test
    @DisplayName("The input instance is not changed")
    void testOriginalUntouched() {
        NLNode root=new Product(0, Arrays.asList(new Factor(1, 0, 1.0), new Abs(1, new Identifier(2, 1)), new Factor(1, 1, 3.0)));
        Instance before=instance(new double[][]{{0, 1}, {-1, 1}}, -5.0, 5.0, root);
        String text=before.toString();
        
        TransformToFactorable t=new TransformToFactorable(before);
        int n=t.transform();
        assertThat(t.getOriginal()).isSameAs(before);
        assertThat(before.toString()).isEqualTo(text);
        assertThat(t.getInstance().numVariables()).isEqualTo(before.numVariables()+n);
        assertThat(t.getInstance().numConstraints()).isEqualTo(before.numConstraints()+n);
    }
    
    @Test
    @DisplayName("Auxiliary names skip names already used by the instance")
    void testAuxiliaryNamesAreFresh() {
        Instance inst=new Instance();
        inst.addVariable(new Variable("aux1", 0.0, 1.0, VarType.CONTINUOUS));
        inst.addVariable(new Variable("aux2", 0.0, 1.0, VarType.CONTINUOUS));
        int c=inst.addConstraint(new ConstraintInfo("c", 0.0, 5.0));
        inst.setNonlinear(c, new Exp(0, new Sum(1, Arrays.asList(new Summand(2, 0, 1.0), new Summand(2, 1, 1.0)))));
        inst.markComplete();
        
        TransformToFactorable t=new TransformToFactorable(inst);
        t.transform();
        assertThat(t.getInstance().getVariable(2).getName()).isEqualTo("aux3");
    }
    
    @Test
    void testIncompleteInstance() {
        Instance inst=new Instance();
        inst.addVariable(new Variable("x"));
        assertThatThrownBy(() -> new TransformToFactorable(inst)).isInstanceOf(ReformulationException.class);
    }
    
    @Test
    @DisplayName("A root that is a bare variable has no rewrite")
    void testUnsupportedRoot() {
        Instance before=instance(new double[][]{{0, 1}}, 0.0, 1.0, new Identifier(0, 0));
        assertThatThrownBy(() -> new TransformToFactorable(before).transform())
            .isInstanceOf(ReformulationException.class)
            .hasMessageContaining("c0");
    }
    
    @Test
    void testVerboseRun() {
        CmdFlags.setVerbose(true);
        NLNode root=new Sine(0, new Sum(1, Arrays.asList(new Summand(2, 0, 1.0), Summand.constant(2, 1.0))));
        Instance before=instance(new double[][]{{0, 1}}, -1.0, 1.0, root);
        assertThat(new TransformToFactorable(before).transform()).isEqualTo(1);
    }
    
    @Test
    @DisplayName("The audit reports every node that is not in factorable form")
    void testAudit() {
        NLNode root=new Sum(0, Arrays.asList(new Summand(1, 0, 1.0),
            new Product(1, Arrays.asList(new Factor(2, 0, 1.0), new Factor(2, 1, 1.0), new Factor(2, 0, 1.0)))));
        Instance inst=instance(new double[][]{{0, 1}, {0, 1}}, 0.0, 5.0, root);
        inst.setNonlinear(Instance.OBJECTIVE, new Divide(0, new Identifier(1, 0), new Identifier(1, 1)));
        
        List<String> bad=AuditFactorable.violations(inst);
        assertThat(bad).hasSize(2);
        assertThat(bad.get(0)).startsWith("objective: division");
        assertThat(bad.get(1)).startsWith("constraint 0: sum entity");
        assertThat(AuditFactorable.isFactorable(inst)).isFalse();
    }
}
