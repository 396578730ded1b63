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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class InstanceTest {
    
    //  min 1 + x + y
    //  c0: 0 <= 2x + xy + exp(y) <= 10
    //  c1: x - y == 0
    static Instance sample() {
        Instance inst=new Instance();
        inst.setName("sample");
        inst.addVariable(new Variable("x", 0.0, 2.0, VarType.CONTINUOUS));
        inst.addVariable(new Variable("y", -1.0, 1.0, VarType.CONTINUOUS));
        Objective obj=new Objective("cost", Objective.Sense.MIN, 1.0);
        obj.setCoefficient(0, 1.0);
        obj.setCoefficient(1, 1.0);
        inst.setObjective(obj);
        int c0=inst.addConstraint(new ConstraintInfo("c0", 0.0, 10.0));
        int c1=inst.addConstraint(ConstraintInfo.equality("c1", 0.0));
        inst.addLinearTerm(c0, new LinearTerm(0, 2.0));
        inst.addQuadraticTerm(c0, new QuadraticTerm(0, 1, 1.0));
        inst.setNonlinear(c0, new Exp(0, new Identifier(1, 1)));
        inst.addLinearTerm(c1, new LinearTerm(0, 1.0));
        inst.addLinearTerm(c1, new LinearTerm(1, -1.0));
        inst.computeBounds();
        inst.markComplete();
        return inst;
    }
    
    @Test
    @DisplayName("New constraints start with empty linear and quadratic parts")
    void testAddConstraint() {
        Instance inst=new Instance();
        int c=inst.addConstraint(new ConstraintInfo("c", Double.NEGATIVE_INFINITY, 1.0));
        assertThat(c).isEqualTo(0);
        assertThat(inst.getLinearTerms(c)).isEmpty();
        assertThat(inst.getQuadraticTerms(c)).isEmpty();
        assertThat(inst.hasNonlinear(c)).isFalse();
        assertThat(inst.getLinearTerms(Instance.OBJECTIVE)).isEmpty();
    }
    
    @Test
    void testUnknownKeys() {
        Instance inst=sample();
        assertThatThrownBy(() -> inst.getLinearTerms(2)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> inst.addLinearTerm(-2, new LinearTerm(0, 1.0))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> inst.addLinearTerm(0, new LinearTerm(5, 1.0))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> inst.addQuadraticTerm(0, new QuadraticTerm(0, 2, 1.0))).isInstanceOf(ValidationException.class);
    }
    
    @Test
    void testSetNonlinearChecks() {
        Instance inst=sample();
        assertThatThrownBy(() -> inst.setNonlinear(1, new Exp(1, new Identifier(2, 0))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("level 0");
        assertThatThrownBy(() -> inst.setNonlinear(1, new Exp(0, new Identifier(1, 2))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("variable 2");
        inst.setNonlinear(Instance.OBJECTIVE, new Square(0, new Identifier(1, 0)));
        assertThat(inst.nonlinearKeys()).containsExactly(Instance.OBJECTIVE, 0);
    }
    
    @Test
    void testSecondObjective() {
        Instance inst=sample();
        assertThatThrownBy(() -> inst.setObjective(new Objective("other", Objective.Sense.MAX, 0.0)))
            .isInstanceOf(ValidationException.class);
    }
    
    @Test
    void testObjectiveCoefficients() {
        Objective obj=new Objective("o", Objective.Sense.fromString("max"), 0.0);
        obj.setCoefficient(3, 2.0);
        obj.setCoefficient(1, -1.0);
        assertThat(obj.getVariables()).containsExactly(1, 3);
        assertThatThrownBy(() -> obj.setCoefficient(3, 1.0)).isInstanceOf(ValidationException.class);
        assertThat(obj.getCoefficient(0)).isEqualTo(0.0);
        assertThat(Objective.Sense.fromString("sideways")).isNull();
    }
    
    @Test
    void testAuxiliaryVariable() {
        Instance inst=sample();
        int v=inst.newAuxiliaryVariable("aux1", new Interval(-1.0, Double.POSITIVE_INFINITY));
        assertThat(v).isEqualTo(2);
        assertThat(inst.getVariable(v).getType()).isEqualTo(VarType.CONTINUOUS);
        assertThat(inst.getVariable(v).getBounds()).isEqualTo(new Interval(-1.0, Double.POSITIVE_INFINITY));
        inst.setVariableBounds(v, 0.0, 3.0);
        assertThat(inst.getVariable(v).getUpperBound()).isEqualTo(3.0);
    }
    
    @Test
    @DisplayName("Activity sums the linear, quadratic and nonlinear parts")
    void testActivityAndObjective() {
        Instance inst=sample();
        double[] x={1.0, 0.0};
        assertThat(inst.constraintActivity(0, x)).isEqualTo(2.0+0.0+1.0);
        assertThat(inst.constraintActivity(1, x)).isEqualTo(1.0);
        assertThat(inst.objectiveValue(x)).isEqualTo(2.0);
    }
    
    @Test
    void testFeasibility() {
        Instance inst=sample();
        assertThat(inst.isFeasible(new double[]{0.5, 0.5}, 1e-9)).isTrue();
        //  violates c1
        assertThat(inst.isFeasible(new double[]{1.0, 0.0}, 1e-9)).isFalse();
        //  outside the bounds of x
        assertThat(inst.isFeasible(new double[]{-0.5, -0.5}, 1e-9)).isFalse();
        assertThatThrownBy(() -> inst.isFeasible(new double[]{0.0}, 1e-9)).isInstanceOf(ValidationException.class);
    }
    
    @Test
    @DisplayName("A copy shares nothing mutable with the original")
    void testDeepCopy() {
        Instance inst=sample();
        Instance c=inst.copy();
        assertThat(c.toString()).isEqualTo(inst.toString());
        assertThat(c.isComplete()).isTrue();
        
        c.addVariable(new Variable("z"));
        c.addLinearTerm(0, new LinearTerm(2, 1.0));
        c.addConstraint(ConstraintInfo.equality("c2", 1.0));
        ((Exp) c.getNonlinear(0)).setArgument(new Identifier(1, 0));
        c.getObjective().setCoefficient(2, 4.0);
        c.removeNonlinear(0);
        
        assertThat(inst.numVariables()).isEqualTo(2);
        assertThat(inst.numConstraints()).isEqualTo(2);
        assertThat(inst.getLinearTerms(0)).containsExactly(new LinearTerm(0, 2.0));
        assertThat(inst.getNonlinear(0).toString()).isEqualTo("exp(x[1])");
        assertThat(inst.getObjective().hasCoefficient(2)).isFalse();
    }
    
    @Test
    void testOperatorCounts() {
        Instance inst=new Instance();
        inst.addVariable(new Variable("x", 1.0, 2.0, VarType.CONTINUOUS));
        int c=inst.addConstraint(ConstraintInfo.equality("c", 0.0));
        inst.setNonlinear(c, new Sum(0, Arrays.asList(new Summand(1, 0, 1.0), new Ln(1, new Identifier(2, 0)))));
        inst.markComplete();
        
        assertThat(inst.getOperatorCount(NodeKind.SUM)).isEqualTo(1);
        assertThat(inst.getOperatorCount(NodeKind.LN)).isEqualTo(1);
        assertThat(inst.getOperatorCount(NodeKind.EXP)).isEqualTo(0);
        assertThat(inst.getOperatorCounts()).doesNotContainKeys(NodeKind.SUMMAND, NodeKind.VARIABLE);
        
        //  counts are taken at completion, later edits only show in countOperators
        inst.removeNonlinear(c);
        assertThat(inst.getOperatorCount(NodeKind.SUM)).isEqualTo(1);
        assertThat(inst.countOperators()).isEmpty();
    }
    
    @Test
    void testBadModelArguments() {
        assertThatThrownBy(() -> new Variable("v", Double.POSITIVE_INFINITY, 1.0, VarType.CONTINUOUS)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new ConstraintInfo("c", Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY))
            .isInstanceOf(ValidationException.class);
        assertThat(VarType.fromCode("B")).isEqualTo(VarType.BINARY);
        assertThat(VarType.fromCode("Q")).isNull();
    }
    
    @Test
    void testToString() {
        String s=sample().toString();
        assertThat(s).contains("instance sample");
        assertThat(s).contains("c1: 0.0 <= 0");
        assertThat(s).contains("exp(x[1])");
    }
}
