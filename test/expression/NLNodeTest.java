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

public class NLNodeTest {
    
    //  2*x0 + sqr(x1 + 3)
    private static Sum sample() {
        Sum inner=new Sum(2, Arrays.asList(new Summand(3, 1, 1.0), Summand.constant(3, 3.0)));
        return new Sum(0, Arrays.asList(new Summand(1, 0, 2.0), new Square(1, inner)));
    }
    
    @Test
    void testEvaluate() {
        assertThat(sample().evaluate(new double[]{1.5, -1.0})).isEqualTo(3.0+4.0);
    }
    
    @Test
    @DisplayName("Evaluation of every operator kind")
    void testEvaluateOperators() {
        double[] x={2.0, -3.0};
        Identifier a=new Identifier(1, 0);
        Identifier b=new Identifier(1, 1);
        assertThat(new Product(0, Arrays.asList(new Factor(1, 0, 1.0), new Factor(1, 1, 2.0))).evaluate(x)).isEqualTo(-12.0);
        assertThat(new Power(0, a, new NumberConstant(1, 3.0)).evaluate(x)).isEqualTo(8.0);
        assertThat(new Power(0, a, 2.0, new NumberConstant(1, 2.0), 1.0).evaluate(x)).isEqualTo(16.0);
        assertThat(new Divide(0, b, a).evaluate(x)).isEqualTo(-1.5);
        assertThat(new Divide(0, new NumberConstant(1, 5.0), 1.0, a, 2.0).evaluate(x)).isEqualTo(1.25);
        assertThat(new Negate(0, b).evaluate(x)).isEqualTo(3.0);
        assertThat(new Abs(0, b, 2.0).evaluate(x)).isEqualTo(6.0);
        assertThat(new Square(0, b).evaluate(x)).isEqualTo(9.0);
        assertThat(new SquareRoot(0, a, 2.0).evaluate(x)).isEqualTo(2.0);
        assertThat(new Exp(0, a).evaluate(x)).isCloseTo(Math.exp(2.0), within(1e-12));
        assertThat(new Ln(0, a).evaluate(x)).isCloseTo(Math.log(2.0), within(1e-12));
        assertThat(new Log10(0, a, 5.0).evaluate(x)).isCloseTo(1.0, within(1e-12));
        assertThat(new Cosine(0, a).evaluate(x)).isCloseTo(Math.cos(2.0), within(1e-12));
        assertThat(new Sine(0, a).evaluate(x)).isCloseTo(Math.sin(2.0), within(1e-12));
        assertThat(new SignPower(0, b, 2.0).evaluate(x)).isEqualTo(-9.0);
    }
    
    @Test
    @DisplayName("Evaluation over a symbolic arithmetic builds an expression")
    void testEvaluateSymbolic() {
        Arithmetic<String> text=new Arithmetic<String>() {
            public String constant(double v) { return String.valueOf(v); }
            public String add(String a, String b) { return "("+a+"+"+b+")"; }
            public String multiply(String a, String b) { return "("+a+"*"+b+")"; }
            public String divide(String a, String b) { return "("+a+"/"+b+")"; }
            public String scale(double c, String a) { return c+"*"+a; }
            public String negate(String a) { return "-"+a; }
            public String power(String a, String b) { return a+"^"+b; }
            public String square(String a) { return "sqr("+a+")"; }
            public String sqrt(String a) { return "sqrt("+a+")"; }
            public String exp(String a) { return "exp("+a+")"; }
            public String ln(String a) { return "ln("+a+")"; }
            public String log10(String a) { return "log10("+a+")"; }
            public String cos(String a) { return "cos("+a+")"; }
            public String sin(String a) { return "sin("+a+")"; }
            public String abs(String a) { return "abs("+a+")"; }
            public String signPower(String a, double p) { return "signpower("+a+","+p+")"; }
        };
        String s=sample().evaluate(text, i -> "v"+i);
        assertThat(s).isEqualTo("(2.0*v0+sqr((v1+3.0)))");
    }
    
    @Test
    @DisplayName("copy is deep: changing the copy leaves the original alone")
    void testCopy() {
        Sum s=sample();
        Sum c=(Sum) s.copy();
        c.setEntity(1, new Summand(1, 4, 1.0));
        assertThat(s.getEntity(1)).isInstanceOf(Square.class);
        assertThat(c.toString()).isNotEqualTo(s.toString());
        assertThat(s.copy().toString()).isEqualTo(s.toString());
    }
    
    @Test
    void testRelevel() {
        Sum s=sample();
        Square sq=(Square) s.getEntity(1);
        NLNode inner=sq.getArgument();
        inner.relevel(0);
        assertThat(inner.getLevel()).isEqualTo(0);
        assertThat(inner.getChildren().get(0).getLevel()).isEqualTo(1);
    }
    
    @Test
    void testToString() {
        assertThat(sample().toString()).isEqualTo("(2.0*x[0] + sqr((x[1] + 3.0)))");
        assertThat(new Divide(0, new NumberConstant(1, 5.0), new Identifier(1, 2)).toString()).isEqualTo("(5.0)/(x[2])");
    }
    
    @Test
    void testMaxVariableIndexAndCounts() {
        Sum s=sample();
        assertThat(s.maxVariableIndex()).isEqualTo(1);
        EnumMap<NodeKind, Integer> counts=new EnumMap<NodeKind, Integer>(NodeKind.class);
        s.countKinds(counts);
        assertThat(counts.get(NodeKind.SUM)).isEqualTo(2);
        assertThat(counts.get(NodeKind.SQUARE)).isEqualTo(1);
        assertThat(counts.get(NodeKind.SUMMAND)).isEqualTo(3);
    }
}
