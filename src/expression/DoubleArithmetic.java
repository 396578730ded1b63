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

public final class DoubleArithmetic implements Arithmetic<Double> {
    public static final DoubleArithmetic INSTANCE = new DoubleArithmetic();
    
    private DoubleArithmetic() {
    }
    
    public Double constant(double value) {
        return value;
    }
    
    public Double add(Double a, Double b) {
        return a+b;
    }
    public Double multiply(Double a, Double b) {
        return a*b;
    }
    public Double divide(Double a, Double b) {
        return a/b;
    }
    public Double scale(double coef, Double a) {
        return coef*a;
    }
    public Double negate(Double a) {
        return -a;
    }
    
    public Double power(Double base, Double exponent) {
        return Math.pow(base, exponent);
    }
    public Double square(Double a) {
        return a*a;
    }
    public Double sqrt(Double a) {
        return Math.sqrt(a);
    }
    public Double exp(Double a) {
        return Math.exp(a);
    }
    public Double ln(Double a) {
        return Math.log(a);
    }
    public Double log10(Double a) {
        return Math.log10(a);
    }
    public Double cos(Double a) {
        return Math.cos(a);
    }
    public Double sin(Double a) {
        return Math.sin(a);
    }
    public Double abs(Double a) {
        return Math.abs(a);
    }
    public Double signPower(Double a, double exponent) {
        return a*Math.pow(Math.abs(a), exponent-1.0);
    }
}
