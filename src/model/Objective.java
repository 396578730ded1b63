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

//  Linear objective: constant + sum of coef*x. Nonlinear and quadratic parts
//  of the objective live in the instance maps under Instance.OBJECTIVE.

public final class Objective {
    public enum Sense {
        MIN, MAX;
        
        public static Sense fromString(String s) {
            if(s.equals("min")) {
                return MIN;
            }
            if(s.equals("max")) {
                return MAX;
            }
            return null;
        }
        
        public String toString() {
            return this==MIN ? "min" : "max";
        }
    }
    
    private final String name;
    private final Sense sense;
    private final double constant;
    private final TIntDoubleHashMap coefficients=new TIntDoubleHashMap();
    
    public Objective(String _name, Sense _sense, double _constant) {
        if(_sense==null) {
            throw new ValidationException("Objective must have a sense.");
        }
        name=(_name==null) ? "" : _name;
        sense=_sense;
        constant=_constant;
    }
    
    public String getName() {
        return name;
    }
    public Sense getSense() {
        return sense;
    }
    public double getConstant() {
        return constant;
    }
    
    public boolean hasCoefficient(int var) {
        return coefficients.containsKey(var);
    }
    public double getCoefficient(int var) {
        return coefficients.containsKey(var) ? coefficients.get(var) : 0.0;
    }
    public int numCoefficients() {
        return coefficients.size();
    }
    
    //  Variable indices with a coefficient, ascending.
    public int[] getVariables() {
        int[] keys=coefficients.keys();
        Arrays.sort(keys);
        return keys;
    }
    
    public void setCoefficient(int var, double coef) {
        if(var<0) {
            throw new ValidationException("Negative variable index "+var+" in objective.");
        }
        if(coefficients.containsKey(var)) {
            throw new ValidationException("Duplicate objective coefficient for variable "+var+".");
        }
        coefficients.put(var, coef);
    }
    
    public double evaluate(double[] x) {
        double total=constant;
        for(int v : getVariables()) {
            total+=coefficients.get(v)*x[v];
        }
        return total;
    }
    
    public Objective copy() {
        Objective o=new Objective(name, sense, constant);
        o.coefficients.putAll(coefficients);
        return o;
    }
    
    public String toString() {
        StringBuilder b=new StringBuilder();
        b.append(sense).append(" ").append(name).append(": ").append(constant);
        for(int v : getVariables()) {
            b.append(" + ").append(coefficients.get(v)).append("*x[").append(v).append("]");
        }
        return b.toString();
    }
}
