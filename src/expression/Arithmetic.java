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

//  Operations needed to evaluate an expression tree over values of type T.
//  DoubleArithmetic evaluates numerically; a model builder can supply an
//  implementation over its own expression handles.

public interface Arithmetic<T> {
    T constant(double value);
    
    T add(T a, T b);
    T multiply(T a, T b);
    T divide(T a, T b);
    T scale(double coef, T a);
    T negate(T a);
    
    T power(T base, T exponent);
    T square(T a);
    T sqrt(T a);
    T exp(T a);
    T ln(T a);
    T log10(T a);
    T cos(T a);
    T sin(T a);
    T abs(T a);
    
    //  a*|a|^(exponent-1)
    T signPower(T a, double exponent);
}
