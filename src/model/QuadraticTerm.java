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

public final class QuadraticTerm {
    public final int var1;
    public final int var2;
    public final double coef;
    
    public QuadraticTerm(int _var1, int _var2, double _coef) {
        if(_var1<0 || _var2<0) {
            throw new ValidationException("Negative variable index in quadratic term.");
        }
        var1=_var1;
        var2=_var2;
        coef=_coef;
    }
    
    @Override
    public boolean equals(Object other) {
        if(!(other instanceof QuadraticTerm)) {
            return false;
        }
        QuadraticTerm o=(QuadraticTerm) other;
        return o.var1==var1 && o.var2==var2 && Double.compare(o.coef, coef)==0;
    }
    
    @Override
    public int hashCode() {
        return (var1*31+var2)*31+Double.hashCode(coef);
    }
    
    public String toString() {
        return coef+"*x["+var1+"]*x["+var2+"]";
    }
}
