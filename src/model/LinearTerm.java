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

public final class LinearTerm {
    public final int var;
    public final double coef;
    
    public LinearTerm(int _var, double _coef) {
        if(_var<0) {
            throw new ValidationException("Negative variable index "+_var+" in linear term.");
        }
        var=_var;
        coef=_coef;
    }
    
    @Override
    public boolean equals(Object other) {
        if(!(other instanceof LinearTerm)) {
            return false;
        }
        LinearTerm o=(LinearTerm) other;
        return o.var==var && Double.compare(o.coef, coef)==0;
    }
    
    @Override
    public int hashCode() {
        return var*31+Double.hashCode(coef);
    }
    
    public String toString() {
        return coef+"*x["+var+"]";
    }
}
