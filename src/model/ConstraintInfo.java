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

//  Name and bounds of a constraint. lower==upper is an equality.

public final class ConstraintInfo {
    private final String name;
    private final double lower;
    private final double upper;
    
    public ConstraintInfo(String _name, double _lower, double _upper) {
        if(_name==null) {
            throw new ValidationException("Constraint must have a name.");
        }
        if(Double.isNaN(_lower) || Double.isNaN(_upper) || _lower==Double.POSITIVE_INFINITY || _upper==Double.NEGATIVE_INFINITY) {
            throw new ValidationException("Bad bounds ["+_lower+", "+_upper+"] for constraint "+_name+".");
        }
        if(_lower==Double.NEGATIVE_INFINITY && _upper==Double.POSITIVE_INFINITY) {
            throw new ValidationException("Constraint "+_name+" has neither a lower nor an upper bound.");
        }
        name=_name;
        lower=_lower;
        upper=_upper;
    }
    
    public static ConstraintInfo equality(String name, double rhs) {
        return new ConstraintInfo(name, rhs, rhs);
    }
    
    public String getName() {
        return name;
    }
    public double getLower() {
        return lower;
    }
    public double getUpper() {
        return upper;
    }
    public boolean isEquality() {
        return lower==upper;
    }
    
    public String toString() {
        return name+" in "+new Interval(lower, upper);
    }
}
