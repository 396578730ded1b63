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

//  Decision variable. An infinite bound means unbounded on that side.

public final class Variable {
    private final String name;
    private final double lb;
    private final double ub;
    private final VarType type;
    
    public Variable(String _name, double _lb, double _ub, VarType _type) {
        if(_name==null) {
            throw new ValidationException("Variable must have a name.");
        }
        if(Double.isNaN(_lb) || Double.isNaN(_ub) || _lb==Double.POSITIVE_INFINITY || _ub==Double.NEGATIVE_INFINITY) {
            throw new ValidationException("Bad bounds ["+_lb+", "+_ub+"] for variable "+_name+".");
        }
        name=_name;
        lb=_lb;
        ub=_ub;
        type=(_type==null) ? VarType.CONTINUOUS : _type;
    }
    
    //  OSiL default: lower bound 0, no upper bound, continuous.
    public Variable(String _name) {
        this(_name, 0.0, Double.POSITIVE_INFINITY, VarType.CONTINUOUS);
    }
    
    public String getName() {
        return name;
    }
    public double getLowerBound() {
        return lb;
    }
    public double getUpperBound() {
        return ub;
    }
    public VarType getType() {
        return type;
    }
    public Interval getBounds() {
        return new Interval(lb, ub);
    }
    
    public Variable withBounds(double l, double u) {
        return new Variable(name, l, u, type);
    }
    
    public String toString() {
        return name+" "+type.getCode()+" "+getBounds();
    }
}
