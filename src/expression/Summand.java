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

public final class Summand extends Atom {
    public Summand(int _level, int _varIndex, double _coef) {
        super(_level, _varIndex, _coef);
    }
    
    public static Summand constant(int level, double value) {
        return new Summand(level, NO_VARIABLE, value);
    }
    
    public NodeKind getKind() {
        return NodeKind.SUMMAND;
    }
    
    public NLNode copy() {
        return new Summand(level, varIndex, coef);
    }
}
