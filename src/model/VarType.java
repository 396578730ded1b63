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

public enum VarType {
    CONTINUOUS("C"), INTEGER("I"), BINARY("B");
    
    private final String code;
    
    VarType(String _code) {
        code=_code;
    }
    
    public String getCode() {
        return code;
    }
    
    //  Type for an OSiL type letter, or null.
    public static VarType fromCode(String c) {
        for(VarType t : values()) {
            if(t.code.equals(c)) {
                return t;
            }
        }
        return null;
    }
}
