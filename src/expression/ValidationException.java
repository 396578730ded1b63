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

//  Thrown when a node or model entity is constructed with arguments that
//  break its structural rules (bad index, non-finite coefficient, wrong
//  argument kind, inconsistent level).

public class ValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;
    
    public ValidationException(String msg) {
        super(msg);
    }
}
