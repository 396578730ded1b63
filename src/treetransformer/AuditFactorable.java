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

//  Checks that an instance is in factorable form: sums hold only summands,
//  products at most two factors, every operator argument is a variable or a
//  constant, and no division is left.

public final class AuditFactorable {
    private AuditFactorable() {
    }
    
    public static boolean isFactorable(Instance inst) {
        return violations(inst).isEmpty();
    }
    
    //  One message per offending node.
    public static List<String> violations(Instance inst) {
        ArrayList<String> out=new ArrayList<String>();
        for(int key : inst.nonlinearKeys()) {
            if(key!=Instance.OBJECTIVE && (key<0 || key>=inst.numConstraints())) {
                out.add("Nonlinear part keyed by unknown constraint "+key);
                continue;
            }
            audit(key, inst.getNonlinear(key), out);
        }
        return out;
    }
    
    private static void audit(int key, NLNode root, List<String> out) {
        String where=(key==Instance.OBJECTIVE) ? "objective" : "constraint "+key;
        switch(root.getKind()) {
            case SUM:
                for(NLNode e : root.getChildren()) {
                    if(e.getKind()!=NodeKind.SUMMAND) {
                        out.add(where+": sum entity "+e+" is not atomic");
                    }
                }
                break;
            case PRODUCT:
                if(root.getChildren().size()>2) {
                    out.add(where+": product "+root+" has more than two factors");
                }
                for(NLNode f : root.getChildren()) {
                    if(f.getKind()!=NodeKind.FACTOR) {
                        out.add(where+": factor "+f+" is not atomic");
                    }
                }
                break;
            case DIVIDE:
                out.add(where+": division "+root+" remains");
                break;
            default:
                if(root.isLeaf()) {
                    out.add(where+": root "+root+" is a leaf");
                    break;
                }
                for(NLNode a : root.getChildren()) {
                    if(a.getKind()!=NodeKind.VARIABLE && a.getKind()!=NodeKind.NUMBER) {
                        out.add(where+": argument "+a+" of "+root.getKind()+" is not atomic");
                    }
                }
        }
    }
}
