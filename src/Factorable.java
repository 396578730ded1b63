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
import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

//  Reads an OSiL file, rewrites it into factorable form and prints the result.

public final class Factorable {
    private Factorable() {
    }
    
    public static void main(String[] args) {
        CmdFlags.parseArguments(args);
        
        Instance inst=read(CmdFlags.getOsilFile());
        if(CmdFlags.getStats()) {
            CmdFlags.println(statistics("Input", inst));
        }
        
        if(CmdFlags.getReformulate()) {
            TransformToFactorable t=new TransformToFactorable(inst);
            t.transform();
            List<String> bad=AuditFactorable.violations(t.getInstance());
            if(!bad.isEmpty()) {
                CmdFlags.errorExit("Reformulated instance is not factorable:", bad.get(0));
            }
            CmdFlags.printlnIfVerbose("Added "+t.getNumNewVariables()+" auxiliary variables.");
            inst=t.getInstance();
            if(CmdFlags.getStats()) {
                CmdFlags.println(statistics("Factorable", inst));
            }
        }
        
        write(inst, CmdFlags.getOutInstanceFile());
    }
    
    private static Instance read(String file) {
        try {
            return OsilParser.parse(Paths.get(file));
        }
        catch(FormatException e) {
            CmdFlags.errorExit("Failed to read OSiL file "+file+":", e.getMessage());
        }
        catch(IOException e) {
            CmdFlags.errorExit("Could not read file "+file+": "+e.getMessage());
        }
        return null;
    }
    
    private static void write(Instance inst, String file) {
        if(file==null) {
            CmdFlags.println(inst);
            return;
        }
        try {
            Files.write(Paths.get(file), inst.toString().getBytes(StandardCharsets.UTF_8));
        }
        catch(IOException e) {
            CmdFlags.errorExit("Could not write file "+file+": "+e.getMessage());
        }
    }
    
    static String statistics(String label, Instance inst) {
        StringBuilder b=new StringBuilder();
        b.append(label).append(" instance ").append(inst.getName()).append(":\n");
        b.append("  variables: ").append(inst.numVariables()).append("\n");
        b.append("  constraints: ").append(inst.numConstraints()).append("\n");
        b.append("  nonlinear parts: ").append(inst.nonlinearKeys().length).append("\n");
        for(Map.Entry<NodeKind, Integer> e : inst.countOperators().entrySet()) {
            b.append("  ").append(e.getKey().getTag()).append(": ").append(e.getValue()).append("\n");
        }
        return b.toString();
    }
}
