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

//  Command-line switches and the message helpers used everywhere else.

public final class CmdFlags {
    private static boolean verbose = false;
    
    private static String osilfile = null;
    private static String outinstancefile = null;
    private static boolean reformulate = true;
    private static boolean stats = false;
    
    private CmdFlags() {
    }
    
    public static boolean getVerbose() {
        return verbose;
    }
    public static void setVerbose(boolean v) {
        verbose=v;
    }
    public static String getOsilFile() {
        return osilfile;
    }
    public static String getOutInstanceFile() {
        return outinstancefile;
    }
    public static boolean getReformulate() {
        return reformulate;
    }
    public static boolean getStats() {
        return stats;
    }
    
    //  Back to defaults, for running more than once in one JVM.
    public static void reset() {
        verbose=false;
        osilfile=null;
        outinstancefile=null;
        reformulate=true;
        stats=false;
    }
    
    public static void println(Object o) {
        System.out.println(o);
    }
    
    public static void printlnIfVerbose(Object o) {
        if (verbose) {
            System.out.println(o);
        }
    }
    
    public static void warning(String warn) {
        System.err.println("WARNING: "+warn);
    }
    
    //  Print error message to stderr and bail out. 
    public static void errorExit(String errmsg) {
        System.err.println("ERROR: "+errmsg);
        CmdFlags.exit();
    }
    public static void errorExit(String errmsg1, String errmsg2) {
        System.err.println("ERROR: "+errmsg1);
        System.err.println("ERROR: "+errmsg2);
        CmdFlags.exit();
    }
    
    public static void cmdLineExit(String errmsg) {
        System.err.println("ERROR: "+errmsg);
        System.err.println("For command line help, use the -help flag.");
        CmdFlags.exit();
    }
    
    public static void exit() {
        System.exit(1);
    }
    
    public static void parseArguments(String[] args) {
        ArrayList<String> arglist=new ArrayList<String>(Arrays.asList(args));
        
        // Parse arguments left-to-right. 
        while(arglist.size()>0) {
            String cur=arglist.remove(0);
            
            if(cur.equals("-help")) {
                printHelp();
                System.exit(0);
            }
            // verbose mode. 
            else if(cur.equals("-v")) {
                CmdFlags.setVerbose(true);
            }
            else if(cur.equals("-in-osil")) {
                if(arglist.size()==0) CmdFlags.cmdLineExit("OSiL file name missing after -in-osil");
                if(osilfile!=null) CmdFlags.cmdLineExit("More than one OSiL file specified on command line.");
                osilfile=arglist.remove(0);
            }
            else if(cur.equals("-out-instance")) {
                if(arglist.size()==0) CmdFlags.cmdLineExit("Output file name missing after -out-instance");
                outinstancefile=arglist.remove(0);
            }
            else if(cur.equals("-no-reformulate")) {
                reformulate=false;
            }
            else if(cur.equals("-stats")) {
                stats=true;
            }
            else {
                CmdFlags.cmdLineExit("Failed to parse command-line argument: "+cur);
            }
        }
        
        if(osilfile==null) {
            CmdFlags.cmdLineExit("No input file: use -in-osil to give the OSiL file to read.");
        }
    }
    
    public static void printHelp() {
        System.out.println("Factorable: rewrites the nonlinear constraints of an OSiL instance into factorable form.");
        System.out.println();
        System.out.println("Usage: java -jar factorable.jar -in-osil <file> [options]");
        System.out.println();
        System.out.println("  -in-osil <file>        OSiL instance to read (required).");
        System.out.println("  -out-instance <file>   Write the resulting instance to <file> instead of standard out.");
        System.out.println("  -no-reformulate        Only read and check the instance.");
        System.out.println("  -stats                 Print counts of variables, constraints and operators.");
        System.out.println("  -v                     Verbose: report every substitution.");
        System.out.println("  -help                  Print this message.");
    }
}
