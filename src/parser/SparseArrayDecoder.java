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

import gnu.trove.list.array.*;

import org.w3c.dom.*;

//  Decodes the run-length encoded arrays of OSiL (start, rowIdx, colIdx,
//  value). Each <el> holds a value; mult repeats it and incr is added on
//  each repeat, so <el mult="3" incr="2">5</el> is 5 7 9.

public final class SparseArrayDecoder {
    private SparseArrayDecoder() {
    }
    
    public static int[] decodeInts(Node node) throws FormatException {
        TIntArrayList out=new TIntArrayList();
        for(Node el=node.getFirstChild(); el!=null; el=el.getNextSibling()) {
            if(!isEl(el, node)) {
                continue;
            }
            int start=parseInt(OsilParser.getText(el), el);
            int mult=parseInt(OsilParser.getAttribute(el, "mult", "1"), el);
            int incr=parseInt(OsilParser.getAttribute(el, "incr", "0"), el);
            checkMult(mult, el);
            for(int m=0; m<mult; m++) {
                out.add(start+incr*m);
            }
        }
        return out.toArray();
    }
    
    public static double[] decodeDoubles(Node node) throws FormatException {
        TDoubleArrayList out=new TDoubleArrayList();
        for(Node el=node.getFirstChild(); el!=null; el=el.getNextSibling()) {
            if(!isEl(el, node)) {
                continue;
            }
            double start=OsilParser.parseNumber(OsilParser.getText(el), "el");
            int mult=parseInt(OsilParser.getAttribute(el, "mult", "1"), el);
            double incr=OsilParser.parseNumber(OsilParser.getAttribute(el, "incr", "0"), "incr");
            checkMult(mult, el);
            for(int m=0; m<mult; m++) {
                out.add(start+incr*m);
            }
        }
        return out.toArray();
    }
    
    private static boolean isEl(Node el, Node parent) throws FormatException {
        if(el.getNodeType()!=Node.ELEMENT_NODE) {
            return false;
        }
        if(!OsilParser.tag(el).equals("el")) {
            throw new FormatException("Unexpected <"+OsilParser.tag(el)+"> in <"+OsilParser.tag(parent)+">, expected <el>.");
        }
        NamedNodeMap attrs=el.getAttributes();
        for(int i=0; i<attrs.getLength(); i++) {
            String a=attrs.item(i).getNodeName();
            if(!a.equals("mult") && !a.equals("incr")) {
                throw new FormatException("Unknown attribute "+a+" on <el> in <"+OsilParser.tag(parent)+">.");
            }
        }
        return true;
    }
    
    private static void checkMult(int mult, Node el) throws FormatException {
        if(mult<1) {
            throw new FormatException("mult must be at least 1, got "+mult+" in <"+OsilParser.tag(el.getParentNode())+">.");
        }
    }
    
    private static int parseInt(String s, Node el) throws FormatException {
        try {
            return Integer.parseInt(s.trim());
        }
        catch(NumberFormatException e) {
            throw new FormatException("Expected an integer in <"+OsilParser.tag(el.getParentNode())+">, got '"+s+"'.", e);
        }
    }
}
