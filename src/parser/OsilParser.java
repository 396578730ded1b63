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
import java.nio.file.*;

import javax.xml.parsers.*;

import org.w3c.dom.*;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

//  Reads an OSiL document into an Instance. Structural surprises are fatal
//  (FormatException); unknown optional attributes only produce a warning.
//  Tags are matched by local name so any namespace prefix is accepted.

public final class OsilParser {
    private final Instance inst=new Instance();
    
    private OsilParser() {
    }
    
    public static Instance parse(Path file) throws FormatException, IOException {
        try(InputStream in=Files.newInputStream(file)) {
            return parse(in);
        }
    }
    
    public static Instance parse(InputStream in) throws FormatException, IOException {
        return parse(new InputSource(in));
    }
    
    public static Instance parseString(String xml) throws FormatException {
        try {
            return parse(new InputSource(new StringReader(xml)));
        }
        catch(IOException e) {
            //  Reading from a string does no I/O.
            throw new UncheckedIOException(e);
        }
    }
    
    private static Instance parse(InputSource source) throws FormatException, IOException {
        Document doc;
        try {
            DocumentBuilderFactory factory=DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setCoalescing(true);
            factory.setIgnoringComments(true);
            factory.setIgnoringElementContentWhitespace(true);
            DocumentBuilder builder=factory.newDocumentBuilder();
            doc=builder.parse(source);
        }
        catch(ParserConfigurationException e) {
            throw new IllegalStateException("No XML parser available.", e);
        }
        catch(SAXException e) {
            throw new FormatException("Not a well-formed XML document: "+e.getMessage(), e);
        }
        OsilParser p=new OsilParser();
        p.osil(doc.getDocumentElement());
        return p.inst;
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Document structure
    
    private void osil(Element root) throws FormatException {
        if(!tag(root).equals("osil")) {
            throw new FormatException("Root element must be <osil>, got <"+tag(root)+">.");
        }
        boolean data=false;
        for(Node child=root.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            switch(tag(child)) {
                case "instanceHeader":
                    instanceHeader(child);
                    break;
                case "instanceData":
                    if(data) {
                        throw new FormatException("More than one <instanceData> section.");
                    }
                    instanceData(child);
                    data=true;
                    break;
                default:
                    throw new FormatException("Unknown section <"+tag(child)+"> in <osil>.");
            }
        }
        if(!data) {
            throw new FormatException("Document has no <instanceData> section.");
        }
        try {
            inst.computeBounds();
        }
        catch(ValidationException e) {
            throw new FormatException(e.getMessage(), e);
        }
        inst.markComplete();
    }
    
    private void instanceHeader(Node node) {
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            if(tag(child).equals("name")) {
                inst.setName(getText(child).trim());
            }
            else {
                CmdFlags.warning("Ignoring unknown element <"+tag(child)+"> in <instanceHeader>.");
            }
        }
    }
    
    private static final List<String> sections=Arrays.asList("variables", "objectives", "constraints",
        "linearConstraintCoefficients", "quadraticCoefficients", "nonlinearExpressions");
    
    private void instanceData(Node node) throws FormatException {
        HashMap<String, Node> found=new HashMap<String, Node>();
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            String t=tag(child);
            if(!sections.contains(t)) {
                throw new FormatException("Unknown section <"+t+"> in <instanceData>.");
            }
            if(found.containsKey(t)) {
                throw new FormatException("Section <"+t+"> appears more than once.");
            }
            found.put(t, child);
        }
        
        //  Fixed order: constraints must exist before their coefficients are read.
        if(!found.containsKey("variables")) {
            throw new FormatException("Document has no <variables> section.");
        }
        variables(found.get("variables"));
        if(found.containsKey("objectives")) {
            objectives(found.get("objectives"));
        }
        else {
            CmdFlags.warning("No objective found in instance "+inst.getName()+".");
        }
        if(found.containsKey("constraints")) {
            constraints(found.get("constraints"));
        }
        if(found.containsKey("linearConstraintCoefficients")) {
            linearCoefficients(found.get("linearConstraintCoefficients"));
        }
        if(found.containsKey("quadraticCoefficients")) {
            quadraticCoefficients(found.get("quadraticCoefficients"));
        }
        if(found.containsKey("nonlinearExpressions")) {
            nonlinearExpressions(found.get("nonlinearExpressions"));
        }
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Sections
    
    private void variables(Node node) throws FormatException {
        int n=requireInt(node, "numberOfVariables");
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            expectTag(child, "var");
            warnUnknownAttributes(child, "name", "lb", "ub", "type");
            String name=getAttribute(child, "name", "x"+inst.numVariables());
            double lb=parseNumber(getAttribute(child, "lb", "0"), "lb");
            double ub=parseNumber(getAttribute(child, "ub", "INF"), "ub");
            VarType type=VarType.CONTINUOUS;
            if(hasAttribute(child, "type")) {
                type=VarType.fromCode(getAttribute(child, "type"));
                if(type==null) {
                    throw new FormatException("Unknown type '"+getAttribute(child, "type")+"' for variable "+name+".");
                }
            }
            try {
                inst.addVariable(new Variable(name, lb, ub, type));
            }
            catch(ValidationException e) {
                throw new FormatException(e.getMessage(), e);
            }
        }
        checkCount("numberOfVariables", n, inst.numVariables());
    }
    
    private void objectives(Node node) throws FormatException {
        int objs=0;
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            expectTag(child, "obj");
            objs++;
            if(objs>1) {
                throw new FormatException("More than one objective is not supported.");
            }
            objective(child);
        }
        if(hasAttribute(node, "numberOfObjectives")) {
            checkCount("numberOfObjectives", requireInt(node, "numberOfObjectives"), objs);
        }
        if(objs!=1) {
            throw new FormatException("Expected exactly one objective, found "+objs+".");
        }
    }
    
    private void objective(Node node) throws FormatException {
        warnUnknownAttributes(node, "name", "maxOrMin", "numberOfObjCoef", "constant", "weight");
        String sensestr=requireAttribute(node, "maxOrMin");
        Objective.Sense sense=Objective.Sense.fromString(sensestr);
        if(sense==null) {
            throw new FormatException("maxOrMin must be min or max, got '"+sensestr+"'.");
        }
        int n=requireInt(node, "numberOfObjCoef");
        double constant=parseNumber(getAttribute(node, "constant", "0"), "constant");
        Objective obj=new Objective(getAttribute(node, "name", ""), sense, constant);
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            expectTag(child, "coef");
            int idx=variableIndex(child, "idx");
            if(obj.hasCoefficient(idx)) {
                throw new FormatException("Duplicate objective coefficient for variable "+idx+".");
            }
            obj.setCoefficient(idx, parseNumber(getText(child), "coef"));
        }
        checkCount("numberOfObjCoef", n, obj.numCoefficients());
        inst.setObjective(obj);
    }
    
    private void constraints(Node node) throws FormatException {
        int n=requireInt(node, "numberOfConstraints");
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            expectTag(child, "con");
            warnUnknownAttributes(child, "name", "lb", "ub");
            String name=getAttribute(child, "name", "c"+inst.numConstraints());
            double lb=parseNumber(getAttribute(child, "lb", "-INF"), "lb");
            double ub=parseNumber(getAttribute(child, "ub", "INF"), "ub");
            try {
                inst.addConstraint(new ConstraintInfo(name, lb, ub));
            }
            catch(ValidationException e) {
                throw new FormatException(e.getMessage(), e);
            }
        }
        checkCount("numberOfConstraints", n, inst.numConstraints());
    }
    
    //  Compressed sparse storage: start[i]..start[i+1] delimits row i (colIdx)
    //  or column i (rowIdx) in the index and value arrays.
    private void linearCoefficients(Node node) throws FormatException {
        int n=requireInt(node, "numberOfValues");
        int[] start=null;
        int[] idx=null;
        boolean rowwise=false;
        double[] values=null;
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            switch(tag(child)) {
                case "start":
                    start=SparseArrayDecoder.decodeInts(child);
                    break;
                case "colIdx":
                case "rowIdx":
                    if(idx!=null) {
                        throw new FormatException("<linearConstraintCoefficients> has both <rowIdx> and <colIdx>.");
                    }
                    rowwise=tag(child).equals("colIdx");
                    idx=SparseArrayDecoder.decodeInts(child);
                    break;
                case "value":
                    values=SparseArrayDecoder.decodeDoubles(child);
                    break;
                default:
                    throw new FormatException("Unknown element <"+tag(child)+"> in <linearConstraintCoefficients>.");
            }
        }
        if(start==null || idx==null || values==null) {
            throw new FormatException("<linearConstraintCoefficients> needs <start>, <rowIdx> or <colIdx>, and <value>.");
        }
        if(idx.length!=values.length) {
            throw new FormatException("Linear coefficients have "+idx.length+" indices but "+values.length+" values.");
        }
        int outer=start.length-1;
        if(outer>(rowwise ? inst.numConstraints() : inst.numVariables())) {
            throw new FormatException("<start> has "+start.length+" entries, too many for the "+(rowwise ? "constraints." : "variables."));
        }
        int count=0;
        for(int i=0; i<outer; i++) {
            if(start[i]<0 || start[i]>start[i+1] || start[i+1]>values.length) {
                throw new FormatException("Bad <start> entry "+start[i]+" at position "+i+".");
            }
            for(int k=start[i]; k<start[i+1]; k++) {
                int row=rowwise ? i : idx[k];
                int col=rowwise ? idx[k] : i;
                if(row<0 || row>=inst.numConstraints()) {
                    throw new FormatException("Constraint index "+row+" out of range in linear coefficients.");
                }
                checkVariableIndex(col);
                inst.addLinearTerm(row, new LinearTerm(col, values[k]));
                count++;
            }
        }
        checkCount("numberOfValues", n, count);
    }
    
    private void quadraticCoefficients(Node node) throws FormatException {
        int n=requireInt(node, "numberOfQuadraticTerms");
        int count=0;
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            expectTag(child, "qTerm");
            warnUnknownAttributes(child, "idx", "idxOne", "idxTwo", "coef");
            int con=constraintIndex(child);
            int v1=variableIndex(child, "idxOne");
            int v2=variableIndex(child, "idxTwo");
            double coef=parseNumber(requireAttribute(child, "coef"), "coef");
            inst.addQuadraticTerm(con, new QuadraticTerm(v1, v2, coef));
            count++;
        }
        checkCount("numberOfQuadraticTerms", n, count);
    }
    
    private void nonlinearExpressions(Node node) throws FormatException {
        int n=requireInt(node, "numberOfNonlinearExpressions");
        int count=0;
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()!=Node.ELEMENT_NODE) {
                continue;
            }
            expectTag(child, "nl");
            warnUnknownAttributes(child, "idx");
            int con=constraintIndex(child);
            if(inst.hasNonlinear(con)) {
                throw new FormatException("Two nonlinear expressions for constraint "+con+".");
            }
            List<Element> args=elementChildren(child);
            if(args.size()!=1) {
                throw new FormatException("<nl idx=\""+con+"\"> must contain exactly one expression, found "+args.size()+".");
            }
            try {
                inst.setNonlinear(con, expression(args.get(0), 0));
            }
            catch(ValidationException e) {
                throw new FormatException("In nonlinear expression "+con+": "+e.getMessage(), e);
            }
            count++;
        }
        checkCount("numberOfNonlinearExpressions", n, count);
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Expression trees
    
    //  An operand together with the coefficient of the slot it sits in.
    private static final class Operand {
        final NLNode node;
        final double coef;
        Operand(NLNode _node, double _coef) {
            node=_node;
            coef=_coef;
        }
    }
    
    private NLNode expression(Element e, int level) throws FormatException {
        NodeKind kind=NodeKind.fromTag(tag(e));
        if(kind==null) {
            throw new FormatException("Unknown nonlinear operator <"+tag(e)+">.");
        }
        if(hasAttribute(e, "coef")) {
            throw new FormatException("A coefficient on operator <"+tag(e)+"> is not supported.");
        }
        warnUnknownAttributes(e);
        List<Element> args=elementChildren(e);
        switch(kind) {
            case SUM: {
                ArrayList<NLNode> entities=new ArrayList<NLNode>();
                for(Element a : args) {
                    Operand o=operand(a, level+1);
                    if(o.node instanceof Identifier) {
                        entities.add(new Summand(level+1, ((Identifier) o.node).getVariableIndex(), o.coef));
                    }
                    else if(o.node instanceof NumberConstant) {
                        entities.add(Summand.constant(level+1, ((NumberConstant) o.node).getValue()));
                    }
                    else {
                        entities.add(o.node);
                    }
                }
                return new Sum(level, entities);
            }
            case PRODUCT: {
                ArrayList<NLNode> factors=new ArrayList<NLNode>();
                for(Element a : args) {
                    Operand o=operand(a, level+1);
                    if(o.node instanceof Identifier) {
                        factors.add(new Factor(level+1, ((Identifier) o.node).getVariableIndex(), o.coef));
                    }
                    else if(o.node instanceof NumberConstant) {
                        factors.add(Factor.constant(level+1, ((NumberConstant) o.node).getValue()));
                    }
                    else {
                        factors.add(o.node);
                    }
                }
                return new Product(level, factors);
            }
            case POWER: {
                checkArity(e, args, 2);
                Operand b=operand(args.get(0), level+1);
                Operand x=operand(args.get(1), level+1);
                return new Power(level, b.node, b.coef, x.node, x.coef);
            }
            case DIVIDE: {
                checkArity(e, args, 2);
                Operand num=operand(args.get(0), level+1);
                Operand den=operand(args.get(1), level+1);
                return new Divide(level, num.node, num.coef, den.node, den.coef);
            }
            case SIGNPOWER: {
                checkArity(e, args, 2);
                if(!tag(args.get(0)).equals("variable") || !tag(args.get(1)).equals("number")) {
                    throw new FormatException("<signpower> needs a <variable> base and a <number> exponent.");
                }
                Operand b=operand(args.get(0), level+1);
                if(b.coef!=1.0) {
                    throw new FormatException("A coefficient on the base of <signpower> is not supported.");
                }
                Operand x=operand(args.get(1), level+1);
                return new SignPower(level, (Identifier) b.node, ((NumberConstant) x.node).getValue());
            }
            default: {
                checkArity(e, args, 1);
                Operand a=operand(args.get(0), level+1);
                return unary(kind, level, a.node, a.coef);
            }
        }
    }
    
    private static NLNode unary(NodeKind kind, int level, NLNode arg, double coef) {
        switch(kind) {
            case SQUARE:
                return new Square(level, arg, coef);
            case COSINE:
                return new Cosine(level, arg, coef);
            case SINE:
                return new Sine(level, arg, coef);
            case NEGATE:
                return new Negate(level, arg, coef);
            case SQUAREROOT:
                return new SquareRoot(level, arg, coef);
            case EXP:
                return new Exp(level, arg, coef);
            case ABS:
                return new Abs(level, arg, coef);
            case LN:
                return new Ln(level, arg, coef);
            case LOG10:
                return new Log10(level, arg, coef);
            default:
                throw new IllegalArgumentException("Not a unary operator: "+kind);
        }
    }
    
    //  A <variable>, a <number> or a nested operator at the given level.
    private Operand operand(Element e, int level) throws FormatException {
        switch(tag(e)) {
            case "variable": {
                warnUnknownAttributes(e, "idx", "coef");
                int idx=variableIndex(e, "idx");
                double coef=parseNumber(getAttribute(e, "coef", "1"), "coef");
                return new Operand(new Identifier(level, idx), coef);
            }
            case "number": {
                warnUnknownAttributes(e, "value", "type");
                double value=parseNumber(requireAttribute(e, "value"), "value");
                return new Operand(new NumberConstant(level, value), 1.0);
            }
            default:
                return new Operand(expression(e, level), 1.0);
        }
    }
    
    private static void checkArity(Element e, List<Element> args, int n) throws FormatException {
        if(args.size()!=n) {
            throw new FormatException("<"+tag(e)+"> takes "+n+" argument"+(n==1 ? "" : "s")+", found "+args.size()+".");
        }
    }
    
    ////////////////////////////////////////////////////////////////////////////
    //  Attribute and number helpers
    
    private int variableIndex(Node node, String attr) throws FormatException {
        int idx=parseInt(requireAttribute(node, attr), attr);
        checkVariableIndex(idx);
        return idx;
    }
    
    private void checkVariableIndex(int idx) throws FormatException {
        if(idx<0 || idx>=inst.numVariables()) {
            throw new FormatException("Variable index "+idx+" out of range, there are "+inst.numVariables()+" variables.");
        }
    }
    
    //  Constraint index or -1 for the objective.
    private int constraintIndex(Node node) throws FormatException {
        int idx=parseInt(requireAttribute(node, "idx"), "idx");
        if(idx!=Instance.OBJECTIVE && (idx<0 || idx>=inst.numConstraints())) {
            throw new FormatException("Constraint index "+idx+" out of range, there are "+inst.numConstraints()+" constraints.");
        }
        return idx;
    }
    
    private static void checkCount(String attr, int declared, int found) throws FormatException {
        if(declared!=found) {
            throw new FormatException(attr+" is "+declared+" but "+found+" entries were found.");
        }
    }
    
    private static void expectTag(Node node, String expected) throws FormatException {
        if(!tag(node).equals(expected)) {
            throw new FormatException("Unexpected element <"+tag(node)+">, expected <"+expected+">.");
        }
    }
    
    private static void warnUnknownAttributes(Node node, String... known) {
        NamedNodeMap attrs=node.getAttributes();
        List<String> k=Arrays.asList(known);
        for(int i=0; i<attrs.getLength(); i++) {
            Node a=attrs.item(i);
            String name=(a.getLocalName()==null) ? a.getNodeName() : a.getLocalName();
            if(a.getNodeName().startsWith("xmlns") || k.contains(name)) {
                continue;
            }
            CmdFlags.warning("Ignoring unknown attribute "+name+" on <"+tag(node)+">.");
        }
    }
    
    private static int requireInt(Node node, String attr) throws FormatException {
        return parseInt(requireAttribute(node, attr), attr);
    }
    
    private static String requireAttribute(Node node, String attr) throws FormatException {
        if(!hasAttribute(node, attr)) {
            throw new FormatException("Missing attribute "+attr+" on <"+tag(node)+">.");
        }
        return getAttribute(node, attr);
    }
    
    private static int parseInt(String s, String what) throws FormatException {
        try {
            return Integer.parseInt(s.trim());
        }
        catch(NumberFormatException e) {
            throw new FormatException("Expected an integer for "+what+", got '"+s+"'.", e);
        }
    }
    
    //  Accepts OSiL's INF and -INF as well as Java's Infinity.
    static double parseNumber(String s, String what) throws FormatException {
        String t=s.trim();
        if(t.equalsIgnoreCase("INF") || t.equalsIgnoreCase("+INF")) {
            return Double.POSITIVE_INFINITY;
        }
        if(t.equalsIgnoreCase("-INF")) {
            return Double.NEGATIVE_INFINITY;
        }
        double d;
        try {
            d=Double.parseDouble(t);
        }
        catch(NumberFormatException e) {
            throw new FormatException("Expected a number for "+what+", got '"+s+"'.", e);
        }
        if(Double.isNaN(d)) {
            throw new FormatException("NaN is not allowed for "+what+".");
        }
        return d;
    }
    
    static String tag(Node node) {
        String local=node.getLocalName();
        return (local==null) ? node.getNodeName() : local;
    }
    
    static boolean hasAttribute(Node node, String name) {
        return node.getAttributes().getNamedItem(name)!=null;
    }
    
    static String getAttribute(Node node, String name) {
        return getAttribute(node, name, "");
    }
    
    static String getAttribute(Node node, String name, String defaultValue) {
        Node attribute=node.getAttributes().getNamedItem(name);
        if(attribute==null) {
            return defaultValue;
        }
        return attribute.getNodeValue();
    }
    
    static String getText(Node node) {
        StringBuilder result=new StringBuilder();
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()==Node.TEXT_NODE || child.getNodeType()==Node.CDATA_SECTION_NODE) {
                result.append(child.getNodeValue());
            }
        }
        return result.toString();
    }
    
    private static List<Element> elementChildren(Node node) {
        ArrayList<Element> out=new ArrayList<Element>();
        for(Node child=node.getFirstChild(); child!=null; child=child.getNextSibling()) {
            if(child.getNodeType()==Node.ELEMENT_NODE) {
                out.add((Element) child);
            }
        }
        return out;
    }
}
