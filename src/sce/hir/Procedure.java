package sce.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
* Represents a function definition or prototype. The children are the
* parameter declarations followed by the body, if there is one. A procedure
* is the symbol that a call's name refers to, and it is the scope of its
* parameters.
*/
public final class Procedure extends Declaration implements Symbol, SymbolTable {

    private List<Specifier> return_type;

    private String name;

    private int num_params;

    /**
    * Creates a procedure.
    *
    * @param return_type the return type specifiers.
    * @param name the name of the procedure.
    * @param params the parameter declarations, one declarator each.
    * @param body the body, or null for a prototype.
    */
    public Procedure(List<Specifier> return_type, String name,
                     List<VariableDeclaration> params, CompoundStatement body) {
        super();
        this.return_type = new ArrayList<Specifier>(return_type);
        this.name = name;
        this.num_params = params.size();
        for (VariableDeclaration param : params) {
            if (param.getNumDeclarators() != 1) {
                throw new IllegalArgumentException(
                        "a parameter declares exactly one declarator");
            }
            addChild(param);
        }
        if (body != null) {
            addChild(body);
        }
    }

    /**
    * Returns a deep copy of this procedure in which the identifiers that refer
    * to the parameters are linked to the cloned parameters.
    */
    @Override
    public Procedure clone() {
        Procedure o = (Procedure)super.clone();
        o.return_type = new ArrayList<Specifier>(return_type);
        Map<Symbol, Symbol> map = new IdentityHashMap<Symbol, Symbol>();
        for (int i = 0; i < num_params; i++) {
            map.put(getParameter(i), o.getParameter(i));
        }
        SymbolTools.relinkSymbols(o, map);
        return o;
    }

    public CompoundStatement getBody() {
        if (children.size() > num_params) {
            return (CompoundStatement)children.get(num_params);
        }
        return null;
    }

    public List<VariableDeclaration> getParameters() {
        List<VariableDeclaration> ret =
                new ArrayList<VariableDeclaration>(num_params);
        for (int i = 0; i < num_params; i++) {
            ret.add((VariableDeclaration)children.get(i));
        }
        return ret;
    }

    /**
    * Returns the declarator of the <var>index</var><i>th</i> parameter.
    */
    public VariableDeclarator getParameter(int index) {
        return ((VariableDeclaration)children.get(index)).getDeclarator(0);
    }

    public int getNumParameters() {
        return num_params;
    }

    public List<Specifier> getReturnType() {
        return return_type;
    }

    /**
    * Checks if the procedure returns no value.
    */
    public boolean isVoid() {
        return (return_type.contains(Specifier.VOID) &&
                !return_type.contains(PointerSpecifier.UNQUALIFIED));
    }

    /* Symbol interface */
    public List<Specifier> getTypeSpecifiers() {
        return return_type;
    }

    /* Symbol interface */
    public List<Specifier> getArraySpecifiers() {
        return new ArrayList<Specifier>(0);
    }

    /* Symbol interface */
    public String getSymbolName() {
        return name;
    }

    /* Symbol interface */
    public void setName(String name) {
        this.name = name;
    }

    /* Symbol interface */
    public Declaration getDeclaration() {
        return this;
    }

    /**
    * Parameters are fixed at construction.
    *
    * @throws UnsupportedOperationException always.
    */
    public void addDeclaration(Declaration decl) {
        throw new UnsupportedOperationException(
                "parameters cannot be added to a procedure");
    }

    /* SymbolTable interface */
    public Symbol findSymbol(String name) {
        for (int i = 0; i < num_params; i++) {
            VariableDeclarator param = getParameter(i);
            if (param.getSymbolName().equals(name)) {
                return param;
            }
        }
        return null;
    }

    /* SymbolTable interface */
    public List<Symbol> getSymbols() {
        List<Symbol> ret = new ArrayList<Symbol>(num_params);
        for (int i = 0; i < num_params; i++) {
            ret.add(getParameter(i));
        }
        return ret;
    }

    /* SymbolTable interface */
    public List<Declaration> getDeclarations() {
        return new ArrayList<Declaration>(getParameters());
    }

    public List<Symbol> getDeclaredSymbols() {
        List<Symbol> ret = new ArrayList<Symbol>(1);
        ret.add(this);
        return ret;
    }

    public void print(PrintWriter o) {
        for (Specifier spec : return_type) {
            spec.print(o);
            o.print(" ");
        }
        o.print(name);
        o.print("(");
        PrintTools.printListWithComma(getParameters(), o);
        o.print(")");
        CompoundStatement body = getBody();
        if (body == null) {
            o.print(";");
        } else {
            o.println();
            body.print(o);
        }
    }
}
