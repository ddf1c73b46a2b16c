package sce.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* Represents a single source file: the root of the IR tree, holding the
* global variable declarations and the procedures in source order.
*/
public final class TranslationUnit implements Cloneable, SymbolTable, Traversable {

    private String file_name;

    private List<Traversable> children;

    private Map<String, Symbol> symbol_table;

    /**
    * Creates an empty translation unit.
    *
    * @param file_name the name of the source file.
    */
    public TranslationUnit(String file_name) {
        this.file_name = file_name;
        this.children = new ArrayList<Traversable>();
        this.symbol_table = new LinkedHashMap<String, Symbol>();
    }

    /**
    * Returns a deep copy of the whole unit. Every identifier in the copy is
    * linked to the copied symbol it refers to.
    */
    @Override
    public TranslationUnit clone() {
        TranslationUnit o = null;
        try {
            o = (TranslationUnit)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.children = new ArrayList<Traversable>(children.size());
        o.symbol_table = new LinkedHashMap<String, Symbol>();
        Map<Symbol, Symbol> map = new IdentityHashMap<Symbol, Symbol>();
        for (Traversable child : children) {
            Declaration decl = (Declaration)child;
            Declaration o_decl = decl.clone();
            o.children.add(o_decl);
            o_decl.setParent(o);
            List<Symbol> symbols = decl.getDeclaredSymbols();
            List<Symbol> o_symbols = o_decl.getDeclaredSymbols();
            for (int i = 0; i < symbols.size(); i++) {
                map.put(symbols.get(i), o_symbols.get(i));
                o.symbol_table.put(o_symbols.get(i).getSymbolName(),
                                   o_symbols.get(i));
            }
        }
        SymbolTools.relinkSymbols(o, map);
        return o;
    }

    public String getFileName() {
        return file_name;
    }

    /**
    * Adds a global declaration or a procedure at the end of the unit. A
    * procedure definition replaces the symbol entry of a previous prototype
    * with the same name.
    *
    * @throws DuplicateSymbolException if a variable name is declared twice
    *   or a procedure is defined twice.
    */
    public void addDeclaration(Declaration decl) {
        if (decl.getParent() != null) {
            throw new NotAnOrphanException();
        }
        for (Symbol symbol : decl.getDeclaredSymbols()) {
            Symbol old = symbol_table.get(symbol.getSymbolName());
            if (old != null && !(old instanceof Procedure &&
                    ((Procedure)old).getBody() == null)) {
                throw new DuplicateSymbolException(
                        symbol.getSymbolName() + " is already declared");
            }
        }
        children.add(decl);
        decl.setParent(this);
        for (Symbol symbol : decl.getDeclaredSymbols()) {
            symbol_table.put(symbol.getSymbolName(), symbol);
        }
    }

    /* SymbolTable interface */
    public Symbol findSymbol(String name) {
        return symbol_table.get(name);
    }

    /* SymbolTable interface */
    public List<Symbol> getSymbols() {
        return new ArrayList<Symbol>(symbol_table.values());
    }

    /* SymbolTable interface */
    public List<Declaration> getDeclarations() {
        List<Declaration> ret = new ArrayList<Declaration>(children.size());
        for (Traversable child : children) {
            ret.add((Declaration)child);
        }
        return ret;
    }

    /**
    * Returns the procedure definition or prototype registered under the name.
    *
    * @param name the procedure name.
    * @return the procedure, or null if the name is not a procedure.
    */
    public Procedure findProcedure(String name) {
        Symbol symbol = symbol_table.get(name);
        return (symbol instanceof Procedure) ? (Procedure)symbol : null;
    }

    /**
    * Returns the procedures with a body, in source order.
    */
    public List<Procedure> getProcedures() {
        List<Procedure> ret = new ArrayList<Procedure>();
        for (Traversable child : children) {
            if (child instanceof Procedure &&
                    ((Procedure)child).getBody() != null) {
                ret.add((Procedure)child);
            }
        }
        return ret;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return null;
    }

    public void setParent(Traversable t) {
        throw new UnsupportedOperationException(
                "a translation unit is always the root");
    }

    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index < 0) {
            throw new NotAChildException();
        }
        for (Symbol symbol : ((Declaration)child).getDeclaredSymbols()) {
            if (symbol_table.get(symbol.getSymbolName()) == symbol) {
                symbol_table.remove(symbol.getSymbolName());
            }
        }
        children.remove(index);
        child.setParent(null);
    }

    public void setChild(int index, Traversable t) {
        throw new UnsupportedOperationException(
                "use addDeclaration to modify a translation unit");
    }

    public void print(PrintWriter o) {
        for (Traversable child : children) {
            child.print(o);
            if (child instanceof VariableDeclaration) {
                o.print(";");
            }
            o.println();
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(400);
        PrintWriter pw = new PrintWriter(sw);
        print(pw);
        pw.flush();
        return sw.toString();
    }
}
