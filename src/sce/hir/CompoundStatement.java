package sce.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* Represents a block of statements enclosed in braces. A compound statement is
* a scope; the variables declared by its declaration statements are entered in
* its symbol table.
*/
public class CompoundStatement extends Statement implements SymbolTable {

    /** Table of the symbols declared directly in this block */
    private Map<String, Symbol> symbol_table;

    /** Creates an empty compound statement. */
    public CompoundStatement() {
        super(8);
        symbol_table = new LinkedHashMap<String, Symbol>();
    }

    /**
    * Returns a deep copy of this block. The copy has its own symbol table and
    * the identifiers in the copy that refer to symbols of this block are
    * linked to the copied declarators.
    */
    @Override
    public CompoundStatement clone() {
        CompoundStatement o = (CompoundStatement)super.clone();
        o.symbol_table = new LinkedHashMap<String, Symbol>();
        Map<Symbol, Symbol> map = new IdentityHashMap<Symbol, Symbol>();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof DeclarationStatement) {
                List<Symbol> symbols = ((DeclarationStatement)children.get(i))
                        .getDeclaration().getDeclaredSymbols();
                List<Symbol> o_symbols = ((DeclarationStatement)o.children
                        .get(i)).getDeclaration().getDeclaredSymbols();
                for (int j = 0; j < symbols.size(); j++) {
                    map.put(symbols.get(j), o_symbols.get(j));
                    o.symbol_table.put(o_symbols.get(j).getSymbolName(),
                                       o_symbols.get(j));
                }
            }
        }
        if (!map.isEmpty()) {
            SymbolTools.relinkSymbols(o, map);
        }
        return o;
    }

    /**
    * Appends a statement to the end of this block. A declaration statement
    * also enters its symbols in the symbol table.
    *
    * @param stmt the statement to be appended.
    * @throws NotAnOrphanException if the statement has a parent.
    * @throws DuplicateSymbolException if a declared name already exists in
    *   this block.
    */
    public void addStatement(Statement stmt) {
        checkSymbols(stmt);
        addChild(stmt);
        registerSymbols(stmt);
    }

    /**
    * Inserts a statement immediately before the reference statement.
    *
    * @param ref the reference statement, a child of this block.
    * @param new_stmt the statement to be inserted.
    * @throws NotAChildException if <b>ref</b> is not a child.
    */
    public void addStatementBefore(Statement ref, Statement new_stmt) {
        int index = Tools.identityIndexOf(children, ref);
        if (index == -1) {
            throw new NotAChildException();
        }
        checkSymbols(new_stmt);
        addChild(index, new_stmt);
        registerSymbols(new_stmt);
    }

    /**
    * Inserts a statement immediately after the reference statement.
    *
    * @param ref the reference statement, a child of this block.
    * @param new_stmt the statement to be inserted.
    * @throws NotAChildException if <b>ref</b> is not a child.
    */
    public void addStatementAfter(Statement ref, Statement new_stmt) {
        int index = Tools.identityIndexOf(children, ref);
        if (index == -1) {
            throw new NotAChildException();
        }
        checkSymbols(new_stmt);
        addChild(index + 1, new_stmt);
        registerSymbols(new_stmt);
    }

    /**
    * Adds a declaration after the last declaration statement that leads the
    * block.
    *
    * @param decl the declaration to be added.
    */
    public void addDeclaration(Declaration decl) {
        DeclarationStatement stmt = new DeclarationStatement(decl);
        int index = 0;
        while (index < children.size() &&
                children.get(index) instanceof DeclarationStatement) {
            index++;
        }
        checkSymbols(stmt);
        addChild(index, stmt);
        registerSymbols(stmt);
    }

    /**
    * Removes the statement from this block.
    *
    * @param stmt the statement to be removed.
    * @throws NotAChildException if the statement is not a child.
    */
    public void removeStatement(Statement stmt) {
        removeChild(stmt);
    }

    @Override
    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index == -1) {
            throw new NotAChildException();
        }
        unregisterSymbols(child);
        children.remove(index);
        child.setParent(null);
    }

    @Override
    public void setChild(int index, Traversable t) {
        if (!(t instanceof Statement)) {
            throw new IllegalArgumentException();
        }
        if (index >= 0 && index < children.size()) {
            unregisterSymbols(children.get(index));
        }
        checkSymbols((Statement)t);
        super.setChild(index, t);
        registerSymbols((Statement)t);
    }

    /**
    * Returns the number of statements in this block.
    */
    public int countStatements() {
        return children.size();
    }

    /**
    * Returns the statements of this block as a typed list.
    */
    public List<Statement> getStatements() {
        List<Statement> ret = new ArrayList<Statement>(children.size());
        for (Traversable child : children) {
            ret.add((Statement)child);
        }
        return ret;
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
        List<Declaration> ret = new ArrayList<Declaration>();
        for (Traversable child : children) {
            if (child instanceof DeclarationStatement) {
                ret.add(((DeclarationStatement)child).getDeclaration());
            }
        }
        return ret;
    }

    private void checkSymbols(Statement stmt) {
        if (stmt instanceof DeclarationStatement) {
            for (Symbol symbol : ((DeclarationStatement)stmt)
                    .getDeclaration().getDeclaredSymbols()) {
                if (symbol_table.containsKey(symbol.getSymbolName())) {
                    throw new DuplicateSymbolException(
                            symbol.getSymbolName() + " is already declared");
                }
            }
        }
    }

    private void registerSymbols(Statement stmt) {
        if (stmt instanceof DeclarationStatement) {
            for (Symbol symbol : ((DeclarationStatement)stmt)
                    .getDeclaration().getDeclaredSymbols()) {
                symbol_table.put(symbol.getSymbolName(), symbol);
            }
        }
    }

    private void unregisterSymbols(Traversable t) {
        if (t instanceof DeclarationStatement) {
            for (Symbol symbol : ((DeclarationStatement)t)
                    .getDeclaration().getDeclaredSymbols()) {
                if (symbol_table.get(symbol.getSymbolName()) == symbol) {
                    symbol_table.remove(symbol.getSymbolName());
                }
            }
        }
    }

    /**
    * Re-enters every declared symbol under its current name. Needed after
    * symbols of this block are renamed.
    */
    public void rehashSymbols() {
        symbol_table.clear();
        for (Traversable child : children) {
            registerSymbols((Statement)child);
        }
    }

    public void print(PrintWriter o) {
        o.println("{");
        for (Traversable child : children) {
            child.print(o);
            o.println();
        }
        o.print("}");
    }
}
