package sce.hir;

import java.io.PrintWriter;

/**
* <b>Identifier</b> represents a C identifier that has a matching symbol,
* typically a variable declarator or a procedure. The printed name is always
* the current name of the symbol, so renaming a symbol renames every
* identifier linked to it.
*/
public class Identifier extends IDExpression {

    /** Reference to the relevant symbol object. */
    private Symbol symbol;

    /**
    * Constructs a new identifier that refers to the given symbol.
    *
    * @param symbol the relevant symbol object.
    * @throws IllegalArgumentException if <b>symbol</b> is null.
    */
    public Identifier(Symbol symbol) {
        super();
        if (symbol == null) {
            throw new IllegalArgumentException("null symbol");
        }
        this.symbol = symbol;
    }

    /**
    * Returns a clone of this identifier. The clone refers to the same symbol;
    * cloning an enclosing scope relinks it.
    */
    @Override
    public Identifier clone() {
        return (Identifier)super.clone();
    }

    public Symbol getSymbol() {
        return symbol;
    }

    /**
    * Sets the symbol field with the given symbol object. This is used only
    * when relinking cloned trees.
    */
    void setSymbol(Symbol symbol) {
        this.symbol = symbol;
    }

    @Override
    public String getName() {
        return symbol.getSymbolName();
    }

    /**
    * Checks if the given object is an identifier for the same symbol.
    */
    @Override
    public boolean equals(Object o) {
        return (o instanceof Identifier &&
                ((Identifier)o).symbol == symbol);
    }

    @Override
    public int hashCode() {
        return getName().hashCode();
    }

    public void print(PrintWriter o) {
        o.print(getName());
    }

    @Override
    public String toString() {
        return getName();
    }
}
