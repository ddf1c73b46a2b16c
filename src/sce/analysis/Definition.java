package sce.analysis;

import sce.hir.Statement;
import sce.hir.Symbol;

/**
* A definition site found by {@link ReachingDefinitionAnalysis}: a node of
* the CFG that assigns, or may assign, a variable.
*/
public final class Definition {

    private final int id;

    private final Symbol symbol;

    private final DFANode node;

    private final boolean must;

    Definition(int id, Symbol symbol, DFANode node, boolean must) {
        this.id = id;
        this.symbol = symbol;
        this.node = node;
        this.must = must;
    }

    /** Returns the position of the definition in the analysis universe. */
    public int getId() {
        return id;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public DFANode getNode() {
        return node;
    }

    /**
    * Returns the statement containing the definition.
    *
    * @return the statement, or null for parameters defined at the entry.
    */
    public Statement getStatement() {
        return CFGraph.getStatement(node);
    }

    /**
    * Checks if the definition always assigns the variable and so kills the
    * other definitions of it.
    */
    public boolean isMust() {
        return must;
    }

    @Override
    public String toString() {
        Statement stmt = getStatement();
        String where = (stmt == null) ? "ENTRY" :
                (stmt.getLocation() == null) ? stmt.toString() :
                stmt.getLocation().toString();
        return symbol.getSymbolName() + "@" + where + (must ? "" : "?");
    }
}
