package sce.analysis;

import sce.hir.Statement;
import sce.hir.Symbol;

/**
* An edge of the {@link DependenceGraph}. The edge points from the dependent
* statement (a use or a controlled statement) to the statement it depends on
* (a reaching definition or a controlling predicate).
*/
public final class DependenceEdge {

    public enum Kind {
        DATA, CONTROL
    }

    private final Statement from;

    private final Statement to;

    private final Kind kind;

    private final Symbol variable;

    /**
    * Creates an edge.
    *
    * @param from the dependent statement.
    * @param to the statement depended on.
    * @param kind the dependence kind.
    * @param variable the variable carrying a data dependence, null for
    *   control dependences.
    */
    public DependenceEdge(Statement from, Statement to, Kind kind,
                          Symbol variable) {
        if (from == null || to == null || kind == null) {
            throw new IllegalArgumentException();
        }
        this.from = from;
        this.to = to;
        this.kind = kind;
        this.variable = variable;
    }

    public Statement getFrom() {
        return from;
    }

    public Statement getTo() {
        return to;
    }

    public Kind getKind() {
        return kind;
    }

    /** Returns the variable of a data edge, or null. */
    public Symbol getVariable() {
        return variable;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DependenceEdge)) {
            return false;
        }
        DependenceEdge other = (DependenceEdge)o;
        return (from == other.from && to == other.to &&
                kind == other.kind && variable == other.variable);
    }

    @Override
    public int hashCode() {
        int ret = System.identityHashCode(from);
        ret = 31 * ret + System.identityHashCode(to);
        ret = 31 * ret + kind.hashCode();
        return 31 * ret + System.identityHashCode(variable);
    }

    private static String name(Statement stmt) {
        return (stmt.getLocation() == null) ?
                stmt.getClass().getSimpleName() : stmt.getLocation().toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(40);
        sb.append(name(from)).append(" -").append(kind);
        if (variable != null) {
            sb.append("(").append(variable.getSymbolName()).append(")");
        }
        sb.append("-> ").append(name(to));
        return sb.toString();
    }
}
