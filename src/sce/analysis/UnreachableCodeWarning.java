package sce.analysis;

import sce.hir.SourceLocation;
import sce.hir.Statement;

/**
* Non-fatal notice that a statement can never execute. Warnings are attached
* to slicing and inlining results; they are never thrown.
*/
public final class UnreachableCodeWarning {

    private final String procedure;

    private final Statement statement;

    public UnreachableCodeWarning(String procedure, Statement statement) {
        this.procedure = procedure;
        this.statement = statement;
    }

    /** Returns the name of the procedure containing the dead code. */
    public String getProcedureName() {
        return procedure;
    }

    public Statement getStatement() {
        return statement;
    }

    /** Returns the location of the dead statement, or null if unknown. */
    public SourceLocation getLocation() {
        return statement.getLocation();
    }

    @Override
    public String toString() {
        SourceLocation loc = getLocation();
        return "[WARNING] unreachable code in " + procedure +
                ((loc == null) ? "" : " at " + loc);
    }
}
