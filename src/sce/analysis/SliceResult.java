package sce.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import sce.hir.Procedure;
import sce.hir.Statement;
import sce.hir.Tools;

/**
* The statements of a slice, in program order, with the warnings collected
* while computing it.
*/
public final class SliceResult {

    private final Procedure procedure;

    private final SliceCriterion criterion;

    private final Statement criterion_stmt;

    private final List<Statement> statements;

    private final List<UnreachableCodeWarning> warnings;

    SliceResult(Procedure procedure, SliceCriterion criterion,
                Statement criterion_stmt, List<Statement> statements,
                List<UnreachableCodeWarning> warnings) {
        this.procedure = procedure;
        this.criterion = criterion;
        this.criterion_stmt = criterion_stmt;
        this.statements = Collections.unmodifiableList(statements);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public Procedure getProcedure() {
        return procedure;
    }

    public SliceCriterion getCriterion() {
        return criterion;
    }

    /** Returns the statement the criterion location resolved to. */
    public Statement getCriterionStatement() {
        return criterion_stmt;
    }

    /** Returns the statements of the slice in program order. */
    public List<Statement> getStatements() {
        return statements;
    }

    public boolean contains(Statement stmt) {
        return Tools.containsByReference(statements, stmt);
    }

    public int size() {
        return statements.size();
    }

    /** Returns the lines of the slice statements that have a location. */
    public SortedSet<Integer> getLines() {
        SortedSet<Integer> ret = new TreeSet<Integer>();
        for (Statement stmt : statements) {
            if (stmt.getLocation() != null) {
                ret.add(stmt.getLocation().getLine());
            }
        }
        return ret;
    }

    public List<UnreachableCodeWarning> getWarnings() {
        return warnings;
    }

    /**
    * Returns the statements that belong to both slices, in the order of this
    * slice.
    */
    public List<Statement> intersect(SliceResult other) {
        List<Statement> ret = new ArrayList<Statement>();
        for (Statement stmt : statements) {
            if (other.contains(stmt)) {
                ret.add(stmt);
            }
        }
        return ret;
    }

    @Override
    public String toString() {
        return "slice " + criterion + " of " + procedure.getSymbolName() +
                " at lines " + getLines();
    }
}
