package sce.transforms;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import sce.analysis.UnreachableCodeWarning;
import sce.hir.CompoundStatement;
import sce.hir.Procedure;
import sce.hir.SourceLocation;
import sce.hir.Statement;
import sce.hir.TranslationUnit;
import sce.hir.VariableDeclarator;

/**
* The outcome of inlining one call: the rewritten copy of the unit, the
* statements introduced with their assigned locations, and the range of lines
* they occupy.
*/
public final class InlineResult {

    private final TranslationUnit unit;

    private final Procedure caller;

    private final CompoundStatement block;

    private final VariableDeclarator result_var;

    private final Map<Statement, SourceLocation> locations;

    private final int min_line;

    private final int max_line;

    private final List<UnreachableCodeWarning> warnings;

    InlineResult(TranslationUnit unit, Procedure caller,
                 CompoundStatement block, VariableDeclarator result_var,
                 Map<Statement, SourceLocation> locations, int min_line,
                 int max_line, List<UnreachableCodeWarning> warnings) {
        this.unit = unit;
        this.caller = caller;
        this.block = block;
        this.result_var = result_var;
        this.locations = Collections.unmodifiableMap(locations);
        this.min_line = min_line;
        this.max_line = max_line;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    /** Returns the rewritten copy of the input unit. */
    public TranslationUnit getTranslationUnit() {
        return unit;
    }

    /** Returns the procedure that contained the call, in the copy. */
    public Procedure getCaller() {
        return caller;
    }

    /** Returns the block holding the expanded body. */
    public CompoundStatement getInlinedBlock() {
        return block;
    }

    /**
    * Returns the temporary holding the returned value.
    *
    * @return the temporary, or null if the value is not used.
    */
    public VariableDeclarator getResultVariable() {
        return result_var;
    }

    /**
    * Returns the location assigned to each introduced statement, in program
    * order.
    */
    public Map<Statement, SourceLocation> getLocations() {
        return locations;
    }

    public int getMinLine() {
        return min_line;
    }

    public int getMaxLine() {
        return max_line;
    }

    /** Returns the number of lines occupied by the introduced code. */
    public int getLineCount() {
        return max_line - min_line + 1;
    }

    /** Returns warnings about dead code in the inlined function. */
    public List<UnreachableCodeWarning> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "inlined into " + caller.getSymbolName() + " at lines [" +
                min_line + ", " + max_line + "]";
    }
}
