package sce.transforms;

import java.util.LinkedHashMap;
import java.util.Map;

import sce.hir.CompoundStatement;
import sce.hir.DoLoop;
import sce.hir.ForLoop;
import sce.hir.IfStatement;
import sce.hir.SourceLocation;
import sce.hir.Statement;
import sce.hir.WhileLoop;

/**
* Assigns consecutive lines to new statements following the printed layout
* of the IR: a simple statement takes one line, a compound statement takes a
* line for each brace, an if statement takes one more line for the else
* keyword and a do loop one more line for its condition. The init statement
* of a for loop shares the line of the loop.
*/
final class LocationAllocator {

    private final int first_line;

    private final int column;

    private int line;

    private final Map<Statement, SourceLocation> locations;

    LocationAllocator(int first_line, int column) {
        this.first_line = first_line;
        this.column = column;
        this.line = first_line;
        locations = new LinkedHashMap<Statement, SourceLocation>();
    }

    /**
    * Allocates lines to the statement and the statements nested in it, after
    * the lines already allocated.
    */
    void allocate(Statement stmt) {
        SourceLocation loc = new SourceLocation(line++, column);
        locations.put(stmt, loc);
        if (stmt instanceof CompoundStatement) {
            for (Statement child : ((CompoundStatement)stmt).getStatements()) {
                allocate(child);
            }
            line++;
        } else if (stmt instanceof IfStatement) {
            IfStatement if_stmt = (IfStatement)stmt;
            allocate(if_stmt.getThenStatement());
            if (if_stmt.getElseStatement() != null) {
                line++;
                allocate(if_stmt.getElseStatement());
            }
        } else if (stmt instanceof ForLoop) {
            ForLoop loop = (ForLoop)stmt;
            if (loop.getInitialStatement() != null) {
                locations.put(loop.getInitialStatement(), loc);
            }
            allocate(loop.getBody());
        } else if (stmt instanceof WhileLoop) {
            allocate(((WhileLoop)stmt).getBody());
        } else if (stmt instanceof DoLoop) {
            allocate(((DoLoop)stmt).getBody());
            line++;
        }
    }

    /** Returns the allocated locations in allocation order. */
    Map<Statement, SourceLocation> getLocations() {
        return locations;
    }

    int getFirstLine() {
        return first_line;
    }

    /** Returns the last allocated line. */
    int getLastLine() {
        return line - 1;
    }

    int getLineCount() {
        return line - first_line;
    }

    /** Sets the allocated locations on the statements. */
    void apply() {
        for (Map.Entry<Statement, SourceLocation> entry :
                locations.entrySet()) {
            entry.getKey().setLocation(entry.getValue());
        }
    }
}
