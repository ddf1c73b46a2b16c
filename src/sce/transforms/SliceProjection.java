package sce.transforms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import sce.analysis.SliceResult;
import sce.hir.CompoundStatement;
import sce.hir.DFIterator;
import sce.hir.DeclarationStatement;
import sce.hir.IRTools;
import sce.hir.PrintTools;
import sce.hir.Procedure;
import sce.hir.SourceLocation;
import sce.hir.Statement;
import sce.hir.Symbol;
import sce.hir.SymbolTools;
import sce.hir.Traversable;

/**
* Projects a slice back onto the program: a copy of the sliced procedure
* that keeps only the statements of the slice, the statements enclosing them
* and the declarations of the variables they use. Statements are removed
* only from blocks; a kept statement keeps its condition and header parts.
* The removed statements and the lines they occupied are reported so that a
* caller can delete them from the source text.
*/
public class SliceProjection {

    private final SliceResult slice;

    private final Procedure projected;

    /** Top-most removed statements of the original procedure */
    private final List<Statement> removed;

    private final SortedSet<Integer> removed_lines;

    /**
    * Builds the projection of the slice. The sliced procedure is not
    * modified.
    *
    * @param slice the slice to be projected.
    */
    public SliceProjection(SliceResult slice) {
        this.slice = slice;
        Procedure proc = slice.getProcedure();
        Set<Statement> kept = computeKept(proc);
        removed = new ArrayList<Statement>();
        collectRemoved(proc.getBody(), kept);
        removed_lines = new TreeSet<Integer>();
        for (Statement stmt : removed) {
            addLines(stmt);
        }
        // Locate the copies before removing anything so the paths are valid.
        projected = proc.clone();
        List<Statement> targets = new ArrayList<Statement>(removed.size());
        for (Statement stmt : removed) {
            targets.add((Statement)IRTools.getByPath(projected,
                    IRTools.getPath(proc, stmt)));
        }
        for (Statement target : targets) {
            ((CompoundStatement)target.getParent()).removeStatement(target);
        }
        PrintTools.printlnStatus(2, "[PROJECTION]", proc.getSymbolName(),
                "removed", removed.size(), "statements on lines",
                removed_lines);
    }

    // Kept: the slice, the statements around it and the declarations of
    // every symbol used by kept code.
    private Set<Statement> computeKept(Procedure proc) {
        Set<Statement> ret = Collections.newSetFromMap(
                new IdentityHashMap<Statement, Boolean>());
        List<Statement> work = new ArrayList<Statement>(slice.getStatements());
        Set<Symbol> needed = new LinkedHashSet<Symbol>();
        while (!work.isEmpty()) {
            Statement stmt = work.remove(work.size() - 1);
            if (!ret.add(stmt)) {
                continue;
            }
            needed.addAll(getHeaderSymbols(stmt));
            Traversable parent = stmt.getParent();
            if (parent instanceof Statement) {
                work.add((Statement)parent);
            }
            if (work.isEmpty()) {
                work.addAll(getDeclarations(proc, needed, ret));
            }
        }
        return ret;
    }

    // Symbols used by the statement itself, not by the statements nested in
    // it.
    private static Set<Symbol> getHeaderSymbols(Statement stmt) {
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        if (stmt instanceof CompoundStatement) {
            return ret;
        }
        for (Traversable child : stmt.getChildren()) {
            if (child != null && !(child instanceof CompoundStatement)) {
                ret.addAll(SymbolTools.getAccessedSymbols(child));
            }
        }
        return ret;
    }

    private static List<Statement> getDeclarations(Procedure proc,
            Set<Symbol> needed, Set<Statement> kept) {
        List<Statement> ret = new ArrayList<Statement>();
        DFIterator<DeclarationStatement> iter =
                new DFIterator<DeclarationStatement>(proc.getBody(),
                        DeclarationStatement.class);
        while (iter.hasNext()) {
            DeclarationStatement stmt = iter.next();
            if (kept.contains(stmt)) {
                continue;
            }
            for (Symbol symbol :
                    stmt.getDeclaration().getDeclaredSymbols()) {
                if (needed.contains(symbol)) {
                    ret.add(stmt);
                    break;
                }
            }
        }
        return ret;
    }

    private void collectRemoved(Statement stmt, Set<Statement> kept) {
        for (Traversable child : stmt.getChildren()) {
            if (!(child instanceof Statement)) {
                continue;
            }
            Statement child_stmt = (Statement)child;
            if (stmt instanceof CompoundStatement &&
                    !kept.contains(child_stmt)) {
                removed.add(child_stmt);
            } else {
                collectRemoved(child_stmt, kept);
            }
        }
    }

    private void addLines(Statement stmt) {
        int first = Integer.MAX_VALUE, last = -1;
        DFIterator<Statement> iter =
                new DFIterator<Statement>(stmt, Statement.class);
        while (iter.hasNext()) {
            int line = iter.next().where();
            if (line > 0) {
                first = Math.min(first, line);
                last = Math.max(last, line);
            }
        }
        for (int line = first; line <= last; line++) {
            removed_lines.add(line);
        }
    }

    /** Returns the slice that was projected. */
    public SliceResult getSlice() {
        return slice;
    }

    /**
    * Returns the copy of the procedure holding only the kept statements.
    */
    public Procedure getProjectedProcedure() {
        return projected;
    }

    /**
    * Returns the removed statements of the sliced procedure, in program
    * order. Statements nested in a removed statement are not listed.
    */
    public List<Statement> getRemovedStatements() {
        return Collections.unmodifiableList(removed);
    }

    /**
    * Returns the locations of the removed statements, in program order.
    * Statements without a location are skipped.
    */
    public List<SourceLocation> getRemovedLocations() {
        List<SourceLocation> ret = new ArrayList<SourceLocation>();
        for (Statement stmt : removed) {
            if (stmt.getLocation() != null) {
                ret.add(stmt.getLocation());
            }
        }
        return ret;
    }

    /**
    * Returns the source lines spanned by the removed statements.
    */
    public SortedSet<Integer> getRemovedLines() {
        return Collections.unmodifiableSortedSet(removed_lines);
    }

    /**
    * Maps a location of the original source to the same position in the
    * source with the removed lines deleted.
    *
    * @throws IllegalArgumentException if the location is on a removed line.
    */
    public SourceLocation adjust(SourceLocation loc) {
        if (removed_lines.contains(loc.getLine())) {
            throw new IllegalArgumentException(loc + " is removed");
        }
        int before = removed_lines.headSet(loc.getLine()).size();
        return new SourceLocation(loc.getLine() - before, loc.getColumn());
    }

    @Override
    public String toString() {
        return projected.toString();
    }
}
