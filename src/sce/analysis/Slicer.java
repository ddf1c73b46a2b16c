package sce.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import sce.hir.BreakStatement;
import sce.hir.CompoundStatement;
import sce.hir.ContinueStatement;
import sce.hir.DFIterator;
import sce.hir.Expression;
import sce.hir.PrintTools;
import sce.hir.Procedure;
import sce.hir.ReturnStatement;
import sce.hir.SourceLocation;
import sce.hir.Statement;
import sce.hir.Symbol;
import sce.hir.SymbolTools;
import sce.hir.Tools;
import sce.hir.Traversable;
import sce.hir.VariableDeclarator;

/**
* Computes program slices over the {@link DependenceGraph} of a procedure.
*
* <p>A backward slice starts from the criterion statement and the
* definitions of the relevant variables that reach the criterion point, and
* adds every statement they transitively depend on through data or control
* edges. The relevant variables are the criterion variable, or the variables
* live at the criterion point when no variable is given. Jump statements
* whose controlling predicate is in the slice are added afterwards, with
* their own dependences, until nothing changes.
*
* <p>A forward slice contains the criterion statement and every statement
* that transitively depends on it.
*/
public class Slicer {

    private static final String pass_name = "[SLICER]";

    private final AnalysisContext context;

    public Slicer(AnalysisContext context) {
        this.context = context;
    }

    public String getPassName() {
        return pass_name;
    }

    /**
    * Computes the slice for the criterion.
    *
    * @param criterion the slicing criterion.
    * @return the slice.
    * @throws CriterionNotFoundException if no statement is at the criterion
    *   location.
    */
    public SliceResult slice(SliceCriterion criterion) {
        double timer = Tools.getTime();
        Procedure proc = context.getProcedure();
        PrintTools.printlnStatus(1, pass_name, "begin", criterion, "in",
                                 proc.getSymbolName());
        Statement stmt = findStatement(criterion.getLocation());
        Set<Statement> slice;
        if (criterion.getDirection() == SliceDirection.FORWARD) {
            slice = new LinkedHashSet<Statement>();
            slice.add(stmt);
            closeForward(slice);
        } else {
            slice = sliceBackward(criterion, stmt);
        }
        List<Statement> ordered = toProgramOrder(slice);
        List<UnreachableCodeWarning> warnings =
                new ArrayList<UnreachableCodeWarning>(context.getWarnings());
        for (UnreachableCodeWarning warning : warnings) {
            PrintTools.printlnStatus(0, warning);
        }
        PrintTools.printlnStatus(2, pass_name, "statements:",
                                 ordered.size());
        PrintTools.printlnStatus(1, pass_name, "end in",
                String.format("%.2f seconds", Tools.getTime(timer)));
        return new SliceResult(proc, criterion, stmt, ordered, warnings);
    }

    private Set<Statement> sliceBackward(SliceCriterion criterion,
                                         Statement stmt) {
        Set<Statement> ret = new LinkedHashSet<Statement>();
        ret.add(stmt);
        ReachingDefinitionAnalysis rd = context.getReachingDefinitions();
        DFANode node = context.getCFGraph().getNode(stmt);
        Set<Symbol> relevant = new LinkedHashSet<Symbol>();
        if (criterion.hasVariable()) {
            Symbol var = criterion.getVariable();
            if (var == null) {
                var = SymbolTools.findSymbol(stmt,
                                             criterion.getVariableName());
            }
            if (var == null || rd.getDefinitions(var).isEmpty()) {
                PrintTools.printlnStatus(1, pass_name,
                        criterion.getVariableName(),
                        "is never defined, the slice is the criterion");
                return ret;
            }
            relevant.add(var);
        } else if (node != null) {
            relevant.addAll(context.getLiveVariables().getLiveIn(node));
        }
        if (node != null) {
            for (Symbol var : relevant) {
                for (Definition def : rd.getReachingDefinitions(node, var)) {
                    if (def.getStatement() != null) {
                        ret.add(def.getStatement());
                    }
                }
            }
        }
        PrintTools.printlnStatus(2, pass_name, "relevant variables:",
                                 PrintTools.collectionToString(
                                         names(relevant), ", "));
        closeBackward(ret);
        addJumps(ret);
        return ret;
    }

    private static List<String> names(Set<Symbol> symbols) {
        List<String> ret = new ArrayList<String>(symbols.size());
        for (Symbol symbol : symbols) {
            ret.add(symbol.getSymbolName());
        }
        return ret;
    }

    // Adds everything the statements in the set depend on.
    private void closeBackward(Set<Statement> slice) {
        DependenceGraph dg = context.getDependenceGraph();
        LinkedList<Statement> work = new LinkedList<Statement>(slice);
        while (!work.isEmpty()) {
            Statement stmt = work.removeFirst();
            for (DependenceEdge edge : dg.getDependences(stmt)) {
                if (slice.add(edge.getTo())) {
                    work.add(edge.getTo());
                }
            }
        }
    }

    // Adds everything depending on the statements in the set.
    private void closeForward(Set<Statement> slice) {
        DependenceGraph dg = context.getDependenceGraph();
        LinkedList<Statement> work = new LinkedList<Statement>(slice);
        while (!work.isEmpty()) {
            Statement stmt = work.removeFirst();
            for (DependenceEdge edge : dg.getDependents(stmt)) {
                if (slice.add(edge.getFrom())) {
                    work.add(edge.getFrom());
                }
            }
        }
    }

    // Adds break, continue and return statements controlled by a predicate
    // in the slice.
    private void addJumps(Set<Statement> slice) {
        DependenceGraph dg = context.getDependenceGraph();
        List<Statement> jumps = new ArrayList<Statement>();
        DFIterator<Statement> iter = new DFIterator<Statement>(
                context.getProcedure().getBody(), Statement.class);
        while (iter.hasNext()) {
            Statement stmt = iter.next();
            if (stmt instanceof BreakStatement ||
                    stmt instanceof ContinueStatement ||
                    stmt instanceof ReturnStatement) {
                jumps.add(stmt);
            }
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Statement jump : jumps) {
                if (slice.contains(jump)) {
                    continue;
                }
                for (DependenceEdge edge : dg.getDependences(jump)) {
                    if (edge.getKind() == DependenceEdge.Kind.CONTROL &&
                            slice.contains(edge.getTo())) {
                        slice.add(jump);
                        closeBackward(slice);
                        changed = true;
                        break;
                    }
                }
            }
        }
    }

    /**
    * Returns the statement identified by the location: the innermost
    * statement located there, otherwise the statement containing an
    * expression or a declarator located there.
    *
    * @throws CriterionNotFoundException if no statement matches.
    */
    public Statement findStatement(SourceLocation location) {
        CompoundStatement body = context.getProcedure().getBody();
        Statement ret = null;
        DFIterator<Statement> iter =
                new DFIterator<Statement>(body, Statement.class);
        while (iter.hasNext()) {
            Statement stmt = iter.next();
            if (!(stmt instanceof CompoundStatement) &&
                    location.equals(stmt.getLocation())) {
                ret = stmt;
            }
        }
        if (ret != null) {
            return ret;
        }
        DFIterator<Traversable> all = new DFIterator<Traversable>(body);
        while (all.hasNext()) {
            Traversable t = all.next();
            if (t instanceof Expression &&
                    location.equals(((Expression)t).getLocation())) {
                ret = ((Expression)t).getStatement();
            } else if (t instanceof VariableDeclarator &&
                    location.equals(((VariableDeclarator)t).getLocation())) {
                ret = enclosingStatement(t);
            }
            if (ret != null && !(ret instanceof CompoundStatement)) {
                return ret;
            }
            ret = null;
        }
        throw new CriterionNotFoundException(
                context.getProcedure().getSymbolName(), location);
    }

    private static Statement enclosingStatement(Traversable t) {
        Traversable p = t.getParent();
        while (p != null && !(p instanceof Statement)) {
            p = p.getParent();
        }
        return (Statement)p;
    }

    private List<Statement> toProgramOrder(Set<Statement> slice) {
        List<Statement> ret = new ArrayList<Statement>(slice.size());
        DFIterator<Statement> iter = new DFIterator<Statement>(
                context.getProcedure().getBody(), Statement.class);
        while (iter.hasNext()) {
            Statement stmt = iter.next();
            if (slice.contains(stmt)) {
                ret.add(stmt);
            }
        }
        return ret;
    }
}
