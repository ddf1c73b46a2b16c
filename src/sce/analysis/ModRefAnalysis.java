package sce.analysis;

import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import sce.hir.ArrayAccess;
import sce.hir.AssignmentExpression;
import sce.hir.DFIterator;
import sce.hir.Expression;
import sce.hir.FunctionCall;
import sce.hir.PrintTools;
import sce.hir.Procedure;
import sce.hir.Symbol;
import sce.hir.SymbolTools;
import sce.hir.TranslationUnit;
import sce.hir.UnaryExpression;
import sce.hir.UnaryOperator;
import sce.hir.VariableDeclarator;

/**
* Computes for every procedure of a translation unit the global variables it
* may modify and may reference, directly or through the procedures it calls,
* and whether it may write or read through pointers. A call to a function
* without a body in the unit may modify and reference every global variable,
* and may access memory when the unit has global pointers.
*/
public class ModRefAnalysis {

    /** The side effects of one procedure, callees included. */
    public static final class Summary {

        private final Set<Symbol> mod = new LinkedHashSet<Symbol>();

        private final Set<Symbol> ref = new LinkedHashSet<Symbol>();

        private boolean writes_memory;

        private boolean reads_memory;

        /** Returns the global variables the procedure may modify. */
        public Set<Symbol> getMod() {
            return mod;
        }

        /** Returns the global variables the procedure may read. */
        public Set<Symbol> getRef() {
            return ref;
        }

        public boolean writesMemory() {
            return writes_memory;
        }

        public boolean readsMemory() {
            return reads_memory;
        }

        private void merge(Summary other) {
            mod.addAll(other.mod);
            ref.addAll(other.ref);
            writes_memory |= other.writes_memory;
            reads_memory |= other.reads_memory;
        }

        @Override
        public String toString() {
            return "mod=" + mod + (writes_memory ? "+" + MemorySymbol.UNKNOWN :
                    "") + " ref=" + ref + (reads_memory ? "+" +
                    MemorySymbol.UNKNOWN : "");
        }
    }

    private static final String tag = "[MOD-REF]";

    private final TranslationUnit unit;

    private final Set<Symbol> globals;

    private final Set<Symbol> address_taken;

    private final Summary unknown;

    private final Map<Procedure, Summary> summaries;

    public ModRefAnalysis(TranslationUnit unit) {
        this.unit = unit;
        globals = new LinkedHashSet<Symbol>();
        boolean global_pointers = false;
        for (Symbol symbol : unit.getSymbols()) {
            if (symbol instanceof VariableDeclarator) {
                globals.add(symbol);
                global_pointers |= SymbolTools.isPointer(symbol);
            }
        }
        address_taken = new LinkedHashSet<Symbol>();
        for (Symbol symbol : SymbolTools.getAddressTakenSymbols(unit)) {
            if (globals.contains(symbol)) {
                address_taken.add(symbol);
            }
        }
        unknown = new Summary();
        unknown.mod.addAll(globals);
        unknown.ref.addAll(globals);
        unknown.writes_memory = global_pointers;
        unknown.reads_memory = global_pointers;

        Map<Procedure, Summary> direct =
                new IdentityHashMap<Procedure, Summary>();
        for (Procedure proc : unit.getProcedures()) {
            direct.put(proc, analyzeProcedure(proc));
        }
        CallGraph cg = new CallGraph(unit);
        summaries = new IdentityHashMap<Procedure, Summary>();
        for (Procedure proc : unit.getProcedures()) {
            Summary summary = new Summary();
            summary.merge(direct.get(proc));
            for (Procedure callee : cg.getTransitiveCallees(proc)) {
                summary.merge(direct.get(callee));
            }
            summaries.put(proc, summary);
            PrintTools.printlnStatus(3, tag, proc.getSymbolName(), summary);
        }
    }

    // Effects of the statements of the procedure, and of calls that leave
    // the unit.
    private Summary analyzeProcedure(Procedure proc) {
        Summary ret = new Summary();
        DFIterator<Expression> iter =
                new DFIterator<Expression>(proc.getBody(), Expression.class);
        while (iter.hasNext()) {
            Expression e = iter.next();
            Expression lhs = null;
            if (e instanceof AssignmentExpression) {
                lhs = ((AssignmentExpression)e).getLHS();
            } else if (e instanceof UnaryExpression &&
                    ((UnaryExpression)e).getOperator().modifiesOperand()) {
                lhs = ((UnaryExpression)e).getExpression();
            } else if (e instanceof FunctionCall &&
                    !isDefined((FunctionCall)e)) {
                ret.merge(unknown);
            }
            if (lhs != null) {
                Symbol symbol = SymbolTools.getSymbolOf(lhs);
                if (globals.contains(symbol)) {
                    ret.mod.add(symbol);
                }
                if (DataFlowTools.isIndirect(lhs)) {
                    ret.writes_memory = true;
                }
            }
            if (e instanceof UnaryExpression &&
                    ((UnaryExpression)e).getOperator() ==
                    UnaryOperator.DEREFERENCE ||
                    e instanceof ArrayAccess && DataFlowTools.isIndirect(e)) {
                ret.reads_memory = true;
            }
        }
        for (Symbol symbol : SymbolTools.getAccessedSymbols(proc.getBody())) {
            if (globals.contains(symbol)) {
                ret.ref.add(symbol);
            }
        }
        return ret;
    }

    private boolean isDefined(FunctionCall call) {
        String name = call.getFunctionName();
        Procedure callee = (name == null) ? null : unit.findProcedure(name);
        return (callee != null && callee.getBody() != null);
    }

    /** Returns the global variables of the unit. */
    public Set<Symbol> getGlobals() {
        return globals;
    }

    /**
    * Returns the global variables whose address is taken somewhere in the
    * unit. Any indirect write may modify them.
    */
    public Set<Symbol> getAddressTakenGlobals() {
        return address_taken;
    }

    /**
    * Returns the side effects of a call: those of the callee and its
    * callees, or the effects of an unknown function when the callee has no
    * body in the unit.
    */
    public Summary getSummary(FunctionCall call) {
        String name = call.getFunctionName();
        Procedure callee = (name == null) ? null : unit.findProcedure(name);
        Summary ret = (callee == null) ? null : summaries.get(callee);
        return (ret == null) ? unknown : ret;
    }
}
