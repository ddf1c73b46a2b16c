package sce.analysis;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import sce.hir.FunctionCall;
import sce.hir.IRTools;
import sce.hir.Procedure;
import sce.hir.Symbol;
import sce.hir.SymbolTools;
import sce.hir.TranslationUnit;

/**
* What the indirect accesses and the calls of one procedure may touch.
*
* <p>The <i>aliasable</i> variables are the arrays and the address-taken
* variables of the procedure, and the globals whose address is taken anywhere
* in the unit. An indirect access may touch every aliasable variable with the
* same base type as the accessed object, and always touches
* {@link MemorySymbol#UNKNOWN}. A call may modify and read what
* {@link ModRefAnalysis} reports for its callee.
*/
public final class MemoryModel {

    private final Set<Symbol> aliasable;

    private final Set<Symbol> variables;

    private final ModRefAnalysis mod_ref;

    /**
    * Builds the model of a procedure. A procedure that is not part of a
    * translation unit is treated as calling only unknown functions of a unit
    * without globals.
    */
    public MemoryModel(Procedure proc) {
        TranslationUnit unit = (proc.getParent() instanceof TranslationUnit) ?
                (TranslationUnit)proc.getParent() : null;
        mod_ref = (unit == null) ? null : new ModRefAnalysis(unit);
        Set<Symbol> set = DataFlowTools.getVariables(proc);
        Set<Symbol> address_taken = SymbolTools.getAddressTakenSymbols(proc);
        Set<Symbol> alias_set = new LinkedHashSet<Symbol>();
        for (Symbol symbol : set) {
            if (SymbolTools.isArray(symbol) ||
                    address_taken.contains(symbol)) {
                alias_set.add(symbol);
            }
        }
        if (mod_ref != null) {
            alias_set.addAll(mod_ref.getAddressTakenGlobals());
            for (FunctionCall call :
                    IRTools.getFunctionCalls(proc.getBody())) {
                ModRefAnalysis.Summary summary = mod_ref.getSummary(call);
                set.addAll(summary.getMod());
                set.addAll(summary.getRef());
            }
        }
        set.addAll(alias_set);
        set.add(MemorySymbol.UNKNOWN);
        aliasable = Collections.unmodifiableSet(alias_set);
        variables = Collections.unmodifiableSet(set);
    }

    /** Returns the variables that indirect writes may modify. */
    public Set<Symbol> getAliasableSymbols() {
        return aliasable;
    }

    /**
    * Returns every variable the dataflow of the procedure tracks: its
    * parameters and locals, the globals it or its callees access, and the
    * unknown memory.
    */
    public Set<Symbol> getVariables() {
        return variables;
    }

    /**
    * Returns the aliasable variables that an indirect access through the
    * given base symbol may touch: those with the same base type, or all of
    * them when the base is unknown.
    */
    public Set<Symbol> getTargets(Symbol base) {
        if (base == null) {
            return aliasable;
        }
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        for (Symbol symbol : aliasable) {
            if (SymbolTools.getBaseType(symbol).equals(
                    SymbolTools.getBaseType(base))) {
                ret.add(symbol);
            }
        }
        return ret;
    }

    /** Returns the side effects of a call, null outside a unit. */
    ModRefAnalysis.Summary getSummary(FunctionCall call) {
        return (mod_ref == null) ? null : mod_ref.getSummary(call);
    }
}
