package sce.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sce.hir.Symbol;

/**
* Backward may analysis that computes the variables live at each node of a
* CFG. A variable is live at a point if some path from the point reads it
* before a definite definition.
*/
public class LiveVariableAnalysis extends DataFlowAnalysis {

    private final CFGraph cfg;

    private final MemoryModel model;

    private final List<Symbol> symbols;

    private final Map<Symbol, Integer> index;

    /**
    * Computes the live variables.
    *
    * @param cfg the control flow graph of a procedure.
    * @param model the memory model of the procedure.
    */
    public LiveVariableAnalysis(CFGraph cfg, MemoryModel model) {
        super(false, true);
        this.cfg = cfg;
        this.model = model;
        symbols = new ArrayList<Symbol>(model.getVariables());
        index = new IdentityHashMap<Symbol, Integer>();
        for (int i = 0; i < symbols.size(); i++) {
            index.put(symbols.get(i), i);
        }
        run();
    }

    @Override
    public String getPassName() {
        return "[LIVE-VARS]";
    }

    @Override
    protected List<DFANode> getNodes() {
        return cfg.getNodes();
    }

    @Override
    protected int getUniverseSize() {
        return symbols.size();
    }

    @Override
    protected BitSet computeGen(DFANode node) {
        return toBits(DataFlowTools.getUseSymbols(CFGraph.getIR(node),
                                                  model));
    }

    @Override
    protected BitSet computeKill(DFANode node) {
        BitSet ret = new BitSet(symbols.size());
        Map<Symbol, Boolean> defs = DataFlowTools.getDefSymbols(
                CFGraph.getIR(node), model);
        for (Symbol symbol : defs.keySet()) {
            Integer i = index.get(symbol);
            if (defs.get(symbol) && i != null) {
                ret.set(i);
            }
        }
        return ret;
    }

    private BitSet toBits(Set<Symbol> set) {
        BitSet ret = new BitSet(symbols.size());
        for (Symbol symbol : set) {
            Integer i = index.get(symbol);
            if (i != null) {
                ret.set(i);
            }
        }
        return ret;
    }

    private Set<Symbol> toSymbols(BitSet bits) {
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            ret.add(symbols.get(i));
        }
        return ret;
    }

    /** Returns the variables live before the node executes. */
    public Set<Symbol> getLiveIn(DFANode node) {
        return toSymbols(getBefore(node));
    }

    /** Returns the variables live after the node executes. */
    public Set<Symbol> getLiveOut(DFANode node) {
        return toSymbols(getAfter(node));
    }
}
