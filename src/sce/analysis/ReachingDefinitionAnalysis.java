package sce.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import sce.hir.Procedure;
import sce.hir.Symbol;

/**
* Forward may analysis that computes the definitions reaching each node of a
* CFG. Definition sites are assignments, increments and decrements,
* declarator initializers, the may-definitions of pointer and array writes
* and of address-taken call arguments, and the parameters, which are defined
* at the entry node. Only definite definitions kill.
*/
public class ReachingDefinitionAnalysis extends DataFlowAnalysis {

    private final CFGraph cfg;

    private final MemoryModel model;

    /** All definitions; the index is the bit position */
    private final List<Definition> defs;

    /** Definitions of each node */
    private final Map<DFANode, List<Definition>> node_defs;

    /** Definitions of each variable */
    private final Map<Symbol, List<Definition>> symbol_defs;

    /**
    * Collects the definition sites and computes the reaching definitions.
    *
    * @param cfg the control flow graph of a procedure.
    * @param model the memory model of the procedure.
    */
    public ReachingDefinitionAnalysis(CFGraph cfg, MemoryModel model) {
        super(true, true);
        this.cfg = cfg;
        this.model = model;
        defs = new ArrayList<Definition>();
        node_defs = new IdentityHashMap<DFANode, List<Definition>>();
        symbol_defs = new IdentityHashMap<Symbol, List<Definition>>();
        collectDefinitions();
        run();
    }

    @Override
    public String getPassName() {
        return "[REACHING-DEFS]";
    }

    private void collectDefinitions() {
        Procedure proc = cfg.getProcedure();
        for (DFANode node : cfg.getNodes()) {
            List<Definition> list = new ArrayList<Definition>(2);
            if (node == cfg.getEntry()) {
                for (int i = 0; i < proc.getNumParameters(); i++) {
                    list.add(newDefinition(proc.getParameter(i), node, true));
                }
            } else {
                Map<Symbol, Boolean> node_symbols = DataFlowTools
                        .getDefSymbols(CFGraph.getIR(node), model);
                for (Symbol symbol : node_symbols.keySet()) {
                    list.add(newDefinition(symbol, node,
                                           node_symbols.get(symbol)));
                }
            }
            node_defs.put(node, list);
        }
    }

    private Definition newDefinition(Symbol symbol, DFANode node,
                                     boolean must) {
        Definition ret = new Definition(defs.size(), symbol, node, must);
        defs.add(ret);
        List<Definition> list = symbol_defs.get(symbol);
        if (list == null) {
            list = new ArrayList<Definition>(4);
            symbol_defs.put(symbol, list);
        }
        list.add(ret);
        return ret;
    }

    @Override
    protected List<DFANode> getNodes() {
        return cfg.getNodes();
    }

    @Override
    protected int getUniverseSize() {
        return defs.size();
    }

    @Override
    protected BitSet computeGen(DFANode node) {
        BitSet ret = new BitSet(defs.size());
        for (Definition def : node_defs.get(node)) {
            ret.set(def.getId());
        }
        return ret;
    }

    @Override
    protected BitSet computeKill(DFANode node) {
        BitSet ret = new BitSet(defs.size());
        for (Definition def : node_defs.get(node)) {
            if (def.isMust()) {
                for (Definition other : symbol_defs.get(def.getSymbol())) {
                    ret.set(other.getId());
                }
            }
        }
        return ret;
    }

    /** Returns every definition site in the procedure. */
    public List<Definition> getDefinitions() {
        return defs;
    }

    /**
    * Returns the definitions of the variable anywhere in the procedure.
    *
    * @return the definitions, empty if the variable is never defined.
    */
    public List<Definition> getDefinitions(Symbol symbol) {
        List<Definition> ret = symbol_defs.get(symbol);
        return (ret == null) ? new ArrayList<Definition>(0) : ret;
    }

    /** Returns the definitions made by the node. */
    public List<Definition> getDefinitions(DFANode node) {
        return node_defs.get(node);
    }

    /**
    * Returns the definitions reaching the point before the node.
    */
    public List<Definition> getReachingDefinitions(DFANode node) {
        BitSet in = getBefore(node);
        List<Definition> ret = new ArrayList<Definition>(in.cardinality());
        for (int i = in.nextSetBit(0); i >= 0; i = in.nextSetBit(i + 1)) {
            ret.add(defs.get(i));
        }
        return ret;
    }

    /**
    * Returns the definitions of the variable reaching the point before the
    * node.
    */
    public List<Definition> getReachingDefinitions(DFANode node,
                                                   Symbol symbol) {
        List<Definition> ret = new ArrayList<Definition>(2);
        for (Definition def : getReachingDefinitions(node)) {
            if (def.getSymbol() == symbol) {
                ret.add(def);
            }
        }
        return ret;
    }
}
