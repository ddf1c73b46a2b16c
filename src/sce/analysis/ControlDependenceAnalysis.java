package sce.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
* Computes control dependence between CFG nodes from a
* {@link PostDominatorTree} with the Ferrante-Ottenstein-Warren condition: a
* node N is control dependent on a branch node P if P has a successor S such
* that N post-dominates S, and N does not strictly post-dominate P. For each
* edge P-&gt;S where S does not post-dominate P, the nodes on the tree path
* from S up to, but excluding, the immediate post-dominator of P are the
* nodes control dependent on P.
*/
public class ControlDependenceAnalysis {

    private final PostDominatorTree pdt;

    /** Branch nodes each node is control dependent on */
    private final Map<DFANode, Set<DFANode>> controllers;

    public ControlDependenceAnalysis(PostDominatorTree pdt) {
        this.pdt = pdt;
        controllers = new IdentityHashMap<DFANode, Set<DFANode>>();
        compute();
    }

    private void compute() {
        for (DFANode p : pdt.getTreeNodes()) {
            Collection<DFANode> succs = pdt.getSuccs(p);
            if (succs.size() < 2) {
                continue;
            }
            DFANode stop = pdt.getImmediatePostDominator(p);
            for (DFANode s : succs) {
                if (pdt.postDominates(s, p)) {
                    continue;
                }
                DFANode runner = s;
                while (runner != null && runner != stop) {
                    addController(runner, p);
                    runner = pdt.getImmediatePostDominator(runner);
                }
            }
        }
    }

    private void addController(DFANode node, DFANode p) {
        Set<DFANode> set = controllers.get(node);
        if (set == null) {
            set = new LinkedHashSet<DFANode>(2);
            controllers.put(node, set);
        }
        set.add(p);
    }

    /**
    * Returns the branch nodes that decide whether the node executes.
    *
    * @return the controlling nodes, empty for unreachable nodes and nodes
    *   that always execute.
    */
    public Set<DFANode> getControllers(DFANode node) {
        Set<DFANode> ret = controllers.get(node);
        return (ret == null) ? new LinkedHashSet<DFANode>(0) : ret;
    }

    /**
    * Returns the nodes that are control dependent on the branch node.
    */
    public List<DFANode> getControlled(DFANode p) {
        List<DFANode> ret = new ArrayList<DFANode>();
        for (DFANode node : pdt.getTreeNodes()) {
            if (getControllers(node).contains(p)) {
                ret.add(node);
            }
        }
        return ret;
    }

    public PostDominatorTree getPostDominatorTree() {
        return pdt;
    }
}
