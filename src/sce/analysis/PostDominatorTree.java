package sce.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sce.hir.PrintTools;

/**
* Post-dominator tree of the reachable part of a {@link CFGraph}. The tree is
* rooted at a single exit node: the only terminal node of the graph, or a
* virtual exit joining all terminal nodes when there are several of them or
* none. Nodes that cannot reach any terminal node, the bodies of infinite
* loops, are connected to the virtual exit through a virtual edge from their
* loop predicate so every analyzed node has a path to the exit.
*
* <p>The post-dominator sets are computed with a backward must data flow
* analysis where each node generates itself.
*/
public class PostDominatorTree extends DataFlowAnalysis {

    private final CFGraph cfg;

    /** Reachable nodes and the virtual exit, if any */
    private final List<DFANode> nodes;

    private final Map<DFANode, Integer> index;

    /** Virtual edges added for the virtual exit */
    private final Map<DFANode, Set<DFANode>> virtual_succs;
    private final Map<DFANode, Set<DFANode>> virtual_preds;

    private DFANode exit;

    private boolean virtual_exit;

    private final Map<DFANode, DFANode> ipdom;

    public PostDominatorTree(CFGraph cfg) {
        super(false, false);
        this.cfg = cfg;
        nodes = new ArrayList<DFANode>();
        index = new IdentityHashMap<DFANode, Integer>();
        virtual_succs = new IdentityHashMap<DFANode, Set<DFANode>>();
        virtual_preds = new IdentityHashMap<DFANode, Set<DFANode>>();
        ipdom = new IdentityHashMap<DFANode, DFANode>();
        for (DFANode node : cfg.getReachableNodes(cfg.getEntry())) {
            nodes.add(node);
        }
        buildExit();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }
        run();
        computeImmediatePostDominators();
    }

    @Override
    public String getPassName() {
        return "[POST-DOMINATORS]";
    }

    // Finds or synthesizes the exit and adds the virtual edges.
    private void buildExit() {
        List<DFANode> terminals = new ArrayList<DFANode>(4);
        for (DFANode node : nodes) {
            if (node.getSuccs().isEmpty()) {
                terminals.add(node);
            }
        }
        if (terminals.size() == 1) {
            exit = terminals.get(0);
            if (getNodesNotReachingExit().isEmpty()) {
                return;
            }
        }
        if (terminals.size() > 1) {
            PrintTools.printlnStatus(2, getPassName(), "MultiExitCfg in",
                    cfg.getProcedure().getSymbolName() + ":",
                    terminals.size(), "terminal nodes, adding a virtual exit");
        }
        exit = new DFANode("tag", "VIRTUAL EXIT");
        virtual_exit = true;
        nodes.add(exit);
        for (DFANode terminal : terminals) {
            addVirtualEdge(terminal, exit);
        }
        // Connects infinite loops until every node reaches the exit.
        List<DFANode> stuck = getNodesNotReachingExit();
        while (!stuck.isEmpty()) {
            DFANode from = stuck.get(0);
            for (DFANode node : stuck) {
                if (node.isPredicate() ||
                        "FORCOND".equals(node.getData("tag"))) {
                    from = node;
                    break;
                }
            }
            PrintTools.printlnStatus(2, getPassName(),
                    "no path to exit from", from, "adding a virtual edge");
            addVirtualEdge(from, exit);
            stuck = getNodesNotReachingExit();
        }
    }

    private void addVirtualEdge(DFANode from, DFANode to) {
        Set<DFANode> succs = virtual_succs.get(from);
        if (succs == null) {
            succs = new LinkedHashSet<DFANode>(2);
            virtual_succs.put(from, succs);
        }
        succs.add(to);
        Set<DFANode> preds = virtual_preds.get(to);
        if (preds == null) {
            preds = new LinkedHashSet<DFANode>();
            virtual_preds.put(to, preds);
        }
        preds.add(from);
    }

    // Returns the analyzed nodes with no path to the exit, in node order.
    private List<DFANode> getNodesNotReachingExit() {
        Set<DFANode> reaching = new LinkedHashSet<DFANode>();
        LinkedList<DFANode> work = new LinkedList<DFANode>();
        reaching.add(exit);
        work.add(exit);
        while (!work.isEmpty()) {
            DFANode node = work.removeFirst();
            for (DFANode pred : getPreds(node)) {
                if (reaching.add(pred)) {
                    work.add(pred);
                }
            }
        }
        List<DFANode> ret = new ArrayList<DFANode>();
        for (DFANode node : nodes) {
            if (!reaching.contains(node)) {
                ret.add(node);
            }
        }
        return ret;
    }

    @Override
    protected List<DFANode> getNodes() {
        return nodes;
    }

    @Override
    protected int getUniverseSize() {
        return nodes.size();
    }

    @Override
    protected BitSet computeGen(DFANode node) {
        BitSet ret = new BitSet(nodes.size());
        ret.set(index.get(node));
        return ret;
    }

    @Override
    protected BitSet computeKill(DFANode node) {
        return new BitSet(nodes.size());
    }

    /**
    * Returns the successors of the node including the virtual edges.
    */
    @Override
    public Collection<DFANode> getSuccs(DFANode node) {
        Set<DFANode> extra = virtual_succs.get(node);
        if (extra == null) {
            return node.getSuccs();
        }
        Set<DFANode> ret = new LinkedHashSet<DFANode>(node.getSuccs());
        ret.addAll(extra);
        return ret;
    }

    /**
    * Returns the predecessors of the node including the virtual edges. Only
    * reachable predecessors are returned.
    */
    @Override
    public Collection<DFANode> getPreds(DFANode node) {
        Set<DFANode> ret = new LinkedHashSet<DFANode>();
        for (DFANode pred : node.getPreds()) {
            if (!CFGraph.isUnreachable(pred)) {
                ret.add(pred);
            }
        }
        Set<DFANode> extra = virtual_preds.get(node);
        if (extra != null) {
            ret.addAll(extra);
        }
        return ret;
    }

    private void computeImmediatePostDominators() {
        for (DFANode node : nodes) {
            BitSet strict = getBefore(node);
            strict.clear(index.get(node));
            int size = strict.cardinality();
            for (int i = strict.nextSetBit(0); i >= 0;
                    i = strict.nextSetBit(i + 1)) {
                if (getBefore(nodes.get(i)).cardinality() == size) {
                    ipdom.put(node, nodes.get(i));
                    break;
                }
            }
        }
    }

    /** Returns the root of the tree. */
    public DFANode getExit() {
        return exit;
    }

    /** Checks if the exit was synthesized. */
    public boolean hasVirtualExit() {
        return virtual_exit;
    }

    /**
    * Returns the nodes in the tree: the reachable CFG nodes and the virtual
    * exit.
    */
    public List<DFANode> getTreeNodes() {
        return nodes;
    }

    public boolean contains(DFANode node) {
        return index.containsKey(node);
    }

    /**
    * Returns the nodes that post-dominate the node, including itself.
    *
    * @throws IllegalArgumentException if the node is unreachable.
    */
    public Set<DFANode> getPostDominators(DFANode node) {
        BitSet bits = getBefore(node);
        Set<DFANode> ret = new LinkedHashSet<DFANode>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            ret.add(nodes.get(i));
        }
        return ret;
    }

    /**
    * Checks if {@code a} post-dominates {@code b}. Every node
    * post-dominates itself.
    */
    public boolean postDominates(DFANode a, DFANode b) {
        Integer i = index.get(a);
        if (i == null || !index.containsKey(b)) {
            return false;
        }
        return getBefore(b).get(i);
    }

    /**
    * Returns the immediate post-dominator of the node.
    *
    * @return the parent in the tree, or null for the exit.
    */
    public DFANode getImmediatePostDominator(DFANode node) {
        return ipdom.get(node);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        sb.append("PostDominatorTree {");
        for (DFANode node : nodes) {
            sb.append(PrintTools.line_sep).append("  ").append(node)
              .append(" -> ").append(ipdom.get(node));
        }
        sb.append(PrintTools.line_sep).append("}");
        return sb.toString();
    }
}
