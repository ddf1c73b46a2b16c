package sce.analysis;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import sce.hir.PrintTools;
import sce.hir.Tools;

/**
 * A directed graph of {@link DFANode}s. Nodes are listed in the order they
 * were added; the CFG builders rely on this to find the entry of a sub graph
 * at the front of the list and its exit at the back.
 */
public class DFAGraph {

    protected ArrayList<DFANode> nodes;

    public DFAGraph() {
        nodes = new ArrayList<DFANode>();
    }

    /** Appends <b>node</b> unless it is already in the graph. */
    public void addNode(DFANode node) {
        if (!Tools.containsByReference(nodes, node)) {
            nodes.add(node);
        }
    }

    /** Appends the nodes of <b>other</b>, keeping their order. */
    public void absorb(DFAGraph other) {
        for (DFANode node : other.nodes) {
            addNode(node);
        }
    }

    /** Puts <b>node</b> at the back of the list, adding it if absent. */
    protected void moveToLast(DFANode node) {
        int index = Tools.identityIndexOf(nodes, node);
        if (index >= 0) {
            nodes.remove(index);
        }
        nodes.add(node);
    }

    public DFANode getFirst() {
        return nodes.get(0);
    }

    public DFANode getLast() {
        return nodes.get(nodes.size() - 1);
    }

    public List<DFANode> getNodes() {
        return nodes;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    /** Links <b>from</b> to <b>to</b>, adding either node if needed. */
    public void addEdge(DFANode from, DFANode to) {
        addNode(from);
        addNode(to);
        from.addSucc(to);
        to.addPred(from);
    }

    public void removeEdge(DFANode from, DFANode to) {
        from.removeSucc(to);
        to.removePred(from);
    }

    /** Drops <b>node</b> and every edge touching it. */
    public void removeNode(DFANode node) {
        int index = Tools.identityIndexOf(nodes, node);
        if (index < 0) {
            return;
        }
        for (DFANode pred : node.getPreds()) {
            pred.removeSucc(node);
        }
        for (DFANode succ : node.getSuccs()) {
            succ.removePred(node);
        }
        nodes.remove(index);
    }

    /**
     * Returns <b>root</b> and the nodes reachable from it, breadth first.
     */
    public Set<DFANode> getReachableNodes(DFANode root) {
        Set<DFANode> ret = new LinkedHashSet<DFANode>();
        Deque<DFANode> work = new ArrayDeque<DFANode>();
        ret.add(root);
        work.add(root);
        while (!work.isEmpty()) {
            for (DFANode succ : work.poll().getSuccs()) {
                if (ret.add(succ)) {
                    work.add(succ);
                }
            }
        }
        return ret;
    }

    /**
     * Renders the graph for graphviz. Each node is labeled with up to
     * <b>num</b> of the attributes named in <b>keys</b>.
     */
    public String toDot(String keys, int num) {
        String sep = PrintTools.line_sep;
        StringBuilder sb = new StringBuilder(64 * nodes.size());
        sb.append("digraph cfg {").append(sep);
        for (int i = 0; i < nodes.size(); i++) {
            sb.append("  n").append(i).append(" ");
            sb.append(nodes.get(i).toDot(keys, num)).append(sep);
        }
        for (int i = 0; i < nodes.size(); i++) {
            for (DFANode succ : nodes.get(i).getSuccs()) {
                sb.append("  n").append(i).append(" -> n");
                sb.append(Tools.identityIndexOf(nodes, succ)).append(";");
                sb.append(sep);
            }
        }
        sb.append("}").append(sep);
        return sb.toString();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + nodes;
    }
}
