package sce.analysis;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import sce.hir.Statement;
import sce.hir.Tools;

/**
* A maximal straight-line chain of CFG nodes. Control enters a block only at
* its first node and leaves only from its last node; a predicate node always
* ends its block.
*/
public class BasicBlock {

    private final int id;

    ArrayList<DFANode> nodes;
    ArrayList<BasicBlock> preds;
    ArrayList<BasicBlock> succs;

    private boolean unreachable;

    BasicBlock(int id) {
        this.id = id;
        nodes = new ArrayList<DFANode>();
        preds = new ArrayList<BasicBlock>(2);
        succs = new ArrayList<BasicBlock>(2);
    }

    public int getId() {
        return id;
    }

    public List<DFANode> getNodes() {
        return nodes;
    }

    /**
    * Returns the statements owning the nodes of this block, without
    * duplicates and in node order.
    */
    public List<Statement> getStatements() {
        List<Statement> ret = new ArrayList<Statement>(nodes.size());
        for (DFANode node : nodes) {
            Statement stmt = CFGraph.getStatement(node);
            if (stmt != null && !Tools.containsByReference(ret, stmt)) {
                ret.add(stmt);
            }
        }
        return ret;
    }

    public List<BasicBlock> getPreds() {
        return preds;
    }

    /**
    * Returns the successor blocks. A predicate block lists the taken branch
    * first.
    */
    public List<BasicBlock> getSuccs() {
        return succs;
    }

    public boolean isUnreachable() {
        return unreachable;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(40);
        sb.append("B").append(id);
        if (unreachable) {
            sb.append("(unreachable)");
        }
        sb.append(" ->");
        for (BasicBlock succ : succs) {
            sb.append(" B").append(succ.id);
        }
        return sb.toString();
    }

    // A node starts a block unless it has a single predecessor whose only
    // successor is the node.
    private static boolean isLeader(CFGraph cfg, DFANode node) {
        if (node == cfg.getEntry() || node.getPreds().size() != 1) {
            return true;
        }
        DFANode pred = node.getPreds().iterator().next();
        return (pred.getSuccs().size() != 1);
    }

    /**
    * Partitions the nodes of the graph into basic blocks.
    *
    * @param cfg the control flow graph.
    * @return the blocks, the one starting with the entry node first.
    */
    static List<BasicBlock> partition(CFGraph cfg) {
        List<BasicBlock> ret = new ArrayList<BasicBlock>();
        Map<DFANode, BasicBlock> owner =
                new IdentityHashMap<DFANode, BasicBlock>();
        for (DFANode node : cfg.getNodes()) {
            if (isLeader(cfg, node)) {
                ret.add(grow(cfg, node, ret.size(), owner));
            }
        }
        // Cycles without a leader only occur in unreachable code.
        for (DFANode node : cfg.getNodes()) {
            if (!owner.containsKey(node)) {
                ret.add(grow(cfg, node, ret.size(), owner));
            }
        }
        for (BasicBlock block : ret) {
            DFANode last = block.nodes.get(block.nodes.size() - 1);
            List<DFANode> targets = new ArrayList<DFANode>(last.getSuccs());
            DFANode taken = last.getData("true");
            if (taken != null && targets.remove(taken)) {
                targets.add(0, taken);
            }
            for (DFANode succ : targets) {
                BasicBlock succ_block = owner.get(succ);
                block.succs.add(succ_block);
                succ_block.preds.add(block);
            }
            block.unreachable = CFGraph.isUnreachable(block.nodes.get(0));
        }
        return ret;
    }

    private static BasicBlock grow(CFGraph cfg, DFANode leader, int id,
                                   Map<DFANode, BasicBlock> owner) {
        BasicBlock ret = new BasicBlock(id);
        DFANode node = leader;
        while (true) {
            ret.nodes.add(node);
            owner.put(node, ret);
            if (node.getSuccs().size() != 1) {
                break;
            }
            DFANode next = node.getSuccs().iterator().next();
            if (owner.containsKey(next) || isLeader(cfg, next)) {
                break;
            }
            node = next;
        }
        return ret;
    }
}
