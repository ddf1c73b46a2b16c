package sce.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sce.hir.PrintTools;

/**
* Iterative bit-vector data flow analysis over a set of graph nodes. A
* subclass fixes the universe of facts, the direction, the meet operation and
* the gen/kill sets of each node; {@link #run()} computes the fixpoint with a
* work list.
*
* <p>The sets are kept in the analysis object, never in the nodes, so a graph
* can be shared by several analyses. The "before" set of a node holds the
* facts at the program point before the node executes and the "after" set
* those after it, for both directions.
*/
public abstract class DataFlowAnalysis {

    /** Forward (true) or backward (false) propagation */
    protected final boolean forward;

    /** Union (true) or intersection (false) at join points */
    protected final boolean may;

    private Map<DFANode, BitSet> before;
    private Map<DFANode, BitSet> after;
    private Map<DFANode, BitSet> gen;
    private Map<DFANode, BitSet> kill;

    private boolean done;

    protected DataFlowAnalysis(boolean forward, boolean may) {
        this.forward = forward;
        this.may = may;
    }

    /** Returns a short name used in log messages. */
    public abstract String getPassName();

    /** Returns the nodes the analysis runs on, in a good iteration order. */
    protected abstract List<DFANode> getNodes();

    /** Returns the number of facts in the universe. */
    protected abstract int getUniverseSize();

    /** Returns the facts generated by the node. */
    protected abstract BitSet computeGen(DFANode node);

    /** Returns the facts killed by the node. */
    protected abstract BitSet computeKill(DFANode node);

    /**
    * Returns the facts flowing into a node that has no predecessor in the
    * direction of the analysis. The default is the empty set.
    */
    protected BitSet getBoundary(DFANode node) {
        return new BitSet();
    }

    /** Returns the successors of the node that take part in the analysis. */
    protected Collection<DFANode> getSuccs(DFANode node) {
        return node.getSuccs();
    }

    /** Returns the predecessors of the node that take part in the analysis. */
    protected Collection<DFANode> getPreds(DFANode node) {
        return node.getPreds();
    }

    /**
    * Computes the fixpoint. Calling this method more than once has no
    * effect.
    */
    public void run() {
        if (done) {
            return;
        }
        List<DFANode> nodes = getNodes();
        int size = getUniverseSize();
        before = new IdentityHashMap<DFANode, BitSet>();
        after = new IdentityHashMap<DFANode, BitSet>();
        gen = new IdentityHashMap<DFANode, BitSet>();
        kill = new IdentityHashMap<DFANode, BitSet>();
        Map<DFANode, BitSet> input = forward ? before : after;
        Map<DFANode, BitSet> output = forward ? after : before;
        for (DFANode node : nodes) {
            gen.put(node, computeGen(node));
            kill.put(node, computeKill(node));
            BitSet init = new BitSet(size);
            if (!may) {
                init.set(0, size);
            }
            input.put(node, new BitSet(size));
            output.put(node, init);
        }
        List<DFANode> order = new ArrayList<DFANode>(nodes);
        if (!forward) {
            Collections.reverse(order);
        }
        Set<DFANode> work = new LinkedHashSet<DFANode>(order);
        int iterations = 0;
        while (!work.isEmpty()) {
            DFANode node = work.iterator().next();
            work.remove(node);
            iterations++;
            BitSet in = null;
            for (DFANode pred : (forward ? getPreds(node) : getSuccs(node))) {
                BitSet pred_out = output.get(pred);
                if (pred_out == null) {
                    continue;
                }
                if (in == null) {
                    in = (BitSet)pred_out.clone();
                } else if (may) {
                    in.or(pred_out);
                } else {
                    in.and(pred_out);
                }
            }
            if (in == null) {
                in = getBoundary(node);
            }
            BitSet out = (BitSet)in.clone();
            out.andNot(kill.get(node));
            out.or(gen.get(node));
            input.put(node, in);
            if (!out.equals(output.get(node))) {
                output.put(node, out);
                for (DFANode succ :
                        (forward ? getSuccs(node) : getPreds(node))) {
                    if (output.containsKey(succ)) {
                        work.add(succ);
                    }
                }
            }
        }
        done = true;
        PrintTools.printlnStatus(3, getPassName(), "converged after",
                                 iterations, "node visits");
    }

    /**
    * Returns the facts at the point before the node.
    *
    * @throws IllegalStateException if the analysis has not been run.
    * @throws IllegalArgumentException if the node is not analyzed.
    */
    public BitSet getBefore(DFANode node) {
        return lookup(before, node);
    }

    /**
    * Returns the facts at the point after the node.
    */
    public BitSet getAfter(DFANode node) {
        return lookup(after, node);
    }

    private BitSet lookup(Map<DFANode, BitSet> sets, DFANode node) {
        if (!done) {
            throw new IllegalStateException(getPassName() + " has not run");
        }
        BitSet ret = sets.get(node);
        if (ret == null) {
            throw new IllegalArgumentException("node is not analyzed");
        }
        return (BitSet)ret.clone();
    }
}
