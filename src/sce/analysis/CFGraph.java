package sce.analysis;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Stack;

import sce.hir.BreakStatement;
import sce.hir.CompoundStatement;
import sce.hir.ContinueStatement;
import sce.hir.DFIterator;
import sce.hir.DeclarationStatement;
import sce.hir.DoLoop;
import sce.hir.ExpressionStatement;
import sce.hir.ForLoop;
import sce.hir.IfStatement;
import sce.hir.NullStatement;
import sce.hir.Procedure;
import sce.hir.ReturnStatement;
import sce.hir.Statement;
import sce.hir.Traversable;
import sce.hir.WhileLoop;

/**
* CFGraph supports creation of statement-level control flow graphs for a
* procedure. The {@link DFANode} class is used to represent each node in the
* graph. Following key:data pairs are added to the nodes.
*
* <ul>
* <li> ir: the IR evaluated at the node, a statement or the condition or step
*      expression of a loop or an if statement.
* <li> stmt: the statement that owns the node. The condition and step nodes of
*      a loop are owned by the loop; the condition node of an if statement is
*      owned by the if statement.
* <li> true: the successor node for the "taken" branch.
* <li> false: the successor node for the "not-taken" branch.
* <li> tag: additional information about the node, such as "FLOW ENTRY".
* <li> unreachable: Boolean.TRUE if the node cannot be reached from the entry.
* </ul>
*
* Return statements have no successors. Nodes that cannot be reached from the
* entry are kept in the graph, flagged and disconnected from the reachable
* part. The graph is not modified after construction.
*/
public class CFGraph extends DFAGraph {

    // Data structure for building CFG.
    protected Stack<List<DFANode>> break_link;
    protected Stack<List<DFANode>> continue_link;

    /** The procedure the graph is built for */
    private final Procedure procedure;

    /** The synthetic entry node */
    private final DFANode entry;

    /** The first node created for each statement */
    private final Map<Statement, DFANode> stmt_nodes;

    /** Basic block partition of the nodes */
    private final List<BasicBlock> blocks;

    /**
    * Constructs a CFGraph object for the body of the procedure. The entry
    * node contains the string "FLOW ENTRY" for the key "tag".
    *
    * @param proc the procedure.
    * @throws IllegalArgumentException if the procedure has no body.
    */
    public CFGraph(Procedure proc) {
        super();
        if (proc.getBody() == null) {
            throw new IllegalArgumentException(
                    "no body in " + proc.getSymbolName());
        }
        procedure = proc;
        break_link = new Stack<List<DFANode>>();
        continue_link = new Stack<List<DFANode>>();
        stmt_nodes = new IdentityHashMap<Statement, DFANode>();
        // ENTRY insertion.
        entry = new DFANode("tag", "FLOW ENTRY");
        addNode(entry);
        // Build and absorb.
        DFAGraph g = buildGraph(proc.getBody());
        addEdge(entry, g.getFirst());
        absorb(g);
        // Optimize.
        reduce();
        markUnreachable();
        blocks = BasicBlock.partition(this);
    }

    public Procedure getProcedure() {
        return procedure;
    }

    public DFANode getEntry() {
        return entry;
    }

    /**
    * Returns the basic blocks of the graph. Every node belongs to exactly one
    * block.
    */
    public List<BasicBlock> getBasicBlocks() {
        return blocks;
    }

    /**
    * Returns the statement that owns the node.
    *
    * @return the statement, or null for the entry node and empty nodes.
    */
    public static Statement getStatement(DFANode node) {
        Object stmt = node.getData("stmt");
        return (stmt instanceof Statement) ? (Statement)stmt : null;
    }

    /**
    * Returns the IR evaluated at the node.
    */
    public static Traversable getIR(DFANode node) {
        return node.getData("ir");
    }

    /**
    * Returns the main node of a statement: the node of a simple statement or
    * the condition node of an if statement or a loop.
    *
    * @param stmt the statement.
    * @return the node, or null if the statement has no node (compound
    *   statements).
    */
    public DFANode getNode(Statement stmt) {
        return stmt_nodes.get(stmt);
    }

    /**
    * Returns every node owned by the statement.
    */
    public List<DFANode> getNodes(Statement stmt) {
        List<DFANode> ret = new ArrayList<DFANode>(2);
        for (DFANode node : nodes) {
            if (node.getData("stmt") == stmt) {
                ret.add(node);
            }
        }
        return ret;
    }

    public static boolean isUnreachable(DFANode node) {
        return (node.getData("unreachable") != null);
    }

    /**
    * Returns the statements whose nodes are all unreachable, in program
    * order.
    */
    public List<Statement> getUnreachableStatements() {
        List<Statement> ret = new ArrayList<Statement>();
        DFIterator<Statement> iter =
                new DFIterator<Statement>(procedure.getBody(), Statement.class);
        while (iter.hasNext()) {
            Statement stmt = iter.next();
            List<DFANode> owned = getNodes(stmt);
            if (owned.isEmpty()) {
                continue;
            }
            boolean dead = true;
            for (DFANode node : owned) {
                dead &= isUnreachable(node);
            }
            if (dead) {
                ret.add(stmt);
            }
        }
        return ret;
    }

    /**
    * Returns the graph in dot format labeled with the IR of each node.
    */
    public String toDot() {
        return toDot("ir,tag", 1);
    }

    /** Check if the node contains an unconditional jump. */
    protected static boolean isJump(DFANode node) {
        Object ir = node.getData("ir");
        return (ir instanceof BreakStatement ||
                ir instanceof ContinueStatement ||
                ir instanceof ReturnStatement);
    }

    private DFANode newNode(Statement owner, Object ir) {
        DFANode ret = new DFANode("stmt", owner);
        if (ir != null) {
            ret.putData("ir", ir);
        }
        if (!stmt_nodes.containsKey(owner)) {
            stmt_nodes.put(owner, ret);
        }
        return ret;
    }

    /**
    * Builds a control flow graph for a statement.
    */
    protected DFAGraph buildGraph(Statement t) {
        DFAGraph ret;
        if (t instanceof CompoundStatement) {
            ret = buildCompound((CompoundStatement)t);
        } else if (t instanceof IfStatement) {
            ret = buildIf((IfStatement)t);
        } else if (t instanceof ForLoop) {
            ret = buildForLoop((ForLoop)t);
        } else if (t instanceof WhileLoop) {
            ret = buildWhile((WhileLoop)t);
        } else if (t instanceof DoLoop) {
            ret = buildDoLoop((DoLoop)t);
        } else if (t instanceof BreakStatement) {
            ret = new DFAGraph();
            DFANode node = newNode(t, t);
            if (break_link.empty()) {
                throw new IllegalStateException("break outside of a loop");
            }
            break_link.peek().add(node);
            ret.addNode(node);
        } else if (t instanceof ContinueStatement) {
            ret = new DFAGraph();
            DFANode node = newNode(t, t);
            if (continue_link.empty()) {
                throw new IllegalStateException("continue outside of a loop");
            }
            continue_link.peek().add(node);
            ret.addNode(node);
        } else if (t instanceof ExpressionStatement ||
                   t instanceof DeclarationStatement ||
                   t instanceof ReturnStatement ||
                   t instanceof NullStatement) {
            ret = new DFAGraph();
            ret.addNode(newNode(t, t));
        } else {
            throw new InternalError("unexpected statement " +
                    t.getClass().getName());
        }
        return ret;
    }

    // Build a graph for a compound statement.
    protected DFAGraph buildCompound(CompoundStatement stmt) {
        DFAGraph ret = new DFAGraph();
        for (Traversable child : stmt.getChildren()) {
            DFAGraph curr = buildGraph((Statement)child);
            // Jumps are not connected to the next statement.
            if (!ret.isEmpty() && !isJump(ret.getLast())) {
                ret.addEdge(ret.getLast(), curr.getFirst());
            }
            ret.absorb(curr);
        }
        // Insert an empty node if this compound statement has no children.
        if (ret.isEmpty()) {
            ret.addNode(new DFANode("tag", "EMPTY"));
        }
        return ret;
    }

    protected DFAGraph buildIf(IfStatement stmt) {
        DFAGraph ret = new DFAGraph();
        DFANode entry = newNode(stmt, stmt.getControlExpression());
        DFANode exit = new DFANode("tag", "IFEXIT");
        DFAGraph thenG = buildGraph(stmt.getThenStatement());
        entry.putData("true", thenG.getFirst());
        ret.addEdge(entry, thenG.getFirst());
        ret.absorb(thenG);
        if (!isJump(thenG.getLast())) {
            ret.addEdge(thenG.getLast(), exit);
        }
        if (stmt.getElseStatement() != null) {
            DFAGraph elseG = buildGraph(stmt.getElseStatement());
            entry.putData("false", elseG.getFirst());
            ret.addEdge(entry, elseG.getFirst());
            ret.absorb(elseG);
            if (!isJump(elseG.getLast())) {
                ret.addEdge(elseG.getLast(), exit);
            }
        } else {
            entry.putData("false", exit);
            ret.addEdge(entry, exit);
        }
        // The exit node must be the last one even if no edge reaches it.
        ret.moveToLast(exit);
        return ret;
    }

    protected DFAGraph buildForLoop(ForLoop stmt) {
        DFAGraph ret = new DFAGraph();
        DFANode init = null;
        if (stmt.getInitialStatement() != null) {
            init = newNode(stmt.getInitialStatement(),
                           stmt.getInitialStatement());
        }
        DFANode condition = newNode(stmt, stmt.getCondition());
        condition.putData("tag", "FORCOND");
        DFANode step = condition;
        if (stmt.getStep() != null) {
            step = newNode(stmt, stmt.getStep());
            step.putData("tag", "FORSTEP");
        }
        DFANode exit = new DFANode("tag", "FOREXIT");
        // Delay links.
        break_link.push(new ArrayList<DFANode>(4));
        continue_link.push(new ArrayList<DFANode>(4));
        DFAGraph body = buildGraph(stmt.getBody());
        // Add edges; the first node is the init or the condition node and the
        // exit is last.
        if (init != null) {
            ret.addEdge(init, condition);
        }
        ret.addEdge(condition, body.getFirst());
        condition.putData("true", body.getFirst());
        // A missing condition never exits the loop.
        if (stmt.getCondition() != null) {
            ret.addEdge(condition, exit);
            condition.putData("false", exit);
        }
        ret.absorb(body);
        if (!isJump(body.getLast())) {
            ret.addEdge(body.getLast(), step);
        }
        if (step != condition) {
            ret.addEdge(step, condition);
        }
        // Finalize delayed jumps.
        for (DFANode node : break_link.pop()) {
            ret.addEdge(node, exit);
        }
        for (DFANode node : continue_link.pop()) {
            ret.addEdge(node, step);
        }
        ret.moveToLast(exit);
        return ret;
    }

    // Build a graph for a while statement.
    protected DFAGraph buildWhile(WhileLoop stmt) {
        DFAGraph ret = new DFAGraph();
        DFANode condition = newNode(stmt, stmt.getCondition());
        DFANode exit = new DFANode("tag", "WHILEEXIT");
        break_link.push(new ArrayList<DFANode>(4));
        continue_link.push(new ArrayList<DFANode>(4));
        DFAGraph body = buildGraph(stmt.getBody());
        condition.putData("true", body.getFirst());
        condition.putData("false", exit);
        ret.addEdge(condition, body.getFirst());
        ret.addEdge(condition, exit);
        ret.absorb(body);
        if (!isJump(body.getLast())) {
            ret.addEdge(body.getLast(), condition);
        }
        for (DFANode node : break_link.pop()) {
            ret.addEdge(node, exit);
        }
        for (DFANode node : continue_link.pop()) {
            ret.addEdge(node, condition);
        }
        ret.moveToLast(exit);
        return ret;
    }

    // Build a graph for a do while loop.
    protected DFAGraph buildDoLoop(DoLoop stmt) {
        DFAGraph ret = new DFAGraph();
        DFANode condition = newNode(stmt, stmt.getCondition());
        DFANode exit = new DFANode("tag", "DOEXIT");
        break_link.push(new ArrayList<DFANode>(4));
        continue_link.push(new ArrayList<DFANode>(4));
        DFAGraph body = buildGraph(stmt.getBody());
        condition.putData("true", body.getFirst());
        condition.putData("false", exit);
        ret.absorb(body);
        if (!isJump(body.getLast())) {
            ret.addEdge(body.getLast(), condition);
        }
        ret.addEdge(condition, body.getFirst());
        ret.addEdge(condition, exit);
        for (DFANode node : break_link.pop()) {
            ret.addEdge(node, exit);
        }
        for (DFANode node : continue_link.pop()) {
            ret.addEdge(node, condition);
        }
        ret.moveToLast(exit);
        return ret;
    }

    protected boolean removable_node(DFANode node) {
        return (node != entry && node.getSuccs().size() == 1 &&
                node.getData("stmt") == null &&
                !node.getSuccs().contains(node));
    }

    // Reduce graph by removing empty nodes with a single successor.
    protected void reduce() {
        for (DFANode node : new ArrayList<DFANode>(nodes)) {
            if (!removable_node(node)) {
                continue;
            }
            List<DFANode> preds = new ArrayList<DFANode>(node.getPreds());
            DFANode succ = node.getSuccs().iterator().next();
            removeNode(node);
            // Reconnect edges
            for (DFANode pred : preds) {
                // Inherit edge property
                if (pred.getData("true") == node) {
                    pred.putData("true", succ);
                }
                if (pred.getData("false") == node) {
                    pred.putData("false", succ);
                }
                addEdge(pred, succ);
            }
        }
    }

    // Flags the nodes that cannot be reached from the entry and cuts their
    // edges into the reachable part.
    private void markUnreachable() {
        Set<DFANode> reachable = getReachableNodes(entry);
        for (DFANode node : nodes) {
            if (reachable.contains(node)) {
                continue;
            }
            node.putData("unreachable", Boolean.TRUE);
            for (DFANode succ : new ArrayList<DFANode>(node.getSuccs())) {
                if (reachable.contains(succ)) {
                    removeEdge(node, succ);
                }
            }
        }
    }
}
