package sce.analysis;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sce.hir.DFIterator;
import sce.hir.FunctionCall;
import sce.hir.Procedure;
import sce.hir.TranslationUnit;

/**
* A static call graph for a translation unit. Only procedures defined in the
* unit are nodes; calls to external functions are ignored.
*/
public class CallGraph {

    public class Node {

        private Procedure proc;

        private List<FunctionCall> callers;

        private List<Procedure> callees;

        public Node(Procedure proc) {
            this.proc = proc;
            callers = new ArrayList<FunctionCall>(1);
            callees = new ArrayList<Procedure>(1);
        }

        public void addCaller(FunctionCall call) {
            callers.add(call);
        }

        public void addCallee(Procedure proc) {
            if (!callees.contains(proc)) {
                callees.add(proc);
            }
        }

        /** Returns the call sites of the procedure. */
        public List<FunctionCall> getCallers() {
            return callers;
        }

        public List<Procedure> getCallees() {
            return callees;
        }

        public Procedure getProcedure() {
            return proc;
        }
    }

    private Node root;

    private Map<Procedure, Node> callgraph;

    /**
    * Creates a call graph for the unit. The graph is rooted at the procedure
    * called "main" if it exists.
    *
    * @param unit the translation unit.
    */
    public CallGraph(TranslationUnit unit) {
        callgraph = new LinkedHashMap<Procedure, Node>();
        for (Procedure proc : unit.getProcedures()) {
            Node node = new Node(proc);
            if (proc.getSymbolName().equals("main")) {
                root = node;
            }
            callgraph.put(proc, node);
        }
        for (Procedure proc : unit.getProcedures()) {
            DFIterator<FunctionCall> iter =
                    new DFIterator<FunctionCall>(proc.getBody(),
                                                 FunctionCall.class);
            while (iter.hasNext()) {
                FunctionCall call = iter.next();
                String name = call.getFunctionName();
                Procedure callee = (name == null) ?
                        null : unit.findProcedure(name);
                // External and undefined functions are not nodes.
                if (callee == null || !callgraph.containsKey(callee)) {
                    continue;
                }
                callgraph.get(proc).addCallee(callee);
                callgraph.get(callee).addCaller(call);
            }
        }
    }

    public Node getNode(Procedure proc) {
        return callgraph.get(proc);
    }

    /**
    * Access the root node of the graph.
    *
    * @return the node of "main", or null.
    */
    public Node getRoot() {
        return root;
    }

    /**
    * Returns the procedures called by the procedure.
    */
    public List<Procedure> getCallees(Procedure proc) {
        Node node = callgraph.get(proc);
        return (node == null) ? new ArrayList<Procedure>(0) : node.getCallees();
    }

    public boolean callsSelf(Procedure proc) {
        Node n = callgraph.get(proc);
        return (n != null && n.getCallees().contains(proc));
    }

    /**
    * Determines if the procedure is a leaf of the call graph.
    *
    * @return true if the procedure calls no procedure of the unit.
    */
    public boolean isLeaf(Procedure proc) {
        return getCallees(proc).isEmpty();
    }

    /**
    * Checks if the procedure is on a cycle of the call graph.
    */
    public boolean isRecursive(Procedure proc) {
        for (Procedure callee : getCallees(proc)) {
            if (reaches(callee, proc)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Checks if a chain of calls, possibly empty, leads from one procedure to
    * another.
    */
    public boolean reaches(Procedure from, Procedure to) {
        Set<Procedure> seen =
                Collections.newSetFromMap(
                        new IdentityHashMap<Procedure, Boolean>());
        List<Procedure> horizon = new ArrayList<Procedure>();
        horizon.add(from);
        seen.add(from);
        while (!horizon.isEmpty()) {
            Procedure p = horizon.remove(horizon.size() - 1);
            if (p == to) {
                return true;
            }
            for (Procedure o : getCallees(p)) {
                if (seen.add(o)) {
                    horizon.add(o);
                }
            }
        }
        return false;
    }

    /**
    * Returns the procedures reachable from the procedure through one or more
    * calls.
    */
    public Set<Procedure> getTransitiveCallees(Procedure proc) {
        Set<Procedure> ret = new LinkedHashSet<Procedure>();
        List<Procedure> horizon = new ArrayList<Procedure>(getCallees(proc));
        while (!horizon.isEmpty()) {
            Procedure p = horizon.remove(0);
            if (ret.add(p)) {
                horizon.addAll(getCallees(p));
            }
        }
        return ret;
    }

    /**
    * Prints the graph to a stream in graphviz format.
    *
    * @param stream The stream on which to print the graph.
    */
    public void print(OutputStream stream) {
        PrintStream p = new PrintStream(stream);
        p.println("digraph {");
        for (Procedure proc : callgraph.keySet()) {
            for (Procedure callee : getCallees(proc)) {
                p.println("  " + proc.getSymbolName() + " -> " +
                          callee.getSymbolName() + ";");
            }
        }
        p.println("}");
        p.flush();
    }
}
