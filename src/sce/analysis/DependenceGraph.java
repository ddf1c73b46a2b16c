package sce.analysis;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sce.hir.PrintTools;
import sce.hir.Statement;
import sce.hir.Symbol;

/**
* Statement-level program dependence graph of a procedure. Data edges link a
* statement to the statements whose definitions reach its uses; control
* edges link a statement to the statements owning its controlling
* predicates. Edges never link a statement to itself.
*/
public class DependenceGraph {

    private final Set<DependenceEdge> edges;

    private final Map<Statement, Set<DependenceEdge>> out_edges;

    private final Map<Statement, Set<DependenceEdge>> in_edges;

    /**
    * Builds the graph from the analyses of a procedure.
    *
    * @param cfg the control flow graph.
    * @param rd the reaching definitions over {@code cfg}.
    * @param cd the control dependences over {@code cfg}.
    * @param model the memory model of the procedure.
    */
    public DependenceGraph(CFGraph cfg, ReachingDefinitionAnalysis rd,
                           ControlDependenceAnalysis cd,
                           MemoryModel model) {
        edges = new LinkedHashSet<DependenceEdge>();
        out_edges = new IdentityHashMap<Statement, Set<DependenceEdge>>();
        in_edges = new IdentityHashMap<Statement, Set<DependenceEdge>>();
        for (DFANode node : cfg.getNodes()) {
            Statement stmt = CFGraph.getStatement(node);
            if (stmt == null) {
                continue;
            }
            Set<Symbol> uses =
                    DataFlowTools.getUseSymbols(CFGraph.getIR(node), model);
            for (Symbol use : uses) {
                for (Definition def : rd.getReachingDefinitions(node, use)) {
                    Statement def_stmt = def.getStatement();
                    if (def_stmt != null && def_stmt != stmt) {
                        addEdge(new DependenceEdge(stmt, def_stmt,
                                DependenceEdge.Kind.DATA, use));
                    }
                }
            }
            for (DFANode p : cd.getControllers(node)) {
                Statement p_stmt = CFGraph.getStatement(p);
                if (p_stmt != null && p_stmt != stmt) {
                    addEdge(new DependenceEdge(stmt, p_stmt,
                            DependenceEdge.Kind.CONTROL, null));
                }
            }
        }
        PrintTools.printlnStatus(3, "[DEPENDENCE-GRAPH]",
                cfg.getProcedure().getSymbolName(), "has", edges.size(),
                "edges");
        if (PrintTools.getVerbosity() >= 4) {
            for (DependenceEdge edge : edges) {
                PrintTools.printlnStatus(4, "  ", edge);
            }
        }
    }

    private void addEdge(DependenceEdge edge) {
        if (!edges.add(edge)) {
            return;
        }
        lookup(out_edges, edge.getFrom()).add(edge);
        lookup(in_edges, edge.getTo()).add(edge);
    }

    private static Set<DependenceEdge>
            lookup(Map<Statement, Set<DependenceEdge>> map, Statement stmt) {
        Set<DependenceEdge> ret = map.get(stmt);
        if (ret == null) {
            ret = new LinkedHashSet<DependenceEdge>(4);
            map.put(stmt, ret);
        }
        return ret;
    }

    /** Returns all edges in insertion order. */
    public Set<DependenceEdge> getEdges() {
        return edges;
    }

    /**
    * Returns the edges leaving the statement: what the statement depends on.
    */
    public List<DependenceEdge> getDependences(Statement stmt) {
        Set<DependenceEdge> ret = out_edges.get(stmt);
        return (ret == null) ?
                new ArrayList<DependenceEdge>(0) :
                new ArrayList<DependenceEdge>(ret);
    }

    /**
    * Returns the edges entering the statement: what depends on the
    * statement.
    */
    public List<DependenceEdge> getDependents(Statement stmt) {
        Set<DependenceEdge> ret = in_edges.get(stmt);
        return (ret == null) ?
                new ArrayList<DependenceEdge>(0) :
                new ArrayList<DependenceEdge>(ret);
    }

    /**
    * Checks if there is an edge of the given kind from one statement to
    * another.
    */
    public boolean dependsOn(Statement from, Statement to,
                             DependenceEdge.Kind kind) {
        for (DependenceEdge edge : getDependences(from)) {
            if (edge.getTo() == to && edge.getKind() == kind) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "DependenceGraph {" + PrintTools.line_sep + "  " +
                PrintTools.collectionToString(edges, PrintTools.line_sep + "  ") +
                PrintTools.line_sep + "}";
    }
}
