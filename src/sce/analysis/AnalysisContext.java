package sce.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import sce.hir.PrintTools;
import sce.hir.Procedure;
import sce.hir.Statement;
import sce.hir.Symbol;
import sce.hir.Tools;

/**
* The analyses of one procedure bundled for a single request. A context is
* built once and never modified, so it can be shared by requests running in
* different threads as long as the procedure is not modified either.
*/
public final class AnalysisContext {

    private final Procedure procedure;

    private final CFGraph cfg;

    private final MemoryModel model;

    private final ReachingDefinitionAnalysis reaching_defs;

    private final LiveVariableAnalysis live_vars;

    private final PostDominatorTree pdt;

    private final ControlDependenceAnalysis control_deps;

    private final DependenceGraph dependence_graph;

    private final List<UnreachableCodeWarning> warnings;

    private AnalysisContext(Procedure procedure) {
        this.procedure = procedure;
        cfg = new CFGraph(procedure);
        model = new MemoryModel(procedure);
        reaching_defs = new ReachingDefinitionAnalysis(cfg, model);
        live_vars = new LiveVariableAnalysis(cfg, model);
        pdt = new PostDominatorTree(cfg);
        control_deps = new ControlDependenceAnalysis(pdt);
        dependence_graph = new DependenceGraph(cfg, reaching_defs,
                                               control_deps, model);
        List<UnreachableCodeWarning> list =
                new ArrayList<UnreachableCodeWarning>();
        for (Statement stmt : cfg.getUnreachableStatements()) {
            list.add(new UnreachableCodeWarning(procedure.getSymbolName(),
                                                stmt));
        }
        warnings = Collections.unmodifiableList(list);
    }

    /**
    * Runs every analysis on the procedure.
    *
    * @param procedure a procedure with a body.
    * @return the analysis context.
    * @throws IllegalArgumentException if the procedure has no body.
    */
    public static AnalysisContext build(Procedure procedure) {
        double timer = Tools.getTime();
        AnalysisContext ret = new AnalysisContext(procedure);
        PrintTools.printlnStatus(2, "[ANALYSIS]", procedure.getSymbolName(),
                "analyzed in",
                String.format("%.2f seconds", Tools.getTime(timer)));
        if (PrintTools.getVerbosity() >= 3) {
            PrintTools.printlnStatus(3, ret.cfg.toDot());
        }
        return ret;
    }

    public Procedure getProcedure() {
        return procedure;
    }

    public CFGraph getCFGraph() {
        return cfg;
    }

    /** Returns the variables that indirect writes may modify. */
    public Set<Symbol> getAliasableSymbols() {
        return model.getAliasableSymbols();
    }

    public MemoryModel getMemoryModel() {
        return model;
    }

    public ReachingDefinitionAnalysis getReachingDefinitions() {
        return reaching_defs;
    }

    public LiveVariableAnalysis getLiveVariables() {
        return live_vars;
    }

    public PostDominatorTree getPostDominatorTree() {
        return pdt;
    }

    public ControlDependenceAnalysis getControlDependences() {
        return control_deps;
    }

    public DependenceGraph getDependenceGraph() {
        return dependence_graph;
    }

    /** Returns one warning per statement that can never execute. */
    public List<UnreachableCodeWarning> getWarnings() {
        return warnings;
    }
}
