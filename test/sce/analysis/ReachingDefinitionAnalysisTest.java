package sce.analysis;

import static org.junit.jupiter.api.Assertions.*;
import static sce.hir.ProgramBuilder.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import sce.hir.Fixtures;
import sce.hir.ForLoop;
import sce.hir.Procedure;
import sce.hir.Statement;
import sce.hir.Symbol;
import sce.hir.TranslationUnit;

class ReachingDefinitionAnalysisTest {

    @Test
    void loopDefinitionsReachUseAfterLoop() {
        TranslationUnit tu = Fixtures.example2();
        Procedure main = tu.findProcedure("main");
        AnalysisContext context = AnalysisContext.build(main);
        Symbol sum = Fixtures.symbol(tu, "main", "sum");

        DFANode use = context.getCFGraph().getNode(statementAt(main, 13));
        List<Definition> defs =
                context.getReachingDefinitions().getReachingDefinitions(use,
                                                                        sum);
        assertEquals(2, defs.size());
        assertSame(statementAt(main, 6), defs.get(0).getStatement());
        assertSame(statementAt(main, 10), defs.get(1).getStatement());
        assertTrue(defs.get(0).isMust());
    }

    @Test
    void stepDefinitionIsOwnedByLoop() {
        TranslationUnit tu = Fixtures.example2();
        Procedure main = tu.findProcedure("main");
        AnalysisContext context = AnalysisContext.build(main);
        Symbol i = Fixtures.symbol(tu, "main", "i");
        ForLoop loop = first(main.getBody(), ForLoop.class);

        DFANode body = context.getCFGraph().getNode(statementAt(main, 11));
        boolean from_init = false, from_step = false;
        for (Definition def : context.getReachingDefinitions()
                .getReachingDefinitions(body, i)) {
            from_init |= (def.getStatement() == loop.getInitialStatement());
            from_step |= (def.getStatement() == loop);
        }
        assertTrue(from_init);
        assertTrue(from_step);
    }

    @Test
    void declarationWithoutInitializerDefinesNothing() {
        TranslationUnit tu = Fixtures.example2();
        AnalysisContext context =
                AnalysisContext.build(tu.findProcedure("main"));
        Symbol i = Fixtures.symbol(tu, "main", "i");
        for (Definition def :
                context.getReachingDefinitions().getDefinitions(i)) {
            assertNotEquals(5, def.getStatement().where());
        }
    }

    @Test
    void writeThroughPointerMayDefineAddressTakenVariable() {
        TranslationUnit tu = Fixtures.pointers();
        Procedure ptr = tu.findProcedure("ptr");
        AnalysisContext context = AnalysisContext.build(ptr);
        Symbol a = Fixtures.symbol(tu, "ptr", "a");
        Symbol b = Fixtures.symbol(tu, "ptr", "b");

        Set<Symbol> aliasable = context.getAliasableSymbols();
        assertTrue(aliasable.contains(a));
        assertFalse(aliasable.contains(b));

        DFANode ret = context.getCFGraph().getNode(statementAt(ptr, 6));
        ReachingDefinitionAnalysis rd = context.getReachingDefinitions();
        List<Definition> a_defs = rd.getReachingDefinitions(ret, a);
        assertEquals(2, a_defs.size());
        assertSame(statementAt(ptr, 2), a_defs.get(0).getStatement());
        assertTrue(a_defs.get(0).isMust());
        assertSame(statementAt(ptr, 5), a_defs.get(1).getStatement());
        assertFalse(a_defs.get(1).isMust());

        List<Definition> b_defs = rd.getReachingDefinitions(ret, b);
        assertEquals(1, b_defs.size());
        assertSame(statementAt(ptr, 3), b_defs.get(0).getStatement());
    }

    @Test
    void writeThroughPointerParameterMayDefineUnknownMemory() {
        TranslationUnit tu = Fixtures.pointerParameter();
        Procedure store = tu.findProcedure("store");
        AnalysisContext context = AnalysisContext.build(store);
        assertTrue(context.getAliasableSymbols().isEmpty());

        DFANode read = context.getCFGraph().getNode(statementAt(store, 3));
        List<Definition> defs = context.getReachingDefinitions()
                .getReachingDefinitions(read, MemorySymbol.UNKNOWN);
        assertEquals(1, defs.size());
        assertSame(statementAt(store, 2), defs.get(0).getStatement());
        assertFalse(defs.get(0).isMust());
    }

    @Test
    void callMayDefineGlobalWithoutKillingIt() {
        TranslationUnit tu = Fixtures.globalWrite();
        Procedure main = tu.findProcedure("main");
        AnalysisContext context = AnalysisContext.build(main);
        Symbol g = tu.findSymbol("g");

        DFANode use = context.getCFGraph().getNode(statementAt(main, 10));
        List<Definition> defs =
                context.getReachingDefinitions().getReachingDefinitions(use, g);
        assertEquals(2, defs.size());
        assertSame(statementAt(main, 8), defs.get(0).getStatement());
        assertTrue(defs.get(0).isMust());
        assertSame(statementAt(main, 9), defs.get(1).getStatement());
        assertFalse(defs.get(1).isMust());
    }

    @Test
    void parametersAreDefinedAtEntry() {
        TranslationUnit tu = Fixtures.inline1();
        Procedure proc = tu.findProcedure("to_inline");
        AnalysisContext context = AnalysisContext.build(proc);
        Symbol a = proc.getParameter(0);
        DFANode ret = context.getCFGraph().getNode(statementAt(proc, 4));
        List<Definition> defs = context.getReachingDefinitions()
                .getReachingDefinitions(ret, a);
        assertEquals(1, defs.size());
        assertNull(defs.get(0).getStatement());
    }

    @Test
    void liveVariablesAtCriterion() {
        TranslationUnit tu = Fixtures.example2();
        Procedure main = tu.findProcedure("main");
        AnalysisContext context = AnalysisContext.build(main);
        Statement write_sum = statementAt(main, 13);
        Set<Symbol> live = context.getLiveVariables()
                .getLiveIn(context.getCFGraph().getNode(write_sum));
        assertTrue(live.contains(Fixtures.symbol(tu, "main", "sum")));
        assertTrue(live.contains(Fixtures.symbol(tu, "main", "product")));
        assertFalse(live.contains(Fixtures.symbol(tu, "main", "w")));
        assertFalse(live.contains(Fixtures.symbol(tu, "main", "i")));

        Set<Symbol> live_out = context.getLiveVariables()
                .getLiveOut(context.getCFGraph().getNode(write_sum));
        assertFalse(live_out.contains(Fixtures.symbol(tu, "main", "sum")));
        assertTrue(live_out.contains(Fixtures.symbol(tu, "main", "product")));
    }
}
