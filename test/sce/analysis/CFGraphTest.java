package sce.analysis;

import static org.junit.jupiter.api.Assertions.*;
import static sce.hir.ProgramBuilder.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sce.hir.Fixtures;
import sce.hir.ForLoop;
import sce.hir.Procedure;
import sce.hir.Specifier;
import sce.hir.Statement;
import sce.hir.TranslationUnit;

class CFGraphTest {

    @Test
    void forLoopHasInitConditionAndStepNodes() {
        Procedure main = Fixtures.example2().findProcedure("main");
        CFGraph cfg = new CFGraph(main);
        ForLoop loop = first(main.getBody(), ForLoop.class);

        DFANode cond = cfg.getNode(loop);
        assertEquals("FORCOND", cond.getData("tag"));
        assertEquals(2, cfg.getNodes(loop).size());

        DFANode init = cfg.getNode(loop.getInitialStatement());
        assertNotNull(init);
        assertNotSame(cond, init);
        assertTrue(init.getSuccs().contains(cond));
        assertNotNull(cond.getData("true"));
        assertNotNull(cond.getData("false"));
    }

    @Test
    void entryLeadsToFirstStatement() {
        Procedure main = Fixtures.example2().findProcedure("main");
        CFGraph cfg = new CFGraph(main);
        assertEquals("FLOW ENTRY", cfg.getEntry().getData("tag"));
        Statement first = main.getBody().getStatements().get(0);
        assertTrue(cfg.getEntry().getSuccs().contains(cfg.getNode(first)));
    }

    @Test
    void returnHasNoSuccessor() {
        Procedure main = Fixtures.example2().findProcedure("main");
        CFGraph cfg = new CFGraph(main);
        DFANode ret = cfg.getNode(statementAt(main, 16));
        assertTrue(ret.getSuccs().isEmpty());
    }

    @Test
    void codeAfterReturnIsUnreachable() {
        Procedure dead = Fixtures.deadCode().findProcedure("dead");
        CFGraph cfg = new CFGraph(dead);
        List<Statement> unreachable = cfg.getUnreachableStatements();
        assertEquals(1, unreachable.size());
        assertSame(statementAt(dead, 3), unreachable.get(0));
        assertTrue(CFGraph.isUnreachable(cfg.getNode(unreachable.get(0))));
        assertFalse(CFGraph.isUnreachable(cfg.getNode(statementAt(dead, 2))));
    }

    @Test
    void loopWithoutConditionHasNoExitEdge() {
        Procedure spin = Fixtures.deadCode().findProcedure("spin");
        CFGraph cfg = new CFGraph(spin);
        ForLoop loop = first(spin.getBody(), ForLoop.class);
        DFANode cond = cfg.getNode(loop);
        assertNull(cond.getData("false"));
        assertEquals(1, cond.getSuccs().size());
        assertTrue(cfg.getUnreachableStatements().isEmpty());
    }

    @Test
    void everyNodeBelongsToOneBlock() {
        TranslationUnit tu = Fixtures.multiReturn();
        CFGraph cfg = new CFGraph(tu.findProcedure("find"));
        int count = 0;
        for (BasicBlock block : cfg.getBasicBlocks()) {
            count += block.getNodes().size();
        }
        assertEquals(cfg.size(), count);
    }

    @Test
    void rejectsProcedureWithoutBody() {
        Procedure decl = procedure(1, Specifier.INT, "ext",
                                   params(), null);
        assertThrows(IllegalArgumentException.class,
                     () -> new CFGraph(decl));
    }
}
