package sce.analysis;

import static org.junit.jupiter.api.Assertions.*;
import static sce.hir.ProgramBuilder.*;

import java.util.Set;

import org.junit.jupiter.api.Test;

import sce.hir.Fixtures;
import sce.hir.FunctionCall;
import sce.hir.IRTools;
import sce.hir.Symbol;
import sce.hir.TranslationUnit;

class ModRefAnalysisTest {

    @Test
    void calleeEffectsReachTheCaller() {
        TranslationUnit tu = Fixtures.globalWrite();
        ModRefAnalysis mod_ref = new ModRefAnalysis(tu);
        Symbol g = tu.findSymbol("g");
        FunctionCall bump = IRTools.getFunctionCalls(
                tu.findProcedure("main").getBody()).get(0);

        assertEquals(Set.of(g), mod_ref.getGlobals());
        ModRefAnalysis.Summary summary = mod_ref.getSummary(bump);
        assertEquals(Set.of(g), summary.getMod());
        assertFalse(summary.writesMemory());
        assertFalse(summary.readsMemory());
    }

    @Test
    void unknownCalleeTouchesEveryGlobal() {
        TranslationUnit tu = Fixtures.voidCall();
        ModRefAnalysis mod_ref = new ModRefAnalysis(tu);
        ModRefAnalysis.Summary summary = mod_ref.getSummary(call("external"));
        Symbol total = tu.findSymbol("total");
        assertTrue(summary.getMod().contains(total));
        assertTrue(summary.getRef().contains(total));
        // No global pointers, so memory is out of reach.
        assertFalse(summary.writesMemory());
    }

    @Test
    void globalReadIsReference() {
        TranslationUnit tu = Fixtures.capture(false);
        ModRefAnalysis mod_ref = new ModRefAnalysis(tu);
        FunctionCall sq = IRTools.getFunctionCalls(
                tu.findProcedure("main").getBody()).get(0);
        ModRefAnalysis.Summary summary = mod_ref.getSummary(sq);
        assertTrue(summary.getMod().isEmpty());
        assertEquals(Set.of(tu.findSymbol("g")), summary.getRef());
    }
}
