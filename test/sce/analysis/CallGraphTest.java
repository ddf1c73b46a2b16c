package sce.analysis;

import static org.junit.jupiter.api.Assertions.*;
import static sce.hir.ProgramBuilder.*;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import sce.hir.Fixtures;
import sce.hir.FunctionCall;
import sce.hir.Procedure;
import sce.hir.TranslationUnit;

class CallGraphTest {

    @Test
    void externalFunctionsAreNotNodes() {
        TranslationUnit tu = Fixtures.inline1();
        CallGraph cg = new CallGraph(tu);
        Procedure main = tu.findProcedure("main");
        Procedure to_inline = tu.findProcedure("to_inline");

        assertSame(main, cg.getRoot().getProcedure());
        assertEquals(List.of(to_inline, tu.findProcedure("another_inline")),
                     cg.getCallees(main));
        assertTrue(cg.isLeaf(to_inline));
        assertFalse(cg.isLeaf(main));

        List<FunctionCall> callers = cg.getNode(to_inline).getCallers();
        assertEquals(1, callers.size());
        assertEquals(loc(16, 13), callers.get(0).getLocation());
    }

    @Test
    void selfCallIsRecursion() {
        TranslationUnit tu = Fixtures.fib();
        CallGraph cg = new CallGraph(tu);
        Procedure fib = tu.findProcedure("fib");
        Procedure main = tu.findProcedure("main");

        assertTrue(cg.callsSelf(fib));
        assertTrue(cg.isRecursive(fib));
        assertFalse(cg.isRecursive(main));
        assertTrue(cg.reaches(main, fib));
        assertFalse(cg.reaches(fib, main));
        assertEquals(4, cg.getNode(fib).getCallers().size());
    }

    @Test
    void mutualCallsAreRecursion() {
        TranslationUnit tu = Fixtures.mutualRecursion();
        CallGraph cg = new CallGraph(tu);
        Procedure odd = tu.findProcedure("odd");
        Procedure even = tu.findProcedure("even");

        assertFalse(cg.callsSelf(odd));
        assertTrue(cg.isRecursive(odd));
        assertTrue(cg.isRecursive(even));
        assertTrue(cg.reaches(odd, even));
        assertFalse(cg.isRecursive(tu.findProcedure("main")));
        assertEquals(Set.of(odd, even),
                     cg.getTransitiveCallees(tu.findProcedure("main")));
    }

    @Test
    void transitiveCalleesIncludeIndirectCalls() {
        TranslationUnit tu = Fixtures.fib();
        CallGraph cg = new CallGraph(tu);
        Set<Procedure> callees =
                cg.getTransitiveCallees(tu.findProcedure("main"));
        assertEquals(Set.of(tu.findProcedure("fib")), callees);
        assertFalse(callees.contains(tu.findProcedure("main")));
    }

    @Test
    void printsDotEdges() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new CallGraph(Fixtures.fib()).print(out);
        String dot = out.toString();
        assertTrue(dot.contains("main -> fib;"), dot);
        assertTrue(dot.contains("fib -> fib;"), dot);
    }
}
