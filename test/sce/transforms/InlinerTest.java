package sce.transforms;

import static org.junit.jupiter.api.Assertions.*;
import static sce.hir.ProgramBuilder.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sce.hir.BreakStatement;
import sce.hir.CompoundStatement;
import sce.hir.DeclarationStatement;
import sce.hir.Fixtures;
import sce.hir.FunctionCall;
import sce.hir.IRTools;
import sce.hir.IfStatement;
import sce.hir.Procedure;
import sce.hir.ReturnStatement;
import sce.hir.SourceLocation;
import sce.hir.Specifier;
import sce.hir.Statement;
import sce.hir.TranslationUnit;

class InlinerTest {

    private static List<String> lines(CompoundStatement block) {
        List<String> ret = new ArrayList<String>();
        for (Statement stmt : block.getStatements()) {
            ret.add(stmt.toString());
        }
        return ret;
    }

    @Test
    void inlinesSingleReturnFunction() {
        TranslationUnit tu = Fixtures.inline1();
        InlineResult result = new Inliner().inline(tu,
                new InlineSpec(loc(16, 13), "to_inline"));

        assertEquals("_result_to_inline",
                     result.getResultVariable().getSymbolName());
        assertEquals(16, result.getMinLine());
        assertEquals(21, result.getMaxLine());
        assertEquals(6, result.getLineCount());

        List<String> block = lines(result.getInlinedBlock());
        assertEquals(3, block.size());
        assertEquals("int _param_to_inline_a = x;", block.get(0));
        assertEquals("int _param_to_inline_b = y;", block.get(1));
        assertEquals(
                "_result_to_inline = _param_to_inline_a + _param_to_inline_b;",
                block.get(2));

        Procedure main = result.getCaller();
        assertEquals("int _result_to_inline;",
                     statementAt(main, 16).toString());
        assertEquals("int z = _result_to_inline;",
                     statementAt(main, 22).toString());
        assertEquals("return 0;", statementAt(main, 26).toString());
        assertSame(result.getInlinedBlock(),
                   main.getBody().getStatements().get(3));
    }

    @Test
    void assignsLocationsToIntroducedStatements() {
        InlineResult result = new Inliner().inline(Fixtures.inline1(),
                new InlineSpec(loc(16, 13), "to_inline"));
        Map<Statement, SourceLocation> locations = result.getLocations();
        List<Integer> lines = new ArrayList<Integer>();
        for (SourceLocation loc : locations.values()) {
            lines.add(loc.getLine());
        }
        assertEquals(List.of(16, 17, 18, 19, 20), lines);
        assertEquals(loc(17, 5), result.getInlinedBlock().getLocation());
        for (Statement stmt : locations.keySet()) {
            assertEquals(locations.get(stmt), stmt.getLocation());
        }
    }

    @Test
    void inputIsNotModified() {
        TranslationUnit tu = Fixtures.inline1();
        String before = tu.toString();
        InlineResult result = new Inliner().inline(tu,
                new InlineSpec(loc(16, 13), "to_inline"));
        assertEquals(before, tu.toString());
        assertNotSame(tu, result.getTranslationUnit());
        assertEquals(4, IRTools.getFunctionCalls(
                tu.findProcedure("main")).size());
        assertEquals(3, IRTools.getFunctionCalls(
                result.getCaller()).size());
    }

    @Test
    void sameRequestGivesSameRange() {
        TranslationUnit tu = Fixtures.inline1();
        InlineSpec spec = new InlineSpec(loc(17, 13), "another_inline");
        InlineResult first = new Inliner().inline(tu, spec);
        InlineResult second = new Inliner().inline(tu, spec);
        assertEquals(17, first.getMinLine());
        assertEquals(24, first.getMaxLine());
        assertEquals(first.getMinLine(), second.getMinLine());
        assertEquals(first.getMaxLine(), second.getMaxLine());
        assertEquals(first.getTranslationUnit().toString(),
                     second.getTranslationUnit().toString());
    }

    @Test
    void renamesLocalsOfCallee() {
        InlineResult result = new Inliner().inline(Fixtures.inline1(),
                InlineSpec.of(17, 13, "another_inline", 17, 24));
        List<String> block = lines(result.getInlinedBlock());
        assertEquals("int _local_another_inline_sum = " +
                     "_param_another_inline_a + _param_another_inline_b;",
                     block.get(2));
        assertEquals("_local_another_inline_sum++;", block.get(3));
        assertEquals("_result_another_inline = _local_another_inline_sum;",
                     block.get(4));
    }

    @Test
    void rangeMismatchIsReported() {
        RangeMismatchException e = assertThrows(RangeMismatchException.class,
                () -> new Inliner().inline(Fixtures.inline1(),
                        InlineSpec.of(16, 13, "to_inline", 3, 5)));
        assertEquals(3, e.getExpectedMinLine());
        assertEquals(5, e.getExpectedMaxLine());
        assertEquals(16, e.getActualMinLine());
        assertEquals(21, e.getActualMaxLine());
    }

    @Test
    void matchingRangeIsAccepted() {
        InlineResult result = new Inliner().inline(Fixtures.inline1(),
                InlineSpec.of(16, 13, "to_inline", 16, 21));
        assertEquals(16, result.getMinLine());
    }

    @Test
    void recursiveFunctionIsRejected() {
        assertThrows(RecursiveInlineException.class,
                () -> new Inliner().inline(Fixtures.fib(),
                        new InlineSpec(loc(14, 13), "fib")));
    }

    @Test
    void indirectlyRecursiveFunctionIsRejected() {
        RecursiveInlineException e = assertThrows(
                RecursiveInlineException.class,
                () -> new Inliner().inline(Fixtures.mutualRecursion(),
                        new InlineSpec(loc(16, 13), "even")));
        assertEquals("even", e.getFunctionName());
    }

    @Test
    void calleeCallingBackIntoCallerIsRejected() {
        RecursiveInlineException e = assertThrows(
                RecursiveInlineException.class,
                () -> new Inliner().inline(Fixtures.mutualRecursion(),
                        new InlineSpec(loc(12, 12), "odd")));
        assertEquals("odd", e.getFunctionName());
        assertTrue(e.getMessage().contains("into even"), e.getMessage());
    }

    @Test
    void unknownFunctionIsRejected() {
        assertThrows(UnknownFunctionException.class,
                () -> new Inliner().inline(Fixtures.inline1(),
                        new InlineSpec(loc(18, 5), "printf")));
    }

    @Test
    void missingCallSiteIsRejected() {
        InlineException e = assertThrows(InlineException.class,
                () -> new Inliner().inline(Fixtures.inline1(),
                        new InlineSpec(loc(40, 1), "to_inline")));
        assertTrue(e.getMessage().contains("call site not found"));
    }

    @Test
    void argumentsAreEvaluatedOnceInOrder() {
        InlineResult result = new Inliner().inline(Fixtures.sideEffects(),
                new InlineSpec(loc(7, 13), "sub"));
        List<String> block = lines(result.getInlinedBlock());
        assertEquals("int _param_sub_a = next();", block.get(0));
        assertEquals("int _param_sub_b = i++;", block.get(1));

        int next_calls = 0;
        for (FunctionCall call : IRTools.getFunctionCalls(result.getCaller())) {
            if (call.getFunctionName().equals("next")) {
                next_calls++;
            }
        }
        assertEquals(1, next_calls);
    }

    @Test
    void generatedNamesAvoidCallerNames() {
        InlineResult result = new Inliner().inline(Fixtures.capture(false),
                new InlineSpec(loc(11, 13), "sq"));
        List<String> block = lines(result.getInlinedBlock());
        assertEquals("int _param_sq_2_x = t;", block.get(0));
        assertEquals("int _local_sq_t = _param_sq_2_x * _param_sq_2_x;",
                     block.get(1));
        assertEquals("_result_sq = _local_sq_t + g;", block.get(2));
    }

    @Test
    void shadowedGlobalIsRejected() {
        InlineException e = assertThrows(InlineException.class,
                () -> new Inliner().inline(Fixtures.capture(true),
                        new InlineSpec(loc(11, 13), "sq")));
        assertTrue(e.getMessage().contains("shadowed"), e.getMessage());
    }

    @Test
    void earlyReturnUsesDoneFlag() {
        InlineResult result = new Inliner().inline(Fixtures.multiReturn(),
                new InlineSpec(loc(21, 13), "classify"));
        CompoundStatement block = result.getInlinedBlock();
        List<String> text = lines(block);
        assertEquals("int _param_classify_v = a;", text.get(0));
        assertEquals("int _done_classify = 0;", text.get(1));
        assertEquals(4, text.size());
        assertEquals(0, count(block, ReturnStatement.class));

        IfStatement early = (IfStatement)block.getStatements().get(2);
        List<String> then = lines((CompoundStatement)early.getThenStatement());
        assertEquals(List.of("_result_classify = -1;",
                             "_done_classify = 1;"), then);

        IfStatement rest = (IfStatement)block.getStatements().get(3);
        assertTrue(rest.getControlExpression().toString()
                   .contains("!_done_classify"));
        List<String> guarded =
                lines((CompoundStatement)rest.getThenStatement());
        assertEquals(List.of(
                "int _local_classify_r = _param_classify_v * 2;",
                "_result_classify = _local_classify_r;"), guarded);
    }

    @Test
    void returnInLoopBreaksOut() {
        InlineResult result = new Inliner().inline(Fixtures.multiReturn(),
                new InlineSpec(loc(22, 13), "find"));
        CompoundStatement block = result.getInlinedBlock();
        assertEquals(0, count(block, ReturnStatement.class));
        assertEquals(1, count(block, BreakStatement.class));
        List<Statement> stmts = block.getStatements();
        assertTrue(stmts.get(stmts.size() - 1) instanceof IfStatement);
        assertEquals("int _done_find = 0;", stmts.get(1).toString());
        assertEquals("int _local_find_i;", stmts.get(2).toString());
        result.getCaller().getBody().verify();
    }

    @Test
    void voidCallStatementIsReplaced() {
        InlineResult result = new Inliner().inline(Fixtures.voidCall(),
                new InlineSpec(loc(11, 5), "add"));
        assertNull(result.getResultVariable());
        assertEquals(11, result.getMinLine());
        assertEquals(22, result.getMaxLine());

        Procedure main = result.getCaller();
        assertEquals(2, main.getBody().countStatements());
        assertSame(result.getInlinedBlock(),
                   main.getBody().getStatements().get(0));
        assertTrue(IRTools.getFunctionCalls(main).isEmpty());
        assertEquals("return total;", statementAt(main, 24).toString());
    }

    @Test
    void usedValueOfVoidFunctionIsRejected() {
        TranslationUnit tu = Fixtures.voidCall();
        Procedure main = tu.findProcedure("main");
        DeclarationStatement use = decl(11, 5, Specifier.INT,
                var("v"), at(11, 13, call("add", lit(1))));
        main.getBody().addStatementBefore(
                main.getBody().getStatements().get(0), use);
        assertThrows(InlineException.class,
                () -> new Inliner().inline(tu,
                        new InlineSpec(loc(11, 13), "add")));
    }

    @Test
    void deadCodeInCalleeIsReported() {
        InlineResult result = new Inliner().inline(Fixtures.deadCode(),
                new InlineSpec(loc(13, 13), "dead"));
        assertEquals(1, result.getWarnings().size());
        assertEquals("dead", result.getWarnings().get(0).getProcedureName());
    }

    @Test
    void prefixesAreConfigurable() {
        Inliner inliner = new Inliner();
        inliner.setParamPrefix("arg");
        inliner.setResultPrefix("ret");
        InlineResult result = inliner.inline(Fixtures.inline1(),
                new InlineSpec(loc(16, 13), "to_inline"));
        assertEquals("_ret_to_inline",
                     result.getResultVariable().getSymbolName());
        assertEquals("int _arg_to_inline_a = x;",
                     result.getInlinedBlock().getStatements().get(0)
                     .toString());
        assertThrows(IllegalArgumentException.class,
                     () -> inliner.setLocalPrefix("bad prefix"));
        assertThrows(IllegalArgumentException.class,
                     () -> inliner.setMaxNameLength(4));
    }

    @Test
    void longNamesAreShortened() {
        Inliner inliner = new Inliner();
        inliner.setMaxNameLength(16);
        InlineResult result = inliner.inline(Fixtures.inline1(),
                new InlineSpec(loc(16, 13), "to_inline"));
        String name = result.getResultVariable().getSymbolName();
        assertTrue(name.length() <= 16 + 9, name);
        assertNotEquals("_result_to_inline", name);
    }
}
