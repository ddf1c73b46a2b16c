package sce.hir;

import static org.junit.jupiter.api.Assertions.*;
import static sce.hir.ProgramBuilder.*;

import org.junit.jupiter.api.Test;

class IRCloneTest {

    @Test
    void unitCloneRelinksGlobalsAndLocals() {
        TranslationUnit tu = Fixtures.capture(false);
        TranslationUnit copy = tu.clone();

        Procedure sq = copy.findProcedure("sq");
        Symbol global_g = copy.findSymbol("g");
        assertNotSame(tu.findSymbol("g"), global_g);
        assertEquals("capture.c", copy.getFileName());

        ReturnStatement ret = first(sq.getBody(), ReturnStatement.class);
        for (Symbol symbol : SymbolTools.getAccessedSymbols(ret)) {
            if (symbol.getSymbolName().equals("g")) {
                assertSame(global_g, symbol);
            } else {
                assertSame(Fixtures.symbol(copy, "sq", "t"), symbol);
            }
        }
        copy.findProcedure("main").getBody().verify();
    }

    @Test
    void cloneKeepsLocations() {
        TranslationUnit tu = Fixtures.inline1();
        TranslationUnit copy = tu.clone();
        Statement stmt = statementAt(copy.findProcedure("main"), 16);
        assertNotNull(stmt);
        assertEquals(loc(16, 5), stmt.getLocation());
        FunctionCall call = IRTools.getFunctionCalls(stmt).get(0);
        assertEquals(loc(16, 13), call.getLocation());
    }

    @Test
    void statementsCompareByIdentity() {
        TranslationUnit tu = Fixtures.example2();
        Statement stmt = statementAt(tu.findProcedure("main"), 10);
        Statement copy = stmt.clone();
        assertNotEquals(stmt, copy);
        assertEquals(stmt.toString(), copy.toString());
    }

    @Test
    void expressionsCompareByStructure() {
        VariableDeclarator a = var("a");
        VariableDeclarator other_a = var("a");
        Expression e = bin(id(a), BinaryOperator.ADD, lit(1));
        assertEquals(e, e.clone());
        assertEquals(e.hashCode(), e.clone().hashCode());
        assertNotEquals(e, bin(id(a), BinaryOperator.SUBTRACT, lit(1)));
        // Same name, different variable.
        assertNotEquals(id(a), id(other_a));
    }

    @Test
    void printsProcedure() {
        TranslationUnit tu = Fixtures.inline1();
        String text = tu.findProcedure("another_inline").toString();
        assertTrue(text.contains("int sum = a + b;"), text);
        assertTrue(text.contains("sum++;"), text);
        assertTrue(text.contains("return sum;"), text);
    }

    @Test
    void findSymbolSearchesEnclosingScopes() {
        TranslationUnit tu = Fixtures.capture(true);
        Statement call_stmt = statementAt(tu.findProcedure("main"), 11);
        Symbol local_g = SymbolTools.findSymbol(call_stmt, "g");
        assertNotNull(local_g);
        assertNotSame(tu.findSymbol("g"), local_g);
        Statement in_sq = statementAt(tu.findProcedure("sq"), 5);
        assertSame(tu.findSymbol("g"), SymbolTools.findSymbol(in_sq, "g"));
    }

    @Test
    void pathsAddressTheSameNodeInACopy() {
        TranslationUnit tu = Fixtures.example2();
        Procedure main = tu.findProcedure("main");
        Statement stmt = statementAt(main, 11);
        Procedure copy = main.clone();
        Traversable found =
                IRTools.getByPath(copy, IRTools.getPath(main, stmt));
        assertNotSame(stmt, found);
        assertEquals(stmt.toString(), found.toString());
    }
}
