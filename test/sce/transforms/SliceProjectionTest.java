package sce.transforms;

import static org.junit.jupiter.api.Assertions.*;
import static sce.hir.ProgramBuilder.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sce.analysis.AnalysisContext;
import sce.analysis.SliceCriterion;
import sce.analysis.SliceResult;
import sce.analysis.Slicer;
import sce.hir.Fixtures;
import sce.hir.ForLoop;
import sce.hir.Procedure;
import sce.hir.Statement;

class SliceProjectionTest {

    private static SliceProjection projectSum(Procedure main) {
        SliceResult slice = new Slicer(AnalysisContext.build(main)).slice(
                new SliceCriterion(loc(13, 11), "sum"));
        return new SliceProjection(slice);
    }

    @Test
    void removesStatementsOutsideSlice() {
        Procedure main = Fixtures.example2().findProcedure("main");
        SliceProjection projection = projectSum(main);

        List<Statement> removed = projection.getRemovedStatements();
        assertEquals(4, removed.size());
        assertSame(statementAt(main, 7), removed.get(0));
        assertSame(statementAt(main, 11), removed.get(1));
        assertSame(statementAt(main, 14), removed.get(2));
        assertSame(statementAt(main, 16), removed.get(3));
        assertEquals(List.of(7, 11, 14, 16),
                     List.copyOf(projection.getRemovedLines()));
        assertEquals(loc(11, 7), projection.getRemovedLocations().get(1));
    }

    @Test
    void keepsDeclarationsOfUsedVariables() {
        Procedure main = Fixtures.example2().findProcedure("main");
        SliceProjection projection = projectSum(main);
        Procedure projected = projection.getProjectedProcedure();

        // "int i;" is not in the slice but the loop header reads i.
        assertFalse(projection.getSlice().contains(statementAt(main, 5)));
        assertNotNull(statementAt(projected, 5));
        assertNotNull(first(projected.getBody(), ForLoop.class));
        assertFalse(projected.toString().contains("product"));
        assertTrue(projected.toString().contains("write(sum);"));
    }

    @Test
    void originalIsNotModified() {
        Procedure main = Fixtures.example2().findProcedure("main");
        String before = main.toString();
        SliceProjection projection = projectSum(main);
        assertEquals(before, main.toString());
        assertNotSame(main, projection.getProjectedProcedure());
        projection.getProjectedProcedure().getBody().verify();
    }

    @Test
    void adjustsLocationsPastRemovedLines() {
        Procedure main = Fixtures.example2().findProcedure("main");
        SliceProjection projection = projectSum(main);
        assertEquals(loc(11, 11), projection.adjust(loc(13, 11)));
        assertEquals(loc(6, 5), projection.adjust(loc(6, 5)));
        assertThrows(IllegalArgumentException.class,
                     () -> projection.adjust(loc(11, 7)));
    }

    @Test
    void sliceOfReturnKeepsOnlyReturn() {
        Procedure main = Fixtures.example2().findProcedure("main");
        SliceResult slice = new Slicer(AnalysisContext.build(main)).slice(
                new SliceCriterion(loc(16, 5)));
        SliceProjection projection = new SliceProjection(slice);
        // return 0 uses nothing, so only the return itself is kept.
        assertEquals(1, slice.size());
        assertEquals(main.getBody().countStatements() - 1,
                     projection.getRemovedStatements().size());
    }
}
