package sce.transforms;

import java.util.ArrayList;
import java.util.List;

import sce.hir.AssignmentExpression;
import sce.hir.AssignmentOperator;
import sce.hir.BreakStatement;
import sce.hir.CompoundStatement;
import sce.hir.DFIterator;
import sce.hir.Expression;
import sce.hir.ExpressionStatement;
import sce.hir.IRTools;
import sce.hir.Identifier;
import sce.hir.IfStatement;
import sce.hir.IntegerLiteral;
import sce.hir.Loop;
import sce.hir.ReturnStatement;
import sce.hir.Statement;
import sce.hir.Traversable;
import sce.hir.UnaryExpression;
import sce.hir.UnaryOperator;
import sce.hir.VariableDeclarator;

/**
* Removes the return statements from a copy of a function body so the body
* falls through to its end, without introducing jumps to labels.
*
* <p>A return in tail position, after which nothing in the function
* executes, becomes an assignment of the returned value to the result
* variable. Any other return also sets a <i>done</i> flag and, inside a loop,
* breaks out of the innermost loop. The code that could run after such a
* return is then guarded: statements following it in a block are moved under
* {@code if (!done)}, and a loop nested in another loop is followed by
* {@code if (done) break;}.
*/
class ReturnNormalizer {

    private final CompoundStatement body;

    private final VariableDeclarator result;

    private final VariableDeclarator done;

    /** Assignments to the done flag inserted for non-tail returns */
    private final List<Statement> markers;

    /**
    * @param body the body to be normalized, a detached copy.
    * @param result the variable receiving the returned value, or null if the
    *   value is not used.
    * @param done the flag set by non-tail returns, or null if
    *   {@link #needsDoneFlag} is false.
    */
    ReturnNormalizer(CompoundStatement body, VariableDeclarator result,
                     VariableDeclarator done) {
        this.body = body;
        this.result = result;
        this.done = done;
        markers = new ArrayList<Statement>();
    }

    /**
    * Checks if the body has a return that is not in tail position.
    */
    static boolean needsDoneFlag(CompoundStatement body) {
        DFIterator<ReturnStatement> iter =
                new DFIterator<ReturnStatement>(body, ReturnStatement.class);
        while (iter.hasNext()) {
            if (!isTail(body, iter.next())) {
                return true;
            }
        }
        return false;
    }

    // Checks if nothing in the function executes after the statement.
    private static boolean isTail(CompoundStatement body, Statement stmt) {
        if (stmt == body) {
            return true;
        }
        Traversable parent = stmt.getParent();
        if (parent instanceof CompoundStatement) {
            List<Traversable> children = parent.getChildren();
            return (children.get(children.size() - 1) == stmt &&
                    isTail(body, (Statement)parent));
        } else if (parent instanceof IfStatement) {
            return isTail(body, (Statement)parent);
        }
        return false;
    }

    /**
    * Rewrites the returns of the body.
    *
    * @throws IllegalStateException if a non-tail return exists and no done
    *   flag was given.
    */
    void normalize() {
        List<ReturnStatement> returns =
                new DFIterator<ReturnStatement>(body, ReturnStatement.class)
                .getList();
        for (ReturnStatement ret : returns) {
            if (isTail(body, ret)) {
                replaceTail(ret);
            } else {
                replaceEarly(ret);
            }
        }
        if (!markers.isEmpty()) {
            guard(body);
        }
    }

    private Statement valueStatement(ReturnStatement ret) {
        Expression expr = ret.getExpression();
        if (expr == null) {
            return null;
        }
        expr = expr.clone();
        if (result == null) {
            return new ExpressionStatement(expr);
        }
        return new ExpressionStatement(new AssignmentExpression(
                new Identifier(result), AssignmentOperator.NORMAL, expr));
    }

    private void replaceTail(ReturnStatement ret) {
        CompoundStatement parent = (CompoundStatement)ret.getParent();
        Statement value = valueStatement(ret);
        if (value != null) {
            parent.addStatementBefore(ret, value);
        }
        parent.removeStatement(ret);
    }

    private void replaceEarly(ReturnStatement ret) {
        if (done == null) {
            throw new IllegalStateException("non-tail return without flag");
        }
        CompoundStatement parent = (CompoundStatement)ret.getParent();
        Statement value = valueStatement(ret);
        if (value != null) {
            parent.addStatementBefore(ret, value);
        }
        Statement marker = new ExpressionStatement(new AssignmentExpression(
                new Identifier(done), AssignmentOperator.NORMAL,
                new IntegerLiteral(1)));
        parent.addStatementBefore(ret, marker);
        markers.add(marker);
        if (getEnclosingLoop(ret) != null) {
            parent.addStatementBefore(ret, new BreakStatement());
        }
        parent.removeStatement(ret);
    }

    // Returns the innermost loop of the body that contains the statement.
    private Statement getEnclosingLoop(Statement stmt) {
        Traversable t = stmt.getParent();
        while (t != null && t != body) {
            if (t instanceof Loop) {
                return (Statement)t;
            }
            t = t.getParent();
        }
        return null;
    }

    private boolean mayReturn(Statement stmt) {
        for (Statement marker : markers) {
            if (marker == stmt || IRTools.isDescendantOf(marker, stmt)) {
                return true;
            }
        }
        return false;
    }

    // Checks if the statement contains a return whose break leaves a loop
    // nested in the statement instead of the loop around it.
    private boolean returnsFromInnerLoop(Statement stmt) {
        Statement loop = getEnclosingLoop(stmt);
        for (Statement marker : markers) {
            if ((marker == stmt || IRTools.isDescendantOf(marker, stmt)) &&
                    getEnclosingLoop(marker) != loop) {
                return true;
            }
        }
        return false;
    }

    private void guard(CompoundStatement block) {
        List<Statement> stmts = block.getStatements();
        for (int i = 0; i < stmts.size(); i++) {
            Statement stmt = stmts.get(i);
            if (stmt instanceof CompoundStatement) {
                guard((CompoundStatement)stmt);
            } else {
                for (Traversable child : stmt.getChildren()) {
                    if (child instanceof CompoundStatement) {
                        guard((CompoundStatement)child);
                    }
                }
            }
            if (!mayReturn(stmt)) {
                continue;
            }
            if (getEnclosingLoop(stmt) != null) {
                // A break already skips the rest of the loop body.
                if (returnsFromInnerLoop(stmt)) {
                    block.addStatementAfter(stmt, new IfStatement(
                            new Identifier(done), new BreakStatement()));
                }
                continue;
            }
            if (i == stmts.size() - 1) {
                continue;
            }
            CompoundStatement rest = new CompoundStatement();
            for (int j = i + 1; j < stmts.size(); j++) {
                block.removeStatement(stmts.get(j));
                rest.addStatement(stmts.get(j));
            }
            block.addStatement(new IfStatement(new UnaryExpression(
                    UnaryOperator.LOGICAL_NEGATION, new Identifier(done)),
                    rest));
            guard(rest);
            return;
        }
    }
}
