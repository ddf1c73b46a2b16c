package sce.hir;

import java.io.PrintWriter;

/**
* <b>ForLoop</b> represents a C-style for loop, having an optional initial
* statement, an optional condition expression, an optional step expression and
* a body. Missing parts are stored as null children. The body is always a
* compound statement.
*/
public class ForLoop extends Statement implements Loop {

    /**
    * Constructs a new for loop.
    *
    * @param init the initial statement, an expression statement or null.
    * @param condition the condition expression or null.
    * @param step the step expression or null.
    * @param body the body statement.
    * @throws IllegalArgumentException if <b>init</b> declares variables.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public ForLoop(Statement init, Expression condition, Expression step,
                   Statement body) {
        super(4);
        if (init instanceof DeclarationStatement) {
            throw new IllegalArgumentException(
                    "declarations in a for-loop header are not supported");
        }
        children.add(null);
        children.add(null);
        children.add(null);
        children.add(new CompoundStatement());
        children.get(3).setParent(this);
        if (init != null) {
            setChild(0, init);
        }
        if (condition != null) {
            setChild(1, condition);
            condition.setParens(false);
        }
        if (step != null) {
            setChild(2, step);
            step.setParens(false);
        }
        setChild(3, IfStatement.toCompound(body));
    }

    /**
    * Returns the initial statement.
    *
    * @return the statement or null if there is none.
    */
    public Statement getInitialStatement() {
        return (Statement)children.get(0);
    }

    /* Loop interface */
    public Expression getCondition() {
        return (Expression)children.get(1);
    }

    /**
    * Returns the step expression.
    *
    * @return the step or null if there is none.
    */
    public Expression getStep() {
        return (Expression)children.get(2);
    }

    /* Loop interface */
    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(3);
    }

    /* Loop interface */
    public void setCondition(Expression cond) {
        setChild(1, cond);
        cond.setParens(false);
    }

    public void print(PrintWriter o) {
        o.print("for (");
        if (getInitialStatement() == null) {
            o.print(";");
        } else {
            getInitialStatement().print(o);
        }
        o.print(" ");
        if (getCondition() != null) {
            getCondition().print(o);
        }
        o.print("; ");
        if (getStep() != null) {
            getStep().print(o);
        }
        o.println(")");
        getBody().print(o);
    }
}
