package sce.hir;

import java.io.PrintWriter;

/**
* Represents a do-while loop. The body is always a compound statement.
*/
public class DoLoop extends Statement implements Loop {

    /**
    * Creates a do-while loop.
    *
    * @param body the loop body.
    * @param condition the condition tested after every iteration.
    */
    public DoLoop(Statement body, Expression condition) {
        super(2);
        addChild(IfStatement.toCompound(body));
        addChild(condition);
        condition.setParens(false);
    }

    /* Loop interface */
    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(0);
    }

    /* Loop interface */
    public Expression getCondition() {
        return (Expression)children.get(1);
    }

    /* Loop interface */
    public void setCondition(Expression cond) {
        setChild(1, cond);
        cond.setParens(false);
    }

    public void print(PrintWriter o) {
        o.println("do");
        getBody().print(o);
        o.println();
        o.print("while (");
        getCondition().print(o);
        o.print(");");
    }
}
