package sce.hir;

import java.io.PrintWriter;

/**
* Represents a while loop. The body is always a compound statement.
*/
public class WhileLoop extends Statement implements Loop {

    /**
    * Creates a while loop.
    *
    * @param condition the condition tested before every iteration.
    * @param body the loop body.
    */
    public WhileLoop(Expression condition, Statement body) {
        super(2);
        addChild(condition);
        condition.setParens(false);
        addChild(IfStatement.toCompound(body));
    }

    /* Loop interface */
    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    /* Loop interface */
    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(1);
    }

    /* Loop interface */
    public void setCondition(Expression cond) {
        setChild(0, cond);
        cond.setParens(false);
    }

    public void print(PrintWriter o) {
        o.print("while (");
        getCondition().print(o);
        o.println(")");
        getBody().print(o);
    }
}
