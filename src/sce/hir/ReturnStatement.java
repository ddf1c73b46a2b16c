package sce.hir;

import java.io.PrintWriter;

/**
* Represents a <b>return</b> statement with an optional value.
*/
public class ReturnStatement extends Statement {

    /** Creates a return statement without a value. */
    public ReturnStatement() {
        super(1);
    }

    /** Creates a return statement that returns the given expression. */
    public ReturnStatement(Expression expr) {
        super(1);
        addChild(expr);
        expr.setParens(false);
    }

    /**
    * Returns the returned expression.
    *
    * @return the expression, or null for a void return.
    */
    public Expression getExpression() {
        return children.isEmpty() ? null : (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        o.print("return");
        if (!children.isEmpty()) {
            o.print(" ");
            getExpression().print(o);
        }
        o.print(";");
    }
}
