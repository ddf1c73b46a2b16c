package sce.hir;

import java.io.PrintWriter;

/**
* Represents an expression evaluated for its side effects, for example
* <b>sum = sum + i;</b>.
*/
public class ExpressionStatement extends Statement {

    public ExpressionStatement(Expression expr) {
        super(1);
        addChild(expr);
        expr.setParens(false);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        getExpression().print(o);
        o.print(";");
    }
}
