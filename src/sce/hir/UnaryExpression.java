package sce.hir;

import java.io.PrintWriter;

/**
* Represents an expression having a unary operator and one operand.
*/
public class UnaryExpression extends Expression {

    protected UnaryOperator op;

    public UnaryExpression(UnaryOperator op, Expression expr) {
        super(1);
        this.op = op;
        addChild(expr);
    }

    @Override
    public UnaryExpression clone() {
        return (UnaryExpression)super.clone();
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public UnaryOperator getOperator() {
        return op;
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((UnaryExpression)o).op);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    public void print(PrintWriter o) {
        if (needs_parens) {
            o.print("(");
        }
        if (op.isPostfix()) {
            getExpression().print(o);
            op.print(o);
        } else {
            op.print(o);
            getExpression().print(o);
        }
        if (needs_parens) {
            o.print(")");
        }
    }
}
