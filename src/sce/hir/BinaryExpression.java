package sce.hir;

import java.io.PrintWriter;

/**
* Represents an expression having a binary operator and two operands.
*/
public class BinaryExpression extends Expression {

    /** The operator */
    protected BinaryOperator op;

    /**
    * Creates a binary expression.
    *
    * @param lhs the left operand.
    * @param op the operator.
    * @param rhs the right operand.
    * @throws NotAnOrphanException if an operand has a parent.
    */
    public BinaryExpression(Expression lhs, BinaryOperator op,
                            Expression rhs) {
        super(2);
        this.op = op;
        addChild(lhs);
        addChild(rhs);
    }

    @Override
    public BinaryExpression clone() {
        return (BinaryExpression)super.clone();
    }

    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    public BinaryOperator getOperator() {
        return op;
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((BinaryExpression)o).op);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    public void print(PrintWriter o) {
        if (needs_parens) {
            o.print("(");
        }
        getLHS().print(o);
        o.print(" ");
        op.print(o);
        o.print(" ");
        getRHS().print(o);
        if (needs_parens) {
            o.print(")");
        }
    }
}
