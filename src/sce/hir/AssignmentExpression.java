package sce.hir;

import java.io.PrintWriter;

/**
* Represents an assignment, plain or compound. The left-hand side is an
* identifier, a dereference or an array access.
*/
public class AssignmentExpression extends Expression {

    protected AssignmentOperator op;

    /**
    * Creates an assignment expression.
    *
    * @param lhs the assigned location.
    * @param op the assignment operator.
    * @param rhs the assigned value.
    */
    public AssignmentExpression(Expression lhs, AssignmentOperator op,
                                Expression rhs) {
        super(2);
        this.op = op;
        addChild(lhs);
        addChild(rhs);
        rhs.setParens(false);
    }

    @Override
    public AssignmentExpression clone() {
        return (AssignmentExpression)super.clone();
    }

    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    public AssignmentOperator getOperator() {
        return op;
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((AssignmentExpression)o).op);
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
