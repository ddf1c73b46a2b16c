package sce.hir;

/**
* Base class of the expressions that consist of a single name.
*/
public abstract class IDExpression extends Expression {

    protected IDExpression() {
        super(-1);
        needs_parens = false;
    }

    /**
    * Returns the name this expression prints.
    */
    public abstract String getName();

    @Override
    public IDExpression clone() {
        return (IDExpression)super.clone();
    }
}
