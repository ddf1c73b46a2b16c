package sce.hir;

/**
* Base class of the constant expressions.
*/
public abstract class Literal extends Expression {

    protected Literal() {
        super(-1);
        needs_parens = false;
    }

    @Override
    public Literal clone() {
        return (Literal)super.clone();
    }
}
