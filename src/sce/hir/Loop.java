package sce.hir;

/**
* Common interface of the loop statements.
*/
public interface Loop {

    /** Returns the loop body. */
    Statement getBody();

    /** Returns the controlling condition, null if there is none. */
    Expression getCondition();

    /** Replaces the controlling condition. */
    void setCondition(Expression cond);
}
