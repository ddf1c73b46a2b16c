package sce.hir;

import java.io.PrintWriter;

/**
* Represents an if statement. The then and else clauses are always compound
* statements; a single statement passed to the constructor is wrapped.
*/
public class IfStatement extends Statement {

    /**
    * Creates an <var>if</var> statement that has no <var>else</var> clause.
    *
    * @param condition the condition tested by the statement.
    * @param true_clause the code to execute if the condition is true.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public IfStatement(Expression condition, Statement true_clause) {
        super(3);
        addChild(condition);
        condition.setParens(false);
        addChild(toCompound(true_clause));
    }

    /**
    * Creates an <var>if</var> statement that has an <var>else</var> clause.
    *
    * @param condition the condition tested by the statement.
    * @param true_clause the code to execute if the condition is true.
    * @param false_clause the code to execute if the condition is false.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public IfStatement(Expression condition, Statement true_clause,
                       Statement false_clause) {
        this(condition, true_clause);
        addChild(toCompound(false_clause));
    }

    static CompoundStatement toCompound(Statement stmt) {
        if (stmt instanceof CompoundStatement) {
            return (CompoundStatement)stmt;
        }
        CompoundStatement cs = new CompoundStatement();
        cs.addStatement(stmt);
        return cs;
    }

    /** Returns the expression used as a branch condition. */
    public Expression getControlExpression() {
        return (Expression)children.get(0);
    }

    /** Returns the then clause of the if statement. */
    public CompoundStatement getThenStatement() {
        return (CompoundStatement)children.get(1);
    }

    /**
    * Returns the else clause of the if statement.
    *
    * @return the else clause or null if it does not exist.
    */
    public CompoundStatement getElseStatement() {
        if (children.size() > 2) {
            return (CompoundStatement)children.get(2);
        } else {
            return null;
        }
    }

    public void print(PrintWriter o) {
        o.print("if (");
        getControlExpression().print(o);
        o.println(")");
        getThenStatement().print(o);
        if (getElseStatement() != null) {
            o.println();
            o.println("else");
            getElseStatement().print(o);
        }
    }
}
