package sce.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Common base of the expression kinds. Unlike statements, expressions compare
* by structure: two expressions of the same class with equal children are
* equal, which lets the dataflow code use them as keys.
*/
public abstract class Expression implements Cloneable, Traversable {

    protected Traversable parent;

    /** Operands in evaluation order; every child is an expression */
    protected List<Traversable> children;

    protected SourceLocation location;

    /** Print an enclosing pair of parentheses */
    protected boolean needs_parens;

    @SuppressWarnings("rawtypes")
    protected static final List empty_list =
            Collections.unmodifiableList(new ArrayList<Object>(0));

    /**
    * Creates an orphan expression with room for <b>size</b> operands, or a
    * leaf if <b>size</b> is negative.
    */
    @SuppressWarnings("unchecked")
    protected Expression(int size) {
        parent = null;
        children = (size < 0) ? empty_list : new ArrayList<Traversable>(size);
        needs_parens = true;
    }

    @Override
    public Expression clone() {
        Expression copy;
        try {
            copy = (Expression)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError(e);
        }
        copy.parent = null;
        if (children != empty_list) {
            copy.children = new ArrayList<Traversable>(children.size());
            for (Traversable child : children) {
                Traversable child_copy = IRTools.cloneChild(child, this);
                child_copy.setParent(copy);
                copy.children.add(child_copy);
            }
        }
        return copy;
    }

    /**
    * Same class and equal operands. Subclasses with their own fields (an
    * operator, a symbol, a value) extend this check.
    */
    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Returns the statement this expression is part of, or null if it is not
    * attached to a statement.
    */
    public Statement getStatement() {
        Traversable t = parent;
        while (t != null && !(t instanceof Statement)) {
            t = t.getParent();
        }
        return (Statement)t;
    }

    public abstract void print(PrintWriter o);

    /** Operands cannot be removed, only replaced. */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(getClass().getSimpleName() +
                " has fixed operands");
    }

    /**
    * Replaces operand <b>index</b> with the orphan expression <b>t</b>.
    *
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    * @throws IllegalArgumentException if <b>t</b> is not an expression or
    *   there is no such operand.
    */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        if (!(t instanceof Expression) || index < 0 ||
                index >= children.size()) {
            throw new IllegalArgumentException("no operand " + index);
        }
        Traversable old = children.get(index);
        if (old != null) {
            old.setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    protected void addChild(Traversable t) {
        if (t == null) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    public void setParens(boolean f) {
        needs_parens = f;
    }

    public void setLocation(SourceLocation location) {
        this.location = location;
    }

    /** Returns the location, null for expressions built by a transformation. */
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        PrintWriter pw = new PrintWriter(sw);
        print(pw);
        pw.flush();
        return sw.toString();
    }
}
