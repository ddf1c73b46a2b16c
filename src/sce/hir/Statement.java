package sce.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Common base of the statement kinds. A statement is its own identifier: two
* statements are equal only when they are the same object, and the analyses
* key their per-statement data on that identity. Each statement carries the
* source position it was parsed from, or the one assigned to it by a
* transformation.
*/
public abstract class Statement implements Cloneable, Traversable {

    protected Traversable parent;

    /** Fixed-order child slots; optional slots hold null */
    protected List<Traversable> children;

    protected SourceLocation location;

    /** Shared child list of leaf statements */
    @SuppressWarnings("rawtypes")
    protected static final List empty_list =
            Collections.unmodifiableList(new ArrayList<Object>(0));

    /**
    * Creates an orphan statement with room for <b>size</b> children, or a
    * leaf statement if <b>size</b> is negative.
    */
    @SuppressWarnings("unchecked")
    protected Statement(int size) {
        parent = null;
        children = (size < 0) ? empty_list : new ArrayList<Traversable>(size);
    }

    /**
    * Copies the statement and its subtree. The copy is an orphan and keeps
    * the location of the original.
    */
    @Override
    public Statement clone() {
        Statement copy;
        try {
            copy = (Statement)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError(e);
        }
        copy.parent = null;
        if (children != empty_list) {
            copy.children = new ArrayList<Traversable>(children.size());
            for (Traversable child : children) {
                Traversable child_copy = IRTools.cloneChild(child, this);
                if (child_copy != null) {
                    child_copy.setParent(copy);
                }
                copy.children.add(child_copy);
            }
        }
        return copy;
    }

    @Override
    public final boolean equals(Object o) {
        return (o == this);
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(this);
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
    * Returns the enclosing procedure, or null for a statement that is not
    * attached to one.
    */
    public Procedure getProcedure() {
        Traversable t = parent;
        while (t != null && !(t instanceof Procedure)) {
            t = t.getParent();
        }
        return (Procedure)t;
    }

    public abstract void print(PrintWriter o);

    /** Only compound statements allow a child to be removed. */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(getClass().getSimpleName() +
                " has fixed child slots");
    }

    /**
    * Puts the orphan <b>t</b> in slot <b>index</b>, orphaning the previous
    * occupant.
    */
    public void setChild(int index, Traversable t) {
        if (t == null || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException("no child slot " + index);
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        Traversable old = children.get(index);
        if (old != null) {
            old.setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    /** Appends the orphan <b>t</b>. */
    protected void addChild(Traversable t) {
        addChild(children.size(), t);
    }

    /** Inserts the orphan <b>t</b> at <b>index</b>. */
    protected void addChild(int index, Traversable t) {
        if (t == null || index < 0 || index > children.size()) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        children.add(index, t);
        t.setParent(this);
    }

    public void setLocation(SourceLocation location) {
        this.location = location;
    }

    /**
    * Returns the source location, or null for a statement introduced by a
    * transformation that has not been placed yet.
    */
    public SourceLocation getLocation() {
        return location;
    }

    /** Returns the line of the statement, -1 if it has no location. */
    public int where() {
        return (location == null) ? -1 : location.getLine();
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        PrintWriter pw = new PrintWriter(sw);
        print(pw);
        pw.flush();
        return sw.toString();
    }

    /**
    * Checks the parent/child links of this statement and of the statements
    * below it.
    *
    * @throws IllegalStateException if a link is broken.
    */
    public void verify() throws IllegalStateException {
        if (parent != null &&
                Tools.identityIndexOf(parent.getChildren(), this) < 0) {
            throw new IllegalStateException(
                    "parent does not list " + this + " as a child");
        }
        for (Traversable child : children) {
            if (child == null) {
                continue;
            }
            if (child.getParent() != this) {
                throw new IllegalStateException(
                        "child " + child + " has a different parent");
            }
            if (child instanceof Statement) {
                ((Statement)child).verify();
            }
        }
    }
}
