package sce.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Base class for all declarations.
*/
public abstract class Declaration implements Cloneable, Traversable {

    /** The parent object */
    protected Traversable parent;

    /** The children of the declaration */
    protected List<Traversable> children;

    /** The position of the declaration, null if not known */
    protected SourceLocation location;

    protected Declaration() {
        parent = null;
        children = new ArrayList<Traversable>(1);
    }

    /** Returns a deep clone of this declaration. */
    @Override
    public Declaration clone() {
        Declaration o = null;
        try {
            o = (Declaration)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.parent = null;
        o.children = new ArrayList<Traversable>(children.size());
        for (int i = 0; i < children.size(); i++) {
            Traversable o_child = IRTools.cloneChild(children.get(i), this);
            if (o_child != null) {
                o_child.setParent(o);
            }
            o.children.add(o_child);
        }
        return o;
    }

    /**
    * Returns the symbols declared by this declaration.
    *
    * @return the list of declared symbols.
    */
    public abstract List<Symbol> getDeclaredSymbols();

    public abstract void print(PrintWriter o);

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Declarations do not support removal of arbitrary children.");
    }

    public void setChild(int index, Traversable t) {
        if (t == null || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    protected void addChild(Traversable t) {
        if (t == null) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    public void setLocation(SourceLocation location) {
        this.location = location;
    }

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
