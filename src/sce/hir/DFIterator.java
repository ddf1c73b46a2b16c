package sce.hir;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Depth-first, pre-order iterator over an IR subtree that returns only the
* nodes of a requested type. The iterator keeps no work list; the next node
* is found by walking the tree from the node returned last. Null children
* (missing optional parts) are skipped.
*/
public class DFIterator<E extends Traversable> {

    /** The initial IR node of the iterator */
    private Traversable root;

    /** The next IR node to be returned */
    private Traversable next;

    /** The IR node type to be returned */
    private Class<? extends Traversable> type;

    /**
    * Constructs a new iterator that returns every node of the subtree.
    *
    * @param root the initial node for the iteration.
    */
    public DFIterator(Traversable root) {
        this(root, Traversable.class);
    }

    /**
    * Constructs a new iterator that returns the nodes of the given type.
    *
    * @param root the initial node for the iteration.
    * @param c the IR class type to be iterated over.
    */
    public DFIterator(Traversable root, Class<? extends Traversable> c) {
        this.root = root;
        this.type = c;
        reset();
    }

    public boolean hasNext() {
        return (next != null);
    }

    /**
    * Returns the next IR node.
    *
    * @throws NoSuchElementException if there are no more nodes.
    */
    @SuppressWarnings("unchecked")
    public E next() {
        if (next == null) {
            throw new NoSuchElementException();
        }
        E ret = (E)next;
        next = findNext(ret);
        return ret;
    }

    /** Restarts the iteration from the root. */
    public void reset() {
        if (type.isInstance(root)) {
            next = root;
        } else {
            next = findNext(root);
        }
    }

    /**
    * Collects the remaining nodes into a list.
    */
    public List<E> getList() {
        List<E> ret = new ArrayList<E>();
        while (hasNext()) {
            ret.add(next());
        }
        return ret;
    }

    // Searches the subtree of t first, then the unvisited right siblings of
    // t and of its ancestors up to the root.
    private Traversable findNext(Traversable t) {
        Traversable ret = findNext(t, 0);
        Traversable child = t;
        while (ret == null && child != root) {
            Traversable parent = child.getParent();
            if (parent == null) {
                break;
            }
            int pos = Tools.identityIndexOf(parent.getChildren(), child);
            ret = findNext(parent, pos + 1);
            child = parent;
        }
        return ret;
    }

    private Traversable findNext(Traversable t, int pos) {
        List<Traversable> children = t.getChildren();
        if (children == null) {
            return null;
        }
        for (int i = pos; i < children.size(); i++) {
            Traversable child = children.get(i);
            if (child == null) {
                continue;
            }
            if (type.isInstance(child)) {
                return child;
            }
            Traversable ret = findNext(child, 0);
            if (ret != null) {
                return ret;
            }
        }
        return null;
    }

}
