package sce.hir;

import java.util.ArrayList;
import java.util.List;

/**
* <b>IRTools</b> provides tools that perform search/replace in the IR tree.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Returns a deep copy of a child of the given owner. Used by the clone
    * methods of the IR classes; optional children are null.
    *
    * @param child the child to be copied, possibly null.
    * @param owner the object that holds the child.
    * @return the copied child or null.
    */
    static Traversable cloneChild(Traversable child, Traversable owner) {
        if (child == null) {
            return null;
        } else if (child instanceof Statement) {
            return ((Statement)child).clone();
        } else if (child instanceof Expression) {
            return ((Expression)child).clone();
        } else if (child instanceof Declaration) {
            return ((Declaration)child).clone();
        } else if (child instanceof VariableDeclarator) {
            return ((VariableDeclarator)child).clone();
        } else {
            throw new InternalError("cannot clone " +
                    child.getClass().getName() + " in " +
                    owner.getClass().getName());
        }
    }

    /**
    * Returns the descendents of {@code t} with the specified type in
    * pre-order, excluding {@code t} itself.
    */
    public static <T extends Traversable> List<T>
            getDescendentsOfType(Traversable t, Class<T> type) {
        List<T> ret = (new DFIterator<T>(t, type)).getList();
        if (type.isInstance(t)) {
            ret.remove(0);
        }
        return ret;
    }

    /**
    * Checks if {@code des} is a proper descendant of {@code anc}.
    */
    public static boolean isDescendantOf(Traversable des, Traversable anc) {
        Traversable t = des;
        while (t != null && t != anc) {
            t = t.getParent();
        }
        return (des != anc && t == anc);
    }

    /**
    * Checks if the subtree contains a node of the given type.
    */
    public static boolean
            containsClass(Traversable t, Class<? extends Traversable> type) {
        return new DFIterator<Traversable>(t, type).hasNext();
    }

    /**
    * Returns the function calls in {@code t} in pre-order.
    */
    public static List<FunctionCall> getFunctionCalls(Traversable t) {
        return (new DFIterator<FunctionCall>(t, FunctionCall.class)).getList();
    }

    /**
    * Replaces an expression in the tree with another, orphan expression.
    *
    * @param old_expr the expression to be replaced, which must have a parent.
    * @param new_expr the replacing expression.
    * @throws IllegalArgumentException if <b>old_expr</b> has no parent.
    */
    public static void replaceExpression(Expression old_expr,
                                         Expression new_expr) {
        Traversable parent = old_expr.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("expression has no parent");
        }
        int index = Tools.identityIndexOf(parent.getChildren(), old_expr);
        if (index < 0) {
            throw new NotAChildException();
        }
        parent.setChild(index, new_expr);
    }

    /**
    * Returns the child positions that lead from {@code root} to {@code t}.
    * Together with {@link #getByPath} this finds the copy of a node in a
    * cloned tree.
    *
    * @throws IllegalArgumentException if {@code t} is not under {@code root}.
    */
    public static List<Integer> getPath(Traversable root, Traversable t) {
        List<Integer> ret = new ArrayList<Integer>();
        Traversable child = t;
        while (child != root) {
            Traversable parent = child.getParent();
            if (parent == null) {
                throw new IllegalArgumentException("not a descendant");
            }
            ret.add(0, Tools.identityIndexOf(parent.getChildren(), child));
            child = parent;
        }
        return ret;
    }

    /**
    * Returns the node reached by following the child positions from
    * {@code root}.
    */
    public static Traversable getByPath(Traversable root, List<Integer> path) {
        Traversable ret = root;
        for (int index : path) {
            ret = ret.getChildren().get(index);
        }
        return ret;
    }
}
