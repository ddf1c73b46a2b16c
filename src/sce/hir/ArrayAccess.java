package sce.hir;

import java.io.PrintWriter;

/**
* Represents a subscript, <b>a[i]</b>. A multi-dimensional access nests
* array accesses.
*/
public class ArrayAccess extends Expression {

    public ArrayAccess(Expression array, Expression index) {
        super(2);
        needs_parens = false;
        addChild(array);
        addChild(index);
        index.setParens(false);
    }

    @Override
    public ArrayAccess clone() {
        return (ArrayAccess)super.clone();
    }

    public Expression getArrayName() {
        return (Expression)children.get(0);
    }

    public Expression getIndex() {
        return (Expression)children.get(1);
    }

    public void print(PrintWriter o) {
        getArrayName().print(o);
        o.print("[");
        getIndex().print(o);
        o.print("]");
    }
}
