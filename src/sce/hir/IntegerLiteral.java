package sce.hir;

import java.io.PrintWriter;

/**
* Represents an integer constant.
*/
public class IntegerLiteral extends Literal {

    private final long value;

    public IntegerLiteral(long value) {
        super();
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public IntegerLiteral clone() {
        return (IntegerLiteral)super.clone();
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof IntegerLiteral &&
                ((IntegerLiteral)o).value == value);
    }

    @Override
    public int hashCode() {
        return Long.valueOf(value).hashCode();
    }

    public void print(PrintWriter o) {
        o.print(value);
    }
}
