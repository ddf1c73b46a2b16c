package sce.hir;

import java.io.PrintWriter;

/**
* Represents a single array dimension in a declarator, for example
* <b>[100]</b>. Macro dimensions are expected to be expanded upstream.
*/
public class ArraySpecifier extends Specifier {

    /** The dimension; -1 when the dimension is not specified. */
    private final int dimension;

    /** Constructs an array specifier with an unspecified dimension. */
    public ArraySpecifier() {
        this(-1);
    }

    public ArraySpecifier(int dimension) {
        super("[]");
        this.dimension = dimension;
    }

    @Override
    public void print(PrintWriter o) {
        o.print("[");
        if (dimension >= 0) {
            o.print(dimension);
        }
        o.print("]");
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof ArraySpecifier &&
                ((ArraySpecifier)o).dimension == dimension);
    }

    @Override
    public int hashCode() {
        return 17 + dimension;
    }

    @Override
    public String toString() {
        return (dimension >= 0) ? "[" + dimension + "]" : "[]";
    }
}
