package sce.hir;

import java.io.PrintWriter;

/**
* Represents a name with no declaration in the translation unit, such as a
* library function called from the program.
*/
public class NameID extends IDExpression {

    private final String name;

    public NameID(String name) {
        super();
        this.name = name;
    }

    @Override
    public NameID clone() {
        return (NameID)super.clone();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof NameID && ((NameID)o).name.equals(name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    public void print(PrintWriter o) {
        o.print(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
