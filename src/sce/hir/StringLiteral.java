package sce.hir;

import java.io.PrintWriter;

/**
* Represents a string constant. The value is kept without the enclosing
* quotes and escape sequences are kept as written.
*/
public class StringLiteral extends Literal {

    private final String value;

    public StringLiteral(String value) {
        super();
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public StringLiteral clone() {
        return (StringLiteral)super.clone();
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof StringLiteral &&
                ((StringLiteral)o).value.equals(value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    public void print(PrintWriter o) {
        o.print("\"" + value + "\"");
    }
}
