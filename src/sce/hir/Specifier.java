package sce.hir;

import java.io.PrintWriter;

/**
* Represents type specifiers and modifiers.
*/
public class Specifier implements Printable {

    public static final Specifier CHAR = new Specifier("char");
    public static final Specifier CONST = new Specifier("const");
    public static final Specifier DOUBLE = new Specifier("double");
    public static final Specifier EXTERN = new Specifier("extern");
    public static final Specifier FLOAT = new Specifier("float");
    public static final Specifier INT = new Specifier("int");
    public static final Specifier LONG = new Specifier("long");
    public static final Specifier SHORT = new Specifier("short");
    public static final Specifier SIGNED = new Specifier("signed");
    public static final Specifier STATIC = new Specifier("static");
    public static final Specifier UNSIGNED = new Specifier("unsigned");
    public static final Specifier VOID = new Specifier("void");
    public static final Specifier VOLATILE = new Specifier("volatile");

    /** The keyword printed for this specifier */
    protected final String name;

    protected Specifier(String name) {
        this.name = name;
    }

    /**
    * Checks if this specifier only qualifies the storage or access of a
    * symbol rather than its type.
    *
    * @return true for storage-class and qualifier keywords.
    */
    public boolean isQualifier() {
        return (this == CONST || this == EXTERN || this == STATIC ||
                this == VOLATILE);
    }

    public void print(PrintWriter o) {
        o.print(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
