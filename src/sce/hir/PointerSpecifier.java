package sce.hir;

/**
* Represents a <b>*</b> in a declarator.
*/
public class PointerSpecifier extends Specifier {

    /** * */
    public static final PointerSpecifier UNQUALIFIED = new PointerSpecifier();

    private PointerSpecifier() {
        super("*");
    }
}
