package sce.hir;

/**
* Thrown when a symbol is declared twice in the same scope.
*/
public class DuplicateSymbolException extends RuntimeException {

    private static final long serialVersionUID = 3481L;

    public DuplicateSymbolException(String message) {
        super(message);
    }
}
