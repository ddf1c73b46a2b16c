package sce.hir;

/**
* Thrown when an IR object is expected to be a child of another object but is
* not.
*/
public class NotAChildException extends RuntimeException {

    private static final long serialVersionUID = 3479L;

    public NotAChildException() {
        super();
    }

    public NotAChildException(String message) {
        super(message);
    }
}
