package sce.transforms;

/**
* Thrown when a call cannot be inlined. Subclasses name the specific reasons
* callers may want to tell apart.
*/
public class InlineException extends RuntimeException {

    private static final long serialVersionUID = 3500L;

    public InlineException(String message) {
        super(message);
    }
}
