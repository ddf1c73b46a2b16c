package sce.transforms;

/**
* Thrown when the function to be inlined is recursive or calls, directly or
* indirectly, the function containing the call site.
*/
public class RecursiveInlineException extends InlineException {

    private static final long serialVersionUID = 3502L;

    private final String function_name;

    public RecursiveInlineException(String function_name, String caller) {
        super("inlining " + function_name + " into " + caller +
              " results in a recursion");
        this.function_name = function_name;
    }

    public String getFunctionName() {
        return function_name;
    }
}
