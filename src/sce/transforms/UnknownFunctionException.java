package sce.transforms;

/**
* Thrown when the function to be inlined has no definition in the unit.
*/
public class UnknownFunctionException extends InlineException {

    private static final long serialVersionUID = 3501L;

    private final String function_name;

    public UnknownFunctionException(String function_name) {
        super("no definition of " + function_name);
        this.function_name = function_name;
    }

    public String getFunctionName() {
        return function_name;
    }
}
