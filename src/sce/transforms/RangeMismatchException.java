package sce.transforms;

/**
* Thrown when the lines occupied by an inlined block differ from the range
* the caller expected.
*/
public class RangeMismatchException extends InlineException {

    private static final long serialVersionUID = 3503L;

    private final int expected_min;
    private final int expected_max;
    private final int actual_min;
    private final int actual_max;

    public RangeMismatchException(int expected_min, int expected_max,
                                  int actual_min, int actual_max) {
        super("inlined block occupies lines [" + actual_min + ", " +
              actual_max + "], expected [" + expected_min + ", " +
              expected_max + "]");
        this.expected_min = expected_min;
        this.expected_max = expected_max;
        this.actual_min = actual_min;
        this.actual_max = actual_max;
    }

    public int getExpectedMinLine() {
        return expected_min;
    }

    public int getExpectedMaxLine() {
        return expected_max;
    }

    public int getActualMinLine() {
        return actual_min;
    }

    public int getActualMaxLine() {
        return actual_max;
    }
}
