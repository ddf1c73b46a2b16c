package sce.transforms;

import sce.hir.SourceLocation;

/**
* Describes one inlining request: the location of the call, the name of the
* called function and, optionally, the range of lines the inlined block is
* expected to occupy. Only the line numbers of the expected range are
* compared.
*/
public final class InlineSpec {

    private final SourceLocation call_site;

    private final String callee_name;

    private final SourceLocation expected_start;

    private final SourceLocation expected_end;

    public InlineSpec(SourceLocation call_site, String callee_name) {
        this(call_site, callee_name, null, null);
    }

    /**
    * Creates a request with an expected range.
    *
    * @param call_site the location of the call or of the callee name.
    * @param callee_name the name of the function to be inlined.
    * @param expected_start the start of the expected range, or null.
    * @param expected_end the end of the expected range, or null.
    */
    public InlineSpec(SourceLocation call_site, String callee_name,
                      SourceLocation expected_start,
                      SourceLocation expected_end) {
        if (call_site == null || callee_name == null) {
            throw new IllegalArgumentException();
        }
        if ((expected_start == null) != (expected_end == null)) {
            throw new IllegalArgumentException(
                    "expected range needs both ends");
        }
        this.call_site = call_site;
        this.callee_name = callee_name;
        this.expected_start = expected_start;
        this.expected_end = expected_end;
    }

    /**
    * Creates a request from a test descriptor: the call site as a line and
    * a column and the target as a pair of lines.
    */
    public static InlineSpec of(int line, int column, String callee_name,
                                int start_line, int end_line) {
        return new InlineSpec(new SourceLocation(line, column), callee_name,
                              new SourceLocation(start_line, 1),
                              new SourceLocation(end_line, 1));
    }

    public SourceLocation getCallSite() {
        return call_site;
    }

    public String getCalleeName() {
        return callee_name;
    }

    public boolean hasExpectedRange() {
        return (expected_start != null);
    }

    public SourceLocation getExpectedStart() {
        return expected_start;
    }

    public SourceLocation getExpectedEnd() {
        return expected_end;
    }

    @Override
    public String toString() {
        return callee_name + "@" + call_site + (hasExpectedRange() ?
                " -> [" + expected_start.getLine() + ", " +
                expected_end.getLine() + "]" : "");
    }
}
