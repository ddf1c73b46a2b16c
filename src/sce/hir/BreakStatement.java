package sce.hir;

import java.io.PrintWriter;

/**
* Represents a <b>break</b> statement.
*/
public class BreakStatement extends Statement {

    public BreakStatement() {
        super(-1);
    }

    public void print(PrintWriter o) {
        o.print("break;");
    }
}
