package sce.hir;

import java.io.PrintWriter;

/**
* Represents a <b>continue</b> statement.
*/
public class ContinueStatement extends Statement {

    public ContinueStatement() {
        super(-1);
    }

    public void print(PrintWriter o) {
        o.print("continue;");
    }
}
