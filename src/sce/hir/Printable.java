package sce.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print itself as C source text.
*/
public interface Printable {

    /**
    * Prints this object on the specified writer.
    *
    * @param o the target print writer.
    */
    void print(PrintWriter o);
}
