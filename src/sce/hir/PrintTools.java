package sce.hir;

import java.io.PrintWriter;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
* Printing helpers for IR lists and status messages. Status messages go to
* {@link System#err} when the verbosity level, set through the
* <b>-verbosity</b> option, is at least the level of the message:
* 0 for warnings, 1 for pass begin/end, 2 for per-procedure summaries,
* 3 and 4 for graph and edge dumps.
*/
public final class PrintTools {

    public static final String line_sep = System.getProperty("line.separator");

    private static volatile int verbosity = 0;

    private PrintTools() {
    }

    public static void setVerbosity(int level) {
        verbosity = level;
    }

    public static int getVerbosity() {
        return verbosity;
    }

    /**
    * Prints <b>items</b> separated by spaces if the verbosity is at least
    * <b>min_verbosity</b>. Nothing is converted to a string otherwise.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity > verbosity || items.length == 0) {
            return;
        }
        StringBuilder sb = new StringBuilder(80);
        sb.append(items[0]);
        for (int i = 1; i < items.length; i++) {
            sb.append(" ").append(items[i]);
        }
        System.err.println(sb);
    }

    /** Prints the elements of <b>list</b> separated by ", ". */
    public static void printListWithComma(List<? extends Printable> list,
                                          PrintWriter w) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                w.print(", ");
            }
            list.get(i).print(w);
        }
    }

    /** Joins the string forms of <b>coll</b> with <b>separator</b>. */
    public static String collectionToString(Collection<?> coll,
                                            String separator) {
        StringBuilder sb = new StringBuilder(80);
        Iterator<?> iter = coll.iterator();
        while (iter.hasNext()) {
            sb.append(iter.next());
            if (iter.hasNext()) {
                sb.append(separator);
            }
        }
        return sb.toString();
    }
}
