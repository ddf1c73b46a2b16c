package sce.hir;

import java.util.List;

/**
* Tools for general-purpose operations that do not belong to a specific IR
* class.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the index of the element in the list using reference equality
    * instead of {@code equals}.
    *
    * @param list the list to be searched.
    * @param obj the object being searched for.
    * @return the index of the object, or -1 if it is not in the list.
    */
    public static int identityIndexOf(List<?> list, Object obj) {
        int list_size = list.size();
        for (int i = 0; i < list_size; i++) {
            if (list.get(i) == obj) {
                return i;
            }
        }
        return -1;
    }

    /**
    * Checks whether the list contains the object by reference.
    */
    public static boolean containsByReference(List<?> list, Object obj) {
        return (identityIndexOf(list, obj) >= 0);
    }

    /**
    * Returns the current system time in seconds.
    */
    public static double getTime() {
        return (System.currentTimeMillis() / 1000.0);
    }

    /**
    * Returns the elapsed time in seconds since the given reference time.
    *
    * @param since the reference time
    * @return the elapsed time in seconds
    */
    public static double getTime(double since) {
        return (System.currentTimeMillis() / 1000.0 - since);
    }
}
