package com.findinpath.hierarchy;

public class Utils {
    private Utils() {
    }

    /**
     * Rethrows the given exception without wrapping it, even when it is checked.
     */
    public static <E extends Throwable> void sneakyThrow(Throwable e) throws E {
        throw (E) e;
    }
}
