package com.conveyal.stitcher.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Convenience functions for working with exceptions (or more generally throwables).
 */
public abstract class ExceptionUtils {

    /** Stack frames from classes in this package prefix are the ones worth showing in a filtered trace. */
    private static final String OWN_PACKAGE_PREFIX = "com.conveyal.";

    /**
     * Returns the output of Throwable.printStackTrace() in a String.
     * This is the usual Java stack trace we're accustomed to seeing on the console.
     */
    public static String stackTraceString (Throwable throwable) {
        StringWriter sw = new StringWriter();
        throwable.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * Short-form exception summary that includes the chain of causality, reversed such that the root cause comes first.
     */
    public static String shortCauseString (Throwable throwable) {
        List<String> items = new ArrayList<>();
        Set<Throwable> seen = new HashSet<>(); // Bail out if there are cycles in the cause chain
        while (throwable != null && !seen.contains(throwable)) {
            String item = throwable.getClass().getSimpleName();
            if (throwable.getMessage() != null) {
                item += ": " + throwable.getMessage();
            }
            items.add(item);
            seen.add(throwable);
            throwable = throwable.getCause();
        }
        Collections.reverse(items);
        return String.join(", caused ", items);
    }

    /**
     * A minimal stack trace: the short cause string followed by only the frames within our own code, which are
     * usually enough to locate the problem without scrolling through Jetty and Spark frames.
     */
    public static String filterStackTrace (Throwable throwable) {
        StringBuilder builder = new StringBuilder(shortCauseString(throwable));
        for (StackTraceElement element : throwable.getStackTrace()) {
            if (element.getClassName().startsWith(OWN_PACKAGE_PREFIX)) {
                builder.append("\n    at ").append(element);
            }
        }
        return builder.toString();
    }

}
