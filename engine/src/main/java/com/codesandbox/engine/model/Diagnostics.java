package com.codesandbox.engine.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Formats failures into the error text returned to callers:
 * {@code "<message>\n\nTraceback:\n<stack trace>"}.
 */
public final class Diagnostics {

    private Diagnostics() {}

    public static String withTraceback(String message, Throwable t) {
        return message + "\n\nTraceback:\n" + stackTrace(t);
    }

    public static String withTraceback(Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return withTraceback(message, t);
    }

    public static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
