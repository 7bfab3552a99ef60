package com.codesandbox.engine.service;

/** Shortens request and response contents before they go to the log. */
public final class LogPreview {

    public static final int MAX_LENGTH = 1000;

    private LogPreview() {}

    public static String truncate(String text) {
        return truncate(text, MAX_LENGTH);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "...(" + (text.length() - maxLength) + " more chars)";
    }
}
