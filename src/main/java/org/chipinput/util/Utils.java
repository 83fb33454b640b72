package org.chipinput.util;

import java.util.Locale;

/**
 * Small string helpers shared by the parsers and writers.
 */
public final class Utils {

    private Utils() {
    }

    public static String escapeCsvField(String field) {
        if (field == null) {
            return "";
        } else {
            boolean mustQuote = field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r");
            String escaped = field.replace("\"", "\"\"");
            return mustQuote ? "\"" + escaped + "\"" : escaped;
        }
    }

    public static String stripTrailingSlash(String path) {
        if (path == null) return "";
        String p = path;
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    static String removeEnclQuotes(String input) {
        return input != null && input.length() > 1 && input.startsWith("\"") && input.endsWith("\"")
                ? input.substring(1, input.length() - 1) : input;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank() || "nan".equalsIgnoreCase(value.trim());
    }

    /**
     * Parses a {@code True}/{@code False} cell; blank cells give {@code null}.
     */
    public static Boolean parseBoolean(String value) {
        String v = removeEnclQuotes(value == null ? null : value.trim());
        if (isBlank(v)) return null;
        switch (v.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "0":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("Not a boolean value: '" + value + "'");
        }
    }

    /**
     * Parses an integer cell, accepting {@code 36.0} style values; blank cells give {@code null}.
     */
    public static Integer parseInteger(String value) {
        String v = removeEnclQuotes(value == null ? null : value.trim());
        if (isBlank(v)) return null;
        try {
            return Integer.valueOf(v);
        } catch (NumberFormatException e) {
            double d = Double.parseDouble(v);
            if (d != Math.rint(d)) throw new IllegalArgumentException("Not an integer value: '" + value + "'");
            if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Integer value out of range: '" + value + "'");
            }
            return (int) d;
        }
    }
}
