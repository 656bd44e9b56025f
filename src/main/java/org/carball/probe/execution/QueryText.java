package org.carball.probe.execution;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a bare DAX expression into a runnable query.
 */
public final class QueryText {

    private static final Pattern TABLE_FUNCTION = Pattern.compile(
            "\\b(SELECTCOLUMNS|ADDCOLUMNS|SUMMARIZECOLUMNS|SUMMARIZE|FILTER|VALUES|ALL|TOPN|SAMPLE"
                    + "|CALCULATETABLE|DATATABLE)\\s*\\(|\\bINFO\\.",
            Pattern.CASE_INSENSITIVE);

    private QueryText() {
    }

    /**
     * Returns the text unchanged when it is already a complete query, otherwise wraps it:
     * table expressions in {@code EVALUATE} (with {@code TOPN} when {@code topN > 0}),
     * scalar expressions in {@code EVALUATE ROW("Value", ...)}.
     */
    public static String prepare(String text, int topN) {
        String trimmed = text.trim();
        if (isCompleteQuery(trimmed)) {
            return trimmed;
        }
        if (isTableExpression(trimmed)) {
            return topN > 0
                    ? "EVALUATE TOPN(" + topN + ", " + trimmed + ")"
                    : "EVALUATE " + trimmed;
        }
        return "EVALUATE ROW(\"Value\", " + trimmed + ")";
    }

    public static boolean isCompleteQuery(String text) {
        String upper = text.trim().toUpperCase(Locale.ROOT);
        return upper.startsWith("EVALUATE") || upper.startsWith("DEFINE") || upper.startsWith("SELECT");
    }

    public static boolean isTableExpression(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return true;
        }
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return true;
        }
        return TABLE_FUNCTION.matcher(trimmed).find();
    }
}
