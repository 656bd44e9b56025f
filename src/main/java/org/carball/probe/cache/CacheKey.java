package org.carball.probe.cache;

import org.carball.probe.model.QueryRequest;

/**
 * Cache key: query text with whitespace collapsed, plus the row limit. Case is significant.
 * Whitespace inside {@code "..."} literals, {@code '...'} table names and {@code [...]}
 * references is kept as written.
 */
public record CacheKey(String normalizedText, int maxRows) {

    public static CacheKey of(String text, int maxRows) {
        return new CacheKey(normalize(text), maxRows);
    }

    public static CacheKey of(QueryRequest request) {
        return of(request.text(), request.maxRows());
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }

        String trimmed = text.trim();
        StringBuilder normalized = new StringBuilder(trimmed.length());
        char closing = 0;
        boolean pendingSpace = false;

        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (closing != 0) {
                // Doubled delimiters ("" '' ]]) close and reopen, which keeps the contents intact
                normalized.append(c);
                if (c == closing) {
                    closing = 0;
                }
                continue;
            }
            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace) {
                normalized.append(' ');
                pendingSpace = false;
            }
            normalized.append(c);
            closing = closingDelimiter(c);
        }
        return normalized.toString();
    }

    private static char closingDelimiter(char c) {
        switch (c) {
            case '"':
                return '"';
            case '\'':
                return '\'';
            case '[':
                return ']';
            default:
                return 0;
        }
    }
}
