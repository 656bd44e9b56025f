package org.carball.probe.engine;

import org.carball.probe.model.ObjectFilter;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises the narrow family of metadata queries the object model can answer:
 * {@code INFO.<KIND>()} functions and {@code $SYSTEM.TMSCHEMA_<KIND>} views, optionally
 * wrapped in {@code TOPN(n, ...)} and filtered on one column by equality.
 *
 * <p>This is pattern matching over query text, not a DAX parser.
 */
public record MetadataQuery(MetadataKind kind, Integer topN, ObjectFilter filter) {

    private static final Pattern INFO_FUNCTION = Pattern.compile("INFO\\.(\\w+)\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern TMSCHEMA_VIEW = Pattern.compile("\\$SYSTEM\\.TMSCHEMA_(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOPN = Pattern.compile("TOPN\\s*\\(\\s*(\\d+)\\s*,", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAX_FILTER = Pattern.compile(
            "FILTER\\s*\\(.*?,\\s*\\[(\\w+)\\]\\s*=\\s*(?:\"([^\"]*)\"|(-?\\d+))",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern DMV_WHERE = Pattern.compile(
            "WHERE\\s+\\[?(\\w+)\\]?\\s*=\\s*(?:'([^']*)'|(-?\\d+))",
            Pattern.CASE_INSENSITIVE);

    /**
     * Parses a query, returning empty when it is not a recognised metadata query.
     */
    public static Optional<MetadataQuery> parse(String queryText) {
        if (queryText == null) {
            return Optional.empty();
        }

        Optional<MetadataKind> kind = firstGroup(INFO_FUNCTION, queryText)
                .or(() -> firstGroup(TMSCHEMA_VIEW, queryText))
                .flatMap(MetadataKind::fromName);
        if (kind.isEmpty()) {
            return Optional.empty();
        }

        Integer topN = firstGroup(TOPN, queryText).map(Integer::valueOf).orElse(null);
        ObjectFilter filter = parseFilter(DAX_FILTER, queryText)
                .or(() -> parseFilter(DMV_WHERE, queryText))
                .orElse(null);

        return Optional.of(new MetadataQuery(kind.get(), topN, filter));
    }

    /**
     * Builds the DAX text for a metadata query.
     */
    public static String toQueryText(MetadataKind kind, ObjectFilter filter, Integer topN) {
        String expression = kind.infoFunction() + "()";
        if (filter != null) {
            expression = "FILTER(" + expression + ", [" + filter.column() + "] = " + literal(filter.value()) + ")";
        }
        if (topN != null && topN > 0) {
            expression = "TOPN(" + topN + ", " + expression + ")";
        }
        return "EVALUATE " + expression;
    }

    private static String literal(String value) {
        if (value.matches("-?\\d+")) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<ObjectFilter> parseFilter(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
        return Optional.of(new ObjectFilter(matcher.group(1), value));
    }
}
