package org.carball.probe.execution;

import org.carball.probe.engine.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Suggests next steps for a failed query based on the engine's error text.
 */
public class QueryErrorAdvisor {

    public List<String> suggest(ErrorKind kind, String errorMessage) {
        List<String> suggestions = new ArrayList<>();
        String error = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
        boolean missing = error.contains("not found") || error.contains("doesn't exist")
                || error.contains("does not exist") || error.contains("cannot find");

        if (kind == ErrorKind.BLOCKED_INTERFACE) {
            suggestions.add("The introspection interface is restricted in this deployment");
            suggestions.add("Load a model definition file so metadata queries can use the object model");
            return suggestions;
        }
        if (kind == ErrorKind.UNSUPPORTED) {
            suggestions.add("Rewrite the request as an INFO.<KIND>() metadata query");
            return suggestions;
        }

        if (error.contains("table") && missing) {
            suggestions.add("Verify the table exists with INFO.TABLES()");
            suggestions.add("Check case-sensitive spelling");
            suggestions.add("Try single quotes: 'TableName'");
        }
        if (error.contains("column") && missing) {
            suggestions.add("Verify the column with INFO.COLUMNS()");
            suggestions.add("Check case-sensitive spelling");
            suggestions.add("Try 'Table'[Column] syntax");
        }
        if (error.contains("syntax")) {
            suggestions.add("Ensure EVALUATE for table expressions");
            suggestions.add("Check balanced delimiters");
            suggestions.add("Verify function parameters");
        }
        if (error.contains("function")) {
            suggestions.add("Check function name spelling");
            suggestions.add("Verify parameter types and count");
        }
        if (error.contains("measure") && error.contains("error")) {
            suggestions.add("Check for circular dependencies");
            suggestions.add("Test expressions individually");
        }
        if (suggestions.isEmpty()) {
            suggestions.add("Check DAX syntax");
            suggestions.add("Verify references exist");
            suggestions.add("Simplify query to isolate issue");
        }
        return suggestions;
    }
}
