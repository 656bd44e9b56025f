package org.carball.probe.engine;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Model metadata collections that both query surfaces can enumerate.
 */
public enum MetadataKind {
    TABLES("ID", "Name", "Description", "IsHidden", "DataCategory"),
    COLUMNS("ID", "TableID", "Table", "ExplicitName", "DataType", "Type", "Expression", "IsHidden",
            "FormatString"),
    MEASURES("ID", "TableID", "Table", "Name", "Expression", "FormatString", "IsHidden", "DisplayFolder"),
    RELATIONSHIPS("ID", "Name", "FromTableID", "FromColumnID", "ToTableID", "ToColumnID", "FromTable",
            "FromColumn", "ToTable", "ToColumn", "IsActive", "CrossFilteringBehavior", "FromCardinality",
            "ToCardinality"),
    PARTITIONS("ID", "TableID", "Table", "Name", "Mode", "SourceType", "QueryDefinition"),
    EXPRESSIONS("ID", "Name", "Kind", "Expression"),
    DATASOURCES("ID", "Name", "Type", "ConnectionString");

    private final List<String> columns;

    MetadataKind(String... columns) {
        this.columns = List.of(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    /** Name of the DAX INFO function, e.g. {@code INFO.TABLES}. */
    public String infoFunction() {
        return "INFO." + name();
    }

    /** Whether rows of this kind carry a {@code TableID} and can be scoped to one table. */
    public boolean isTableScoped() {
        return columns.contains("TableID");
    }

    public static Optional<MetadataKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (MetadataKind kind : values()) {
            if (kind.name().equals(upper)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
