package org.carball.probe.resolve;

import java.util.List;

/**
 * Model object kinds whose opaque identifiers appear as foreign keys in metadata rows.
 */
public enum IdentifierKind {

    TABLE("EVALUATE INFO.TABLES()", "TableID",
            List.of("Name", "TABLE_NAME"),
            List.of("ID", "TableID")),

    COLUMN("EVALUATE INFO.COLUMNS()", "ColumnID",
            List.of("ExplicitName", "InferredName", "Name", "COLUMN_NAME"),
            List.of("ID", "ColumnID"));

    private final String enumerationQuery;
    private final String idSuffix;
    private final List<String> nameKeys;
    private final List<String> idKeys;

    IdentifierKind(String enumerationQuery, String idSuffix, List<String> nameKeys, List<String> idKeys) {
        this.enumerationQuery = enumerationQuery;
        this.idSuffix = idSuffix;
        this.nameKeys = nameKeys;
        this.idKeys = idKeys;
    }

    public String getEnumerationQuery() {
        return enumerationQuery;
    }

    public List<String> getNameKeys() {
        return nameKeys;
    }

    public List<String> getIdKeys() {
        return idKeys;
    }

    /**
     * Whether a field holds an identifier of this kind, e.g. {@code FromTableID} for TABLE.
     */
    public boolean isIdentifierField(String field) {
        return field.endsWith(idSuffix);
    }

    /**
     * Name of the field that receives the resolved name: {@code FromTableID} becomes {@code FromTable}.
     */
    public String resolvedField(String idField) {
        return idField.substring(0, idField.length() - 2);
    }
}
