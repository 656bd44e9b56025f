package org.carball.probe.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.ResultRow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Object-model surface backed by a model definition document ({@code model.bim} layout).
 * Enumerates tables, columns, measures, relationships, partitions, expressions and data
 * sources; identifiers are assigned in document order.
 */
@Slf4j
public class ModelDefinitionClient implements ObjectModelClient {

    private final Map<MetadataKind, List<ResultRow>> collections = new EnumMap<>(MetadataKind.class);

    public ModelDefinitionClient(Path modelFile) throws IOException {
        if (!Files.exists(modelFile)) {
            throw new IOException("Model definition file not found: " + modelFile);
        }

        JsonNode root = new ObjectMapper().readTree(Files.readString(modelFile));
        JsonNode model = validateModel(root);
        load(model);

        log.debug("Loaded model definition {}: {} tables, {} columns, {} measures",
                modelFile.getFileName(), collections.get(MetadataKind.TABLES).size(),
                collections.get(MetadataKind.COLUMNS).size(), collections.get(MetadataKind.MEASURES).size());
    }

    @Override
    public Outcome<RowSet> query(String queryText, int maxRows) {
        Optional<MetadataQuery> parsed = MetadataQuery.parse(queryText);
        if (parsed.isEmpty()) {
            return Outcome.failure(ErrorKind.UNSUPPORTED, "Object model answers metadata queries only");
        }

        MetadataQuery query = parsed.get();
        List<ResultRow> rows = new ArrayList<>();
        for (ResultRow row : collections.get(query.kind())) {
            if (query.filter() == null || query.filter().matches(row)) {
                rows.add(row.copy());
            }
        }

        if (query.topN() != null && rows.size() > query.topN()) {
            rows = new ArrayList<>(rows.subList(0, query.topN()));
        }

        boolean truncated = false;
        if (maxRows > 0 && rows.size() > maxRows) {
            rows = new ArrayList<>(rows.subList(0, maxRows));
            truncated = true;
        }

        return Outcome.success(new RowSet(query.kind().getColumns(), rows, truncated));
    }

    /**
     * Number of objects of one kind in the loaded model.
     */
    public int count(MetadataKind kind) {
        return collections.get(kind).size();
    }

    private JsonNode validateModel(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Invalid JSON format in model definition file");
        }

        JsonNode model = root.has("model") ? root.get("model") : root;
        JsonNode tables = model.get("tables");
        if (tables == null || !tables.isArray()) {
            throw new IllegalStateException("Missing or invalid tables section in model definition file");
        }
        return model;
    }

    private void load(JsonNode model) {
        for (MetadataKind kind : MetadataKind.values()) {
            collections.put(kind, new ArrayList<>());
        }

        Map<String, Long> tableIds = new HashMap<>();
        Map<String, Long> columnIds = new HashMap<>();
        long tableId = 0;
        long columnId = 0;
        long measureId = 0;
        long partitionId = 0;

        for (JsonNode table : model.get("tables")) {
            String tableName = text(table, "name");
            tableId++;
            tableIds.put(tableName, tableId);
            collections.get(MetadataKind.TABLES).add(ResultRow.of(
                    "ID", tableId,
                    "Name", tableName,
                    "Description", text(table, "description"),
                    "IsHidden", table.path("isHidden").asBoolean(false),
                    "DataCategory", text(table, "dataCategory")));

            for (JsonNode column : table.path("columns")) {
                String columnName = text(column, "name");
                columnId++;
                columnIds.put(tableName + "|" + columnName, columnId);
                collections.get(MetadataKind.COLUMNS).add(ResultRow.of(
                        "ID", columnId,
                        "TableID", tableId,
                        "Table", tableName,
                        "ExplicitName", columnName,
                        "DataType", text(column, "dataType"),
                        "Type", column.has("expression") ? "Calculated" : "Data",
                        "Expression", expression(column.get("expression")),
                        "IsHidden", column.path("isHidden").asBoolean(false),
                        "FormatString", text(column, "formatString")));
            }

            for (JsonNode measure : table.path("measures")) {
                measureId++;
                collections.get(MetadataKind.MEASURES).add(ResultRow.of(
                        "ID", measureId,
                        "TableID", tableId,
                        "Table", tableName,
                        "Name", text(measure, "name"),
                        "Expression", expression(measure.get("expression")),
                        "FormatString", text(measure, "formatString"),
                        "IsHidden", measure.path("isHidden").asBoolean(false),
                        "DisplayFolder", text(measure, "displayFolder")));
            }

            for (JsonNode partition : table.path("partitions")) {
                partitionId++;
                JsonNode source = partition.path("source");
                collections.get(MetadataKind.PARTITIONS).add(ResultRow.of(
                        "ID", partitionId,
                        "TableID", tableId,
                        "Table", tableName,
                        "Name", text(partition, "name"),
                        "Mode", text(partition, "mode"),
                        "SourceType", text(source, "type"),
                        "QueryDefinition", source.has("query")
                                ? expression(source.get("query"))
                                : expression(source.get("expression"))));
            }
        }

        long relationshipId = 0;
        for (JsonNode relationship : model.path("relationships")) {
            relationshipId++;
            String fromTable = text(relationship, "fromTable");
            String fromColumn = text(relationship, "fromColumn");
            String toTable = text(relationship, "toTable");
            String toColumn = text(relationship, "toColumn");
            collections.get(MetadataKind.RELATIONSHIPS).add(ResultRow.of(
                    "ID", relationshipId,
                    "Name", text(relationship, "name"),
                    "FromTableID", tableIds.get(fromTable),
                    "FromColumnID", columnIds.get(fromTable + "|" + fromColumn),
                    "ToTableID", tableIds.get(toTable),
                    "ToColumnID", columnIds.get(toTable + "|" + toColumn),
                    "FromTable", fromTable,
                    "FromColumn", fromColumn,
                    "ToTable", toTable,
                    "ToColumn", toColumn,
                    "IsActive", relationship.path("isActive").asBoolean(true),
                    "CrossFilteringBehavior", text(relationship, "crossFilteringBehavior"),
                    "FromCardinality", Optional.ofNullable(text(relationship, "fromCardinality")).orElse("many"),
                    "ToCardinality", Optional.ofNullable(text(relationship, "toCardinality")).orElse("one")));
        }

        long expressionId = 0;
        for (JsonNode expression : model.path("expressions")) {
            expressionId++;
            collections.get(MetadataKind.EXPRESSIONS).add(ResultRow.of(
                    "ID", expressionId,
                    "Name", text(expression, "name"),
                    "Kind", text(expression, "kind"),
                    "Expression", expression(expression.get("expression"))));
        }

        long dataSourceId = 0;
        for (JsonNode dataSource : model.path("dataSources")) {
            dataSourceId++;
            collections.get(MetadataKind.DATASOURCES).add(ResultRow.of(
                    "ID", dataSourceId,
                    "Name", text(dataSource, "name"),
                    "Type", text(dataSource, "type"),
                    "ConnectionString", text(dataSource, "connectionString")));
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    // Multi-line expressions are stored as arrays of lines
    private static String expression(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            StringJoiner joiner = new StringJoiner("\n");
            node.forEach(line -> joiner.add(line.asText()));
            return joiner.toString();
        }
        return node.asText();
    }
}
