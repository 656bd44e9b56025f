package org.carball.probe.engine;

import org.carball.probe.model.ObjectFilter;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class MetadataQueryTest {

    @Test
    void shouldRecogniseInfoFunctions() {
        Optional<MetadataQuery> query = MetadataQuery.parse("EVALUATE INFO.TABLES()");

        assertThat(query).contains(new MetadataQuery(MetadataKind.TABLES, null, null));
    }

    @Test
    void shouldRecogniseTopNAndFilter() {
        MetadataQuery query = MetadataQuery.parse(
                "EVALUATE TOPN(25, FILTER(INFO.COLUMNS(), [TableID] = 12))").orElseThrow();

        assertThat(query.kind()).isEqualTo(MetadataKind.COLUMNS);
        assertThat(query.topN()).isEqualTo(25);
        assertThat(query.filter()).isEqualTo(new ObjectFilter("TableID", "12"));
    }

    @Test
    void shouldRecogniseSystemViewsWithWhereClause() {
        MetadataQuery query = MetadataQuery.parse(
                "SELECT * FROM $SYSTEM.TMSCHEMA_MEASURES WHERE [Name] = 'Total Sales'").orElseThrow();

        assertThat(query.kind()).isEqualTo(MetadataKind.MEASURES);
        assertThat(query.filter()).isEqualTo(new ObjectFilter("Name", "Total Sales"));
    }

    @Test
    void shouldIgnoreOtherQueries() {
        assertThat(MetadataQuery.parse("EVALUATE 'Sales'")).isEmpty();
        assertThat(MetadataQuery.parse("EVALUATE INFO.STORAGETABLES()")).isEmpty();
        assertThat(MetadataQuery.parse(null)).isEmpty();
    }

    @Test
    void shouldBuildQueryText() {
        assertThat(MetadataQuery.toQueryText(MetadataKind.TABLES, null, null))
                .isEqualTo("EVALUATE INFO.TABLES()");
        assertThat(MetadataQuery.toQueryText(MetadataKind.MEASURES, ObjectFilter.of("TableID", 3), 10))
                .isEqualTo("EVALUATE TOPN(10, FILTER(INFO.MEASURES(), [TableID] = 3))");
        assertThat(MetadataQuery.toQueryText(MetadataKind.COLUMNS, ObjectFilter.of("Table", "Say \"hi\""), null))
                .isEqualTo("EVALUATE FILTER(INFO.COLUMNS(), [Table] = \"Say \"\"hi\"\"\")");
    }

    @Test
    void shouldParseWhatItBuilds() {
        String text = MetadataQuery.toQueryText(MetadataKind.PARTITIONS, ObjectFilter.of("TableID", 4), 5);

        assertThat(MetadataQuery.parse(text))
                .contains(new MetadataQuery(MetadataKind.PARTITIONS, 5, new ObjectFilter("TableID", "4")));
    }

    @Test
    void shouldDescribeTableScopedKinds() {
        assertThat(MetadataKind.COLUMNS.isTableScoped()).isTrue();
        assertThat(MetadataKind.RELATIONSHIPS.isTableScoped()).isFalse();
        assertThat(MetadataKind.fromName(" measures ")).contains(MetadataKind.MEASURES);
        assertThat(MetadataKind.PARTITIONS.infoFunction()).isEqualTo("INFO.PARTITIONS");
    }
}
