package org.carball.probe.resolve;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.probe.dispatch.FallbackDispatcher;
import org.carball.probe.engine.ErrorKind;
import org.carball.probe.engine.ModelConnection;
import org.carball.probe.model.ResultRow;
import org.carball.probe.support.FakeIntrospectionClient;
import org.carball.probe.support.FakeObjectModelClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class IdentifierResolverTest {

    private static final String TABLES = "EVALUATE INFO.TABLES()";
    private static final String COLUMNS = "EVALUATE INFO.COLUMNS()";

    private FakeIntrospectionClient introspection;
    private FakeObjectModelClient objectModel;
    private ModelConnection connection;
    private IdentifierResolver resolver;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        introspection = new FakeIntrospectionClient()
                .returns(TABLES,
                        ResultRow.of("ID", 1L, "Name", "Sales"),
                        ResultRow.of("ID", 2L, "Name", "Customer"))
                .returns(COLUMNS,
                        ResultRow.of("ID", 10L, "ExplicitName", "Amount"),
                        ResultRow.of("ID", 11L, "ExplicitName", "Date"),
                        ResultRow.of("ID", 12L, "ExplicitName", "Date"));
        objectModel = new FakeObjectModelClient();
        connection = new ModelConnection("jdbc:probe:test");
        resolver = new IdentifierResolver(new FallbackDispatcher(introspection, objectModel), connection);

        logger = (Logger) LoggerFactory.getLogger(IdentifierResolver.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    @Test
    void shouldAddTableNameNextToTableId() {
        // Given
        List<ResultRow> rows = rows(ResultRow.of("ID", 10L, "TableID", 1L, "ExplicitName", "Amount"));

        // When
        resolver.resolve(rows);

        // Then
        assertThat(rows.get(0).get("Table")).isEqualTo("Sales");
        assertThat(rows.get(0).get("TableID")).isEqualTo(1L);
        assertThat(introspection.countOf(TABLES)).isEqualTo(1);
    }

    @Test
    void shouldResolvePrefixedIdentifierFields() {
        List<ResultRow> rows = rows(ResultRow.of(
                "FromTableID", 1L, "ToTableID", 2L, "FromColumnID", 10L, "ToColumnID", 11L));

        resolver.resolve(rows);

        ResultRow row = rows.get(0);
        assertThat(row.get("FromTable")).isEqualTo("Sales");
        assertThat(row.get("ToTable")).isEqualTo("Customer");
        assertThat(row.get("FromColumn")).isEqualTo("Amount");
        // Date is ambiguous across tables and stays unresolved
        assertThat(row.containsKey("ToColumn")).isFalse();
    }

    @Test
    void shouldNormaliseBracketedKeys() {
        List<ResultRow> rows = rows(ResultRow.of("[ID]", 10L, "[TableID]", 2L));

        resolver.resolve(rows);

        assertThat(rows.get(0).columns()).containsExactly("ID", "TableID", "Table");
        assertThat(rows.get(0).get("Table")).isEqualTo("Customer");
    }

    @Test
    void shouldNotOverwriteExistingNameField() {
        List<ResultRow> rows = rows(ResultRow.of("TableID", 1L, "Table", "Given"));

        resolver.resolve(rows);

        assertThat(rows.get(0).get("Table")).isEqualTo("Given");
        assertThat(introspection.countOf(TABLES)).isZero();
    }

    @Test
    void shouldPassThroughUnknownIdentifierWithWarning() {
        List<ResultRow> rows = rows(ResultRow.of("TableID", 99L));

        resolver.resolve(rows);

        assertThat(rows.get(0).containsKey("Table")).isFalse();
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Unresolved TABLE identifier in field TableID: 99");
    }

    @Test
    void shouldReuseMapsAcrossCalls() {
        resolver.resolve(rows(ResultRow.of("TableID", 1L)));
        resolver.resolve(rows(ResultRow.of("TableID", 2L)));
        resolver.nameFor(IdentifierKind.TABLE, 1L);

        assertThat(introspection.countOf(TABLES)).isEqualTo(1);
    }

    @Test
    void shouldLeaveRowsUntouchedAndRetryWhenEnumerationFails() {
        // Given
        introspection.fails(TABLES, ErrorKind.QUERY_ERROR, "INFO.TABLES is unavailable");
        List<ResultRow> first = rows(ResultRow.of("TableID", 1L));

        // When
        resolver.resolve(first);

        // Then
        assertThat(first.get(0).columns()).containsExactly("TableID");

        // Given - enumeration recovers
        introspection.returns(TABLES, ResultRow.of("ID", 1L, "Name", "Sales"));
        List<ResultRow> second = rows(ResultRow.of("TableID", 1L));

        // When
        resolver.resolve(second);

        // Then
        assertThat(second.get(0).get("Table")).isEqualTo("Sales");
        assertThat(introspection.countOf(TABLES)).isEqualTo(2);
    }

    @Test
    void shouldEnumerateThroughObjectModelWhenIntrospectionBlocked() {
        introspection.fails(TABLES, ErrorKind.BLOCKED_INTERFACE, "INFO functions are not allowed");
        objectModel.returns(TABLES, ResultRow.of("ID", 1L, "Name", "Sales"));

        assertThat(resolver.nameFor(IdentifierKind.TABLE, 1L)).contains("Sales");
        assertThat(objectModel.queries()).containsExactly(TABLES);
    }

    @Test
    void shouldRebuildMapsAfterReconnect() {
        // Given
        assertThat(resolver.idFor(IdentifierKind.TABLE, "Sales")).contains("1");
        introspection.returns(TABLES, ResultRow.of("ID", 7L, "Name", "Sales"));

        // When
        connection.reconnect();

        // Then
        assertThat(resolver.idFor(IdentifierKind.TABLE, "Sales")).contains("7");
        assertThat(introspection.countOf(TABLES)).isEqualTo(2);
    }

    @Test
    void shouldRebuildMapsAfterInvalidate() {
        resolver.idFor(IdentifierKind.TABLE, "Sales");

        resolver.invalidate();
        resolver.idFor(IdentifierKind.TABLE, "Sales");

        assertThat(introspection.countOf(TABLES)).isEqualTo(2);
    }

    @Test
    void shouldLookUpBracketedThenQuotedThenBareKey() {
        ResultRow row = ResultRow.of("Name", "bare", "'Name'", "quoted", "[Name]", "bracketed");
        ResultRow partial = ResultRow.of("Name", "bare", "'Name'", "quoted", "[Name]", null);

        assertThat(IdentifierResolver.lookup(row, "Name")).contains("bracketed");
        assertThat(IdentifierResolver.lookup(partial, "Name")).contains("quoted");
        assertThat(IdentifierResolver.lookup(partial, "Missing", "Name")).contains("quoted");
        assertThat(IdentifierResolver.lookup(partial, "Missing")).isEmpty();
    }

    private static List<ResultRow> rows(ResultRow... rows) {
        return new ArrayList<>(List.of(rows));
    }
}
