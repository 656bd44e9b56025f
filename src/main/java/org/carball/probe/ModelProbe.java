package org.carball.probe;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.cache.ResultCache;
import org.carball.probe.config.ProbeSettings;
import org.carball.probe.dispatch.FallbackDispatcher;
import org.carball.probe.engine.*;
import org.carball.probe.execution.QueryExecutor;
import org.carball.probe.model.QueryRequest;
import org.carball.probe.model.QueryResult;
import org.carball.probe.model.profile.ProfileReport;
import org.carball.probe.model.profile.QueryComparison;
import org.carball.probe.profile.ProfileOptions;
import org.carball.probe.profile.TimingAggregator;
import org.carball.probe.resolve.IdentifierResolver;
import org.carball.probe.trace.EventCorrelator;
import org.carball.probe.trace.JsonLinesTraceSource;
import org.carball.probe.trace.TraceSessionManager;
import org.carball.probe.trace.TraceSource;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;

/**
 * Query and profiling operations for one model connection. All components are created per
 * instance; nothing is shared between connections.
 */
@Slf4j
public class ModelProbe implements AutoCloseable {

    private final ModelConnection connection;
    private final ProbeSettings settings;
    private final QueryExecutor executor;
    private final TimingAggregator aggregator;

    public ModelProbe(ModelConnection connection, IntrospectionClient introspection, ObjectModelClient objectModel,
                      TraceSource traceSource, ProbeSettings settings) {
        this(connection, introspection, objectModel, traceSource, settings, Clock.systemUTC());
    }

    public ModelProbe(ModelConnection connection, IntrospectionClient introspection, ObjectModelClient objectModel,
                      TraceSource traceSource, ProbeSettings settings, Clock clock) {
        this.connection = connection;
        this.settings = settings;

        FallbackDispatcher dispatcher = new FallbackDispatcher(introspection, objectModel);
        IdentifierResolver resolver = new IdentifierResolver(dispatcher, connection);
        ResultCache cache = new ResultCache(clock, settings.cacheTtl(), settings.getMaxCacheItems());
        this.executor = new QueryExecutor(connection, dispatcher, resolver, cache, settings);
        this.aggregator = new TimingAggregator(executor, new TraceSessionManager(traceSource, clock),
                new EventCorrelator(settings.pollInterval()), clock);
    }

    /**
     * Wires a probe over JDBC, with an optional model definition file for the object-model
     * fallback and an optional JSON-lines trace file.
     */
    public static ModelProbe connect(String connectionString, Path modelFile, Path traceFile, ProbeSettings settings)
            throws IOException {
        ModelConnection connection = new ModelConnection(connectionString);
        ObjectModelClient objectModel = modelFile != null
                ? new ModelDefinitionClient(modelFile)
                : (queryText, maxRows) -> Outcome.failure(ErrorKind.UNSUPPORTED, "No model definition loaded");
        TraceSource traceSource = traceFile != null
                ? new JsonLinesTraceSource(traceFile, settings.pollInterval())
                : TraceSource.none();

        log.debug("Probe wired: object model {}, trace {}", modelFile != null ? modelFile : "none", traceSource.name());
        return new ModelProbe(connection, new JdbcIntrospectionClient(connection, settings), objectModel,
                traceSource, settings);
    }

    public QueryResult executeQuery(String text, int maxRows, boolean bypassCache) {
        return executor.execute(new QueryRequest(text, maxRows, bypassCache));
    }

    public QueryResult executeInfoQuery(MetadataKind kind, String tableName, Integer topN) {
        return executor.executeInfoQuery(kind, tableName, topN);
    }

    public QueryResult executeTableQuery(String tableName, int maxRows) {
        return executor.executeTableQuery(tableName, maxRows);
    }

    public QueryResult searchObjects(String pattern, Set<MetadataKind> kinds) {
        return executor.searchObjects(pattern, kinds);
    }

    public QueryResult searchMeasures(String text, boolean inName, boolean inExpression) {
        return executor.searchMeasures(text, inName, inExpression);
    }

    public QueryResult measureDetails(String tableName, String measureName) {
        return executor.measureDetails(tableName, measureName);
    }

    public ProfileReport profileQuery(String text) {
        return profileQuery(text, settings.getDefaultRuns(), true, settings.getEventTimeoutSeconds());
    }

    public ProfileReport profileQuery(String text, int runs, boolean clearCacheFirst, int eventTimeoutSeconds) {
        return aggregator.profile(QueryRequest.of(text), options(runs, clearCacheFirst, eventTimeoutSeconds));
    }

    public QueryComparison compareQueries(String before, String after, int runs) {
        return aggregator.compare(QueryRequest.of(before), QueryRequest.of(after),
                options(runs, true, settings.getEventTimeoutSeconds()));
    }

    public QueryExecutor getExecutor() {
        return executor;
    }

    public TimingAggregator getAggregator() {
        return aggregator;
    }

    public ModelConnection getConnection() {
        return connection;
    }

    @Override
    public void close() {
        connection.close();
    }

    private static ProfileOptions options(int runs, boolean clearCacheFirst, int eventTimeoutSeconds) {
        return ProfileOptions.builder()
                .runs(runs)
                .clearCacheFirst(clearCacheFirst)
                .eventTimeout(Duration.ofSeconds(eventTimeoutSeconds))
                .build();
    }
}
