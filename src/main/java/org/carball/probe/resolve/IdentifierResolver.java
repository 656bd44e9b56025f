package org.carball.probe.resolve;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.engine.ModelConnection;
import org.carball.probe.model.QueryRequest;
import org.carball.probe.model.QueryResult;
import org.carball.probe.model.ResultRow;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites foreign identifier fields in result rows into readable names.
 *
 * <p>Each {@link IdentifierKind} is enumerated once per connection epoch on first need. A
 * failed enumeration leaves rows untouched for that call and is retried on the next one.
 * A reconnect or {@link #invalidate()} discards every map so the next call rebuilds it.
 */
@Slf4j
public class IdentifierResolver {

    private final RowSource rowSource;
    private final ModelConnection connection;
    private final Map<IdentifierKind, IdentifierMap> maps = new EnumMap<>(IdentifierKind.class);
    private long loadedEpoch;

    public IdentifierResolver(RowSource rowSource, ModelConnection connection) {
        this.rowSource = rowSource;
        this.connection = connection;
        this.loadedEpoch = connection.epoch();
    }

    /**
     * Looks up the first present key among {@code names}, trying the bracketed, quoted and bare
     * spelling of each name in that order. The two query surfaces disagree on key formatting.
     */
    public static Optional<Object> lookup(ResultRow row, String... names) {
        for (String name : names) {
            for (String key : new String[]{"[" + name + "]", "'" + name + "'", name}) {
                if (row.containsKey(key) && row.get(key) != null) {
                    return Optional.of(row.get(key));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Normalises bracketed keys and adds a resolved name next to every identifier field.
     * Rows are modified in place and returned.
     */
    public synchronized List<ResultRow> resolve(List<ResultRow> rows) {
        for (ResultRow row : rows) {
            normalizeKeys(row);
        }

        for (ResultRow row : rows) {
            for (String field : row.columns()) {
                for (IdentifierKind kind : IdentifierKind.values()) {
                    if (kind.isIdentifierField(field)) {
                        resolveField(row, field, kind);
                    }
                }
            }
        }
        return rows;
    }

    public synchronized Optional<String> nameFor(IdentifierKind kind, Object id) {
        return mapFor(kind).flatMap(map -> map.nameFor(id));
    }

    public synchronized Optional<String> idFor(IdentifierKind kind, String name) {
        return mapFor(kind).flatMap(map -> map.idFor(name));
    }

    /**
     * Discards all loaded maps. Call after a schema change.
     */
    public synchronized void invalidate() {
        maps.clear();
        log.debug("Identifier maps invalidated");
    }

    private void resolveField(ResultRow row, String field, IdentifierKind kind) {
        String target = kind.resolvedField(field);
        Object id = row.get(field);
        if (id == null || row.containsKey(target)) {
            return;
        }

        Optional<IdentifierMap> map = mapFor(kind);
        if (map.isEmpty()) {
            return;
        }

        Optional<String> name = map.get().nameFor(id);
        if (name.isPresent()) {
            row.put(target, name.get());
        } else {
            log.warn("Unresolved {} identifier in field {}: {}", kind, field, id);
        }
    }

    private Optional<IdentifierMap> mapFor(IdentifierKind kind) {
        long epoch = connection.epoch();
        if (epoch != loadedEpoch) {
            maps.clear();
            loadedEpoch = epoch;
            log.debug("Connection epoch changed to {}, identifier maps will be rebuilt", epoch);
        }

        IdentifierMap map = maps.get(kind);
        if (map == null) {
            map = load(kind);
            if (map == null) {
                return Optional.empty();
            }
            maps.put(kind, map);
        }
        return Optional.of(map);
    }

    private IdentifierMap load(IdentifierKind kind) {
        QueryResult result = rowSource.fetch(new QueryRequest(kind.getEnumerationQuery(), 0, true));
        if (!result.isSuccess()) {
            log.warn("Could not enumerate {} identifiers, leaving rows unresolved: {}", kind, result.getError());
            return null;
        }

        List<ResultRow> rows = new ArrayList<>();
        for (ResultRow row : result.getRows()) {
            rows.add(row.copy());
        }
        IdentifierMap map = IdentifierMap.build(kind, rows);
        log.info("Loaded {} {} identifiers", map.size(), kind);
        return map;
    }

    private static void normalizeKeys(ResultRow row) {
        for (String key : row.columns()) {
            if (key.length() > 2 && key.startsWith("[") && key.endsWith("]")) {
                String bare = key.substring(1, key.length() - 1);
                if (!row.containsKey(bare)) {
                    row.rename(key, bare);
                }
            }
        }
    }
}
