package org.carball.probe.resolve;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.ResultRow;

import java.util.*;

/**
 * Immutable two-way mapping between identifiers and names of one object kind, taken from a
 * single enumeration. Rows whose name or id is not unique in the snapshot are left out of both
 * directions, so every entry maps back to itself.
 */
@Slf4j
public final class IdentifierMap {

    private final IdentifierKind kind;
    private final Map<String, String> idToName;
    private final Map<String, String> nameToId;

    private IdentifierMap(IdentifierKind kind, Map<String, String> idToName, Map<String, String> nameToId) {
        this.kind = kind;
        this.idToName = Collections.unmodifiableMap(idToName);
        this.nameToId = Collections.unmodifiableMap(nameToId);
    }

    public static IdentifierMap empty(IdentifierKind kind) {
        return new IdentifierMap(kind, new HashMap<>(), new HashMap<>());
    }

    /**
     * Builds the map from enumeration rows.
     */
    public static IdentifierMap build(IdentifierKind kind, List<ResultRow> rows) {
        Map<String, String> idToName = new LinkedHashMap<>();
        Map<String, String> nameToId = new HashMap<>();
        Set<String> duplicateIds = new HashSet<>();
        Set<String> duplicateNames = new HashSet<>();

        for (ResultRow row : rows) {
            Optional<Object> id = IdentifierResolver.lookup(row, kind.getIdKeys().toArray(String[]::new));
            Optional<Object> name = IdentifierResolver.lookup(row, kind.getNameKeys().toArray(String[]::new));
            if (id.isEmpty() || name.isEmpty()) {
                continue;
            }

            String idKey = idKey(id.get());
            String nameText = String.valueOf(name.get());
            String nameKey = nameKey(nameText);

            if (idToName.containsKey(idKey)) {
                duplicateIds.add(idKey);
            }
            if (nameToId.containsKey(nameKey)) {
                duplicateNames.add(nameKey);
            }
            idToName.put(idKey, nameText);
            nameToId.put(nameKey, idKey);
        }

        // Drop every pair touching a duplicate, from both directions
        Iterator<Map.Entry<String, String>> entries = idToName.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<String, String> entry = entries.next();
            if (duplicateIds.contains(entry.getKey()) || duplicateNames.contains(nameKey(entry.getValue()))) {
                entries.remove();
            }
        }
        nameToId.clear();
        idToName.forEach((idKey, name) -> nameToId.put(nameKey(name), idKey));

        if (!duplicateIds.isEmpty() || !duplicateNames.isEmpty()) {
            log.warn("Skipped ambiguous {} identifiers: {} duplicate ids, {} duplicate names",
                    kind, duplicateIds.size(), duplicateNames.size());
        }
        return new IdentifierMap(kind, idToName, nameToId);
    }

    public IdentifierKind getKind() {
        return kind;
    }

    public Optional<String> nameFor(Object id) {
        return id == null ? Optional.empty() : Optional.ofNullable(idToName.get(idKey(id)));
    }

    public Optional<String> idFor(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(nameToId.get(nameKey(name)));
    }

    public Set<String> ids() {
        return idToName.keySet();
    }

    public int size() {
        return idToName.size();
    }

    public boolean isEmpty() {
        return idToName.isEmpty();
    }

    /**
     * Canonical text of an identifier. The two surfaces report ids as longs, doubles or strings,
     * so {@code 1}, {@code 1.0} and {@code "1"} share one key.
     */
    public static String idKey(Object id) {
        if (id instanceof Number number) {
            double value = number.doubleValue();
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return Long.toString(number.longValue());
            }
        }
        String text = String.valueOf(id).trim();
        if (text.matches("-?\\d+\\.0+")) {
            return text.substring(0, text.indexOf('.'));
        }
        return text;
    }

    private static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
