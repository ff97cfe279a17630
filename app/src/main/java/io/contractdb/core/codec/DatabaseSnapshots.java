package io.contractdb.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contractdb.core.database.ContractDatabase;
import io.contractdb.core.database.DataMap;
import io.contractdb.core.database.DataMapView;
import io.contractdb.core.database.MemoryContractDatabase;
import io.contractdb.core.database.MemoryDataMap;
import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Whole-database snapshot/restore as JSON.
 * Restoring a snapshot yields maps with the same names, schemas and entries,
 * whichever backend wrote it or receives it.
 *
 * Layout:
 * <pre>
 * {"format":1,
 *  "maps":[{"name":"balances","keyType":{...},"valueType":{...},
 *           "entries":[{"key":{...},"value":{...}}]}]}
 * </pre>
 * Maps are written in name order and entries in encoded-key order, so equal
 * databases produce identical bytes.
 */
public final class DatabaseSnapshots {
    private static final Logger LOG = Logger.getLogger(DatabaseSnapshots.class.getName());

    public static final int FORMAT_VERSION = 1;

    private DatabaseSnapshots() {}

    public static byte[] serialize(ContractDatabase database) {
        ObjectNode root = JsonCodec.mapper().createObjectNode();
        root.put("format", FORMAT_VERSION);
        ArrayNode maps = root.putArray("maps");
        for (String name : database.mapNames()) {
            try (DataMapView view = database.getDataMap(name)
                    .orElseThrow(() -> new IllegalStateException("Map vanished during snapshot: " + name))) {
                ObjectNode m = maps.addObject();
                m.put("name", name);
                m.set("keyType", JsonCodec.tupleTypeToJson(view.keyType()));
                m.set("valueType", JsonCodec.tupleTypeToJson(view.valueType()));
                ArrayNode entries = m.putArray("entries");
                for (Row row : sortedEntries(view)) {
                    ObjectNode entry = entries.addObject();
                    entry.set("key", JsonCodec.valueToJson(row.key));
                    entry.set("value", JsonCodec.valueToJson(row.value));
                }
            }
        }
        try {
            return JsonCodec.mapper().writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize database snapshot", e);
        }
    }

    public static void write(ContractDatabase database, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, serialize(database));
    }

    /** Restore into a fresh in-memory database. */
    public static MemoryContractDatabase restore(byte[] snapshot) {
        MemoryContractDatabase db = new MemoryContractDatabase();
        restoreInto(db, snapshot);
        return db;
    }

    public static MemoryContractDatabase read(Path file) throws IOException {
        return restore(Files.readAllBytes(file));
    }

    /**
     * Recreate every map of the snapshot in {@code target}. Same-named maps in
     * the target are replaced; others are left alone. The snapshot is fully
     * parsed and validated, and none of its map names may be borrowed in the
     * target, before the target is touched.
     *
     * @throws IllegalStateException if a map to be replaced has an open handle
     */
    public static void restoreInto(ContractDatabase target, byte[] snapshot) {
        Map<String, MemoryDataMap> staged = parse(snapshot);
        for (String name : staged.keySet()) {
            if (target.isBorrowed(name)) {
                throw new IllegalStateException("Map '" + name + "' cannot be restored while borrowed");
            }
        }
        long entries = 0;
        for (Map.Entry<String, MemoryDataMap> e : staged.entrySet()) {
            MemoryDataMap source = e.getValue();
            target.createMap(e.getKey(), source.keyType(), source.valueType());
            try (DataMap map = target.getMutDataMap(e.getKey())
                    .orElseThrow(() -> new IllegalStateException("Map missing after create: " + e.getKey()))) {
                source.forEachEntry(map::setEntry);
            }
            entries += source.size();
        }
        LOG.info("Restored " + staged.size() + " maps (" + entries + " entries) from snapshot");
    }

    private static Map<String, MemoryDataMap> parse(byte[] snapshot) {
        try {
            JsonNode root = JsonCodec.mapper().readTree(snapshot);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Snapshot is not a JSON object");
            }
            int format = root.path("format").asInt(-1);
            if (format != FORMAT_VERSION) {
                throw new IllegalArgumentException("Unsupported snapshot format: " + format);
            }
            Map<String, MemoryDataMap> staged = new LinkedHashMap<>();
            for (JsonNode m : root.path("maps")) {
                String name = m.path("name").asText("");
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("Map without a name");
                }
                if (staged.containsKey(name)) {
                    throw new IllegalArgumentException("Duplicate map name: " + name);
                }
                TupleTypeSignature keyType = JsonCodec.tupleTypeFromJson(m.get("keyType"));
                TupleTypeSignature valueType = JsonCodec.tupleTypeFromJson(m.get("valueType"));
                MemoryDataMap map = new MemoryDataMap(keyType, valueType);
                for (JsonNode entry : m.path("entries")) {
                    Value key = JsonCodec.valueFromJson(entry.get("key"));
                    Value value = JsonCodec.valueFromJson(entry.get("value"));
                    if (!map.insertEntry(key, value)) {
                        throw new IllegalArgumentException("Duplicate key in map " + name + ": " + key);
                    }
                }
                staged.put(name, map);
            }
            return staged;
        } catch (IOException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed database snapshot", ex);
        }
    }

    private static List<Row> sortedEntries(DataMapView view) {
        List<Row> rows = new ArrayList<>();
        view.forEachEntry((k, v) -> rows.add(new Row(k, v)));
        rows.sort((a, b) -> Arrays.compareUnsigned(a.sortKey, b.sortKey));
        return rows;
    }

    private static final class Row {
        final byte[] sortKey;
        final Value key;
        final Value value;

        Row(Value key, Value value) {
            this.sortKey = ValueCodec.toBytes(key);
            this.key = key;
            this.value = value;
        }
    }
}
