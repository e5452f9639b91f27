package io.threadline.storage.postgres;

import io.threadline.serde.Serializer;
import io.threadline.serde.TypedValue;
import io.threadline.storage.VersionOracle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which channel blobs a {@code put} must write.
 *
 * <p>A channel whose version did not advance past the previous checkpoint's version keeps
 * pointing at the blob already stored for that version, so no row is produced for it. Without a
 * known previous checkpoint every versioned channel is written and the insert-if-absent on the
 * blob key drops duplicates.
 */
final class BlobPlanner {
    private BlobPlanner() {
    }

    static Map<String, String> changedVersions(Map<String, String> versions, Map<String, String> previous) {
        Map<String, String> changed = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : versions.entrySet()) {
            String before = previous == null ? null : previous.get(e.getKey());
            if (previous == null || VersionOracle.isNewer(e.getValue(), before)) {
                changed.put(e.getKey(), e.getValue());
            }
        }
        return changed;
    }

    static List<BlobRow> plan(
            Serializer serde,
            Map<String, Object> values,
            Map<String, String> versions,
            Map<String, String> previous
    ) {
        List<BlobRow> rows = new ArrayList<>();
        for (Map.Entry<String, String> e : changedVersions(versions, previous).entrySet()) {
            String channel = e.getKey();
            TypedValue blob = values.containsKey(channel) ? serde.dumps(values.get(channel)) : TypedValue.empty();
            rows.add(new BlobRow(channel, e.getValue(), blob));
        }
        return rows;
    }

    record BlobRow(String channel, String version, TypedValue value) {
    }
}
