package io.threadline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of every channel at one execution step.
 *
 * <p>{@code channelValues} omits channels that have no value; a channel mapped to {@code null}
 * holds a present {@code null}.
 */
public record Checkpoint(
        @JsonProperty("v") int v,
        @JsonProperty("id") String id,
        @JsonProperty("ts") String ts,
        @JsonProperty("channel_values") Map<String, Object> channelValues,
        @JsonProperty("channel_versions") Map<String, String> channelVersions,
        @JsonProperty("versions_seen") Map<String, Map<String, String>> versionsSeen,
        @JsonProperty("pending_sends") List<Object> pendingSends
) implements Serializable {
    public static final int FORMAT_VERSION = 1;

    public Checkpoint {
        channelValues = channelValues == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(channelValues));
        channelVersions = channelVersions == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(channelVersions));
        versionsSeen = versionsSeen == null ? Collections.emptyMap() : copySeen(versionsSeen);
        pendingSends = pendingSends == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(pendingSends));
    }

    public Checkpoint withId(String newId) {
        return new Checkpoint(v, newId, ts, channelValues, channelVersions, versionsSeen, pendingSends);
    }

    public Checkpoint withChannelValues(Map<String, Object> values) {
        return new Checkpoint(v, id, ts, values, channelVersions, versionsSeen, pendingSends);
    }

    public Checkpoint withPendingSends(List<Object> sends) {
        return new Checkpoint(v, id, ts, channelValues, channelVersions, versionsSeen, sends);
    }

    private static Map<String, Map<String, String>> copySeen(Map<String, Map<String, String>> seen) {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> e : seen.entrySet()) {
            out.put(e.getKey(), e.getValue() == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        return Collections.unmodifiableMap(out);
    }
}
