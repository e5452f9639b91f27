package io.threadline.storage;

import io.threadline.channel.Channel;
import io.threadline.channel.EmptyChannelException;
import io.threadline.serde.Serializer;
import io.threadline.util.Hashing;

/** Channel versions of the form {@code <32-digit counter>.<md5 of the snapshot>}, ordered as strings. */
public final class VersionOracle {
    private static final String FORMAT = "%032d.%s";

    private final Serializer serde;

    public VersionOracle(Serializer serde) {
        this.serde = serde;
    }

    public String nextVersion(String current, Channel<?, ?, ?> channel) {
        long next = counter(current) + 1;
        String hash;
        try {
            hash = Hashing.md5Hex(serde.dumps(channel.checkpoint()).data());
        } catch (EmptyChannelException e) {
            hash = "";
        }
        return String.format(FORMAT, next, hash);
    }

    public static long counter(String version) {
        if (version == null || version.isBlank()) {
            return 0L;
        }
        int dot = version.indexOf('.');
        String prefix = dot < 0 ? version : version.substring(0, dot);
        try {
            return Long.parseLong(prefix.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed channel version: " + version, e);
        }
    }

    public static String hash(String version) {
        if (version == null) {
            return "";
        }
        int dot = version.indexOf('.');
        return dot < 0 ? "" : version.substring(dot + 1);
    }

    // a missing previous is older than anything
    public static boolean isNewer(String candidate, String previous) {
        if (previous == null) {
            return true;
        }
        return candidate.compareTo(previous) > 0;
    }
}
