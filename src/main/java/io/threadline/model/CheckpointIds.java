package io.threadline.model;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Time-ordered checkpoint ids in the UUIDv6 layout: the 60-bit timestamp is stored most
 * significant bits first, so the string form sorts in creation order. Ids are strictly increasing
 * within one process even when the clock does not advance.
 */
public final class CheckpointIds {
    private static final long GREGORIAN_OFFSET_100NS = 0x01B21DD213814000L;
    private static final long NODE_BITS = new SecureRandom().nextLong();

    private static Clock clock = Clock.systemUTC();
    private static long lastTimestamp;

    private CheckpointIds() {
    }

    public static synchronized String next() {
        Instant now = clock.instant();
        long timestamp = now.getEpochSecond() * 10_000_000L + now.getNano() / 100L + GREGORIAN_OFFSET_100NS;
        if (timestamp <= lastTimestamp) {
            timestamp = lastTimestamp + 1;
        }
        lastTimestamp = timestamp;

        long msb = ((timestamp >>> 12) << 16) | (0x6L << 12) | (timestamp & 0xFFFL);
        long lsb = (NODE_BITS & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(msb, lsb).toString();
    }

    static synchronized void useClock(Clock testClock) {
        clock = testClock;
    }
}
