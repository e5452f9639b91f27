package io.threadline.storage.postgres;

import io.threadline.model.CheckpointTuple;
import io.threadline.model.RunConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Single-flight holder for "latest checkpoint of a thread".
 *
 * <p>A background lookup offered through {@link #offer} is claimed by the first caller asking for
 * the latest checkpoint of the same thread and namespace. Every caller that arrives while the
 * claimed lookup is still running awaits that same result; once it completes the slot is cleared
 * and the next caller queries the database again. Callers for another thread never touch the slot
 * and go straight to the fallback query.
 *
 * <p>The last checkpoint written or served through the store is kept as the baseline; {@code put}
 * compares against its channel versions to skip blobs that did not change.
 */
final class LatestTupleCache {
    private static final Logger log = LoggerFactory.getLogger(LatestTupleCache.class);

    private final Object lock = new Object();
    private Entry pending;
    private Entry inFlight;
    private CheckpointTuple baseline;

    void offer(RunConfig config, CompletableFuture<Optional<CheckpointTuple>> result) {
        synchronized (lock) {
            pending = new Entry(config.threadId(), config.checkpointNs(), result);
        }
    }

    CompletableFuture<Optional<CheckpointTuple>> get(
            RunConfig config,
            Function<RunConfig, CompletableFuture<Optional<CheckpointTuple>>> fallback
    ) {
        if (config.checkpointId() != null) {
            return served(fallback.apply(config));
        }
        Entry shared;
        boolean claimed = false;
        synchronized (lock) {
            if (inFlight != null && inFlight.matches(config) && !inFlight.result().isDone()) {
                shared = inFlight;
            } else if (pending != null && pending.matches(config)) {
                shared = pending;
                pending = null;
                inFlight = shared;
                claimed = true;
            } else {
                shared = null;
            }
        }
        if (shared == null) {
            return served(fallback.apply(config));
        }
        if (claimed) {
            shared.result().whenComplete((found, error) -> clear(shared));
        }
        return served(shared.result()
                .handle((found, error) -> {
                    if (error != null) {
                        log.debug("Prefetched lookup for thread {} failed, querying directly", config.threadId(), error);
                        return null;
                    }
                    return found;
                })
                .thenCompose(found -> {
                    if (found == null) {
                        return fallback.apply(config);
                    }
                    log.debug("Latest checkpoint for thread {} served from a shared lookup", config.threadId());
                    return CompletableFuture.completedFuture(found);
                }));
    }

    void recordPut(CheckpointTuple tuple) {
        synchronized (lock) {
            baseline = tuple;
        }
        invalidate(tuple.config());
    }

    /**
     * Channel versions of the checkpoint {@code config} points at, when that is the last one
     * written or read through this store; otherwise {@code null}.
     */
    Map<String, String> previousVersions(RunConfig config) {
        synchronized (lock) {
            if (baseline == null || config.checkpointId() == null) {
                return null;
            }
            RunConfig last = baseline.config();
            if (last.threadId().equals(config.threadId())
                    && last.checkpointNs().equals(config.checkpointNs())
                    && config.checkpointId().equals(last.checkpointId())) {
                return baseline.checkpoint().channelVersions();
            }
            return null;
        }
    }

    /** Drops any lookup for {@code config}'s thread, so the next read goes to the database. */
    void invalidate(RunConfig config) {
        synchronized (lock) {
            if (pending != null && pending.matches(config)) {
                pending = null;
            }
            if (inFlight != null && inFlight.matches(config)) {
                inFlight = null;
            }
        }
    }

    private CompletableFuture<Optional<CheckpointTuple>> served(CompletableFuture<Optional<CheckpointTuple>> lookup) {
        return lookup.thenApply(found -> {
            found.ifPresent(tuple -> {
                synchronized (lock) {
                    baseline = tuple;
                }
            });
            return found;
        });
    }

    private void clear(Entry entry) {
        synchronized (lock) {
            if (inFlight == entry) {
                inFlight = null;
            }
        }
    }

    private record Entry(String threadId, String checkpointNs, CompletableFuture<Optional<CheckpointTuple>> result) {
        boolean matches(RunConfig config) {
            return threadId.equals(config.threadId()) && checkpointNs.equals(config.checkpointNs());
        }
    }
}
