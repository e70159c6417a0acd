package careguard.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.model.auth.AttemptCounter;
import careguard.core.port.out.AttemptCounterRepository;

/**
 * In-memory implementation of AttemptCounterRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Counters are lost on restart and not shared across instances.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryAttemptCounterRepository implements AttemptCounterRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryAttemptCounterRepository.class);

    private final ConcurrentMap<String, Entry> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryAttemptCounterRepository(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            final var t = new Thread(r, "attempt-counter-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory attempt counter repository");
    }

    @Override
    public Uni<CounterResult> incrementIfBelow(String key, int threshold, Duration window, Instant now) {
        return Uni.createFrom().item(() -> {
            final var entry = counters.compute(key, (k, existing) -> {
                var current = existing;
                if (current == null || current.counter().isExpired(now, current.window())) {
                    current = new Entry(new AttemptCounter(key, 0, now), window, false);
                }
                final var counter = current.counter();
                if (counter.count() >= threshold) {
                    return new Entry(counter, current.window(), false);
                }
                return new Entry(new AttemptCounter(key, counter.count() + 1, counter.windowStart()), window, true);
            });
            return new CounterResult(entry.lastPermitted(), entry.counter());
        });
    }

    @Override
    public Uni<Optional<AttemptCounter>> find(String key, Duration window, Instant now) {
        return Uni.createFrom().item(() -> {
            final var entry = counters.get(key);
            if (entry == null || entry.counter().isExpired(now, window)) {
                return Optional.empty();
            }
            return Optional.of(entry.counter());
        });
    }

    @Override
    public Uni<Void> reset(String key) {
        return Uni.createFrom().item(() -> {
            counters.remove(key);
            LOG.debugf("Cleared attempt counter for %s", key);
            return null;
        });
    }

    private void cleanupExpired() {
        final var now = clock.instant();
        final var before = counters.size();
        counters.entrySet().removeIf(e -> e.getValue().counter().isExpired(now, e.getValue().window()));
        final var removed = before - counters.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired attempt counters", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Get the current count of tracked keys (for testing).
     */
    public int size() {
        return counters.size();
    }

    private record Entry(AttemptCounter counter, Duration window, boolean lastPermitted) {}
}
