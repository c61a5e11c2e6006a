package ac.tagcache;

import ac.tagcache.exception.CacheException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Coalesces concurrent cache misses of the same key inside this process.
 * The first caller runs the loader; callers arriving while it runs wait for
 * its outcome and receive the same value or the same exception. A caller that
 * waits longer than the flight timeout gives up on the leader and runs its own
 * loader.
 * <p>
 * When disabled every caller runs its own loader.
 */
public class SingleFlight {
    private static final Logger logger = LoggerFactory.getLogger(SingleFlight.class);

    private final boolean enabled;
    private final Duration maxFlightDuration;
    private final Cache<String, CompletableFuture<Object>> inFlight;
    private final CacheStatistics statistics;

    public SingleFlight(boolean enabled, Duration maxFlightDuration, CacheStatistics statistics) {
        this.enabled = enabled;
        this.maxFlightDuration = maxFlightDuration;
        this.statistics = statistics;
        // a stuck flight stops accepting new joiners once it expires
        this.inFlight = Caffeine.newBuilder()
                .expireAfterWrite(maxFlightDuration)
                .build();
    }

    public static SingleFlight disabled(CacheStatistics statistics) {
        return new SingleFlight(false, Duration.ofSeconds(30), statistics);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public <T> T execute(String flightKey, Supplier<T> loader) {
        if (!enabled) {
            return loader.get();
        }

        ConcurrentMap<String, CompletableFuture<Object>> flights = inFlight.asMap();
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> leader = flights.putIfAbsent(flightKey, mine);
        if (leader != null) {
            logger.debug("Joining in-flight production for {}", flightKey);
            statistics.incrementSharedProductions();
            return await(flightKey, leader, loader);
        }

        try {
            T value = loader.get();
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            flights.remove(flightKey, mine);
        }
    }

    public long inFlightCount() {
        return inFlight.estimatedSize();
    }

    @SuppressWarnings("unchecked")
    private <T> T await(String flightKey, CompletableFuture<Object> leader, Supplier<T> loader) {
        try {
            return (T) leader.get(maxFlightDuration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("In-flight production for {} exceeded {}, loading independently", flightKey,
                    maxFlightDuration);
            return loader.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException("Interrupted while waiting for in-flight production of " + flightKey, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CacheException("In-flight production of " + flightKey + " failed", cause);
        }
    }
}
