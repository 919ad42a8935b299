/* (C)2026 */
package com.ammann.blockstats.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Short-TTL memoization in front of the read-path handlers.
 *
 * <p>Backed by Caffeine with {@code expireAfterWrite}: an expired entry is never served
 * (checked on lookup) and is physically removed either by the lookup or by the periodic
 * {@link #sweep()}. Payloads are stored and returned by reference; callers must not mutate
 * them.
 *
 * <p>A handler that throws leaves nothing in the cache. Handlers run on the calling thread
 * without any cache lock held.
 */
@ApplicationScoped
public class ResponseCache {

    private static final Logger LOG = Logger.getLogger(ResponseCache.class);

    private final Cache<String, CacheEntry> entries;
    private final Duration ttl;

    @Inject
    public ResponseCache(
            @ConfigProperty(name = "blockstats.cache.ttl", defaultValue = "1s") Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public ResponseCache(Duration ttl, Ticker ticker) {
        this.ttl = ttl;
        this.entries =
                Caffeine.newBuilder()
                        .expireAfterWrite(ttl)
                        .ticker(ticker)
                        .executor(Runnable::run)
                        .build();
        LOG.infof("Response cache initialized with TTL %s", ttl);
    }

    /**
     * Builds the cache key for a request.
     *
     * @param method HTTP method
     * @param path request path including the query string, if any
     * @param body request body for structured queries, or {@code null}
     * @return key of the form {@code METHOD:path[:body]}
     */
    public static String key(String method, String path, String body) {
        StringBuilder key = new StringBuilder(method).append(':').append(path);
        if (body != null && !body.isEmpty()) {
            key.append(':').append(body);
        }
        return key.toString();
    }

    /**
     * Serves the stored payload for {@code key} if it is younger than the TTL, otherwise runs
     * {@code handler} and stores its result.
     *
     * @param key cache key, see {@link #key(String, String, String)}
     * @param handler computes the payload on a miss
     * @return the cached or freshly computed payload
     */
    @SuppressWarnings("unchecked")
    public <T> T serve(String key, Supplier<T> handler) {
        CacheEntry cached = entries.getIfPresent(key);
        if (cached != null) {
            LOG.debugf("Cache hit for key: %s", key);
            return (T) cached.payload();
        }

        // Runs outside the cache's own locking; concurrent misses may each compute, last put wins.
        T payload = handler.get();
        entries.put(key, new CacheEntry(key, payload, Instant.now()));
        LOG.debugf("Cached response for key: %s", key);
        return payload;
    }

    /**
     * Removes every expired entry. Called periodically by the cache sweeper.
     */
    public void sweep() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        long removed = before - entries.estimatedSize();
        if (removed > 0) {
            LOG.debugf("Cache sweep removed %d expired entries", removed);
        }
    }

    public void invalidateAll() {
        entries.invalidateAll();
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * A stored payload.
     *
     * @param key cache key
     * @param payload handler result, shared by reference
     * @param insertedAt wall-clock time of insertion
     */
    public record CacheEntry(String key, Object payload, Instant insertedAt) {}
}
