package com.propertymarket.scraper.crawl.http;

import com.propertymarket.scraper.crawl.model.FetchResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-memory fetch memo scoped to a single scrape run.
 *
 * <p>Only results for which {@link FetchResult#isCacheable()} holds are retained. Concurrent
 * {@link #getOrLoad} calls for the same key share one load: the first caller runs the loader,
 * the others wait for its outcome.
 */
public class FetchResultCache {
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration defaultTtl;

    public FetchResultCache() {
        this(null);
    }

    public FetchResultCache(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Optional<FetchResult> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null || !entry.future().isDone() || entry.future().isCompletedExceptionally()) {
            return Optional.empty();
        }
        if (entry.isExpired(Instant.now())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.future().join());
    }

    public void put(String key, FetchResult result, Duration ttl) {
        if (result == null || !result.isCacheable()) {
            return;
        }
        entries.put(key, new Entry(CompletableFuture.completedFuture(result), expiry(ttl)));
    }

    public Lookup getOrLoad(String key, Supplier<FetchResult> loader) {
        CompletableFuture<FetchResult> created = new CompletableFuture<>();
        Entry pending = new Entry(created, null);
        Instant now = Instant.now();
        Entry winner = entries.compute(key, (ignored, current) ->
            current == null || current.isExpired(now) || current.future().isCompletedExceptionally() ? pending : current
        );
        if (winner != pending) {
            return new Lookup(winner.future().join(), true);
        }

        FetchResult result;
        try {
            result = loader.get();
        } catch (RuntimeException e) {
            entries.remove(key, pending);
            created.completeExceptionally(e);
            throw e;
        }
        if (result != null && result.isCacheable()) {
            entries.replace(key, pending, new Entry(created, expiry(defaultTtl)));
        } else {
            entries.remove(key, pending);
        }
        created.complete(result);
        return new Lookup(result, false);
    }

    public int size() {
        return entries.size();
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : Instant.now().plus(ttl);
    }

    public record Lookup(FetchResult result, boolean fromCache) {
    }

    private record Entry(CompletableFuture<FetchResult> future, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !expiresAt.isAfter(now);
        }
    }
}
