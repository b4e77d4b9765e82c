package com.areakeeper.service.lint;

import com.areakeeper.domain.CacheEntry;
import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalCause;
import com.google.common.cache.RemovalNotification;
import io.micronaut.context.annotation.Value;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Memoizes lint results per area.
 *
 * An entry is served only while its fingerprint matches the record being linted; otherwise the
 * rules run again and the entry is replaced. The fingerprint covers the rule set and each rule's
 * evaluation context, so a date-dependent result is recomputed when the day changes. At most one evaluation per area id runs at a time:
 * concurrent callers for the same id wait for it and receive the same result (or the same
 * {@link LintRuleException}). Callers for other ids never wait.
 *
 * A failed evaluation is never stored. Entries older than {@code lint.cache.ttl} or beyond
 * {@code lint.cache.max-size} (least recently used first) are reclaimed.
 */
@Singleton
public class LintCache {

    private static final Logger log = LoggerFactory.getLogger(LintCache.class);

    private final LintRuleSet ruleSet;
    private final Clock clock;
    private final Cache<String, CacheEntry> entries;
    private final ConcurrentMap<String, InFlight> inFlight = new ConcurrentHashMap<>();

    private static final class InFlight {
        final String fingerprint;
        final CompletableFuture<List<LintIssue>> result = new CompletableFuture<>();
        volatile boolean invalidated;

        InFlight(String fingerprint) {
            this.fingerprint = fingerprint;
        }
    }

    @Inject
    public LintCache(LintRuleSet ruleSet,
                     Clock clock,
                     @Value("${lint.cache.ttl:1h}") Duration ttl,
                     @Value("${lint.cache.max-size:10000}") long maxSize) {
        this(ruleSet, clock, ttl, maxSize, Ticker.systemTicker());
    }

    public LintCache(LintRuleSet ruleSet, Clock clock, Duration ttl, long maxSize, Ticker ticker) {
        this.ruleSet = ruleSet;
        this.clock = clock;
        this.entries = CacheBuilder.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxSize)
            .ticker(ticker)
            .<String, CacheEntry>removalListener(this::onRemove)
            .build();
    }

    public List<LintIssue> getOrCompute(String areaId, NormalizedRecord record) {
        String fingerprint = RecordFingerprint.of(record, ruleSet.evaluationKey());
        while (true) {
            CacheEntry cached = entries.getIfPresent(areaId);
            if (cached != null && cached.matches(fingerprint)) {
                log.debug("Lint cache hit: area={}", areaId);
                return cached.issues();
            }

            InFlight mine = new InFlight(fingerprint);
            InFlight running = inFlight.putIfAbsent(areaId, mine);
            if (running == null) {
                return computeAndStore(areaId, record, mine);
            }

            // Someone else is evaluating this area; share their result if it is for the same content.
            try {
                List<LintIssue> shared = running.result.join();
                if (running.fingerprint.equals(fingerprint)) {
                    return shared;
                }
            } catch (CompletionException e) {
                if (running.fingerprint.equals(fingerprint)) {
                    throw unwrap(e);
                }
            }
        }
    }

    /** Drops the entry for {@code areaId}; the next lookup re-evaluates regardless of fingerprint. */
    public void invalidate(String areaId) {
        InFlight running = inFlight.get(areaId);
        if (running != null) {
            running.invalidated = true;
        }
        entries.invalidate(areaId);
        log.debug("Lint cache invalidated: area={}", areaId);
    }

    public void invalidateAll() {
        inFlight.values().forEach(f -> f.invalidated = true);
        entries.invalidateAll();
    }

    public long size() {
        entries.cleanUp();
        return entries.size();
    }

    @Scheduled(fixedDelay = "${lint.cache.cleanup-interval:60s}")
    public void reclaimExpired() {
        entries.cleanUp();
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    private List<LintIssue> computeAndStore(String areaId, NormalizedRecord record, InFlight mine) {
        try {
            CacheEntry cached = entries.getIfPresent(areaId);
            if (cached != null && cached.matches(mine.fingerprint)) {
                mine.result.complete(cached.issues());
                return cached.issues();
            }

            log.debug("Lint cache miss: area={} fingerprint={}", areaId, mine.fingerprint);
            CacheEntry entry = new CacheEntry(areaId, mine.fingerprint, ruleSet.evaluate(record), clock.instant());
            entries.put(areaId, entry);
            if (mine.invalidated) {
                entries.invalidate(areaId);
            }
            mine.result.complete(entry.issues());
            return entry.issues();
        } catch (RuntimeException | Error e) {
            mine.result.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(areaId, mine);
        }
    }

    private RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return e;
    }

    private void onRemove(RemovalNotification<String, CacheEntry> notification) {
        if (notification.getCause() == RemovalCause.EXPIRED || notification.getCause() == RemovalCause.SIZE) {
            log.debug("Lint cache entry reclaimed: area={} cause={}", notification.getKey(), notification.getCause());
        }
    }
}
