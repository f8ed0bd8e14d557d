package com.touchline.matchdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.touchline.domain.enums.MatchPhase;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.exception.SnapshotFetchException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Snapshot source backed by API-Football.
 *
 * <p>Each call fetches the live fixture list (with retry and backoff), then the
 * statistics of every fixture. Statistics fetches run on the {@code fetchExecutor},
 * whose pool size is the upstream concurrency budget, in batches of
 * {@code batchSize} with {@code requestDelayMs} between batches.
 *
 * <p>Statistics responses are cached in Caffeine with a lifetime chosen by match
 * phase (live fixtures refresh every minute, scheduled ones every ten).
 *
 * <p>When the fixture list cannot be fetched after all retries, the last successful
 * list is returned with every snapshot flagged {@code stale}. With no previous list
 * the result is empty.
 */
@Service
public class MatchSnapshotService implements SnapshotSource {

    private static final Logger log = LoggerFactory.getLogger(MatchSnapshotService.class);

    private final ApiFootballClient apiFootballClient;
    private final SnapshotParser snapshotParser;
    private final RetryPolicy retryPolicy;
    private final SportsApiConfig sportsApiConfig;
    private final Executor fetchExecutor;

    /** Caffeine cache: key = fixture id, value = statistics response, TTL by match phase. */
    private final Cache<String, CachedStatistics> statisticsCache;

    private final AtomicReference<List<MatchSnapshot>> lastSnapshots = new AtomicReference<>(List.of());

    public MatchSnapshotService(
            ApiFootballClient apiFootballClient,
            SnapshotParser snapshotParser,
            RetryPolicy retryPolicy,
            SportsApiConfig sportsApiConfig,
            @Qualifier("fetchExecutor") Executor fetchExecutor) {
        this.apiFootballClient = apiFootballClient;
        this.snapshotParser = snapshotParser;
        this.retryPolicy = retryPolicy;
        this.sportsApiConfig = sportsApiConfig;
        this.fetchExecutor = fetchExecutor;
        this.statisticsCache = Caffeine.newBuilder()
                .maximumSize(1000)
                .expireAfter(new PhaseExpiry(sportsApiConfig))
                .build();
    }

    @Override
    public List<MatchSnapshot> fetchCurrentMatches() {
        JsonNode fixtures;
        try {
            fixtures = retryPolicy.execute("GET " + ApiFootballClient.LIVE_FIXTURES_PATH, apiFootballClient::getLiveFixtures);
        } catch (SnapshotFetchException e) {
            return fallback(e);
        }

        List<JsonNode> entries = new ArrayList<>();
        fixtures.forEach(entries::add);

        Instant fetchedAt = Instant.now();
        List<MatchSnapshot> snapshots = new ArrayList<>(entries.size());
        int batchSize = Math.max(1, sportsApiConfig.getBatchSize());
        for (int start = 0; start < entries.size(); start += batchSize) {
            if (start > 0 && !pauseBetweenBatches()) {
                break;
            }
            List<JsonNode> batch = entries.subList(start, Math.min(start + batchSize, entries.size()));
            snapshots.addAll(processBatch(batch, fetchedAt));
        }

        lastSnapshots.set(List.copyOf(snapshots));
        log.info("Fetched {} live fixtures", snapshots.size());
        return snapshots;
    }

    /** Number of fixtures whose statistics are currently cached. */
    public long getCachedStatisticsCount() {
        statisticsCache.cleanUp();
        return statisticsCache.estimatedSize();
    }

    private List<MatchSnapshot> processBatch(List<JsonNode> batch, Instant fetchedAt) {
        List<CompletableFuture<MatchSnapshot>> futures = new ArrayList<>(batch.size());
        for (JsonNode fixture : batch) {
            futures.add(CompletableFuture.supplyAsync(() -> toSnapshot(fixture, fetchedAt), fetchExecutor));
        }

        List<MatchSnapshot> result = new ArrayList<>(batch.size());
        for (CompletableFuture<MatchSnapshot> future : futures) {
            MatchSnapshot snapshot = future.exceptionally(e -> {
                        log.error("Failed to build snapshot: {}", e.getMessage(), e);
                        return null;
                    })
                    .join();
            if (snapshot != null && !snapshot.getFixtureId().isEmpty()) {
                result.add(snapshot);
            }
        }
        return result;
    }

    private MatchSnapshot toSnapshot(JsonNode fixture, Instant fetchedAt) {
        String fixtureId = snapshotParser.fixtureId(fixture);
        if (fixtureId.isEmpty()) {
            log.warn("Skipping fixture entry without an id");
            return null;
        }
        return snapshotParser.parse(fixture, statisticsFor(fixtureId, snapshotParser.status(fixture)), fetchedAt);
    }

    private JsonNode statisticsFor(String fixtureId, String status) {
        CachedStatistics cached = statisticsCache.getIfPresent(fixtureId);
        if (cached != null) {
            return cached.statistics();
        }
        try {
            JsonNode statistics = apiFootballClient.getFixtureStatistics(fixtureId);
            statisticsCache.put(fixtureId, new CachedStatistics(statistics, MatchPhase.fromStatus(status)));
            return statistics;
        } catch (SnapshotFetchException e) {
            log.warn("Statistics unavailable for fixture {}: {}", fixtureId, e.getMessage());
            return null;
        }
    }

    private List<MatchSnapshot> fallback(SnapshotFetchException cause) {
        List<MatchSnapshot> previous = lastSnapshots.get();
        if (previous.isEmpty()) {
            log.warn("Live fixtures unavailable and no cached list to fall back on: {}", cause.getMessage());
            return List.of();
        }
        log.warn("Live fixtures unavailable, serving {} cached snapshots as stale: {}",
                previous.size(), cause.getMessage());
        return previous.stream()
                .map(snapshot -> snapshot.toBuilder().stale(true).build())
                .toList();
    }

    private boolean pauseBetweenBatches() {
        long delay = sportsApiConfig.getRequestDelayMs();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fixture fetch interrupted between batches");
            return false;
        }
    }

    private record CachedStatistics(JsonNode statistics, MatchPhase phase) {}

    private static final class PhaseExpiry implements Expiry<String, CachedStatistics> {

        private final SportsApiConfig sportsApiConfig;

        private PhaseExpiry(SportsApiConfig sportsApiConfig) {
            this.sportsApiConfig = sportsApiConfig;
        }

        @Override
        public long expireAfterCreate(String key, CachedStatistics value, long currentTime) {
            return sportsApiConfig.ttlFor(value.phase()).toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedStatistics value, long currentTime, long currentDuration) {
            return sportsApiConfig.ttlFor(value.phase()).toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedStatistics value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
