package com.touchline.matchdata;

import com.touchline.exception.SnapshotFetchException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded exponential backoff for upstream calls.
 *
 * <p>Makes up to {@code maxRetries} attempts, sleeping {@code base * 2^attempt} between
 * them, and rethrows the last failure wrapped with the attempt count.
 */
@Component
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final SportsApiConfig sportsApiConfig;

    public RetryPolicy(SportsApiConfig sportsApiConfig) {
        this.sportsApiConfig = sportsApiConfig;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int attempts = Math.max(1, sportsApiConfig.getMaxRetries());
        SnapshotFetchException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return call.get();
            } catch (SnapshotFetchException e) {
                last = e;
                if (attempt < attempts - 1) {
                    long delay = delayFor(attempt);
                    log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                            operation, attempt + 1, attempts, delay, e.getMessage());
                    if (!sleep(delay)) {
                        break;
                    }
                }
            }
        }
        throw new SnapshotFetchException(operation, attempts, last);
    }

    long delayFor(int attempt) {
        return sportsApiConfig.getRetryBaseDelayMs() * (1L << attempt);
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retry backoff interrupted");
            return false;
        }
    }
}
