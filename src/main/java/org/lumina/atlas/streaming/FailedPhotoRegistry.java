package org.lumina.atlas.streaming;

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Remembers photos whose decode failed for a non-retryable reason, so later generations
 * report them as failed without asking the loader again.
 * <p>
 * Entries expire after a fixed time (the file may be replaced or repaired) and the
 * registry is bounded in size.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe (backed by a Caffeine cache).
 */
public class FailedPhotoRegistry {

    private static final Logger log = LoggerFactory.getLogger(FailedPhotoRegistry.class);

    private final Cache<String, String> failures;

    public FailedPhotoRegistry(Duration expireAfterWrite, long maximumSize) {
        this(expireAfterWrite, maximumSize, Ticker.systemTicker());
    }

    /**
     * @param ticker Time source, replaceable in tests.
     */
    public FailedPhotoRegistry(Duration expireAfterWrite, long maximumSize, Ticker ticker) {
        this.failures = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(expireAfterWrite)
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
        log.debug("Failed photo registry initialized: maxSize={}, expireAfterWrite={}", maximumSize, expireAfterWrite);
    }

    public void record(String photoId, String reason) {
        failures.put(photoId, reason);
        log.debug("Remembering decode failure of '{}': {}", photoId, reason);
    }

    public boolean isFailed(String photoId) {
        return failures.getIfPresent(photoId) != null;
    }

    public Optional<String> reason(String photoId) {
        return Optional.ofNullable(failures.getIfPresent(photoId));
    }

    public void forget(String photoId) {
        failures.invalidate(photoId);
    }

    public void clear() {
        failures.invalidateAll();
    }

    public long size() {
        failures.cleanUp();
        return failures.estimatedSize();
    }
}
