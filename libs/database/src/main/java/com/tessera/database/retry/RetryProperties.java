package com.tessera.database.retry;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Bounded retry settings for transient storage failures.
 *
 * <pre>{@code
 * tessera:
 *   storage:
 *     retry:
 *       max-attempts: 3
 *       initial-backoff: 50ms
 *       multiplier: 2.0
 * }</pre>
 *
 * @param maxAttempts total attempts including the first one
 * @param initialBackoff pause before the first retry
 * @param multiplier growth factor applied to the pause after each retry
 */
@Validated
@ConfigurationProperties(prefix = "tessera.storage.retry")
public record RetryProperties(
        @Min(1) @Max(10) Integer maxAttempts,
        Duration initialBackoff,
        @DecimalMin("1.0") Double multiplier) {

    public RetryProperties {
        if (maxAttempts == null) {
            maxAttempts = 3;
        }
        if (initialBackoff == null) {
            initialBackoff = Duration.ofMillis(50);
        }
        if (multiplier == null) {
            multiplier = 2.0;
        }
    }

    /** Settings used when nothing is configured. */
    public static RetryProperties defaults() {
        return new RetryProperties(null, null, null);
    }
}
