// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.util.concurrent.Uninterruptibles;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Exponential backoff with full jitter: the n-th retry waits a random duration between zero and
 * {@code min(maxDelay, baseDelay * 2^(n-1))}.
 */
@Value
public class ExponentialBackoff {
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RETRIES = 50;

    Duration baseDelay;
    Duration maxDelay;
    int maxRetries;
    Sleeper sleeper;

    @Builder
    private ExponentialBackoff(
            @Nullable Duration baseDelay,
            @Nullable Duration maxDelay,
            @Nullable Integer maxRetries,
            @Nullable Sleeper sleeper) {
        this.baseDelay = baseDelay != null ? baseDelay : DEFAULT_BASE_DELAY;
        this.maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        this.sleeper = sleeper != null ? sleeper : Uninterruptibles::sleepUninterruptibly;
        checkArgument(!this.baseDelay.isNegative(), "Base delay must not be negative");
        checkArgument(!this.maxDelay.isNegative(), "Max delay must not be negative");
        checkArgument(this.maxRetries >= 0, "Max retries must not be negative");
    }

    public static ExponentialBackoff defaults() {
        return builder().build();
    }

    public boolean canRetry(int retry) {
        return retry <= maxRetries;
    }

    /**
     * Upper bound of the delay before the given retry, counting from 1.
     */
    public Duration delayBound(int retry) {
        checkArgument(retry > 0, "Retries are counted from 1");
        long baseMillis = baseDelay.toMillis();
        int shift = Math.min(retry - 1, 62);
        long boundMillis = baseMillis > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseMillis << shift;
        return Duration.ofMillis(Math.min(boundMillis, maxDelay.toMillis()));
    }

    /**
     * Sleeps a jittered delay before the given retry.
     *
     * @return the delay slept
     */
    public Duration pause(int retry) {
        long boundMillis = delayBound(retry).toMillis();
        Duration delay = Duration.ofMillis(boundMillis == 0 ? 0 : ThreadLocalRandom.current().nextLong(boundMillis + 1));
        sleeper.sleep(delay);
        return delay;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration);
    }
}
