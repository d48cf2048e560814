package me.golemcore.livechat.retry;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with a cap and symmetric jitter.
 *
 * <p>
 * The delay for a 0-indexed attempt is {@code base * multiplier^attempt},
 * capped at {@code maxDelay}, then shifted by a random amount within
 * {@code ±jitter * capped}. The random source returns values in
 * {@code [0, 1)} and can be replaced for deterministic tests.
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 *
 * @since 1.0
 */
@Getter
public final class BackoffPolicy {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final double DEFAULT_JITTER = 0.1;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitter;
    @Getter(AccessLevel.NONE)
    private final DoubleSupplier randomSource;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double multiplier, double jitter,
            DoubleSupplier randomSource) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.randomSource = randomSource != null ? randomSource : () -> ThreadLocalRandom.current().nextDouble();
    }

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double multiplier, double jitter) {
        this(baseDelay, maxDelay, multiplier, jitter, null);
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MULTIPLIER, DEFAULT_JITTER);
    }

    /**
     * Returns a copy of this policy using the given random source.
     */
    public BackoffPolicy withRandomSource(DoubleSupplier source) {
        return new BackoffPolicy(baseDelay, maxDelay, multiplier, jitter, source);
    }

    /**
     * Returns a copy of this policy without jitter.
     */
    public BackoffPolicy withoutJitter() {
        return new BackoffPolicy(baseDelay, maxDelay, multiplier, 0.0, randomSource);
    }

    /**
     * Computes the wait before retry number {@code attempt} (0-indexed).
     */
    public Duration delay(int attempt) {
        double capped = cappedMillis(Math.max(0, attempt));
        if (jitter > 0.0) {
            // uniform in [-jitter, +jitter) of the capped delay
            double offset = (randomSource.getAsDouble() * 2.0 - 1.0) * jitter * capped;
            capped = capped + offset;
        }
        return Duration.ofMillis(Math.max(0L, Math.round(capped)));
    }

    private double cappedMillis(int attempt) {
        double max = maxDelay.toMillis();
        double raw = baseDelay.toMillis() * Math.pow(multiplier, attempt);
        if (Double.isInfinite(raw) || raw > max) {
            return max;
        }
        return raw;
    }
}
