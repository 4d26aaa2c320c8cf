/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.taskdag.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy for a node whose external execution reports failure.
 *
 * <p>The delay before the n-th retry (1-based) is
 * {@code delayMs * backoffMultiplier^(n - 1)}, so a policy of
 * {@code {maxRetries: 2, delayMs: 100, backoffMultiplier: 2}} waits 100 ms before the first
 * retry and 200 ms before the second.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class RetryPolicy {

    private static final RetryPolicy NONE = new RetryPolicy(0, 0L, 1.0);

    private final int maxRetries;
    private final long delayMs;
    private final double backoffMultiplier;

    public RetryPolicy(int maxRetries, long delayMs, double backoffMultiplier) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative: " + maxRetries);
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("Retry delay cannot be negative: " + delayMs);
        }
        if (Double.isNaN(backoffMultiplier) || Double.isInfinite(backoffMultiplier) || backoffMultiplier <= 0) {
            throw new IllegalArgumentException("Backoff multiplier must be a positive number: " + backoffMultiplier);
        }
        this.maxRetries = maxRetries;
        this.delayMs = delayMs;
        this.backoffMultiplier = backoffMultiplier;
    }

    /**
     * A policy that never retries.
     */
    public static RetryPolicy none() {
        return NONE;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getDelayMs() {
        return delayMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    /**
     * Whether another attempt is allowed after {@code retriesSoFar} retries have been used.
     */
    public boolean allowsRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries;
    }

    /**
     * Computes the backoff delay before the given retry.
     *
     * @param retryNumber the 1-based retry number
     * @return the delay to wait before re-releasing the node
     */
    public Duration delayFor(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number must be at least 1: " + retryNumber);
        }
        double millis = delayMs * Math.pow(backoffMultiplier, retryNumber - 1);
        if (millis >= Long.MAX_VALUE) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.ofMillis(Math.round(millis));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxRetries == that.maxRetries &&
               delayMs == that.delayMs &&
               Double.compare(that.backoffMultiplier, backoffMultiplier) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, delayMs, backoffMultiplier);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
               "maxRetries=" + maxRetries +
               ", delayMs=" + delayMs +
               ", backoffMultiplier=" + backoffMultiplier +
               '}';
    }
}
