/*
 * Copyright (c) 2026 MakiBytes.
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
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.neonwatch.rpc;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter for RPC retries.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 10;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxRetries;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxRetries) {
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.jitterFactor = Math.max(0, jitterFactor);
        this.maxRetries = Math.max(0, maxRetries);
    }

    /**
     * Delay before retry number {@code attempt + 1}: baseDelay * 2^attempt, then jitter.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(0, attempt), MAX_SHIFT));
        return jitter(exponential);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    void sleep(int attempt) throws InterruptedException {
        long delay = delayMs(attempt);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }
}
