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
package de.makibytes.neonwatch.metrics;

import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import de.makibytes.neonwatch.model.TransactionOutcome;

/**
 * Total and failure counters of one {@code (chain, program_id, rpc_url)} series.
 * The success ratio gauge only appears once at least one transaction was counted.
 */
public final class TransactionCounters {

    private final MeterRegistry registry;
    private final Tags tags;
    private final Counter totalCounter;
    private final Counter failedCounter;
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicBoolean ratioRegistered = new AtomicBoolean();

    TransactionCounters(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.tags = tags;
        this.totalCounter = Counter.builder(MonitorMetrics.TRANSACTION_COUNT)
                .description("Transactions seen for the program")
                .tags(tags)
                .register(registry);
        this.failedCounter = Counter.builder(MonitorMetrics.TRANSACTION_FAIL_COUNT)
                .description("Transactions of the program that failed on chain")
                .tags(tags)
                .register(registry);
    }

    public void record(TransactionOutcome outcome) {
        if (!outcome.isClassified()) {
            throw new IllegalArgumentException("Cannot count an unclassified transaction");
        }
        add(1, outcome == TransactionOutcome.FAILURE ? 1 : 0);
    }

    /**
     * Adds signatures recovered from the checkpoint store that this process had not counted yet.
     */
    public void addRestored(long restoredTotal, long restoredFailed) {
        if (restoredTotal < 0 || restoredFailed < 0 || restoredFailed > restoredTotal) {
            throw new IllegalArgumentException("Invalid restored counts " + restoredTotal + "/" + restoredFailed);
        }
        add(restoredTotal, restoredFailed);
    }

    public long total() {
        return total.get();
    }

    public long failed() {
        return failed.get();
    }

    public OptionalDouble successRatio() {
        long totalSnapshot = total.get();
        if (totalSnapshot <= 0) {
            return OptionalDouble.empty();
        }
        long failedSnapshot = Math.min(failed.get(), totalSnapshot);
        return OptionalDouble.of(1.0 - failedSnapshot / (double) totalSnapshot);
    }

    private void add(long addTotal, long addFailed) {
        if (addTotal == 0) {
            return;
        }
        if (addFailed > 0) {
            failed.addAndGet(addFailed);
            failedCounter.increment(addFailed);
        }
        total.addAndGet(addTotal);
        totalCounter.increment(addTotal);
        if (ratioRegistered.compareAndSet(false, true)) {
            Gauge.builder(MonitorMetrics.TRANSACTION_SUCCESS_RATIO, this, counters -> counters.successRatio().orElse(Double.NaN))
                    .description("1 - failed/total for the program")
                    .tags(tags)
                    .strongReference(true)
                    .register(registry);
        }
    }
}
