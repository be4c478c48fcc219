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
package de.makibytes.neonwatch.monitor;

import java.util.Deque;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;

import de.makibytes.neonwatch.metrics.TransactionCounters;
import de.makibytes.neonwatch.model.TransactionOutcome;
import de.makibytes.neonwatch.store.Checkpoint;
import de.makibytes.neonwatch.store.CheckpointKey;

/**
 * In-memory checkpoint of one network. Authoritative while the process lives; the store
 * only backs it up. Only the reconciler task holding {@link #tryBeginRound()} mutates it.
 */
public class ReconcilerState {

    private final CheckpointKey key;
    private final TransactionCounters counters;
    private final Set<String> processed = ConcurrentHashMap.newKeySet();
    private final Set<String> failed = ConcurrentHashMap.newKeySet();
    private final Deque<PendingWrite> pendingWrites = new ConcurrentLinkedDeque<>();
    private volatile String cursor;
    private volatile boolean restored;
    private final AtomicBoolean inProgress = new AtomicBoolean();

    public ReconcilerState(CheckpointKey key, TransactionCounters counters) {
        this.key = key;
        this.counters = counters;
    }

    public CheckpointKey getKey() {
        return key;
    }

    public TransactionCounters getCounters() {
        return counters;
    }

    /**
     * Claims this network for one reconciliation pass.
     *
     * @return false while an earlier pass, possibly one cancelled at a round deadline, still runs
     */
    public boolean tryBeginRound() {
        return inProgress.compareAndSet(false, true);
    }

    public void endRound() {
        inProgress.set(false);
    }

    public boolean isRoundInProgress() {
        return inProgress.get();
    }

    public boolean contains(String signature) {
        return processed.contains(signature) || failed.contains(signature);
    }

    /**
     * Counts a freshly classified signature. A known signature is not counted again.
     */
    public boolean record(String signature, TransactionOutcome outcome) {
        boolean added = !contains(signature)
                && (outcome == TransactionOutcome.FAILURE ? failed.add(signature) : processed.add(signature));
        if (added) {
            counters.record(outcome);
        }
        cursor = signature;
        return added;
    }

    public void advanceCursor(String signature) {
        cursor = signature;
    }

    /**
     * Folds a stored checkpoint into memory. Signatures this process has not seen are added and
     * counted; an in-memory cursor wins over the stored one since it can only be newer.
     *
     * @return number of signatures that were new to this process
     */
    public long merge(Checkpoint checkpoint) {
        long addedTotal = 0;
        long addedFailed = 0;
        for (String signature : checkpoint.failed()) {
            if (!contains(signature)) {
                failed.add(signature);
                addedTotal++;
                addedFailed++;
            }
        }
        for (String signature : checkpoint.processed()) {
            if (!contains(signature)) {
                processed.add(signature);
                addedTotal++;
            }
        }
        counters.addRestored(addedTotal, addedFailed);
        if (cursor == null) {
            cursor = checkpoint.lastSignature();
        }
        restored = true;
        return addedTotal;
    }

    public String getCursor() {
        return cursor;
    }

    public boolean isRestored() {
        return restored;
    }

    public int processedCount() {
        return processed.size();
    }

    public int failedCount() {
        return failed.size();
    }

    Deque<PendingWrite> pendingWrites() {
        return pendingWrites;
    }

    public int pendingWriteCount() {
        return pendingWrites.size();
    }

    /**
     * A store write that could not be made while the store was down. {@code outcome} is null
     * for a cursor-only move.
     */
    record PendingWrite(String signature, TransactionOutcome outcome) {
    }
}
