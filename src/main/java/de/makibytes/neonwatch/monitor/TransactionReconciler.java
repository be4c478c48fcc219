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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.neonwatch.config.NeonWatchProperties;
import de.makibytes.neonwatch.metrics.MonitorMetrics;
import de.makibytes.neonwatch.model.SignatureInfo;
import de.makibytes.neonwatch.model.TransactionOutcome;
import de.makibytes.neonwatch.monitor.NetworkRegistry.NetworkDefinition;
import de.makibytes.neonwatch.monitor.ReconcilerState.PendingWrite;
import de.makibytes.neonwatch.rpc.MalformedResponseException;
import de.makibytes.neonwatch.rpc.RateLimitedException;
import de.makibytes.neonwatch.rpc.RpcClientPool;
import de.makibytes.neonwatch.rpc.RpcException;
import de.makibytes.neonwatch.rpc.SolanaRpcClient;
import de.makibytes.neonwatch.store.Checkpoint;
import de.makibytes.neonwatch.store.CheckpointKey;
import de.makibytes.neonwatch.store.CheckpointStore;
import de.makibytes.neonwatch.store.StoreUnavailableException;

/**
 * Counts the transactions of each configured program exactly once across restarts.
 *
 * <p>Per round and network: flush writes queued while the store was down, restore the stored
 * checkpoint once, list signatures newer than the cursor, then classify them strictly oldest
 * to newest. Processing stops at the first signature that cannot be classified, so the cursor
 * never moves past an unclassified signature and the next round resumes right there.
 */
@Service
public class TransactionReconciler implements RoundSource {

    private static final Logger logger = LoggerFactory.getLogger(TransactionReconciler.class);

    private final NetworkRegistry networkRegistry;
    private final RpcClientPool clientPool;
    private final CheckpointStore store;
    private final MonitorMetrics metrics;
    private final NeonWatchProperties properties;
    private final Map<String, ReconcilerState> states = new ConcurrentHashMap<>();

    public TransactionReconciler(NetworkRegistry networkRegistry,
                                 RpcClientPool clientPool,
                                 CheckpointStore store,
                                 MonitorMetrics metrics,
                                 NeonWatchProperties properties) {
        this.networkRegistry = networkRegistry;
        this.clientPool = clientPool;
        this.store = store;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public List<ProbeTask> roundTasks() {
        List<ProbeTask> tasks = new ArrayList<>();
        for (NetworkDefinition network : networkRegistry.getNetworks()) {
            if (network.hasProgram()) {
                tasks.add(new ProbeTask("reconcile:" + network.key(), () -> reconcile(network)));
            }
        }
        return tasks;
    }

    public ReconcilerState getState(String networkKey) {
        return states.get(networkKey);
    }

    public void reconcile(NetworkDefinition network) throws InterruptedException {
        SolanaRpcClient client = clientPool.solana(network.url());
        if (clientPool.isBackingOff(client.getUrl())) {
            logger.debug("Skipping reconciliation of {}: {} is backing off", network.name(), client.getUrl());
            return;
        }
        ReconcilerState state = states.computeIfAbsent(network.key(), key -> new ReconcilerState(
                new CheckpointKey(network.chain(), network.programId()),
                metrics.transactionCounters(network.chain(), network.programId(), network.url())));
        if (!state.tryBeginRound()) {
            logger.warn("Previous reconciliation of {} is still running, skipping this round", network.name());
            return;
        }
        try {
            reconcile(network, client, state);
        } finally {
            state.endRound();
        }
    }

    private void reconcile(NetworkDefinition network, SolanaRpcClient client, ReconcilerState state)
            throws InterruptedException {
        boolean storeReachable = flushPendingWrites(state);
        if (storeReachable && !state.isRestored()) {
            restore(state);
        }

        List<SignatureInfo> fresh;
        try {
            fresh = fetchNewSignatures(client, network.programId(), state.getCursor());
        } catch (RateLimitedException ex) {
            clientPool.markRateLimited(ex.getUrl());
            return;
        } catch (RpcException ex) {
            logger.warn("Could not list signatures for {} ({}): {}", network.name(), state.getKey(), ex.getMessage());
            return;
        }

        int classified = 0;
        for (SignatureInfo info : fresh) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Reconciliation of " + network.name() + " cancelled after " + classified + " signatures");
            }
            String signature = info.signature();
            if (state.contains(signature)) {
                state.advanceCursor(signature);
                continue;
            }
            TransactionOutcome outcome;
            try {
                outcome = client.getTransactionOutcome(signature);
            } catch (RateLimitedException ex) {
                clientPool.markRateLimited(ex.getUrl());
                break;
            } catch (MalformedResponseException ex) {
                logger.warn("Skipping signature {} of {}: {}", signature, network.name(), ex.getMessage());
                state.advanceCursor(signature);
                write(state, new PendingWrite(signature, null));
                continue;
            } catch (RpcException ex) {
                logger.warn("Could not fetch transaction {} of {}, retrying next round: {}", signature, network.name(), ex.getMessage());
                break;
            }
            if (!outcome.isClassified()) {
                logger.debug("Transaction {} of {} not available yet, retrying next round", signature, network.name());
                break;
            }
            write(state, new PendingWrite(signature, outcome));
            state.record(signature, outcome);
            classified++;
        }
        if (classified > 0) {
            logger.info("Reconciled {} new transactions for {} (total {}, failed {})",
                    classified, network.name(), state.getCounters().total(), state.getCounters().failed());
        }
    }

    /**
     * New signatures, oldest first. Without a cursor only the newest page is read: the initial
     * backfill is bounded by {@code reconciler.initial-backfill-limit}.
     */
    List<SignatureInfo> fetchNewSignatures(SolanaRpcClient client, String programId, String cursor)
            throws RpcException, InterruptedException {
        NeonWatchProperties.Reconciler settings = properties.getReconciler();
        List<SignatureInfo> collected = new ArrayList<>();
        if (cursor == null) {
            collected.addAll(client.getSignatures(programId, null, null, signaturePageSize(settings.getInitialBackfillLimit())));
        } else {
            int pageSize = signaturePageSize(settings.getPageSize());
            String before = null;
            while (true) {
                List<SignatureInfo> page = client.getSignatures(programId, before, cursor, pageSize);
                collected.addAll(page);
                if (page.isEmpty() || page.size() < pageSize) {
                    break;
                }
                String oldest = page.get(page.size() - 1).signature();
                if (oldest.equals(before)) {
                    break;
                }
                before = oldest;
                if (Thread.interrupted()) {
                    throw new InterruptedException("Signature listing cancelled");
                }
            }
        }
        Collections.reverse(collected);
        return collected;
    }

    /**
     * A page larger than the node serves would look short and end the catch-up early.
     */
    private static int signaturePageSize(int configured) {
        return Math.min(Math.max(1, configured), SolanaRpcClient.MAX_SIGNATURES_PER_REQUEST);
    }

    private void restore(ReconcilerState state) {
        try {
            Checkpoint checkpoint = store.restore(state.getKey());
            long added = state.merge(checkpoint);
            logger.info("Restored checkpoint {}: {} processed, {} failed, {} new to this process",
                    state.getKey(), checkpoint.processed().size(), checkpoint.failed().size(), added);
        } catch (StoreUnavailableException ex) {
            logger.warn("Checkpoint store unavailable, continuing {} from memory: {}", state.getKey(), ex.getMessage());
        }
    }

    /**
     * Writes through to the store, or queues the write behind earlier ones while the store is down.
     */
    private void write(ReconcilerState state, PendingWrite write) {
        Deque<PendingWrite> pending = state.pendingWrites();
        if (!pending.isEmpty()) {
            pending.addLast(write);
            return;
        }
        try {
            apply(state, write);
        } catch (StoreUnavailableException ex) {
            logger.warn("Checkpoint store unavailable, queueing writes for {}: {}", state.getKey(), ex.getMessage());
            pending.addLast(write);
        }
    }

    /**
     * @return whether the store accepted every queued write
     */
    private boolean flushPendingWrites(ReconcilerState state) {
        Deque<PendingWrite> pending = state.pendingWrites();
        int flushed = 0;
        while (!pending.isEmpty()) {
            try {
                apply(state, pending.peekFirst());
            } catch (StoreUnavailableException ex) {
                logger.warn("Checkpoint store still unavailable for {} ({} writes queued)", state.getKey(), pending.size());
                return false;
            }
            pending.pollFirst();
            flushed++;
        }
        if (flushed > 0) {
            logger.info("Flushed {} queued checkpoint writes for {}", flushed, state.getKey());
        }
        return true;
    }

    private void apply(ReconcilerState state, PendingWrite write) throws StoreUnavailableException {
        if (write.outcome() == null) {
            store.advanceCursor(state.getKey(), write.signature());
        } else {
            store.persistSignature(state.getKey(), write.signature(), write.outcome());
        }
    }
}
