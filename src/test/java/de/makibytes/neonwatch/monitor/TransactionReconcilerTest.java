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

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.neonwatch.config.NeonWatchProperties;
import de.makibytes.neonwatch.config.TestProperties;
import de.makibytes.neonwatch.metrics.MonitorMetrics;
import de.makibytes.neonwatch.metrics.TransactionCounters;
import de.makibytes.neonwatch.model.TransactionOutcome;
import de.makibytes.neonwatch.monitor.NetworkRegistry.NetworkDefinition;
import de.makibytes.neonwatch.rpc.FakeRpcClientPool;
import de.makibytes.neonwatch.rpc.FakeSolanaRpcClient;
import de.makibytes.neonwatch.rpc.MalformedResponseException;
import de.makibytes.neonwatch.rpc.RateLimitedException;
import de.makibytes.neonwatch.rpc.RpcException;
import de.makibytes.neonwatch.store.CheckpointKey;
import de.makibytes.neonwatch.store.InMemoryCheckpointStore;
import de.makibytes.neonwatch.store.SignatureGroup;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("TransactionReconciler Tests")
class TransactionReconcilerTest {

    private static final String DEVNET_URL = "http://devnet.rpc";
    private static final String PROGRAM = "NeonProgram111";
    private static final CheckpointKey DEVNET_KEY = new CheckpointKey("devnet", PROGRAM);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private NeonWatchProperties properties;
    private InMemoryCheckpointStore store;
    private MeterRegistry meterRegistry;
    private FakeRpcClientPool pool;
    private TransactionReconciler reconciler;
    private NetworkRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new NeonWatchProperties();
        properties.setNetworks(List.of(TestProperties.network("devnet", "devnet", PROGRAM, DEVNET_URL)));
        store = new InMemoryCheckpointStore();
        rebuild();
    }

    private void rebuild() {
        registry = new NetworkRegistry(properties);
        meterRegistry = new SimpleMeterRegistry();
        pool = new FakeRpcClientPool(properties, CLOCK);
        reconciler = new TransactionReconciler(registry, pool, store, new MonitorMetrics(meterRegistry), properties);
    }

    private NetworkDefinition devnet() {
        return registry.getNetworks().get(0);
    }

    private FakeSolanaRpcClient rpc() {
        return pool.solanaFake(DEVNET_URL);
    }

    private TransactionCounters counters() {
        return reconciler.getState(devnet().key()).getCounters();
    }

    private static Set<String> signatures(String prefix, int count) {
        return IntStream.range(0, count).mapToObj(i -> prefix + i).collect(Collectors.toSet());
    }

    @Test
    @DisplayName("devnet: 10 restored plus 2 success and 1 failure gives 13/1 and ratio 12/13")
    void devnetScenario() throws Exception {
        store.seed(DEVNET_KEY, signatures("old", 10), Set.of(), "old9");
        rpc().addTransactions("old", 10, TransactionOutcome.SUCCESS)
                .addTransaction("new0", TransactionOutcome.SUCCESS)
                .addTransaction("new1", TransactionOutcome.FAILURE)
                .addTransaction("new2", TransactionOutcome.SUCCESS);

        reconciler.reconcile(devnet());

        assertEquals(13, counters().total());
        assertEquals(1, counters().failed());
        assertEquals(12.0 / 13.0, counters().successRatio().getAsDouble(), 1e-9);
        assertEquals(3, rpc().transactionCalls(), "Only the new signatures should be classified");
        assertEquals(12, store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.PROCESSED).size());
        assertEquals(Set.of("new1"), store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.FAILED));
        assertEquals("new2", store.cursor(DEVNET_KEY));

        assertEquals(13.0, meterRegistry.get(MonitorMetrics.TRANSACTION_COUNT)
                .tags("chain", "devnet", "program_id", PROGRAM, "rpc_url", DEVNET_URL).counter().count());
        assertEquals(1.0, meterRegistry.get(MonitorMetrics.TRANSACTION_FAIL_COUNT).counter().count());
        assertEquals(12.0 / 13.0, meterRegistry.get(MonitorMetrics.TRANSACTION_SUCCESS_RATIO).gauge().value(), 1e-9);
    }

    @Test
    @DisplayName("idempotence: a second round over the same signatures counts nothing")
    void secondRoundDoesNotRecount() throws Exception {
        rpc().addTransactions("sig", 5, TransactionOutcome.SUCCESS);

        reconciler.reconcile(devnet());
        reconciler.reconcile(devnet());

        assertEquals(5, counters().total());
        assertEquals(5, rpc().transactionCalls());
    }

    @Test
    @DisplayName("restart: a new process restores counts from the store and classifies nothing twice")
    void restartRestoresFromStore() throws Exception {
        rpc().addTransactions("sig", 4, TransactionOutcome.SUCCESS)
                .addTransaction("bad", TransactionOutcome.FAILURE);
        reconciler.reconcile(devnet());
        assertEquals(5, counters().total());

        rebuild();
        rpc().addTransactions("sig", 4, TransactionOutcome.SUCCESS)
                .addTransaction("bad", TransactionOutcome.FAILURE)
                .addTransaction("later", TransactionOutcome.SUCCESS);
        reconciler.reconcile(devnet());

        assertEquals(6, counters().total());
        assertEquals(1, counters().failed());
        assertEquals(1, rpc().transactionCalls(), "Only the signature after the stored cursor is new");
    }

    @Test
    @DisplayName("initial backfill reads only the newest page of the configured size")
    void initialBackfillIsBounded() throws Exception {
        properties.getReconciler().setInitialBackfillLimit(20);
        rpc().addTransactions("sig", 50, TransactionOutcome.SUCCESS);

        reconciler.reconcile(devnet());

        assertEquals(20, counters().total());
        assertEquals(List.of(20), rpc().requestedLimits());
        assertEquals("sig49", reconciler.getState(devnet().key()).getCursor());
        assertTrue(store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.PROCESSED).contains("sig30"));
        assertFalse(store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.PROCESSED).contains("sig29"));
    }

    @Test
    @DisplayName("catching up pages back to the cursor and processes oldest first")
    void catchUpPagesToCursor() throws Exception {
        properties.getReconciler().setPageSize(2);
        store.seed(DEVNET_KEY, Set.of("base"), Set.of(), "base");
        rpc().addTransaction("base", TransactionOutcome.SUCCESS)
                .addTransactions("n", 5, TransactionOutcome.SUCCESS);

        reconciler.reconcile(devnet());

        assertEquals(6, counters().total());
        assertEquals("n4", store.cursor(DEVNET_KEY));
        assertEquals(List.of(2, 2, 2), rpc().requestedLimits());
    }

    @Test
    @DisplayName("a page size above the node cap still pages all the way back to the cursor")
    void oversizedPageSizeIsCapped() throws Exception {
        properties.getReconciler().setPageSize(1500);
        store.seed(DEVNET_KEY, Set.of("base"), Set.of(), "base");
        rpc().addTransaction("base", TransactionOutcome.SUCCESS)
                .addTransactions("n", 2500, TransactionOutcome.SUCCESS);

        reconciler.reconcile(devnet());

        assertEquals(2501, counters().total());
        assertEquals(2500, rpc().transactionCalls());
        assertEquals("n2499", store.cursor(DEVNET_KEY));
        assertTrue(store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.PROCESSED).contains("n0"));
        assertEquals(List.of(1000, 1000, 1000), rpc().requestedLimits());
    }

    @Test
    @DisplayName("a transaction not yet available stops the round and is retried next round")
    void notFoundStopsAndResumes() throws Exception {
        rpc().addTransactions("a", 5, TransactionOutcome.SUCCESS);
        rpc().setOutcome("a2", TransactionOutcome.NOT_FOUND);

        reconciler.reconcile(devnet());
        assertEquals(2, counters().total());
        assertEquals("a1", store.cursor(DEVNET_KEY));

        rpc().setOutcome("a2", TransactionOutcome.SUCCESS);
        reconciler.reconcile(devnet());
        assertEquals(5, counters().total());
        assertEquals("a4", store.cursor(DEVNET_KEY));
    }

    @Test
    @DisplayName("an RPC error mid-round never moves the cursor past the failed signature")
    void rpcErrorKeepsCursor() throws Exception {
        rpc().addTransactions("a", 5, TransactionOutcome.SUCCESS);
        rpc().failTransaction("a3", new RpcException("connection reset"));

        reconciler.reconcile(devnet());
        assertEquals(3, counters().total());
        assertEquals("a2", reconciler.getState(devnet().key()).getCursor());

        rpc().clearTransactionError("a3");
        reconciler.reconcile(devnet());
        assertEquals(5, counters().total());
    }

    @Test
    @DisplayName("cancelled mid-page: store and memory stop at the last classified signature")
    void interruptedRoundStopsAtLastClassification() throws Exception {
        rpc().addTransactions("a", 6, TransactionOutcome.SUCCESS);
        rpc().setOutcome("a1", TransactionOutcome.FAILURE);
        rpc().setTransactionHook(signature -> {
            if (signature.equals("a3")) {
                throw new InterruptedException("round deadline");
            }
        });

        assertThrows(InterruptedException.class, () -> reconciler.reconcile(devnet()));

        ReconcilerState state = reconciler.getState(devnet().key());
        assertEquals(2, state.processedCount());
        assertEquals(1, state.failedCount());
        assertEquals(Set.of("a0", "a2"), store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.PROCESSED));
        assertEquals(Set.of("a1"), store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.FAILED));
        assertEquals("a2", store.cursor(DEVNET_KEY));
        assertEquals("a2", state.getCursor());
        assertEquals(3, counters().total());
        assertFalse(state.isRoundInProgress());

        rpc().setTransactionHook(null);
        reconciler.reconcile(devnet());

        assertEquals(6, counters().total());
        assertEquals(1, counters().failed());
        assertEquals("a5", store.cursor(DEVNET_KEY));
        assertEquals(7, rpc().transactionCalls(), "Only the interrupted signature is fetched twice");
    }

    @Test
    @DisplayName("a round that is still running keeps a second round off the same network")
    void overlappingRoundIsSkipped() throws Exception {
        rpc().addTransactions("a", 3, TransactionOutcome.SUCCESS);
        CountDownLatch blocked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        rpc().setTransactionHook(signature -> {
            if (signature.equals("a1")) {
                blocked.countDown();
                release.await();
            }
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> first = executor.submit(() -> {
                reconciler.reconcile(devnet());
                return null;
            });
            assertTrue(blocked.await(5, TimeUnit.SECONDS));
            int callsBefore = rpc().transactionCalls();

            reconciler.reconcile(devnet());

            assertEquals(callsBefore, rpc().transactionCalls());
            release.countDown();
            first.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertEquals(3, counters().total());
        assertEquals("a2", store.cursor(DEVNET_KEY));
        assertFalse(reconciler.getState(devnet().key()).isRoundInProgress());
    }

    @Test
    @DisplayName("a malformed transaction is skipped without being counted")
    void malformedTransactionIsSkipped() throws Exception {
        rpc().addTransactions("a", 4, TransactionOutcome.SUCCESS);
        rpc().failTransaction("a1", new MalformedResponseException("getTransaction a1 has no meta"));

        reconciler.reconcile(devnet());

        assertEquals(3, counters().total());
        assertEquals("a3", store.cursor(DEVNET_KEY));
        assertFalse(store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.PROCESSED).contains("a1"));
    }

    @Test
    @DisplayName("store outage: counting continues in memory and queued writes are flushed later")
    void storeOutageQueuesWrites() throws Exception {
        store.seed(DEVNET_KEY, signatures("old", 10), Set.of(), "old9");
        rpc().addTransactions("old", 10, TransactionOutcome.SUCCESS)
                .addTransaction("new0", TransactionOutcome.SUCCESS)
                .addTransaction("new1", TransactionOutcome.FAILURE)
                .addTransaction("new2", TransactionOutcome.SUCCESS);
        store.setAvailable(false);

        reconciler.reconcile(devnet());
        ReconcilerState state = reconciler.getState(devnet().key());
        assertFalse(state.isRestored());
        assertEquals(13, counters().total());
        assertEquals(13, state.pendingWriteCount());

        store.setAvailable(true);
        reconciler.reconcile(devnet());

        assertTrue(state.isRestored());
        assertEquals(0, state.pendingWriteCount());
        assertEquals(13, counters().total(), "Restored signatures already counted in memory must not count again");
        assertEquals(1, counters().failed());
        assertEquals(12, store.loadAllGroupMembers(DEVNET_KEY, SignatureGroup.PROCESSED).size());
        assertEquals("new2", store.cursor(DEVNET_KEY));
    }

    @Test
    @DisplayName("restore merges stored signatures this process has not seen")
    void restoreMergesUnseenSignatures() throws Exception {
        rpc().addTransactions("fresh", 2, TransactionOutcome.SUCCESS);
        store.setAvailable(false);
        reconciler.reconcile(devnet());
        assertEquals(2, counters().total());

        store.seed(DEVNET_KEY, Set.of("stored0", "stored1"), Set.of("storedFail"), "stored1");
        store.setAvailable(true);
        reconciler.reconcile(devnet());

        assertEquals(5, counters().total());
        assertEquals(1, counters().failed());
        assertEquals("fresh1", reconciler.getState(devnet().key()).getCursor());
    }

    @Test
    @DisplayName("rate limiting marks the endpoint and the next round skips it")
    void rateLimitBacksOff() throws Exception {
        rpc().addTransactions("a", 3, TransactionOutcome.SUCCESS);
        rpc().failTransaction("a1", new RateLimitedException(DEVNET_URL, "Too many requests"));

        reconciler.reconcile(devnet());
        assertEquals(1, counters().total());
        assertTrue(pool.isBackingOff(DEVNET_URL));

        rpc().clearTransactionError("a1");
        int callsBefore = rpc().transactionCalls();
        reconciler.reconcile(devnet());
        assertEquals(callsBefore, rpc().transactionCalls());
        assertEquals(1, counters().total());
    }

    @Test
    @DisplayName("isolation: a failing network leaves the other network's counters alone")
    void failuresAreIsolatedPerNetwork() throws Exception {
        properties.setNetworks(List.of(
                TestProperties.network("devnet", "devnet", PROGRAM, DEVNET_URL),
                TestProperties.network("mainnet", "mainnet", PROGRAM, "http://mainnet.rpc")));
        rebuild();
        NetworkDefinition mainnet = registry.getNetworks().get(1);
        FakeSolanaRpcClient mainnetRpc = pool.solanaFake("http://mainnet.rpc");
        rpc().addTransactions("d", 2, TransactionOutcome.SUCCESS);
        mainnetRpc.addTransactions("m", 3, TransactionOutcome.FAILURE);
        reconciler.reconcile(devnet());
        reconciler.reconcile(mainnet);

        rpc().setSignaturesError(new RpcException("HTTP status 502 from " + DEVNET_URL));
        mainnetRpc.addTransaction("m3", TransactionOutcome.SUCCESS);
        reconciler.reconcile(devnet());
        reconciler.reconcile(mainnet);

        assertEquals(2, counters().total());
        assertEquals(0, counters().failed());
        TransactionCounters mainnetCounters = reconciler.getState(mainnet.key()).getCounters();
        assertEquals(4, mainnetCounters.total());
        assertEquals(3, mainnetCounters.failed());
    }

    @Test
    @DisplayName("networks without a program id get no reconciliation task")
    void networksWithoutProgramAreSkipped() {
        properties.setNetworks(List.of(
                TestProperties.network("devnet", "devnet", PROGRAM, DEVNET_URL),
                TestProperties.network("rpc-only", "devnet", null, "http://other.rpc")));
        rebuild();

        List<ProbeTask> tasks = reconciler.roundTasks();

        assertEquals(1, tasks.size());
        assertEquals("reconcile:devnet", tasks.get(0).name());
        assertNull(reconciler.getState("rpc-only"));
    }
}
