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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import de.makibytes.neonwatch.config.MonitorConfig;
import de.makibytes.neonwatch.config.NeonWatchProperties;
import de.makibytes.neonwatch.metrics.MonitorMetrics;
import de.makibytes.neonwatch.model.NodeHealthStatus;
import de.makibytes.neonwatch.monitor.NetworkRegistry.ServerGroupDefinition;
import de.makibytes.neonwatch.rpc.RpcClientPool;
import de.makibytes.neonwatch.rpc.RpcException;
import de.makibytes.neonwatch.rpc.SolanaRpcClient;

/**
 * Scores every member of a server group against the group's highest slot.
 * Health is 0 when unreachable, 1 when within the drift threshold and the drift itself otherwise.
 */
@Service
public class RpcHealthProber implements RoundSource {

    private static final Logger logger = LoggerFactory.getLogger(RpcHealthProber.class);

    static final long UNREACHABLE = 0;
    static final long HEALTHY = 1;

    private final NetworkRegistry networkRegistry;
    private final RpcClientPool clientPool;
    private final MonitorMetrics metrics;
    private final NeonWatchProperties properties;
    private final ExecutorService executor;

    public RpcHealthProber(NetworkRegistry networkRegistry,
                           RpcClientPool clientPool,
                           MonitorMetrics metrics,
                           NeonWatchProperties properties,
                           @Qualifier(MonitorConfig.MONITOR_EXECUTOR) ExecutorService executor) {
        this.networkRegistry = networkRegistry;
        this.clientPool = clientPool;
        this.metrics = metrics;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public List<ProbeTask> roundTasks() {
        List<ProbeTask> tasks = new ArrayList<>();
        for (ServerGroupDefinition group : networkRegistry.getServerGroups()) {
            if (!group.servers().isEmpty()) {
                tasks.add(new ProbeTask("health:" + group.name(), () -> probeGroup(group)));
            }
        }
        return tasks;
    }

    public Map<String, Long> probeGroup(ServerGroupDefinition group) throws InterruptedException {
        Map<String, Future<MemberSample>> pending = new LinkedHashMap<>();
        for (String server : group.servers()) {
            pending.put(server, executor.submit(() -> sample(server)));
        }
        long waitMs = Math.max(1, properties.getHealth().getProbeTimeoutMs() * 2);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitMs);

        Map<String, MemberSample> samples = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, Future<MemberSample>> entry : pending.entrySet()) {
                samples.put(entry.getKey(), await(entry.getKey(), entry.getValue(), deadline));
            }
        } finally {
            pending.values().forEach(future -> future.cancel(true));
        }

        Map<String, Long> health = score(samples, properties.getHealth().getSlotDriftThreshold());
        health.forEach((server, value) -> metrics.setNodeHealth(server, group.name(), value));
        logger.debug("Health of group {}: {}", group.name(), health);
        return health;
    }

    /**
     * Scores one group. A missing slot means unreachable.
     */
    static Map<String, Long> score(Map<String, MemberSample> samples, long driftThreshold) {
        long threshold = Math.max(1, driftThreshold);
        OptionalLong maxSlot = samples.values().stream()
                .filter(MemberSample::reachable)
                .mapToLong(MemberSample::slot)
                .max();
        Map<String, Long> health = new LinkedHashMap<>();
        for (Map.Entry<String, MemberSample> entry : samples.entrySet()) {
            MemberSample sample = entry.getValue();
            if (!sample.reachable() || maxSlot.isEmpty()) {
                health.put(entry.getKey(), UNREACHABLE);
                continue;
            }
            long drift = maxSlot.getAsLong() - sample.slot();
            long value = drift <= threshold ? HEALTHY : drift;
            Long reported = sample.reportedSlotsBehind();
            if (reported != null && reported > threshold && reported > value) {
                value = reported;
            }
            health.put(entry.getKey(), value);
        }
        return health;
    }

    private MemberSample sample(String server) throws InterruptedException {
        SolanaRpcClient client = clientPool.probe(server);
        long slot;
        try {
            slot = client.getSlot();
        } catch (RpcException ex) {
            logger.warn("Server {} unreachable: {}", server, ex.getMessage());
            return MemberSample.unreachable();
        }
        Long reported = null;
        try {
            NodeHealthStatus status = client.getHealth();
            reported = status.healthy() ? null : status.slotsBehind();
        } catch (RpcException ex) {
            logger.debug("Server {} did not answer getHealth: {}", server, ex.getMessage());
        }
        return new MemberSample(slot, reported);
    }

    private MemberSample await(String server, Future<MemberSample> future, long deadline) throws InterruptedException {
        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            logger.warn("Server {} did not answer within the probe timeout", server);
            return MemberSample.unreachable();
        } catch (ExecutionException ex) {
            logger.warn("Server {} probe failed: {}", server, String.valueOf(ex.getCause()));
            return MemberSample.unreachable();
        }
    }

    /**
     * One member's answer. {@code slot} is -1 when the member could not be reached.
     */
    record MemberSample(long slot, Long reportedSlotsBehind) {

        static MemberSample unreachable() {
            return new MemberSample(-1, null);
        }

        boolean reachable() {
            return slot >= 0;
        }
    }
}
