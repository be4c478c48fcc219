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
import java.util.List;
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
import de.makibytes.neonwatch.config.NeonWatchProperties.LagDirection;
import de.makibytes.neonwatch.metrics.MonitorMetrics;
import de.makibytes.neonwatch.monitor.NetworkRegistry.LagPairing;
import de.makibytes.neonwatch.rpc.RateLimitedException;
import de.makibytes.neonwatch.rpc.RpcClientPool;
import de.makibytes.neonwatch.rpc.RpcException;

/**
 * Compares each proxy's block height with the slot of every RPC endpoint on the same chain.
 */
@Service
public class BlockLagMonitor implements RoundSource {

    private static final Logger logger = LoggerFactory.getLogger(BlockLagMonitor.class);

    private final NetworkRegistry networkRegistry;
    private final RpcClientPool clientPool;
    private final MonitorMetrics metrics;
    private final NeonWatchProperties properties;
    private final ExecutorService executor;

    public BlockLagMonitor(NetworkRegistry networkRegistry,
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
        for (LagPairing pairing : networkRegistry.getLagPairings()) {
            tasks.add(new ProbeTask("block-lag:" + pairing.proxy().key() + ":" + pairing.network().key(),
                    () -> measure(pairing)));
        }
        return tasks;
    }

    public void measure(LagPairing pairing) throws InterruptedException {
        String proxyUrl = pairing.proxy().url();
        String rpcUrl = pairing.network().url();
        if (clientPool.isBackingOff(proxyUrl) || clientPool.isBackingOff(rpcUrl)) {
            logger.debug("Skipping block lag {} / {}: endpoint backing off", pairing.proxy().name(), pairing.network().name());
            return;
        }
        Future<Long> proxyHeight = executor.submit(() -> clientPool.proxy(proxyUrl).getBlockNumber());
        Future<Long> rpcHeight = executor.submit(() -> clientPool.solana(rpcUrl).getSlot());
        try {
            long timeoutMs = heightTimeoutMs();
            long proxy = proxyHeight.get(timeoutMs, TimeUnit.MILLISECONDS);
            long rpc = rpcHeight.get(timeoutMs, TimeUnit.MILLISECONDS);
            long lag = lag(properties.getBlockLag().getDirection(), proxy, rpc);
            metrics.setBlockLag(pairing.proxy().name(), pairing.network().name(), pairing.network().chain(), lag);
            logger.debug("Block lag {} / {}: proxy {} rpc {} lag {}",
                    pairing.proxy().name(), pairing.network().name(), proxy, rpc, lag);
        } catch (TimeoutException ex) {
            logger.warn("Block lag {} / {} timed out, keeping previous sample", pairing.proxy().name(), pairing.network().name());
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RateLimitedException rateLimited) {
                clientPool.markRateLimited(rateLimited.getUrl());
            } else if (!(cause instanceof RpcException)) {
                throw new IllegalStateException("Block lag fetch failed unexpectedly", cause);
            }
            logger.warn("Block lag {} / {} failed, keeping previous sample: {}",
                    pairing.proxy().name(), pairing.network().name(), cause.getMessage());
        } finally {
            proxyHeight.cancel(true);
            rpcHeight.cancel(true);
        }
    }

    static long lag(LagDirection direction, long proxyHeight, long rpcHeight) {
        return direction == LagDirection.RPC_MINUS_PROXY ? rpcHeight - proxyHeight : proxyHeight - rpcHeight;
    }

    private long heightTimeoutMs() {
        NeonWatchProperties.Defaults defaults = properties.getDefaults();
        long perAttempt = defaults.getConnectTimeoutMs() + defaults.getReadTimeoutMs();
        return Math.max(1, perAttempt * (Math.max(0, defaults.getMaxRetries()) + 1));
    }
}
