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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.neonwatch.config.NeonWatchProperties;
import de.makibytes.neonwatch.metrics.MonitorMetrics;
import de.makibytes.neonwatch.monitor.NetworkRegistry.NetworkDefinition;
import de.makibytes.neonwatch.monitor.NetworkRegistry.WalletDefinition;
import de.makibytes.neonwatch.rpc.RateLimitedException;
import de.makibytes.neonwatch.rpc.RpcClientPool;
import de.makibytes.neonwatch.rpc.RpcException;
import de.makibytes.neonwatch.rpc.SolanaRpcClient;

@Service
public class WalletBalanceMonitor implements RoundSource {

    private static final Logger logger = LoggerFactory.getLogger(WalletBalanceMonitor.class);

    private final NetworkRegistry networkRegistry;
    private final RpcClientPool clientPool;
    private final MonitorMetrics metrics;
    private final NeonWatchProperties properties;

    public WalletBalanceMonitor(NetworkRegistry networkRegistry,
                                RpcClientPool clientPool,
                                MonitorMetrics metrics,
                                NeonWatchProperties properties) {
        this.networkRegistry = networkRegistry;
        this.clientPool = clientPool;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public List<ProbeTask> roundTasks() {
        List<ProbeTask> tasks = new ArrayList<>();
        for (WalletDefinition wallet : networkRegistry.getWallets()) {
            tasks.add(new ProbeTask("wallet:" + wallet.name(), () -> refresh(wallet)));
        }
        return tasks;
    }

    public void refresh(WalletDefinition wallet) throws InterruptedException {
        Optional<NetworkDefinition> network = networkRegistry.findNetworkForChain(wallet.chain());
        if (network.isEmpty()) {
            logger.warn("No network configured for chain {} of wallet {}", wallet.chain(), wallet.name());
            return;
        }
        SolanaRpcClient client = clientPool.solana(network.get().url());
        if (clientPool.isBackingOff(client.getUrl())) {
            return;
        }
        try {
            long lamports = client.getBalance(wallet.address());
            double balance = toNative(lamports, properties.getWalletSettings().getNativeDecimals());
            metrics.setWalletBalance(wallet.address(), wallet.name(), balance);
        } catch (RateLimitedException ex) {
            clientPool.markRateLimited(ex.getUrl());
        } catch (RpcException ex) {
            logger.warn("Balance of wallet {} unavailable, keeping previous value: {}", wallet.name(), ex.getMessage());
        }
    }

    static double toNative(long baseUnits, int decimals) {
        return BigDecimal.valueOf(baseUnits).movePointLeft(Math.max(0, decimals)).doubleValue();
    }
}
