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

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Every series the monitor exposes. Probes receive this object instead of touching
 * meters directly; gauges are registered on first write so a series that never had a
 * value stays absent rather than reporting zero.
 */
@Component
public class MonitorMetrics {

    public static final String TRANSACTION_COUNT = "neon.transaction.count";
    public static final String TRANSACTION_FAIL_COUNT = "neon.transaction.fail.count";
    public static final String TRANSACTION_SUCCESS_RATIO = "neon.transaction.success.ratio";
    public static final String PROXY_BLOCK_LAG = "neon.proxy.block.lag";
    public static final String NODE_HEALTH = "solana.health";
    public static final String WALLET_BALANCE = "wallet.balance";
    public static final String LAST_SUCCESSFUL_UPDATE = "neonwatch.last.successful.update";

    private final MeterRegistry registry;
    private final Map<Tags, TransactionCounters> transactionCounters = new ConcurrentHashMap<>();
    private final Map<Tags, GaugeValue> blockLag = new ConcurrentHashMap<>();
    private final Map<Tags, GaugeValue> nodeHealth = new ConcurrentHashMap<>();
    private final Map<Tags, GaugeValue> walletBalance = new ConcurrentHashMap<>();
    private final AtomicLong lastSuccessfulUpdate = new AtomicLong();

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(LAST_SUCCESSFUL_UPDATE, lastSuccessfulUpdate, AtomicLong::doubleValue)
                .description("Epoch seconds of the last polling round that completed")
                .strongReference(true)
                .register(registry);
    }

    public TransactionCounters transactionCounters(String chain, String programId, String rpcUrl) {
        Tags tags = Tags.of("chain", chain, "program_id", programId, "rpc_url", rpcUrl);
        return transactionCounters.computeIfAbsent(tags, key -> new TransactionCounters(registry, key));
    }

    public void setBlockLag(String proxyName, String rpcName, String chain, long lag) {
        Tags tags = Tags.of("proxy_name", proxyName, "rpc_name", rpcName, "chain", chain);
        gauge(blockLag, PROXY_BLOCK_LAG, "Proxy block height minus backing RPC slot", tags, lag);
    }

    public OptionalDouble getBlockLag(String proxyName, String rpcName, String chain) {
        return read(blockLag, Tags.of("proxy_name", proxyName, "rpc_name", rpcName, "chain", chain));
    }

    public void setNodeHealth(String address, String serverGroup, long health) {
        Tags tags = Tags.of("address", address, "server_group", serverGroup);
        gauge(nodeHealth, NODE_HEALTH, "0 unreachable, 1 healthy, >1 slots behind the group", tags, health);
    }

    public OptionalDouble getNodeHealth(String address, String serverGroup) {
        return read(nodeHealth, Tags.of("address", address, "server_group", serverGroup));
    }

    public void setWalletBalance(String address, String name, double balance) {
        Tags tags = Tags.of("address", address, "name", name);
        gauge(walletBalance, WALLET_BALANCE, "Wallet balance in the chain's native unit", tags, balance);
    }

    public OptionalDouble getWalletBalance(String address, String name) {
        return read(walletBalance, Tags.of("address", address, "name", name));
    }

    public void markSuccessfulUpdate(Instant at) {
        lastSuccessfulUpdate.set(at.getEpochSecond());
    }

    public long getLastSuccessfulUpdate() {
        return lastSuccessfulUpdate.get();
    }

    private void gauge(Map<Tags, GaugeValue> values, String name, String description, Tags tags, double newValue) {
        values.computeIfAbsent(tags, key -> {
            GaugeValue value = new GaugeValue(newValue);
            Gauge.builder(name, value, GaugeValue::get)
                    .description(description)
                    .tags(key)
                    .strongReference(true)
                    .register(registry);
            return value;
        }).set(newValue);
    }

    private static OptionalDouble read(Map<Tags, GaugeValue> values, Tags tags) {
        GaugeValue value = values.get(tags);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value.get());
    }

    private static final class GaugeValue {
        private volatile double value;

        GaugeValue(double initial) {
            this.value = initial;
        }

        void set(double newValue) {
            this.value = newValue;
        }

        double get() {
            return value;
        }
    }
}
