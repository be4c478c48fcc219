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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import de.makibytes.neonwatch.config.NeonWatchProperties;
import de.makibytes.neonwatch.rpc.SolanaRpcClient;

/**
 * Immutable view of everything the monitor polls, built once from configuration.
 * Missing required fields fail fast with {@link IllegalStateException}.
 */
@Component
public class NetworkRegistry {

    private final List<NetworkDefinition> networks;
    private final List<ProxyDefinition> proxies;
    private final List<WalletDefinition> wallets;
    private final List<ServerGroupDefinition> serverGroups;
    private final List<LagPairing> lagPairings;
    private final Map<String, NetworkDefinition> networksByKey;

    public NetworkRegistry(NeonWatchProperties properties) {
        requireSignaturePage(properties.getReconciler().getPageSize(), "reconciler.page-size");
        requireSignaturePage(properties.getReconciler().getInitialBackfillLimit(), "reconciler.initial-backfill-limit");

        Set<String> usedKeys = new HashSet<>();
        List<NetworkDefinition> networkTemp = new ArrayList<>();
        Map<String, NetworkDefinition> byKey = new HashMap<>();
        int index = 1;
        for (NeonWatchProperties.NetworkProperties network : properties.getNetworks()) {
            String chain = require(network.getChain(), "networks[" + index + "].chain");
            String url = require(network.getUrl(), "networks[" + index + "].url");
            String name = isBlank(network.getName()) ? chain + "-" + index : network.getName().trim();
            String programId = isBlank(network.getProgramId()) ? null : network.getProgramId().trim();
            NetworkDefinition definition = new NetworkDefinition(uniqueKey(name, usedKeys), name, chain.trim(), programId, url.trim());
            networkTemp.add(definition);
            byKey.put(definition.key(), definition);
            index++;
        }

        List<ProxyDefinition> proxyTemp = new ArrayList<>();
        index = 1;
        for (NeonWatchProperties.ProxyProperties proxy : properties.getProxies()) {
            String chain = require(proxy.getChain(), "proxies[" + index + "].chain");
            String url = require(proxy.getUrl(), "proxies[" + index + "].url");
            String name = isBlank(proxy.getName()) ? "proxy-" + index : proxy.getName().trim();
            proxyTemp.add(new ProxyDefinition(uniqueKey(name, usedKeys), name, chain.trim(), url.trim()));
            index++;
        }

        List<WalletDefinition> walletTemp = new ArrayList<>();
        index = 1;
        for (NeonWatchProperties.WalletProperties wallet : properties.getWallets()) {
            String address = require(wallet.getAddress(), "wallets[" + index + "].address");
            String chain = require(wallet.getChain(), "wallets[" + index + "].chain");
            String name = isBlank(wallet.getName()) ? address : wallet.getName().trim();
            walletTemp.add(new WalletDefinition(name, address.trim(), chain.trim()));
            index++;
        }

        List<ServerGroupDefinition> groupTemp = new ArrayList<>();
        index = 1;
        for (NeonWatchProperties.ServerGroupProperties group : properties.getServerGroups()) {
            String name = require(group.getName(), "server-groups[" + index + "].name");
            List<String> servers = group.getServers() == null ? List.of() : group.getServers().stream()
                    .filter(server -> !isBlank(server))
                    .map(String::trim)
                    .distinct()
                    .toList();
            groupTemp.add(new ServerGroupDefinition(name.trim(), servers));
            index++;
        }

        List<LagPairing> pairings = new ArrayList<>();
        for (ProxyDefinition proxy : proxyTemp) {
            for (NetworkDefinition network : networkTemp) {
                if (proxy.chain().equals(network.chain())) {
                    pairings.add(new LagPairing(proxy, network));
                }
            }
        }

        this.networks = List.copyOf(networkTemp);
        this.networksByKey = Map.copyOf(byKey);
        this.proxies = List.copyOf(proxyTemp);
        this.wallets = List.copyOf(walletTemp);
        this.serverGroups = List.copyOf(groupTemp);
        this.lagPairings = List.copyOf(pairings);
    }

    public List<NetworkDefinition> getNetworks() {
        return networks;
    }

    public NetworkDefinition getNetwork(String key) {
        return networksByKey.get(key);
    }

    public List<ProxyDefinition> getProxies() {
        return proxies;
    }

    public List<WalletDefinition> getWallets() {
        return wallets;
    }

    public List<ServerGroupDefinition> getServerGroups() {
        return serverGroups;
    }

    public List<LagPairing> getLagPairings() {
        return lagPairings;
    }

    /**
     * First configured network serving the given chain; wallets are read through it.
     */
    public Optional<NetworkDefinition> findNetworkForChain(String chain) {
        return networks.stream().filter(network -> network.chain().equals(chain)).findFirst();
    }

    private static String uniqueKey(String name, Set<String> usedKeys) {
        String baseKey = name.trim().toLowerCase().replaceAll("[^a-z0-9]+", "-");
        String key = baseKey;
        int suffix = 2;
        while (usedKeys.contains(key)) {
            key = baseKey + "-" + suffix++;
        }
        usedKeys.add(key);
        return key;
    }

    private static String require(String value, String field) {
        if (isBlank(value)) {
            throw new IllegalStateException("Missing required configuration value monitor." + field);
        }
        return value;
    }

    private static void requireSignaturePage(int value, String field) {
        if (value < 1 || value > SolanaRpcClient.MAX_SIGNATURES_PER_REQUEST) {
            throw new IllegalStateException("monitor." + field + " must be between 1 and "
                    + SolanaRpcClient.MAX_SIGNATURES_PER_REQUEST + ", got " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record NetworkDefinition(String key,
                                    String name,
                                    String chain,
                                    String programId,
                                    String url) {

        public boolean hasProgram() {
            return programId != null;
        }
    }

    public record ProxyDefinition(String key, String name, String chain, String url) {
    }

    public record WalletDefinition(String name, String address, String chain) {
    }

    public record ServerGroupDefinition(String name, List<String> servers) {
    }

    public record LagPairing(ProxyDefinition proxy, NetworkDefinition network) {
    }
}
