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
package de.makibytes.neonwatch.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monitor")
public class NeonWatchProperties {

    public enum LagDirection {
        PROXY_MINUS_RPC,
        RPC_MINUS_PROXY
    }

    private long pollIntervalMs = 5000;
    private Defaults defaults = new Defaults();
    private Reconciler reconciler = new Reconciler();
    private BlockLag blockLag = new BlockLag();
    private Health health = new Health();
    private WalletSettings walletSettings = new WalletSettings();
    private List<NetworkProperties> networks = new ArrayList<>();
    private List<ProxyProperties> proxies = new ArrayList<>();
    private List<WalletProperties> wallets = new ArrayList<>();
    private List<ServerGroupProperties> serverGroups = new ArrayList<>();

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Reconciler getReconciler() {
        return reconciler;
    }

    public void setReconciler(Reconciler reconciler) {
        this.reconciler = reconciler;
    }

    public BlockLag getBlockLag() {
        return blockLag;
    }

    public void setBlockLag(BlockLag blockLag) {
        this.blockLag = blockLag;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public WalletSettings getWalletSettings() {
        return walletSettings;
    }

    public void setWalletSettings(WalletSettings walletSettings) {
        this.walletSettings = walletSettings;
    }

    public List<NetworkProperties> getNetworks() {
        return networks;
    }

    public void setNetworks(List<NetworkProperties> networks) {
        this.networks = networks;
    }

    public List<ProxyProperties> getProxies() {
        return proxies;
    }

    public void setProxies(List<ProxyProperties> proxies) {
        this.proxies = proxies;
    }

    public List<WalletProperties> getWallets() {
        return wallets;
    }

    public void setWallets(List<WalletProperties> wallets) {
        this.wallets = wallets;
    }

    public List<ServerGroupProperties> getServerGroups() {
        return serverGroups;
    }

    public void setServerGroups(List<ServerGroupProperties> serverGroups) {
        this.serverGroups = serverGroups;
    }

    public static class NetworkProperties {

        private String name;
        private String chain;
        private String programId;
        private String url;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getChain() {
            return chain;
        }

        public void setChain(String chain) {
            this.chain = chain;
        }

        public String getProgramId() {
            return programId;
        }

        public void setProgramId(String programId) {
            this.programId = programId;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }

    public static class ProxyProperties {

        private String name;
        private String chain;
        private String url;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getChain() {
            return chain;
        }

        public void setChain(String chain) {
            this.chain = chain;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }

    public static class WalletProperties {

        private String name;
        private String address;
        private String chain;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getChain() {
            return chain;
        }

        public void setChain(String chain) {
            this.chain = chain;
        }
    }

    public static class ServerGroupProperties {

        private String name;
        private List<String> servers = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getServers() {
            return servers;
        }

        public void setServers(List<String> servers) {
            this.servers = servers;
        }
    }

    public static class Defaults {
        private long connectTimeoutMs = 2000;
        private long readTimeoutMs = 4000;
        private int maxRetries = 2;
        private long retryBackoffMs = 200;
        private long rateLimitCooldownMs = 30000;
        private Map<String, String> headers = new HashMap<>();

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(long readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getRateLimitCooldownMs() {
            return rateLimitCooldownMs;
        }

        public void setRateLimitCooldownMs(long rateLimitCooldownMs) {
            this.rateLimitCooldownMs = rateLimitCooldownMs;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }
    }

    public static class Reconciler {
        /** Signatures requested per getSignaturesForAddress page while catching up to the cursor. */
        private int pageSize = 1000;
        /** Signatures fetched on the very first round for a program without any stored cursor. */
        private int initialBackfillLimit = 1000;

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getInitialBackfillLimit() {
            return initialBackfillLimit;
        }

        public void setInitialBackfillLimit(int initialBackfillLimit) {
            this.initialBackfillLimit = initialBackfillLimit;
        }
    }

    public static class BlockLag {
        private LagDirection direction = LagDirection.PROXY_MINUS_RPC;

        public LagDirection getDirection() {
            return direction;
        }

        public void setDirection(LagDirection direction) {
            this.direction = direction;
        }
    }

    public static class Health {
        private long probeTimeoutMs = 2000;
        private long slotDriftThreshold = 10;

        public long getProbeTimeoutMs() {
            return probeTimeoutMs;
        }

        public void setProbeTimeoutMs(long probeTimeoutMs) {
            this.probeTimeoutMs = probeTimeoutMs;
        }

        public long getSlotDriftThreshold() {
            return slotDriftThreshold;
        }

        public void setSlotDriftThreshold(long slotDriftThreshold) {
            this.slotDriftThreshold = slotDriftThreshold;
        }
    }

    public static class WalletSettings {
        private int nativeDecimals = 9;

        public int getNativeDecimals() {
            return nativeDecimals;
        }

        public void setNativeDecimals(int nativeDecimals) {
            this.nativeDecimals = nativeDecimals;
        }
    }
}
