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
package de.makibytes.neonwatch.rpc;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.neonwatch.config.NeonWatchProperties;

/**
 * One client per endpoint URL, created lazily and reused across rounds. Also remembers
 * which endpoints asked us to slow down, so every probe on that endpoint can skip it
 * until the cool-down has passed.
 */
@Component
public class RpcClientPool {

    private static final Logger logger = LoggerFactory.getLogger(RpcClientPool.class);

    private final NeonWatchProperties properties;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final Map<Long, HttpClient> httpClients = new ConcurrentHashMap<>();
    private final Map<String, SolanaRpcClient> solanaClients = new ConcurrentHashMap<>();
    private final Map<String, SolanaRpcClient> probeClients = new ConcurrentHashMap<>();
    private final Map<String, ProxyRpcClient> proxyClients = new ConcurrentHashMap<>();
    private final Map<String, Instant> backoffUntil = new ConcurrentHashMap<>();

    @Autowired
    public RpcClientPool(NeonWatchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public RpcClientPool(NeonWatchProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public SolanaRpcClient solana(String url) {
        return solanaClients.computeIfAbsent(url, key -> createSolanaClient(settingsFor(key)));
    }

    /**
     * Client for health probes: the probe timeout replaces the read timeout and nothing is retried,
     * an unreachable member should be reported as such within one round.
     */
    public SolanaRpcClient probe(String url) {
        long timeoutMs = properties.getHealth().getProbeTimeoutMs();
        return probeClients.computeIfAbsent(url, key -> createSolanaClient(settingsFor(key).withReadTimeout(timeoutMs, 0)));
    }

    public ProxyRpcClient proxy(String url) {
        return proxyClients.computeIfAbsent(url, key -> createProxyClient(settingsFor(key)));
    }

    public void markRateLimited(String url) {
        long cooldownMs = Math.max(0, properties.getDefaults().getRateLimitCooldownMs());
        Instant until = clock.instant().plus(Duration.ofMillis(cooldownMs));
        backoffUntil.put(url, until);
        logger.warn("Endpoint {} is rate limiting, backing off until {}", url, until);
    }

    public boolean isBackingOff(String url) {
        Instant until = backoffUntil.get(url);
        if (until == null) {
            return false;
        }
        if (!clock.instant().isBefore(until)) {
            backoffUntil.remove(url, until);
            return false;
        }
        return true;
    }

    protected SolanaRpcClient createSolanaClient(EndpointSettings settings) {
        return new HttpSolanaRpcClient(transport(settings));
    }

    protected ProxyRpcClient createProxyClient(EndpointSettings settings) {
        return new HttpProxyRpcClient(transport(settings));
    }

    EndpointSettings settingsFor(String url) {
        NeonWatchProperties.Defaults defaults = properties.getDefaults();
        return new EndpointSettings(
                url,
                defaults.getConnectTimeoutMs(),
                defaults.getReadTimeoutMs(),
                defaults.getMaxRetries(),
                defaults.getRetryBackoffMs(),
                defaults.getHeaders());
    }

    private JsonRpcTransport transport(EndpointSettings settings) {
        return new JsonRpcTransport(settings, getHttpClient(settings.connectTimeoutMs()), mapper);
    }

    private HttpClient getHttpClient(long connectTimeoutMs) {
        long effectiveTimeout = connectTimeoutMs > 0 ? connectTimeoutMs : properties.getDefaults().getConnectTimeoutMs();
        return httpClients.computeIfAbsent(effectiveTimeout, timeout -> HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, timeout)))
                .build());
    }
}
