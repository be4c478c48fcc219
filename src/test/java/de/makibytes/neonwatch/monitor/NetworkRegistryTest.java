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

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.neonwatch.config.NeonWatchProperties;
import de.makibytes.neonwatch.config.TestProperties;
import de.makibytes.neonwatch.monitor.NetworkRegistry.LagPairing;
import de.makibytes.neonwatch.monitor.NetworkRegistry.NetworkDefinition;

@DisplayName("NetworkRegistry Tests")
class NetworkRegistryTest {

    @Test
    @DisplayName("duplicate names get unique keys")
    void uniqueKeys() {
        NeonWatchProperties properties = new NeonWatchProperties();
        properties.setNetworks(List.of(
                TestProperties.network("Devnet RPC", "devnet", "P", "http://a"),
                TestProperties.network("Devnet RPC", "devnet", "P", "http://b")));

        NetworkRegistry registry = new NetworkRegistry(properties);

        assertEquals("devnet-rpc", registry.getNetworks().get(0).key());
        assertEquals("devnet-rpc-2", registry.getNetworks().get(1).key());
        assertEquals("http://b", registry.getNetwork("devnet-rpc-2").url());
    }

    @Test
    @DisplayName("missing required fields fail fast")
    void missingFieldsFail() {
        NeonWatchProperties properties = new NeonWatchProperties();
        properties.setNetworks(List.of(TestProperties.network("x", "devnet", "P", " ")));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new NetworkRegistry(properties));
        assertTrue(ex.getMessage().contains("monitor.networks[1].url"));

        NeonWatchProperties walletless = new NeonWatchProperties();
        walletless.setWallets(List.of(TestProperties.wallet("w", null, "devnet")));
        assertThrows(IllegalStateException.class, () -> new NetworkRegistry(walletless));
    }

    @Test
    @DisplayName("signature page sizes beyond what a node serves are rejected at startup")
    void oversizedSignaturePagesFail() {
        NeonWatchProperties properties = new NeonWatchProperties();
        properties.getReconciler().setPageSize(1500);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new NetworkRegistry(properties));
        assertTrue(ex.getMessage().contains("monitor.reconciler.page-size"));

        NeonWatchProperties backfill = new NeonWatchProperties();
        backfill.getReconciler().setInitialBackfillLimit(0);
        assertThrows(IllegalStateException.class, () -> new NetworkRegistry(backfill));
    }

    @Test
    @DisplayName("names default from chain and index, blank program ids mean no reconciliation")
    void defaults() {
        NeonWatchProperties properties = new NeonWatchProperties();
        properties.setNetworks(List.of(TestProperties.network(null, "devnet", "", "http://a")));
        properties.setWallets(List.of(TestProperties.wallet(null, "Addr1", "devnet")));

        NetworkRegistry registry = new NetworkRegistry(properties);

        NetworkDefinition network = registry.getNetworks().get(0);
        assertEquals("devnet-1", network.name());
        assertFalse(network.hasProgram());
        assertEquals("Addr1", registry.getWallets().get(0).name());
    }

    @Test
    @DisplayName("every proxy pairs with every network of its chain")
    void lagPairings() {
        NeonWatchProperties properties = new NeonWatchProperties();
        properties.setNetworks(List.of(
                TestProperties.network("dev-a", "devnet", null, "http://a"),
                TestProperties.network("dev-b", "devnet", null, "http://b"),
                TestProperties.network("main", "mainnet", null, "http://m")));
        properties.setProxies(List.of(
                TestProperties.proxy("dev-proxy", "devnet", "http://p"),
                TestProperties.proxy("main-proxy", "mainnet", "http://q")));

        List<LagPairing> pairings = new NetworkRegistry(properties).getLagPairings();

        assertEquals(3, pairings.size());
        assertTrue(pairings.stream().allMatch(p -> p.proxy().chain().equals(p.network().chain())));
    }

    @Test
    @DisplayName("server groups drop blank and duplicate members")
    void serverGroupMembers() {
        NeonWatchProperties properties = new NeonWatchProperties();
        properties.setServerGroups(List.of(TestProperties.serverGroup("g", "http://a", " ", "http://a ", "http://b")));

        NetworkRegistry registry = new NetworkRegistry(properties);

        assertEquals(List.of("http://a", "http://b"), registry.getServerGroups().get(0).servers());
        assertTrue(registry.findNetworkForChain("devnet").isEmpty());
    }
}
