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

import java.util.List;

/**
 * Builds {@link NeonWatchProperties} for tests without a Spring context.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static NeonWatchProperties.NetworkProperties network(String name, String chain, String programId, String url) {
        NeonWatchProperties.NetworkProperties network = new NeonWatchProperties.NetworkProperties();
        network.setName(name);
        network.setChain(chain);
        network.setProgramId(programId);
        network.setUrl(url);
        return network;
    }

    public static NeonWatchProperties.ProxyProperties proxy(String name, String chain, String url) {
        NeonWatchProperties.ProxyProperties proxy = new NeonWatchProperties.ProxyProperties();
        proxy.setName(name);
        proxy.setChain(chain);
        proxy.setUrl(url);
        return proxy;
    }

    public static NeonWatchProperties.WalletProperties wallet(String name, String address, String chain) {
        NeonWatchProperties.WalletProperties wallet = new NeonWatchProperties.WalletProperties();
        wallet.setName(name);
        wallet.setAddress(address);
        wallet.setChain(chain);
        return wallet;
    }

    public static NeonWatchProperties.ServerGroupProperties serverGroup(String name, String... servers) {
        NeonWatchProperties.ServerGroupProperties group = new NeonWatchProperties.ServerGroupProperties();
        group.setName(name);
        group.setServers(List.of(servers));
        return group;
    }
}
