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

import com.fasterxml.jackson.databind.JsonNode;

public class HttpProxyRpcClient implements ProxyRpcClient {

    private final JsonRpcTransport transport;

    public HttpProxyRpcClient(JsonRpcTransport transport) {
        this.transport = transport;
    }

    @Override
    public String getUrl() {
        return transport.getUrl();
    }

    @Override
    public long getBlockNumber() throws RpcException, InterruptedException {
        JsonNode result = transport.call("eth_blockNumber", transport.mapper().createArrayNode());
        Long blockNumber;
        try {
            blockNumber = EthHex.parseDecimalOrHexLong(result.isNull() ? null : result.asText());
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new MalformedResponseException("eth_blockNumber returned " + result, ex);
        }
        if (blockNumber == null) {
            throw new MalformedResponseException("eth_blockNumber returned no value");
        }
        return blockNumber;
    }
}
