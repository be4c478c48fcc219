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

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import de.makibytes.neonwatch.model.NodeHealthStatus;
import de.makibytes.neonwatch.model.SignatureInfo;
import de.makibytes.neonwatch.model.TransactionOutcome;

public class HttpSolanaRpcClient implements SolanaRpcClient {

    private static final String COMMITMENT = "confirmed";
    private static final int NODE_UNHEALTHY_CODE = -32005;

    private final JsonRpcTransport transport;

    public HttpSolanaRpcClient(JsonRpcTransport transport) {
        this.transport = transport;
    }

    @Override
    public String getUrl() {
        return transport.getUrl();
    }

    @Override
    public List<SignatureInfo> getSignatures(String address, String before, String until, int limit)
            throws RpcException, InterruptedException {
        ObjectNode config = transport.mapper().createObjectNode()
                .put("limit", Math.min(Math.max(1, limit), MAX_SIGNATURES_PER_REQUEST))
                .put("commitment", COMMITMENT);
        if (before != null) {
            config.put("before", before);
        }
        if (until != null) {
            config.put("until", until);
        }
        ArrayNode params = transport.mapper().createArrayNode().add(address).add(config);
        JsonNode result = transport.call("getSignaturesForAddress", params);
        if (!result.isArray()) {
            throw new MalformedResponseException("getSignaturesForAddress result is not an array");
        }
        List<SignatureInfo> signatures = new ArrayList<>(result.size());
        for (JsonNode entry : result) {
            String signature = entry.path("signature").asText(null);
            if (signature == null || signature.isBlank()) {
                throw new MalformedResponseException("getSignaturesForAddress entry without signature: " + entry);
            }
            signatures.add(new SignatureInfo(signature, entry.path("slot").asLong()));
        }
        return signatures;
    }

    @Override
    public TransactionOutcome getTransactionOutcome(String signature) throws RpcException, InterruptedException {
        ObjectNode config = transport.mapper().createObjectNode()
                .put("encoding", "json")
                .put("commitment", COMMITMENT)
                .put("maxSupportedTransactionVersion", 0);
        ArrayNode params = transport.mapper().createArrayNode().add(signature).add(config);
        JsonNode result = transport.call("getTransaction", params);
        if (result == null || result.isNull()) {
            return TransactionOutcome.NOT_FOUND;
        }
        JsonNode meta = result.get("meta");
        if (meta == null || !meta.isObject()) {
            throw new MalformedResponseException("getTransaction " + signature + " has no meta");
        }
        JsonNode err = meta.get("err");
        return err == null || err.isNull() ? TransactionOutcome.SUCCESS : TransactionOutcome.FAILURE;
    }

    @Override
    public long getSlot() throws RpcException, InterruptedException {
        ArrayNode params = transport.mapper().createArrayNode()
                .add(transport.mapper().createObjectNode().put("commitment", COMMITMENT));
        JsonNode result = transport.call("getSlot", params);
        if (!result.canConvertToLong()) {
            throw new MalformedResponseException("getSlot result is not a number: " + result);
        }
        return result.asLong();
    }

    @Override
    public long getBalance(String address) throws RpcException, InterruptedException {
        ArrayNode params = transport.mapper().createArrayNode()
                .add(address)
                .add(transport.mapper().createObjectNode().put("commitment", COMMITMENT));
        JsonNode value = transport.call("getBalance", params).path("value");
        if (!value.canConvertToLong()) {
            throw new MalformedResponseException("getBalance for " + address + " has no numeric value");
        }
        return value.asLong();
    }

    @Override
    public NodeHealthStatus getHealth() throws RpcException, InterruptedException {
        try {
            JsonNode result = transport.call("getHealth", null);
            if ("ok".equals(result.asText())) {
                return NodeHealthStatus.ok();
            }
            return NodeHealthStatus.behind(null);
        } catch (RpcResponseException ex) {
            if (ex.getCode() != NODE_UNHEALTHY_CODE) {
                throw ex;
            }
            JsonNode behind = ex.getData() == null ? null : ex.getData().get("numSlotsBehind");
            return NodeHealthStatus.behind(behind != null && behind.canConvertToLong() ? behind.asLong() : null);
        }
    }
}
