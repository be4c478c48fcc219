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

public class HttpStatusException extends RpcException {

    private final int statusCode;
    private final transient JsonNode rpcErrorBody;

    public HttpStatusException(int statusCode, String url) {
        this(statusCode, url, null);
    }

    public HttpStatusException(int statusCode, String url, JsonNode rpcErrorBody) {
        super("HTTP status " + statusCode + " from " + url);
        this.statusCode = statusCode;
        this.rpcErrorBody = rpcErrorBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * JSON-RPC error envelope that came with the status, or {@code null}.
     */
    public JsonNode getRpcErrorBody() {
        return rpcErrorBody;
    }
}
