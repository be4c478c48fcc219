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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON-RPC 2.0 over HTTP POST for a single endpoint.
 * HTTP 429/5xx, timeouts and connection errors are retried; JSON-RPC error objects are not.
 * A JSON-RPC error that arrived with a 5xx is reported once the retries are used up.
 */
public class JsonRpcTransport {

    private static final String JSONRPC_VERSION = "2.0";
    private static final Logger logger = LoggerFactory.getLogger(JsonRpcTransport.class);
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int RPC_RATE_LIMIT_CODE = -32090;
    private static final int RPC_NODE_UNHEALTHY_CODE = -32005;

    private final EndpointSettings settings;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final RetryPolicy retryPolicy;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcTransport(EndpointSettings settings, HttpClient httpClient, ObjectMapper mapper) {
        this(settings, httpClient, mapper, new RetryPolicy(settings.retryBackoffMs(), 0.2, settings.maxRetries()));
    }

    public JsonRpcTransport(EndpointSettings settings, HttpClient httpClient, ObjectMapper mapper, RetryPolicy retryPolicy) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.retryPolicy = retryPolicy;
    }

    public String getUrl() {
        return settings.url();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Sends {@code method} and returns its {@code result} node, which may be a JSON null.
     */
    public JsonNode call(String method, JsonNode params) throws RpcException, InterruptedException {
        JsonNode response = sendWithRetry(method, params);
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            int code = error.path("code").asInt();
            String message = error.path("message").asText("");
            if (code == RPC_RATE_LIMIT_CODE || message.toLowerCase().contains("rate limit")) {
                throw new RateLimitedException(settings.url(), message);
            }
            throw new RpcResponseException(method, code, message, error.get("data"));
        }
        if (!response.has("result")) {
            throw new MalformedResponseException(method + " response from " + settings.url() + " has neither result nor error");
        }
        return response.get("result");
    }

    private JsonNode sendWithRetry(String method, JsonNode params) throws RpcException, InterruptedException {
        int attempts = retryPolicy.getMaxRetries();
        for (int attempt = 0; ; attempt++) {
            try {
                return sendOnce(method, params);
            } catch (HttpStatusException statusEx) {
                boolean retryable = shouldRetryStatus(statusEx.getStatusCode());
                if (!retryable || attempt >= attempts) {
                    if (statusEx.getStatusCode() == HTTP_TOO_MANY_REQUESTS) {
                        throw new RateLimitedException(settings.url(), "HTTP 429 after " + (attempt + 1) + " attempts");
                    }
                    if (statusEx.getRpcErrorBody() != null) {
                        return statusEx.getRpcErrorBody();
                    }
                    throw statusEx;
                }
                logger.debug("{} on {} returned {}, retrying", method, settings.url(), statusEx.getStatusCode());
            } catch (JsonProcessingException parseEx) {
                throw new MalformedResponseException(method + " returned invalid JSON from " + settings.url(), parseEx);
            } catch (IOException ioEx) {
                if (attempt >= attempts) {
                    throw new RpcException(describe(ioEx) + " calling " + method + " on " + settings.url(), ioEx);
                }
                logger.debug("{} on {} failed ({}), retrying", method, settings.url(), describe(ioEx));
            }
            retryPolicy.sleep(attempt);
        }
    }

    private JsonNode sendOnce(String method, JsonNode params) throws IOException, InterruptedException {
        JsonNode body = mapper.createObjectNode()
                .put("jsonrpc", JSONRPC_VERSION)
                .put("id", requestIds.incrementAndGet())
                .put("method", method)
                .set("params", params == null ? mapper.createArrayNode() : params);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(settings.url()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        if (settings.readTimeoutMs() > 0) {
            builder.timeout(Duration.ofMillis(settings.readTimeoutMs()));
        }
        settings.headers().forEach(builder::header);
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            JsonNode errorBody = response.statusCode() == HTTP_TOO_MANY_REQUESTS ? null : tryParseRpcError(response.body());
            // getHealth answers "node behind" with a 503 and a regular JSON-RPC error body
            if (errorBody != null && errorBody.path("error").path("code").asInt() == RPC_NODE_UNHEALTHY_CODE) {
                return errorBody;
            }
            throw new HttpStatusException(response.statusCode(), settings.url(), errorBody);
        }
        return mapper.readTree(response.body());
    }

    private JsonNode tryParseRpcError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode parsed = mapper.readTree(body);
            return parsed != null && parsed.hasNonNull("error") && parsed.path("error").has("code") ? parsed : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private boolean shouldRetryStatus(int statusCode) {
        return statusCode == HTTP_TOO_MANY_REQUESTS || statusCode >= 500;
    }

    private static String describe(IOException error) {
        if (error instanceof HttpTimeoutException) {
            return "HTTP timeout";
        }
        if (error instanceof java.net.ConnectException) {
            return "Connect error";
        }
        return error.getClass().getSimpleName() + (error.getMessage() == null ? "" : ": " + error.getMessage());
    }
}
