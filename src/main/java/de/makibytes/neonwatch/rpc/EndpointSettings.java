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

import java.util.Map;

public record EndpointSettings(String url,
                               long connectTimeoutMs,
                               long readTimeoutMs,
                               int maxRetries,
                               long retryBackoffMs,
                               Map<String, String> headers) {

    public EndpointSettings {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public EndpointSettings withReadTimeout(long timeoutMs, int retries) {
        return new EndpointSettings(url, Math.min(connectTimeoutMs, timeoutMs), timeoutMs, retries, retryBackoffMs, headers);
    }
}
