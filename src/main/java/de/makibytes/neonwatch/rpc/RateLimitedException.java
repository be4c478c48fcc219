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

/**
 * The endpoint keeps refusing calls for rate reasons. Callers back off the endpoint for the
 * rest of the round instead of issuing further requests.
 */
public class RateLimitedException extends RpcException {

    private final String url;

    public RateLimitedException(String url, String message) {
        super("Rate limited by " + url + ": " + message);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
