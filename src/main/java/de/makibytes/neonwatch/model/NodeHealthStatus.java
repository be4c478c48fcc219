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
package de.makibytes.neonwatch.model;

/**
 * What a node says about itself through getHealth. {@code slotsBehind} is only
 * present when the node reported it.
 */
public record NodeHealthStatus(boolean healthy, Long slotsBehind) {

    public static NodeHealthStatus ok() {
        return new NodeHealthStatus(true, null);
    }

    public static NodeHealthStatus behind(Long slotsBehind) {
        return new NodeHealthStatus(false, slotsBehind);
    }
}
