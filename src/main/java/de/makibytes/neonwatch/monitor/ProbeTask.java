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

import java.util.Objects;

/**
 * One independent unit of work inside a round: a network, a pairing, a group or a wallet.
 * Bodies handle their expected failures themselves; whatever escapes is an unrecoverable fault.
 */
public record ProbeTask(String name, Body body) {

    public ProbeTask {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
    }

    @FunctionalInterface
    public interface Body {
        void run() throws Exception;
    }
}
