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
package de.makibytes.neonwatch.store;

/**
 * Redis key layout for checkpoints. This is the on-disk format used for crash recovery:
 * changing it requires a new {@link #SCHEMA_VERSION}.
 *
 * <pre>
 * neonwatch:v1:{chain}:{programId}:processed   SET of successful signatures
 * neonwatch:v1:{chain}:{programId}:failed      SET of failed signatures
 * neonwatch:v1:{chain}:{programId}:last        STRING, newest classified signature
 * </pre>
 */
public final class CheckpointKeys {

    public static final String NAMESPACE = "neonwatch";
    public static final String SCHEMA_VERSION = "v1";
    static final String CURSOR_SUFFIX = "last";

    private CheckpointKeys() {}

    public static String group(CheckpointKey key, SignatureGroup group) {
        return prefix(key) + group.getKeySuffix();
    }

    public static String cursor(CheckpointKey key) {
        return prefix(key) + CURSOR_SUFFIX;
    }

    private static String prefix(CheckpointKey key) {
        return NAMESPACE + ":" + SCHEMA_VERSION + ":" + key.chain() + ":" + key.programId() + ":";
    }
}
