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

import java.util.HashSet;
import java.util.Set;

/**
 * Snapshot of a stored checkpoint. A signature found in both sets counts as failed.
 */
public record Checkpoint(Set<String> processed, Set<String> failed, String lastSignature) {

    public Checkpoint {
        Set<String> failedCopy = failed == null ? Set.of() : Set.copyOf(failed);
        Set<String> processedCopy = new HashSet<>(processed == null ? Set.of() : processed);
        processedCopy.removeAll(failedCopy);
        processed = Set.copyOf(processedCopy);
        failed = failedCopy;
    }

    public static Checkpoint empty() {
        return new Checkpoint(Set.of(), Set.of(), null);
    }

    public boolean isEmpty() {
        return processed.isEmpty() && failed.isEmpty() && lastSignature == null;
    }

    public long totalCount() {
        return (long) processed.size() + failed.size();
    }

    public long failedCount() {
        return failed.size();
    }
}
