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

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.neonwatch.model.TransactionOutcome;

@DisplayName("Checkpoint keys and records")
class CheckpointKeysTest {

    private static final CheckpointKey KEY = new CheckpointKey("mainnet", "NeonVMyRX5GbCrsAHnUwx1nYYoJAtskU1bWUo6JGNyG");

    @Test
    @DisplayName("keys follow namespace:version:chain:program:suffix")
    void keyLayout() {
        assertEquals("neonwatch:v1:mainnet:NeonVMyRX5GbCrsAHnUwx1nYYoJAtskU1bWUo6JGNyG:processed",
                CheckpointKeys.group(KEY, SignatureGroup.PROCESSED));
        assertEquals("neonwatch:v1:mainnet:NeonVMyRX5GbCrsAHnUwx1nYYoJAtskU1bWUo6JGNyG:failed",
                CheckpointKeys.group(KEY, SignatureGroup.FAILED));
        assertEquals("neonwatch:v1:mainnet:NeonVMyRX5GbCrsAHnUwx1nYYoJAtskU1bWUo6JGNyG:last",
                CheckpointKeys.cursor(KEY));
    }

    @Test
    @DisplayName("outcomes map to signature groups")
    void groupsForOutcomes() {
        assertEquals(SignatureGroup.PROCESSED, SignatureGroup.of(TransactionOutcome.SUCCESS));
        assertEquals(SignatureGroup.FAILED, SignatureGroup.of(TransactionOutcome.FAILURE));
        assertThrows(IllegalArgumentException.class, () -> SignatureGroup.of(TransactionOutcome.NOT_FOUND));
    }

    @Test
    @DisplayName("a signature in both sets counts once, as failed")
    void failedWinsOverProcessed() {
        Checkpoint checkpoint = new Checkpoint(Set.of("a", "b"), Set.of("b"), "b");

        assertEquals(Set.of("a"), checkpoint.processed());
        assertEquals(2, checkpoint.totalCount());
        assertEquals(1, checkpoint.failedCount());
    }

    @Test
    @DisplayName("null sets are treated as empty")
    void nullSets() {
        assertTrue(new Checkpoint(null, null, null).isEmpty());
        assertTrue(Checkpoint.empty().isEmpty());
    }
}
