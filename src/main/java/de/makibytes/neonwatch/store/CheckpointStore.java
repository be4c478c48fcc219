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

import de.makibytes.neonwatch.model.TransactionOutcome;

/**
 * Durable de-duplication state for the transaction reconciler.
 * All writes are idempotent; nothing is ever removed.
 */
public interface CheckpointStore {

    /**
     * Reads both signature sets and the cursor. An unknown key yields an empty checkpoint.
     */
    Checkpoint restore(CheckpointKey key) throws StoreUnavailableException;

    /**
     * Adds {@code signature} to the set matching {@code outcome} and moves the cursor to it.
     */
    void persistSignature(CheckpointKey key, String signature, TransactionOutcome outcome) throws StoreUnavailableException;

    /**
     * Moves the cursor without recording a classification.
     */
    void advanceCursor(CheckpointKey key, String signature) throws StoreUnavailableException;

    /**
     * Full read of one signature set.
     */
    Set<String> loadAllGroupMembers(CheckpointKey key, SignatureGroup group) throws StoreUnavailableException;
}
