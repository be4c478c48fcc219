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

import de.makibytes.neonwatch.model.TransactionOutcome;

/**
 * The two disjoint signature sets of a checkpoint.
 */
public enum SignatureGroup {
    PROCESSED("processed"),
    FAILED("failed");

    private final String keySuffix;

    SignatureGroup(String keySuffix) {
        this.keySuffix = keySuffix;
    }

    public String getKeySuffix() {
        return keySuffix;
    }

    public static SignatureGroup of(TransactionOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> PROCESSED;
            case FAILURE -> FAILED;
            case NOT_FOUND -> throw new IllegalArgumentException("Unclassified outcome has no signature group");
        };
    }
}
