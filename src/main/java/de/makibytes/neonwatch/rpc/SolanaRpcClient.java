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

import java.util.List;

import de.makibytes.neonwatch.model.NodeHealthStatus;
import de.makibytes.neonwatch.model.SignatureInfo;
import de.makibytes.neonwatch.model.TransactionOutcome;

/**
 * Read-only calls against one Solana JSON-RPC endpoint.
 */
public interface SolanaRpcClient {

    /** Largest page getSignaturesForAddress serves; bigger limits are capped by the node. */
    int MAX_SIGNATURES_PER_REQUEST = 1000;

    String getUrl();

    /**
     * Signatures touching {@code address}, newest first, as getSignaturesForAddress returns them.
     *
     * @param before only signatures older than this one, or {@code null} to start at the tip
     * @param until  stop before reaching this signature, or {@code null} for no lower bound
     * @param limit  page size (1..{@value #MAX_SIGNATURES_PER_REQUEST})
     */
    List<SignatureInfo> getSignatures(String address, String before, String until, int limit)
            throws RpcException, InterruptedException;

    TransactionOutcome getTransactionOutcome(String signature) throws RpcException, InterruptedException;

    long getSlot() throws RpcException, InterruptedException;

    /**
     * Balance in lamports.
     */
    long getBalance(String address) throws RpcException, InterruptedException;

    NodeHealthStatus getHealth() throws RpcException, InterruptedException;
}
