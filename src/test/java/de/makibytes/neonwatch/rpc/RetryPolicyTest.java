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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

    @Test
    @DisplayName("delay doubles with every attempt")
    void exponentialWithoutJitter() {
        RetryPolicy policy = new RetryPolicy(200, 0, 3);

        assertEquals(200, policy.delayMs(0));
        assertEquals(400, policy.delayMs(1));
        assertEquals(800, policy.delayMs(2));
        assertEquals(3, policy.getMaxRetries());
    }

    @Test
    @DisplayName("the exponent is capped")
    void exponentIsCapped() {
        RetryPolicy policy = new RetryPolicy(1, 0, 1);

        assertEquals(1024, policy.delayMs(10));
        assertEquals(1024, policy.delayMs(60));
    }

    @Test
    @DisplayName("jitter stays within the configured factor")
    void jitterIsBounded() {
        RetryPolicy policy = new RetryPolicy(1000, 0.2, 1);

        for (int i = 0; i < 200; i++) {
            long delay = policy.delayMs(0);
            assertTrue(delay >= 800 && delay <= 1200, "delay out of range: " + delay);
        }
    }

    @Test
    @DisplayName("negative settings are clamped to zero")
    void negativeSettingsClamped() {
        RetryPolicy policy = new RetryPolicy(-5, -1, -2);

        assertEquals(0, policy.delayMs(3));
        assertEquals(0, policy.getMaxRetries());
    }
}
