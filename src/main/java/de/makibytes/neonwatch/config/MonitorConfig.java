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
package de.makibytes.neonwatch.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Shared infrastructure for the polling loop. Probe tasks and the sub-fetches they fan out
 * run on one cached pool, so a probe waiting on its own sub-fetches can never starve them.
 */
@Configuration
public class MonitorConfig {

    public static final String MONITOR_EXECUTOR = "monitorExecutor";

    @Bean(name = MONITOR_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService monitorExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("probe-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
