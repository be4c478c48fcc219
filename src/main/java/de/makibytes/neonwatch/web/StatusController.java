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
package de.makibytes.neonwatch.web;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import de.makibytes.neonwatch.metrics.MonitorMetrics;
import de.makibytes.neonwatch.model.RoundReport;
import de.makibytes.neonwatch.monitor.MonitorScheduler;
import de.makibytes.neonwatch.monitor.NetworkRegistry;
import de.makibytes.neonwatch.monitor.NetworkRegistry.NetworkDefinition;
import de.makibytes.neonwatch.monitor.ReconcilerState;
import de.makibytes.neonwatch.monitor.TransactionReconciler;

@RestController
public class StatusController {

    private final MonitorScheduler scheduler;
    private final MonitorMetrics metrics;
    private final NetworkRegistry networkRegistry;
    private final TransactionReconciler reconciler;

    public StatusController(MonitorScheduler scheduler,
                            MonitorMetrics metrics,
                            NetworkRegistry networkRegistry,
                            TransactionReconciler reconciler) {
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.networkRegistry = networkRegistry;
        this.reconciler = reconciler;
    }

    @GetMapping("/api/status")
    public ResponseEntity<StatusView> status() {
        long heartbeat = metrics.getLastSuccessfulUpdate();
        List<ReconcilerView> reconcilers = new ArrayList<>();
        for (NetworkDefinition network : networkRegistry.getNetworks()) {
            ReconcilerState state = reconciler.getState(network.key());
            if (state != null) {
                reconcilers.add(new ReconcilerView(
                        network.name(),
                        state.getKey().toString(),
                        state.getCounters().total(),
                        state.getCounters().failed(),
                        state.getCursor(),
                        state.pendingWriteCount()));
            }
        }
        return ResponseEntity.ok(new StatusView(
                heartbeat > 0 ? Instant.ofEpochSecond(heartbeat) : null,
                scheduler.getLastRound(),
                reconcilers));
    }

    public record StatusView(Instant heartbeat, RoundReport lastRound, List<ReconcilerView> reconcilers) {
    }

    public record ReconcilerView(String network,
                                 String checkpoint,
                                 long total,
                                 long failed,
                                 String cursor,
                                 int pendingWrites) {
    }
}
