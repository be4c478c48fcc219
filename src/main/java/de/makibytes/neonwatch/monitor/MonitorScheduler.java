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

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import de.makibytes.neonwatch.config.NeonWatchProperties;
import de.makibytes.neonwatch.metrics.MonitorMetrics;
import de.makibytes.neonwatch.model.RoundReport;
import de.makibytes.neonwatch.model.TaskStatus;

/**
 * Drives the polling loop. Every tick runs one round of all probes and moves the heartbeat
 * forward unless a probe failed with an unexpected error.
 */
@Component
public class MonitorScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MonitorScheduler.class);

    private final List<RoundSource> sources;
    private final RoundRunner roundRunner;
    private final MonitorMetrics metrics;
    private final NeonWatchProperties properties;
    private final Clock clock;
    private final AtomicReference<RoundReport> lastRound = new AtomicReference<>();

    public MonitorScheduler(List<RoundSource> sources,
                            RoundRunner roundRunner,
                            MonitorMetrics metrics,
                            NeonWatchProperties properties,
                            Clock clock) {
        this.sources = List.copyOf(sources);
        this.roundRunner = roundRunner;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${monitor.poll-interval-ms:5000}", initialDelayString = "${monitor.initial-delay-ms:1000}")
    public void tick() {
        try {
            runRound();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Polling round interrupted");
        }
    }

    public RoundReport runRound() throws InterruptedException {
        List<ProbeTask> tasks = new ArrayList<>();
        for (RoundSource source : sources) {
            tasks.addAll(source.roundTasks());
        }
        Duration deadline = Duration.ofMillis(Math.max(1, properties.getPollIntervalMs()));
        RoundReport report = roundRunner.run(tasks, deadline);
        lastRound.set(report);

        if (report.hasFailures()) {
            logger.warn("Round finished with {} failed probes, heartbeat not updated", report.count(TaskStatus.FAILED));
        } else {
            metrics.markSuccessfulUpdate(clock.instant());
        }
        logger.debug("Round finished: {} probes, {} timed out in {} ms",
                tasks.size(),
                report.count(TaskStatus.TIMED_OUT),
                Duration.between(report.startedAt(), report.finishedAt()).toMillis());
        return report;
    }

    public RoundReport getLastRound() {
        return lastRound.get();
    }
}
