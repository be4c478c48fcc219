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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import de.makibytes.neonwatch.config.MonitorConfig;
import de.makibytes.neonwatch.model.RoundReport;
import de.makibytes.neonwatch.model.RoundReport.TaskResult;
import de.makibytes.neonwatch.model.TaskStatus;

/**
 * Runs the tasks of one round concurrently and waits for them up to a deadline.
 * Tasks still running at the deadline are cancelled through interruption.
 */
@Component
public class RoundRunner {

    private static final Logger logger = LoggerFactory.getLogger(RoundRunner.class);

    private final ExecutorService executor;
    private final Clock clock;

    public RoundRunner(@Qualifier(MonitorConfig.MONITOR_EXECUTOR) ExecutorService executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    public RoundReport run(List<ProbeTask> tasks, Duration deadline) throws InterruptedException {
        Instant startedAt = clock.instant();
        List<Callable<Void>> callables = new ArrayList<>(tasks.size());
        for (ProbeTask task : tasks) {
            callables.add(() -> {
                task.body().run();
                return null;
            });
        }
        List<Future<Void>> futures = executor.invokeAll(callables, Math.max(1, deadline.toMillis()), TimeUnit.MILLISECONDS);

        List<TaskResult> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            results.add(outcome(tasks.get(i), futures.get(i)));
        }
        return new RoundReport(startedAt, clock.instant(), results);
    }

    private TaskResult outcome(ProbeTask task, Future<Void> future) throws InterruptedException {
        if (future.isCancelled()) {
            logger.warn("Probe {} did not finish before the round deadline and was cancelled", task.name());
            return new TaskResult(task.name(), TaskStatus.TIMED_OUT, "round deadline exceeded");
        }
        try {
            future.get();
            return new TaskResult(task.name(), TaskStatus.OK, null);
        } catch (CancellationException ex) {
            return new TaskResult(task.name(), TaskStatus.TIMED_OUT, "round deadline exceeded");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            logger.error("Probe {} failed with an unexpected error", task.name(), cause);
            return new TaskResult(task.name(), TaskStatus.FAILED, String.valueOf(cause));
        }
    }
}
