package io.abcsmc.status.sinks;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.abcsmc.status.eventing.StatusSink;
import io.abcsmc.status.eventing.StatusUpdate;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A sink that writes sampling progress to Log4j 2.
 *
 * <p>Updates are throttled per task: an update is only logged when progress
 * advanced by at least {@code stepFraction} since the last logged update, so a
 * population of 10,000 particles produces a handful of lines rather than one
 * per acceptance.
 *
 * <h2>Log Message Format</h2>
 * <ul>
 *   <li><strong>Started:</strong> "Sampling started: [task] target=[n]"</li>
 *   <li><strong>Update:</strong> "Sampling: [task] [accepted/target] [XX.X%], [evaluations] evaluations"</li>
 *   <li><strong>Finished:</strong> "Sampling finished: [task] ..."</li>
 * </ul>
 *
 * <pre>{@code
 * sampler.setStatusSink(new LoggerStatusSink("io.abcsmc.progress", Level.INFO, 0.1));
 * sampler.setShowProgress(true);
 * }</pre>
 */
public class LoggerStatusSink implements StatusSink {

    /** Default minimum progress step between logged updates */
    public static final double DEFAULT_STEP = 0.1;

    private final Logger logger;
    private final Level level;
    private final double stepFraction;
    private final ConcurrentMap<String, Double> lastLogged = new ConcurrentHashMap<>();

    public LoggerStatusSink() {
        this(LogManager.getLogger(LoggerStatusSink.class));
    }

    public LoggerStatusSink(Logger logger) {
        this(logger, Level.INFO, DEFAULT_STEP);
    }

    public LoggerStatusSink(String loggerName, Level level, double stepFraction) {
        this(LogManager.getLogger(loggerName), level, stepFraction);
    }

    public LoggerStatusSink(Logger logger, Level level, double stepFraction) {
        if (stepFraction < 0.0 || stepFraction > 1.0) {
            throw new IllegalArgumentException("stepFraction must be in [0, 1], got: " + stepFraction);
        }
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
        this.stepFraction = stepFraction;
    }

    @Override
    public void taskStarted(String task, long target) {
        lastLogged.put(task, 0.0);
        log("Sampling started: " + task + " target=" + target);
    }

    @Override
    public void taskUpdate(String task, StatusUpdate status) {
        double previous = lastLogged.getOrDefault(task, 0.0);
        if (status.progress - previous >= stepFraction && status.progress > previous) {
            lastLogged.put(task, status.progress);
            log(String.format("Sampling: %s [%d/%d] [%.1f%%], %d evaluations",
                task, status.accepted, status.target, status.progress * 100, status.evaluations));
        }
    }

    @Override
    public void taskFinished(String task, StatusUpdate status) {
        lastLogged.remove(task);
        log(String.format("Sampling finished: %s %s, acceptance rate %.4f",
            task, status, status.acceptanceRate()));
    }

    private void log(String message) {
        if (logger.isEnabled(level)) {
            logger.log(level, message);
        }
    }
}
