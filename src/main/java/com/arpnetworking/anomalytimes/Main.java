/*
 * Copyright 2026 Inscope Metrics
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
 */
package com.arpnetworking.anomalytimes;

import ch.qos.logback.classic.LoggerContext;
import com.arpnetworking.anomalytimes.configuration.AnomalyTimesConfiguration;
import com.arpnetworking.anomalytimes.configuration.DetectionJob;
import com.arpnetworking.anomalytimes.configuration.ForecastJob;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.tsdcore.exceptions.TsdbException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.asynchttpclient.AsyncHttpClient;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point running one forecast or detection job once.
 *
 * Usage: {@code Main <configuration-file> <forecast|detect> <job-name>}
 */
public final class Main {
    /**
     * Entry point.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        Thread.setDefaultUncaughtExceptionHandler(
                (thread, throwable) -> {
                    LOGGER.error()
                            .setMessage("Unhandled exception!")
                            .setThrowable(throwable)
                            .log();
                });

        final int exitCode;
        try {
            exitCode = run(args);
        } finally {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.stop();
        }
        System.exit(exitCode);
    }

    /**
     * Run the job named on the command line.
     *
     * @param args command line arguments
     * @return The process exit code.
     */
    static int run(final String[] args) {
        if (args.length != 3) {
            LOGGER.error()
                    .setMessage("Usage: <configuration-file> <forecast|detect> <job-name>")
                    .addData("args", args)
                    .log();
            return EXIT_USAGE;
        }
        final Optional<Mode> mode = Mode.parse(args[1]);
        if (!mode.isPresent()) {
            LOGGER.error()
                    .setMessage("Unknown mode")
                    .addData("mode", args[1])
                    .log();
            return EXIT_USAGE;
        }

        LOGGER.debug()
                .setMessage("Loading configuration from file")
                .addData("file", args[0])
                .log();
        final AnomalyTimesConfiguration configuration;
        try {
            configuration = AnomalyTimesConfiguration.load(new File(args[0]));
            // CHECKSTYLE.OFF: IllegalCatch - Builder validation failures are runtime exceptions
        } catch (final IOException | RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
            LOGGER.error()
                    .setMessage("Invalid configuration")
                    .addData("file", args[0])
                    .setThrowable(e)
                    .log();
            return EXIT_FAILURE;
        }

        final Injector injector = Guice.createInjector(new GuiceModule(configuration));
        try {
            final RunResult result = runJob(
                    injector.getInstance(Orchestrator.class),
                    configuration,
                    mode.get(),
                    args[2]);
            return result.getFailedWrites().isEmpty() ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (final JobNotFoundException e) {
            LOGGER.error()
                    .setMessage("Job not found")
                    .addData("mode", mode.get())
                    .addData("job", args[2])
                    .log();
            return EXIT_USAGE;
        } catch (final TsdbException | IllegalArgumentException e) {
            LOGGER.error()
                    .setMessage("Run aborted")
                    .addData("job", args[2])
                    .setThrowable(e)
                    .log();
            return EXIT_FAILURE;
        } finally {
            closeHttpClient(injector.getInstance(AsyncHttpClient.class));
        }
    }

    private static RunResult runJob(
            final Orchestrator orchestrator,
            final AnomalyTimesConfiguration configuration,
            final Mode mode,
            final String jobName)
            throws TsdbException, JobNotFoundException {
        final RunContext context = RunContext.create(jobName);
        LOGGER.info()
                .setMessage("Launching run")
                .addData("mode", mode)
                .addData("context", context)
                .log();
        if (mode == Mode.FORECAST) {
            final ForecastJob job = configuration.getForecastJob(jobName).orElseThrow(JobNotFoundException::new);
            return orchestrator.runForecast(job, context);
        }
        final DetectionJob job = configuration.getDetectionJob(jobName).orElseThrow(JobNotFoundException::new);
        return orchestrator.runDetection(job, context);
    }

    private static void closeHttpClient(final AsyncHttpClient httpClient) {
        try {
            httpClient.close();
        } catch (final IOException e) {
            LOGGER.warn()
                    .setMessage("Failed to close http client")
                    .setThrowable(e)
                    .log();
        }
    }

    private Main() {}

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOGGER = com.arpnetworking.steno.LoggerFactory.getLogger(Main.class);

    private enum Mode {
        FORECAST,
        DETECT;

        static Optional<Mode> parse(final String value) {
            try {
                return Optional.of(Mode.valueOf(value.toUpperCase(Locale.ROOT)));
            } catch (final IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }

    private static final class JobNotFoundException extends Exception {
        private static final long serialVersionUID = 1L;
    }
}
