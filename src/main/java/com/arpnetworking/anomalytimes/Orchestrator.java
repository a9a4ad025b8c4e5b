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

import com.arpnetworking.anomalytimes.artifacts.ModelArtifactCache;
import com.arpnetworking.anomalytimes.configuration.DetectionJob;
import com.arpnetworking.anomalytimes.configuration.ForecastJob;
import com.arpnetworking.anomalytimes.models.Model;
import com.arpnetworking.anomalytimes.models.ModelFactory;
import com.arpnetworking.anomalytimes.models.ModelRegistry;
import com.arpnetworking.anomalytimes.scoring.AnomalyScorer;
import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.exceptions.TsdbException;
import com.arpnetworking.tsdcore.model.CompositeFrame;
import com.arpnetworking.tsdcore.model.CompositeRecord;
import com.arpnetworking.tsdcore.model.ForecastFrame;
import com.arpnetworking.tsdcore.model.LabelCodec;
import com.arpnetworking.tsdcore.model.MatchedRow;
import com.arpnetworking.tsdcore.model.PanelFrame;
import com.arpnetworking.tsdcore.model.PanelJoiner;
import com.arpnetworking.tsdcore.sinks.TsdbWriter;
import com.arpnetworking.tsdcore.sources.TsdbReader;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Runs forecast and detection jobs.
 *
 * A forecast run reads the context window of the job's query, loads or fits
 * the job's model, forecasts the horizon and writes the point estimate and
 * the interval bounds as three metrics. Forecast rows carry exactly the
 * labels of their input series so that detection can join them back.
 *
 * A detection run reads the realtime window of the job's query together with
 * the stored forecast metrics, joins them on series and timestamp and writes
 * the anomaly score of every observation that has a complete forecast. The
 * forecast metrics are read without the realtime query's selector, so every
 * stored forecast series whose labels match a realtime series is joined.
 *
 * Instances keep no mutable state and may be shared by concurrent runs.
 */
public final class Orchestrator {

    /**
     * Run a forecast job once.
     *
     * @param job The job.
     * @param context The run identity.
     * @return The {@link RunResult}.
     * @throws TsdbException if reading the context window fails.
     * @throws IllegalArgumentException if the job's model type is unknown.
     */
    public RunResult runForecast(final ForecastJob job, final RunContext context) throws TsdbException {
        final ModelFactory factory = _modelRegistry.getFactory(job.getModelType());
        final Instant end = windowEnd();
        final Instant start = end.minus(job.getLookback());

        logState(context, RunState.FETCH_CONTEXT);
        final PanelFrame contextFrame = PanelFrame.fromRows(
                _reader.read(job.getQuery(), start, end, job.getStep()),
                _labelCodec);
        if (contextFrame.isEmpty()) {
            return skipped(context, "No context data");
        }

        logState(context, RunState.RESOLVE_MODEL);
        final Model model = _modelArtifactCache.resolveModel(
                factory,
                job.getModelParameters(),
                contextFrame,
                job.getArtifactKey(),
                job.getFitExpiration(),
                context);

        logState(context, RunState.PREDICT);
        final ForecastFrame forecast = model.predict(contextFrame, job.getHorizon(), job.getConfidenceLevel());
        if (forecast.isEmpty()) {
            return skipped(context, "Empty forecast");
        }

        logState(context, RunState.WRITE);
        final ImmutableList.Builder<String> failures = ImmutableList.builder();
        int written = 0;
        written += write(forecast.getPred(), MetricNames.PREDICTION, ImmutableMap.of(), context, failures);
        written += write(forecast.getLower(), MetricNames.LOWER, ImmutableMap.of(), context, failures);
        written += write(forecast.getUpper(), MetricNames.UPPER, ImmutableMap.of(), context, failures);
        return done(context, contextFrame.getSeriesIds().size(), written, failures.build());
    }

    /**
     * Run a detection job once.
     *
     * @param job The job.
     * @param context The run identity.
     * @return The {@link RunResult}.
     * @throws TsdbException if reading the realtime window or the forecasts fails.
     */
    public RunResult runDetection(final DetectionJob job, final RunContext context) throws TsdbException {
        final Instant end = windowEnd();
        final Instant start = end.minus(job.getLookback());
        final Duration step = job.getStep();

        logState(context, RunState.FETCH_REALTIME);
        final PanelFrame realtime = PanelFrame.fromRows(_reader.read(job.getQuery(), start, end, step), _labelCodec);
        if (realtime.isEmpty()) {
            return skipped(context, "No realtime data");
        }
        final CompositeFrame forecast = PanelJoiner.outerJoin(ImmutableMap.of(
                MetricNames.PREDICTION_COMPONENT, readForecast(MetricNames.PREDICTION, start, end, step),
                MetricNames.LOWER_COMPONENT, readForecast(MetricNames.LOWER, start, end, step),
                MetricNames.UPPER_COMPONENT, readForecast(MetricNames.UPPER, start, end, step)));
        if (forecast.isEmpty()) {
            return skipped(context, "No forecast data");
        }

        logState(context, RunState.JOIN);
        final ImmutableList<MatchedRow> matched = PanelJoiner.innerJoin(realtime, forecast);
        if (matched.isEmpty()) {
            return skipped(context, "No overlap between realtime and forecast data");
        }

        logState(context, RunState.SCORE);
        final PanelFrame.Builder scores = new PanelFrame.Builder();
        int incomplete = 0;
        for (final MatchedRow row : matched) {
            final CompositeRecord record = row.getRecord();
            if (!record.hasAll(SCORED_COMPONENTS)) {
                ++incomplete;
                continue;
            }
            scores.add(
                    row.getTimestamp(),
                    row.getSeriesId(),
                    AnomalyScorer.score(
                            row.getActual(),
                            record.get(MetricNames.PREDICTION_COMPONENT).get(),
                            record.get(MetricNames.LOWER_COMPONENT).get(),
                            record.get(MetricNames.UPPER_COMPONENT).get()));
        }
        if (incomplete > 0) {
            context.decorate(LOGGER.debug())
                    .setMessage("Skipped rows without a complete forecast")
                    .addData("count", incomplete)
                    .log();
        }
        final PanelFrame scoreFrame = scores.build();
        if (scoreFrame.isEmpty()) {
            return skipped(context, "No rows with a complete forecast");
        }

        logState(context, RunState.WRITE);
        final ImmutableList.Builder<String> failures = ImmutableList.builder();
        final int written = write(scoreFrame, MetricNames.SCORE, job.getExtraLabels(), context, failures);
        return done(context, scoreFrame.getSeriesIds().size(), written, failures.build());
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("reader", _reader)
                .put("writer", _writer)
                .put("modelArtifactCache", _modelArtifactCache)
                .put("modelRegistry", _modelRegistry)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private Instant windowEnd() {
        return _clock.instant().truncatedTo(ChronoUnit.MINUTES);
    }

    private PanelFrame readForecast(
            final String metricName,
            final Instant start,
            final Instant end,
            final Duration step)
            throws TsdbException {
        return PanelFrame.fromRows(_reader.read(metricName, start, end, step), _labelCodec);
    }

    private int write(
            final PanelFrame frame,
            final String metricName,
            final ImmutableMap<String, String> extraLabels,
            final RunContext context,
            final ImmutableList.Builder<String> failures) {
        try {
            _writer.write(frame, metricName, extraLabels);
            return frame.size();
        } catch (final TsdbException e) {
            context.decorate(LOGGER.error())
                    .setMessage("Failed to write metric")
                    .addData("metric", metricName)
                    .addData("points", frame.size())
                    .setThrowable(e)
                    .log();
            failures.add(metricName);
            return 0;
        }
    }

    private static void logState(final RunContext context, final RunState state) {
        context.decorate(LOGGER.debug())
                .setMessage("Run state changed")
                .addData("state", state)
                .log();
    }

    private static RunResult skipped(final RunContext context, final String reason) {
        context.decorate(LOGGER.warn())
                .setMessage("Run skipped")
                .addData("reason", reason)
                .log();
        return new RunResult.Builder()
                .setState(RunState.SKIPPED)
                .setReason(reason)
                .build();
    }

    private static RunResult done(
            final RunContext context,
            final int seriesCount,
            final int pointsWritten,
            final ImmutableList<String> failures) {
        final RunResult result = new RunResult.Builder()
                .setState(RunState.DONE)
                .setSeriesCount(seriesCount)
                .setPointsWritten(pointsWritten)
                .setFailedWrites(failures)
                .build();
        context.decorate(failures.isEmpty() ? LOGGER.info() : LOGGER.warn())
                .setMessage("Run complete")
                .addData("result", result)
                .log();
        return result;
    }

    private Orchestrator(final Builder builder) {
        _reader = builder._reader;
        _writer = builder._writer;
        _modelArtifactCache = builder._modelArtifactCache;
        _modelRegistry = builder._modelRegistry;
        _labelCodec = builder._labelCodec;
        _clock = builder._clock;
    }

    private final TsdbReader _reader;
    private final TsdbWriter _writer;
    private final ModelArtifactCache _modelArtifactCache;
    private final ModelRegistry _modelRegistry;
    private final LabelCodec _labelCodec;
    private final Clock _clock;

    private static final List<String> SCORED_COMPONENTS = ImmutableList.of(
            MetricNames.PREDICTION_COMPONENT,
            MetricNames.LOWER_COMPONENT,
            MetricNames.UPPER_COMPONENT);
    private static final Logger LOGGER = LoggerFactory.getLogger(Orchestrator.class);

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link Orchestrator}.
     */
    public static final class Builder extends OvalBuilder<Orchestrator> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(Orchestrator::new);
        }

        /**
         * The source of realtime and forecast data. Required. Cannot be null.
         *
         * @param value The reader.
         * @return This instance of {@link Builder}.
         */
        public Builder setReader(final TsdbReader value) {
            _reader = value;
            return this;
        }

        /**
         * The destination of forecasts and scores. Required. Cannot be null.
         *
         * @param value The writer.
         * @return This instance of {@link Builder}.
         */
        public Builder setWriter(final TsdbWriter value) {
            _writer = value;
            return this;
        }

        /**
         * The model artifact cache. Required. Cannot be null.
         *
         * @param value The cache.
         * @return This instance of {@link Builder}.
         */
        public Builder setModelArtifactCache(final ModelArtifactCache value) {
            _modelArtifactCache = value;
            return this;
        }

        /**
         * The registry of model types. Required. Cannot be null.
         *
         * @param value The registry.
         * @return This instance of {@link Builder}.
         */
        public Builder setModelRegistry(final ModelRegistry value) {
            _modelRegistry = value;
            return this;
        }

        /**
         * The series identifier codec. Optional. Cannot be null. Default is a
         * new {@link LabelCodec}.
         *
         * @param value The codec.
         * @return This instance of {@link Builder}.
         */
        public Builder setLabelCodec(final LabelCodec value) {
            _labelCodec = value;
            return this;
        }

        /**
         * The clock that positions run windows. Optional. Cannot be null.
         * Default is the UTC system clock.
         *
         * @param value The clock.
         * @return This instance of {@link Builder}.
         */
        public Builder setClock(final Clock value) {
            _clock = value;
            return this;
        }

        @NotNull
        private TsdbReader _reader;
        @NotNull
        private TsdbWriter _writer;
        @NotNull
        private ModelArtifactCache _modelArtifactCache;
        @NotNull
        private ModelRegistry _modelRegistry;
        @NotNull
        private LabelCodec _labelCodec = new LabelCodec();
        @NotNull
        private Clock _clock = Clock.systemUTC();
    }
}
