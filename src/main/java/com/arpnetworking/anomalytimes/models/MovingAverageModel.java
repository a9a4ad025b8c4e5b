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
package com.arpnetworking.anomalytimes.models;

import com.arpnetworking.anomalytimes.artifacts.ArtifactStore;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.model.ForecastFrame;
import com.arpnetworking.tsdcore.model.ForecastPoint;
import com.arpnetworking.tsdcore.model.PanelFrame;
import com.arpnetworking.tsdcore.model.SeriesId;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Baseline forecasting model. The point forecast of a series is the mean of
 * its trailing window of observations; the bounds are a normal confidence
 * band around it whose spread is the standard deviation learned when the
 * model was fit. Series that were not seen at fit time use the spread of
 * their own trailing window.
 *
 * Forecast timestamps continue the series at its median spacing, or at
 * the configured step when a series has a single observation.
 *
 * Parameters:
 * <ul>
 *     <li>{@code window}: number of trailing observations; default 60</li>
 *     <li>{@code step_seconds}: fallback spacing of forecasts; default 60</li>
 * </ul>
 */
public final class MovingAverageModel implements Model {

    @Override
    public void fit(final PanelFrame context) {
        final ImmutableMap.Builder<SeriesId, Double> spreads = ImmutableMap.builder();
        for (final SeriesId seriesId : context.getSeriesIds()) {
            spreads.put(seriesId, window(context.getSeries(seriesId)).getStandardDeviation());
        }
        _spreads = spreads.build();
        LOGGER.debug()
                .setMessage("Fit model")
                .addData("model", this)
                .log();
    }

    @Override
    public ForecastFrame predict(final PanelFrame context, final int horizon, final double confidenceLevel) {
        final double z = confidenceLevel > 0.0 && confidenceLevel < 1.0
                ? STANDARD_NORMAL.inverseCumulativeProbability(0.5 + confidenceLevel / 2.0)
                : 0.0;
        final ImmutableList.Builder<ForecastPoint> points = ImmutableList.builder();
        for (final SeriesId seriesId : context.getSeriesIds()) {
            final ImmutableSortedMap<Long, Double> series = context.getSeries(seriesId);
            final DescriptiveStatistics window = window(series);
            final double pred = window.getMean();
            final double spread = Optional.ofNullable(_spreads.get(seriesId)).orElse(window.getStandardDeviation());
            final double halfWidth = Double.isNaN(spread) ? 0.0 : z * spread;
            final long step = inferStep(series);
            final long last = series.lastKey();
            for (int i = 1; i <= horizon; ++i) {
                points.add(new ForecastPoint(last + i * step, seriesId, pred, pred - halfWidth, pred + halfWidth));
            }
        }
        return new ForecastFrame(points.build());
    }

    @Override
    public void save(final ArtifactStore store, final String key) throws IOException {
        final ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put(TYPE_FIELD, TYPE);
        root.put(WINDOW_PARAMETER, _window);
        root.put(STEP_PARAMETER, _stepMillis / 1000);
        final ObjectNode spreads = root.putObject(SPREADS_FIELD);
        for (final Map.Entry<SeriesId, Double> spread : _spreads.entrySet()) {
            spreads.put(spread.getKey().getId(), spread.getValue());
        }
        store.write(key, OBJECT_MAPPER.writeValueAsBytes(root));
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("window", _window)
                .put("stepMillis", _stepMillis)
                .put("fittedSeries", _spreads.size())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    ImmutableMap<SeriesId, Double> getSpreads() {
        return _spreads;
    }

    private DescriptiveStatistics window(final ImmutableSortedMap<Long, Double> series) {
        final DescriptiveStatistics statistics = new DescriptiveStatistics(_window);
        for (final Double value : series.values()) {
            statistics.addValue(value);
        }
        return statistics;
    }

    private long inferStep(final ImmutableSortedMap<Long, Double> series) {
        if (series.size() < 2) {
            return _stepMillis;
        }
        final DescriptiveStatistics differences = new DescriptiveStatistics();
        Long previous = null;
        for (final Long timestamp : series.keySet()) {
            if (previous != null) {
                differences.addValue(timestamp - previous);
            }
            previous = timestamp;
        }
        return Math.max(1L, Math.round(differences.getPercentile(50)));
    }

    private static int getInt(final Map<String, Object> parameters, final String name, final int defaultValue) {
        final Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid model parameter; name=%s, value=%s", name, value), e);
        }
    }

    private MovingAverageModel(final int window, final long stepMillis, final ImmutableMap<SeriesId, Double> spreads) {
        if (window < 1) {
            throw new IllegalArgumentException(String.format("Window must be positive; window=%d", window));
        }
        if (stepMillis < 1) {
            throw new IllegalArgumentException(String.format("Step must be positive; stepMillis=%d", stepMillis));
        }
        _window = window;
        _stepMillis = stepMillis;
        _spreads = spreads;
    }

    private final int _window;
    private final long _stepMillis;
    private ImmutableMap<SeriesId, Double> _spreads;

    /**
     * Model-type tag of {@link MovingAverageModel}.
     */
    public static final String TYPE = "moving_average";

    private static final String TYPE_FIELD = "type";
    private static final String SPREADS_FIELD = "spreads";
    private static final String WINDOW_PARAMETER = "window";
    private static final String STEP_PARAMETER = "step_seconds";
    private static final int DEFAULT_WINDOW = 60;
    private static final int DEFAULT_STEP_SECONDS = 60;
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
    private static final Logger LOGGER = LoggerFactory.getLogger(MovingAverageModel.class);

    /**
     * {@link ModelFactory} for {@link MovingAverageModel}.
     */
    public static final class Factory implements ModelFactory {

        @Override
        public String getType() {
            return TYPE;
        }

        @Override
        public Model create(final ImmutableMap<String, Object> parameters) {
            return new MovingAverageModel(
                    getInt(parameters, WINDOW_PARAMETER, DEFAULT_WINDOW),
                    getInt(parameters, STEP_PARAMETER, DEFAULT_STEP_SECONDS) * 1000L,
                    ImmutableMap.of());
        }

        @Override
        public Model load(final ArtifactStore store, final String key) throws IOException {
            final JsonNode root = OBJECT_MAPPER.readTree(store.read(key));
            if (root == null || !TYPE.equals(root.path(TYPE_FIELD).asText())) {
                throw new IOException(String.format("Artifact is not a %s model; key=%s", TYPE, key));
            }
            final ImmutableMap.Builder<SeriesId, Double> spreads = ImmutableMap.builder();
            final Iterator<Map.Entry<String, JsonNode>> fields = root.path(SPREADS_FIELD).fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                spreads.put(SeriesId.of(field.getKey()), field.getValue().asDouble());
            }
            try {
                return new MovingAverageModel(
                        root.path(WINDOW_PARAMETER).asInt(DEFAULT_WINDOW),
                        root.path(STEP_PARAMETER).asLong(DEFAULT_STEP_SECONDS) * 1000L,
                        spreads.build());
            } catch (final IllegalArgumentException e) {
                throw new IOException(String.format("Invalid %s artifact; key=%s", TYPE, key), e);
            }
        }

        @Override
        public String toString() {
            return getClass().getName();
        }
    }
}
