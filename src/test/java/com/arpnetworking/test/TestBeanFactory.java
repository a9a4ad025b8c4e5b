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
package com.arpnetworking.test;

import com.arpnetworking.anomalytimes.configuration.DetectionJob;
import com.arpnetworking.anomalytimes.configuration.ForecastJob;
import com.arpnetworking.tsdcore.model.MetricRow;
import com.arpnetworking.tsdcore.model.PanelFrame;
import com.arpnetworking.tsdcore.model.SeriesId;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Creates reasonable random instances of common data types for testing. This is
 * strongly preferred over mocking data type classes as mocking should be
 * reserved for defining behavior and not data.
 */
public final class TestBeanFactory {

    /**
     * Create a univariate {@link MetricRow}.
     *
     * @param timestamp The timestamp in epoch milliseconds.
     * @param labels The label columns.
     * @param value The value.
     * @return New {@link MetricRow}.
     */
    public static MetricRow createMetricRow(
            final long timestamp,
            final ImmutableMap<String, String> labels,
            final double value) {
        return new MetricRow.Builder()
                .setTimestamp(timestamp)
                .setColumns(labels)
                .setValue(value)
                .build();
    }

    /**
     * Create a panel holding a single series.
     *
     * @param seriesId The series.
     * @param points The observations keyed by epoch milliseconds.
     * @return New {@link PanelFrame}.
     */
    public static PanelFrame createPanelFrame(final SeriesId seriesId, final Map<Long, Double> points) {
        final PanelFrame.Builder builder = new PanelFrame.Builder();
        for (final Map.Entry<Long, Double> point : points.entrySet()) {
            builder.add(point.getKey(), seriesId, point.getValue());
        }
        return builder.build();
    }

    /**
     * Create a builder for a pseudo-random {@link ForecastJob}.
     *
     * @return New builder for a pseudo-random {@link ForecastJob}.
     */
    public static ForecastJob.Builder createForecastJobBuilder() {
        return new ForecastJob.Builder()
                .setName("forecast-" + UUID.randomUUID())
                .setQuery("metric_" + RANDOM.nextInt(Integer.MAX_VALUE));
    }

    /**
     * Create a builder for a pseudo-random {@link DetectionJob}.
     *
     * @return New builder for a pseudo-random {@link DetectionJob}.
     */
    public static DetectionJob.Builder createDetectionJobBuilder() {
        return new DetectionJob.Builder()
                .setName("detection-" + UUID.randomUUID())
                .setQuery("metric_" + RANDOM.nextInt(Integer.MAX_VALUE));
    }

    private TestBeanFactory() {}

    /**
     * A minute aligned timestamp, 2024-01-01T00:00:00Z.
     */
    public static final long BASE_TIMESTAMP = 1704067200000L;
    /**
     * One minute in milliseconds.
     */
    public static final long MINUTE_MILLIS = 60000L;

    private static final Random RANDOM = new Random();
}
