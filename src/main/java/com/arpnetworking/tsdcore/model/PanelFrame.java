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
package com.arpnetworking.tsdcore.model;

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable panel of time series: observations of many series keyed by
 * (series, timestamp). A key appears at most once. Iteration is ordered by
 * series and then by timestamp, both ascending.
 *
 * Instances are created through {@link Builder}, which has a single owner,
 * or from raw database rows with {@link #fromRows(Collection, LabelCodec)}.
 */
public final class PanelFrame {

    /**
     * An empty panel.
     *
     * @return The empty {@link PanelFrame}.
     */
    public static PanelFrame empty() {
        return EMPTY;
    }

    /**
     * Build a panel from raw database rows using {@link #DEFAULT_RESERVED_COLUMNS}.
     *
     * @param rows The raw rows.
     * @param codec The codec deriving series identifiers from labels.
     * @return New {@link PanelFrame}.
     */
    public static PanelFrame fromRows(final Collection<MetricRow> rows, final LabelCodec codec) {
        return fromRows(rows, DEFAULT_RESERVED_COLUMNS, codec);
    }

    /**
     * Build a panel from raw database rows. Every column of a row not in
     * {@code reservedColumns} is a label; the distinct label sets are encoded
     * into series identifiers. Rows without label columns all belong to the
     * series of the empty label set. A multivariate row with N values yields
     * N series, the label {@link #VARIATE_LABEL} carrying the index of each
     * value. A source label of a multivariate row that is itself named
     * {@link #VARIATE_LABEL} is kept as {@link #EXPORTED_VARIATE_LABEL}.
     * Missing values are dropped.
     *
     * @param rows The raw rows.
     * @param reservedColumns The columns that are not labels.
     * @param codec The codec deriving series identifiers from labels.
     * @return New {@link PanelFrame}.
     */
    public static PanelFrame fromRows(
            final Collection<MetricRow> rows,
            final Set<String> reservedColumns,
            final LabelCodec codec) {
        final Builder builder = new Builder();
        final Map<Map<String, String>, SeriesId> seriesIds = Maps.newHashMap();
        int duplicates = 0;
        int renamed = 0;
        for (final MetricRow row : rows) {
            final SortedMap<String, String> labels = new TreeMap<>();
            for (final Map.Entry<String, String> column : row.getColumns().entrySet()) {
                if (!reservedColumns.contains(column.getKey())) {
                    labels.put(column.getKey(), column.getValue());
                }
            }
            if (row.isMultivariate() && labels.containsKey(VARIATE_LABEL)) {
                labels.put(EXPORTED_VARIATE_LABEL, labels.remove(VARIATE_LABEL));
                ++renamed;
            }
            final ImmutableList<Optional<Double>> values = row.getValues();
            for (int variate = 0; variate < values.size(); ++variate) {
                final Optional<Double> value = values.get(variate);
                if (!value.isPresent()) {
                    continue;
                }
                final ImmutableMap<String, String> seriesLabels;
                if (row.isMultivariate()) {
                    final SortedMap<String, String> variateLabels = new TreeMap<>(labels);
                    variateLabels.put(VARIATE_LABEL, String.valueOf(variate));
                    seriesLabels = ImmutableMap.copyOf(variateLabels);
                } else {
                    seriesLabels = ImmutableMap.copyOf(labels);
                }
                final SeriesId seriesId = seriesIds.computeIfAbsent(seriesLabels, codec::encode);
                if (builder.contains(seriesId, row.getTimestamp())) {
                    ++duplicates;
                    continue;
                }
                builder.add(row.getTimestamp(), seriesId, value.get());
            }
        }
        if (renamed > 0) {
            LOGGER.warn()
                    .setMessage("Renamed source labels clashing with the variate label")
                    .addData("rows", renamed)
                    .addData("label", VARIATE_LABEL)
                    .addData("renamedTo", EXPORTED_VARIATE_LABEL)
                    .log();
        }
        if (duplicates > 0) {
            LOGGER.warn()
                    .setMessage("Dropped duplicate observations while building panel")
                    .addData("duplicates", duplicates)
                    .addData("reservedColumns", reservedColumns)
                    .log();
        }
        return builder.build();
    }

    public ImmutableSortedSet<SeriesId> getSeriesIds() {
        return _series.keySet();
    }

    /**
     * The observations of one series ordered by timestamp.
     *
     * @param seriesId The series.
     * @return Timestamp to value map; empty if the series is not in the panel.
     */
    public ImmutableSortedMap<Long, Double> getSeries(final SeriesId seriesId) {
        final ImmutableSortedMap<Long, Double> series = _series.get(seriesId);
        return series == null ? ImmutableSortedMap.of() : series;
    }

    /**
     * Look up the value of a series at a timestamp.
     *
     * @param seriesId The series.
     * @param timestamp The timestamp in epoch milliseconds.
     * @return The value if present.
     */
    public Optional<Double> getValue(final SeriesId seriesId, final long timestamp) {
        return Optional.ofNullable(getSeries(seriesId).get(timestamp));
    }

    /**
     * All observations, ordered by series then timestamp.
     *
     * @return The observations.
     */
    public ImmutableList<Observation> getObservations() {
        final ImmutableList.Builder<Observation> observations = ImmutableList.builderWithExpectedSize(_size);
        for (final Map.Entry<SeriesId, ImmutableSortedMap<Long, Double>> series : _series.entrySet()) {
            for (final Map.Entry<Long, Double> point : series.getValue().entrySet()) {
                observations.add(new Observation(point.getKey(), series.getKey(), point.getValue()));
            }
        }
        return observations.build();
    }

    /**
     * The number of observations.
     *
     * @return The number of observations.
     */
    public int size() {
        return _size;
    }

    public boolean isEmpty() {
        return _size == 0;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("series", _series.size())
                .put("observations", _size)
                .build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final PanelFrame other = (PanelFrame) object;
        return Objects.equal(_series, other._series);
    }

    @Override
    public int hashCode() {
        return _series.hashCode();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private PanelFrame(final ImmutableSortedMap<SeriesId, ImmutableSortedMap<Long, Double>> series) {
        _series = series;
        int size = 0;
        for (final ImmutableSortedMap<Long, Double> points : series.values()) {
            size += points.size();
        }
        _size = size;
    }

    private final ImmutableSortedMap<SeriesId, ImmutableSortedMap<Long, Double>> _series;
    private final int _size;

    /**
     * Label injected into the labels of each series expanded from a multivariate row.
     */
    public static final String VARIATE_LABEL = "variate";
    /**
     * Name given to a source {@link #VARIATE_LABEL} of a multivariate row.
     */
    public static final String EXPORTED_VARIATE_LABEL = "exported_variate";
    /**
     * Columns of a raw row that never become labels.
     */
    public static final ImmutableSet<String> DEFAULT_RESERVED_COLUMNS = ImmutableSet.of("timestamp", "value", "__name__");

    private static final PanelFrame EMPTY = new PanelFrame(ImmutableSortedMap.of());
    private static final Logger LOGGER = LoggerFactory.getLogger(PanelFrame.class);

    /**
     * Single owner builder for {@link PanelFrame}. Not thread safe.
     */
    public static final class Builder {

        /**
         * Add an observation. NaN values are ignored.
         *
         * @param observation The observation.
         * @return This {@link Builder} instance.
         * @throws IllegalArgumentException if the (series, timestamp) key was already added.
         */
        public Builder add(final Observation observation) {
            return add(observation.getTimestamp(), observation.getSeriesId(), observation.getValue());
        }

        /**
         * Add an observation. NaN values are ignored.
         *
         * @param timestamp The timestamp in epoch milliseconds.
         * @param seriesId The series.
         * @param value The value.
         * @return This {@link Builder} instance.
         * @throws IllegalArgumentException if the (series, timestamp) key was already added.
         */
        public Builder add(final long timestamp, final SeriesId seriesId, final double value) {
            if (Double.isNaN(value)) {
                return this;
            }
            final SortedMap<Long, Double> series = _series.computeIfAbsent(seriesId, key -> new TreeMap<>());
            if (series.putIfAbsent(timestamp, value) != null) {
                throw new IllegalArgumentException(
                        String.format("Duplicate observation; series=%s, timestamp=%d", seriesId, timestamp));
            }
            return this;
        }

        /**
         * Whether an observation was already added for a key.
         *
         * @param seriesId The series.
         * @param timestamp The timestamp in epoch milliseconds.
         * @return True if and only if the key is present.
         */
        public boolean contains(final SeriesId seriesId, final long timestamp) {
            final SortedMap<Long, Double> series = _series.get(seriesId);
            return series != null && series.containsKey(timestamp);
        }

        /**
         * Create the {@link PanelFrame}.
         *
         * @return New {@link PanelFrame}.
         */
        public PanelFrame build() {
            final ImmutableSortedMap.Builder<SeriesId, ImmutableSortedMap<Long, Double>> series =
                    ImmutableSortedMap.naturalOrder();
            for (final Map.Entry<SeriesId, SortedMap<Long, Double>> entry : _series.entrySet()) {
                series.put(entry.getKey(), ImmutableSortedMap.copyOfSorted(entry.getValue()));
            }
            return new PanelFrame(series.build());
        }

        private final SortedMap<SeriesId, SortedMap<Long, Double>> _series = new TreeMap<>();
    }
}
