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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.MinSize;
import net.sf.oval.constraint.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * A raw row read from a time series database: a timestamp, every column the
 * database returned for the series (reserved ones included) and one or more
 * values. A row with more than one value is multivariate; each value becomes
 * its own series when the row is converted into a {@link PanelFrame}.
 */
@Loggable
public final class MetricRow {

    public long getTimestamp() {
        return _timestamp;
    }

    public ImmutableMap<String, String> getColumns() {
        return _columns;
    }

    /**
     * The values carried by this row. Elements are empty where the database
     * reported no value.
     *
     * @return The values of the row.
     */
    public ImmutableList<Optional<Double>> getValues() {
        return _values;
    }

    public boolean isMultivariate() {
        return _values.size() > 1;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final MetricRow other = (MetricRow) object;
        return _timestamp == other._timestamp
                && Objects.equal(_columns, other._columns)
                && Objects.equal(_values, other._values);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _columns, _values);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Timestamp", _timestamp)
                .add("Columns", _columns)
                .add("Values", _values)
                .toString();
    }

    private MetricRow(final Builder builder) {
        _timestamp = builder._timestamp;
        _columns = builder._columns;
        _values = builder._values;
    }

    private final long _timestamp;
    private final ImmutableMap<String, String> _columns;
    private final ImmutableList<Optional<Double>> _values;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MetricRow}.
     */
    public static final class Builder extends OvalBuilder<MetricRow> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MetricRow::new);
        }

        /**
         * Set the timestamp in epoch milliseconds. Required. Cannot be null.
         *
         * @param value The timestamp.
         * @return This {@link Builder} instance.
         */
        public Builder setTimestamp(final Long value) {
            _timestamp = value;
            return this;
        }

        /**
         * Set the columns. Optional. Cannot be null. Defaults to an empty {@link ImmutableMap}.
         *
         * @param value The columns.
         * @return This {@link Builder} instance.
         */
        public Builder setColumns(final ImmutableMap<String, String> value) {
            _columns = value;
            return this;
        }

        /**
         * Set a single value; the row is univariate. A null or NaN value is
         * recorded as missing.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setValue(final Double value) {
            _values = ImmutableList.of(toOptional(value));
            return this;
        }

        /**
         * Set the values. Required. Cannot be null or empty. Null or NaN
         * elements are recorded as missing.
         *
         * @param value The values.
         * @return This {@link Builder} instance.
         */
        public Builder setValues(final List<Double> value) {
            final ImmutableList.Builder<Optional<Double>> values = ImmutableList.builder();
            for (final Double element : value) {
                values.add(toOptional(element));
            }
            _values = values.build();
            return this;
        }

        private static Optional<Double> toOptional(final Double value) {
            if (value == null || value.isNaN()) {
                return Optional.empty();
            }
            return Optional.of(value);
        }

        @NotNull
        private Long _timestamp;
        @NotNull
        private ImmutableMap<String, String> _columns = ImmutableMap.of();
        @NotNull
        @MinSize(1)
        private ImmutableList<Optional<Double>> _values;
    }
}
