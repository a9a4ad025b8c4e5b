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
package com.arpnetworking.tsdcore.sinks;

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;

/**
 * One row of a bulk import: a timestamp, a value, the metric name and the
 * labels of the series.
 */
@Loggable
public final class ImportRow {

    /**
     * Public constructor.
     *
     * @param unixMillis The timestamp in epoch milliseconds.
     * @param value The value.
     * @param metricName The metric name.
     * @param labels The labels.
     */
    public ImportRow(
            final long unixMillis,
            final double value,
            final String metricName,
            final ImmutableMap<String, String> labels) {
        _unixMillis = unixMillis;
        _value = value;
        _metricName = metricName;
        _labels = labels;
    }

    public long getUnixMillis() {
        return _unixMillis;
    }

    public double getValue() {
        return _value;
    }

    public String getMetricName() {
        return _metricName;
    }

    public ImmutableMap<String, String> getLabels() {
        return _labels;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final ImportRow other = (ImportRow) object;
        return _unixMillis == other._unixMillis
                && Double.compare(_value, other._value) == 0
                && Objects.equal(_metricName, other._metricName)
                && Objects.equal(_labels, other._labels);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_unixMillis, _value, _metricName, _labels);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("UnixMillis", _unixMillis)
                .add("Value", _value)
                .add("MetricName", _metricName)
                .add("Labels", _labels)
                .toString();
    }

    private final long _unixMillis;
    private final double _value;
    private final String _metricName;
    private final ImmutableMap<String, String> _labels;
}
