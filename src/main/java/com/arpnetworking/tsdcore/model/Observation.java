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

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A single value of a single series at a single point in time.
 */
@Loggable
public final class Observation {

    /**
     * Public constructor.
     *
     * @param timestamp The timestamp in epoch milliseconds.
     * @param seriesId The series the value belongs to.
     * @param value The value.
     */
    public Observation(final long timestamp, final SeriesId seriesId, final double value) {
        _timestamp = timestamp;
        _seriesId = seriesId;
        _value = value;
    }

    public long getTimestamp() {
        return _timestamp;
    }

    public SeriesId getSeriesId() {
        return _seriesId;
    }

    public double getValue() {
        return _value;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final Observation other = (Observation) object;
        return _timestamp == other._timestamp
                && Double.compare(_value, other._value) == 0
                && Objects.equal(_seriesId, other._seriesId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _seriesId, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("SeriesId", _seriesId)
                .add("Value", _value)
                .toString();
    }

    private final long _timestamp;
    private final SeriesId _seriesId;
    private final double _value;
}
