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
 * A (series, timestamp) key present on both sides of
 * {@link PanelJoiner#innerJoin(PanelFrame, CompositeFrame)}: the actual value
 * paired with the composite record.
 */
@Loggable
public final class MatchedRow {

    /**
     * Public constructor.
     *
     * @param timestamp The timestamp in epoch milliseconds.
     * @param seriesId The series.
     * @param actual The value from the plain panel.
     * @param record The record from the composite panel.
     */
    public MatchedRow(
            final long timestamp,
            final SeriesId seriesId,
            final double actual,
            final CompositeRecord record) {
        _timestamp = timestamp;
        _seriesId = seriesId;
        _actual = actual;
        _record = record;
    }

    public long getTimestamp() {
        return _timestamp;
    }

    public SeriesId getSeriesId() {
        return _seriesId;
    }

    public double getActual() {
        return _actual;
    }

    public CompositeRecord getRecord() {
        return _record;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final MatchedRow other = (MatchedRow) object;
        return _timestamp == other._timestamp
                && Double.compare(_actual, other._actual) == 0
                && Objects.equal(_seriesId, other._seriesId)
                && Objects.equal(_record, other._record);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _seriesId, _actual, _record);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("SeriesId", _seriesId)
                .add("Actual", _actual)
                .add("Record", _record)
                .toString();
    }

    private final long _timestamp;
    private final SeriesId _seriesId;
    private final double _actual;
    private final CompositeRecord _record;
}
