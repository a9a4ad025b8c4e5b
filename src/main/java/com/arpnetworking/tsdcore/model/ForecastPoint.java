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
 * A forecast value with its confidence interval for one series at one point
 * in time. The upper bound is expected to be at least the lower bound but
 * this is not enforced.
 */
@Loggable
public final class ForecastPoint {

    /**
     * Public constructor.
     *
     * @param timestamp The timestamp in epoch milliseconds.
     * @param seriesId The series forecast.
     * @param pred The point forecast.
     * @param lower The lower bound of the confidence interval.
     * @param upper The upper bound of the confidence interval.
     */
    public ForecastPoint(
            final long timestamp,
            final SeriesId seriesId,
            final double pred,
            final double lower,
            final double upper) {
        _timestamp = timestamp;
        _seriesId = seriesId;
        _pred = pred;
        _lower = lower;
        _upper = upper;
    }

    public long getTimestamp() {
        return _timestamp;
    }

    public SeriesId getSeriesId() {
        return _seriesId;
    }

    public double getPred() {
        return _pred;
    }

    public double getLower() {
        return _lower;
    }

    public double getUpper() {
        return _upper;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final ForecastPoint other = (ForecastPoint) object;
        return _timestamp == other._timestamp
                && Double.compare(_pred, other._pred) == 0
                && Double.compare(_lower, other._lower) == 0
                && Double.compare(_upper, other._upper) == 0
                && Objects.equal(_seriesId, other._seriesId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _seriesId, _pred, _lower, _upper);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("SeriesId", _seriesId)
                .add("Pred", _pred)
                .add("Lower", _lower)
                .add("Upper", _upper)
                .toString();
    }

    private final long _timestamp;
    private final SeriesId _seriesId;
    private final double _pred;
    private final double _lower;
    private final double _upper;
}
