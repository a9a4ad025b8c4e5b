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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of a forecast or detection run.
 */
@Loggable
public final class RunResult {

    public RunState getState() {
        return _state;
    }

    public Optional<String> getReason() {
        return _reason;
    }

    public int getSeriesCount() {
        return _seriesCount;
    }

    public int getPointsWritten() {
        return _pointsWritten;
    }

    public ImmutableList<String> getFailedWrites() {
        return _failedWrites;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RunResult)) {
            return false;
        }
        final RunResult otherResult = (RunResult) other;
        return _seriesCount == otherResult._seriesCount
                && _pointsWritten == otherResult._pointsWritten
                && Objects.equal(_state, otherResult._state)
                && Objects.equal(_reason, otherResult._reason)
                && Objects.equal(_failedWrites, otherResult._failedWrites);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_state, _reason, _seriesCount, _pointsWritten, _failedWrites);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("State", _state)
                .add("Reason", _reason)
                .add("SeriesCount", _seriesCount)
                .add("PointsWritten", _pointsWritten)
                .add("FailedWrites", _failedWrites)
                .toString();
    }

    private RunResult(final Builder builder) {
        _state = builder._state;
        _reason = Optional.ofNullable(builder._reason);
        _seriesCount = builder._seriesCount;
        _pointsWritten = builder._pointsWritten;
        _failedWrites = builder._failedWrites;
    }

    private final RunState _state;
    private final Optional<String> _reason;
    private final int _seriesCount;
    private final int _pointsWritten;
    private final ImmutableList<String> _failedWrites;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link RunResult}.
     */
    public static final class Builder extends OvalBuilder<RunResult> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(RunResult::new);
        }

        /**
         * The terminal state. Required. Cannot be null.
         *
         * @param value The state.
         * @return This instance of {@link Builder}.
         */
        public Builder setState(final RunState value) {
            _state = value;
            return this;
        }

        /**
         * Why the run was skipped. Optional.
         *
         * @param value The reason.
         * @return This instance of {@link Builder}.
         */
        public Builder setReason(@Nullable final String value) {
            _reason = value;
            return this;
        }

        /**
         * The number of series processed. Optional. Cannot be null. Default is 0.
         *
         * @param value The series count.
         * @return This instance of {@link Builder}.
         */
        public Builder setSeriesCount(final Integer value) {
            _seriesCount = value;
            return this;
        }

        /**
         * The number of points successfully written. Optional. Cannot be null. Default is 0.
         *
         * @param value The points written.
         * @return This instance of {@link Builder}.
         */
        public Builder setPointsWritten(final Integer value) {
            _pointsWritten = value;
            return this;
        }

        /**
         * The metric names whose write failed. Optional. Cannot be null. Default is empty.
         *
         * @param value The failed metric names.
         * @return This instance of {@link Builder}.
         */
        public Builder setFailedWrites(final ImmutableList<String> value) {
            _failedWrites = value;
            return this;
        }

        @NotNull
        private RunState _state;
        private String _reason;
        @NotNull
        @Min(0)
        private Integer _seriesCount = 0;
        @NotNull
        @Min(0)
        private Integer _pointsWritten = 0;
        @NotNull
        private ImmutableList<String> _failedWrites = ImmutableList.of();
    }
}
