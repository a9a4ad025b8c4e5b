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
package com.arpnetworking.anomalytimes.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.Duration;

/**
 * A detection job: the realtime query scored against the stored forecasts.
 */
@Loggable
@JsonDeserialize(builder = DetectionJob.Builder.class)
public final class DetectionJob {

    public String getName() {
        return _name;
    }

    public String getQuery() {
        return _query;
    }

    public Duration getLookback() {
        return _lookback;
    }

    public Duration getStep() {
        return _step;
    }

    public ImmutableMap<String, String> getExtraLabels() {
        return _extraLabels;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Name", _name)
                .add("Query", _query)
                .add("Lookback", _lookback)
                .add("Step", _step)
                .add("ExtraLabels", _extraLabels)
                .toString();
    }

    private DetectionJob(final Builder builder) {
        _name = builder._name;
        _query = builder._query;
        _lookback = builder._lookback;
        _step = builder._step;
        _extraLabels = builder._extraLabels;
    }

    private final String _name;
    private final String _query;
    private final Duration _lookback;
    private final Duration _step;
    private final ImmutableMap<String, String> _extraLabels;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DetectionJob}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<DetectionJob> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DetectionJob::new);
        }

        /**
         * The job name. Required. Cannot be null or empty.
         *
         * @param value The job name.
         * @return This instance of {@link Builder}.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * The realtime query. Required. Cannot be null or empty.
         *
         * @param value The query.
         * @return This instance of {@link Builder}.
         */
        public Builder setQuery(final String value) {
            _query = value;
            return this;
        }

        /**
         * The length of the scored window. Optional. Cannot be null. Default is 5 minutes.
         * Must be positive.
         *
         * @param value The lookback.
         * @return This instance of {@link Builder}.
         */
        public Builder setLookback(final Duration value) {
            _lookback = value;
            return this;
        }

        /**
         * The query resolution. Optional. Cannot be null. Default is 1 minute.
         * Must be at least one second.
         *
         * @param value The step.
         * @return This instance of {@link Builder}.
         */
        public Builder setStep(final Duration value) {
            _step = value;
            return this;
        }

        /**
         * Labels added to every written score row. Optional. Cannot be null. Default is empty.
         *
         * @param value The extra labels.
         * @return This instance of {@link Builder}.
         */
        public Builder setExtraLabels(final ImmutableMap<String, String> value) {
            _extraLabels = value;
            return this;
        }

        /**
         * Validate that the lookback is positive.
         *
         * @param lookback the configured lookback
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateLookback(final Duration lookback) {
            return !lookback.isNegative() && !lookback.isZero();
        }

        /**
         * Validate that the step is at least one second, the resolution of range queries.
         *
         * @param step the configured step
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateStep(final Duration step) {
            return step.compareTo(MINIMUM_STEP) >= 0;
        }

        @NotNull
        @NotEmpty
        private String _name;
        @NotNull
        @NotEmpty
        private String _query;
        @NotNull
        @ValidateWithMethod(methodName = "validateLookback", parameterType = Duration.class)
        private Duration _lookback = Duration.ofMinutes(5);
        @NotNull
        @ValidateWithMethod(methodName = "validateStep", parameterType = Duration.class)
        private Duration _step = Duration.ofMinutes(1);
        @NotNull
        private ImmutableMap<String, String> _extraLabels = ImmutableMap.of();

        private static final Duration MINIMUM_STEP = Duration.ofSeconds(1);
    }
}
