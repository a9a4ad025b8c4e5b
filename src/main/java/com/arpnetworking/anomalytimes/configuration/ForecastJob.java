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
import com.arpnetworking.anomalytimes.models.MovingAverageModel;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A forecast job: which query to forecast, with which model, and where its
 * fitted artifact is kept.
 */
@Loggable
@JsonDeserialize(builder = ForecastJob.Builder.class)
public final class ForecastJob {

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

    public int getHorizon() {
        return _horizon;
    }

    public double getConfidenceLevel() {
        return _confidenceLevel;
    }

    public String getModelType() {
        return _modelType;
    }

    public ImmutableMap<String, Object> getModelParameters() {
        return _modelParameters;
    }

    public Optional<String> getArtifactKey() {
        return _artifactKey;
    }

    public Duration getFitExpiration() {
        return _fitExpiration;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Name", _name)
                .add("Query", _query)
                .add("Lookback", _lookback)
                .add("Step", _step)
                .add("Horizon", _horizon)
                .add("ConfidenceLevel", _confidenceLevel)
                .add("ModelType", _modelType)
                .add("ModelParameters", _modelParameters)
                .add("ArtifactKey", _artifactKey)
                .add("FitExpiration", _fitExpiration)
                .toString();
    }

    private ForecastJob(final Builder builder) {
        _name = builder._name;
        _query = builder._query;
        _lookback = builder._lookback;
        _step = builder._step;
        _horizon = builder._horizon;
        _confidenceLevel = builder._confidenceLevel;
        _modelType = builder._modelType;
        _modelParameters = builder._modelParameters;
        _artifactKey = Optional.ofNullable(builder._artifactKey);
        _fitExpiration = builder._fitExpiration;
    }

    private final String _name;
    private final String _query;
    private final Duration _lookback;
    private final Duration _step;
    private final int _horizon;
    private final double _confidenceLevel;
    private final String _modelType;
    private final ImmutableMap<String, Object> _modelParameters;
    private final Optional<String> _artifactKey;
    private final Duration _fitExpiration;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ForecastJob}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<ForecastJob> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ForecastJob::new);
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
         * The query to forecast. Required. Cannot be null or empty.
         *
         * @param value The query.
         * @return This instance of {@link Builder}.
         */
        public Builder setQuery(final String value) {
            _query = value;
            return this;
        }

        /**
         * The length of the context window. Optional. Cannot be null. Default is 60 minutes.
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
         * The number of steps to forecast. Optional. Cannot be null. Default is 60. Minimum is 1.
         *
         * @param value The horizon.
         * @return This instance of {@link Builder}.
         */
        public Builder setHorizon(final Integer value) {
            _horizon = value;
            return this;
        }

        /**
         * The confidence level of the bounds. Optional. Cannot be null. Default is 0.9.
         * Must be between 0 and 1.
         *
         * @param value The confidence level.
         * @return This instance of {@link Builder}.
         */
        public Builder setConfidenceLevel(final Double value) {
            _confidenceLevel = value;
            return this;
        }

        /**
         * The model-type tag. Optional. Cannot be null or empty. Default is
         * {@link MovingAverageModel#TYPE}.
         *
         * @param value The model type.
         * @return This instance of {@link Builder}.
         */
        public Builder setModelType(final String value) {
            _modelType = value;
            return this;
        }

        /**
         * Parameters of newly created models. Optional. Cannot be null. Default is empty.
         *
         * @param value The model parameters.
         * @return This instance of {@link Builder}.
         */
        public Builder setModelParameters(final ImmutableMap<String, Object> value) {
            _modelParameters = value;
            return this;
        }

        /**
         * The key of the fitted model artifact. Optional. When null the model
         * is fit on every run and never stored.
         *
         * @param value The artifact key.
         * @return This instance of {@link Builder}.
         */
        public Builder setArtifactKey(@Nullable final String value) {
            _artifactKey = value;
            return this;
        }

        /**
         * The age after which a stored artifact is refit. Optional. Cannot be null. Default is 24 hours.
         *
         * @param value The fit expiration.
         * @return This instance of {@link Builder}.
         */
        public Builder setFitExpiration(final Duration value) {
            _fitExpiration = value;
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
        private Duration _lookback = Duration.ofMinutes(60);
        @NotNull
        @ValidateWithMethod(methodName = "validateStep", parameterType = Duration.class)
        private Duration _step = Duration.ofMinutes(1);
        @NotNull
        @Min(1)
        private Integer _horizon = 60;
        @NotNull
        @Range(min = 0.0, max = 1.0)
        private Double _confidenceLevel = 0.9;
        @NotNull
        @NotEmpty
        private String _modelType = MovingAverageModel.TYPE;
        @NotNull
        private ImmutableMap<String, Object> _modelParameters = ImmutableMap.of();
        @Nullable
        @NotEmpty
        private String _artifactKey;
        @NotNull
        private Duration _fitExpiration = Duration.ofHours(24);

        private static final Duration MINIMUM_STEP = Duration.ofSeconds(1);
    }
}
