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
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import net.sf.oval.constraint.NotNull;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Representation of the anomaly times configuration.
 */
@JsonDeserialize(builder = AnomalyTimesConfiguration.Builder.class)
public final class AnomalyTimesConfiguration {

    /**
     * Create an {@link ObjectMapper} for the configuration.
     *
     * @return An {@link ObjectMapper} for the configuration.
     */
    public static ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = ObjectMapperFactory.createInstance();
        objectMapper.registerModule(new GuavaModule());
        objectMapper.registerModule(new Jdk8Module());
        objectMapper.registerModule(new JavaTimeModule());
        return objectMapper;
    }

    /**
     * Load the configuration from a file. Files ending in {@code .conf} are
     * read as HOCON, all others as JSON.
     *
     * @param file The configuration file.
     * @return The validated {@link AnomalyTimesConfiguration}.
     * @throws IOException if the file cannot be read or does not describe a
     * valid configuration.
     */
    public static AnomalyTimesConfiguration load(final File file) throws IOException {
        final ObjectMapper objectMapper = createObjectMapper();
        if (file.getName().toLowerCase(Locale.getDefault()).endsWith(HOCON_FILE_EXTENSION)) {
            final String json;
            try {
                final Config config = ConfigFactory.parseFile(file).resolve();
                json = config.root().render(ConfigRenderOptions.concise());
            } catch (final ConfigException e) {
                throw new IOException(String.format("Invalid configuration file; file=%s", file), e);
            }
            return objectMapper.readValue(json, AnomalyTimesConfiguration.class);
        }
        return objectMapper.readValue(file, AnomalyTimesConfiguration.class);
    }

    public URI getTsdbUri() {
        return _tsdbUri;
    }

    /**
     * The uri imports are posted to; the tsdb uri when not configured.
     *
     * @return The import uri.
     */
    public URI getImportUri() {
        return _importUri.orElse(_tsdbUri);
    }

    public File getArtifactDirectory() {
        return _artifactDirectory;
    }

    public Duration getRequestTimeout() {
        return _requestTimeout;
    }

    public ImmutableList<ForecastJob> getForecastJobs() {
        return _forecastJobs;
    }

    public ImmutableList<DetectionJob> getDetectionJobs() {
        return _detectionJobs;
    }

    /**
     * Find a forecast job by name.
     *
     * @param name The job name.
     * @return The job, if configured.
     */
    public Optional<ForecastJob> getForecastJob(final String name) {
        return find(_forecastJobs, ForecastJob::getName, name);
    }

    /**
     * Find a detection job by name.
     *
     * @param name The job name.
     * @return The job, if configured.
     */
    public Optional<DetectionJob> getDetectionJob(final String name) {
        return find(_detectionJobs, DetectionJob::getName, name);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("TsdbUri", _tsdbUri)
                .add("ImportUri", _importUri)
                .add("ArtifactDirectory", _artifactDirectory)
                .add("RequestTimeout", _requestTimeout)
                .add("ForecastJobs", _forecastJobs)
                .add("DetectionJobs", _detectionJobs)
                .toString();
    }

    private static <T> Optional<T> find(
            final ImmutableList<T> jobs,
            final Function<T, String> nameFunction,
            final String name) {
        return jobs.stream()
                .filter(job -> nameFunction.apply(job).equals(name))
                .findFirst();
    }

    private AnomalyTimesConfiguration(final Builder builder) {
        _tsdbUri = builder._tsdbUri;
        _importUri = Optional.ofNullable(builder._importUri);
        _artifactDirectory = builder._artifactDirectory;
        _requestTimeout = builder._requestTimeout;
        _forecastJobs = builder._forecastJobs;
        _detectionJobs = builder._detectionJobs;
    }

    private final URI _tsdbUri;
    private final Optional<URI> _importUri;
    private final File _artifactDirectory;
    private final Duration _requestTimeout;
    private final ImmutableList<ForecastJob> _forecastJobs;
    private final ImmutableList<DetectionJob> _detectionJobs;

    private static final String HOCON_FILE_EXTENSION = ".conf";

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link AnomalyTimesConfiguration}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<AnomalyTimesConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AnomalyTimesConfiguration::new);
        }

        /**
         * The base uri of the time series database queries are sent to.
         * Required. Cannot be null.
         *
         * @param value The tsdb uri.
         * @return This instance of {@link Builder}.
         */
        public Builder setTsdbUri(final URI value) {
            _tsdbUri = value;
            return this;
        }

        /**
         * The base uri imports are posted to. Optional. Defaults to the tsdb uri.
         *
         * @param value The import uri.
         * @return This instance of {@link Builder}.
         */
        public Builder setImportUri(@Nullable final URI value) {
            _importUri = value;
            return this;
        }

        /**
         * The directory fitted model artifacts are stored in. Required. Cannot be null.
         *
         * @param value The artifact directory.
         * @return This instance of {@link Builder}.
         */
        public Builder setArtifactDirectory(final File value) {
            _artifactDirectory = value;
            return this;
        }

        /**
         * The timeout of each request to the database. Optional. Cannot be
         * null. Default is 60 seconds.
         *
         * @param value The request timeout.
         * @return This instance of {@link Builder}.
         */
        public Builder setRequestTimeout(final Duration value) {
            _requestTimeout = value;
            return this;
        }

        /**
         * The forecast jobs. Optional. Cannot be null. Default is empty.
         *
         * @param value The forecast jobs.
         * @return This instance of {@link Builder}.
         */
        public Builder setForecastJobs(final ImmutableList<ForecastJob> value) {
            _forecastJobs = value;
            return this;
        }

        /**
         * The detection jobs. Optional. Cannot be null. Default is empty.
         *
         * @param value The detection jobs.
         * @return This instance of {@link Builder}.
         */
        public Builder setDetectionJobs(final ImmutableList<DetectionJob> value) {
            _detectionJobs = value;
            return this;
        }

        @NotNull
        private URI _tsdbUri;
        private URI _importUri;
        @NotNull
        private File _artifactDirectory;
        @NotNull
        private Duration _requestTimeout = Duration.ofSeconds(60);
        @NotNull
        private ImmutableList<ForecastJob> _forecastJobs = ImmutableList.of();
        @NotNull
        private ImmutableList<DetectionJob> _detectionJobs = ImmutableList.of();
    }
}
