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
package com.arpnetworking.tsdcore.sources;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.exceptions.TsdbException;
import com.arpnetworking.tsdcore.model.MetricRow;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotNull;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.Request;
import org.asynchttpclient.RequestBuilder;
import org.asynchttpclient.Response;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Reads range queries from a Prometheus compatible HTTP API such as
 * Prometheus itself or VictoriaMetrics. Each sample of the {@code matrix}
 * result becomes one univariate {@link MetricRow} whose columns are the
 * series labels, {@code __name__} included. This class is thread safe.
 */
public final class PrometheusReader implements TsdbReader {

    @Override
    public ImmutableList<MetricRow> read(
            final String query,
            final Instant start,
            final Instant end,
            final Duration step) throws TsdbException {
        final Request request = new RequestBuilder("GET")
                .setUrl(_queryRangeUrl)
                .addQueryParam("query", query)
                .addQueryParam("start", toSeconds(start))
                .addQueryParam("end", toSeconds(end))
                .addQueryParam("step", step.getSeconds() + "s")
                .setRequestTimeout((int) _requestTimeout.toMillis())
                .build();

        final Response response;
        try {
            response = _httpClient.executeRequest(request).get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TsdbException(String.format("Interrupted reading query; query=%s", query), e);
        } catch (final ExecutionException e) {
            throw new TsdbException(String.format("Failed to read query; query=%s", query), e.getCause());
        }

        if (response.getStatusCode() / 100 != 2) {
            throw new TsdbException(String.format(
                    "Unexpected response reading query; query=%s, status=%d, body=%s",
                    query,
                    response.getStatusCode(),
                    response.getResponseBody()));
        }

        final ImmutableList<MetricRow> rows = parse(query, response.getResponseBodyAsBytes());
        LOGGER.debug()
                .setMessage("Read query")
                .addData("query", query)
                .addData("start", start)
                .addData("end", end)
                .addData("rows", rows.size())
                .log();
        return rows;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("uri", _uri)
                .put("requestTimeout", _requestTimeout)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    ImmutableList<MetricRow> parse(final String query, final byte[] body) throws TsdbException {
        final JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(body);
        } catch (final IOException e) {
            throw new TsdbException(String.format("Malformed response reading query; query=%s", query), e);
        }
        if (!SUCCESS.equals(root.path("status").asText())) {
            throw new TsdbException(String.format(
                    "Query was not successful; query=%s, errorType=%s, error=%s",
                    query,
                    root.path("errorType").asText(),
                    root.path("error").asText()));
        }
        final JsonNode data = root.path("data");
        final String resultType = data.path("resultType").asText();
        if (!MATRIX.equals(resultType)) {
            throw new TsdbException(String.format(
                    "Unsupported result type; query=%s, resultType=%s",
                    query,
                    resultType));
        }

        final ImmutableList.Builder<MetricRow> rows = ImmutableList.builder();
        for (final JsonNode series : data.path("result")) {
            final ImmutableMap.Builder<String, String> columns = ImmutableMap.builder();
            final Iterator<Map.Entry<String, JsonNode>> labels = series.path("metric").fields();
            while (labels.hasNext()) {
                final Map.Entry<String, JsonNode> label = labels.next();
                columns.put(label.getKey(), label.getValue().asText());
            }
            final ImmutableMap<String, String> seriesColumns = columns.buildKeepingLast();
            for (final JsonNode sample : series.path("values")) {
                rows.add(new MetricRow.Builder()
                        .setTimestamp(Math.round(sample.path(0).asDouble() * 1000.0))
                        .setColumns(seriesColumns)
                        .setValue(parseValue(sample.path(1).asText()))
                        .build());
            }
        }
        return rows.build();
    }

    private static Double parseValue(final String value) {
        switch (value) {
            case "+Inf":
            case "Inf":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(value);
                } catch (final NumberFormatException e) {
                    return Double.NaN;
                }
        }
    }

    private static String toSeconds(final Instant instant) {
        return BigDecimal.valueOf(instant.toEpochMilli(), 3).toPlainString();
    }

    private PrometheusReader(final Builder builder) {
        _uri = builder._uri;
        _httpClient = builder._httpClient;
        _requestTimeout = builder._requestTimeout;
        _queryRangeUrl = stripTrailingSlashes(_uri.toString()) + QUERY_RANGE_PATH;
    }

    private static String stripTrailingSlashes(final String uri) {
        int end = uri.length();
        while (end > 0 && uri.charAt(end - 1) == '/') {
            --end;
        }
        return uri.substring(0, end);
    }

    private final URI _uri;
    private final AsyncHttpClient _httpClient;
    private final Duration _requestTimeout;
    private final String _queryRangeUrl;

    private static final String QUERY_RANGE_PATH = "/api/v1/query_range";
    private static final String SUCCESS = "success";
    private static final String MATRIX = "matrix";
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
    private static final Logger LOGGER = LoggerFactory.getLogger(PrometheusReader.class);

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link PrometheusReader}.
     */
    public static final class Builder extends OvalBuilder<PrometheusReader> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(PrometheusReader::new);
        }

        /**
         * The base {@link URI} of the database, e.g. {@code http://localhost:8428}. Required. Cannot be null.
         *
         * @param value The base {@link URI}.
         * @return This instance of {@link Builder}.
         */
        public Builder setUri(final URI value) {
            _uri = value;
            return this;
        }

        /**
         * The http client. Required. Cannot be null.
         *
         * @param value The http client.
         * @return This instance of {@link Builder}.
         */
        public Builder setHttpClient(final AsyncHttpClient value) {
            _httpClient = value;
            return this;
        }

        /**
         * The request timeout. Optional. Cannot be null. Default is 60 seconds.
         *
         * @param value The request timeout.
         * @return This instance of {@link Builder}.
         */
        public Builder setRequestTimeout(final Duration value) {
            _requestTimeout = value;
            return this;
        }

        @NotNull
        private URI _uri;
        @NotNull
        private AsyncHttpClient _httpClient;
        @NotNull
        private Duration _requestTimeout = Duration.ofSeconds(60);
    }
}
