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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.tsdcore.exceptions.TsdbException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import net.sf.oval.constraint.NotNull;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.Request;
import org.asynchttpclient.RequestBuilder;
import org.asynchttpclient.Response;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Writes panels through the VictoriaMetrics CSV bulk import API
 * ({@code /api/v1/import/csv}). The CSV has the timestamp and value columns
 * followed by one column per label key found in any row; rows without a key
 * leave its cell empty. This class is thread safe.
 */
public final class VictoriaMetricsCsvWriter extends BaseTsdbWriter {

    @Override
    protected void writeRows(final String metricName, final ImmutableList<ImportRow> rows) throws TsdbException {
        final ImmutableSortedSet.Builder<String> labelKeysBuilder = ImmutableSortedSet.naturalOrder();
        for (final ImportRow row : rows) {
            labelKeysBuilder.addAll(row.getLabels().keySet());
        }
        final ImmutableSortedSet<String> labelKeys = labelKeysBuilder.build();

        final Request request = new RequestBuilder("POST")
                .setUrl(_importUrl)
                .addQueryParam("format", createFormat(metricName, labelKeys))
                .setHeader("Content-Type", CONTENT_TYPE)
                .setBody(createBody(rows, labelKeys).getBytes(StandardCharsets.UTF_8))
                .setRequestTimeout((int) _requestTimeout.toMillis())
                .build();

        final Response response;
        try {
            response = _httpClient.executeRequest(request).get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TsdbException(String.format("Interrupted writing metric; metric=%s", metricName), e);
        } catch (final ExecutionException e) {
            throw new TsdbException(String.format("Failed to write metric; metric=%s", metricName), e.getCause());
        }
        if (response.getStatusCode() / 100 != 2) {
            throw new TsdbException(String.format(
                    "Unexpected response writing metric; metric=%s, status=%d, body=%s",
                    metricName,
                    response.getStatusCode(),
                    response.getResponseBody()));
        }
    }

    @LogValue
    @Override
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("super", super.toLogValue())
                .put("uri", _uri)
                .put("requestTimeout", _requestTimeout)
                .build();
    }

    static String createFormat(final String metricName, final ImmutableSortedSet<String> labelKeys) {
        final StringBuilder format = new StringBuilder("1:time:unix_ms,2:metric:").append(metricName);
        int column = 3;
        for (final String labelKey : labelKeys) {
            format.append(',').append(column++).append(":label:").append(labelKey);
        }
        return format.toString();
    }

    static String createBody(final ImmutableList<ImportRow> rows, final ImmutableSortedSet<String> labelKeys) {
        final StringBuilder body = new StringBuilder();
        for (final ImportRow row : rows) {
            body.append(row.getUnixMillis()).append(',').append(row.getValue());
            for (final String labelKey : labelKeys) {
                body.append(',');
                final String labelValue = row.getLabels().get(labelKey);
                if (labelValue != null) {
                    appendEscaped(body, labelValue);
                }
            }
            body.append('\n');
        }
        return body.toString();
    }

    private static void appendEscaped(final StringBuilder body, final String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            body.append(value);
            return;
        }
        body.append('"').append(value.replace("\"", "\"\"")).append('"');
    }

    private VictoriaMetricsCsvWriter(final Builder builder) {
        super(builder);
        _uri = builder._uri;
        _httpClient = builder._httpClient;
        _requestTimeout = builder._requestTimeout;
        final String base = _uri.toString();
        _importUrl = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + IMPORT_PATH;
    }

    private final URI _uri;
    private final AsyncHttpClient _httpClient;
    private final Duration _requestTimeout;
    private final String _importUrl;

    private static final String IMPORT_PATH = "/api/v1/import/csv";
    private static final String CONTENT_TYPE = "text/csv";

    /**
     * Implementation of builder pattern for {@link VictoriaMetricsCsvWriter}.
     */
    public static final class Builder extends BaseTsdbWriter.Builder<Builder, VictoriaMetricsCsvWriter> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(VictoriaMetricsCsvWriter::new);
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

        @Override
        protected Builder self() {
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
