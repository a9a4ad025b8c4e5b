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

import com.arpnetworking.tsdcore.exceptions.TsdbException;
import com.arpnetworking.tsdcore.model.MetricRow;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.DefaultAsyncHttpClient;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tests for the {@link PrometheusReader} class.
 */
public class PrometheusReaderTest {

    @Before
    public void setUp() {
        _wireMockServer = new WireMockServer(0);
        _wireMockServer.start();
        _wireMock = new WireMock(_wireMockServer.port());
        _httpClient = new DefaultAsyncHttpClient();
        _reader = new PrometheusReader.Builder()
                .setUri(URI.create("http://localhost:" + _wireMockServer.port() + "/"))
                .setHttpClient(_httpClient)
                .setRequestTimeout(Duration.ofSeconds(10))
                .build();
    }

    @After
    public void tearDown() throws IOException {
        _httpClient.close();
        _wireMockServer.stop();
    }

    @Test
    public void testRead() throws TsdbException {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH))
                .withQueryParam("query", WireMock.equalTo("up{job=\"a\"}"))
                .withQueryParam("start", WireMock.equalTo("1704067200.000"))
                .withQueryParam("end", WireMock.equalTo("1704067500.000"))
                .withQueryParam("step", WireMock.equalTo("60s"))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":["
                                + "{\"metric\":{\"__name__\":\"up\",\"job\":\"a\"},"
                                + "\"values\":[[1704067200,\"1\"],[1704067260.5,\"NaN\"],[1704067320,\"+Inf\"]]},"
                                + "{\"metric\":{\"__name__\":\"up\",\"job\":\"b\"},"
                                + "\"values\":[[1704067200,\"0.25\"]]}]}}")));

        final ImmutableList<MetricRow> rows = _reader.read("up{job=\"a\"}", START, END, Duration.ofMinutes(1));

        Assert.assertEquals(4, rows.size());
        Assert.assertEquals(1704067200000L, rows.get(0).getTimestamp());
        Assert.assertEquals(ImmutableMap.of("__name__", "up", "job", "a"), rows.get(0).getColumns());
        Assert.assertEquals(ImmutableList.of(Optional.of(1.0)), rows.get(0).getValues());
        Assert.assertEquals(1704067260500L, rows.get(1).getTimestamp());
        Assert.assertEquals(ImmutableList.of(Optional.empty()), rows.get(1).getValues());
        Assert.assertEquals(ImmutableList.of(Optional.of(Double.POSITIVE_INFINITY)), rows.get(2).getValues());
        Assert.assertEquals("b", rows.get(3).getColumns().get("job"));
    }

    @Test
    public void testReadEmptyResult() throws TsdbException {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":[]}}")));
        Assert.assertTrue(_reader.read("up", START, END, Duration.ofMinutes(1)).isEmpty());
    }

    @Test(expected = TsdbException.class)
    public void testServerError() throws TsdbException {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH))
                .willReturn(WireMock.aResponse()
                        .withStatus(503)));
        _reader.read("up", START, END, Duration.ofMinutes(1));
    }

    @Test(expected = TsdbException.class)
    public void testQueryError() throws TsdbException {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}")));
        _reader.read("up{", START, END, Duration.ofMinutes(1));
    }

    @Test(expected = TsdbException.class)
    public void testUnsupportedResultType() throws TsdbException {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[]}}")));
        _reader.read("up", START, END, Duration.ofMinutes(1));
    }

    @Test(expected = TsdbException.class)
    public void testMalformedResponse() throws TsdbException {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("<html>")));
        _reader.read("up", START, END, Duration.ofMinutes(1));
    }

    private PrometheusReader _reader;
    private AsyncHttpClient _httpClient;
    private WireMockServer _wireMockServer;
    private WireMock _wireMock;

    private static final String PATH = "/api/v1/query_range";
    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-01T00:05:00Z");
}
