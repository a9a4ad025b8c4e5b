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

import com.arpnetworking.anomalytimes.configuration.AnomalyTimesConfiguration;
import com.arpnetworking.tsdcore.sinks.TsdbWriter;
import com.arpnetworking.tsdcore.sinks.VictoriaMetricsCsvWriter;
import com.arpnetworking.tsdcore.sources.PrometheusReader;
import com.arpnetworking.tsdcore.sources.TsdbReader;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.asynchttpclient.AsyncHttpClient;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Tests for the {@link Main} and {@link GuiceModule} classes.
 */
public class MainTest {

    @Test
    public void testGuiceModule() throws IOException {
        final AnomalyTimesConfiguration configuration = new AnomalyTimesConfiguration.Builder()
                .setTsdbUri(URI.create("http://localhost:8428"))
                .setArtifactDirectory(_folder.getRoot())
                .build();
        final Injector injector = Guice.createInjector(new GuiceModule(configuration));
        try {
            Assert.assertNotNull(injector.getInstance(Orchestrator.class));
            Assert.assertTrue(injector.getInstance(TsdbReader.class) instanceof PrometheusReader);
            Assert.assertTrue(injector.getInstance(TsdbWriter.class) instanceof VictoriaMetricsCsvWriter);
            Assert.assertSame(injector.getInstance(Orchestrator.class), injector.getInstance(Orchestrator.class));
        } finally {
            injector.getInstance(AsyncHttpClient.class).close();
        }
    }

    @Test
    public void testMissingArguments() {
        Assert.assertEquals(Main.EXIT_USAGE, Main.run(new String[0]));
    }

    @Test
    public void testUnknownMode() throws IOException {
        Assert.assertEquals(Main.EXIT_USAGE, Main.run(new String[] {writeConfiguration().getPath(), "train", "cpu"}));
    }

    @Test
    public void testUnknownJob() throws IOException {
        Assert.assertEquals(Main.EXIT_USAGE, Main.run(new String[] {writeConfiguration().getPath(), "forecast", "disk"}));
    }

    @Test
    public void testInvalidConfiguration() throws IOException {
        final File file = _folder.newFile("invalid.json");
        Files.write(file.toPath(), "{}".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {file.getPath(), "detect", "cpu"}));
    }

    private File writeConfiguration() throws IOException {
        final File file = _folder.newFile("configuration.json");
        final String json = "{\"tsdbUri\":\"http://localhost:1\","
                + "\"artifactDirectory\":\"" + _folder.getRoot().getPath().replace("\\", "\\\\") + "\","
                + "\"forecastJobs\":[{\"name\":\"cpu\",\"query\":\"cpu\"}]}";
        Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Rule
    public TemporaryFolder _folder = new TemporaryFolder();
}
