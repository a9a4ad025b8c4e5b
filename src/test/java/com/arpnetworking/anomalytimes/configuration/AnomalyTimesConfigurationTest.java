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

import com.arpnetworking.anomalytimes.models.MovingAverageModel;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Optional;

/**
 * Tests for the {@link AnomalyTimesConfiguration} class.
 */
public class AnomalyTimesConfigurationTest {

    @Test
    public void testLoadJson() throws IOException, URISyntaxException {
        final AnomalyTimesConfiguration configuration = AnomalyTimesConfiguration.load(getResource("testLoadJson.json"));

        Assert.assertEquals(URI.create("http://victoria:8428"), configuration.getTsdbUri());
        Assert.assertEquals(URI.create("http://victoria-import:8428"), configuration.getImportUri());
        Assert.assertEquals(new File("/tmp/artifacts"), configuration.getArtifactDirectory());
        Assert.assertEquals(Duration.ofSeconds(30), configuration.getRequestTimeout());

        final ForecastJob forecastJob = configuration.getForecastJob("cpu").get();
        Assert.assertEquals("rate(cpu_seconds_total[5m])", forecastJob.getQuery());
        Assert.assertEquals(30, forecastJob.getHorizon());
        Assert.assertEquals(0.95, forecastJob.getConfidenceLevel(), 0.0);
        Assert.assertEquals(20, ((Number) forecastJob.getModelParameters().get("window")).intValue());
        Assert.assertEquals(Optional.of("cpu/moving_average.json"), forecastJob.getArtifactKey());
        Assert.assertEquals(Duration.ofHours(12), forecastJob.getFitExpiration());
        Assert.assertEquals(Duration.ofMinutes(60), forecastJob.getLookback());

        final DetectionJob detectionJob = configuration.getDetectionJob("cpu").get();
        Assert.assertEquals(Duration.ofMinutes(5), detectionJob.getLookback());
        Assert.assertEquals(Duration.ofMinutes(1), detectionJob.getStep());
        Assert.assertEquals(ImmutableMap.of("detector", "cpu"), detectionJob.getExtraLabels());
    }

    @Test
    public void testLoadHocon() throws IOException, URISyntaxException {
        final AnomalyTimesConfiguration configuration = AnomalyTimesConfiguration.load(getResource("testLoadHocon.conf"));

        Assert.assertEquals(configuration.getTsdbUri(), configuration.getImportUri());
        Assert.assertEquals(Duration.ofSeconds(60), configuration.getRequestTimeout());
        Assert.assertTrue(configuration.getDetectionJobs().isEmpty());
        Assert.assertFalse(configuration.getDetectionJob("memory").isPresent());

        final ForecastJob job = configuration.getForecastJob("memory").get();
        Assert.assertEquals(Duration.ofHours(2), job.getLookback());
        Assert.assertEquals(60, job.getHorizon());
        Assert.assertEquals(0.9, job.getConfidenceLevel(), 0.0);
        Assert.assertEquals(MovingAverageModel.TYPE, job.getModelType());
        Assert.assertEquals(Optional.empty(), job.getArtifactKey());
        Assert.assertEquals(Duration.ofHours(24), job.getFitExpiration());
    }

    @Test(expected = IOException.class)
    public void testMissingTsdbUri() throws IOException, URISyntaxException {
        AnomalyTimesConfiguration.load(getResource("testMissingTsdbUri.json"));
    }

    @Test(expected = IOException.class)
    public void testInvalidJob() throws IOException, URISyntaxException {
        AnomalyTimesConfiguration.load(getResource("testInvalidJob.json"));
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testZeroHorizon() {
        new ForecastJob.Builder()
                .setName("cpu")
                .setQuery("cpu")
                .setHorizon(0)
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testEmptyArtifactKey() {
        new ForecastJob.Builder()
                .setName("cpu")
                .setQuery("cpu")
                .setArtifactKey("")
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testSubSecondForecastStep() {
        new ForecastJob.Builder()
                .setName("cpu")
                .setQuery("cpu")
                .setStep(Duration.ofMillis(500))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testNegativeForecastLookback() {
        new ForecastJob.Builder()
                .setName("cpu")
                .setQuery("cpu")
                .setLookback(Duration.ofMinutes(-5))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testZeroDetectionLookback() {
        new DetectionJob.Builder()
                .setName("cpu")
                .setQuery("cpu")
                .setLookback(Duration.ZERO)
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testSubSecondDetectionStep() {
        new DetectionJob.Builder()
                .setName("cpu")
                .setQuery("cpu")
                .setStep(Duration.ofMillis(10))
                .build();
    }

    @Test
    public void testOneSecondStepIsAccepted() {
        final DetectionJob job = new DetectionJob.Builder()
                .setName("cpu")
                .setQuery("cpu")
                .setStep(Duration.ofSeconds(1))
                .build();
        Assert.assertEquals(Duration.ofSeconds(1), job.getStep());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testDetectionJobRequiresQuery() {
        new DetectionJob.Builder()
                .setName("cpu")
                .build();
    }

    private File getResource(final String suffix) throws URISyntaxException {
        return new File(getClass().getResource(getClass().getSimpleName() + "." + suffix).toURI());
    }
}
