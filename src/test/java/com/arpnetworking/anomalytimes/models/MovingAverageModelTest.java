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
package com.arpnetworking.anomalytimes.models;

import com.arpnetworking.anomalytimes.artifacts.ArtifactStore;
import com.arpnetworking.anomalytimes.artifacts.FileSystemArtifactStore;
import com.arpnetworking.test.TestBeanFactory;
import com.arpnetworking.tsdcore.model.ForecastFrame;
import com.arpnetworking.tsdcore.model.ForecastPoint;
import com.arpnetworking.tsdcore.model.PanelFrame;
import com.arpnetworking.tsdcore.model.SeriesId;
import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Tests for the {@link MovingAverageModel} class.
 */
public class MovingAverageModelTest {

    @Before
    public void setUp() {
        _store = new FileSystemArtifactStore(_folder.getRoot().toPath());
    }

    @Test
    public void testPredict() {
        final Model model = FACTORY.create(ImmutableMap.of());
        final PanelFrame context = createContext();
        model.fit(context);

        final ForecastFrame forecast = model.predict(context, 3, 0.9);

        Assert.assertEquals(3, forecast.getPoints().size());
        final ForecastPoint first = forecast.getPoints().get(0);
        Assert.assertEquals(at(4), first.getTimestamp());
        Assert.assertEquals(SERIES, first.getSeriesId());
        Assert.assertEquals(2.5, first.getPred(), EPSILON);
        Assert.assertTrue(first.getLower() < first.getPred());
        Assert.assertTrue(first.getUpper() > first.getPred());
        Assert.assertEquals(first.getPred() - first.getLower(), first.getUpper() - first.getPred(), EPSILON);
        Assert.assertEquals(at(6), forecast.getPoints().get(2).getTimestamp());
    }

    @Test
    public void testWindowLimitsHistory() {
        final Model model = FACTORY.create(ImmutableMap.of("window", 2));
        final PanelFrame context = createContext();
        model.fit(context);
        Assert.assertEquals(3.5, model.predict(context, 1, 0.9).getPoints().get(0).getPred(), EPSILON);
    }

    @Test
    public void testSinglePointUsesConfiguredStep() {
        final Model model = FACTORY.create(ImmutableMap.of("step_seconds", 30));
        final PanelFrame context = TestBeanFactory.createPanelFrame(SERIES, ImmutableMap.of(at(0), 5.0));
        model.fit(context);
        final ForecastPoint point = model.predict(context, 1, 0.9).getPoints().get(0);
        Assert.assertEquals(at(0) + 30000L, point.getTimestamp());
        Assert.assertEquals(5.0, point.getLower(), EPSILON);
        Assert.assertEquals(5.0, point.getUpper(), EPSILON);
    }

    @Test
    public void testUnfitSeriesUsesOwnSpread() {
        final Model model = FACTORY.create(ImmutableMap.of());
        model.fit(PanelFrame.empty());
        final ForecastPoint point = model.predict(createContext(), 1, 0.9).getPoints().get(0);
        Assert.assertTrue(point.getUpper() > point.getLower());
    }

    @Test
    public void testSaveAndLoad() throws IOException {
        final MovingAverageModel model = (MovingAverageModel) FACTORY.create(ImmutableMap.of("window", 10));
        final PanelFrame context = createContext();
        model.fit(context);
        model.save(_store, "models/a.json");

        final MovingAverageModel loaded = (MovingAverageModel) FACTORY.load(_store, "models/a.json");

        Assert.assertEquals(model.getSpreads(), loaded.getSpreads());
        Assert.assertEquals(model.predict(context, 5, 0.8).getPoints(), loaded.predict(context, 5, 0.8).getPoints());
    }

    @Test(expected = IOException.class)
    public void testLoadRejectsOtherType() throws IOException {
        _store.write("other.json", "{\"type\":\"prophet\"}".getBytes(StandardCharsets.UTF_8));
        FACTORY.load(_store, "other.json");
    }

    @Test(expected = IOException.class)
    public void testLoadRejectsInvalidWindow() throws IOException {
        _store.write("bad.json", "{\"type\":\"moving_average\",\"window\":0}".getBytes(StandardCharsets.UTF_8));
        FACTORY.load(_store, "bad.json");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCreateRejectsInvalidParameter() {
        FACTORY.create(ImmutableMap.of("window", "wide"));
    }

    private static PanelFrame createContext() {
        return TestBeanFactory.createPanelFrame(
                SERIES,
                ImmutableMap.of(at(0), 1.0, at(1), 2.0, at(2), 3.0, at(3), 4.0));
    }

    private static long at(final int minute) {
        return TestBeanFactory.BASE_TIMESTAMP + minute * TestBeanFactory.MINUTE_MILLIS;
    }

    @Rule
    public TemporaryFolder _folder = new TemporaryFolder();

    private ArtifactStore _store;

    private static final ModelFactory FACTORY = new MovingAverageModel.Factory();
    private static final SeriesId SERIES = SeriesId.of("{\"job\":\"a\"}");
    private static final double EPSILON = 1e-9;
}
