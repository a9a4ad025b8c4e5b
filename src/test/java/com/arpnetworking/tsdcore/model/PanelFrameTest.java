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
package com.arpnetworking.tsdcore.model;

import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Optional;

/**
 * Tests for the {@link PanelFrame} class.
 */
public class PanelFrameTest {

    @Test
    public void testFromRowsGroupsByLabels() {
        final ImmutableMap<String, String> first = ImmutableMap.of("__name__", "cpu", "host", "a");
        final ImmutableMap<String, String> second = ImmutableMap.of("__name__", "cpu", "host", "b");
        final PanelFrame frame = PanelFrame.fromRows(
                ImmutableList.of(
                        TestBeanFactory.createMetricRow(T0, first, 1.0),
                        TestBeanFactory.createMetricRow(T1, first, 2.0),
                        TestBeanFactory.createMetricRow(T0, second, 3.0)),
                CODEC);

        Assert.assertEquals(2, frame.getSeriesIds().size());
        Assert.assertEquals(3, frame.size());
        final SeriesId hostA = CODEC.encode(ImmutableMap.of("host", "a"));
        Assert.assertEquals(Optional.of(2.0), frame.getValue(hostA, T1));
        Assert.assertEquals(Optional.empty(), frame.getValue(hostA, T0 - 1));
    }

    @Test
    public void testFromRowsWithoutLabels() {
        final PanelFrame frame = PanelFrame.fromRows(
                ImmutableList.of(TestBeanFactory.createMetricRow(T0, ImmutableMap.of(), 1.0)),
                CODEC);
        Assert.assertEquals(LabelCodec.EMPTY_LABELS_ID, frame.getSeriesIds().first().getId());
    }

    @Test
    public void testMultivariateRows() {
        final MetricRow row = new MetricRow.Builder()
                .setTimestamp(T0)
                .setColumns(ImmutableMap.of("job", "a"))
                .setValues(Arrays.asList(1.0, 2.0, 3.0))
                .build();
        final PanelFrame frame = PanelFrame.fromRows(ImmutableList.of(row), CODEC);

        Assert.assertEquals(3, frame.getSeriesIds().size());
        for (int variate = 0; variate < 3; ++variate) {
            final SeriesId seriesId = CODEC.encode(ImmutableMap.of(
                    "job", "a",
                    PanelFrame.VARIATE_LABEL, String.valueOf(variate)));
            Assert.assertEquals(Optional.of(variate + 1.0), frame.getValue(seriesId, T0));
        }
    }

    @Test
    public void testMultivariateRowsKeepSourceVariateLabel() {
        final PanelFrame frame = PanelFrame.fromRows(
                ImmutableList.of(
                        new MetricRow.Builder()
                                .setTimestamp(T0)
                                .setColumns(ImmutableMap.of("job", "a", PanelFrame.VARIATE_LABEL, "x"))
                                .setValues(Arrays.asList(1.0, 2.0))
                                .build(),
                        new MetricRow.Builder()
                                .setTimestamp(T0)
                                .setColumns(ImmutableMap.of("job", "a", PanelFrame.VARIATE_LABEL, "y"))
                                .setValues(Arrays.asList(3.0, 4.0))
                                .build()),
                CODEC);

        Assert.assertEquals(4, frame.size());
        Assert.assertEquals(
                Optional.of(2.0),
                frame.getValue(
                        CODEC.encode(ImmutableMap.of(
                                "job", "a",
                                PanelFrame.EXPORTED_VARIATE_LABEL, "x",
                                PanelFrame.VARIATE_LABEL, "1")),
                        T0));
        Assert.assertEquals(
                Optional.of(3.0),
                frame.getValue(
                        CODEC.encode(ImmutableMap.of(
                                "job", "a",
                                PanelFrame.EXPORTED_VARIATE_LABEL, "y",
                                PanelFrame.VARIATE_LABEL, "0")),
                        T0));
    }

    @Test
    public void testUnivariateRowKeepsSourceVariateLabel() {
        final PanelFrame frame = PanelFrame.fromRows(
                ImmutableList.of(TestBeanFactory.createMetricRow(
                        T0,
                        ImmutableMap.of("job", "a", PanelFrame.VARIATE_LABEL, "x"),
                        1.0)),
                CODEC);
        Assert.assertEquals(
                ImmutableMap.of("job", "a", PanelFrame.VARIATE_LABEL, "x"),
                CODEC.decode(frame.getSeriesIds().first()));
    }

    @Test
    public void testUnivariateRowHasNoVariateLabel() {
        final PanelFrame frame = PanelFrame.fromRows(
                ImmutableList.of(TestBeanFactory.createMetricRow(T0, ImmutableMap.of("job", "a"), 1.0)),
                CODEC);
        MatcherAssert.assertThat(
                CODEC.decode(frame.getSeriesIds().first()),
                Matchers.not(Matchers.hasKey(PanelFrame.VARIATE_LABEL)));
    }

    @Test
    public void testMissingValuesAreDropped() {
        final PanelFrame frame = PanelFrame.fromRows(
                ImmutableList.of(
                        TestBeanFactory.createMetricRow(T0, ImmutableMap.of("job", "a"), Double.NaN),
                        TestBeanFactory.createMetricRow(T1, ImmutableMap.of("job", "a"), 4.0)),
                CODEC);
        Assert.assertEquals(1, frame.size());
    }

    @Test
    public void testDuplicateRowsKeepFirst() {
        final PanelFrame frame = PanelFrame.fromRows(
                ImmutableList.of(
                        TestBeanFactory.createMetricRow(T0, ImmutableMap.of("job", "a"), 1.0),
                        TestBeanFactory.createMetricRow(T0, ImmutableMap.of("job", "a"), 2.0)),
                CODEC);
        Assert.assertEquals(1, frame.size());
        Assert.assertEquals(Optional.of(1.0), frame.getValue(frame.getSeriesIds().first(), T0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBuilderRejectsDuplicateKey() {
        new PanelFrame.Builder()
                .add(T0, SERIES, 1.0)
                .add(T0, SERIES, 2.0);
    }

    @Test
    public void testObservationsAreOrdered() {
        final PanelFrame frame = new PanelFrame.Builder()
                .add(T1, SERIES, 2.0)
                .add(T0, SERIES, 1.0)
                .build();
        Assert.assertEquals(
                ImmutableList.of(new Observation(T0, SERIES, 1.0), new Observation(T1, SERIES, 2.0)),
                frame.getObservations());
    }

    @Test
    public void testEmpty() {
        Assert.assertTrue(PanelFrame.empty().isEmpty());
        Assert.assertTrue(PanelFrame.fromRows(ImmutableList.of(), CODEC).isEmpty());
        Assert.assertTrue(PanelFrame.empty().getSeries(SERIES).isEmpty());
    }

    private static final LabelCodec CODEC = new LabelCodec();
    private static final SeriesId SERIES = SeriesId.of("{\"job\":\"a\"}");
    private static final long T0 = TestBeanFactory.BASE_TIMESTAMP;
    private static final long T1 = T0 + TestBeanFactory.MINUTE_MILLIS;
}
