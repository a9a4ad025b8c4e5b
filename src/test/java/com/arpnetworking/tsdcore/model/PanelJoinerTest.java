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
import com.google.common.collect.ImmutableSet;
import org.junit.Assert;
import org.junit.Test;

import java.util.Optional;

/**
 * Tests for the {@link PanelJoiner} class.
 */
public class PanelJoinerTest {

    @Test
    public void testInnerJoinKeepsOverlapOnly() {
        final PanelFrame realtime = TestBeanFactory.createPanelFrame(
                SERIES,
                ImmutableMap.of(at(0), 1.0, at(1), 2.0, at(2), 3.0));
        final CompositeFrame forecast = PanelJoiner.outerJoin(ImmutableMap.of(
                "pred",
                TestBeanFactory.createPanelFrame(SERIES, ImmutableMap.of(at(1), 10.0, at(2), 20.0, at(3), 30.0))));

        final ImmutableList<MatchedRow> matched = PanelJoiner.innerJoin(realtime, forecast);

        Assert.assertEquals(2, matched.size());
        Assert.assertEquals(at(1), matched.get(0).getTimestamp());
        Assert.assertEquals(2.0, matched.get(0).getActual(), 0.0);
        Assert.assertEquals(Optional.of(10.0), matched.get(0).getRecord().get("pred"));
        Assert.assertEquals(at(2), matched.get(1).getTimestamp());
    }

    @Test
    public void testInnerJoinDisjointSeries() {
        final PanelFrame realtime = TestBeanFactory.createPanelFrame(SERIES, ImmutableMap.of(at(0), 1.0));
        final CompositeFrame forecast = PanelJoiner.outerJoin(ImmutableMap.of(
                "pred",
                TestBeanFactory.createPanelFrame(OTHER_SERIES, ImmutableMap.of(at(0), 1.0))));
        Assert.assertTrue(PanelJoiner.innerJoin(realtime, forecast).isEmpty());
    }

    @Test
    public void testOuterJoinKeepsPartialRecords() {
        final CompositeFrame composite = PanelJoiner.outerJoin(ImmutableMap.of(
                "pred", TestBeanFactory.createPanelFrame(SERIES, ImmutableMap.of(at(0), 5.0, at(1), 6.0)),
                "lower", TestBeanFactory.createPanelFrame(SERIES, ImmutableMap.of(at(0), 4.0)),
                "upper", TestBeanFactory.createPanelFrame(SERIES, ImmutableMap.of(at(0), 7.0, at(2), 8.0))));

        Assert.assertEquals(ImmutableSet.of("lower", "pred", "upper"), composite.getComponentNames());
        Assert.assertEquals(3, composite.size());

        final CompositeRecord complete = composite.getRecord(SERIES, at(0)).get();
        Assert.assertTrue(complete.hasAll(ImmutableList.of("pred", "lower", "upper")));

        final CompositeRecord partial = composite.getRecord(SERIES, at(1)).get();
        Assert.assertFalse(partial.hasAll(ImmutableList.of("pred", "lower", "upper")));
        Assert.assertEquals(Optional.of(6.0), partial.get("pred"));
        Assert.assertEquals(Optional.empty(), partial.get("lower"));

        Assert.assertEquals(Optional.of(8.0), composite.getRecord(SERIES, at(2)).get().get("upper"));
        Assert.assertFalse(composite.getRecord(SERIES, at(3)).isPresent());
    }

    @Test
    public void testOuterJoinOfEmptyPanels() {
        final CompositeFrame composite = PanelJoiner.outerJoin(ImmutableMap.of(
                "pred", PanelFrame.empty(),
                "lower", PanelFrame.empty()));
        Assert.assertTrue(composite.isEmpty());
    }

    private static long at(final int minute) {
        return TestBeanFactory.BASE_TIMESTAMP + minute * TestBeanFactory.MINUTE_MILLIS;
    }

    private static final SeriesId SERIES = SeriesId.of("{\"job\":\"a\"}");
    private static final SeriesId OTHER_SERIES = SeriesId.of("{\"job\":\"b\"}");
}
