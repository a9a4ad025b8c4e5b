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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Joins of independently fetched panels on (series, timestamp). Joins never
 * match keys with different {@link SeriesId}s and never modify their inputs.
 */
public final class PanelJoiner {

    /**
     * Full outer join of named panels. Every key present in any input yields
     * one record carrying the components of the inputs that have the key.
     *
     * @param frames The panels by component name.
     * @return New {@link CompositeFrame}.
     */
    public static CompositeFrame outerJoin(final Map<String, PanelFrame> frames) {
        final SortedMap<SeriesId, SortedMap<Long, ImmutableMap.Builder<String, Double>>> joined = new TreeMap<>();
        for (final Map.Entry<String, PanelFrame> frame : frames.entrySet()) {
            final String component = frame.getKey();
            for (final SeriesId seriesId : frame.getValue().getSeriesIds()) {
                final SortedMap<Long, ImmutableMap.Builder<String, Double>> series =
                        joined.computeIfAbsent(seriesId, key -> new TreeMap<>());
                for (final Map.Entry<Long, Double> point : frame.getValue().getSeries(seriesId).entrySet()) {
                    series.computeIfAbsent(point.getKey(), key -> ImmutableMap.builder())
                            .put(component, point.getValue());
                }
            }
        }

        final ImmutableSortedMap.Builder<SeriesId, ImmutableSortedMap<Long, CompositeRecord>> records =
                ImmutableSortedMap.naturalOrder();
        for (final Map.Entry<SeriesId, SortedMap<Long, ImmutableMap.Builder<String, Double>>> series : joined.entrySet()) {
            final ImmutableSortedMap.Builder<Long, CompositeRecord> seriesRecords = ImmutableSortedMap.naturalOrder();
            for (final Map.Entry<Long, ImmutableMap.Builder<String, Double>> point : series.getValue().entrySet()) {
                seriesRecords.put(point.getKey(), new CompositeRecord(point.getValue().build()));
            }
            records.put(series.getKey(), seriesRecords.build());
        }
        return new CompositeFrame(ImmutableSortedMap.copyOf(frames).keySet(), records.build());
    }

    /**
     * Inner join of a panel with a composite panel. Exactly the keys present
     * in both inputs are emitted; keys present on one side only are dropped.
     *
     * @param frame The plain panel.
     * @param composite The composite panel.
     * @return The matched rows ordered by series then timestamp.
     */
    public static ImmutableList<MatchedRow> innerJoin(final PanelFrame frame, final CompositeFrame composite) {
        final ImmutableList.Builder<MatchedRow> matched = ImmutableList.builder();
        for (final SeriesId seriesId : frame.getSeriesIds()) {
            final ImmutableSortedMap<Long, CompositeRecord> records = composite.getSeries(seriesId);
            if (records.isEmpty()) {
                continue;
            }
            for (final Map.Entry<Long, Double> point : frame.getSeries(seriesId).entrySet()) {
                final CompositeRecord record = records.get(point.getKey());
                if (record != null) {
                    matched.add(new MatchedRow(point.getKey(), seriesId, point.getValue(), record));
                }
            }
        }
        return matched.build();
    }

    private PanelJoiner() {}
}
