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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable panel whose values are {@link CompositeRecord}s, produced by
 * {@link PanelJoiner#outerJoin(java.util.Map)}. Keyed and ordered like
 * {@link PanelFrame}.
 */
public final class CompositeFrame {

    public ImmutableSet<String> getComponentNames() {
        return _componentNames;
    }

    public ImmutableSortedSet<SeriesId> getSeriesIds() {
        return _records.keySet();
    }

    /**
     * The records of one series ordered by timestamp.
     *
     * @param seriesId The series.
     * @return Timestamp to record map; empty if the series is not present.
     */
    public ImmutableSortedMap<Long, CompositeRecord> getSeries(final SeriesId seriesId) {
        final ImmutableSortedMap<Long, CompositeRecord> series = _records.get(seriesId);
        return series == null ? ImmutableSortedMap.of() : series;
    }

    /**
     * Look up the record of a series at a timestamp.
     *
     * @param seriesId The series.
     * @param timestamp The timestamp in epoch milliseconds.
     * @return The record if present.
     */
    public Optional<CompositeRecord> getRecord(final SeriesId seriesId, final long timestamp) {
        return Optional.ofNullable(getSeries(seriesId).get(timestamp));
    }

    /**
     * The number of records.
     *
     * @return The number of records.
     */
    public int size() {
        int size = 0;
        for (final Map<Long, CompositeRecord> series : _records.values()) {
            size += series.size();
        }
        return size;
    }

    public boolean isEmpty() {
        return _records.isEmpty();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("components", _componentNames)
                .put("series", _records.size())
                .put("records", size())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    CompositeFrame(
            final ImmutableSet<String> componentNames,
            final ImmutableSortedMap<SeriesId, ImmutableSortedMap<Long, CompositeRecord>> records) {
        _componentNames = componentNames;
        _records = records;
    }

    private final ImmutableSet<String> _componentNames;
    private final ImmutableSortedMap<SeriesId, ImmutableSortedMap<Long, CompositeRecord>> _records;
}
