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
import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.Instant;

/**
 * Reads raw rows for a query over a time range from a time series database.
 */
public interface TsdbReader {

    /**
     * Evaluate a query over a range.
     *
     * @param query The query, e.g. a PromQL expression.
     * @param start The inclusive start of the range.
     * @param end The inclusive end of the range.
     * @param step The resolution of the returned rows.
     * @return The rows, one per series and timestamp. Empty if nothing matched.
     * @throws TsdbException if the database could not be read.
     */
    ImmutableList<MetricRow> read(String query, Instant start, Instant end, Duration step) throws TsdbException;
}
