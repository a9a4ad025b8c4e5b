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

/**
 * States of a forecast or detection run. A run finishes in {@code DONE} or
 * {@code SKIPPED}.
 */
public enum RunState {
    /**
     * Reading the forecast context window.
     */
    FETCH_CONTEXT,
    /**
     * Loading or fitting the model.
     */
    RESOLVE_MODEL,
    /**
     * Producing the forecast.
     */
    PREDICT,
    /**
     * Reading the realtime window and the stored forecasts.
     */
    FETCH_REALTIME,
    /**
     * Joining realtime observations with forecast components.
     */
    JOIN,
    /**
     * Scoring joined rows.
     */
    SCORE,
    /**
     * Writing results.
     */
    WRITE,
    /**
     * Results were produced and written.
     */
    DONE,
    /**
     * The run stopped early because there was nothing to process.
     */
    SKIPPED
}
