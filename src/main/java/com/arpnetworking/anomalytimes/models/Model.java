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
import com.arpnetworking.tsdcore.model.ForecastFrame;
import com.arpnetworking.tsdcore.model.PanelFrame;

import java.io.IOException;

/**
 * A forecasting model backend. Implementations wrap one forecasting algorithm;
 * the rest of the system depends only on this interface. Calls are
 * synchronous and may be long running.
 *
 * Instances are created and restored by the matching {@link ModelFactory}.
 */
public interface Model {

    /**
     * Fit the model against a context panel.
     *
     * @param context The historical observations of every series to model.
     */
    void fit(PanelFrame context);

    /**
     * Forecast every series of the context panel.
     *
     * @param context The recent observations to forecast from.
     * @param horizon The number of future steps to forecast.
     * @param confidenceLevel The probability mass the bounds are intended to
     * cover, e.g. {@code 0.9}.
     * @return The forecast, tagged with the series identifiers of the context.
     */
    ForecastFrame predict(PanelFrame context, int horizon, double confidenceLevel);

    /**
     * Persist the fitted state.
     *
     * @param store The artifact store.
     * @param key The artifact key.
     * @throws IOException if the state could not be stored.
     */
    void save(ArtifactStore store, String key) throws IOException;
}
