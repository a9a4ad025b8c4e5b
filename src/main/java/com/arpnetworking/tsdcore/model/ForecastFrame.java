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
import com.google.common.collect.ImmutableList;

import java.util.function.ToDoubleFunction;

/**
 * Immutable output of a forecasting model: one {@link ForecastPoint} per
 * (series, timestamp). Each component of the points can be projected into a
 * {@link PanelFrame} of its own.
 */
public final class ForecastFrame {

    /**
     * Public constructor.
     *
     * @param points The forecast points.
     */
    public ForecastFrame(final ImmutableList<ForecastPoint> points) {
        _points = points;
    }

    public ImmutableList<ForecastPoint> getPoints() {
        return _points;
    }

    public boolean isEmpty() {
        return _points.isEmpty();
    }

    /**
     * The point forecasts as a panel.
     *
     * @return New {@link PanelFrame}.
     */
    public PanelFrame getPred() {
        return project(ForecastPoint::getPred);
    }

    /**
     * The lower bounds as a panel.
     *
     * @return New {@link PanelFrame}.
     */
    public PanelFrame getLower() {
        return project(ForecastPoint::getLower);
    }

    /**
     * The upper bounds as a panel.
     *
     * @return New {@link PanelFrame}.
     */
    public PanelFrame getUpper() {
        return project(ForecastPoint::getUpper);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("points", _points.size())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private PanelFrame project(final ToDoubleFunction<ForecastPoint> component) {
        final PanelFrame.Builder builder = new PanelFrame.Builder();
        for (final ForecastPoint point : _points) {
            builder.add(point.getTimestamp(), point.getSeriesId(), component.applyAsDouble(point));
        }
        return builder.build();
    }

    private final ImmutableList<ForecastPoint> _points;
}
