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
 * Names of the metrics written by forecast and detection runs.
 */
public final class MetricNames {

    /**
     * Forecast point estimate.
     */
    public static final String PREDICTION = "anomaly_pred";
    /**
     * Lower bound of the forecast interval.
     */
    public static final String LOWER = "anomaly_lower";
    /**
     * Upper bound of the forecast interval.
     */
    public static final String UPPER = "anomaly_upper";
    /**
     * Anomaly score of a realtime observation.
     */
    public static final String SCORE = "anomaly_score";

    /**
     * Component name of the point estimate in a joined forecast.
     */
    public static final String PREDICTION_COMPONENT = "pred";
    /**
     * Component name of the lower bound in a joined forecast.
     */
    public static final String LOWER_COMPONENT = "lower";
    /**
     * Component name of the upper bound in a joined forecast.
     */
    public static final String UPPER_COMPONENT = "upper";

    private MetricNames() {}
}
