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
package com.arpnetworking.anomalytimes.scoring;

/**
 * Scores an observation against the confidence interval forecast for it.
 *
 * The score is the absolute deviation from the point forecast divided by
 * half the interval width: 0 at the point forecast, exactly 1 at either
 * bound, growing linearly and without clamping beyond the bounds. Scores in
 * [0, 1] are normal and scores above 1 are anomalous.
 *
 * When the interval is degenerate (width at most {@link #DEGENERATE_WIDTH})
 * the score is the plain absolute deviation. Those scores are not on the
 * 0 to 1 scale; a deviation of 0.5 from a degenerate interval reads as normal
 * and a deviation of 2 reads as anomalous regardless of the units of the
 * series. An inverted interval (upper below lower) is scored as degenerate.
 */
public final class AnomalyScorer {

    /**
     * Score one observation.
     *
     * @param actual The observed value.
     * @param pred The point forecast.
     * @param lower The lower bound of the interval.
     * @param upper The upper bound of the interval.
     * @return The anomaly score.
     */
    public static double score(final double actual, final double pred, final double lower, final double upper) {
        final double deviation = Math.abs(actual - pred);
        final double width = upper - lower;
        if (width <= DEGENERATE_WIDTH) {
            return deviation;
        }
        return deviation / (width / 2.0);
    }

    /**
     * Whether a score is anomalous.
     *
     * @param score The score.
     * @return True if and only if the score exceeds {@link #ANOMALY_THRESHOLD}.
     */
    public static boolean isAnomalous(final double score) {
        return score > ANOMALY_THRESHOLD;
    }

    private AnomalyScorer() {}

    /**
     * Interval widths at or below this value are degenerate.
     */
    public static final double DEGENERATE_WIDTH = 1e-9;
    /**
     * Scores above this value are anomalous.
     */
    public static final double ANOMALY_THRESHOLD = 1.0;
}
