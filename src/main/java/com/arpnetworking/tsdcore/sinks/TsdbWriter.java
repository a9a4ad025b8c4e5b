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
package com.arpnetworking.tsdcore.sinks;

import com.arpnetworking.tsdcore.exceptions.TsdbException;
import com.arpnetworking.tsdcore.model.PanelFrame;
import com.google.common.collect.ImmutableMap;

/**
 * Writes a panel to a time series database under a metric name.
 */
public interface TsdbWriter {

    /**
     * Write every observation of the panel. The labels of each row are the
     * labels its series identifier decodes to, merged with the extra labels.
     *
     * @param frame The panel to write.
     * @param metricName The metric name to write under.
     * @param extraLabels Static labels added to every row; they replace
     * decoded labels with the same key.
     * @throws TsdbException if the database rejected or did not receive the write.
     */
    void write(PanelFrame frame, String metricName, ImmutableMap<String, String> extraLabels) throws TsdbException;
}
