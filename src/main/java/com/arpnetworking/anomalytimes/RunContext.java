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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogBuilder;
import com.arpnetworking.steno.LogValueMapFactory;

import java.util.UUID;

/**
 * Identity of one forecast or detection run. It is passed explicitly to every
 * operation of the run and decorates their log messages so that the messages
 * of one run can be correlated.
 */
public final class RunContext {

    /**
     * Create the context of a new run.
     *
     * @param jobName The name of the job being run.
     * @return New {@link RunContext} with a random run id.
     */
    public static RunContext create(final String jobName) {
        return new RunContext(jobName, UUID.randomUUID().toString());
    }

    /**
     * Public constructor.
     *
     * @param jobName The name of the job being run.
     * @param runId The identifier of the run.
     */
    public RunContext(final String jobName, final String runId) {
        _jobName = jobName;
        _runId = runId;
    }

    public String getJobName() {
        return _jobName;
    }

    public String getRunId() {
        return _runId;
    }

    /**
     * Add the run identity to a log message.
     *
     * @param builder The log message being built.
     * @return The same {@link LogBuilder}.
     */
    public LogBuilder decorate(final LogBuilder builder) {
        return builder
                .addData("job", _jobName)
                .addData("runId", _runId);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("job", _jobName)
                .put("runId", _runId)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final String _jobName;
    private final String _runId;
}
