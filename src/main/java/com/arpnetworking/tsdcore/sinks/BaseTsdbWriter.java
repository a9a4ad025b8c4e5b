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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.exceptions.TsdbException;
import com.arpnetworking.tsdcore.model.LabelCodec;
import com.arpnetworking.tsdcore.model.Observation;
import com.arpnetworking.tsdcore.model.PanelFrame;
import com.arpnetworking.tsdcore.model.SeriesId;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.Map;
import java.util.function.Function;

/**
 * Common behavior of {@link TsdbWriter} implementations: turning a panel
 * into {@link ImportRow}s. Series identifiers that cannot be decoded are
 * written with the fallback label set of {@link LabelCodec}; they never fail
 * the batch.
 */
public abstract class BaseTsdbWriter implements TsdbWriter {

    @Override
    public void write(
            final PanelFrame frame,
            final String metricName,
            final ImmutableMap<String, String> extraLabels) throws TsdbException {
        if (frame.isEmpty()) {
            LOGGER.debug()
                    .setMessage("Empty panel, skipping write")
                    .addData("writer", _name)
                    .addData("metric", metricName)
                    .log();
            return;
        }
        final ImmutableList<ImportRow> rows = createImportRows(frame, metricName, extraLabels);
        writeRows(metricName, rows);
        LOGGER.debug()
                .setMessage("Wrote rows")
                .addData("writer", _name)
                .addData("metric", metricName)
                .addData("rows", rows.size())
                .log();
    }

    /**
     * Convert a panel into import rows.
     *
     * @param frame The panel.
     * @param metricName The metric name of every row.
     * @param extraLabels Labels merged into every row, replacing decoded labels with the same key.
     * @return The import rows ordered like the panel.
     */
    public ImmutableList<ImportRow> createImportRows(
            final PanelFrame frame,
            final String metricName,
            final ImmutableMap<String, String> extraLabels) {
        final Map<SeriesId, ImmutableMap<String, String>> labelsBySeries = Maps.newHashMap();
        final ImmutableList.Builder<ImportRow> rows = ImmutableList.builderWithExpectedSize(frame.size());
        for (final Observation observation : frame.getObservations()) {
            final ImmutableMap<String, String> labels = labelsBySeries.computeIfAbsent(
                    observation.getSeriesId(),
                    seriesId -> ImmutableMap.<String, String>builder()
                            .putAll(_labelCodec.decode(seriesId))
                            .putAll(extraLabels)
                            .buildKeepingLast());
            rows.add(new ImportRow(observation.getTimestamp(), observation.getValue(), metricName, labels));
        }
        return rows.build();
    }

    public String getName() {
        return _name;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("name", _name)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    /**
     * Send the rows to the database.
     *
     * @param metricName The metric name of the rows.
     * @param rows The rows; never empty.
     * @throws TsdbException if the write failed.
     */
    protected abstract void writeRows(String metricName, ImmutableList<ImportRow> rows) throws TsdbException;

    /**
     * Protected constructor.
     *
     * @param builder Instance of {@link Builder}.
     */
    protected BaseTsdbWriter(final Builder<?, ?> builder) {
        _name = builder._name;
        _labelCodec = builder._labelCodec;
    }

    private final String _name;
    private final LabelCodec _labelCodec;

    private static final Logger LOGGER = LoggerFactory.getLogger(BaseTsdbWriter.class);

    /**
     * Base {@link com.arpnetworking.commons.builder.Builder} for subclasses of {@link BaseTsdbWriter}.
     *
     * @param <B> type of the builder
     * @param <W> type of the object to be built
     */
    public abstract static class Builder<B extends Builder<B, W>, W extends BaseTsdbWriter> extends OvalBuilder<W> {

        /**
         * Sets the name of the writer. Required. Cannot be null or empty.
         *
         * @param value The name.
         * @return This instance of {@link Builder}.
         */
        public B setName(final String value) {
            _name = value;
            return self();
        }

        /**
         * Sets the codec decoding series identifiers into labels. Optional. Cannot be null.
         * Default is a new {@link LabelCodec}.
         *
         * @param value The codec.
         * @return This instance of {@link Builder}.
         */
        public B setLabelCodec(final LabelCodec value) {
            _labelCodec = value;
            return self();
        }

        /**
         * Called by setters to always return appropriate subclass of
         * {@link Builder}, even from setters of base class.
         *
         * @return instance with correct {@link Builder} class type.
         */
        protected abstract B self();

        /**
         * Protected constructor for subclasses.
         *
         * @param targetConstructor The constructor for the concrete type to be created by this builder.
         */
        protected Builder(final Function<B, W> targetConstructor) {
            super(targetConstructor);
        }

        @NotNull
        @NotEmpty
        private String _name;
        @NotNull
        private LabelCodec _labelCodec = new LabelCodec();
    }
}
