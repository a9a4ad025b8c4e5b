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

import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Iterator;
import java.util.Map;

/**
 * Bidirectional mapping between a label set and a {@link SeriesId}.
 *
 * The identifier is the label set with its keys sorted lexicographically,
 * rendered as compact JSON, e.g. {@code {"instance":"h1","job":"a"}}. Two label
 * sets with the same pairs always encode to the same identifier regardless of
 * insertion order. The empty label set encodes to {@link #EMPTY_LABELS_ID}.
 *
 * Decoding never fails. Identifiers that are not in the canonical form decode
 * to a single entry label set {@code {"series_id": <id>}}.
 *
 * This class is thread safe.
 */
public final class LabelCodec {

    /**
     * Public constructor.
     */
    public LabelCodec() {
        this(ObjectMapperFactory.getInstance());
    }

    /**
     * Public constructor.
     *
     * @param objectMapper The {@link ObjectMapper} used to render and parse identifiers.
     */
    public LabelCodec(final ObjectMapper objectMapper) {
        _objectMapper = objectMapper;
    }

    /**
     * Encode a label set into its {@link SeriesId}.
     *
     * @param labels The label set.
     * @return The deterministic {@link SeriesId} for the label set.
     */
    public SeriesId encode(final Map<String, String> labels) {
        if (labels.isEmpty()) {
            return EMPTY_LABELS_SERIES_ID;
        }
        final ImmutableSortedMap<String, String> sorted = ImmutableSortedMap.copyOf(labels);
        try {
            return SeriesId.of(_objectMapper.writeValueAsString(sorted));
        } catch (final JsonProcessingException e) {
            // Serializing a map of strings cannot fail in practice
            throw new IllegalStateException("Unable to encode labels", e);
        }
    }

    /**
     * Decode a {@link SeriesId} back into its label set.
     *
     * @param seriesId The series identifier.
     * @return The label set, or the fallback label set if the identifier is
     * not in canonical form.
     */
    public ImmutableMap<String, String> decode(final SeriesId seriesId) {
        final String id = seriesId.getId();
        if (EMPTY_LABELS_ID.equals(id)) {
            return ImmutableMap.of();
        }
        try {
            final JsonNode node = _objectMapper.readTree(id);
            if (node == null || !node.isObject()) {
                return fallback(id);
            }
            final ImmutableMap.Builder<String, String> labels = ImmutableMap.builder();
            final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                final JsonNode value = field.getValue();
                if (!value.isValueNode() || value.isNull()) {
                    return fallback(id);
                }
                labels.put(field.getKey(), value.asText());
            }
            return labels.buildKeepingLast();
        } catch (final JsonProcessingException e) {
            LOGGER.debug()
                    .setMessage("Series id is not in canonical form")
                    .addData("seriesId", id)
                    .setThrowable(e)
                    .log();
            return fallback(id);
        }
    }

    private static ImmutableMap<String, String> fallback(final String id) {
        return ImmutableMap.of(FALLBACK_LABEL, id);
    }

    private final ObjectMapper _objectMapper;

    /**
     * Identifier of the empty label set.
     */
    public static final String EMPTY_LABELS_ID = "series_0";
    /**
     * Label key used when an identifier cannot be decoded.
     */
    public static final String FALLBACK_LABEL = "series_id";

    private static final SeriesId EMPTY_LABELS_SERIES_ID = SeriesId.of(EMPTY_LABELS_ID);
    private static final Logger LOGGER = LoggerFactory.getLogger(LabelCodec.class);
}
