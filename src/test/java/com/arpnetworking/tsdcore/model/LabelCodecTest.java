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

import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tests for the {@link LabelCodec} class.
 */
public class LabelCodecTest {

    @Test
    public void testRoundTrip() {
        final ImmutableMap<String, String> labels = ImmutableMap.of("job", "a", "instance", "h1");
        Assert.assertEquals(labels, CODEC.decode(CODEC.encode(labels)));
    }

    @Test
    public void testEncodeIsOrderIndependent() {
        final Map<String, String> forward = new LinkedHashMap<>();
        forward.put("a", "1");
        forward.put("b", "2");
        final Map<String, String> reverse = new LinkedHashMap<>();
        reverse.put("b", "2");
        reverse.put("a", "1");
        Assert.assertEquals(CODEC.encode(forward), CODEC.encode(reverse));
        Assert.assertEquals("{\"a\":\"1\",\"b\":\"2\"}", CODEC.encode(forward).getId());
    }

    @Test
    public void testDistinctLabelSetsEncodeDistinctly() {
        Assert.assertNotEquals(
                CODEC.encode(ImmutableMap.of("job", "a")),
                CODEC.encode(ImmutableMap.of("job", "b")));
    }

    @Test
    public void testEmptyLabels() {
        final SeriesId seriesId = CODEC.encode(ImmutableMap.of());
        Assert.assertEquals(LabelCodec.EMPTY_LABELS_ID, seriesId.getId());
        Assert.assertTrue(CODEC.decode(seriesId).isEmpty());
    }

    @Test
    public void testDecodeMalformed() {
        Assert.assertEquals(
                ImmutableMap.of(LabelCodec.FALLBACK_LABEL, "not-json"),
                CODEC.decode(SeriesId.of("not-json")));
    }

    @Test
    public void testDecodeNonObject() {
        Assert.assertEquals(
                ImmutableMap.of(LabelCodec.FALLBACK_LABEL, "[1,2]"),
                CODEC.decode(SeriesId.of("[1,2]")));
    }

    @Test
    public void testDecodeNestedValue() {
        final String id = "{\"a\":{\"b\":\"c\"}}";
        Assert.assertEquals(ImmutableMap.of(LabelCodec.FALLBACK_LABEL, id), CODEC.decode(SeriesId.of(id)));
    }

    @Test
    public void testDecodeScalarValues() {
        Assert.assertEquals(
                ImmutableMap.of("code", "200", "ok", "true"),
                CODEC.decode(SeriesId.of("{\"code\":200,\"ok\":true}")));
    }

    @Test
    public void testValuesWithQuotes() {
        final ImmutableMap<String, String> labels = ImmutableMap.of("path", "/a \"b\",c");
        Assert.assertEquals(labels, CODEC.decode(CODEC.encode(labels)));
    }

    private static final LabelCodec CODEC = new LabelCodec();
}
