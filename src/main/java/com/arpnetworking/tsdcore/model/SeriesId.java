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

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.Preconditions;

import java.io.Serial;
import java.io.Serializable;

/**
 * Opaque identifier of a single time series. Instances are created by
 * {@link LabelCodec} from a label set and are used as the join and group key
 * across independently fetched panels.
 *
 * Ordering is lexicographic on the identifier text.
 */
@Loggable
public final class SeriesId implements Comparable<SeriesId>, Serializable {

    /**
     * Wrap an existing identifier string.
     *
     * @param id The identifier text. Cannot be null or empty.
     * @return New instance of {@link SeriesId}.
     */
    public static SeriesId of(final String id) {
        Preconditions.checkArgument(id != null && !id.isEmpty(), "Series id cannot be null or empty");
        return new SeriesId(id);
    }

    public String getId() {
        return _id;
    }

    @Override
    public int compareTo(final SeriesId other) {
        return _id.compareTo(other._id);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof SeriesId)) {
            return false;
        }
        final SeriesId other = (SeriesId) object;
        return _id.equals(other._id);
    }

    @Override
    public int hashCode() {
        return _id.hashCode();
    }

    @Override
    public String toString() {
        return _id;
    }

    private SeriesId(final String id) {
        _id = id;
    }

    private final String _id;

    @Serial
    private static final long serialVersionUID = 4109873460517651301L;
}
