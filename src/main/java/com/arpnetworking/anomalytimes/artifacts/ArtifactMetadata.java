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
package com.arpnetworking.anomalytimes.artifacts;

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import java.time.Instant;

/**
 * Key and last modification time of a stored artifact.
 */
@Loggable
public final class ArtifactMetadata {

    /**
     * Public constructor.
     *
     * @param key The artifact key.
     * @param lastModified When the artifact was last written.
     */
    public ArtifactMetadata(final String key, final Instant lastModified) {
        _key = key;
        _lastModified = lastModified;
    }

    public String getKey() {
        return _key;
    }

    public Instant getLastModified() {
        return _lastModified;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final ArtifactMetadata other = (ArtifactMetadata) object;
        return Objects.equal(_key, other._key)
                && Objects.equal(_lastModified, other._lastModified);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_key, _lastModified);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Key", _key)
                .add("LastModified", _lastModified)
                .toString();
    }

    private final String _key;
    private final Instant _lastModified;
}
