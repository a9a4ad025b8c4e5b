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

import java.util.Optional;

/**
 * Result of resolving a cache key: the derived state, the action to take and,
 * for {@link CacheAction#LOAD}, the artifact to load.
 */
@Loggable
public final class CacheEntry {

    /**
     * An entry requiring a refit.
     *
     * @param state The derived state; must map to {@link CacheAction#REFIT}.
     * @return New {@link CacheEntry}.
     */
    public static CacheEntry refit(final CacheState state) {
        if (state.getAction() != CacheAction.REFIT) {
            throw new IllegalArgumentException(String.format("State does not refit; state=%s", state));
        }
        return new CacheEntry(state, Optional.empty());
    }

    /**
     * An entry loading a fresh artifact.
     *
     * @param artifact The artifact to load.
     * @return New {@link CacheEntry}.
     */
    public static CacheEntry load(final ArtifactMetadata artifact) {
        return new CacheEntry(CacheState.FRESH, Optional.of(artifact));
    }

    public CacheState getState() {
        return _state;
    }

    public CacheAction getAction() {
        return _state.getAction();
    }

    public Optional<ArtifactMetadata> getArtifact() {
        return _artifact;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final CacheEntry other = (CacheEntry) object;
        return _state == other._state
                && Objects.equal(_artifact, other._artifact);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_state, _artifact);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("State", _state)
                .add("Action", getAction())
                .add("Artifact", _artifact)
                .toString();
    }

    private CacheEntry(final CacheState state, final Optional<ArtifactMetadata> artifact) {
        _state = state;
        _artifact = artifact;
    }

    private final CacheState _state;
    private final Optional<ArtifactMetadata> _artifact;
}
