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
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.Optional;

/**
 * The components present for one (series, timestamp) key of a
 * {@link CompositeFrame}. A component that none of the joined panels carried
 * for the key is absent; it is never defaulted.
 */
@Loggable
public final class CompositeRecord {

    /**
     * Public constructor.
     *
     * @param components The present components by name.
     */
    public CompositeRecord(final ImmutableMap<String, Double> components) {
        _components = components;
    }

    /**
     * Look up one component.
     *
     * @param name The component name.
     * @return The value if the component is present.
     */
    public Optional<Double> get(final String name) {
        return Optional.ofNullable(_components.get(name));
    }

    /**
     * Whether every named component is present.
     *
     * @param names The component names.
     * @return True if and only if all components are present.
     */
    public boolean hasAll(final Collection<String> names) {
        return _components.keySet().containsAll(names);
    }

    public ImmutableMap<String, Double> getComponents() {
        return _components;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final CompositeRecord other = (CompositeRecord) object;
        return _components.equals(other._components);
    }

    @Override
    public int hashCode() {
        return _components.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Components", _components)
                .toString();
    }

    private final ImmutableMap<String, Double> _components;
}
