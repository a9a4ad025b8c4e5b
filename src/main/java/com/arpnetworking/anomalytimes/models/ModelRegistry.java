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
package com.arpnetworking.anomalytimes.models;

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

import java.util.Map;
import java.util.Optional;

/**
 * Maps model-type tags to the {@link ModelFactory} implementations compiled
 * into the application. The registry is assembled explicitly at startup.
 */
public final class ModelRegistry {

    /**
     * The registry of the model types shipped with the application.
     *
     * @return New {@link ModelRegistry}.
     */
    public static ModelRegistry createDefault() {
        return new Builder()
                .register(new MovingAverageModel.Factory())
                .build();
    }

    /**
     * Get the factory for a model type.
     *
     * @param type The model-type tag.
     * @return The registered {@link ModelFactory}.
     * @throws IllegalArgumentException if no factory is registered for the type.
     */
    public ModelFactory getFactory(final String type) {
        final Optional<ModelFactory> factory = tryGetFactory(type);
        if (!factory.isPresent()) {
            throw new IllegalArgumentException(
                    String.format("Unknown model type; type=%s, known=%s", type, getTypes()));
        }
        return factory.get();
    }

    /**
     * Get the factory for a model type.
     *
     * @param type The model-type tag.
     * @return The registered {@link ModelFactory} if any.
     */
    public Optional<ModelFactory> tryGetFactory(final String type) {
        return Optional.ofNullable(_factories.get(type));
    }

    public ImmutableSortedSet<String> getTypes() {
        return _factories.keySet();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("types", getTypes())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private ModelRegistry(final Builder builder) {
        _factories = ImmutableSortedMap.copyOf(builder._factories);
    }

    private final ImmutableSortedMap<String, ModelFactory> _factories;

    /**
     * Builder for {@link ModelRegistry}.
     */
    public static final class Builder {

        /**
         * Register a factory under its type.
         *
         * @param factory The factory.
         * @return This instance of {@link Builder}.
         * @throws IllegalArgumentException if the type is already registered.
         */
        public Builder register(final ModelFactory factory) {
            final ModelFactory existing = _factories.putIfAbsent(factory.getType(), factory);
            if (existing != null) {
                throw new IllegalArgumentException(String.format(
                        "Model type already registered; type=%s, existing=%s, new=%s",
                        factory.getType(),
                        existing,
                        factory));
            }
            return this;
        }

        /**
         * Create the {@link ModelRegistry}.
         *
         * @return New {@link ModelRegistry}.
         */
        public ModelRegistry build() {
            return new ModelRegistry(this);
        }

        private final Map<String, ModelFactory> _factories = Maps.newHashMap();
    }
}
