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

import com.arpnetworking.anomalytimes.artifacts.ArtifactStore;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;

/**
 * Creates and restores {@link Model} instances of one model type.
 */
public interface ModelFactory {

    /**
     * The model-type tag this factory is registered under.
     *
     * @return The model type.
     */
    String getType();

    /**
     * Create a new, unfitted model.
     *
     * @param parameters Model specific parameters.
     * @return New {@link Model}.
     */
    Model create(ImmutableMap<String, Object> parameters);

    /**
     * Restore a fitted model previously saved with {@link Model#save(ArtifactStore, String)}.
     *
     * @param store The artifact store.
     * @param key The artifact key.
     * @return The restored {@link Model}.
     * @throws IOException if the artifact could not be read or is not a model of this type.
     */
    Model load(ArtifactStore store, String key) throws IOException;
}
