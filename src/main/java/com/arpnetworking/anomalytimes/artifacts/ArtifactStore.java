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

import java.io.IOException;
import java.util.Optional;

/**
 * Storage of serialized model artifacts addressed by caller supplied keys.
 * An artifact is never modified in place; writing a key supersedes the
 * previous artifact at that key.
 *
 * There is no locking across processes. Two writers of the same key race and
 * the last writer wins.
 */
public interface ArtifactStore {

    /**
     * Describe the artifact at a key.
     *
     * @param key The artifact key.
     * @return The metadata of the artifact, or empty if there is none.
     * @throws IOException if the store could not be probed.
     */
    Optional<ArtifactMetadata> stat(String key) throws IOException;

    /**
     * Read the artifact at a key.
     *
     * @param key The artifact key.
     * @return The serialized artifact.
     * @throws IOException if the artifact is missing or could not be read.
     */
    byte[] read(String key) throws IOException;

    /**
     * Store an artifact at a key, superseding any existing artifact.
     *
     * @param key The artifact key.
     * @param artifact The serialized artifact.
     * @throws IOException if the artifact could not be stored.
     */
    void write(String key, byte[] artifact) throws IOException;
}
