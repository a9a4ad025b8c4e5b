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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link ArtifactStore} over a directory. Keys are paths relative to the root
 * directory, absolute paths, or {@code file:} URIs. Artifacts are written to
 * a temporary file next to the target and atomically moved into place, so a
 * reader never observes a partially written artifact.
 */
public final class FileSystemArtifactStore implements ArtifactStore {

    /**
     * Public constructor.
     *
     * @param root The directory relative keys are resolved against.
     */
    public FileSystemArtifactStore(final Path root) {
        _root = root;
    }

    @Override
    public Optional<ArtifactMetadata> stat(final String key) throws IOException {
        final Path path = resolve(key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(new ArtifactMetadata(key, Files.getLastModifiedTime(path).toInstant()));
    }

    @Override
    public byte[] read(final String key) throws IOException {
        return Files.readAllBytes(resolve(key));
    }

    @Override
    public void write(final String key, final byte[] artifact) throws IOException {
        final Path path = resolve(key);
        final Path directory = path.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        final Path temporary = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
        try {
            Files.write(temporary, artifact);
            Files.move(temporary, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temporary);
        }
        LOGGER.debug()
                .setMessage("Wrote artifact")
                .addData("key", key)
                .addData("path", path)
                .addData("bytes", artifact.length)
                .log();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("root", _root)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    Path resolve(final String key) {
        if (key.startsWith(FILE_SCHEME)) {
            return Paths.get(URI.create(key));
        }
        return _root.resolve(key).normalize();
    }

    private final Path _root;

    private static final String FILE_SCHEME = "file:";
    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemArtifactStore.class);
}
