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

import com.arpnetworking.anomalytimes.RunContext;
import com.arpnetworking.anomalytimes.models.Model;
import com.arpnetworking.anomalytimes.models.ModelFactory;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.model.PanelFrame;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Striped;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Cache of fitted model artifacts with time based expiration. For a key it
 * either loads the stored artifact, when that is younger than the
 * expiration, or creates a new model, fits it and stores it.
 *
 * Failures never fail the caller's run: probing the store or loading the
 * artifact falls back to refitting, and a failed save leaves the freshly fit
 * model in use for this run only.
 *
 * Resolutions of the same key are serialized within this instance. Nothing
 * coordinates separate processes; two deployments refitting the same key
 * concurrently race and the last save wins. Keys are used as given; two
 * deployments configured with the same key share and overwrite one artifact.
 */
public final class ModelArtifactCache {

    /**
     * Public constructor.
     *
     * @param store The artifact store.
     * @param clock The clock artifact ages are measured with.
     */
    public ModelArtifactCache(final ArtifactStore store, final Clock clock) {
        _store = store;
        _clock = clock;
    }

    /**
     * Decide whether to load or refit the model at a key. The state is
     * recomputed from the store on every call.
     *
     * @param key The artifact key.
     * @param expiration The maximum age of a loadable artifact.
     * @param context The run being served.
     * @return The {@link CacheEntry}.
     */
    public CacheEntry resolve(final String key, final Duration expiration, final RunContext context) {
        final Optional<ArtifactMetadata> artifact;
        try {
            artifact = _store.stat(key);
            // CHECKSTYLE.OFF: IllegalCatch - Any probe failure degrades to a refit
        } catch (final IOException | RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
            context.decorate(LOGGER.warn())
                    .setMessage("Error checking artifact store, proceeding to fit")
                    .addData("key", key)
                    .setThrowable(e)
                    .log();
            return CacheEntry.refit(CacheState.UNKNOWN);
        }

        if (!artifact.isPresent()) {
            context.decorate(LOGGER.info())
                    .setMessage("No existing model, fitting new")
                    .addData("key", key)
                    .log();
            return CacheEntry.refit(CacheState.NO_ENTRY);
        }

        final Duration age = Duration.between(artifact.get().getLastModified(), _clock.instant());
        if (age.compareTo(expiration) < 0) {
            context.decorate(LOGGER.info())
                    .setMessage("Found valid model, loading")
                    .addData("key", key)
                    .addData("age", age)
                    .log();
            return CacheEntry.load(artifact.get());
        }
        context.decorate(LOGGER.info())
                .setMessage("Model expired, refitting")
                .addData("key", key)
                .addData("age", age)
                .addData("expiration", expiration)
                .log();
        return CacheEntry.refit(CacheState.STALE);
    }

    /**
     * Produce a fitted model: load it from the store or create, fit and
     * store a new one. Without a key the model is always fit and never
     * stored.
     *
     * @param factory The factory of the model type.
     * @param parameters The parameters of a newly created model.
     * @param contextFrame The panel a new model is fit against.
     * @param key The artifact key, if artifacts are kept.
     * @param expiration The maximum age of a loadable artifact.
     * @param context The run being served.
     * @return The fitted {@link Model}.
     */
    public Model resolveModel(
            final ModelFactory factory,
            final ImmutableMap<String, Object> parameters,
            final PanelFrame contextFrame,
            final Optional<String> key,
            final Duration expiration,
            final RunContext context) {
        if (!key.isPresent()) {
            return fit(factory, parameters, contextFrame, context);
        }

        final Lock lock = _locks.get(key.get());
        lock.lock();
        try {
            final CacheEntry entry = resolve(key.get(), expiration, context);
            if (entry.getAction() == CacheAction.LOAD) {
                final Optional<Model> model = load(factory, key.get(), context);
                if (model.isPresent()) {
                    return model.get();
                }
            }
            final Model model = fit(factory, parameters, contextFrame, context);
            save(model, key.get(), context);
            return model;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("store", _store)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private Optional<Model> load(final ModelFactory factory, final String key, final RunContext context) {
        try {
            return Optional.of(factory.load(_store, key));
            // CHECKSTYLE.OFF: IllegalCatch - Any load failure degrades to a refit
        } catch (final IOException | RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
            context.decorate(LOGGER.warn())
                    .setMessage("Failed to load model, proceeding to fit")
                    .addData("key", key)
                    .addData("type", factory.getType())
                    .setThrowable(e)
                    .log();
            return Optional.empty();
        }
    }

    private Model fit(
            final ModelFactory factory,
            final ImmutableMap<String, Object> parameters,
            final PanelFrame contextFrame,
            final RunContext context) {
        context.decorate(LOGGER.info())
                .setMessage("Fitting model")
                .addData("type", factory.getType())
                .addData("context", contextFrame)
                .log();
        final Model model = factory.create(parameters);
        model.fit(contextFrame);
        return model;
    }

    private void save(final Model model, final String key, final RunContext context) {
        context.decorate(LOGGER.info())
                .setMessage("Saving model")
                .addData("key", key)
                .log();
        try {
            model.save(_store, key);
            // CHECKSTYLE.OFF: IllegalCatch - The fitted model remains usable without its artifact
        } catch (final IOException | RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
            context.decorate(LOGGER.error())
                    .setMessage("Failed to save model")
                    .addData("key", key)
                    .setThrowable(e)
                    .log();
        }
    }

    private final ArtifactStore _store;
    private final Clock _clock;
    private final Striped<Lock> _locks = Striped.lock(LOCK_STRIPES);

    private static final int LOCK_STRIPES = 64;
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelArtifactCache.class);
}
