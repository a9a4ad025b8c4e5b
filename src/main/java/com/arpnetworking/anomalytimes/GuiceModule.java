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
package com.arpnetworking.anomalytimes;

import com.arpnetworking.anomalytimes.artifacts.ArtifactStore;
import com.arpnetworking.anomalytimes.artifacts.FileSystemArtifactStore;
import com.arpnetworking.anomalytimes.artifacts.ModelArtifactCache;
import com.arpnetworking.anomalytimes.configuration.AnomalyTimesConfiguration;
import com.arpnetworking.anomalytimes.models.ModelRegistry;
import com.arpnetworking.tsdcore.model.LabelCodec;
import com.arpnetworking.tsdcore.sinks.TsdbWriter;
import com.arpnetworking.tsdcore.sinks.VictoriaMetricsCsvWriter;
import com.arpnetworking.tsdcore.sources.PrometheusReader;
import com.arpnetworking.tsdcore.sources.TsdbReader;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.DefaultAsyncHttpClient;
import org.asynchttpclient.DefaultAsyncHttpClientConfig;

import java.time.Clock;

/**
 * The Guice module used to bootstrap anomaly times from its configuration.
 */
public class GuiceModule extends AbstractModule {
    /**
     * Public constructor.
     *
     * @param configuration The configuration.
     */
    public GuiceModule(final AnomalyTimesConfiguration configuration) {
        _configuration = configuration;
    }

    @Override
    protected void configure() {
        bind(AnomalyTimesConfiguration.class).toInstance(_configuration);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private LabelCodec provideLabelCodec() {
        return new LabelCodec();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private AsyncHttpClient provideHttpClient() {
        final DefaultAsyncHttpClientConfig.Builder clientConfigBuilder = new DefaultAsyncHttpClientConfig.Builder();
        clientConfigBuilder.setThreadPoolName("AnomalyTimesHttpWorker");
        clientConfigBuilder.setRequestTimeout((int) _configuration.getRequestTimeout().toMillis());
        return new DefaultAsyncHttpClient(clientConfigBuilder.build());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private TsdbReader provideReader(final AsyncHttpClient httpClient) {
        return new PrometheusReader.Builder()
                .setUri(_configuration.getTsdbUri())
                .setHttpClient(httpClient)
                .setRequestTimeout(_configuration.getRequestTimeout())
                .build();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private TsdbWriter provideWriter(final AsyncHttpClient httpClient, final LabelCodec labelCodec) {
        return new VictoriaMetricsCsvWriter.Builder()
                .setName("victoria-metrics-import")
                .setLabelCodec(labelCodec)
                .setUri(_configuration.getImportUri())
                .setHttpClient(httpClient)
                .setRequestTimeout(_configuration.getRequestTimeout())
                .build();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ArtifactStore provideArtifactStore() {
        return new FileSystemArtifactStore(_configuration.getArtifactDirectory().toPath());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ModelRegistry provideModelRegistry() {
        return ModelRegistry.createDefault();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ModelArtifactCache provideModelArtifactCache(final ArtifactStore store, final Clock clock) {
        return new ModelArtifactCache(store, clock);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private Orchestrator provideOrchestrator(
            final TsdbReader reader,
            final TsdbWriter writer,
            final ModelArtifactCache modelArtifactCache,
            final ModelRegistry modelRegistry,
            final LabelCodec labelCodec,
            final Clock clock) {
        return new Orchestrator.Builder()
                .setReader(reader)
                .setWriter(writer)
                .setModelArtifactCache(modelArtifactCache)
                .setModelRegistry(modelRegistry)
                .setLabelCodec(labelCodec)
                .setClock(clock)
                .build();
    }

    private final AnomalyTimesConfiguration _configuration;
}
