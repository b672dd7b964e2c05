/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracecore.impl;

import co.tracecore.configuration.ExporterConfiguration;
import co.tracecore.configuration.TraceConfiguration;
import co.tracecore.configuration.source.ConfigSources;
import co.tracecore.context.ClosableLifecycleListenerAdapter;
import co.tracecore.context.LifecycleListener;
import co.tracecore.export.DisruptorSpanExporter;
import co.tracecore.export.InMemoryLocalSpanStore;
import co.tracecore.export.InMemoryRunningSpanStore;
import co.tracecore.export.LocalSpanStore;
import co.tracecore.export.LoggingExportHandler;
import co.tracecore.export.RunningSpanStore;
import co.tracecore.export.SpanExporter;
import co.tracecore.logging.LoggingConfiguration;
import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;
import co.tracecore.util.ExecutorUtils;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.ConfigurationSource;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class SpanRecorderBuilder {

    static final int CONFIG_RELOAD_INTERVAL_SECONDS = 30;

    private final Logger logger;

    @Nullable
    private ConfigurationRegistry configurationRegistry;
    @Nullable
    private SpanExporter spanExporter;
    @Nullable
    private RunningSpanStore runningSpanStore;
    @Nullable
    private LocalSpanStore localSpanStore;
    private final List<LifecycleListener> extraLifecycleListeners = new ArrayList<>();
    private final List<ConfigurationSource> configSources;

    /**
     * Reads the configuration from the default sources, see {@link ConfigSources#getDefaultSources(ClassLoader)}
     */
    public SpanRecorderBuilder() {
        this(ConfigSources.getDefaultSources(SpanRecorderBuilder.class.getClassLoader()));
    }

    /**
     * @param configSources configuration sources, highest priority first
     */
    public SpanRecorderBuilder(List<ConfigurationSource> configSources) {
        this.configSources = configSources;
        LoggingConfiguration.init();
        this.logger = LoggerFactory.getLogger(getClass());
    }

    /**
     * Uses the given registry instead of one created from the configuration sources.
     * The registry is then not reloaded periodically.
     */
    public SpanRecorderBuilder configurationRegistry(ConfigurationRegistry configurationRegistry) {
        this.configurationRegistry = configurationRegistry;
        return this;
    }

    public SpanRecorderBuilder spanExporter(SpanExporter spanExporter) {
        this.spanExporter = spanExporter;
        return this;
    }

    public SpanRecorderBuilder runningSpanStore(RunningSpanStore runningSpanStore) {
        this.runningSpanStore = runningSpanStore;
        return this;
    }

    public SpanRecorderBuilder localSpanStore(LocalSpanStore localSpanStore) {
        this.localSpanStore = localSpanStore;
        return this;
    }

    public SpanRecorderBuilder withLifecycleListener(LifecycleListener listener) {
        this.extraLifecycleListeners.add(listener);
        return this;
    }

    /**
     * @return a recorder which produces blank spans until it is {@link SpanRecorder#start() started}
     */
    public SpanRecorder build() {
        return build(false);
    }

    public SpanRecorder buildAndStart() {
        return build(true);
    }

    private SpanRecorder build(boolean start) {
        List<LifecycleListener> lifecycleListeners = new ArrayList<>();
        if (configurationRegistry == null) {
            configurationRegistry = getDefaultConfigurationRegistry(configSources);
            lifecycleListeners.add(scheduleReload(configurationRegistry, CONFIG_RELOAD_INTERVAL_SECONDS, TimeUnit.SECONDS));
        }
        configurationRegistry.getConfig(LoggingConfiguration.class).applyLogLevel();

        ExporterConfiguration exporterConfiguration = configurationRegistry.getConfig(ExporterConfiguration.class);
        if (spanExporter == null) {
            spanExporter = new DisruptorSpanExporter(exporterConfiguration);
        }
        if (exporterConfiguration.isLogExportedSpans()) {
            spanExporter.registerHandler(LoggingExportHandler.NAME, new LoggingExportHandler());
        }
        if (runningSpanStore == null) {
            runningSpanStore = new InMemoryRunningSpanStore();
        }
        if (localSpanStore == null) {
            localSpanStore = new InMemoryLocalSpanStore(exporterConfiguration.getLocalSpanStoreMaxSpansPerName(),
                exporterConfiguration.getLocalSpanStoreMaxSpanNames());
        }
        TraceConfig traceConfig = TraceConfig.fromConfiguration(configurationRegistry.getConfig(TraceConfiguration.class));

        SpanRecorder recorder = new SpanRecorder(configurationRegistry, traceConfig, runningSpanStore, localSpanStore, spanExporter);
        lifecycleListeners.addAll(extraLifecycleListeners);
        recorder.init(lifecycleListeners);
        if (start) {
            recorder.start();
        }
        return recorder;
    }

    private LifecycleListener scheduleReload(final ConfigurationRegistry configurationRegistry, final int interval, TimeUnit unit) {
        final ScheduledExecutorService configurationReloader = ExecutorUtils.scheduleWithFixedDelay("configuration-reloader", new Runnable() {
            @Override
            public void run() {
                logger.debug("Beginning scheduled configuration reload (interval is {} sec)...", interval);
                configurationRegistry.reloadDynamicConfigurationOptions();
                logger.debug("Finished scheduled configuration reload");
            }
        }, interval, unit);
        return ClosableLifecycleListenerAdapter.of(new Closeable() {
            @Override
            public void close() {
                ExecutorUtils.shutdownAndWaitTermination(configurationReloader, 1, TimeUnit.SECONDS);
            }
        });
    }

    private ConfigurationRegistry getDefaultConfigurationRegistry(List<ConfigurationSource> configSources) {
        List<ConfigurationOptionProvider> providers = new ArrayList<>();
        for (ConfigurationOptionProvider provider : ServiceLoader.load(ConfigurationOptionProvider.class, SpanRecorderBuilder.class.getClassLoader())) {
            providers.add(provider);
        }
        logger.debug("Configuration sources: {}", configSources);
        return ConfigurationRegistry.builder()
            .configSources(configSources)
            .optionProviders(providers)
            .build();
    }
}
