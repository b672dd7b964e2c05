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

import co.tracecore.configuration.TraceConfiguration;
import co.tracecore.context.LifecycleListener;
import co.tracecore.export.LocalSpanStore;
import co.tracecore.export.RunningSpanStore;
import co.tracecore.export.SpanExporter;
import co.tracecore.impl.sampling.Sampler;
import co.tracecore.impl.span.EpochTickClock;
import co.tracecore.impl.span.Id;
import co.tracecore.impl.span.Span;
import co.tracecore.impl.span.SpanAccessor;
import co.tracecore.impl.span.SpanContext;
import co.tracecore.impl.span.SpanData;
import co.tracecore.impl.span.SpanImpl;
import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Starts spans, decides whether they are sampled and recorded,
 * and hands ended spans to the span stores and the exporter.
 * <p>
 * None of the span methods ever throw:
 * when the recorder is not running, blank spans are returned,
 * and failures of samplers, stores and exporters are logged.
 * </p>
 */
public class SpanRecorder {

    private static final Logger logger = LoggerFactory.getLogger(SpanRecorder.class);
    private static final String UNNAMED = "unnamed";

    private final ConfigurationRegistry configurationRegistry;
    private final TraceConfiguration traceConfiguration;
    private final TraceConfig traceConfig;
    private final RunningSpanStore runningSpanStore;
    private final LocalSpanStore localSpanStore;
    private final SpanExporter spanExporter;
    private final List<LifecycleListener> lifecycleListeners = new CopyOnWriteArrayList<>();
    private volatile RecorderState state = RecorderState.UNINITIALIZED;

    public enum RecorderState {
        /**
         * Spans can't be started before {@link #start()}
         */
        UNINITIALIZED,
        RUNNING,
        STOPPED
    }

    SpanRecorder(ConfigurationRegistry configurationRegistry, TraceConfig traceConfig, RunningSpanStore runningSpanStore,
                 LocalSpanStore localSpanStore, SpanExporter spanExporter) {
        this.configurationRegistry = configurationRegistry;
        this.traceConfiguration = configurationRegistry.getConfig(TraceConfiguration.class);
        this.traceConfig = traceConfig;
        this.runningSpanStore = runningSpanStore;
        this.localSpanStore = localSpanStore;
        this.spanExporter = spanExporter;
    }

    /**
     * Starts a root span
     */
    public Span startSpan(@Nullable String name) {
        return startSpan(name, null, StartSpanOptions.DEFAULT);
    }

    /**
     * Starts a span which is a child of a span of this process.
     *
     * @param parent the local parent; if {@code null} or blank, a root span is started
     */
    public Span startSpan(@Nullable String name, @Nullable Span parent) {
        return startSpan(name, parent, StartSpanOptions.DEFAULT);
    }

    public Span startSpan(@Nullable String name, @Nullable Span parent, @Nullable StartSpanOptions options) {
        SpanContext parentContext = parent != null ? parent.getContext() : null;
        return startSpanInternal(name, parentContext, SpanAccessor.getSpanImpl(parent), false, options);
    }

    /**
     * Starts a span which is a child of a span of another process.
     *
     * @param remoteParent the context received from the other process; if {@code null} or invalid, a root span is started
     */
    public Span startSpanWithRemoteParent(@Nullable String name, @Nullable SpanContext remoteParent) {
        return startSpanWithRemoteParent(name, remoteParent, StartSpanOptions.DEFAULT);
    }

    public Span startSpanWithRemoteParent(@Nullable String name, @Nullable SpanContext remoteParent, @Nullable StartSpanOptions options) {
        return startSpanInternal(name, remoteParent, null, true, options);
    }

    private Span startSpanInternal(@Nullable String name, @Nullable SpanContext parentContext, @Nullable SpanImpl localParent,
                                   boolean remoteParent, @Nullable StartSpanOptions options) {
        if (!isRunning()) {
            return Span.blank();
        }
        if (options == null) {
            options = StartSpanOptions.DEFAULT;
        }
        if (name == null) {
            name = UNNAMED;
        }
        final TraceParams traceParams = traceConfig.getActiveTraceParams();
        final boolean hasParent = parentContext != null && parentContext.isValid();

        final Id traceId;
        final Id parentSpanId;
        final String traceState;
        final boolean parentSampled;
        if (hasParent) {
            traceId = parentContext.getTraceId();
            parentSpanId = parentContext.getSpanId();
            traceState = parentContext.getTraceState();
            parentSampled = parentContext.isSampled();
        } else {
            traceId = Id.randomTraceId();
            parentSpanId = null;
            traceState = "";
            parentSampled = false;
        }

        final List<SpanContext> linkContexts = getValidContexts(options.getParentLinks());
        final boolean sampled = parentSampled
            || isSampled(options.getSampler() != null ? options.getSampler() : traceParams.getSampler(), traceId, parentSampled, linkContexts);
        final boolean recording = sampled || options.isRecordEvents();
        final SpanContext context = SpanContext.create(traceId, Id.randomSpanId(), sampled, traceState);

        SpanImpl spanImpl = null;
        if (recording) {
            // all spans of a local trace share the clock of the local root
            EpochTickClock clock = hasParent && localParent != null ? localParent.getClock() : EpochTickClock.create();
            spanImpl = new SpanImpl(context, name, parentSpanId, hasParent && remoteParent, traceParams, clock, this);
        }
        Span span = SpanAccessor.createSpan(context, spanImpl);
        linkSpans(span, options.getParentLinks());
        if (spanImpl != null) {
            onSpanStart(spanImpl);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("startSpan {} (sampled={}, recording={})", span, sampled, recording);
        }
        return span;
    }

    private static List<SpanContext> getValidContexts(List<Span> spans) {
        if (spans.isEmpty()) {
            return Collections.emptyList();
        }
        List<SpanContext> contexts = new ArrayList<>(spans.size());
        for (Span span : spans) {
            if (span.getContext().isValid()) {
                contexts.add(span.getContext());
            }
        }
        return contexts;
    }

    /**
     * Fails closed: a missing or failing sampler means the span is not sampled.
     */
    private boolean isSampled(@Nullable Sampler sampler, Id traceId, boolean parentSampled, List<SpanContext> linkContexts) {
        if (sampler == null) {
            logger.debug("No sampler available, span is not sampled");
            return false;
        }
        try {
            return sampler.isSampled(traceId, parentSampled, linkContexts);
        } catch (RuntimeException e) {
            logger.warn("Sampler " + sampler + " failed, span is not sampled", e);
            return false;
        }
    }

    /**
     * The new span records a parent link to each link parent, and each recording link parent records a child link back.
     */
    private static void linkSpans(Span span, List<Span> parentLinks) {
        for (Span linkParent : parentLinks) {
            if (!linkParent.getContext().isValid()) {
                continue;
            }
            linkParent.addChildLink(span.getContext());
            span.addParentLink(linkParent.getContext());
        }
    }

    private void onSpanStart(SpanImpl span) {
        try {
            runningSpanStore.onStart(span);
        } catch (Exception e) {
            logger.warn("Failed to register running span " + span, e);
        }
    }

    /**
     * Called by {@link SpanImpl#end()} after the span has been frozen.
     *
     * @param spanData the frozen record of {@code span}
     */
    public void endSpan(SpanImpl span, SpanData spanData) {
        if (logger.isDebugEnabled()) {
            logger.debug("endSpan {}", span);
            if (logger.isTraceEnabled()) {
                logger.trace("ending span at", new RuntimeException("this exception is just used to record where the span has been ended from"));
            }
        }
        try {
            runningSpanStore.onEnd(span);
        } catch (Exception e) {
            logger.warn("Failed to deregister running span " + span, e);
        }
        if (!span.getContext().isSampled()) {
            return;
        }
        try {
            localSpanStore.considerForSampleStore(spanData);
        } catch (Exception e) {
            logger.warn("Failed to store span " + span, e);
        }
        try {
            spanExporter.export(spanData);
        } catch (Exception e) {
            logger.warn("Failed to export span " + span, e);
        }
    }

    void init(List<LifecycleListener> listeners) {
        lifecycleListeners.addAll(listeners);
    }

    public synchronized void start() {
        if (state != RecorderState.UNINITIALIZED) {
            logger.debug("Span recorder is already {}", state);
            return;
        }
        spanExporter.start();
        state = RecorderState.RUNNING;
        for (LifecycleListener lifecycleListener : lifecycleListeners) {
            try {
                lifecycleListener.start(this);
            } catch (Exception e) {
                logger.error("Failed to start " + lifecycleListener.getClass().getName(), e);
            }
        }
        logger.info("Span recorder switched to RUNNING state");
    }

    public synchronized void stop() {
        if (state == RecorderState.STOPPED) {
            return;
        }
        state = RecorderState.STOPPED;
        for (LifecycleListener lifecycleListener : lifecycleListeners) {
            try {
                lifecycleListener.stop();
            } catch (Exception e) {
                logger.warn("Suppressed exception while calling stop()", e);
            }
        }
        try {
            spanExporter.close();
            configurationRegistry.close();
        } catch (Exception e) {
            logger.warn("Suppressed exception while calling stop()", e);
        }
        logger.info("Span recorder switched to STOPPED state");
    }

    /**
     * @return {@code true} if the recorder has been started, not stopped, and recording is enabled
     */
    public boolean isRunning() {
        return state == RecorderState.RUNNING && traceConfiguration.isRecording();
    }

    public RecorderState getState() {
        return state;
    }

    public <T extends ConfigurationOptionProvider> T getConfig(Class<T> configProvider) {
        return configurationRegistry.getConfig(configProvider);
    }

    public ConfigurationRegistry getConfigurationRegistry() {
        return configurationRegistry;
    }

    public TraceConfig getTraceConfig() {
        return traceConfig;
    }

    public RunningSpanStore getRunningSpanStore() {
        return runningSpanStore;
    }

    public LocalSpanStore getLocalSpanStore() {
        return localSpanStore;
    }

    public SpanExporter getSpanExporter() {
        return spanExporter;
    }
}
