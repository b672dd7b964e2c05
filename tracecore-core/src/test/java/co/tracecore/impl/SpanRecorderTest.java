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

import co.tracecore.MockSpanExporter;
import co.tracecore.MockSpanRecorder;
import co.tracecore.configuration.SpyConfiguration;
import co.tracecore.configuration.TraceConfiguration;
import co.tracecore.export.RunningSpanStore;
import co.tracecore.impl.sampling.ConstantSampler;
import co.tracecore.impl.sampling.Sampler;
import co.tracecore.impl.span.Id;
import co.tracecore.impl.span.Link;
import co.tracecore.impl.span.Span;
import co.tracecore.impl.span.SpanAccessor;
import co.tracecore.impl.span.SpanContext;
import co.tracecore.impl.span.SpanData;
import co.tracecore.impl.span.SpanImpl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.ConfigurationRegistry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpanRecorderTest {

    private static final StartSpanOptions NEVER_SAMPLE = StartSpanOptions.builder().sampler(ConstantSampler.of(false)).build();
    private static final StartSpanOptions ALWAYS_SAMPLE = StartSpanOptions.builder().sampler(ConstantSampler.of(true)).build();

    private ConfigurationRegistry config;
    private MockSpanExporter exporter;
    private SpanRecorder recorder;

    @BeforeEach
    void setUp() {
        config = SpyConfiguration.createSpyConfig();
        exporter = new MockSpanExporter();
        recorder = MockSpanRecorder.createRealRecorder(exporter, config);
    }

    @AfterEach
    void tearDown() {
        recorder.stop();
    }

    @Test
    void testRootSpanNotSampledIsNotRecorded() {
        Span span = recorder.startSpan("root", null, NEVER_SAMPLE);

        assertThat(span.getContext().isValid()).isTrue();
        assertThat(span.isSampled()).isFalse();
        assertThat(span.isRecording()).isFalse();
        assertThat(recorder.getRunningSpanStore().getSummary()).isEmpty();

        span.end();
        assertThat(exporter.getSpans()).isEmpty();
    }

    @Test
    void testRootSpanSampled() {
        Span span = recorder.startSpan("root", null, ALWAYS_SAMPLE);

        assertThat(span.isSampled()).isTrue();
        assertThat(span.isRecording()).isTrue();
        assertThat(recorder.getRunningSpanStore().getSummary()).containsEntry("root", 1);

        span.addAttribute("key", "value");
        span.end();

        assertThat(recorder.getRunningSpanStore().getSummary()).isEmpty();
        SpanData spanData = exporter.getFirstSpan();
        assertThat(spanData.getName()).isEqualTo("root");
        assertThat(spanData.getContext()).isEqualTo(span.getContext());
        assertThat(spanData.getParentSpanId()).isNull();
        assertThat(spanData.isEnded()).isTrue();
        assertThat(spanData.getAttributes()).containsOnlyKeys("key");
        assertThat(recorder.getLocalSpanStore().getSpans("root")).containsExactly(spanData);
    }

    @Test
    void testDefaultSamplerNotSamplingRootSpan() throws Exception {
        config.getConfig(TraceConfiguration.class).getSampleRate().update(0.0, SpyConfiguration.CONFIG_SOURCE_NAME);

        Span span = recorder.startSpan("op");

        assertThat(span.isRecording()).isFalse();
        assertThat(span.isSampled()).isFalse();
        assertThat(recorder.getRunningSpanStore().getSummary()).isEmpty();
    }

    @Test
    void testDefaultSamplerFromConfiguration() throws Exception {
        config.getConfig(TraceConfiguration.class).getSampleRate().update(1.0, SpyConfiguration.CONFIG_SOURCE_NAME);
        assertThat(recorder.startSpan("sampled").isSampled()).isTrue();

        config.getConfig(TraceConfiguration.class).getSampleRate().update(0.0, SpyConfiguration.CONFIG_SOURCE_NAME);
        assertThat(recorder.startSpan("not sampled").isSampled()).isFalse();
    }

    @Test
    void testSampledLocalParentWinsOverSampler() {
        Span parent = recorder.startSpan("parent", null, ALWAYS_SAMPLE);
        Span child = recorder.startSpan("child", parent, NEVER_SAMPLE);

        assertThat(child.isSampled()).isTrue();
        assertThat(child.isRecording()).isTrue();
        assertThat(child.getContext().isSameTrace(parent.getContext())).isTrue();
        assertThat(child.getContext().getSpanId()).isNotEqualTo(parent.getContext().getSpanId());

        SpanImpl childImpl = SpanAccessor.getSpanImpl(child);
        SpanImpl parentImpl = SpanAccessor.getSpanImpl(parent);
        assertThat(childImpl.getParentSpanId()).isEqualTo(parent.getContext().getSpanId());
        assertThat(childImpl.hasRemoteParent()).isFalse();
        assertThat(childImpl.getClock()).isSameAs(parentImpl.getClock());
    }

    @Test
    void testNotSampledLocalParentConsultsSampler() {
        Span parent = recorder.startSpan("parent", null, NEVER_SAMPLE);
        Span child = recorder.startSpan("child", parent, ALWAYS_SAMPLE);

        assertThat(child.isSampled()).isTrue();
        assertThat(child.getContext().isSameTrace(parent.getContext())).isTrue();
    }

    @Test
    void testSampledRemoteParent() {
        SpanContext remoteParent = SpanContext.create(Id.randomTraceId(), Id.randomSpanId(), true, "vendor=value");
        Span span = recorder.startSpanWithRemoteParent("server", remoteParent, NEVER_SAMPLE);

        assertThat(span.isSampled()).isTrue();
        assertThat(span.getContext().getTraceId()).isEqualTo(remoteParent.getTraceId());
        assertThat(span.getContext().getTraceState()).isEqualTo("vendor=value");
        SpanImpl spanImpl = SpanAccessor.getSpanImpl(span);
        assertThat(spanImpl.getParentSpanId()).isEqualTo(remoteParent.getSpanId());
        assertThat(spanImpl.hasRemoteParent()).isTrue();
    }

    @Test
    void testInvalidParentStartsNewTrace() {
        Span span = recorder.startSpanWithRemoteParent("server", SpanContext.INVALID, ALWAYS_SAMPLE);
        assertThat(span.getContext().isValid()).isTrue();
        assertThat(SpanAccessor.getSpanImpl(span).getParentSpanId()).isNull();
        assertThat(SpanAccessor.getSpanImpl(span).hasRemoteParent()).isFalse();

        Span child = recorder.startSpan("child", Span.blank(), ALWAYS_SAMPLE);
        assertThat(child.getContext().isValid()).isTrue();
        assertThat(SpanAccessor.getSpanImpl(child).getParentSpanId()).isNull();
    }

    @Test
    void testRecordEventsWithoutSampling() {
        Span span = recorder.startSpan("recorded", null, StartSpanOptions.builder()
            .sampler(ConstantSampler.of(false))
            .recordEvents(true)
            .build());

        assertThat(span.isSampled()).isFalse();
        assertThat(span.isRecording()).isTrue();
        assertThat(recorder.getRunningSpanStore().getRunningSpans("recorded")).hasSize(1);

        span.end();

        assertThat(recorder.getRunningSpanStore().getRunningSpans("recorded")).isEmpty();
        assertThat(exporter.getSpans()).isEmpty();
        assertThat(recorder.getLocalSpanStore().getSpans("recorded")).isEmpty();
    }

    @Test
    void testParentLinks() {
        Span linkParent = recorder.startSpan("batch item", null, ALWAYS_SAMPLE);
        Span notRecordingLinkParent = recorder.startSpan("other item", null, NEVER_SAMPLE);
        Span span = recorder.startSpan("batch", null, StartSpanOptions.builder()
            .sampler(ConstantSampler.of(false))
            .addParentLink(linkParent)
            .addParentLink(notRecordingLinkParent)
            .addParentLink(Span.blank())
            .build());

        // a constant sampler ignores sampled links
        assertThat(span.isSampled()).isFalse();
        assertThat(span.isRecording()).isFalse();
        assertThat(SpanAccessor.getSpanImpl(linkParent).toSpanData().getChildLinks())
            .extracting(Link::getContext)
            .containsExactly(span.getContext());
    }

    @Test
    void testParentLinksOfRecordingSpan() {
        Span linkParent = recorder.startSpan("batch item", null, ALWAYS_SAMPLE);
        Span otherLinkParent = recorder.startSpan("other item", null, NEVER_SAMPLE);
        Span span = recorder.startSpan("batch", null, StartSpanOptions.builder()
            .sampler(ConstantSampler.of(true))
            .addParentLink(linkParent)
            .addParentLink(otherLinkParent)
            .build());

        List<Link> parentLinks = SpanAccessor.getSpanImpl(span).toSpanData().getParentLinks();
        assertThat(parentLinks).extracting(Link::getType).containsOnly(Link.Type.PARENT_LINKED_SPAN);
        assertThat(parentLinks).extracting(Link::getContext)
            .containsExactly(linkParent.getContext(), otherLinkParent.getContext());
        List<Link> childLinks = SpanAccessor.getSpanImpl(linkParent).toSpanData().getChildLinks();
        assertThat(childLinks).extracting(Link::getType).containsExactly(Link.Type.CHILD_LINKED_SPAN);
    }

    @Test
    void testSampledLinkSamplesSpanWithProbabilitySampler() throws Exception {
        config.getConfig(TraceConfiguration.class).getSampleRate().update(0.5, SpyConfiguration.CONFIG_SOURCE_NAME);
        Span linkParent = recorder.startSpan("item", null, ALWAYS_SAMPLE);
        for (int i = 0; i < 100; i++) {
            Span span = recorder.startSpan("batch", null, StartSpanOptions.builder().addParentLink(linkParent).build());
            assertThat(span.isSampled()).isTrue();
        }
    }

    @Test
    void testFailingSamplerFailsClosed() {
        Sampler sampler = mock(Sampler.class);
        when(sampler.isSampled(any(), anyBoolean(), any())).thenThrow(new IllegalStateException("expected"));

        Span span = recorder.startSpan("span", null, StartSpanOptions.builder().sampler(sampler).build());

        assertThat(span.getContext().isValid()).isTrue();
        assertThat(span.isSampled()).isFalse();
        assertThat(span.isRecording()).isFalse();
    }

    @Test
    void testMaxAttributesFromConfiguration() throws Exception {
        config.getConfig(TraceConfiguration.class).getMaxAttributes().update(2, SpyConfiguration.CONFIG_SOURCE_NAME);
        Span span = recorder.startSpan("span", null, ALWAYS_SAMPLE);
        span.addAttribute("a", 1L);
        span.addAttribute("b", 2L);
        span.addAttribute("c", 3L);
        span.end();

        SpanData spanData = exporter.getFirstSpan();
        assertThat(spanData.getAttributes()).containsOnlyKeys("b", "c");
        assertThat(spanData.getDroppedAttributesCount()).isEqualTo(1);
    }

    @Test
    void testSpanKeepsParamsOfItsStart() throws Exception {
        Span span = recorder.startSpan("span", null, ALWAYS_SAMPLE);
        config.getConfig(TraceConfiguration.class).getMaxAttributes().update(1, SpyConfiguration.CONFIG_SOURCE_NAME);
        span.addAttribute("a", 1L);
        span.addAttribute("b", 2L);

        assertThat(SpanAccessor.getSpanImpl(span).toSpanData().getAttributes()).containsOnlyKeys("a", "b");
        assertThat(recorder.getTraceConfig().getActiveTraceParams().getMaxAttributes()).isEqualTo(1);
    }

    @Test
    void testDisabledRecording() throws Exception {
        config.getConfig(TraceConfiguration.class).getRecordingOption().update(false, SpyConfiguration.CONFIG_SOURCE_NAME);
        assertThat(recorder.isRunning()).isFalse();
        assertThat(recorder.startSpan("span", null, ALWAYS_SAMPLE)).isSameAs(Span.blank());

        config.getConfig(TraceConfiguration.class).getRecordingOption().update(true, SpyConfiguration.CONFIG_SOURCE_NAME);
        assertThat(recorder.startSpan("span", null, ALWAYS_SAMPLE).isRecording()).isTrue();
    }

    @Test
    void testStoppedRecorder() {
        Span span = recorder.startSpan("span", null, ALWAYS_SAMPLE);
        recorder.stop();

        assertThat(recorder.getState()).isEqualTo(SpanRecorder.RecorderState.STOPPED);
        assertThat(exporter.isClosed()).isTrue();
        assertThat(recorder.startSpan("span", null, ALWAYS_SAMPLE)).isSameAs(Span.blank());
        assertThat(recorder.startSpanWithRemoteParent("span", span.getContext())).isSameAs(Span.blank());
    }

    @Test
    void testNotStartedRecorder() {
        SpanRecorder notStarted = new SpanRecorderBuilder()
            .configurationRegistry(SpyConfiguration.createSpyConfig())
            .spanExporter(new MockSpanExporter())
            .build();
        assertThat(notStarted.getState()).isEqualTo(SpanRecorder.RecorderState.UNINITIALIZED);
        assertThat(notStarted.startSpan("span", null, ALWAYS_SAMPLE)).isSameAs(Span.blank());
    }

    @Test
    void testNullNameAndOptions() {
        Span span = recorder.startSpan(null, null, null);
        assertThat(span.getContext().isValid()).isTrue();
        Span sampled = recorder.startSpan(null, null, ALWAYS_SAMPLE);
        assertThat(SpanAccessor.getSpanImpl(sampled).getName()).isEqualTo("unnamed");
    }

    @Test
    void testFailingStoresDoNotAffectCaller() {
        RunningSpanStore runningSpanStore = mock(RunningSpanStore.class);
        doThrow(new IllegalStateException("expected")).when(runningSpanStore).onStart(any());
        doThrow(new IllegalStateException("expected")).when(runningSpanStore).onEnd(any());
        MockSpanExporter spanExporter = new MockSpanExporter();
        SpanRecorder recorderWithFailingStore = new SpanRecorderBuilder()
            .configurationRegistry(SpyConfiguration.createSpyConfig())
            .spanExporter(spanExporter)
            .runningSpanStore(runningSpanStore)
            .buildAndStart();
        try {
            Span span = recorderWithFailingStore.startSpan("span", null, ALWAYS_SAMPLE);
            assertThat(span.isRecording()).isTrue();
            span.end();
            assertThat(spanExporter.getSpanNames()).containsExactly("span");
        } finally {
            recorderWithFailingStore.stop();
        }
    }

    @Test
    void testOnlyFirstEndIsExported() {
        Span span = recorder.startSpan("span", null, ALWAYS_SAMPLE);
        span.end();
        span.end();
        assertThat(exporter.getSpans()).hasSize(1);
    }
}
