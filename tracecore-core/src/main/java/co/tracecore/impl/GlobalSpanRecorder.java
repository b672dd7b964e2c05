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

import co.tracecore.impl.span.Span;
import co.tracecore.impl.span.SpanContext;

import javax.annotation.Nullable;

/**
 * Process-wide access to the {@link SpanRecorder}.
 * <p>
 * Until a recorder is {@link #init(SpanRecorder) set}, all spans started through this class are blank.
 * </p>
 */
public final class GlobalSpanRecorder {

    @Nullable
    private static volatile SpanRecorder recorder;

    private GlobalSpanRecorder() {
    }

    public static synchronized void init(SpanRecorder spanRecorder) {
        if (recorder != null) {
            throw new IllegalStateException("Span recorder is already initialized");
        }
        recorder = spanRecorder;
    }

    /**
     * Removes the current recorder.
     *
     * @throws IllegalStateException if the current recorder is still running
     */
    public static synchronized void setNoop() {
        SpanRecorder current = recorder;
        if (current != null && current.getState() == SpanRecorder.RecorderState.RUNNING) {
            throw new IllegalStateException("Can't remove span recorder as it is still running");
        }
        recorder = null;
    }

    public static boolean isNoop() {
        return recorder == null;
    }

    @Nullable
    public static SpanRecorder get() {
        return recorder;
    }

    public static Span startSpan(@Nullable String name) {
        SpanRecorder current = recorder;
        return current != null ? current.startSpan(name) : Span.blank();
    }

    public static Span startSpan(@Nullable String name, @Nullable Span parent) {
        SpanRecorder current = recorder;
        return current != null ? current.startSpan(name, parent) : Span.blank();
    }

    public static Span startSpan(@Nullable String name, @Nullable Span parent, @Nullable StartSpanOptions options) {
        SpanRecorder current = recorder;
        return current != null ? current.startSpan(name, parent, options) : Span.blank();
    }

    public static Span startSpanWithRemoteParent(@Nullable String name, @Nullable SpanContext remoteParent) {
        SpanRecorder current = recorder;
        return current != null ? current.startSpanWithRemoteParent(name, remoteParent) : Span.blank();
    }

    public static Span startSpanWithRemoteParent(@Nullable String name, @Nullable SpanContext remoteParent,
                                                 @Nullable StartSpanOptions options) {
        SpanRecorder current = recorder;
        return current != null ? current.startSpanWithRemoteParent(name, remoteParent, options) : Span.blank();
    }
}
