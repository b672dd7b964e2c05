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
package co.tracecore.impl.span;

import java.util.Objects;

/**
 * The immutable identity of a span within a trace.
 * <p>
 * A context is {@link #isValid() valid} if both its trace id and its span id are non-empty.
 * {@link #INVALID} is the context of blank spans.
 * </p>
 */
public final class SpanContext {

    public static final SpanContext INVALID = new SpanContext(Id.INVALID_TRACE_ID, Id.INVALID_SPAN_ID, false, "");

    private static final String VERSION = "00";

    private final Id traceId;
    private final Id spanId;
    private final boolean sampled;
    private final String traceState;

    private SpanContext(Id traceId, Id spanId, boolean sampled, String traceState) {
        this.traceId = traceId;
        this.spanId = spanId;
        this.sampled = sampled;
        this.traceState = traceState;
    }

    public static SpanContext create(Id traceId, Id spanId, boolean sampled) {
        return create(traceId, spanId, sampled, "");
    }

    public static SpanContext create(Id traceId, Id spanId, boolean sampled, String traceState) {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(spanId, "spanId");
        Objects.requireNonNull(traceState, "traceState");
        return new SpanContext(traceId, spanId, sampled, traceState);
    }

    public Id getTraceId() {
        return traceId;
    }

    public Id getSpanId() {
        return spanId;
    }

    public boolean isSampled() {
        return sampled;
    }

    /**
     * @return the opaque, propagated vendor state; empty if there is none
     */
    public String getTraceState() {
        return traceState;
    }

    public boolean isValid() {
        return !traceId.isEmpty() && !spanId.isEmpty();
    }

    public boolean isSameTrace(SpanContext other) {
        return traceId.equals(other.traceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpanContext that = (SpanContext) o;
        return sampled == that.sampled
            && traceId.equals(that.traceId)
            && spanId.equals(that.spanId)
            && traceState.equals(that.traceState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traceId, spanId, sampled, traceState);
    }

    /**
     * @return {@code 00-<trace id>-<span id>-<flags>}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(55);
        sb.append(VERSION).append('-');
        traceId.writeAsHex(sb);
        sb.append('-');
        spanId.writeAsHex(sb);
        sb.append('-').append(sampled ? "01" : "00");
        return sb.toString();
    }
}
