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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpanContextTest {

    private final Id traceId = Id.fromHexString("0af7651916cd43dd8448eb211c80319c");
    private final Id spanId = Id.fromHexString("b7ad6b7169203331");

    @Test
    void testInvalid() {
        assertThat(SpanContext.INVALID.isValid()).isFalse();
        assertThat(SpanContext.INVALID.isSampled()).isFalse();
        assertThat(SpanContext.create(traceId, Id.INVALID_SPAN_ID, true).isValid()).isFalse();
        assertThat(SpanContext.create(Id.INVALID_TRACE_ID, spanId, true).isValid()).isFalse();
    }

    @Test
    void testValid() {
        SpanContext context = SpanContext.create(traceId, spanId, true);
        assertThat(context.isValid()).isTrue();
        assertThat(context.getTraceId()).isEqualTo(traceId);
        assertThat(context.getSpanId()).isEqualTo(spanId);
        assertThat(context.getTraceState()).isEmpty();
    }

    @Test
    void testStructuralEquality() {
        SpanContext context = SpanContext.create(traceId, spanId, true, "vendor=value");
        assertThat(context).isEqualTo(SpanContext.create(Id.fromHexString(traceId.toString()), spanId, true, "vendor=value"));
        assertThat(context.hashCode()).isEqualTo(SpanContext.create(traceId, spanId, true, "vendor=value").hashCode());
        assertThat(context).isNotEqualTo(SpanContext.create(traceId, spanId, false, "vendor=value"));
        assertThat(context).isNotEqualTo(SpanContext.create(traceId, spanId, true));
    }

    @Test
    void testSameTrace() {
        SpanContext context = SpanContext.create(traceId, spanId, true);
        assertThat(context.isSameTrace(SpanContext.create(traceId, Id.randomSpanId(), false))).isTrue();
        assertThat(context.isSameTrace(SpanContext.create(Id.randomTraceId(), spanId, true))).isFalse();
    }

    @Test
    void testToString() {
        assertThat(SpanContext.create(traceId, spanId, true).toString())
            .isEqualTo("00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01");
        assertThat(SpanContext.create(traceId, spanId, false).toString())
            .isEqualTo("00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-00");
    }
}
