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

import javax.annotation.Nullable;

/**
 * Privileged access to the internals of {@link Span} handles.
 * <p>
 * Only meant for the span recorder, the span stores and tests. Instrumentation code must not use it.
 * </p>
 */
public final class SpanAccessor {

    private SpanAccessor() {
    }

    public static Span createSpan(SpanContext context, @Nullable SpanImpl spanImpl) {
        return new Span(context, spanImpl);
    }

    @Nullable
    public static SpanImpl getSpanImpl(@Nullable Span span) {
        return span != null ? span.getSpanImpl() : null;
    }
}
