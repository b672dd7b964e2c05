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
package co.tracecore.impl.sampling;

import co.tracecore.impl.span.Id;
import co.tracecore.impl.span.SpanContext;

import java.util.List;

/**
 * A sampler is responsible for determining whether a span should be sampled.
 * <p>
 * Sampled spans are recorded and handed to the local span store and the exporters when they end.
 * Spans which are not sampled only propagate their identity.
 * </p>
 * <p>
 * Implementations are called concurrently from arbitrary threads and must not block.
 * </p>
 */
public interface Sampler {

    /**
     * Determines whether a new span should be sampled.
     *
     * @param traceId       the id of the trace the span belongs to
     * @param parentSampled whether the parent of the span is sampled, {@code false} for root spans
     * @param parentLinks   the contexts of the spans the new span is linked to as a child, possibly empty
     * @return {@code true}, if the span should be sampled
     */
    boolean isSampled(Id traceId, boolean parentSampled, List<SpanContext> parentLinks);

    /**
     * @return sample rate of this sampler, between 0.0 and 1.0
     */
    double getSampleRate();
}
