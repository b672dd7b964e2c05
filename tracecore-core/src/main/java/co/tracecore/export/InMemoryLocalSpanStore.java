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
package co.tracecore.export;

import co.tracecore.collections.BoundedBuffer;
import co.tracecore.impl.span.SpanData;
import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps the most recent spans per span name. Older spans are evicted first.
 * <p>
 * Spans are kept for at most {@code maxSpanNames} distinct names.
 * Once that many names are known, spans with another name are not stored until the store is {@linkplain #clear() cleared}.
 * </p>
 */
public class InMemoryLocalSpanStore implements LocalSpanStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryLocalSpanStore.class);

    private final int maxSpansPerName;
    private final int maxSpanNames;
    // guarded by this
    private final Map<String, BoundedBuffer<Long, SpanData>> spansByName = new HashMap<>();

    public InMemoryLocalSpanStore(int maxSpansPerName, int maxSpanNames) {
        if (maxSpansPerName < 1) {
            throw new IllegalArgumentException("maxSpansPerName must be at least 1, was " + maxSpansPerName);
        }
        if (maxSpanNames < 1) {
            throw new IllegalArgumentException("maxSpanNames must be at least 1, was " + maxSpanNames);
        }
        this.maxSpansPerName = maxSpansPerName;
        this.maxSpanNames = maxSpanNames;
    }

    @Override
    public synchronized void considerForSampleStore(SpanData spanData) {
        BoundedBuffer<Long, SpanData> spans = spansByName.get(spanData.getName());
        if (spans == null) {
            if (spansByName.size() >= maxSpanNames) {
                logger.debug("Not storing span {}, already storing spans of {} distinct names", spanData, maxSpanNames);
                return;
            }
            spans = BoundedBuffer.fifo(maxSpansPerName);
            spansByName.put(spanData.getName(), spans);
        }
        spans.add(spanData);
    }

    @Override
    public synchronized List<SpanData> getSpans(String spanName) {
        BoundedBuffer<Long, SpanData> spans = spansByName.get(spanName);
        if (spans == null) {
            return Collections.emptyList();
        }
        return spans.values();
    }

    @Override
    public synchronized Set<String> getSpanNames() {
        return Collections.unmodifiableSet(new TreeSet<>(spansByName.keySet()));
    }

    @Override
    public synchronized void clear() {
        spansByName.clear();
    }

    public int getMaxSpansPerName() {
        return maxSpansPerName;
    }

    public int getMaxSpanNames() {
        return maxSpanNames;
    }
}
