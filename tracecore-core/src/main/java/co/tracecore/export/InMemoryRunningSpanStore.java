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

import co.tracecore.impl.span.SpanData;
import co.tracecore.impl.span.SpanImpl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRunningSpanStore implements RunningSpanStore {

    private final Set<SpanImpl> runningSpans = Collections.newSetFromMap(new ConcurrentHashMap<SpanImpl, Boolean>());

    @Override
    public void onStart(SpanImpl span) {
        runningSpans.add(span);
    }

    @Override
    public void onEnd(SpanImpl span) {
        runningSpans.remove(span);
    }

    @Override
    public List<SpanData> getRunningSpans(String spanName) {
        List<SpanData> result = new ArrayList<>();
        for (SpanImpl span : runningSpans) {
            if (span.getName().equals(spanName)) {
                result.add(span.toSpanData());
            }
        }
        return result;
    }

    @Override
    public Map<String, Integer> getSummary() {
        Map<String, Integer> summary = new TreeMap<>();
        for (SpanImpl span : runningSpans) {
            Integer count = summary.get(span.getName());
            summary.put(span.getName(), count == null ? 1 : count + 1);
        }
        return summary;
    }

    public int size() {
        return runningSpans.size();
    }
}
