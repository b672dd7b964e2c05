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

import java.util.List;
import java.util.Map;

/**
 * Keeps track of the recording spans which have been started but not yet ended.
 * <p>
 * Implementations are called from arbitrary threads and must not block the caller.
 * </p>
 */
public interface RunningSpanStore {

    void onStart(SpanImpl span);

    void onEnd(SpanImpl span);

    /**
     * @return snapshots of the running spans with the given name
     */
    List<SpanData> getRunningSpans(String spanName);

    /**
     * @return the number of running spans per span name
     */
    Map<String, Integer> getSummary();
}
