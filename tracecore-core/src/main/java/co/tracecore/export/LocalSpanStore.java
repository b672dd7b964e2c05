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

import java.util.List;
import java.util.Set;

/**
 * Keeps a sample of recently ended, sampled spans, for in-process inspection.
 */
public interface LocalSpanStore {

    /**
     * Called with the frozen snapshot of every sampled span when it ends.
     */
    void considerForSampleStore(SpanData spanData);

    /**
     * @return the stored spans with the given name, oldest first
     */
    List<SpanData> getSpans(String spanName);

    Set<String> getSpanNames();

    void clear();
}
