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

import java.io.Closeable;
import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Hands the snapshots of ended, sampled spans to the registered {@link Handler}s.
 */
public interface SpanExporter extends Closeable {

    void start();

    /**
     * Enqueues a span for export. Never blocks; if the span can't be enqueued it is dropped.
     */
    void export(SpanData span);

    void registerHandler(String name, Handler handler);

    void unregisterHandler(String name);

    /**
     * Waits until all spans enqueued before this call have been handed to the handlers.
     *
     * @return {@code true} if all spans have been handed over within the timeout
     */
    boolean flush(long timeout, TimeUnit unit);

    long getDropped();

    long getExported();

    @Override
    void close();

    /**
     * Receives batches of ended spans, for example to write them to a backend.
     * <p>
     * Handlers are called from the exporter's thread, one batch at a time.
     * </p>
     */
    interface Handler {
        void export(Collection<SpanData> spans) throws Exception;
    }
}
