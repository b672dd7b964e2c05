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

import co.tracecore.configuration.ExporterConfiguration;
import co.tracecore.impl.span.SpanData;
import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;
import com.lmax.disruptor.EventHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes the export ring buffer on the single exporter thread.
 * <p>
 * Spans are collected into batches which are handed to every registered handler
 * when the batch is full, at the end of a ring buffer batch, on flush and on shutdown.
 * </p>
 */
class ExportEventHandler implements EventHandler<ExportEvent> {

    private static final Logger logger = LoggerFactory.getLogger(ExportEventHandler.class);

    private final ExporterConfiguration configuration;
    private final Map<String, SpanExporter.Handler> handlers = new ConcurrentHashMap<>();
    private final List<SpanData> batch = new ArrayList<>();
    private final AtomicLong processed = new AtomicLong(-1);
    private final AtomicLong exported = new AtomicLong();
    private final AtomicLong handlerFailures = new AtomicLong();
    private volatile boolean shutdown;

    ExportEventHandler(ExporterConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void onEvent(ExportEvent event, long sequence, boolean endOfBatch) {
        try {
            if (logger.isTraceEnabled()) {
                logger.trace("Receiving {} event (sequence {})", event.getType(), sequence);
            }
            if (shutdown) {
                return;
            }
            dispatchEvent(event, endOfBatch);
        } finally {
            processed.set(sequence);
            event.end();
            event.resetState();
        }
    }

    private void dispatchEvent(ExportEvent event, boolean endOfBatch) {
        ExportEvent.Type type = event.getType();
        if (type == null) {
            return;
        }
        switch (type) {
            case SPAN:
                SpanData span = event.getSpan();
                if (span != null) {
                    batch.add(span);
                }
                if (endOfBatch || batch.size() >= configuration.getExportBatchSize()) {
                    exportBatch();
                }
                break;
            case FLUSH:
                exportBatch();
                break;
            case SHUTDOWN:
                exportBatch();
                shutdown = true;
                break;
            default:
                throw new IllegalArgumentException("unsupported event type " + type);
        }
    }

    private void exportBatch() {
        if (batch.isEmpty()) {
            return;
        }
        List<SpanData> spans = new ArrayList<>(batch);
        batch.clear();
        for (Map.Entry<String, SpanExporter.Handler> entry : handlers.entrySet()) {
            try {
                entry.getValue().export(spans);
            } catch (Exception e) {
                handlerFailures.incrementAndGet();
                logger.warn("Export handler " + entry.getKey() + " failed to export " + spans.size() + " spans", e);
            }
        }
        exported.addAndGet(spans.size());
    }

    void registerHandler(String name, SpanExporter.Handler handler) {
        handlers.put(name, handler);
    }

    void unregisterHandler(String name) {
        handlers.remove(name);
    }

    boolean isProcessed(long sequence) {
        return processed.get() >= sequence;
    }

    boolean isShutdown() {
        return shutdown;
    }

    long getExported() {
        return exported.get();
    }

    long getHandlerFailures() {
        return handlerFailures.get();
    }
}
