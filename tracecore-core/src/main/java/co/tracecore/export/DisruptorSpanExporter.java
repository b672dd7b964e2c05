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
import co.tracecore.export.disruptor.IdleBackoffWaitStrategy;
import co.tracecore.impl.span.SpanData;
import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;
import co.tracecore.util.ExecutorUtils;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.IgnoreExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;

import javax.annotation.Nullable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

/**
 * Exports spans asynchronously through a ring buffer which is consumed by a single daemon thread.
 * <p>
 * Producers never block: when the ring buffer is full, spans are dropped and counted.
 * </p>
 */
public class DisruptorSpanExporter implements SpanExporter {

    private static final Logger logger = LoggerFactory.getLogger(DisruptorSpanExporter.class);

    private static final EventTranslatorOneArg<ExportEvent, SpanData> SPAN_EVENT_TRANSLATOR = new EventTranslatorOneArg<ExportEvent, SpanData>() {
        @Override
        public void translateTo(ExportEvent event, long sequence, SpanData span) {
            event.setSpan(span);
        }
    };
    private static final EventTranslatorOneArg<ExportEvent, Thread> FLUSH_EVENT_TRANSLATOR = new EventTranslatorOneArg<ExportEvent, Thread>() {
        @Override
        public void translateTo(ExportEvent event, long sequence, @Nullable Thread unparkAfterProcessed) {
            event.setFlushEvent();
            event.unparkAfterProcessed(unparkAfterProcessed);
        }
    };
    private static final EventTranslatorOneArg<ExportEvent, Thread> SHUTDOWN_EVENT_TRANSLATOR = new EventTranslatorOneArg<ExportEvent, Thread>() {
        @Override
        public void translateTo(ExportEvent event, long sequence, @Nullable Thread unparkAfterProcessed) {
            event.setShutdownEvent();
            event.unparkAfterProcessed(unparkAfterProcessed);
        }
    };

    private final Disruptor<ExportEvent> disruptor;
    private final ExportEventHandler exportEventHandler;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean started;
    private volatile boolean closed;

    public DisruptorSpanExporter(ExporterConfiguration configuration) {
        exportEventHandler = new ExportEventHandler(configuration);
        disruptor = new Disruptor<>(new ExportEventFactory(), ringBufferSize(configuration.getExportQueueSize()),
            ExecutorUtils.namedDaemonThreadFactory("span-exporter"),
            ProducerType.MULTI, new IdleBackoffWaitStrategy(100, 10_000, TimeUnit.MICROSECONDS));
        disruptor.setDefaultExceptionHandler(new IgnoreExceptionHandler());
        disruptor.handleEventsWith(exportEventHandler);
    }

    /**
     * @return the smallest power of two which can hold {@code queueSize} spans, at least 2
     */
    static int ringBufferSize(int queueSize) {
        if (queueSize > 1 << 30) {
            throw new IllegalArgumentException("Export queue size too large: " + queueSize);
        }
        return Math.max(2, Integer.highestOneBit(queueSize - 1) << 1);
    }

    @Override
    public synchronized void start() {
        if (!started) {
            disruptor.start();
            started = true;
        }
    }

    @Override
    public void export(SpanData span) {
        if (closed) {
            dropped.incrementAndGet();
            return;
        }
        boolean queueFull = !disruptor.getRingBuffer().tryPublishEvent(SPAN_EVENT_TRANSLATOR, span);
        if (queueFull) {
            if (logger.isDebugEnabled()) {
                logger.debug("Could not add {} to ring buffer as no slots are available", span);
            }
            dropped.incrementAndGet();
        }
    }

    @Override
    public void registerHandler(String name, Handler handler) {
        exportEventHandler.registerHandler(name, handler);
    }

    @Override
    public void unregisterHandler(String name) {
        exportEventHandler.unregisterHandler(name);
    }

    @Override
    public boolean flush(long timeout, TimeUnit unit) {
        return publishAndWaitForEvent(timeout, unit, FLUSH_EVENT_TRANSLATOR);
    }

    private boolean publishAndWaitForEvent(long timeout, TimeUnit unit, EventTranslatorOneArg<ExportEvent, Thread> eventTranslator) {
        if (!started || exportEventHandler.isShutdown()) {
            return false;
        }
        long startNs = System.nanoTime();
        long thresholdNs;
        if (timeout < 0) {
            thresholdNs = Long.MAX_VALUE;
        } else {
            thresholdNs = unit.toNanos(timeout) + startNs;
        }
        do {
            try {
                long sequence = disruptor.getRingBuffer().tryNext();
                try {
                    eventTranslator.translateTo(disruptor.get(sequence), sequence, Thread.currentThread());
                } finally {
                    disruptor.getRingBuffer().publish(sequence);
                }
                return waitForEventProcessed(sequence, thresholdNs);
            } catch (InsufficientCapacityException e) {
                LockSupport.parkNanos(100_000);
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }
        } while (System.nanoTime() < thresholdNs);
        return false;
    }

    private boolean waitForEventProcessed(long sequence, long thresholdNs) {
        for (long nowNs = System.nanoTime();
             nowNs < thresholdNs && !exportEventHandler.isProcessed(sequence);
             nowNs = System.nanoTime()) {
            // the consumer unparks this thread once the event is processed
            LockSupport.parkNanos(Math.min(10_000_000, thresholdNs - nowNs));
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        return exportEventHandler.isProcessed(sequence);
    }

    @Override
    public long getDropped() {
        return dropped.get();
    }

    @Override
    public long getExported() {
        return exportEventHandler.getExported();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("dropped spans because of full queue: {}", dropped.get());
        if (!started) {
            return;
        }
        publishAndWaitForEvent(5, TimeUnit.SECONDS, SHUTDOWN_EVENT_TRANSLATOR);
        try {
            disruptor.shutdown(1, TimeUnit.SECONDS);
        } catch (com.lmax.disruptor.TimeoutException e) {
            logger.warn("Timeout while shutting down disruptor");
        }
    }

    static class ExportEventFactory implements EventFactory<ExportEvent> {
        @Override
        public ExportEvent newInstance() {
            return new ExportEvent();
        }
    }
}
