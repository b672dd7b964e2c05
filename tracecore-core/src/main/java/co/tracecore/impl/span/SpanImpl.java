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

import co.tracecore.collections.BoundedBuffer;
import co.tracecore.impl.SpanRecorder;
import co.tracecore.impl.TraceParams;
import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;

import javax.annotation.Nullable;
import java.util.List;

/**
 * The mutable record of a recording span.
 * <p>
 * All {@link Span} handles of one span share a single instance.
 * Every mutator and the {@link #end()} transition are serialized through one lock.
 * Once ended, all mutators are silent no-ops and the record is frozen into an immutable {@link SpanData}
 * which can be read by stores and exporters without further locking.
 * </p>
 */
public final class SpanImpl {

    private static final Logger logger = LoggerFactory.getLogger(SpanImpl.class);

    private final SpanContext context;
    @Nullable
    private final Id parentSpanId;
    private final boolean hasRemoteParent;
    private final String name;
    private final TraceParams traceParams;
    private final EpochTickClock clock;
    private final long startTimestamp;
    private final SpanRecorder recorder;

    private final Object lock = new Object();
    // the buffers are created on first use
    @Nullable
    private BoundedBuffer<String, AttributeValue> attributes;
    @Nullable
    private BoundedBuffer<Long, Annotation> annotations;
    @Nullable
    private BoundedBuffer<Long, MessageEvent> messageEvents;
    @Nullable
    private BoundedBuffer<Long, Link> parentLinks;
    @Nullable
    private BoundedBuffer<Long, Link> childLinks;
    private Status status = Status.OK;
    private long endTimestamp;
    private boolean ended;
    @Nullable
    private volatile SpanData frozen;

    /**
     * Creates a record for a recording span. The caller is responsible for registering it as running.
     *
     * @param clock the clock of the local trace, or a freshly calibrated one for local root spans
     */
    public SpanImpl(SpanContext context, String name, @Nullable Id parentSpanId, boolean hasRemoteParent,
                    TraceParams traceParams, EpochTickClock clock, SpanRecorder recorder) {
        this.context = context;
        this.name = name;
        this.parentSpanId = parentSpanId;
        this.hasRemoteParent = hasRemoteParent;
        this.traceParams = traceParams;
        this.clock = clock;
        this.recorder = recorder;
        this.startTimestamp = clock.getEpochMicros();
    }

    /**
     * Adds all attributes as one atomic operation.
     * Setting an existing key replaces its value and makes it the most recently set attribute.
     */
    public void addAttributes(List<Attribute> newAttributes) {
        synchronized (lock) {
            if (ended) {
                return;
            }
            BoundedBuffer<String, AttributeValue> buffer = attributes;
            if (buffer == null) {
                buffer = attributes = BoundedBuffer.updateInPlaceByKey(traceParams.getMaxAttributes());
            }
            for (Attribute attribute : newAttributes) {
                buffer.put(attribute.getKey(), attribute.getValue());
            }
        }
    }

    public void addAnnotation(String description, List<Attribute> annotationAttributes) {
        synchronized (lock) {
            if (ended) {
                return;
            }
            BoundedBuffer<Long, Annotation> buffer = annotations;
            if (buffer == null) {
                buffer = annotations = BoundedBuffer.fifo(traceParams.getMaxAnnotations());
            }
            buffer.add(Annotation.create(clock.getEpochMicros(), description, annotationAttributes));
        }
    }

    public void addMessageEvent(MessageEvent.Type type, long messageId, long compressedSize, long uncompressedSize) {
        synchronized (lock) {
            if (ended) {
                return;
            }
            BoundedBuffer<Long, MessageEvent> buffer = messageEvents;
            if (buffer == null) {
                buffer = messageEvents = BoundedBuffer.fifo(traceParams.getMaxMessageEvents());
            }
            buffer.add(MessageEvent.create(clock.getEpochMicros(), type, messageId, compressedSize, uncompressedSize));
        }
    }

    /**
     * Adds the link to the parent or child link buffer, depending on its {@link Link#getType() type}.
     * Both buffers are bounded by the maximum number of links independently.
     */
    public void addLink(Link link) {
        synchronized (lock) {
            if (ended) {
                return;
            }
            if (link.getType() == Link.Type.PARENT_LINKED_SPAN) {
                BoundedBuffer<Long, Link> buffer = parentLinks;
                if (buffer == null) {
                    buffer = parentLinks = BoundedBuffer.fifo(traceParams.getMaxLinks());
                }
                buffer.add(link);
            } else {
                BoundedBuffer<Long, Link> buffer = childLinks;
                if (buffer == null) {
                    buffer = childLinks = BoundedBuffer.fifo(traceParams.getMaxLinks());
                }
                buffer.add(link);
            }
        }
    }

    /**
     * The last status set wins
     */
    public void setStatus(Status status) {
        synchronized (lock) {
            if (ended) {
                return;
            }
            this.status = status;
        }
    }

    public boolean end() {
        return end(clock.getEpochMicros());
    }

    /**
     * Ends this span, freezes its record and hands it to the recorder.
     *
     * @param epochMicros the end timestamp
     * @return {@code true} only for the call which actually ended the span
     */
    public boolean end(long epochMicros) {
        final SpanData data;
        synchronized (lock) {
            if (ended) {
                if (logger.isDebugEnabled()) {
                    logger.debug("End has already been called: {}", this);
                }
                return false;
            }
            endTimestamp = epochMicros;
            ended = true;
            data = snapshot();
            frozen = data;
        }
        recorder.endSpan(this, data);
        return true;
    }

    /**
     * @return the frozen record if this span has ended, otherwise a consistent snapshot of the current state
     */
    public SpanData toSpanData() {
        SpanData data = frozen;
        if (data != null) {
            return data;
        }
        synchronized (lock) {
            data = frozen;
            if (data != null) {
                return data;
            }
            return snapshot();
        }
    }

    // must be called while holding the lock
    private SpanData snapshot() {
        SpanData.Builder builder = SpanData.builder(context, name)
            .parentSpanId(parentSpanId, hasRemoteParent)
            .startTimestamp(startTimestamp)
            .status(status);
        if (ended) {
            builder.endTimestamp(endTimestamp);
        }
        if (attributes != null) {
            builder.attributes(attributes.toMap(), attributes.getDroppedCount());
        }
        if (annotations != null) {
            builder.annotations(annotations.values(), annotations.getDroppedCount());
        }
        if (messageEvents != null) {
            builder.messageEvents(messageEvents.values(), messageEvents.getDroppedCount());
        }
        if (parentLinks != null) {
            builder.parentLinks(parentLinks.values(), parentLinks.getDroppedCount());
        }
        if (childLinks != null) {
            builder.childLinks(childLinks.values(), childLinks.getDroppedCount());
        }
        return builder.build();
    }

    public boolean isEnded() {
        synchronized (lock) {
            return ended;
        }
    }

    public SpanContext getContext() {
        return context;
    }

    public String getName() {
        return name;
    }

    @Nullable
    public Id getParentSpanId() {
        return parentSpanId;
    }

    public boolean hasRemoteParent() {
        return hasRemoteParent;
    }

    public long getStartTimestamp() {
        return startTimestamp;
    }

    public EpochTickClock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "'" + name + "' " + context;
    }
}
