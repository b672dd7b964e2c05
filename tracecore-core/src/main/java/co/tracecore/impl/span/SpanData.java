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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable snapshot of a span's recorded state.
 * <p>
 * This is what local span stores and exporters consume.
 * The snapshot of an {@link #isEnded() ended} span never changes.
 * </p>
 */
public final class SpanData {

    private final SpanContext context;
    @Nullable
    private final Id parentSpanId;
    private final boolean hasRemoteParent;
    private final String name;
    private final long startTimestamp;
    private final long endTimestamp;
    private final boolean ended;
    private final Status status;
    private final Map<String, AttributeValue> attributes;
    private final int droppedAttributesCount;
    private final List<Annotation> annotations;
    private final int droppedAnnotationsCount;
    private final List<MessageEvent> messageEvents;
    private final int droppedMessageEventsCount;
    private final List<Link> parentLinks;
    private final int droppedParentLinksCount;
    private final List<Link> childLinks;
    private final int droppedChildLinksCount;

    private SpanData(Builder builder) {
        this.context = builder.context;
        this.parentSpanId = builder.parentSpanId;
        this.hasRemoteParent = builder.hasRemoteParent;
        this.name = builder.name;
        this.startTimestamp = builder.startTimestamp;
        this.endTimestamp = builder.endTimestamp;
        this.ended = builder.ended;
        this.status = builder.status;
        this.attributes = builder.attributes;
        this.droppedAttributesCount = builder.droppedAttributesCount;
        this.annotations = builder.annotations;
        this.droppedAnnotationsCount = builder.droppedAnnotationsCount;
        this.messageEvents = builder.messageEvents;
        this.droppedMessageEventsCount = builder.droppedMessageEventsCount;
        this.parentLinks = builder.parentLinks;
        this.droppedParentLinksCount = builder.droppedParentLinksCount;
        this.childLinks = builder.childLinks;
        this.droppedChildLinksCount = builder.droppedChildLinksCount;
    }

    public static Builder builder(SpanContext context, String name) {
        return new Builder(context, name);
    }

    public SpanContext getContext() {
        return context;
    }

    /**
     * @return the span id of the local or remote parent, {@code null} for root spans
     */
    @Nullable
    public Id getParentSpanId() {
        return parentSpanId;
    }

    public boolean hasRemoteParent() {
        return hasRemoteParent;
    }

    public String getName() {
        return name;
    }

    /**
     * @return epoch micros
     */
    public long getStartTimestamp() {
        return startTimestamp;
    }

    /**
     * @return epoch micros, {@code 0} if the span has not ended yet
     */
    public long getEndTimestamp() {
        return endTimestamp;
    }

    public long getDurationMicros() {
        return ended ? endTimestamp - startTimestamp : 0;
    }

    public boolean isEnded() {
        return ended;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return the attributes, in the order in which they were last set
     */
    public Map<String, AttributeValue> getAttributes() {
        return attributes;
    }

    public int getDroppedAttributesCount() {
        return droppedAttributesCount;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public int getDroppedAnnotationsCount() {
        return droppedAnnotationsCount;
    }

    public List<MessageEvent> getMessageEvents() {
        return messageEvents;
    }

    public int getDroppedMessageEventsCount() {
        return droppedMessageEventsCount;
    }

    public List<Link> getParentLinks() {
        return parentLinks;
    }

    public int getDroppedParentLinksCount() {
        return droppedParentLinksCount;
    }

    public List<Link> getChildLinks() {
        return childLinks;
    }

    public int getDroppedChildLinksCount() {
        return droppedChildLinksCount;
    }

    @Override
    public String toString() {
        return "SpanData{'" + name + "' " + context +
            ", parent=" + parentSpanId +
            ", start=" + startTimestamp +
            ", end=" + endTimestamp +
            ", status=" + status +
            ", attributes=" + attributes +
            ", annotations=" + annotations.size() +
            ", messageEvents=" + messageEvents.size() +
            ", parentLinks=" + parentLinks.size() +
            ", childLinks=" + childLinks.size() +
            '}';
    }

    public static final class Builder {
        private final SpanContext context;
        private final String name;
        @Nullable
        private Id parentSpanId;
        private boolean hasRemoteParent;
        private long startTimestamp;
        private long endTimestamp;
        private boolean ended;
        private Status status = Status.OK;
        private Map<String, AttributeValue> attributes = Collections.emptyMap();
        private int droppedAttributesCount;
        private List<Annotation> annotations = Collections.emptyList();
        private int droppedAnnotationsCount;
        private List<MessageEvent> messageEvents = Collections.emptyList();
        private int droppedMessageEventsCount;
        private List<Link> parentLinks = Collections.emptyList();
        private int droppedParentLinksCount;
        private List<Link> childLinks = Collections.emptyList();
        private int droppedChildLinksCount;

        private Builder(SpanContext context, String name) {
            this.context = Objects.requireNonNull(context, "context");
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder parentSpanId(@Nullable Id parentSpanId, boolean hasRemoteParent) {
            this.parentSpanId = parentSpanId;
            this.hasRemoteParent = hasRemoteParent;
            return this;
        }

        public Builder startTimestamp(long startTimestamp) {
            this.startTimestamp = startTimestamp;
            return this;
        }

        public Builder endTimestamp(long endTimestamp) {
            this.endTimestamp = endTimestamp;
            this.ended = true;
            return this;
        }

        public Builder status(Status status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder attributes(Map<String, AttributeValue> attributes, int droppedCount) {
            this.attributes = Collections.unmodifiableMap(attributes);
            this.droppedAttributesCount = droppedCount;
            return this;
        }

        public Builder annotations(List<Annotation> annotations, int droppedCount) {
            this.annotations = Collections.unmodifiableList(annotations);
            this.droppedAnnotationsCount = droppedCount;
            return this;
        }

        public Builder messageEvents(List<MessageEvent> messageEvents, int droppedCount) {
            this.messageEvents = Collections.unmodifiableList(messageEvents);
            this.droppedMessageEventsCount = droppedCount;
            return this;
        }

        public Builder parentLinks(List<Link> parentLinks, int droppedCount) {
            this.parentLinks = Collections.unmodifiableList(parentLinks);
            this.droppedParentLinksCount = droppedCount;
            return this;
        }

        public Builder childLinks(List<Link> childLinks, int droppedCount) {
            this.childLinks = Collections.unmodifiableList(childLinks);
            this.droppedChildLinksCount = droppedCount;
            return this;
        }

        public SpanData build() {
            return new SpanData(this);
        }
    }
}
