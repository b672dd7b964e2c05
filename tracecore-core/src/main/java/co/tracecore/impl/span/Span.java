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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The handle through which instrumentation code attaches data to a span.
 * <p>
 * A handle is an immutable {@link SpanContext} plus an optional, shared {@link SpanImpl}.
 * Handles of spans which are not recording have no {@link SpanImpl}, so all mutators are no-ops,
 * while the context can still be propagated.
 * None of the methods ever throw: {@code null} arguments, blank spans and ended spans are silently ignored.
 * </p>
 */
public final class Span {

    private static final Span BLANK = new Span(SpanContext.INVALID, null);

    private final SpanContext context;
    @Nullable
    private final SpanImpl spanImpl;

    Span(SpanContext context, @Nullable SpanImpl spanImpl) {
        this.context = context;
        this.spanImpl = spanImpl;
    }

    /**
     * @return a span without identity which records nothing
     */
    public static Span blank() {
        return BLANK;
    }

    public SpanContext getContext() {
        return context;
    }

    /**
     * Fixed when the span is started.
     */
    public boolean isSampled() {
        return context.isSampled();
    }

    /**
     * Fixed when the span is started.
     */
    public boolean isRecording() {
        return spanImpl != null;
    }

    public void addAttribute(@Nullable String key, @Nullable String value) {
        if (spanImpl != null && key != null && value != null) {
            spanImpl.addAttributes(Collections.singletonList(Attribute.of(key, value)));
        }
    }

    public void addAttribute(@Nullable String key, boolean value) {
        if (spanImpl != null && key != null) {
            spanImpl.addAttributes(Collections.singletonList(Attribute.of(key, value)));
        }
    }

    public void addAttribute(@Nullable String key, long value) {
        if (spanImpl != null && key != null) {
            spanImpl.addAttributes(Collections.singletonList(Attribute.of(key, value)));
        }
    }

    public void addAttribute(@Nullable String key, double value) {
        if (spanImpl != null && key != null) {
            spanImpl.addAttributes(Collections.singletonList(Attribute.of(key, value)));
        }
    }

    /**
     * Adds the attributes atomically: concurrent readers see either none or all of them.
     */
    public void addAttributes(@Nullable Attribute... attributes) {
        if (spanImpl != null && attributes != null) {
            spanImpl.addAttributes(withoutNulls(attributes));
        }
    }

    public void addAttributes(@Nullable List<Attribute> attributes) {
        if (spanImpl != null && attributes != null) {
            spanImpl.addAttributes(withoutNulls(attributes));
        }
    }

    public void addAnnotation(@Nullable String description, @Nullable Attribute... attributes) {
        if (spanImpl != null && description != null) {
            spanImpl.addAnnotation(description, withoutNulls(attributes));
        }
    }

    public void addSentMessageEvent(long messageId, long compressedSize, long uncompressedSize) {
        if (spanImpl != null) {
            spanImpl.addMessageEvent(MessageEvent.Type.SENT, messageId, compressedSize, uncompressedSize);
        }
    }

    public void addReceivedMessageEvent(long messageId, long compressedSize, long uncompressedSize) {
        if (spanImpl != null) {
            spanImpl.addMessageEvent(MessageEvent.Type.RECEIVED, messageId, compressedSize, uncompressedSize);
        }
    }

    /**
     * Records that the span identified by {@code parentContext} is a parent of this span.
     */
    public void addParentLink(@Nullable SpanContext parentContext, @Nullable Attribute... attributes) {
        if (spanImpl != null && parentContext != null) {
            spanImpl.addLink(Link.create(Link.Type.PARENT_LINKED_SPAN, parentContext, withoutNulls(attributes)));
        }
    }

    /**
     * Records that the span identified by {@code childContext} is a child of this span.
     */
    public void addChildLink(@Nullable SpanContext childContext, @Nullable Attribute... attributes) {
        if (spanImpl != null && childContext != null) {
            spanImpl.addLink(Link.create(Link.Type.CHILD_LINKED_SPAN, childContext, withoutNulls(attributes)));
        }
    }

    public void setStatus(@Nullable StatusCode code) {
        setStatus(code, null);
    }

    public void setStatus(@Nullable StatusCode code, @Nullable String message) {
        if (spanImpl != null && code != null) {
            spanImpl.setStatus(Status.create(code, message));
        }
    }

    /**
     * Ends the span. Only the first call has an effect.
     */
    public void end() {
        if (spanImpl != null) {
            spanImpl.end();
        }
    }

    @Nullable
    SpanImpl getSpanImpl() {
        return spanImpl;
    }

    private static List<Attribute> withoutNulls(@Nullable Attribute[] attributes) {
        if (attributes == null || attributes.length == 0) {
            return Collections.emptyList();
        }
        List<Attribute> result = new ArrayList<>(attributes.length);
        for (Attribute attribute : attributes) {
            if (attribute != null) {
                result.add(attribute);
            }
        }
        return result;
    }

    private static List<Attribute> withoutNulls(List<Attribute> attributes) {
        List<Attribute> result = new ArrayList<>(attributes.size());
        for (Attribute attribute : attributes) {
            if (attribute != null) {
                result.add(attribute);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Span that = (Span) o;
        return context.equals(that.context) && spanImpl == that.spanImpl;
    }

    @Override
    public int hashCode() {
        return context.hashCode();
    }

    @Override
    public String toString() {
        if (spanImpl != null) {
            return spanImpl.toString();
        }
        return "Span{" + context + (context.isValid() ? ", not recording}" : ", blank}");
    }
}
