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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A reference from one span to a span which is usually part of another trace.
 */
public final class Link {

    public enum Type {
        /**
         * The linked span is a parent of the span holding the link
         */
        PARENT_LINKED_SPAN,
        /**
         * The linked span is a child of the span holding the link
         */
        CHILD_LINKED_SPAN
    }

    private final Type type;
    private final SpanContext context;
    private final Map<String, AttributeValue> attributes;

    private Link(Type type, SpanContext context, Map<String, AttributeValue> attributes) {
        this.type = type;
        this.context = context;
        this.attributes = attributes;
    }

    public static Link create(Type type, SpanContext context, List<Attribute> attributes) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(context, "context");
        return new Link(type, context, Annotation.toMap(attributes));
    }

    public Type getType() {
        return type;
    }

    public SpanContext getContext() {
        return context;
    }

    public Map<String, AttributeValue> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "Link{" + type + ' ' + context + ", attributes=" + attributes + '}';
    }
}
