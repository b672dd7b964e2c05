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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A timestamped, described event within a span.
 */
public final class Annotation {

    private final long timestamp;
    private final String description;
    private final Map<String, AttributeValue> attributes;

    private Annotation(long timestamp, String description, Map<String, AttributeValue> attributes) {
        this.timestamp = timestamp;
        this.description = description;
        this.attributes = attributes;
    }

    public static Annotation create(long timestamp, String description, List<Attribute> attributes) {
        Objects.requireNonNull(description, "description");
        return new Annotation(timestamp, description, toMap(attributes));
    }

    static Map<String, AttributeValue> toMap(List<Attribute> attributes) {
        if (attributes.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, AttributeValue> map = new LinkedHashMap<>();
        for (Attribute attribute : attributes) {
            if (attribute != null) {
                map.put(attribute.getKey(), attribute.getValue());
            }
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * @return epoch micros
     */
    public long getTimestamp() {
        return timestamp;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, AttributeValue> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "Annotation{" + description + ", attributes=" + attributes + ", timestamp=" + timestamp + '}';
    }
}
