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

import java.util.Objects;

public final class Attribute {

    private final String key;
    private final AttributeValue value;

    private Attribute(String key, AttributeValue value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Attribute of(String key, AttributeValue value) {
        return new Attribute(key, value);
    }

    public static Attribute of(String key, String value) {
        return new Attribute(key, AttributeValue.stringValue(value));
    }

    public static Attribute of(String key, boolean value) {
        return new Attribute(key, AttributeValue.booleanValue(value));
    }

    public static Attribute of(String key, long value) {
        return new Attribute(key, AttributeValue.longValue(value));
    }

    public static Attribute of(String key, double value) {
        return new Attribute(key, AttributeValue.doubleValue(value));
    }

    public String getKey() {
        return key;
    }

    public AttributeValue getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Attribute attribute = (Attribute) o;
        return key.equals(attribute.key) && value.equals(attribute.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + '=' + value;
    }
}
