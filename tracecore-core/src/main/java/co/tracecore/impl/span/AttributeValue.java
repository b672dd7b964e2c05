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

/**
 * The value of an attribute: a string, a boolean, a signed 64 bit integer or a double.
 */
public final class AttributeValue {

    public enum Type {
        STRING,
        BOOLEAN,
        LONG,
        DOUBLE
    }

    private final Type type;
    private final Object value;

    private AttributeValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static AttributeValue stringValue(String value) {
        return new AttributeValue(Type.STRING, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue booleanValue(boolean value) {
        return new AttributeValue(Type.BOOLEAN, value);
    }

    public static AttributeValue longValue(long value) {
        return new AttributeValue(Type.LONG, value);
    }

    public static AttributeValue doubleValue(double value) {
        return new AttributeValue(Type.DOUBLE, value);
    }

    public Type getType() {
        return type;
    }

    public String getStringValue() {
        checkType(Type.STRING);
        return (String) value;
    }

    public boolean getBooleanValue() {
        checkType(Type.BOOLEAN);
        return (Boolean) value;
    }

    public long getLongValue() {
        checkType(Type.LONG);
        return (Long) value;
    }

    public double getDoubleValue() {
        checkType(Type.DOUBLE);
        return (Double) value;
    }

    private void checkType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Attribute value is a " + type + ", not a " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeValue that = (AttributeValue) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
