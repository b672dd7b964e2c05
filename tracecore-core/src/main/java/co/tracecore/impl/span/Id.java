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

import co.tracecore.util.HexUtils;

import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * An immutable identifier: 128 bit for traces, 64 bit for spans.
 * The all-zero id is the invalid (empty) id.
 */
public final class Id {

    private static final int TRACE_ID_LENGTH = 16;
    private static final int SPAN_ID_LENGTH = 8;

    public static final Id INVALID_TRACE_ID = new Id(new byte[TRACE_ID_LENGTH]);
    public static final Id INVALID_SPAN_ID = new Id(new byte[SPAN_ID_LENGTH]);

    private final byte[] data;
    private final boolean empty;
    @Nullable
    private volatile String cachedStringRepresentation;

    private Id(byte[] data) {
        this.data = data;
        this.empty = isAllZeros(data);
    }

    public static Id randomTraceId() {
        return randomTraceId(ThreadLocalRandom.current());
    }

    public static Id randomTraceId(Random random) {
        return random(TRACE_ID_LENGTH, random);
    }

    public static Id randomSpanId() {
        return randomSpanId(ThreadLocalRandom.current());
    }

    public static Id randomSpanId(Random random) {
        return random(SPAN_ID_LENGTH, random);
    }

    private static Id random(int length, Random random) {
        byte[] bytes = new byte[length];
        do {
            random.nextBytes(bytes);
        } while (isAllZeros(bytes));
        return new Id(bytes);
    }

    /**
     * @param hexEncodedString 32 (trace id) or 16 (span id) hex characters
     */
    public static Id fromHexString(String hexEncodedString) {
        int length = hexEncodedString.length();
        if (length != TRACE_ID_LENGTH * 2 && length != SPAN_ID_LENGTH * 2) {
            throw new IllegalArgumentException("Invalid id length " + length + ": " + hexEncodedString);
        }
        return new Id(HexUtils.decodeHex(hexEncodedString));
    }

    public static Id fromBytes(byte[] bytes) {
        if (bytes.length != TRACE_ID_LENGTH && bytes.length != SPAN_ID_LENGTH) {
            throw new IllegalArgumentException("Invalid id length " + bytes.length);
        }
        return new Id(bytes.clone());
    }

    public static Id fromLongs(long... values) {
        if (values.length != 1 && values.length != 2) {
            throw new IllegalArgumentException("Invalid number of long values");
        }
        final ByteBuffer buffer = ByteBuffer.allocate(values.length * Long.BYTES);
        for (long value : values) {
            buffer.putLong(value);
        }
        return new Id(buffer.array());
    }

    public byte[] toBytes() {
        return data.clone();
    }

    public boolean isEmpty() {
        return empty;
    }

    public int getLength() {
        return data.length;
    }

    /**
     * Returns the last 8 bytes of this id as a {@code long}.
     * <p>
     * The right part of a trace id is the one preferred for making random sampling decisions.
     * </p>
     *
     * @return the last 8 bytes of this id as a {@code long}
     */
    public long getLeastSignificantBits() {
        long lsb = 0;
        for (int i = data.length - 8; i < data.length; i++) {
            lsb = (lsb << 8) | (data[i] & 0xff);
        }
        return lsb;
    }

    public void writeAsHex(StringBuilder sb) {
        HexUtils.appendHex(data, sb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Id that = (Id) o;
        return Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        String s = cachedStringRepresentation;
        if (s == null) {
            s = cachedStringRepresentation = HexUtils.toHex(data);
        }
        return s;
    }

    private static boolean isAllZeros(byte[] bytes) {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }
}
