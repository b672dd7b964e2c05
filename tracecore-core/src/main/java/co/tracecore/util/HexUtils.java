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
package co.tracecore.util;

import java.util.Arrays;

/**
 * Base16 encoding of ids. Encoding always produces lower case characters, decoding accepts both cases.
 */
public final class HexUtils {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();
    private static final byte[] VALUES = new byte['f' + 1];

    static {
        Arrays.fill(VALUES, (byte) -1);
        for (int i = 0; i < 16; i++) {
            VALUES[DIGITS[i]] = (byte) i;
            VALUES[Character.toUpperCase(DIGITS[i])] = (byte) i;
        }
    }

    private HexUtils() {
    }

    public static String toHex(byte[] bytes) {
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        appendHex(bytes, sb);
        return sb.toString();
    }

    public static void appendHex(byte[] bytes, StringBuilder sb) {
        for (byte b : bytes) {
            sb.append(DIGITS[(b >> 4) & 0x0F]).append(DIGITS[b & 0x0F]);
        }
    }

    /**
     * @param hex an even number of hex characters
     * @return the decoded bytes, one per two characters
     * @throws IllegalArgumentException if the length is odd or there is a non-hex character
     */
    public static byte[] decodeHex(CharSequence hex) {
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("Odd number of hex characters: " + hex);
        }
        final byte[] bytes = new byte[hex.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) ((digit(hex, i * 2) << 4) | digit(hex, i * 2 + 1));
        }
        return bytes;
    }

    private static int digit(CharSequence hex, int index) {
        final char ch = hex.charAt(index);
        final int value = ch < VALUES.length ? VALUES[ch] : -1;
        if (value < 0) {
            throw new IllegalArgumentException("Not a hex character at index " + index + ": " + hex);
        }
        return value;
    }
}
