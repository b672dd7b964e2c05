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

/**
 * A message sent or received within a span.
 */
public final class MessageEvent {

    public enum Type {
        SENT,
        RECEIVED
    }

    private final long timestamp;
    private final Type type;
    private final long messageId;
    private final long compressedSize;
    private final long uncompressedSize;

    private MessageEvent(long timestamp, Type type, long messageId, long compressedSize, long uncompressedSize) {
        this.timestamp = timestamp;
        this.type = type;
        this.messageId = messageId;
        this.compressedSize = compressedSize;
        this.uncompressedSize = uncompressedSize;
    }

    public static MessageEvent create(long timestamp, Type type, long messageId, long compressedSize, long uncompressedSize) {
        if (type == null) {
            throw new NullPointerException("type");
        }
        return new MessageEvent(timestamp, type, messageId, compressedSize, uncompressedSize);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Type getType() {
        return type;
    }

    public long getMessageId() {
        return messageId;
    }

    public long getCompressedSize() {
        return compressedSize;
    }

    public long getUncompressedSize() {
        return uncompressedSize;
    }

    @Override
    public String toString() {
        return "MessageEvent{" + type + " id=" + messageId + ", compressed=" + compressedSize + ", uncompressed=" + uncompressedSize + '}';
    }
}
