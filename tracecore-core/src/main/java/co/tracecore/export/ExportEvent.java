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
package co.tracecore.export;

import co.tracecore.impl.span.SpanData;

import javax.annotation.Nullable;
import java.util.concurrent.locks.LockSupport;

/**
 * A slot of the export ring buffer. Slots are reused, see {@link #resetState()}.
 */
class ExportEvent {

    enum Type {
        SPAN,
        FLUSH,
        SHUTDOWN
    }

    @Nullable
    private Type type;
    @Nullable
    private SpanData span;
    @Nullable
    private Thread unparkAfterProcessed;

    void setSpan(SpanData span) {
        this.type = Type.SPAN;
        this.span = span;
    }

    void setFlushEvent() {
        this.type = Type.FLUSH;
    }

    void setShutdownEvent() {
        this.type = Type.SHUTDOWN;
    }

    void unparkAfterProcessed(@Nullable Thread thread) {
        unparkAfterProcessed = thread;
    }

    @Nullable
    Type getType() {
        return type;
    }

    @Nullable
    SpanData getSpan() {
        return span;
    }

    void end() {
        if (unparkAfterProcessed != null) {
            LockSupport.unpark(unparkAfterProcessed);
        }
    }

    void resetState() {
        type = null;
        span = null;
        unparkAfterProcessed = null;
    }

    @Override
    public String toString() {
        return type == Type.SPAN ? "ExportEvent{" + span + '}' : "ExportEvent{" + type + '}';
    }
}
