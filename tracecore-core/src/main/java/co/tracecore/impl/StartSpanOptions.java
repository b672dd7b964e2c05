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
package co.tracecore.impl;

import co.tracecore.impl.sampling.Sampler;
import co.tracecore.impl.span.Span;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Optional settings for starting a span.
 */
public final class StartSpanOptions {

    public static final StartSpanOptions DEFAULT = builder().build();

    @Nullable
    private final Sampler sampler;
    private final boolean recordEvents;
    private final List<Span> parentLinks;

    private StartSpanOptions(Builder builder) {
        this.sampler = builder.sampler;
        this.recordEvents = builder.recordEvents;
        this.parentLinks = Collections.unmodifiableList(new ArrayList<>(builder.parentLinks));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the sampler to use instead of the default sampler of the active {@link TraceParams},
     * {@code null} to use the default one
     */
    @Nullable
    public Sampler getSampler() {
        return sampler;
    }

    /**
     * @return whether the span should be recorded even if it is not sampled
     */
    public boolean isRecordEvents() {
        return recordEvents;
    }

    /**
     * @return the spans, usually of other traces, the new span should be linked to as a child
     */
    public List<Span> getParentLinks() {
        return parentLinks;
    }

    public static final class Builder {
        @Nullable
        private Sampler sampler;
        private boolean recordEvents;
        private final List<Span> parentLinks = new ArrayList<>();

        private Builder() {
        }

        public Builder sampler(@Nullable Sampler sampler) {
            this.sampler = sampler;
            return this;
        }

        public Builder recordEvents(boolean recordEvents) {
            this.recordEvents = recordEvents;
            return this;
        }

        public Builder addParentLink(@Nullable Span parentLink) {
            if (parentLink != null) {
                parentLinks.add(parentLink);
            }
            return this;
        }

        public Builder parentLinks(@Nullable List<Span> parentLinks) {
            if (parentLinks != null) {
                for (Span parentLink : parentLinks) {
                    addParentLink(parentLink);
                }
            }
            return this;
        }

        public StartSpanOptions build() {
            return new StartSpanOptions(this);
        }
    }
}
