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

import co.tracecore.impl.sampling.ProbabilitySampler;
import co.tracecore.impl.sampling.Sampler;

import java.util.Objects;

/**
 * The limits and the default sampler applied to newly started spans.
 * <p>
 * Instances are immutable; the active instance is swapped as a whole through {@link TraceConfig}.
 * Spans capture the instance which was active when they started.
 * </p>
 */
public final class TraceParams {

    public static final double DEFAULT_SAMPLE_RATE = 1e-4;
    public static final int DEFAULT_MAX_ATTRIBUTES = 32;
    public static final int DEFAULT_MAX_ANNOTATIONS = 32;
    public static final int DEFAULT_MAX_MESSAGE_EVENTS = 128;
    public static final int DEFAULT_MAX_LINKS = 32;

    public static final TraceParams DEFAULT = builder().build();

    private final Sampler sampler;
    private final int maxAttributes;
    private final int maxAnnotations;
    private final int maxMessageEvents;
    private final int maxLinks;

    private TraceParams(Builder builder) {
        this.sampler = builder.sampler;
        this.maxAttributes = builder.maxAttributes;
        this.maxAnnotations = builder.maxAnnotations;
        this.maxMessageEvents = builder.maxMessageEvents;
        this.maxLinks = builder.maxLinks;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .sampler(sampler)
            .maxAttributes(maxAttributes)
            .maxAnnotations(maxAnnotations)
            .maxMessageEvents(maxMessageEvents)
            .maxLinks(maxLinks);
    }

    public Sampler getSampler() {
        return sampler;
    }

    public int getMaxAttributes() {
        return maxAttributes;
    }

    public int getMaxAnnotations() {
        return maxAnnotations;
    }

    public int getMaxMessageEvents() {
        return maxMessageEvents;
    }

    public int getMaxLinks() {
        return maxLinks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraceParams that = (TraceParams) o;
        return maxAttributes == that.maxAttributes &&
            maxAnnotations == that.maxAnnotations &&
            maxMessageEvents == that.maxMessageEvents &&
            maxLinks == that.maxLinks &&
            sampler.equals(that.sampler);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampler, maxAttributes, maxAnnotations, maxMessageEvents, maxLinks);
    }

    @Override
    public String toString() {
        return "TraceParams{" +
            "sampler=" + sampler +
            ", maxAttributes=" + maxAttributes +
            ", maxAnnotations=" + maxAnnotations +
            ", maxMessageEvents=" + maxMessageEvents +
            ", maxLinks=" + maxLinks +
            '}';
    }

    public static final class Builder {
        private Sampler sampler = ProbabilitySampler.of(DEFAULT_SAMPLE_RATE);
        private int maxAttributes = DEFAULT_MAX_ATTRIBUTES;
        private int maxAnnotations = DEFAULT_MAX_ANNOTATIONS;
        private int maxMessageEvents = DEFAULT_MAX_MESSAGE_EVENTS;
        private int maxLinks = DEFAULT_MAX_LINKS;

        private Builder() {
        }

        public Builder sampler(Sampler sampler) {
            this.sampler = Objects.requireNonNull(sampler, "sampler");
            return this;
        }

        public Builder maxAttributes(int maxAttributes) {
            this.maxAttributes = requirePositive(maxAttributes, "maxAttributes");
            return this;
        }

        public Builder maxAnnotations(int maxAnnotations) {
            this.maxAnnotations = requirePositive(maxAnnotations, "maxAnnotations");
            return this;
        }

        public Builder maxMessageEvents(int maxMessageEvents) {
            this.maxMessageEvents = requirePositive(maxMessageEvents, "maxMessageEvents");
            return this;
        }

        public Builder maxLinks(int maxLinks) {
            this.maxLinks = requirePositive(maxLinks, "maxLinks");
            return this;
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be greater than 0, was " + value);
            }
            return value;
        }

        public TraceParams build() {
            return new TraceParams(this);
        }
    }
}
