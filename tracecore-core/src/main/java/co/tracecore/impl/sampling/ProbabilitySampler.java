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
package co.tracecore.impl.sampling;

import co.tracecore.impl.span.Id;
import co.tracecore.impl.span.SpanContext;

import java.util.List;

/**
 * This implementation of {@link Sampler} samples based on a sampling probability (or sampling rate) between 0.0 and 1.0.
 * <p>
 * A sampling rate of 0.5 means that 50% of all root spans should be {@linkplain Sampler sampled}.
 * A span is always sampled if its parent, or any of the spans it is linked to as a child, is sampled.
 * </p>
 * <p>
 * Implementation notes:
 * </p>
 * We are taking advantage of the fact, that the trace {@link Id} is randomly generated.
 * So instead of generating another random number,
 * we just see if the long value returned by {@link Id#getLeastSignificantBits()}
 * falls into the range between the {@code lowerBound} and the <code>higherBound</code>.
 * This is a visual representation of the mechanism with a sampling rate of 0.5 (=50%):
 * <pre>
 * Long.MIN_VALUE        0                     Long.MAX_VALUE
 * v                     v                     v
 * [----------[----------|----------]----------]
 *            ^                     ^
 *            lowerBound            higherBound = Long.MAX_VALUE * samplingRate
 *            = Long.MAX_VALUE * samplingRate * -1
 * </pre>
 */
public class ProbabilitySampler implements Sampler {

    private final long lowerBound;
    private final long higherBound;
    private final double sampleRate;

    private ProbabilitySampler(double samplingRate) {
        this.higherBound = (long) (Long.MAX_VALUE * samplingRate);
        this.lowerBound = -higherBound;
        this.sampleRate = samplingRate;
    }

    /**
     * @param samplingRate a rate between 0.0 and 1.0
     * @throws IllegalArgumentException if the rate is not within [0.0, 1.0]
     */
    public static Sampler of(double samplingRate) {
        if (!(samplingRate >= 0 && samplingRate <= 1)) {
            throw new IllegalArgumentException("Sampling rate must be within [0.0, 1.0], was " + samplingRate);
        }
        if (samplingRate == 1) {
            return ConstantSampler.of(true);
        }
        if (samplingRate == 0) {
            return ConstantSampler.of(false);
        }
        return new ProbabilitySampler(samplingRate);
    }

    @Override
    public boolean isSampled(Id traceId, boolean parentSampled, List<SpanContext> parentLinks) {
        if (parentSampled) {
            return true;
        }
        for (int i = 0; i < parentLinks.size(); i++) {
            if (parentLinks.get(i).isSampled()) {
                return true;
            }
        }
        final long leastSignificantBits = traceId.getLeastSignificantBits();
        return leastSignificantBits > lowerBound && leastSignificantBits < higherBound;
    }

    @Override
    public double getSampleRate() {
        return sampleRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Double.compare(((ProbabilitySampler) o).sampleRate, sampleRate) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(sampleRate);
    }

    @Override
    public String toString() {
        return "ProbabilitySampler{" + sampleRate + '}';
    }
}
