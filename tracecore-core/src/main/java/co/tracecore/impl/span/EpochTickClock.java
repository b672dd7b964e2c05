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
 * This clock makes sure that all spans of a local trace use a consistent clock
 * which does not drift in case of NTP updates or leap seconds.
 * <p>
 * The clock is calibrated with wall clock time when the root span starts and from there on
 * uses {@link System#nanoTime()} in order to be able to measure durations.
 * {@link System#currentTimeMillis()}, which uses wall clock time, is not suitable for measuring durations because of the aforementioned
 * possibility of clock drifts.
 * </p>
 */
public final class EpochTickClock {

    private final long nanoTimeOffsetToEpoch;

    private EpochTickClock(long nanoTimeOffsetToEpoch) {
        this.nanoTimeOffsetToEpoch = nanoTimeOffsetToEpoch;
    }

    /**
     * Creates a clock calibrated based on the current wall clock time
     */
    public static EpochTickClock create() {
        return create(System.currentTimeMillis() * 1000, System.nanoTime());
    }

    /**
     * Creates a calibrated clock
     *
     * @param epochMicrosWallClock the current timestamp in microseconds since epoch, based on wall clock time
     * @param nanoTime             the current nanosecond ticks (mostly {@link System#nanoTime()})
     */
    public static EpochTickClock create(long epochMicrosWallClock, long nanoTime) {
        return new EpochTickClock(epochMicrosWallClock * 1_000 - nanoTime);
    }

    public long getEpochMicros() {
        return getEpochMicros(System.nanoTime());
    }

    public long getEpochMicros(final long nanoTime) {
        return (nanoTime + nanoTimeOffsetToEpoch) / 1000;
    }

    long getOffset() {
        return nanoTimeOffsetToEpoch;
    }
}
