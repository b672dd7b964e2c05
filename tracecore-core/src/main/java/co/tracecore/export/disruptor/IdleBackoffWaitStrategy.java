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
package co.tracecore.export.disruptor;

import com.lmax.disruptor.AlertException;
import com.lmax.disruptor.Sequence;
import com.lmax.disruptor.SequenceBarrier;
import com.lmax.disruptor.WaitStrategy;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Parks the span export thread while no ended spans are queued.
 * <p>
 * The park time starts at {@code minPark} and doubles with every empty check, up to {@code maxPark}.
 * Publishers never wake up the export thread, so the first span after a pause waits up to {@code maxPark}.
 * </p>
 */
public final class IdleBackoffWaitStrategy implements WaitStrategy {

    private final long minParkNanos;
    private final long maxParkNanos;

    public IdleBackoffWaitStrategy(long minPark, long maxPark, TimeUnit unit) {
        this.minParkNanos = unit.toNanos(minPark);
        this.maxParkNanos = unit.toNanos(maxPark);
        if (minParkNanos <= 0 || maxParkNanos < minParkNanos) {
            throw new IllegalArgumentException("Expected 0 < minPark <= maxPark, got " + minPark + " and " + maxPark + " " + unit);
        }
    }

    @Override
    public long waitFor(final long sequence, Sequence cursor, final Sequence dependentSequence, final SequenceBarrier barrier) throws AlertException {
        long parkNanos = minParkNanos;
        long availableSequence = dependentSequence.get();
        while (availableSequence < sequence) {
            barrier.checkAlert();
            LockSupport.parkNanos(parkNanos);
            parkNanos = Math.min(parkNanos << 1, maxParkNanos);
            availableSequence = dependentSequence.get();
        }
        return availableSequence;
    }

    @Override
    public void signalAllWhenBlocking() {
    }

    long getMinParkNanos() {
        return minParkNanos;
    }

    long getMaxParkNanos() {
        return maxParkNanos;
    }

    @Override
    public String toString() {
        return "IdleBackoffWaitStrategy{" + minParkNanos + "ns.." + maxParkNanos + "ns}";
    }
}
