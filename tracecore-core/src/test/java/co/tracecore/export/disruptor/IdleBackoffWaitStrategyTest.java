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
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class IdleBackoffWaitStrategyTest {

    private final IdleBackoffWaitStrategy waitStrategy = new IdleBackoffWaitStrategy(1, 100, TimeUnit.MICROSECONDS);

    @Test
    void testParkLimits() {
        assertThat(waitStrategy.getMinParkNanos()).isEqualTo(1_000);
        assertThat(waitStrategy.getMaxParkNanos()).isEqualTo(100_000);
        assertThatThrownBy(() -> new IdleBackoffWaitStrategy(0, 1, TimeUnit.MILLISECONDS)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IdleBackoffWaitStrategy(2, 1, TimeUnit.MILLISECONDS)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testReturnsImmediatelyWhenAvailable() throws Exception {
        SequenceBarrier barrier = mock(SequenceBarrier.class);
        Sequence published = new Sequence(7);

        assertThat(waitStrategy.waitFor(5, published, published, barrier)).isEqualTo(7);
        verifyNoInteractions(barrier);
    }

    @Test
    void testWaitsUntilPublished() throws Exception {
        SequenceBarrier barrier = mock(SequenceBarrier.class);
        final Sequence published = new Sequence(-1);
        Thread publisher = new Thread(() -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            published.set(3);
        });
        publisher.start();

        assertThat(waitStrategy.waitFor(0, published, published, barrier)).isEqualTo(3);
        publisher.join();
    }

    @Test
    void testAlertStopsWaiting() throws Exception {
        SequenceBarrier barrier = mock(SequenceBarrier.class);
        doThrow(AlertException.INSTANCE).when(barrier).checkAlert();
        Sequence published = new Sequence(-1);

        assertThatThrownBy(() -> waitStrategy.waitFor(0, published, published, barrier)).isSameAs(AlertException.INSTANCE);
    }
}
