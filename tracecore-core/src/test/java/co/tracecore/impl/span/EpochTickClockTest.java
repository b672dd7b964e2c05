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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EpochTickClockTest {

    @Test
    void testEpochMicros() {
        EpochTickClock clock = EpochTickClock.create(1_000_000, 0);
        assertThat(clock.getEpochMicros(0)).isEqualTo(1_000_000);
        assertThat(clock.getEpochMicros(1_000)).isEqualTo(1_000_001);
        assertThat(clock.getOffset()).isEqualTo(1_000_000_000L);
    }

    @Test
    void testOffsetIsIndependentOfNanoTimeOrigin() {
        EpochTickClock clock = EpochTickClock.create(1_000_000, -5_000);
        assertThat(clock.getEpochMicros(-5_000)).isEqualTo(1_000_000);
        assertThat(clock.getEpochMicros(-3_000)).isEqualTo(1_000_002);
    }

    @Test
    void testCalibratedToWallClock() {
        long before = System.currentTimeMillis() * 1000;
        long epochMicros = EpochTickClock.create().getEpochMicros();
        long after = System.currentTimeMillis() * 1000 + 1000;
        assertThat(epochMicros).isBetween(before, after);
    }
}
