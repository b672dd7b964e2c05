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

import co.tracecore.configuration.SpyConfiguration;
import co.tracecore.configuration.TraceConfiguration;
import co.tracecore.impl.sampling.ConstantSampler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.ConfigurationRegistry;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceConfigTest {

    private ConfigurationRegistry config;
    private TraceConfiguration traceConfiguration;

    @BeforeEach
    void setUp() {
        config = SpyConfiguration.createSpyConfig();
        traceConfiguration = config.getConfig(TraceConfiguration.class);
    }

    @Test
    void testDefaultParams() {
        assertThat(new TraceConfig().getActiveTraceParams()).isSameAs(TraceParams.DEFAULT);
    }

    @Test
    void testUpdateReplacesWholeTable() {
        TraceConfig traceConfig = new TraceConfig();
        TraceParams params = TraceParams.builder().maxLinks(1).sampler(ConstantSampler.of(true)).build();
        traceConfig.updateActiveTraceParams(params);
        assertThat(traceConfig.getActiveTraceParams()).isSameAs(params);
        assertThatThrownBy(() -> traceConfig.updateActiveTraceParams(null)).isInstanceOf(NullPointerException.class);
        assertThat(traceConfig.getActiveTraceParams()).isSameAs(params);
    }

    @Test
    void testFromConfiguration() {
        TraceConfig traceConfig = TraceConfig.fromConfiguration(traceConfiguration);
        assertThat(traceConfig.getActiveTraceParams()).isEqualTo(TraceParams.DEFAULT);
    }

    @Test
    void testFollowsConfigurationChanges() throws Exception {
        TraceConfig traceConfig = TraceConfig.fromConfiguration(traceConfiguration);
        TraceParams before = traceConfig.getActiveTraceParams();

        traceConfiguration.getSampleRate().update(1.0, SpyConfiguration.CONFIG_SOURCE_NAME);
        traceConfiguration.getMaxAttributes().update(4, SpyConfiguration.CONFIG_SOURCE_NAME);
        traceConfiguration.getMaxAnnotations().update(5, SpyConfiguration.CONFIG_SOURCE_NAME);
        traceConfiguration.getMaxMessageEvents().update(6, SpyConfiguration.CONFIG_SOURCE_NAME);
        traceConfiguration.getMaxLinks().update(7, SpyConfiguration.CONFIG_SOURCE_NAME);

        TraceParams after = traceConfig.getActiveTraceParams();
        assertThat(after.getSampler()).isSameAs(ConstantSampler.of(true));
        assertThat(after.getMaxAttributes()).isEqualTo(4);
        assertThat(after.getMaxAnnotations()).isEqualTo(5);
        assertThat(after.getMaxMessageEvents()).isEqualTo(6);
        assertThat(after.getMaxLinks()).isEqualTo(7);
        // previously captured tables are never mutated
        assertThat(before).isEqualTo(TraceParams.DEFAULT);
    }

    @Test
    void testInvalidValueKeepsActiveParams() throws Exception {
        TraceConfig traceConfig = TraceConfig.fromConfiguration(traceConfiguration);
        assertThatThrownBy(() -> config.save(TraceConfiguration.MAX_LINKS, "0", SpyConfiguration.CONFIG_SOURCE_NAME))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.save(TraceConfiguration.SAMPLE_RATE, "1.5", SpyConfiguration.CONFIG_SOURCE_NAME))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(traceConfig.getActiveTraceParams()).isEqualTo(TraceParams.DEFAULT);
    }

    @Test
    void testModifyKeepsOtherLimits() {
        TraceConfig traceConfig = new TraceConfig();
        TraceParams modified = traceConfig.modifyActiveTraceParams(builder -> builder.maxLinks(3));
        assertThat(traceConfig.getActiveTraceParams()).isSameAs(modified);
        assertThat(modified.getMaxLinks()).isEqualTo(3);
        assertThat(modified.getMaxAttributes()).isEqualTo(TraceParams.DEFAULT_MAX_ATTRIBUTES);
        assertThatThrownBy(() -> traceConfig.modifyActiveTraceParams(builder -> builder.maxLinks(0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(traceConfig.getActiveTraceParams()).isSameAs(modified);
    }

    @Test
    void testConcurrentChangesOfDifferentLimitsAreNotLost() throws Exception {
        TraceConfig traceConfig = TraceConfig.fromConfiguration(traceConfiguration);
        int iterations = 1000;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Future<?> sampleRateUpdates = executor.submit(() -> {
                start.await();
                for (int i = 1; i <= iterations; i++) {
                    traceConfiguration.getSampleRate().update(i / (double) iterations, SpyConfiguration.CONFIG_SOURCE_NAME);
                }
                return null;
            });
            Future<?> maxAttributesUpdates = executor.submit(() -> {
                start.await();
                for (int i = 1; i <= iterations; i++) {
                    final int maxAttributes = i;
                    traceConfig.modifyActiveTraceParams(builder -> builder.maxAttributes(maxAttributes));
                }
                return null;
            });
            Future<?> maxLinksUpdates = executor.submit(() -> {
                start.await();
                for (int i = 1; i <= iterations; i++) {
                    final int maxLinks = i;
                    traceConfig.modifyActiveTraceParams(builder -> builder.maxLinks(maxLinks));
                }
                return null;
            });
            start.countDown();
            sampleRateUpdates.get(30, TimeUnit.SECONDS);
            maxAttributesUpdates.get(30, TimeUnit.SECONDS);
            maxLinksUpdates.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        TraceParams params = traceConfig.getActiveTraceParams();
        assertThat(params.getSampler()).isSameAs(ConstantSampler.of(true));
        assertThat(params.getMaxAttributes()).isEqualTo(iterations);
        assertThat(params.getMaxLinks()).isEqualTo(iterations);
        assertThat(params.getMaxAnnotations()).isEqualTo(TraceParams.DEFAULT_MAX_ANNOTATIONS);
    }
}
