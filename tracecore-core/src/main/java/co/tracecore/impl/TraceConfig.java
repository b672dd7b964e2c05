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

import co.tracecore.configuration.TraceConfiguration;
import co.tracecore.impl.sampling.ProbabilitySampler;
import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOption;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the active {@link TraceParams}.
 * <p>
 * The whole table is replaced atomically, so readers never observe a partially updated table.
 * </p>
 */
public class TraceConfig {

    private static final Logger logger = LoggerFactory.getLogger(TraceConfig.class);

    private final AtomicReference<TraceParams> activeTraceParams;

    public TraceConfig() {
        this(TraceParams.DEFAULT);
    }

    public TraceConfig(TraceParams initial) {
        activeTraceParams = new AtomicReference<>(initial);
    }

    /**
     * Creates a config from the current option values and keeps it in sync with dynamic changes of these options.
     */
    public static TraceConfig fromConfiguration(TraceConfiguration configuration) {
        final TraceConfig traceConfig = new TraceConfig(TraceParams.builder()
            .sampler(ProbabilitySampler.of(configuration.getSampleRate().get()))
            .maxAttributes(configuration.getMaxAttributes().get())
            .maxAnnotations(configuration.getMaxAnnotations().get())
            .maxMessageEvents(configuration.getMaxMessageEvents().get())
            .maxLinks(configuration.getMaxLinks().get())
            .build());
        configuration.getSampleRate().addChangeListener(new TraceParamsUpdater<Double>(traceConfig) {
            @Override
            TraceParams.Builder update(TraceParams.Builder builder, Double newValue) {
                return builder.sampler(ProbabilitySampler.of(newValue));
            }
        });
        configuration.getMaxAttributes().addChangeListener(new TraceParamsUpdater<Integer>(traceConfig) {
            @Override
            TraceParams.Builder update(TraceParams.Builder builder, Integer newValue) {
                return builder.maxAttributes(newValue);
            }
        });
        configuration.getMaxAnnotations().addChangeListener(new TraceParamsUpdater<Integer>(traceConfig) {
            @Override
            TraceParams.Builder update(TraceParams.Builder builder, Integer newValue) {
                return builder.maxAnnotations(newValue);
            }
        });
        configuration.getMaxMessageEvents().addChangeListener(new TraceParamsUpdater<Integer>(traceConfig) {
            @Override
            TraceParams.Builder update(TraceParams.Builder builder, Integer newValue) {
                return builder.maxMessageEvents(newValue);
            }
        });
        configuration.getMaxLinks().addChangeListener(new TraceParamsUpdater<Integer>(traceConfig) {
            @Override
            TraceParams.Builder update(TraceParams.Builder builder, Integer newValue) {
                return builder.maxLinks(newValue);
            }
        });
        return traceConfig;
    }

    public TraceParams getActiveTraceParams() {
        return activeTraceParams.get();
    }

    public void updateActiveTraceParams(TraceParams traceParams) {
        if (traceParams == null) {
            throw new NullPointerException("traceParams");
        }
        TraceParams previous = activeTraceParams.getAndSet(traceParams);
        if (logger.isDebugEnabled()) {
            logger.debug("Trace params changed from {} to {}", previous, traceParams);
        }
    }

    /**
     * Atomically applies {@code modification} to a builder of the active table and activates the result.
     * <p>
     * Concurrent modifications of different limits never overwrite each other.
     * The modification may be applied more than once under contention, so it must not have side effects.
     * </p>
     *
     * @param modification changes some of the limits of the active table
     * @return the activated table
     */
    public TraceParams modifyActiveTraceParams(UnaryOperator<TraceParams.Builder> modification) {
        if (modification == null) {
            throw new NullPointerException("modification");
        }
        TraceParams previous;
        TraceParams next;
        do {
            previous = activeTraceParams.get();
            next = modification.apply(previous.toBuilder()).build();
        } while (!activeTraceParams.compareAndSet(previous, next));
        if (logger.isDebugEnabled()) {
            logger.debug("Trace params changed from {} to {}", previous, next);
        }
        return next;
    }

    /**
     * Applies a changed option value to the active table, keeping concurrent changes of the other limits.
     */
    private abstract static class TraceParamsUpdater<T> implements ConfigurationOption.ChangeListener<T> {

        private final TraceConfig traceConfig;

        TraceParamsUpdater(TraceConfig traceConfig) {
            this.traceConfig = traceConfig;
        }

        @Override
        public void onChange(ConfigurationOption<?> configurationOption, T oldValue, final T newValue) {
            logger.debug("{} changed from {} to {}", configurationOption.getKey(), oldValue, newValue);
            traceConfig.modifyActiveTraceParams(new UnaryOperator<TraceParams.Builder>() {
                @Override
                public TraceParams.Builder apply(TraceParams.Builder builder) {
                    return update(builder, newValue);
                }
            });
        }

        abstract TraceParams.Builder update(TraceParams.Builder builder, T newValue);
    }
}
