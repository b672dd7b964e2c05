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
package co.tracecore.configuration;

import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

import static co.tracecore.configuration.validation.RangeValidator.isInRange;
import static co.tracecore.configuration.validation.RangeValidator.min;

public class TraceConfiguration extends ConfigurationOptionProvider {

    public static final String TRACE_CATEGORY = "Tracing";
    public static final String RECORDING = "recording";
    public static final String SAMPLE_RATE = "sample_rate";
    public static final String MAX_ATTRIBUTES = "max_attributes";
    public static final String MAX_ANNOTATIONS = "max_annotations";
    public static final String MAX_MESSAGE_EVENTS = "max_message_events";
    public static final String MAX_LINKS = "max_links";

    private final ConfigurationOption<Boolean> recording = ConfigurationOption.booleanOption()
        .key(RECORDING)
        .configurationCategory(TRACE_CATEGORY)
        .description("A boolean specifying if spans should be recorded.\n" +
            "When set to `false`, every span started is a blank span which records nothing and propagates no identity.\n" +
            "Spans started while recording keep recording after a change.")
        .dynamic(true)
        .buildWithDefault(true);

    private final ConfigurationOption<Double> sampleRate = ConfigurationOption.doubleOption()
        .key(SAMPLE_RATE)
        .configurationCategory(TRACE_CATEGORY)
        .description("The probability with which root spans are sampled, between 0.0 and 1.0.\n" +
            "Child spans of sampled spans are always sampled.\n" +
            "Spans which are not sampled still propagate their identity, but record and export nothing.")
        .dynamic(true)
        .addValidator(isInRange(0d, 1d))
        .buildWithDefault(1e-4);

    private final ConfigurationOption<Integer> maxAttributes = ConfigurationOption.integerOption()
        .key(MAX_ATTRIBUTES)
        .configurationCategory(TRACE_CATEGORY)
        .description("The maximum number of attributes per span.\n" +
            "When exceeded, the attribute which has not been set for the longest time is dropped.")
        .dynamic(true)
        .addValidator(min(1))
        .buildWithDefault(32);

    private final ConfigurationOption<Integer> maxAnnotations = ConfigurationOption.integerOption()
        .key(MAX_ANNOTATIONS)
        .configurationCategory(TRACE_CATEGORY)
        .description("The maximum number of annotations per span. When exceeded, the oldest annotation is dropped.")
        .dynamic(true)
        .addValidator(min(1))
        .buildWithDefault(32);

    private final ConfigurationOption<Integer> maxMessageEvents = ConfigurationOption.integerOption()
        .key(MAX_MESSAGE_EVENTS)
        .configurationCategory(TRACE_CATEGORY)
        .description("The maximum number of message events per span. When exceeded, the oldest message event is dropped.")
        .dynamic(true)
        .addValidator(min(1))
        .buildWithDefault(128);

    private final ConfigurationOption<Integer> maxLinks = ConfigurationOption.integerOption()
        .key(MAX_LINKS)
        .configurationCategory(TRACE_CATEGORY)
        .description("The maximum number of parent links and, separately, of child links per span.\n" +
            "When exceeded, the oldest link is dropped.")
        .dynamic(true)
        .addValidator(min(1))
        .buildWithDefault(32);

    public boolean isRecording() {
        return recording.get();
    }

    public ConfigurationOption<Boolean> getRecordingOption() {
        return recording;
    }

    public ConfigurationOption<Double> getSampleRate() {
        return sampleRate;
    }

    public ConfigurationOption<Integer> getMaxAttributes() {
        return maxAttributes;
    }

    public ConfigurationOption<Integer> getMaxAnnotations() {
        return maxAnnotations;
    }

    public ConfigurationOption<Integer> getMaxMessageEvents() {
        return maxMessageEvents;
    }

    public ConfigurationOption<Integer> getMaxLinks() {
        return maxLinks;
    }
}
