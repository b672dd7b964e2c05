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

import static co.tracecore.configuration.validation.RangeValidator.min;

public class ExporterConfiguration extends ConfigurationOptionProvider {

    public static final String EXPORTER_CATEGORY = "Exporter";

    private final ConfigurationOption<Integer> exportQueueSize = ConfigurationOption.integerOption()
        .key("export_queue_size")
        .configurationCategory(EXPORTER_CATEGORY)
        .description("The maximum number of ended spans waiting to be exported.\n" +
            "The value is rounded up to the next power of two.\n" +
            "When the queue is full, further spans are dropped.")
        .addValidator(min(1))
        .dynamic(false)
        .buildWithDefault(2048);

    private final ConfigurationOption<Integer> exportBatchSize = ConfigurationOption.integerOption()
        .key("export_batch_size")
        .configurationCategory(EXPORTER_CATEGORY)
        .description("The maximum number of spans handed to an export handler at once.")
        .addValidator(min(1))
        .dynamic(true)
        .buildWithDefault(64);

    private final ConfigurationOption<Boolean> logExportedSpans = ConfigurationOption.booleanOption()
        .key("log_exported_spans")
        .configurationCategory(EXPORTER_CATEGORY)
        .description("When enabled, every exported span is logged at info level.")
        .dynamic(false)
        .buildWithDefault(false);

    private final ConfigurationOption<Integer> localSpanStoreMaxSpansPerName = ConfigurationOption.integerOption()
        .key("local_span_store_max_spans_per_name")
        .configurationCategory(EXPORTER_CATEGORY)
        .description("The number of most recently ended sampled spans the local span store keeps per span name.")
        .addValidator(min(1))
        .dynamic(false)
        .buildWithDefault(16);

    private final ConfigurationOption<Integer> localSpanStoreMaxSpanNames = ConfigurationOption.integerOption()
        .key("local_span_store_max_span_names")
        .configurationCategory(EXPORTER_CATEGORY)
        .description("The maximum number of distinct span names the local span store keeps spans for.\n" +
            "Spans with a new name are not stored once this limit is reached.")
        .addValidator(min(1))
        .dynamic(false)
        .buildWithDefault(1024);

    public int getExportQueueSize() {
        return exportQueueSize.get();
    }

    public int getExportBatchSize() {
        return exportBatchSize.get();
    }

    public boolean isLogExportedSpans() {
        return logExportedSpans.get();
    }

    public int getLocalSpanStoreMaxSpansPerName() {
        return localSpanStoreMaxSpansPerName.get();
    }

    public int getLocalSpanStoreMaxSpanNames() {
        return localSpanStoreMaxSpanNames.get();
    }
}
