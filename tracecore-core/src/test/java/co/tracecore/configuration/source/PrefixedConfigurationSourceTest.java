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
package co.tracecore.configuration.source;

import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.source.SimpleSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrefixedConfigurationSourceTest {

    @Test
    void testExternalNames() {
        assertThat(PrefixedConfigurationSource.toSystemPropertyName("max_links")).isEqualTo("tracecore.max_links");
        assertThat(PrefixedConfigurationSource.toEnvironmentVariableName("max_links")).isEqualTo("TRACECORE_MAX_LINKS");
        assertThat(PrefixedConfigurationSource.toEnvironmentVariableName("export.batch")).isEqualTo("TRACECORE_EXPORT_BATCH");
    }

    @Test
    void testEnvironmentVariableKeys() {
        SimpleSource environment = new SimpleSource("environment")
            .add("TRACECORE_SAMPLE_RATE", "0.5")
            .add("sample_rate", "1.0");
        PrefixedConfigurationSource source = new PrefixedConfigurationSource(environment, true);

        assertThat(source.getValue("sample_rate")).isEqualTo("0.5");
        assertThat(source.getValue("max_links")).isNull();
        assertThat(source.getName()).isEqualTo("environment");
    }

    @Test
    void testSystemProperties() {
        System.setProperty("tracecore.max_annotations", "7");
        try {
            PrefixedConfigurationSource source = PrefixedConfigurationSource.systemProperties();
            assertThat(source.getValue("max_annotations")).isEqualTo("7");
            assertThat(source.getValue("tracecore.max_annotations")).isNull();
        } finally {
            System.clearProperty("tracecore.max_annotations");
        }
    }

    @Test
    void testReadOnly() {
        PrefixedConfigurationSource source = new PrefixedConfigurationSource(new SimpleSource("properties"), false);

        assertThat(source.isSavingPossible()).isFalse();
        assertThat(source.isSavingPersistent()).isFalse();
        assertThatThrownBy(() -> source.save("max_links", "3")).isInstanceOf(UnsupportedOperationException.class);
    }
}
