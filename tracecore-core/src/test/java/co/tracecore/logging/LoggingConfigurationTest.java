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
package co.tracecore.logging;

import co.tracecore.configuration.SpyConfiguration;
import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.SimpleSource;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfigurationTest {

    private ConfigurationRegistry config;

    @BeforeEach
    void setUp() {
        LoggingConfiguration.init();
        config = SpyConfiguration.createSpyConfig();
    }

    @AfterEach
    void tearDown() {
        LoggingConfiguration.setLogLevel(LogLevel.INFO);
    }

    @Test
    void testDefaultLevel() {
        assertThat(config.getConfig(LoggingConfiguration.class).getLogLevel()).isEqualTo(LogLevel.INFO);
    }

    @Test
    void testDynamicLevelChange() throws Exception {
        config.save(LoggingConfiguration.LOG_LEVEL_KEY, "debug", SpyConfiguration.CONFIG_SOURCE_NAME);

        assertThat(LogManager.getLogger(LoggingConfiguration.TRACECORE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        Logger logger = LoggerFactory.getLogger("co.tracecore.export.SomeComponent");
        assertThat(logger.isDebugEnabled()).isTrue();
        assertThat(logger.isTraceEnabled()).isFalse();

        config.save(LoggingConfiguration.LOG_LEVEL_KEY, "WARN", SpyConfiguration.CONFIG_SOURCE_NAME);
        assertThat(logger.isInfoEnabled()).isFalse();
        assertThat(logger.isWarnEnabled()).isTrue();
    }

    @Test
    void testApplyConfiguredLevel() {
        ConfigurationRegistry configured = SpyConfiguration.createSpyConfig(new SimpleSource(SpyConfiguration.CONFIG_SOURCE_NAME)
            .add(LoggingConfiguration.LOG_LEVEL_KEY, "ERROR"));
        LoggingConfiguration loggingConfiguration = configured.getConfig(LoggingConfiguration.class);
        assertThat(loggingConfiguration.getLogLevel()).isEqualTo(LogLevel.ERROR);

        loggingConfiguration.applyLogLevel();
        assertThat(LogManager.getLogger(LoggingConfiguration.TRACECORE_LOGGER).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void testOffLevel() {
        LoggingConfiguration.setLogLevel(LogLevel.OFF);
        assertThat(LoggerFactory.getLogger(LoggingConfiguration.class).isErrorEnabled()).isFalse();
    }
}
