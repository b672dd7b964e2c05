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

import co.tracecore.sdk.logging.LoggerFactory;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

import javax.annotation.Nullable;

/**
 * Defines configuration options related to logging.
 * <p>
 * {@link #init()} has to be called before any logging is expected to show up;
 * until then, loggers obtained from {@link LoggerFactory} discard all events.
 * </p>
 */
public class LoggingConfiguration extends ConfigurationOptionProvider {

    static final String LOG_LEVEL_KEY = "log_level";
    static final String TRACECORE_LOGGER = "co.tracecore";

    private static final String LOGGING_CATEGORY = "Logging";

    private final ConfigurationOption<LogLevel> logLevel = ConfigurationOption.enumOption(LogLevel.class)
        .key(LOG_LEVEL_KEY)
        .configurationCategory(LOGGING_CATEGORY)
        .description("Sets the logging level of the span recorder.\n" +
            "This option is case-insensitive.")
        .dynamic(true)
        .addChangeListener(new ConfigurationOption.ChangeListener<LogLevel>() {
            @Override
            public void onChange(ConfigurationOption<?> configurationOption, LogLevel oldValue, LogLevel newValue) {
                setLogLevel(newValue);
            }
        })
        .buildWithDefault(LogLevel.INFO);

    /**
     * Routes all {@link LoggerFactory} loggers to Log4j2.
     */
    public static void init() {
        LoggerFactory.initialize(new Log4j2LoggingBackend());
    }

    public LogLevel getLogLevel() {
        return logLevel.get();
    }

    /**
     * Applies the configured level, unless it has been left at its default, in which case the Log4j2 configuration decides.
     */
    public void applyLogLevel() {
        if (!logLevel.isDefault()) {
            setLogLevel(logLevel.get());
        }
    }

    static void setLogLevel(@Nullable LogLevel level) {
        if (level == null) {
            level = LogLevel.INFO;
        }
        Configurator.setLevel(TRACECORE_LOGGER, Level.toLevel(level.toString(), Level.INFO));
    }
}
