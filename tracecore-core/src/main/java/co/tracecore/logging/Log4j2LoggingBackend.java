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

import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggingBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.spi.LoggerContext;

/**
 * Writes the events of tracecore loggers to a Log4j2 {@link LoggerContext}.
 */
public class Log4j2LoggingBackend implements LoggingBackend {

    private final LoggerContext loggerContext;

    public Log4j2LoggingBackend() {
        this(LogManager.getContext(false));
    }

    public Log4j2LoggingBackend(LoggerContext loggerContext) {
        this.loggerContext = loggerContext;
    }

    @Override
    public Logger getLogger(String name) {
        final String log4jName = Logger.ROOT_LOGGER_NAME.equals(name) ? LogManager.ROOT_LOGGER_NAME : name;
        return new Log4j2LoggerBridge(loggerContext.getLogger(log4jName), name);
    }
}
