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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.Message;
import org.apache.logging.log4j.spi.ExtendedLogger;

/**
 * Forwards the events of a tracecore {@link Logger} to a Log4j2 logger.
 * <p>
 * Events are logged with this class as the logger FQCN, so that Log4j2 reports the tracecore class which logged the event as location.
 * </p>
 */
public class Log4j2LoggerBridge implements Logger {

    static final String FQCN = Log4j2LoggerBridge.class.getName();

    private final ExtendedLogger log4jLogger;
    private final String name;

    public Log4j2LoggerBridge(ExtendedLogger log4jLogger, String name) {
        this.log4jLogger = log4jLogger;
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isTraceEnabled() {
        return isEnabled(Level.TRACE);
    }

    @Override
    public void trace(String format, Object... arguments) {
        log(Level.TRACE, format, arguments);
    }

    @Override
    public void trace(String msg, Throwable t) {
        log(Level.TRACE, msg, t);
    }

    @Override
    public boolean isDebugEnabled() {
        return isEnabled(Level.DEBUG);
    }

    @Override
    public void debug(String format, Object... arguments) {
        log(Level.DEBUG, format, arguments);
    }

    @Override
    public void debug(String msg, Throwable t) {
        log(Level.DEBUG, msg, t);
    }

    @Override
    public boolean isInfoEnabled() {
        return isEnabled(Level.INFO);
    }

    @Override
    public void info(String format, Object... arguments) {
        log(Level.INFO, format, arguments);
    }

    @Override
    public void info(String msg, Throwable t) {
        log(Level.INFO, msg, t);
    }

    @Override
    public boolean isWarnEnabled() {
        return isEnabled(Level.WARN);
    }

    @Override
    public void warn(String format, Object... arguments) {
        log(Level.WARN, format, arguments);
    }

    @Override
    public void warn(String msg, Throwable t) {
        log(Level.WARN, msg, t);
    }

    @Override
    public boolean isErrorEnabled() {
        return isEnabled(Level.ERROR);
    }

    @Override
    public void error(String format, Object... arguments) {
        log(Level.ERROR, format, arguments);
    }

    @Override
    public void error(String msg, Throwable t) {
        log(Level.ERROR, msg, t);
    }

    private boolean isEnabled(Level level) {
        return log4jLogger.isEnabled(level);
    }

    private void log(Level level, String format, Object[] arguments) {
        if (log4jLogger.isEnabled(level)) {
            // a trailing Throwable argument is logged as the event's exception
            Message message = log4jLogger.getMessageFactory().newMessage(format, arguments);
            log4jLogger.logMessage(FQCN, level, null, message, message.getThrowable());
        }
    }

    private void log(Level level, String msg, Throwable t) {
        if (log4jLogger.isEnabled(level)) {
            log4jLogger.logMessage(FQCN, level, null, log4jLogger.getMessageFactory().newMessage(msg), t);
        }
    }
}
