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
package co.tracecore.sdk.logging;

import javax.annotation.Nullable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Hands out the loggers of all tracecore components.
 * <p>
 * Loggers can be obtained, and stored in {@code static final} fields, before a {@link LoggingBackend} is
 * {@linkplain #initialize(LoggingBackend) initialized}. Such loggers discard all events until then.
 * Every logger handed out follows later calls to {@link #initialize(LoggingBackend)}.
 * </p>
 */
public final class LoggerFactory {

    private static final ConcurrentMap<String, RebindableLogger> loggers = new ConcurrentHashMap<>();
    @Nullable
    private static volatile LoggingBackend backend;

    private LoggerFactory() {
    }

    /**
     * Routes all loggers, including the ones already handed out, to {@code backend}.
     *
     * @param backend the new logging backend, or {@code null} to discard all events
     */
    public static synchronized void initialize(@Nullable LoggingBackend backend) {
        LoggerFactory.backend = backend;
        for (RebindableLogger logger : loggers.values()) {
            logger.bind(resolve(backend, logger.getName()));
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    /**
     * @return the logger with the given name, the same instance for every call with the same name
     */
    public static Logger getLogger(String name) {
        RebindableLogger logger = loggers.get(name);
        if (logger != null) {
            return logger;
        }
        synchronized (LoggerFactory.class) {
            logger = loggers.get(name);
            if (logger == null) {
                logger = new RebindableLogger(name, resolve(backend, name));
                loggers.put(name, logger);
            }
            return logger;
        }
    }

    private static Logger resolve(@Nullable LoggingBackend backend, String name) {
        if (backend == null) {
            return NoopLogger.INSTANCE;
        }
        Logger logger = backend.getLogger(name);
        return logger != null ? logger : NoopLogger.INSTANCE;
    }
}
