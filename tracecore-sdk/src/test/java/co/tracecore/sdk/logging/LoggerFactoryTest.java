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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class LoggerFactoryTest {

    @AfterEach
    void after() {
        LoggerFactory.initialize(null);
    }

    @Test
    void discardsEventsWithoutBackend() {
        Logger logger = LoggerFactory.getLogger("no-backend");

        assertThat(logger.getName()).isEqualTo("no-backend");
        assertThat(delegateOf(logger)).isSameAs(NoopLogger.INSTANCE);
        assertThat(logger.isErrorEnabled()).isFalse();
        logger.error("discarded {}", 1);
    }

    @Test
    void returnsSameLoggerPerName() {
        assertThat(LoggerFactory.getLogger(LoggerFactoryTest.class)).isSameAs(LoggerFactory.getLogger(LoggerFactoryTest.class.getName()));
        assertThat(LoggerFactory.getLogger("other")).isNotSameAs(LoggerFactory.getLogger(LoggerFactoryTest.class));
    }

    @Test
    void loggerObtainedAfterInitializeUsesBackend() {
        String name = "after-initialize";
        LoggingBackend backend = mock(LoggingBackend.class);
        Logger backendLogger = mock(Logger.class);
        doReturn(backendLogger).when(backend).getLogger(name);
        LoggerFactory.initialize(backend);

        LoggerFactory.getLogger(name).info("span {} exported", "foo");

        verify(backendLogger).info("span {} exported", "foo");
    }

    @Test
    void loggerObtainedBeforeInitializeFollowsBackendChanges() {
        String name = "before-initialize";
        Logger logger = LoggerFactory.getLogger(name);
        LoggingBackend backend = mock(LoggingBackend.class);
        Logger backendLogger = mock(Logger.class);
        doReturn(backendLogger).when(backend).getLogger(name);

        LoggerFactory.initialize(backend);
        assertThat(delegateOf(logger)).isSameAs(backendLogger);
        logger.warn("span {} dropped", "foo");
        verify(backendLogger).warn("span {} dropped", "foo");

        LoggerFactory.initialize(null);
        assertThat(delegateOf(logger)).isSameAs(NoopLogger.INSTANCE);
    }

    @Test
    void backendWithoutLoggerDiscardsEvents() {
        String name = "unsupported";
        LoggingBackend backend = mock(LoggingBackend.class);
        doReturn(null).when(backend).getLogger(name);
        LoggerFactory.initialize(backend);

        Logger logger = LoggerFactory.getLogger(name);

        assertThat(delegateOf(logger)).isSameAs(NoopLogger.INSTANCE);
        assertThat(logger.isDebugEnabled()).isFalse();
    }

    private static Logger delegateOf(Logger logger) {
        assertThat(logger).isInstanceOf(RebindableLogger.class);
        return ((RebindableLogger) logger).getDelegate();
    }
}
