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

/**
 * The logging system which {@link Logger}s obtained from {@link LoggerFactory} write to.
 */
public interface LoggingBackend {

    /**
     * @param name a logger name, or {@link Logger#ROOT_LOGGER_NAME} for the root logger of the logging system
     * @return the logger, or {@code null} if the logging system can't provide one, in which case events are discarded
     */
    @Nullable
    Logger getLogger(String name);
}
