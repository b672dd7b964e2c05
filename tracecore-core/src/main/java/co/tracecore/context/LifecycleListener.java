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
package co.tracecore.context;

import co.tracecore.impl.SpanRecorder;

/**
 * A {@link LifecycleListener} is notified when the {@link SpanRecorder} starts and stops.
 * <p>
 * Exceptions thrown by listeners are logged by the recorder and don't prevent other listeners from being notified.
 * </p>
 */
public interface LifecycleListener {

    /**
     * Callback for when the {@link SpanRecorder} has been started.
     * Spans can be started from this point on.
     *
     * @param recorder The recorder.
     */
    void start(SpanRecorder recorder) throws Exception;

    /**
     * Callback for when the {@link SpanRecorder} is stopped.
     * <p>
     * Implementations should release all resources, for example stop background threads.
     * </p>
     */
    void stop() throws Exception;
}
