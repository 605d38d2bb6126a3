package io.abcsmc.status.sinks;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
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

import io.abcsmc.status.eventing.StatusSink;
import io.abcsmc.status.eventing.StatusUpdate;

/**
 * A sink that ignores all events. Used when progress display is disabled.
 */
public final class NoopStatusSink implements StatusSink {

    private static final NoopStatusSink INSTANCE = new NoopStatusSink();

    private NoopStatusSink() {
    }

    public static NoopStatusSink getInstance() {
        return INSTANCE;
    }

    @Override
    public void taskStarted(String task, long target) {
    }

    @Override
    public void taskUpdate(String task, StatusUpdate status) {
    }

    @Override
    public void taskFinished(String task, StatusUpdate status) {
    }
}
