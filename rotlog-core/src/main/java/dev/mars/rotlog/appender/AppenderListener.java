/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.rotlog.appender;

import java.nio.file.Path;

/**
 * Receives lifecycle events from an appender.
 * <p>
 * All callbacks run on the appender's writer thread and must not block.
 * Exceptions thrown by a listener are logged and otherwise ignored.
 */
public interface AppenderListener {

    /** Listener that ignores every event. */
    AppenderListener NONE = new AppenderListener() {
    };

    /** The writer thread has opened the file and started reading. */
    default void onStarted(Path file) {
    }

    /** The active file was archived under {@code archive} and reopened empty. */
    default void onRotated(Path file, Path archive) {
    }

    /** The loop failed and is terminating. */
    default void onError(Path file, Throwable cause) {
    }

    /** The loop has exited and the file is closed. */
    default void onTerminated(Path file) {
    }
}
