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
import java.util.List;

/**
 * Decides when a {@link RollingFileAppender} rotates its file and how the
 * archived file is named.
 * <p>
 * Policies are only ever touched by the appender's writer thread, so
 * implementations keep plain mutable state without synchronization.
 * <p>
 * <b>Call order per pending write:</b>
 * <pre>{@code
 * if (policy.shouldRotate(n)) {
 *     String suffix = policy.archiveSuffix();   // names the file being closed
 *     // close, rename to <file><suffix>, reopen
 *     policy.onRotate();
 * }
 * // write n bytes
 * policy.bytesWritten(n);
 * }</pre>
 *
 * @see TimeBasedRollingPolicy
 * @see SizeBasedRollingPolicy
 */
public interface RollingPolicy {

    /**
     * Whether the current file must be rotated before writing the pending bytes.
     *
     * @param pendingBytes number of bytes about to be written
     * @return true if the appender should rotate first
     */
    boolean shouldRotate(long pendingBytes);

    /**
     * Resets internal counters or timers after a rotation.
     */
    void onRotate();

    /**
     * Suffix appended to the active file name to form the archive name.
     * Must be called before {@link #onRotate()}.
     */
    String archiveSuffix();

    /**
     * Reports bytes that reached the current file.
     */
    default void bytesWritten(long bytes) {
    }

    /**
     * Called once when the appender first opens its file, before any write.
     *
     * @param activeFileBytes size of the active file as found on disk
     * @param archives        archives left behind by earlier runs, in name order
     */
    default void recover(long activeFileBytes, List<Path> archives) {
    }
}
