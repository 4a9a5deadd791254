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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Continuously appends the bytes of an input stream to a file.
 * <p>
 * One background thread per appender does all reading and writing. Callers
 * interact with it only through {@link #stop()} and the termination methods.
 * <p>
 * <b>Caller obligation:</b> {@link #stop()} is cooperative and cannot interrupt a
 * read that is blocked on the input stream. If the producer may stay silent
 * forever, close the input stream after stopping, otherwise
 * {@link #awaitTermination()} may never return.
 * <pre>{@code
 * StreamAppender appender = FileAppenders.create(process.getInputStream(), logFile, config);
 * ...
 * appender.stop();
 * process.getInputStream().close();
 * appender.awaitTermination();
 * }</pre>
 *
 * @see FileAppender
 * @see RollingFileAppender
 */
public interface StreamAppender {

    /**
     * Starts the background writer. Idempotent; returns immediately.
     *
     * @return this appender
     */
    StreamAppender start();

    /**
     * Asks the writer to stop after the current read. Never blocks and does
     * not close the input stream.
     */
    void stop();

    /**
     * Blocks until the writer has exited and the file is closed. Idempotent.
     *
     * @throws IllegalStateException if the appender was never started
     */
    void awaitTermination();

    /**
     * Waits at most the given time for the writer to exit.
     *
     * @return true if the writer has exited
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * A future completed when the writer has exited.
     *
     * @throws IllegalStateException if the appender was never started
     */
    CompletableFuture<Void> termination();

    /** The active destination file. */
    Path file();

    /** Total bytes appended to the destination so far, across rotations. */
    long bytesAppended();
}
