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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Appends an input stream to a single, never rotated file.
 * <p>
 * <b>Thread Safety:</b>
 * The read-write loop runs on a dedicated single-threaded executor. The output
 * channel, the read buffer and any subclass state are touched only by that
 * thread, so no locking is needed. The stop flag is the only state written by
 * other threads.
 * <p>
 * <b>Loop:</b>
 * <ol>
 *   <li>Open the destination in append mode</li>
 *   <li>Read into the fixed buffer until end of input or {@link #stop()}</li>
 *   <li>Append exactly the bytes of each read, in order</li>
 *   <li>Flush and close the file on every exit path</li>
 * </ol>
 * A read error after {@link #stop()} is the expected result of the caller
 * closing the stream and is ignored. Any other read or file error is logged and
 * ends the loop without retry.
 *
 * @see RollingFileAppender
 */
public class FileAppender implements StreamAppender {

    private static final Logger LOG = LoggerFactory.getLogger(FileAppender.class);

    /** Default read buffer size in bytes. */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    private final InputStream inputStream;
    private final Path file;
    private final int bufferSize;
    private final AppenderListener listener;

    /**
     * Single-threaded executor running the read-write loop.
     * <p>
     * <b>INVARIANT:</b> this is the only thread that ever touches
     * {@link #outputChannel}. Do not add other write paths.
     */
    private final ExecutorService appendExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private FileChannel outputChannel;
    private volatile boolean markedForStop = false;
    private volatile long bytesAppended = 0;
    private volatile CompletableFuture<Void> termination;

    public FileAppender(InputStream inputStream, Path file) {
        this(inputStream, file, DEFAULT_BUFFER_SIZE);
    }

    public FileAppender(InputStream inputStream, Path file, int bufferSize) {
        this(inputStream, file, bufferSize, AppenderListener.NONE);
    }

    /**
     * Creates an appender. Nothing is read until {@link #start()} is called.
     *
     * @param inputStream stream to drain; this appender becomes its only reader
     * @param file        destination file, created with its parent directories if missing
     * @param bufferSize  read buffer size, must be positive
     * @param listener    receives lifecycle events on the writer thread
     */
    public FileAppender(InputStream inputStream, Path file, int bufferSize, AppenderListener listener) {
        this.inputStream = Objects.requireNonNull(inputStream, "inputStream");
        this.file = Objects.requireNonNull(file, "file");
        this.listener = Objects.requireNonNull(listener, "listener");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;

        this.appendExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "File appending thread for " + file);
            t.setDaemon(true);
            return t;
        });
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public FileAppender start() {
        if (!started.compareAndSet(false, true)) {
            LOG.debug("Appender for {} already started, ignoring duplicate start()", file);
            return this;
        }
        termination = CompletableFuture.runAsync(this::appendStreamToFile, appendExecutor);
        // The queued loop still runs; the thread exits once it is done.
        appendExecutor.shutdown();
        return this;
    }

    @Override
    public void stop() {
        if (!markedForStop) {
            LOG.debug("Stop requested for appender on {}", file);
        }
        markedForStop = true;
    }

    @Override
    public void awaitTermination() {
        termination().join();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            termination().get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // The loop handles its own failures; anything reaching here is an Error.
            throw new IllegalStateException("Appender for " + file + " died", e.getCause());
        }
    }

    @Override
    public CompletableFuture<Void> termination() {
        CompletableFuture<Void> future = termination;
        if (future == null) {
            throw new IllegalStateException("Appender for " + file + " was never started");
        }
        return future;
    }

    @Override
    public Path file() {
        return file;
    }

    @Override
    public long bytesAppended() {
        return bytesAppended;
    }

    public int bufferSize() {
        return bufferSize;
    }

    /** Whether {@link #stop()} has been called. */
    public boolean isStopRequested() {
        return markedForStop;
    }

    // ========================================================================
    // Read-write loop (writer thread only)
    // ========================================================================

    /**
     * Continuously reads chunks from the input stream and appends them to the file.
     */
    protected void appendStreamToFile() {
        try {
            LOG.debug("Started appending thread for {}", file);
            try {
                openFile();
                notifyListener(l -> l.onStarted(file));
                byte[] buf = new byte[bufferSize];
                int n = 0;
                while (!markedForStop && n != -1) {
                    try {
                        n = inputStream.read(buf);
                    } catch (IOException e) {
                        if (!markedForStop) {
                            throw e;
                        }
                        // The stream was closed under us after stop(); nothing left to append.
                        LOG.debug("Ignoring read failure on {} after stop: {}", file, e.getMessage());
                        break;
                    }
                    if (n > 0) {
                        appendToFile(buf, n);
                    }
                }
            } finally {
                closeFile();
            }
        } catch (Exception e) {
            LOG.error("Error writing stream to file {}", file, e);
            notifyListener(l -> l.onError(file, e));
        } finally {
            LOG.debug("Appending thread for {} finished, {} bytes appended", file, bytesAppended);
            notifyListener(l -> l.onTerminated(file));
        }
    }

    /**
     * Appends the first {@code len} bytes of the buffer to the file.
     */
    protected void appendToFile(byte[] bytes, int len) throws IOException {
        if (outputChannel == null) {
            openFile();
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes, 0, len);
        while (buf.hasRemaining()) {
            outputChannel.write(buf);
        }
        bytesAppended += len;
        LOG.trace("Appended {} bytes to {}", len, file);
    }

    /**
     * Opens the destination in append mode, creating parent directories as needed.
     */
    protected void openFile() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        outputChannel = FileChannel.open(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
        LOG.debug("Opened file {}", file);
    }

    /**
     * Flushes and closes the destination. No-op if it is not open.
     */
    protected void closeFile() throws IOException {
        FileChannel channel = outputChannel;
        if (channel == null) {
            return;
        }
        outputChannel = null;
        try {
            channel.force(false);
        } finally {
            channel.close();
        }
        LOG.debug("Closed file {}", file);
    }

    /**
     * Size of the open destination file, or 0 if it is not open.
     */
    protected long currentFileSize() throws IOException {
        return outputChannel == null ? 0L : outputChannel.size();
    }

    protected void notifyListener(Consumer<AppenderListener> event) {
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            LOG.warn("Appender listener failed for {}: {}", file, e.getMessage(), e);
        }
    }
}
