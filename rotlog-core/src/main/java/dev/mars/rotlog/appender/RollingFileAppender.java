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
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A {@link FileAppender} that rotates its file according to a {@link RollingPolicy}.
 * <p>
 * Before each write the policy is asked whether to rotate. Rotation closes the
 * active file, renames it to {@code <file><suffix>}, reopens an empty file at
 * the original path and then performs the write. All of this happens on the
 * writer thread, so rotation never races with a read or another write.
 * <p>
 * <b>Files:</b>
 * <pre>
 * logs/
 *  ├─ stdout                    // active file, always unsuffixed
 *  ├─ stdout--2026-10-19--10-00 // archives, never written again
 *  └─ stdout--2026-10-19--10-01
 * </pre>
 * If an archive name is already taken (for example after a restart within the
 * same period) {@code .1}, {@code .2}, ... is appended.
 * <p>
 * <b>Retention:</b> with {@code maxRetainedFiles > 0}, only the newest archives
 * (by name) are kept after each rotation.
 */
public class RollingFileAppender extends FileAppender {

    private static final Logger LOG = LoggerFactory.getLogger(RollingFileAppender.class);

    /** Separator that starts every archive suffix. */
    static final String ARCHIVE_SEPARATOR = "--";

    private final RollingPolicy policy;
    private final int maxRetainedFiles;

    private boolean recovered = false;
    private volatile int rotations = 0;

    public RollingFileAppender(InputStream inputStream, Path file, RollingPolicy policy) {
        this(inputStream, file, policy, DEFAULT_BUFFER_SIZE, -1, AppenderListener.NONE);
    }

    /**
     * @param inputStream      stream to drain
     * @param file             active destination file
     * @param policy           decides when to rotate; owned by this appender from now on
     * @param bufferSize       read buffer size, must be positive
     * @param maxRetainedFiles archives to keep, {@code <= 0} keeps all
     * @param listener         receives lifecycle and rotation events
     */
    public RollingFileAppender(InputStream inputStream,
                               Path file,
                               RollingPolicy policy,
                               int bufferSize,
                               int maxRetainedFiles,
                               AppenderListener listener) {
        super(inputStream, file, bufferSize, listener);
        this.policy = Objects.requireNonNull(policy, "policy");
        this.maxRetainedFiles = maxRetainedFiles;
    }

    @Override
    public RollingFileAppender start() {
        super.start();
        return this;
    }

    public RollingPolicy policy() {
        return policy;
    }

    public int maxRetainedFiles() {
        return maxRetainedFiles;
    }

    /** Number of rotations performed so far. */
    public int rotations() {
        return rotations;
    }

    // ========================================================================
    // Write path (writer thread only)
    // ========================================================================

    @Override
    protected void appendToFile(byte[] bytes, int len) throws IOException {
        if (policy.shouldRotate(len)) {
            rollover();
        }
        super.appendToFile(bytes, len);
        policy.bytesWritten(len);
    }

    @Override
    protected void openFile() throws IOException {
        super.openFile();
        if (!recovered) {
            recovered = true;
            long existing = currentFileSize();
            policy.recover(existing, archivedFiles());
            if (existing > 0) {
                LOG.debug("Resuming {} with {} existing bytes", file(), existing);
            }
        }
    }

    /**
     * Closes the active file, archives it and opens a fresh one.
     */
    private void rollover() throws IOException {
        if (currentFileSize() == 0) {
            // Nothing to archive; keep writing to the same file in the new period.
            LOG.debug("Skipping rollover of empty file {}", file());
            policy.onRotate();
            return;
        }
        closeFile();
        Path archive = nextArchivePath(policy.archiveSuffix());
        if (Files.exists(file())) {
            Files.move(file(), archive);
            LOG.info("Rolled over {} to {}", file(), archive);
        } else {
            LOG.warn("Active file {} disappeared before rollover, nothing archived", file());
        }
        policy.onRotate();
        openFile();
        rotations++;
        notifyListener(l -> l.onRotated(file(), archive));
        deleteOldFiles();
    }

    private Path nextArchivePath(String suffix) {
        String base = file().getFileName().toString() + suffix;
        Path candidate = file().resolveSibling(base);
        int attempt = 1;
        while (Files.exists(candidate)) {
            candidate = file().resolveSibling(base + "." + attempt++);
        }
        return candidate;
    }

    /**
     * Deletes the oldest archives beyond {@link #maxRetainedFiles()}.
     * Failures are logged and never stop the appender.
     */
    private void deleteOldFiles() {
        if (maxRetainedFiles <= 0) {
            return;
        }
        try {
            List<Path> archives = archivedFiles();
            int excess = archives.size() - maxRetainedFiles;
            for (int i = 0; i < excess; i++) {
                Path old = archives.get(i);
                try {
                    Files.deleteIfExists(old);
                    LOG.info("Deleted old rolled over file {}", old);
                } catch (IOException e) {
                    LOG.warn("Could not delete old rolled over file {}: {}", old, e.getMessage());
                }
            }
        } catch (IOException e) {
            LOG.warn("Could not list rolled over files for {}: {}", file(), e.getMessage());
        }
    }

    // ========================================================================
    // Archive listing
    // ========================================================================

    /**
     * Lists the archives of this appender's file, oldest first.
     *
     * @return siblings named {@code <file-name>--*}, sorted by name
     * @throws IOException if the directory cannot be read
     */
    public List<Path> archivedFiles() throws IOException {
        Path dir = file().toAbsolutePath().getParent();
        List<Path> archives = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) {
            return archives;
        }
        String prefix = file().getFileName().toString() + ARCHIVE_SEPARATOR;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, p ->
                Files.isRegularFile(p) && p.getFileName().toString().startsWith(prefix))) {
            for (Path entry : entries) {
                archives.add(entry);
            }
        }
        archives.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return archives;
    }
}
