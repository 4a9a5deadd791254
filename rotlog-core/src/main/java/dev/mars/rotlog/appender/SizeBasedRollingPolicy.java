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

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rotates once the current file would grow past a byte threshold.
 * <p>
 * Archives are numbered with a zero-padded ordinal ({@code --000001},
 * {@code --000002}, ...) so that name order is creation order. Numbering
 * resumes after the highest ordinal already on disk.
 * <p>
 * A file is never archived while empty: a single write larger than the
 * threshold lands in a fresh file on its own and is rotated out by the next write.
 */
public final class SizeBasedRollingPolicy implements RollingPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(SizeBasedRollingPolicy.class);

    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("--(\\d{6,})(\\.\\d+)?$");

    private final long maxBytes;

    private long bytesSinceRotation;
    private long ordinal = 1;

    /**
     * @param maxBytes maximum size of a file before it is rotated, must be positive
     */
    public SizeBasedRollingPolicy(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Rollover size must be positive: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    public long maxBytes() {
        return maxBytes;
    }

    /** Bytes written to the current file since it was opened fresh. */
    public long bytesSinceRotation() {
        return bytesSinceRotation;
    }

    @Override
    public boolean shouldRotate(long pendingBytes) {
        return bytesSinceRotation > 0 && bytesSinceRotation + pendingBytes > maxBytes;
    }

    @Override
    public void onRotate() {
        bytesSinceRotation = 0;
        ordinal++;
    }

    @Override
    public void bytesWritten(long bytes) {
        bytesSinceRotation += bytes;
    }

    @Override
    public String archiveSuffix() {
        return String.format("--%06d", ordinal);
    }

    @Override
    public void recover(long activeFileBytes, List<Path> archives) {
        bytesSinceRotation = activeFileBytes;
        long highest = 0;
        for (Path archive : archives) {
            Matcher m = ORDINAL_SUFFIX.matcher(archive.getFileName().toString());
            if (m.find()) {
                try {
                    highest = Math.max(highest, Long.parseLong(m.group(1)));
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring archive with unreadable ordinal: {}", archive);
                }
            }
        }
        ordinal = highest + 1;
        LOG.debug("Recovered size policy: {} bytes in active file, next archive ordinal {}",
                activeFileBytes, ordinal);
    }

    @Override
    public String toString() {
        return "SizeBasedRollingPolicy{" +
                "maxBytes=" + maxBytes +
                ", bytesSinceRotation=" + bytesSinceRotation +
                ", ordinal=" + ordinal +
                '}';
    }
}
