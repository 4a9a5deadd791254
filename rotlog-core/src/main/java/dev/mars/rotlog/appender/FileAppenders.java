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

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

/**
 * Creates the right appender for a configuration.
 * <p>
 * Rotation settings are parsed once by {@link RollingSpec}. When rotation is off
 * or misconfigured a plain {@link FileAppender} is returned, so a bad setting
 * never prevents log capture. Appenders are returned already started.
 */
public final class FileAppenders {

    private static final Logger LOG = LoggerFactory.getLogger(FileAppenders.class);

    private FileAppenders() {
    }

    /**
     * Creates and starts an appender for the given configuration.
     */
    public static StreamAppender create(InputStream inputStream, Path file, FileAppenderConfig config) {
        return create(inputStream, file, config, Clock.systemDefaultZone(), AppenderListener.NONE);
    }

    /**
     * Creates and starts an appender for the given configuration.
     *
     * @param inputStream stream to drain
     * @param file        active destination file
     * @param config      buffer and rolling settings
     * @param clock       time source for time based rolling; its zone names the archives
     * @param listener    receives lifecycle events
     * @return a started {@link FileAppender} or {@link RollingFileAppender}
     */
    public static StreamAppender create(InputStream inputStream,
                                        Path file,
                                        FileAppenderConfig config,
                                        Clock clock,
                                        AppenderListener listener) {
        RollingSpec spec = config.rollingSpec();
        Optional<RollingPolicy> policy = spec.newPolicy(clock);
        if (policy.isEmpty()) {
            LOG.debug("Appending to {} without rolling", file);
            return new FileAppender(inputStream, file, config.bufferSize(), listener).start();
        }
        LOG.info("Rolling logs enabled for {} with {}", file, spec.describe());
        return new RollingFileAppender(inputStream, file, policy.get(),
                config.bufferSize(), config.maxRetainedFiles(), listener).start();
    }
}
