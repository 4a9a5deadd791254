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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for file appenders.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Drotlog.rolling.strategy=size})</li>
 *   <li>Environment variables (e.g., {@code ROTLOG_ROLLING_STRATEGY})</li>
 *   <li>Properties file ({@code rotlog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 * Rolling values are kept as raw strings; {@link #rollingSpec()} parses them and
 * falls back to no rotation when they are invalid.
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>bufferSize</td><td>rotlog.bufferSize</td><td>ROTLOG_BUFFER_SIZE</td><td>8192</td></tr>
 *   <tr><td>strategy</td><td>rotlog.rolling.strategy</td><td>ROTLOG_ROLLING_STRATEGY</td><td>(none)</td></tr>
 *   <tr><td>interval</td><td>rotlog.rolling.interval</td><td>ROTLOG_ROLLING_INTERVAL</td><td>daily</td></tr>
 *   <tr><td>maxBytes</td><td>rotlog.rolling.maxBytes</td><td>ROTLOG_ROLLING_MAX_BYTES</td><td>(none)</td></tr>
 *   <tr><td>maxRetainedFiles</td><td>rotlog.rolling.maxRetainedFiles</td><td>ROTLOG_ROLLING_MAX_RETAINED_FILES</td><td>-1 (keep all)</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # rotlog.properties
 * rotlog.bufferSize=8192
 * rotlog.rolling.strategy=time
 * rotlog.rolling.interval=hourly
 * rotlog.rolling.maxRetainedFiles=24
 * </pre>
 */
public final class FileAppenderConfig {

    private static final Logger LOG = LoggerFactory.getLogger(FileAppenderConfig.class);

    private static final String PROPERTIES_FILE = "rotlog.properties";

    // Property keys
    static final String PROP_BUFFER_SIZE = "rotlog.bufferSize";
    static final String PROP_STRATEGY = "rotlog.rolling.strategy";
    static final String PROP_INTERVAL = "rotlog.rolling.interval";
    static final String PROP_MAX_BYTES = "rotlog.rolling.maxBytes";
    static final String PROP_MAX_RETAINED_FILES = "rotlog.rolling.maxRetainedFiles";

    // Environment variable keys
    private static final String ENV_BUFFER_SIZE = "ROTLOG_BUFFER_SIZE";
    private static final String ENV_STRATEGY = "ROTLOG_ROLLING_STRATEGY";
    private static final String ENV_INTERVAL = "ROTLOG_ROLLING_INTERVAL";
    private static final String ENV_MAX_BYTES = "ROTLOG_ROLLING_MAX_BYTES";
    private static final String ENV_MAX_RETAINED_FILES = "ROTLOG_ROLLING_MAX_RETAINED_FILES";

    // Defaults
    private static final int DEFAULT_BUFFER_SIZE = FileAppender.DEFAULT_BUFFER_SIZE;
    private static final String DEFAULT_STRATEGY = "";
    private static final String DEFAULT_INTERVAL = "daily";
    private static final String DEFAULT_MAX_BYTES = "";
    private static final int DEFAULT_MAX_RETAINED_FILES = -1;

    private final int bufferSize;
    private final String strategy;
    private final String interval;
    private final String maxBytes;
    private final int maxRetainedFiles;

    private FileAppenderConfig(Builder builder) {
        this.bufferSize = builder.bufferSize;
        this.strategy = builder.strategy;
        this.interval = builder.interval;
        this.maxBytes = builder.maxBytes;
        this.maxRetainedFiles = builder.maxRetainedFiles;
    }

    /** Read buffer size in bytes. */
    public int bufferSize() {
        return bufferSize;
    }

    /** Raw rolling strategy: "", "none", "time" or "size". */
    public String strategy() {
        return strategy;
    }

    /** Raw rolling interval for the "time" strategy. */
    public String interval() {
        return interval;
    }

    /** Raw byte threshold for the "size" strategy. */
    public String maxBytes() {
        return maxBytes;
    }

    /** Number of archives to keep; zero or negative keeps all. */
    public int maxRetainedFiles() {
        return maxRetainedFiles;
    }

    /**
     * Parses the rolling values. Invalid values are logged and yield {@link RollingSpec#NONE}.
     */
    public RollingSpec rollingSpec() {
        return RollingSpec.parse(strategy, interval, maxBytes);
    }

    @Override
    public String toString() {
        return "FileAppenderConfig{" +
                "bufferSize=" + bufferSize +
                ", strategy='" + strategy + '\'' +
                ", interval='" + interval + '\'' +
                ", maxBytes='" + maxBytes + '\'' +
                ", maxRetainedFiles=" + maxRetainedFiles +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code FileAppenderConfig.builder().build()}.
     */
    public static FileAppenderConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link FileAppenderConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Integer bufferSize;
        private String strategy;
        private String interval;
        private String maxBytes;
        private Integer maxRetainedFiles;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the read buffer size (default: 8192). */
        public Builder bufferSize(int bufferSize) {
            if (bufferSize <= 0) {
                throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
            }
            this.bufferSize = bufferSize;
            return this;
        }

        /** Sets the rolling strategy: "", "none", "time" or "size". */
        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        /** Sets the rolling interval: daily, hourly, minutely or a number of seconds. */
        public Builder interval(String interval) {
            this.interval = interval;
            return this;
        }

        /** Sets the size threshold in bytes for the "size" strategy. */
        public Builder maxBytes(String maxBytes) {
            this.maxBytes = maxBytes;
            return this;
        }

        /** Sets the size threshold in bytes for the "size" strategy. */
        public Builder maxBytes(long maxBytes) {
            return maxBytes(Long.toString(maxBytes));
        }

        /** Sets how many archives to keep; zero or negative keeps all. */
        public Builder maxRetainedFiles(int maxRetainedFiles) {
            this.maxRetainedFiles = maxRetainedFiles;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public FileAppenderConfig build() {
            if (bufferSize == null) {
                bufferSize = resolveInt(PROP_BUFFER_SIZE, ENV_BUFFER_SIZE, DEFAULT_BUFFER_SIZE);
                if (bufferSize <= 0) {
                    LOG.warn("Ignoring non-positive buffer size {}, using {}", bufferSize, DEFAULT_BUFFER_SIZE);
                    bufferSize = DEFAULT_BUFFER_SIZE;
                }
            }
            if (strategy == null) {
                strategy = resolveString(PROP_STRATEGY, ENV_STRATEGY, DEFAULT_STRATEGY);
            }
            if (interval == null) {
                interval = resolveString(PROP_INTERVAL, ENV_INTERVAL, DEFAULT_INTERVAL);
            }
            if (maxBytes == null) {
                maxBytes = resolveString(PROP_MAX_BYTES, ENV_MAX_BYTES, DEFAULT_MAX_BYTES);
            }
            if (maxRetainedFiles == null) {
                maxRetainedFiles = resolveInt(PROP_MAX_RETAINED_FILES, ENV_MAX_RETAINED_FILES,
                        DEFAULT_MAX_RETAINED_FILES);
            }

            return new FileAppenderConfig(this);
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 4. Default
            return defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolveString(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Invalid integer [{}] for {}, using default {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = FileAppenderConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
