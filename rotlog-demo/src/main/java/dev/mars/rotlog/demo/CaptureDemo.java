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
package dev.mars.rotlog.demo;

import dev.mars.rotlog.appender.FileAppenderConfig;
import dev.mars.rotlog.appender.FileAppenders;
import dev.mars.rotlog.appender.StreamAppender;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Captures a child process's stdout and stderr into (rotating) log files.
 * <p>
 * This demonstrates the appender lifecycle:
 * <ul>
 *   <li>Creating appenders from configuration</li>
 *   <li>Draining a live process stream</li>
 *   <li>Stopping, closing the stream and awaiting termination</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Rotation is configured by {@link FileAppenderConfig} with the following priority:
 * <ol>
 *   <li>System properties: {@code -Drotlog.rolling.strategy=size -Drotlog.rolling.maxBytes=1024 ...}</li>
 *   <li>Environment variables: {@code ROTLOG_ROLLING_STRATEGY, ROTLOG_ROLLING_INTERVAL, ...}</li>
 *   <li>Properties file: {@code rotlog.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 * The log directory is {@code -Drotlog.logDir} (default {@code logs}).
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl rotlog-demo -am
 *
 * # Capture the built-in sample process
 * java -cp "rotlog-demo/target/*:..." dev.mars.rotlog.demo.CaptureDemo
 *
 * # Capture any command, rolling every 200 bytes and keeping 3 archives
 * java -Drotlog.rolling.strategy=size -Drotlog.rolling.maxBytes=200 \
 *      -Drotlog.rolling.maxRetainedFiles=3 ... dev.mars.rotlog.demo.CaptureDemo ping -c 5 localhost
 * </pre>
 */
public class CaptureDemo {

    private static final List<String> SAMPLE_COMMAND = List.of("sh", "-c",
            "for i in 1 2 3 4 5 6 7 8 9 10; do echo \"stdout line $i\"; echo \"stderr line $i\" 1>&2; sleep 0.1; done");

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|        Process Capture Demo           |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        List<String> command = args.length > 0 ? Arrays.asList(args) : SAMPLE_COMMAND;
        Path logDir = Path.of(System.getProperty("rotlog.logDir", "logs"));
        FileAppenderConfig config = FileAppenderConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println("Rolling:       " + config.rollingSpec().describe());
        System.out.println("Command:       " + String.join(" ", command));
        System.out.println();

        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        InputStream stdout = process.getInputStream();
        InputStream stderr = process.getErrorStream();
        StreamAppender outAppender = FileAppenders.create(stdout, logDir.resolve("stdout"), config);
        StreamAppender errAppender = FileAppenders.create(stderr, logDir.resolve("stderr"), config);
        System.out.println("[OK] Capturing into " + logDir.toAbsolutePath());

        int exitCode = process.waitFor();
        System.out.println("[OK] Process exited with code " + exitCode);

        awaitOrForce(outAppender, stdout);
        awaitOrForce(errAppender, stderr);
        System.out.println("[OK] Appended " + outAppender.bytesAppended() + " stdout bytes, "
                + errAppender.bytesAppended() + " stderr bytes");

        System.out.println("\n  Files in " + logDir + ":");
        try (Stream<Path> files = Files.list(logDir)) {
            files.sorted().forEach(f -> System.out.printf("    %-40s %6d bytes%n",
                    f.getFileName(), sizeOf(f)));
        }

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Capture demo complete!               |");
        System.out.println("|  Run again to see files appended to.  |");
        System.out.println("+---------------------------------------+");
    }

    /**
     * Waits for the stream to end on its own. A grandchild process may keep it
     * open, so after a grace period stop the appender and close the stream.
     */
    private static void awaitOrForce(StreamAppender appender, InputStream in) throws InterruptedException {
        if (appender.awaitTermination(5, TimeUnit.SECONDS)) {
            return;
        }
        System.out.println("[WARN] " + appender.file() + " still open, closing it");
        appender.stop();
        try {
            in.close();
        } catch (IOException e) {
            System.out.println("[WARN] Could not close process stream: " + e.getMessage());
        }
        appender.awaitTermination();
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return -1;
        }
    }
}
