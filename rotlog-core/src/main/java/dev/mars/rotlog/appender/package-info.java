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
/**
 * Streaming log appenders - drain a live input stream into a (rotating) file.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link dev.mars.rotlog.appender.StreamAppender} - The appender interface</li>
 *   <li>{@link dev.mars.rotlog.appender.FileAppender} - Single file, never rotated</li>
 *   <li>{@link dev.mars.rotlog.appender.RollingFileAppender} - Rotates by {@link dev.mars.rotlog.appender.RollingPolicy}</li>
 *   <li>{@link dev.mars.rotlog.appender.FileAppenders} - Picks the appender from {@link dev.mars.rotlog.appender.FileAppenderConfig}</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>One writer thread:</b> each appender owns a dedicated thread that does every read, write and rotation</li>
 *   <li><b>Cooperative stop:</b> {@code stop()} is a flag; closing the input stream is the caller's job</li>
 *   <li><b>Degrade gracefully:</b> invalid rotation settings fall back to a plain file</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * logs/
 *  ├─ stderr               // active file
 *  ├─ stderr--000001       // size based archives
 *  ├─ stdout               // active file
 *  └─ stdout--2026-10-19   // time based archives
 * </pre>
 *
 * @see dev.mars.rotlog.appender.StreamAppender
 */
package dev.mars.rotlog.appender;
