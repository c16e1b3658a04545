package dev.mars.uplink.core;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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


import java.io.IOException;

/**
 * The caller's handle on the source bytes of an upload.
 *
 * <p>Implementations must return exactly the requested range. The upload client reads
 * one chunk at a time and never holds more than one chunk in memory.</p>
 */
public interface MediaFile {

    /**
     * Name reported to the server when the session is created.
     */
    String getFileName();

    /**
     * Total size in bytes. Must not change for the lifetime of an upload.
     */
    long getSize();

    /**
     * Read the half-open range {@code [offset, offset + length)}.
     *
     * @param offset first byte to read
     * @param length number of bytes to read
     * @return a new array of exactly {@code length} bytes
     * @throws IOException if the range cannot be read in full
     */
    byte[] read(long offset, int length) throws IOException;
}
