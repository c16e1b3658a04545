package dev.mars.uplink.transfer;

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


import dev.mars.uplink.core.MediaFile;
import dev.mars.uplink.core.exceptions.ChunkTransferException;
import dev.mars.uplink.core.exceptions.UploadApiException;
import dev.mars.uplink.protocol.ResumableUploadApi;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Sends one byte range of the source file and returns the server's next offset.
 *
 * <p>The range is always {@code [offset, offset + min(chunkSize, totalSize - offset))}.
 * The returned offset is taken from the server verbatim; the only check applied is that it
 * moves forward and stays within the file, since anything else would break the offset
 * invariant of the session. There is no retry: every failure surfaces as a
 * {@link ChunkTransferException}.</p>
 */
public class ChunkTransmitter {
    private static final Logger logger = Logger.getLogger(ChunkTransmitter.class.getName());

    private final ResumableUploadApi api;

    public ChunkTransmitter(ResumableUploadApi api) {
        this.api = api;
    }

    /**
     * Length of the chunk that starts at {@code offset}.
     */
    public static int chunkLength(long offset, long totalSize, int chunkSize) {
        return (int) Math.min(chunkSize, totalSize - offset);
    }

    /**
     * Read and transmit the chunk starting at {@code offset}.
     *
     * @return the server-confirmed next offset, strictly greater than {@code offset}
     *         and at most {@code totalSize}
     * @throws ChunkTransferException if the range cannot be read, the call fails or the
     *         server reports an offset outside {@code (offset, totalSize]}
     */
    public long send(String sessionId, long offset, long totalSize, int chunkSize, MediaFile file)
            throws ChunkTransferException {
        if (offset >= totalSize) {
            throw new IllegalArgumentException("No bytes left to send at offset " + offset + " of " + totalSize);
        }
        int length = chunkLength(offset, totalSize, chunkSize);

        byte[] bytes;
        try {
            bytes = file.read(offset, length);
        } catch (IOException | RuntimeException e) {
            throw new ChunkTransferException(sessionId, offset, String.format(
                    "Failed to read bytes [%d, %d) of %s", offset, offset + length, file.getFileName()), e);
        }
        if (bytes == null || bytes.length != length) {
            throw new ChunkTransferException(sessionId, offset, String.format(
                    "Read %d bytes from %s, expected %d", bytes == null ? 0 : bytes.length,
                    file.getFileName(), length));
        }

        long nextOffset;
        try {
            nextOffset = api.transferChunk(sessionId, offset, bytes);
        } catch (UploadApiException | RuntimeException e) {
            throw new ChunkTransferException(sessionId, offset,
                    "Chunk [" + offset + ", " + (offset + length) + ") rejected: " + e.getMessage(), e);
        }

        if (nextOffset <= offset || nextOffset > totalSize) {
            throw new ChunkTransferException(sessionId, offset, String.format(
                    "Server returned offset %d after chunk at %d (total %d)", nextOffset, offset, totalSize));
        }
        if (nextOffset != offset + length) {
            logger.fine(String.format("Session %s: server confirmed %d instead of %d, adopting server offset",
                    sessionId, nextOffset, offset + length));
        }
        return nextOffset;
    }
}
