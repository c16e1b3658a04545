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


import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link MediaFile} backed by a local file, read with positional {@link FileChannel} reads.
 * The size is captured when the instance is created.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PathMediaFile implements MediaFile {

    private final Path path;
    private final String fileName;
    private final long size;

    public PathMediaFile(Path path) throws IOException {
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new IOException("Not a readable file: " + path);
        }
        this.fileName = path.getFileName().toString();
        this.size = Files.size(path);
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getFileName() {
        return fileName;
    }

    @Override
    public long getSize() {
        return size;
    }

    @Override
    public byte[] read(long offset, int length) throws IOException {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: offset=" + offset + ", length=" + length);
        }
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    throw new EOFException(String.format("Unexpected end of %s at byte %d (wanted [%d, %d))",
                            path, position, offset, offset + length));
                }
                position += read;
            }
        }
        return buffer.array();
    }

    @Override
    public String toString() {
        return "PathMediaFile{path=" + path + ", size=" + size + '}';
    }
}
