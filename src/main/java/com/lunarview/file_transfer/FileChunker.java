package com.lunarview.file_transfer;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Fixed-size slicing of a file and reassembly of the slices.
 *
 * A file of {@code size} bytes split at {@code chunkSize} yields
 * {@code ceil(size / chunkSize)} chunks; every chunk is full except
 * possibly the last. An empty file has no chunks.
 */
public final class FileChunker {

    private FileChunker() {
    }

    public static int chunkCount(long fileSize, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (fileSize < 0) {
            throw new IllegalArgumentException("fileSize must not be negative: " + fileSize);
        }
        long count = (fileSize + chunkSize - 1) / chunkSize;
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many chunks: " + count);
        }
        return (int) count;
    }

    /**
     * Read chunk {@code index} of the file behind {@code channel}.
     */
    public static byte[] readChunk(FileChannel channel, int index, int chunkSize) throws IOException {
        long size = channel.size();
        long offset = (long) index * chunkSize;
        if (index < 0 || offset >= size) {
            throw new IllegalArgumentException("Chunk " + index + " out of range for " + size + " bytes");
        }
        int length = (int) Math.min(chunkSize, size - offset);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset + buffer.position());
            if (read < 0) {
                throw new EOFException("File shrank while reading chunk " + index);
            }
        }
        return buffer.array();
    }

    public static byte[] readChunk(Path file, int index, int chunkSize) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            return readChunk(channel, index, chunkSize);
        }
    }

    /**
     * Write {@code chunks} in index order to {@code target}, replacing it.
     *
     * @return the number of bytes written
     * @throws IllegalStateException if any chunk is missing
     */
    public static long assemble(byte[][] chunks, Path target) throws IOException {
        long written = 0;
        try (FileChannel out = FileChannel.open(target, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (int i = 0; i < chunks.length; i++) {
                if (chunks[i] == null) {
                    throw new IllegalStateException("Chunk " + i + " missing");
                }
                ByteBuffer buffer = ByteBuffer.wrap(chunks[i]);
                while (buffer.hasRemaining()) {
                    written += out.write(buffer);
                }
            }
        }
        return written;
    }
}
