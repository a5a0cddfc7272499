package com.lunarview.file_transfer;

import com.lunarview.error.ChecksumMismatchException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.zip.CRC32C;

/**
 * Checksums used by the transfer protocol: CRC32C per chunk, SHA-256 over
 * the whole file. Both are rendered as lower-case hex.
 */
public final class ChunkChecksums {

    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final int READ_BUFFER = 64 * 1024;

    private ChunkChecksums() {
    }

    public static String crc32c(byte[] data) {
        CRC32C crc = new CRC32C();
        crc.update(data, 0, data.length);
        return String.format("%08x", crc.getValue());
    }

    public static String sha256(byte[] data) {
        return toHex(sha256Digest().digest(data));
    }

    public static String sha256(Path file) throws IOException {
        MessageDigest digest = sha256Digest();
        byte[] buffer = new byte[READ_BUFFER];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return toHex(digest.digest());
    }

    /**
     * @throws ChecksumMismatchException if the file's SHA-256 differs from {@code expected}
     */
    public static void verifyFile(Path file, String expected) throws IOException, ChecksumMismatchException {
        String actual = sha256(file);
        if (!actual.equalsIgnoreCase(expected)) {
            throw new ChecksumMismatchException("File checksum mismatch for " + file.getFileName()
                + ": expected " + expected + ", got " + actual);
        }
    }

    private static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0F];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0F];
        }
        return new String(out);
    }
}
