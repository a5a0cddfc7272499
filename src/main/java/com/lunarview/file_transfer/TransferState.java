package com.lunarview.file_transfer;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Book-keeping for one file in flight, either direction.
 *
 * Received chunks are keyed by chunk index, so duplicates and out-of-order
 * arrivals land in the same slot and memory only grows with chunks that
 * actually arrived. The received count only moves when an empty slot is
 * filled. Not thread-safe; guarded by
 * the owning {@link ChunkedFileTransfer}.
 */
public class TransferState {

    private final String fileId;
    private final String fileName;
    private final TransferDirection direction;
    private final long fileSize;
    private final int totalChunks;
    private final String checksum;
    private final long startTime;

    // SEND
    private Path sourcePath;
    private int nextChunk;
    private final Map<Integer, Integer> retries = new HashMap<>();

    // RECEIVE
    private Map<Integer, byte[]> chunks;
    private int receivedCount;
    private Path savedPath;

    private TransferStatus status = TransferStatus.PENDING;
    private long transferredBytes;
    private long lastActivity;

    private TransferState(String fileId, String fileName, TransferDirection direction, long fileSize,
                          int totalChunks, String checksum, long now) {
        this.fileId = fileId;
        this.fileName = fileName;
        this.direction = direction;
        this.fileSize = fileSize;
        this.totalChunks = totalChunks;
        this.checksum = checksum;
        this.startTime = now;
        this.lastActivity = now;
    }

    static TransferState outgoing(String fileId, Path source, long fileSize, int totalChunks,
                                  String checksum, long now) {
        TransferState state = new TransferState(fileId, source.getFileName().toString(),
            TransferDirection.SEND, fileSize, totalChunks, checksum, now);
        state.sourcePath = source;
        return state;
    }

    static TransferState incoming(String fileId, String fileName, long fileSize, int totalChunks,
                                  String checksum, long now) {
        TransferState state = new TransferState(fileId, fileName, TransferDirection.RECEIVE,
            fileSize, totalChunks, checksum, now);
        state.chunks = new HashMap<>();
        return state;
    }

    /**
     * Store a verified chunk. A slot that is already filled is left alone.
     *
     * @return true if this call filled a new slot
     */
    boolean storeChunk(int index, byte[] data) {
        if (chunks.putIfAbsent(index, data) != null) {
            return false;
        }
        receivedCount++;
        transferredBytes += data.length;
        return true;
    }

    boolean isComplete() {
        return receivedCount == totalChunks;
    }

    /** @return the retry count for {@code index} after this one */
    int recordRetry(int index) {
        return retries.merge(index, 1, Integer::sum);
    }

    void chunkSent(int length) {
        nextChunk++;
        transferredBytes += length;
    }

    /**
     * Received chunks in index order, with null for any index still missing.
     * Only called once every chunk has arrived.
     */
    byte[][] orderedChunks() {
        byte[][] ordered = new byte[totalChunks][];
        for (Map.Entry<Integer, byte[]> e : chunks.entrySet()) {
            ordered[e.getKey()] = e.getValue();
        }
        return ordered;
    }

    void releaseChunks() {
        if (chunks != null) {
            chunks.clear();
        }
    }

    void touch(long now) {
        lastActivity = now;
    }

    void setStatus(TransferStatus status) {
        this.status = status;
    }

    void setSavedPath(Path savedPath) {
        this.savedPath = savedPath;
    }

    public String getFileId() { return fileId; }
    public String getFileName() { return fileName; }
    public TransferDirection getDirection() { return direction; }
    public long getFileSize() { return fileSize; }
    public int getTotalChunks() { return totalChunks; }
    public String getChecksum() { return checksum; }
    public long getStartTime() { return startTime; }
    public long getLastActivity() { return lastActivity; }
    public TransferStatus getStatus() { return status; }
    public long getTransferredBytes() { return transferredBytes; }
    public int getReceivedCount() { return receivedCount; }
    public int getNextChunk() { return nextChunk; }
    public Path getSourcePath() { return sourcePath; }
    public Path getSavedPath() { return savedPath; }

    @Override
    public String toString() {
        return "TransferState{" + fileId + " " + direction + " " + fileName + " " + status + "}";
    }
}
