package com.lunarview.file_transfer;

/**
 * Immutable snapshot of one transfer, handed to {@link TransferProgressListener}s.
 */
public final class TransferProgress {

    private final String fileId;
    private final String fileName;
    private final TransferDirection direction;
    private final long totalBytes;
    private final long transferredBytes;
    private final int percent;
    private final long bytesPerSecond;
    private final long remainingSeconds;
    private final TransferStatus status;

    TransferProgress(String fileId, String fileName, TransferDirection direction, long totalBytes,
                     long transferredBytes, int percent, long bytesPerSecond, long remainingSeconds,
                     TransferStatus status) {
        this.fileId = fileId;
        this.fileName = fileName;
        this.direction = direction;
        this.totalBytes = totalBytes;
        this.transferredBytes = transferredBytes;
        this.percent = percent;
        this.bytesPerSecond = bytesPerSecond;
        this.remainingSeconds = remainingSeconds;
        this.status = status;
    }

    static TransferProgress of(TransferState state, long now) {
        long total = state.getFileSize();
        long done = state.getTransferredBytes();
        int percent = total <= 0
            ? (state.getStatus() == TransferStatus.COMPLETED ? 100 : 0)
            : (int) Math.min(100, Math.round(done * 100.0 / total));
        long elapsedMillis = now - state.getStartTime();
        long speed = elapsedMillis > 0 ? done * 1000 / elapsedMillis : 0;
        long remaining = speed > 0 ? Math.max(0, total - done) / speed : 0;
        return new TransferProgress(state.getFileId(), state.getFileName(), state.getDirection(),
            total, done, percent, speed, remaining, state.getStatus());
    }

    public String getFileId() { return fileId; }
    public String getFileName() { return fileName; }
    public TransferDirection getDirection() { return direction; }
    public long getTotalBytes() { return totalBytes; }
    public long getTransferredBytes() { return transferredBytes; }
    public int getPercent() { return percent; }
    public long getBytesPerSecond() { return bytesPerSecond; }
    public long getRemainingSeconds() { return remainingSeconds; }
    public TransferStatus getStatus() { return status; }

    @Override
    public String toString() {
        return String.format("%s %s %d%% (%,d/%,d bytes, %s)",
            direction, fileName, percent, transferredBytes, totalBytes, status);
    }
}
