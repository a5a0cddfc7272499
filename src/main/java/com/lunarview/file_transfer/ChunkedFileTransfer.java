package com.lunarview.file_transfer;

import com.lunarview.client.ClientSettings;
import com.lunarview.error.CapacityException;
import com.lunarview.error.ChecksumMismatchException;
import com.lunarview.error.TransportException;
import com.lunarview.protocol.MessageDispatcher;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.ProtocolException;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.protocol.SignalingChannel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ack-gated chunked file transfer over whichever {@link SignalingChannel}
 * currently reaches the partner.
 *
 * Sender: {@code file-start}, wait for {@code file-ready}, then one
 * {@code file-chunk} at a time, each sent only after the previous one was
 * acknowledged. A {@code file-chunk-retry} resends that index, up to the
 * configured limit. The last ack is followed by {@code file-complete}.
 *
 * Receiver: every chunk's CRC32C is recomputed. A mismatch asks for that
 * index again and stores nothing; a match is stored at its index and acked.
 * When every index is filled the chunks are written in order and the
 * SHA-256 announced in {@code file-start} is checked against the saved file.
 */
public class ChunkedFileTransfer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ChunkedFileTransfer.class.getName());

    private final SignalingChannel channel;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier clock;

    private final int chunkSize;
    private final long maxFileBytes;
    private final long staleMillis;
    private final long sweepIntervalMillis;
    private final int maxChunkRetries;
    private final Path downloadDir;

    private final Map<String, TransferState> transfers = new LinkedHashMap<>();
    private final List<TransferProgressListener> listeners = new CopyOnWriteArrayList<>();

    private final Consumer<SignalMessage> startHandler = this::onFileStart;
    private final Consumer<SignalMessage> readyHandler = this::onFileReady;
    private final Consumer<SignalMessage> chunkHandler = this::onFileChunk;
    private final Consumer<SignalMessage> ackHandler = this::onChunkAck;
    private final Consumer<SignalMessage> retryHandler = this::onChunkRetry;
    private final Consumer<SignalMessage> completeHandler = this::onFileComplete;
    private final Consumer<SignalMessage> cancelHandler = this::onFileCancel;

    private ScheduledFuture<?> sweepTask;
    private boolean started;

    public ChunkedFileTransfer(SignalingChannel channel, ClientSettings settings,
                               ScheduledExecutorService scheduler, LongSupplier clock) {
        this.channel = channel;
        this.scheduler = scheduler;
        this.clock = clock;
        this.chunkSize = settings.getChunkSize();
        this.maxFileBytes = settings.getMaxFileBytes();
        this.staleMillis = settings.getTransferStaleMillis();
        this.sweepIntervalMillis = settings.getTransferSweepIntervalMillis();
        this.maxChunkRetries = settings.getMaxChunkRetries();
        this.downloadDir = settings.getDownloadDir();
    }

    public ChunkedFileTransfer(SignalingChannel channel, ClientSettings settings,
                               ScheduledExecutorService scheduler) {
        this(channel, settings, scheduler, System::currentTimeMillis);
    }

    /**
     * Subscribe to the file-transfer kinds and start the stale-transfer sweep.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        MessageDispatcher dispatcher = channel.dispatcher();
        dispatcher.on(MessageType.FILE_START, startHandler);
        dispatcher.on(MessageType.FILE_READY, readyHandler);
        dispatcher.on(MessageType.FILE_CHUNK, chunkHandler);
        dispatcher.on(MessageType.FILE_CHUNK_ACK, ackHandler);
        dispatcher.on(MessageType.FILE_CHUNK_RETRY, retryHandler);
        dispatcher.on(MessageType.FILE_COMPLETE, completeHandler);
        dispatcher.on(MessageType.FILE_CANCEL, cancelHandler);
        sweepTask = scheduler.scheduleAtFixedRate(this::sweepStale,
            sweepIntervalMillis, sweepIntervalMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (!started) {
            return;
        }
        started = false;
        MessageDispatcher dispatcher = channel.dispatcher();
        dispatcher.off(MessageType.FILE_START, startHandler);
        dispatcher.off(MessageType.FILE_READY, readyHandler);
        dispatcher.off(MessageType.FILE_CHUNK, chunkHandler);
        dispatcher.off(MessageType.FILE_CHUNK_ACK, ackHandler);
        dispatcher.off(MessageType.FILE_CHUNK_RETRY, retryHandler);
        dispatcher.off(MessageType.FILE_COMPLETE, completeHandler);
        dispatcher.off(MessageType.FILE_CANCEL, cancelHandler);
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
    }

    public void addProgressListener(TransferProgressListener listener) {
        listeners.add(listener);
    }

    public void removeProgressListener(TransferProgressListener listener) {
        listeners.remove(listener);
    }

    // ===============================
    // Sender
    // ===============================

    /**
     * Announce {@code file} to the partner. Chunks follow once it replies
     * {@code file-ready}.
     *
     * @return the id of the new transfer
     * @throws CapacityException if the file exceeds the configured maximum; nothing is sent
     * @throws TransportException if the announcement could not be sent
     */
    public String sendFile(Path file) throws IOException, CapacityException, TransportException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        long size = Files.size(file);
        if (size > maxFileBytes) {
            throw new CapacityException("File too large: " + size + " bytes (limit " + maxFileBytes + ")");
        }
        int totalChunks = FileChunker.chunkCount(size, chunkSize);
        String checksum = ChunkChecksums.sha256(file);
        String fileId = UUID.randomUUID().toString().replace("-", "");

        TransferState state = TransferState.outgoing(fileId, file, size, totalChunks, checksum, clock.getAsLong());
        synchronized (this) {
            transfers.put(fileId, state);
        }

        SignalMessage announce = SignalMessage.of(MessageType.FILE_START)
            .with("fileId", fileId)
            .with("fileName", state.getFileName())
            .with("fileSize", size)
            .with("totalChunks", totalChunks)
            .with("checksum", checksum);
        if (!channel.send(announce)) {
            synchronized (this) {
                transfers.remove(fileId);
            }
            throw new TransportException("Could not announce " + state.getFileName() + ": no route to partner");
        }

        LOGGER.info("[FileTransfer] Offering " + state.getFileName() + " (" + size + " bytes, "
            + totalChunks + " chunks) as " + fileId);
        notifyProgress(state);
        return fileId;
    }

    private synchronized void onFileReady(SignalMessage message) {
        TransferState state = outgoing(message);
        if (state == null || state.getStatus() != TransferStatus.PENDING) {
            return;
        }
        state.setStatus(TransferStatus.TRANSFERRING);
        state.touch(clock.getAsLong());
        LOGGER.fine("[FileTransfer] Partner ready for " + state.getFileId());

        if (state.getTotalChunks() == 0) {
            finishSend(state);
        } else {
            sendChunk(state, 0);
        }
    }

    private synchronized void onChunkAck(SignalMessage message) {
        TransferState state = outgoing(message);
        if (state == null || state.getStatus() != TransferStatus.TRANSFERRING) {
            return;
        }
        int index = message.getInt("chunkIndex");
        if (index != state.getNextChunk() - 1) {
            LOGGER.fine("[FileTransfer] Ignoring stale ack " + index + " for " + state.getFileId());
            return;
        }
        state.touch(clock.getAsLong());
        notifyProgress(state);

        if (state.getNextChunk() < state.getTotalChunks()) {
            sendChunk(state, state.getNextChunk());
        } else {
            finishSend(state);
        }
    }

    private synchronized void onChunkRetry(SignalMessage message) {
        TransferState state = outgoing(message);
        if (state == null || state.getStatus() != TransferStatus.TRANSFERRING) {
            return;
        }
        int index = message.getInt("chunkIndex");
        if (index < 0 || index >= state.getNextChunk()) {
            LOGGER.warning("[FileTransfer] Retry for unsent chunk " + index + " of " + state.getFileId());
            return;
        }
        state.touch(clock.getAsLong());
        int attempt = state.recordRetry(index);
        if (attempt > maxChunkRetries) {
            LOGGER.warning("[FileTransfer] Chunk " + index + " of " + state.getFileId()
                + " failed " + attempt + " times, giving up");
            abort(state, TransferStatus.FAILED);
            return;
        }
        LOGGER.fine("[FileTransfer] Resending chunk " + index + " of " + state.getFileId()
            + " (retry " + attempt + ")");
        sendChunk(state, index);
    }

    /** Caller holds the lock. */
    private void sendChunk(TransferState state, int index) {
        byte[] data;
        try {
            data = FileChunker.readChunk(state.getSourcePath(), index, chunkSize);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "[FileTransfer] Cannot read chunk " + index + " of "
                + state.getSourcePath(), e);
            abort(state, TransferStatus.FAILED);
            return;
        }

        SignalMessage chunk = SignalMessage.of(MessageType.FILE_CHUNK)
            .with("fileId", state.getFileId())
            .with("chunkIndex", index)
            .with("totalChunks", state.getTotalChunks())
            .with("data", Base64.getEncoder().encodeToString(data))
            .with("checksum", ChunkChecksums.crc32c(data));
        if (!channel.send(chunk)) {
            LOGGER.warning("[FileTransfer] Lost route while sending " + state.getFileId());
            state.setStatus(TransferStatus.FAILED);
            notifyProgress(state);
            return;
        }
        if (index == state.getNextChunk()) {
            state.chunkSent(data.length);
        }
    }

    /** Caller holds the lock. */
    private void finishSend(TransferState state) {
        state.setStatus(TransferStatus.COMPLETED);
        channel.send(SignalMessage.of(MessageType.FILE_COMPLETE).with("fileId", state.getFileId()));
        LOGGER.info("[FileTransfer] Sent " + state.getFileName() + " (" + state.getFileId() + ")");
        notifyProgress(state);
    }

    // ===============================
    // Receiver
    // ===============================

    private synchronized void onFileStart(SignalMessage message) {
        String fileId = message.getString("fileId");
        if (transfers.containsKey(fileId)) {
            // duplicate announcement; the partner may have missed our reply
            channel.send(SignalMessage.of(MessageType.FILE_READY).with("fileId", fileId));
            return;
        }
        long size = message.getLong("fileSize");
        int totalChunks = message.getInt("totalChunks");
        String refusal = null;
        if (size > maxFileBytes) {
            refusal = "File too large";
        } else if (size < 0 || totalChunks < 0 || totalChunks > size || (size > 0 && totalChunks == 0)) {
            // every chunk carries at least one byte
            refusal = "Invalid chunk count";
        }
        if (refusal != null) {
            LOGGER.warning("[FileTransfer] Refusing " + fileId + ": " + size + " bytes in " + totalChunks + " chunks");
            channel.send(SignalMessage.of(MessageType.FILE_CANCEL)
                .with("fileId", fileId)
                .with("reason", refusal));
            return;
        }

        TransferState state = TransferState.incoming(fileId, message.getString("fileName"), size,
            totalChunks, message.getString("checksum"), clock.getAsLong());
        state.setStatus(TransferStatus.TRANSFERRING);
        transfers.put(fileId, state);
        channel.send(SignalMessage.of(MessageType.FILE_READY).with("fileId", fileId));
        LOGGER.info("[FileTransfer] Receiving " + state.getFileName() + " (" + size + " bytes) as " + fileId);
        notifyProgress(state);

        if (totalChunks == 0) {
            save(state);
        }
    }

    private synchronized void onFileChunk(SignalMessage message) {
        TransferState state = incoming(message);
        if (state == null || state.getStatus() != TransferStatus.TRANSFERRING) {
            return;
        }
        int index = message.getInt("chunkIndex");
        if (index < 0 || index >= state.getTotalChunks()) {
            LOGGER.warning("[FileTransfer] Chunk index " + index + " out of range for " + state.getFileId());
            return;
        }

        byte[] data;
        try {
            data = Base64.getDecoder().decode(message.getString("data"));
        } catch (IllegalArgumentException e) {
            data = null;
        }
        state.touch(clock.getAsLong());
        if (data == null || !ChunkChecksums.crc32c(data).equalsIgnoreCase(message.getString("checksum"))) {
            LOGGER.fine("[FileTransfer] Checksum mismatch on chunk " + index + " of " + state.getFileId());
            channel.send(SignalMessage.of(MessageType.FILE_CHUNK_RETRY)
                .with("fileId", state.getFileId())
                .with("chunkIndex", index));
            return;
        }

        state.storeChunk(index, data);
        channel.send(SignalMessage.of(MessageType.FILE_CHUNK_ACK)
            .with("fileId", state.getFileId())
            .with("chunkIndex", index));
        notifyProgress(state);

        if (state.isComplete()) {
            save(state);
        }
    }

    /** Caller holds the lock. */
    private void save(TransferState state) {
        state.setStatus(TransferStatus.SAVING);
        notifyProgress(state);

        Path target = null;
        try {
            Files.createDirectories(downloadDir);
            target = uniqueTarget(downloadDir, sanitizeFileName(state.getFileName(), state.getFileId()));
            long written = FileChunker.assemble(state.orderedChunks(), target);
            if (written != state.getFileSize()) {
                throw new ChecksumMismatchException("Expected " + state.getFileSize()
                    + " bytes, assembled " + written);
            }
            ChunkChecksums.verifyFile(target, state.getChecksum());

            state.setSavedPath(target);
            state.setStatus(TransferStatus.COMPLETED);
            channel.send(SignalMessage.of(MessageType.FILE_COMPLETE).with("fileId", state.getFileId()));
            LOGGER.info("[FileTransfer] Saved " + state.getFileName() + " to " + target);
        } catch (IOException | ChecksumMismatchException e) {
            LOGGER.warning("[FileTransfer] Could not save " + state.getFileId() + ": " + e.getMessage());
            state.setStatus(TransferStatus.FAILED);
            deleteQuietly(target);
        } finally {
            state.releaseChunks();
        }
        notifyProgress(state);
    }

    private synchronized void onFileComplete(SignalMessage message) {
        TransferState state = transfers.get(message.getString("fileId"));
        if (state == null) {
            return;
        }
        if (state.getDirection() == TransferDirection.SEND && !state.getStatus().isTerminal()) {
            state.setStatus(TransferStatus.COMPLETED);
            notifyProgress(state);
        }
        LOGGER.fine("[FileTransfer] Partner reports " + state.getFileId() + " complete");
    }

    private synchronized void onFileCancel(SignalMessage message) {
        TransferState state = transfers.remove(message.getString("fileId"));
        if (state == null) {
            return;
        }
        state.releaseChunks();
        if (!state.getStatus().isTerminal()) {
            state.setStatus(TransferStatus.CANCELLED);
            LOGGER.info("[FileTransfer] Partner cancelled " + state.getFileId()
                + " (" + message.optString("reason", "no reason") + ")");
            notifyProgress(state);
        }
    }

    // ===============================
    // Control
    // ===============================

    /**
     * Cancel a transfer in either direction and tell the partner.
     *
     * @return false if no such transfer is known
     */
    public synchronized boolean cancelTransfer(String fileId) {
        TransferState state = transfers.get(fileId);
        if (state == null) {
            return false;
        }
        abort(state, TransferStatus.CANCELLED);
        return true;
    }

    /**
     * Drop transfers idle for longer than the stale window. Unfinished ones
     * are marked failed and the partner is told.
     *
     * @return how many transfers were dropped
     */
    public synchronized int sweepStale() {
        long now = clock.getAsLong();
        List<TransferState> expired = new ArrayList<>();
        for (Iterator<TransferState> it = transfers.values().iterator(); it.hasNext(); ) {
            TransferState state = it.next();
            if (now - state.getLastActivity() > staleMillis) {
                it.remove();
                expired.add(state);
            }
        }
        for (TransferState state : expired) {
            if (!state.getStatus().isTerminal()) {
                LOGGER.warning("[FileTransfer] Transfer " + state.getFileId() + " stalled, dropping");
                state.releaseChunks();
                state.setStatus(TransferStatus.FAILED);
                channel.send(SignalMessage.of(MessageType.FILE_CANCEL)
                    .with("fileId", state.getFileId())
                    .with("reason", "Transfer timed out"));
                notifyProgress(state);
            }
        }
        return expired.size();
    }

    public synchronized TransferProgress progress(String fileId) {
        TransferState state = transfers.get(fileId);
        return state == null ? null : TransferProgress.of(state, clock.getAsLong());
    }

    public synchronized List<TransferProgress> transfers() {
        long now = clock.getAsLong();
        List<TransferProgress> snapshot = new ArrayList<>();
        for (TransferState state : transfers.values()) {
            snapshot.add(TransferProgress.of(state, now));
        }
        return snapshot;
    }

    /**
     * @return where a completed incoming file was written, or null
     */
    public synchronized Path savedPath(String fileId) {
        TransferState state = transfers.get(fileId);
        return state == null ? null : state.getSavedPath();
    }

    // ===============================
    // Internals
    // ===============================

    /** Caller holds the lock. */
    private void abort(TransferState state, TransferStatus status) {
        transfers.remove(state.getFileId());
        state.releaseChunks();
        state.setStatus(status);
        channel.send(SignalMessage.of(MessageType.FILE_CANCEL).with("fileId", state.getFileId()));
        notifyProgress(state);
    }

    private TransferState outgoing(SignalMessage message) {
        TransferState state = lookup(message);
        return state != null && state.getDirection() == TransferDirection.SEND ? state : null;
    }

    private TransferState incoming(SignalMessage message) {
        TransferState state = lookup(message);
        return state != null && state.getDirection() == TransferDirection.RECEIVE ? state : null;
    }

    private TransferState lookup(SignalMessage message) {
        try {
            return transfers.get(message.getString("fileId"));
        } catch (ProtocolException e) {
            LOGGER.warning("[FileTransfer] " + e.getMessage());
            return null;
        }
    }

    private void notifyProgress(TransferState state) {
        TransferProgress progress = TransferProgress.of(state, clock.getAsLong());
        for (TransferProgressListener listener : listeners) {
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "[FileTransfer] Progress listener failed", e);
            }
        }
    }

    /**
     * Keep only the last path element and replace characters that are unsafe
     * on common file systems.
     */
    static String sanitizeFileName(String name, String fallback) {
        String base = name == null ? "" : name.replace('\\', '/');
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        base = base.replaceAll("[\\x00-\\x1f<>:\"|?*]", "_").trim();
        if (base.isEmpty() || base.equals(".") || base.equals("..")) {
            return fallback;
        }
        return base;
    }

    static Path uniqueTarget(Path dir, String fileName) {
        Path candidate = dir.resolve(fileName);
        if (!Files.exists(candidate)) {
            return candidate;
        }
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        for (int i = 1; ; i++) {
            candidate = dir.resolve(stem + " (" + i + ")" + ext);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "[FileTransfer] Could not remove " + file, e);
        }
    }
}
