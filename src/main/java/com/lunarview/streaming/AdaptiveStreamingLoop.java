package com.lunarview.streaming;

import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host-side capture loop.
 *
 * Each tick captures one frame and hands it to the transport; a refused send
 * drops that frame. Once per second the frame rate is recomputed and, with
 * auto quality on, the {@link QualityController} may move the preset one
 * step. A preset change reschedules the tick at the new frame rate.
 */
public class AdaptiveStreamingLoop {

    private static final Logger LOGGER = Logger.getLogger(AdaptiveStreamingLoop.class.getName());

    private static final long SAMPLE_WINDOW_MILLIS = 1000;

    private final FrameSource source;
    private final FrameTransport transport;
    private final QualityController controller;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier clock;

    private ScheduledFuture<?> tickTask;
    private boolean running;

    private QualityPreset preset = QualityPreset.HIGH;
    private QualityPreset presetBeforeGame = QualityPreset.HIGH;
    private boolean gameMode;
    private boolean autoQuality = true;

    private int lastFrameBytes;
    private int fps;
    private int framesInWindow;
    private long windowStart;
    private long framesSent;
    private long framesDropped;

    public AdaptiveStreamingLoop(FrameSource source, FrameTransport transport, QualityController controller,
                                 ScheduledExecutorService scheduler, LongSupplier clock) {
        this.source = source;
        this.transport = transport;
        this.controller = controller;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        windowStart = clock.getAsLong();
        framesInWindow = 0;
        schedule();
        LOGGER.info("[Stream] Started at " + preset.wireName() + " (" + preset.fps() + " fps)");
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        cancelTick();
        LOGGER.info("[Stream] Stopped after " + framesSent + " frames (" + framesDropped + " dropped)");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    // ===============================
    // Controls
    // ===============================

    public synchronized void setQuality(QualityPreset next) {
        if (next.isGame() && !gameMode) {
            presetBeforeGame = preset;
        }
        gameMode = next.isGame();
        applyPreset(next);
    }

    /**
     * Switch to the game ladder, or back to the preset used before it.
     */
    public synchronized void setGameMode(boolean enabled) {
        if (enabled == gameMode) {
            return;
        }
        gameMode = enabled;
        if (enabled) {
            presetBeforeGame = preset;
            applyPreset(QualityPreset.GAME);
        } else {
            applyPreset(presetBeforeGame.isGame() ? QualityPreset.HIGH : presetBeforeGame);
        }
    }

    public synchronized void setAutoQuality(boolean enabled) {
        autoQuality = enabled;
    }

    public synchronized QualityPreset getPreset() {
        return preset;
    }

    public synchronized StreamingStats stats() {
        return new StreamingStats(fps, preset, lastFrameBytes, gameMode, autoQuality, framesSent, framesDropped);
    }

    // ===============================
    // Loop
    // ===============================

    void tick() {
        QualityPreset current;
        synchronized (this) {
            if (!running) {
                return;
            }
            current = preset;
        }

        byte[] frame;
        try {
            frame = source.capture(current);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, "[Stream] Capture failed, skipping frame", e);
            frame = null;
        }

        boolean sent = false;
        if (frame != null) {
            try {
                sent = transport.sendFrame(frame);
            } catch (RuntimeException e) {
                LOGGER.log(Level.FINE, "[Stream] Send failed, dropping frame", e);
            }
        }

        synchronized (this) {
            if (frame != null) {
                lastFrameBytes = frame.length;
                if (sent) {
                    framesSent++;
                    framesInWindow++;
                } else {
                    framesDropped++;
                }
            }

            long now = clock.getAsLong();
            long elapsed = now - windowStart;
            if (elapsed >= SAMPLE_WINDOW_MILLIS) {
                fps = (int) Math.round(framesInWindow * 1000.0 / elapsed);
                framesInWindow = 0;
                windowStart = now;
                sample();
            }
        }
    }

    /** Once-per-second quality decision. Caller holds the lock. */
    private void sample() {
        if (!autoQuality || !running) {
            return;
        }
        QualityPreset next = controller.evaluate(preset, lastFrameBytes, gameMode);
        if (next != preset) {
            LOGGER.info("[Stream] Quality " + preset.wireName() + " -> " + next.wireName()
                + " (last frame " + lastFrameBytes / 1024 + " KB, " + fps + " fps)");
            applyPreset(next);
        }
    }

    private void applyPreset(QualityPreset next) {
        boolean rateChanged = next.periodMicros() != preset.periodMicros();
        preset = next;
        if (running && rateChanged) {
            cancelTick();
            schedule();
        }
    }

    private void schedule() {
        long period = preset.periodMicros();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, period, period, TimeUnit.MICROSECONDS);
    }

    private void cancelTick() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
    }
}
