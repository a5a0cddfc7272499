package com.lunarview.streaming;

import com.lunarview.testutil.ManualScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AdaptiveStreamingLoopTest {

    private static final int LARGE = 300 * 1024;
    private static final int MIDDLE = 100 * 1024;
    private static final int SMALL = 10 * 1024;

    private ManualScheduler scheduler;
    private final List<QualityPreset> captured = new ArrayList<>();
    private final List<byte[]> sent = new ArrayList<>();
    private int frameBytes = MIDDLE;
    private boolean acceptFrames = true;
    private AdaptiveStreamingLoop loop;

    @BeforeEach
    public void setUp() {
        scheduler = new ManualScheduler();
        FrameSource source = preset -> {
            captured.add(preset);
            return new byte[frameBytes];
        };
        FrameTransport transport = frame -> {
            if (acceptFrames) {
                sent.add(frame);
            }
            return acceptFrames;
        };
        loop = new AdaptiveStreamingLoop(source, transport, new QualityController(200 * 1024, 50 * 1024),
            scheduler, scheduler.clock());
    }

    @Test
    public void capturesAtPresetFrameRate() {
        loop.start();
        scheduler.advance(1000);

        assertEquals(25, sent.size());
        assertEquals(25, loop.stats().getFps());
        assertEquals(QualityPreset.HIGH, loop.getPreset());
        assertEquals(MIDDLE, loop.stats().getLastFrameBytes());
    }

    @Test
    public void largeFramesWalkDownTheLadder() {
        frameBytes = LARGE;
        loop.start();

        scheduler.advance(1000);
        assertEquals(QualityPreset.MEDIUM, loop.getPreset());

        scheduler.advance(2000);
        assertEquals(QualityPreset.LOW, loop.getPreset());
        assertEquals(QualityPreset.LOW, captured.get(captured.size() - 1));
    }

    @Test
    public void smallFramesWalkUp() {
        frameBytes = SMALL;
        loop.setQuality(QualityPreset.LOW);
        loop.start();

        scheduler.advance(1000);
        assertEquals(QualityPreset.MEDIUM, loop.getPreset());

        scheduler.advance(3000);
        assertEquals(QualityPreset.HIGH, loop.getPreset());
    }

    @Test
    public void presetChangeReschedulesTick() {
        loop.setQuality(QualityPreset.LOW);
        loop.start();

        scheduler.advance(1000);

        assertEquals(10, sent.size());
        assertEquals(10, loop.stats().getFps());
    }

    @Test
    public void manualQualityHoldsWithAutoOff() {
        frameBytes = LARGE;
        loop.setAutoQuality(false);
        loop.start();

        scheduler.advance(5000);

        assertEquals(QualityPreset.HIGH, loop.getPreset());
        assertFalse(loop.stats().isAutoQuality());
    }

    @Test
    public void refusedFramesAreDropped() {
        acceptFrames = false;
        loop.start();

        scheduler.advance(1000);

        assertEquals(0, loop.stats().getFramesSent());
        assertEquals(25, loop.stats().getFramesDropped());
        assertEquals(0, loop.stats().getFps());
        assertTrue(loop.isRunning());
    }

    @Test
    public void captureFailuresSkipTheTick() {
        int[] calls = {0};
        AdaptiveStreamingLoop flaky = new AdaptiveStreamingLoop(preset -> {
            calls[0]++;
            if (calls[0] % 2 == 0) {
                throw new IOException("display busy");
            }
            return calls[0] % 3 == 0 ? null : new byte[MIDDLE];
        }, frame -> true, new QualityController(200 * 1024, 50 * 1024), scheduler, scheduler.clock());

        flaky.start();
        scheduler.advance(1000);

        assertEquals(25, calls[0]);
        assertTrue(flaky.stats().getFramesSent() > 0);
        assertEquals(0, flaky.stats().getFramesDropped());
        assertTrue(flaky.isRunning());
    }

    @Test
    @DisplayName("game mode only moves between GAME and GAMELOW and restores the previous preset on exit")
    public void gameModeStaysOnGameLadder() {
        frameBytes = LARGE;
        loop.setQuality(QualityPreset.MEDIUM);
        loop.setGameMode(true);
        loop.start();
        assertEquals(QualityPreset.GAME, loop.getPreset());

        scheduler.advance(1100);
        assertEquals(QualityPreset.GAMELOW, loop.getPreset());

        scheduler.advance(3000);
        assertEquals(QualityPreset.GAMELOW, loop.getPreset());
        assertTrue(loop.stats().isGameMode());

        loop.setGameMode(false);
        assertEquals(QualityPreset.MEDIUM, loop.getPreset());
        assertFalse(loop.stats().isGameMode());
    }

    @Test
    public void selectingGamePresetEntersGameMode() {
        loop.setQuality(QualityPreset.GAMELOW);
        assertTrue(loop.stats().isGameMode());

        loop.setQuality(QualityPreset.LOW);
        assertFalse(loop.stats().isGameMode());
    }

    @Test
    public void stopCancelsTheTick() {
        loop.start();
        scheduler.advance(200);
        int before = sent.size();

        loop.stop();
        scheduler.advance(5000);

        assertEquals(before, sent.size());
        assertFalse(loop.isRunning());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    public void startIsIdempotent() {
        loop.start();
        loop.start();
        scheduler.advance(1000);

        assertEquals(25, sent.size());
        assertEquals(1, scheduler.pendingTasks());
    }
}
