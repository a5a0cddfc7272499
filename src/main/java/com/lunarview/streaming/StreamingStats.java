package com.lunarview.streaming;

public final class StreamingStats {

    private final int fps;
    private final QualityPreset preset;
    private final int lastFrameBytes;
    private final boolean gameMode;
    private final boolean autoQuality;
    private final long framesSent;
    private final long framesDropped;

    StreamingStats(int fps, QualityPreset preset, int lastFrameBytes, boolean gameMode,
                   boolean autoQuality, long framesSent, long framesDropped) {
        this.fps = fps;
        this.preset = preset;
        this.lastFrameBytes = lastFrameBytes;
        this.gameMode = gameMode;
        this.autoQuality = autoQuality;
        this.framesSent = framesSent;
        this.framesDropped = framesDropped;
    }

    public int getFps() { return fps; }
    public QualityPreset getPreset() { return preset; }
    public int getLastFrameBytes() { return lastFrameBytes; }
    public boolean isGameMode() { return gameMode; }
    public boolean isAutoQuality() { return autoQuality; }
    public long getFramesSent() { return framesSent; }
    public long getFramesDropped() { return framesDropped; }

    @Override
    public String toString() {
        return String.format("%d fps, %s, last frame %.1f KB, sent=%d dropped=%d%s",
            fps, preset.wireName(), lastFrameBytes / 1024.0, framesSent, framesDropped,
            gameMode ? " [game]" : "");
    }
}
