package com.lunarview.streaming;

/**
 * Capture presets. LOW, MEDIUM and HIGH form the general ladder; GAME and
 * GAMELOW form the separate game-mode ladder.
 */
public enum QualityPreset {
    LOW("low", 854, 480, 10, 40),
    MEDIUM("medium", 1280, 720, 15, 60),
    HIGH("high", 1920, 1080, 25, 80),
    GAME("game", 1920, 1080, 60, 70),
    GAMELOW("gamelow", 1280, 720, 60, 50);

    private final String wireName;
    private final int width;
    private final int height;
    private final int fps;
    private final int jpegQuality;

    QualityPreset(String wireName, int width, int height, int fps, int jpegQuality) {
        this.wireName = wireName;
        this.width = width;
        this.height = height;
        this.fps = fps;
        this.jpegQuality = jpegQuality;
    }

    public String wireName() { return wireName; }
    public int width() { return width; }
    public int height() { return height; }
    public int fps() { return fps; }

    /** Encoder quality, 0..100. */
    public int jpegQuality() { return jpegQuality; }

    /** Tick period; microseconds so that 60 fps does not round. */
    public long periodMicros() {
        return 1_000_000L / fps;
    }

    public boolean isGame() {
        return this == GAME || this == GAMELOW;
    }

    /** One step down the same ladder; the bottom returns itself. */
    public QualityPreset lower() {
        return switch (this) {
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
            case GAME, GAMELOW -> GAMELOW;
        };
    }

    /** One step up the same ladder; the top returns itself. */
    public QualityPreset higher() {
        return switch (this) {
            case LOW -> MEDIUM;
            case MEDIUM, HIGH -> HIGH;
            case GAME, GAMELOW -> GAME;
        };
    }

    public static QualityPreset fromWireName(String name) {
        for (QualityPreset preset : values()) {
            if (preset.wireName.equalsIgnoreCase(name)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown quality preset: " + name);
    }
}
