package com.lunarview.streaming;

import java.io.IOException;

/**
 * Platform screen capture. Returns one encoded (JPEG) frame at the preset's
 * resolution and quality, or null when nothing is available this tick.
 */
@FunctionalInterface
public interface FrameSource {
    byte[] capture(QualityPreset preset) throws IOException;
}
