package com.lunarview.streaming;

@FunctionalInterface
public interface FrameTransport {

    /**
     * @return false if the frame could not be sent; it is dropped, not queued
     */
    boolean sendFrame(byte[] encodedFrame);
}
