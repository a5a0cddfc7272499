package com.lunarview.p2p;

/**
 * Minimal view of a peer-to-peer data channel.
 */
public interface DataChannel {

    interface Listener {
        void onOpen();

        void onClose();

        void onText(String text);

        void onBinary(byte[] data);
    }

    String label();

    boolean isOpen();

    void setListener(Listener listener);

    /** @return false if the channel is not open or the send failed */
    boolean sendText(String text);

    /** @return false if the channel is not open or the send failed */
    boolean sendBinary(byte[] data);

    void close();
}
