package com.lunarview.file_transfer;

@FunctionalInterface
public interface TransferProgressListener {
    void onProgress(TransferProgress progress);
}
