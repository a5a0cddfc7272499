package com.lunarview.file_transfer;

public enum TransferStatus {
    PENDING,
    TRANSFERRING,
    SAVING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
