package com.lunarview.file_transfer;

public enum TransferDirection {
    SEND,
    RECEIVE
}
