package com.lunarview.entitlement;

public enum Feature {
    FILE_TRANSFER,
    MULTI_MONITOR,
    AUDIO_STREAM,
    GAME_MODE,
    CLIPBOARD
}
