package com.lunarview.input;

public interface ClipboardProvider {

    /** @return the current text content, or null if there is none */
    String readText();

    void writeText(String text);
}
