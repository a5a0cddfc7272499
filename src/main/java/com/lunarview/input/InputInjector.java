package com.lunarview.input;

import com.google.gson.JsonObject;

/**
 * Platform input injection on the host. Events are passed through as the
 * viewer sent them.
 */
public interface InputInjector {

    void injectMouse(JsonObject event);

    void injectKeyboard(JsonObject event);
}
