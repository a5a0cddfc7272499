package com.lunarview.entitlement;

import java.util.OptionalLong;

/**
 * Answers what the signed-in user's plan allows. Consulted before a
 * connection is started and before gated features are used.
 */
public interface EntitlementService {

    boolean canStartConnection();

    boolean canUseFeature(Feature feature);

    /**
     * @return time left in the current session, or empty when sessions are not capped
     */
    OptionalLong remainingSessionTimeMillis();

    /** Count a new session against the daily allowance and start its clock. */
    void sessionStarted();

    void sessionEnded();
}
