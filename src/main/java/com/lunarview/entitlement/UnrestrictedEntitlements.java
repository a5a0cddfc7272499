package com.lunarview.entitlement;

import java.util.OptionalLong;

/**
 * Allows everything. Used when no plan information is available, e.g. on a
 * self-hosted relay.
 */
public final class UnrestrictedEntitlements implements EntitlementService {

    public static final UnrestrictedEntitlements INSTANCE = new UnrestrictedEntitlements();

    private UnrestrictedEntitlements() {
    }

    @Override
    public boolean canStartConnection() {
        return true;
    }

    @Override
    public boolean canUseFeature(Feature feature) {
        return true;
    }

    @Override
    public OptionalLong remainingSessionTimeMillis() {
        return OptionalLong.empty();
    }

    @Override
    public void sessionStarted() {
    }

    @Override
    public void sessionEnded() {
    }
}
