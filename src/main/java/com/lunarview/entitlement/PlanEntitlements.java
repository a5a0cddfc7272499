package com.lunarview.entitlement;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Entitlements derived from a subscription plan. The daily connection
 * allowance resets when the local date changes.
 */
public class PlanEntitlements implements EntitlementService {

    private static final Logger LOGGER = Logger.getLogger(PlanEntitlements.class.getName());

    private static final long UNLIMITED = -1;

    public enum Plan {
        FREE("free", 30 * 60 * 1000L, 5, 720, 1,
            EnumSet.of(Feature.CLIPBOARD)),
        PERSONAL_PRO("personal_pro", UNLIMITED, UNLIMITED, 1080, 2,
            EnumSet.allOf(Feature.class)),
        BUSINESS("business", UNLIMITED, UNLIMITED, 2160, 5,
            EnumSet.allOf(Feature.class)),
        TEAM("team", UNLIMITED, UNLIMITED, 2160, 10,
            EnumSet.allOf(Feature.class));

        private final String wireName;
        private final long sessionDurationMillis;
        private final long maxDailyConnections;
        private final int maxResolution;
        private final int simultaneousSessions;
        private final Set<Feature> features;

        Plan(String wireName, long sessionDurationMillis, long maxDailyConnections, int maxResolution,
             int simultaneousSessions, Set<Feature> features) {
            this.wireName = wireName;
            this.sessionDurationMillis = sessionDurationMillis;
            this.maxDailyConnections = maxDailyConnections;
            this.maxResolution = maxResolution;
            this.simultaneousSessions = simultaneousSessions;
            this.features = features;
        }

        public String wireName() { return wireName; }
        public int maxResolution() { return maxResolution; }
        public int simultaneousSessions() { return simultaneousSessions; }

        public boolean hasSessionCap() {
            return sessionDurationMillis != UNLIMITED;
        }

        public long sessionDurationMillis() {
            return sessionDurationMillis;
        }

        public boolean hasDailyLimit() {
            return maxDailyConnections != UNLIMITED;
        }

        public long maxDailyConnections() {
            return maxDailyConnections;
        }

        /** Unknown names fall back to FREE. */
        public static Plan fromWireName(String name) {
            for (Plan plan : values()) {
                if (plan.wireName.equalsIgnoreCase(name)) {
                    return plan;
                }
            }
            return FREE;
        }
    }

    private final Plan plan;
    private final LongSupplier clock;
    private final ZoneId zone;

    private LocalDate countingDay;
    private int connectionsToday;
    private long sessionStart = -1;

    public PlanEntitlements(Plan plan, LongSupplier clock, ZoneId zone) {
        this.plan = plan;
        this.clock = clock;
        this.zone = zone;
    }

    public PlanEntitlements(Plan plan) {
        this(plan, System::currentTimeMillis, ZoneId.systemDefault());
    }

    public Plan getPlan() {
        return plan;
    }

    @Override
    public synchronized boolean canStartConnection() {
        rollDay();
        if (plan.hasDailyLimit() && connectionsToday >= plan.maxDailyConnections()) {
            LOGGER.info("[Plan] Daily connection limit of " + plan.maxDailyConnections() + " reached");
            return false;
        }
        return true;
    }

    @Override
    public boolean canUseFeature(Feature feature) {
        return plan.features.contains(feature);
    }

    @Override
    public synchronized OptionalLong remainingSessionTimeMillis() {
        if (!plan.hasSessionCap() || sessionStart < 0) {
            return OptionalLong.empty();
        }
        long elapsed = clock.getAsLong() - sessionStart;
        return OptionalLong.of(Math.max(0, plan.sessionDurationMillis() - elapsed));
    }

    @Override
    public synchronized void sessionStarted() {
        rollDay();
        connectionsToday++;
        sessionStart = clock.getAsLong();
    }

    @Override
    public synchronized void sessionEnded() {
        sessionStart = -1;
    }

    public synchronized int getConnectionsToday() {
        rollDay();
        return connectionsToday;
    }

    private void rollDay() {
        LocalDate today = LocalDate.ofInstant(Instant.ofEpochMilli(clock.getAsLong()), zone);
        if (!today.equals(countingDay)) {
            countingDay = today;
            connectionsToday = 0;
        }
    }
}
