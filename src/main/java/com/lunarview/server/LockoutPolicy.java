package com.lunarview.server;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Per-IP failed-password accounting.
 *
 * An IP is blocked once it reaches {@code maxFailedAttempts} failures and stays
 * blocked until {@code lockoutMillis} have passed since its last failure, or
 * until an administrator unblocks it. Manually blocked IPs stay blocked until
 * explicitly released.
 */
public class LockoutPolicy {

    /** Failure count for one source IP. */
    public static final class FailedAttemptRecord {
        private int count;
        private long lastAttempt;

        FailedAttemptRecord(long now) {
            this.count = 0;
            this.lastAttempt = now;
        }

        public int count() { return count; }
        public long lastAttempt() { return lastAttempt; }
    }

    private final int maxFailedAttempts;
    private final long lockoutMillis;
    private final LongSupplier clock;

    private final Map<String, FailedAttemptRecord> failures = new HashMap<>();
    private final Set<String> manuallyBlocked = new HashSet<>();

    public LockoutPolicy(int maxFailedAttempts, long lockoutMillis, LongSupplier clock) {
        this.maxFailedAttempts = maxFailedAttempts;
        this.lockoutMillis = lockoutMillis;
        this.clock = clock;
    }

    public synchronized boolean isBlocked(String ip) {
        if (ip == null) {
            return false;
        }
        if (manuallyBlocked.contains(ip)) {
            return true;
        }
        FailedAttemptRecord record = failures.get(ip);
        if (record == null) {
            return false;
        }
        if (clock.getAsLong() - record.lastAttempt >= lockoutMillis) {
            failures.remove(ip);
            return false;
        }
        return record.count >= maxFailedAttempts;
    }

    /**
     * Count one failed attempt. A record whose last attempt fell outside the
     * window starts over.
     *
     * @return the failure count after this attempt
     */
    public synchronized int recordFailure(String ip) {
        long now = clock.getAsLong();
        FailedAttemptRecord record = failures.get(ip);
        if (record == null || now - record.lastAttempt >= lockoutMillis) {
            record = new FailedAttemptRecord(now);
            failures.put(ip, record);
        }
        record.count++;
        record.lastAttempt = now;
        return record.count;
    }

    /**
     * Drop failure records whose lockout window has passed, whether or not
     * the IP ever came back. Manual blocks are kept.
     *
     * @return number of records dropped
     */
    public synchronized int purgeExpired() {
        long now = clock.getAsLong();
        int purged = 0;
        for (Iterator<FailedAttemptRecord> it = failures.values().iterator(); it.hasNext(); ) {
            if (now - it.next().lastAttempt >= lockoutMillis) {
                it.remove();
                purged++;
            }
        }
        return purged;
    }

    public synchronized int trackedIps() {
        return failures.size();
    }

    public synchronized void block(String ip) {
        manuallyBlocked.add(ip);
    }

    /**
     * Clear both the manual block and any failure record for {@code ip}.
     */
    public synchronized void unblock(String ip) {
        manuallyBlocked.remove(ip);
        failures.remove(ip);
    }

    public synchronized int failureCount(String ip) {
        FailedAttemptRecord record = failures.get(ip);
        return record == null ? 0 : record.count;
    }

    public synchronized Set<String> blockedIps() {
        Set<String> result = new HashSet<>(manuallyBlocked);
        for (Map.Entry<String, FailedAttemptRecord> e : failures.entrySet()) {
            if (e.getValue().count >= maxFailedAttempts
                    && clock.getAsLong() - e.getValue().lastAttempt < lockoutMillis) {
                result.add(e.getKey());
            }
        }
        return result;
    }
}
