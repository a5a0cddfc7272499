package com.lunarview.server;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Bounded in-memory audit trail, newest entry first. The oldest entry is
 * dropped once capacity is reached.
 */
public class AccessLog {

    private static final Logger LOGGER = Logger.getLogger(AccessLog.class.getName());

    private final int capacity;
    private final Deque<AccessLogEntry> entries = new ArrayDeque<>();

    public AccessLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized void append(AccessLogEntry entry) {
        entries.addFirst(entry);
        while (entries.size() > capacity) {
            entries.removeLast();
        }
        LOGGER.info("[Access] " + entry);
    }

    /**
     * @return up to {@code limit} entries, newest first
     */
    public synchronized List<AccessLogEntry> latest(int limit) {
        List<AccessLogEntry> result = new ArrayList<>(Math.min(limit, entries.size()));
        for (AccessLogEntry entry : entries) {
            if (result.size() >= limit) {
                break;
            }
            result.add(entry);
        }
        return result;
    }

    public synchronized int size() {
        return entries.size();
    }
}
