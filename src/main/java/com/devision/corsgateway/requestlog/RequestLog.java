package com.devision.corsgateway.requestlog;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Bounded, in-memory history of recent gateway calls.
 *
 * Entries are kept in completion order; once capacity is reached the oldest entry is dropped.
 * Nothing survives a restart.
 */
public class RequestLog {

    public static final int DEFAULT_CAPACITY = 1000;
    public static final int DEFAULT_RECENT_LIMIT = 50;

    private final int capacity;
    private final Clock clock;
    private final Deque<LogEntry> entries = new ArrayDeque<>();
    private final AtomicLong requestCount = new AtomicLong();

    public RequestLog(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public RequestLog(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    /**
     * Allocates an id of the form {@code req-<n>-<epochMillis>} and counts the request.
     */
    public String nextRequestId() {
        long n = requestCount.incrementAndGet();
        return "req-" + n + "-" + clock.millis();
    }

    public void record(LogEntry entry) {
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        }
    }

    /**
     * Most recent entries, newest first.
     */
    public List<LogEntry> recentLogs(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<LogEntry> recent = new ArrayList<>(Math.min(limit, capacity));
        synchronized (entries) {
            Iterator<LogEntry> it = entries.descendingIterator();
            while (it.hasNext() && recent.size() < limit) {
                recent.add(it.next());
            }
        }
        return Collections.unmodifiableList(recent);
    }

    public RequestStats stats(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<LogEntry> recent = new ArrayList<>();
        synchronized (entries) {
            for (LogEntry entry : entries) {
                if (entry.timestamp() != null && entry.timestamp().isAfter(cutoff)) {
                    recent.add(entry);
                }
            }
        }

        long averageResponseTime = 0;
        long successRate = 0;
        if (!recent.isEmpty()) {
            long totalDuration = recent.stream()
                    .filter(e -> e.durationMs() != null)
                    .mapToLong(LogEntry::durationMs)
                    .sum();
            averageResponseTime = Math.round((double) totalDuration / recent.size());

            long successful = recent.stream()
                    .filter(e -> e.status() != null && e.status() < 400)
                    .count();
            successRate = Math.round(successful * 100.0 / recent.size());
        }

        return new RequestStats(
                requestCount.get(),
                recent.size(),
                averageResponseTime,
                successRate,
                countBy(recent, e -> e.origin() == null ? "unknown" : e.origin()),
                countBy(recent, e -> e.apiKey() == null ? "none" : e.apiKey()),
                countBy(recent, e -> String.valueOf(e.status() == null ? 500 : e.status())));
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    private static Map<String, Long> countBy(List<LogEntry> entries, Function<LogEntry, String> key) {
        Map<String, Long> counts = new TreeMap<>();
        for (LogEntry entry : entries) {
            counts.merge(key.apply(entry), 1L, Long::sum);
        }
        return counts;
    }
}
