package com.phillippitts.meetingscribe.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key log throttle for repeated diagnostics (late verdicts, full mailboxes, dropped replies).
 * A key may log once per window; everything in between is only counted by metrics.
 */
public final class DiagnosticsThrottle {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(30);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Duration window;
    private final Clock clock;

    public DiagnosticsThrottle() {
        this(DEFAULT_WINDOW, Clock.systemUTC());
    }

    public DiagnosticsThrottle(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    /**
     * Returns true when the given key has not logged within the window, and records it.
     */
    public boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(window) >= 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }

    /** Forgets throttle state for keys starting with the prefix (used when a stream is released). */
    public void forget(String prefix) {
        lastLog.keySet().removeIf(k -> k.startsWith(prefix));
    }
}
