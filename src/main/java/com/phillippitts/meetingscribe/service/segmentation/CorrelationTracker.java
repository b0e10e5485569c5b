package com.phillippitts.meetingscribe.service.segmentation;

import com.phillippitts.meetingscribe.util.TimeUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches asynchronous voice-activity verdicts to the packets that produced them.
 *
 * <p>Entries are kept in packet order. A verdict that arrives ahead of an earlier unresolved
 * packet is recorded but only handed out by {@link #drainReady()} once everything before it
 * has resolved, so the state machine always sees verdicts in packet order.
 *
 * <p>Three policies keep a stream live when replies go missing: requests older than the
 * verdict timeout resolve as {@link VerdictOutcome#TIMEOUT}; when more than the bound are
 * unresolved the oldest resolves as {@link VerdictOutcome#EVICTED}; a failed gateway call
 * resolves as {@link VerdictOutcome#FAILED}. All three count as non-speech. An id is matched
 * at most once.
 *
 * <p>Not thread-safe; owned by a single {@code AudioStream}.
 */
public final class CorrelationTracker {

    /** Result of matching a reply. */
    public enum Resolution {
        ACCEPTED,
        /** Id already resolved (late reply after timeout/eviction, or a duplicate). */
        DUPLICATE,
        /** Id was never issued by this stream. */
        UNKNOWN
    }

    private final int maxOutstanding;
    private final Duration timeout;
    private final Map<Long, Pending> pending = new LinkedHashMap<>();
    private long highestRegistered;
    private int unresolved;

    public CorrelationTracker(int maxOutstanding, Duration timeout) {
        if (maxOutstanding < 1) {
            throw new IllegalArgumentException("maxOutstanding must be >= 1");
        }
        this.maxOutstanding = maxOutstanding;
        this.timeout = timeout;
    }

    public void register(AudioPacket packet, Instant dispatchedAt) {
        pending.put(packet.correlationId(), new Pending(packet, dispatchedAt));
        highestRegistered = Math.max(highestRegistered, packet.correlationId());
        unresolved++;
    }

    /**
     * Evicts the oldest unresolved requests until at most the bound remain.
     *
     * @return number of evicted requests
     */
    public int enforceBound() {
        int evicted = 0;
        Iterator<Pending> it = pending.values().iterator();
        while (unresolved > maxOutstanding && it.hasNext()) {
            Pending p = it.next();
            if (p.outcome == null) {
                p.resolve(VerdictOutcome.EVICTED, 0.0);
                unresolved--;
                evicted++;
            }
        }
        return evicted;
    }

    public Resolution resolve(long correlationId, boolean speech, double confidence) {
        Pending p = pending.get(correlationId);
        if (p == null) {
            return correlationId > 0 && correlationId <= highestRegistered
                    ? Resolution.DUPLICATE : Resolution.UNKNOWN;
        }
        if (p.outcome != null) {
            return Resolution.DUPLICATE;
        }
        p.resolve(speech ? VerdictOutcome.SPEECH : VerdictOutcome.NON_SPEECH, confidence);
        unresolved--;
        return Resolution.ACCEPTED;
    }

    /**
     * Resolves a request whose gateway call failed.
     *
     * @return false if the id is not pending
     */
    public boolean fail(long correlationId) {
        Pending p = pending.get(correlationId);
        if (p == null || p.outcome != null) {
            return false;
        }
        p.resolve(VerdictOutcome.FAILED, 0.0);
        unresolved--;
        return true;
    }

    /**
     * Times out every unresolved request dispatched at least the timeout before {@code now}.
     *
     * @return number of timed-out requests
     */
    public int expire(Instant now) {
        int expired = 0;
        for (Pending p : pending.values()) {
            if (p.outcome == null && TimeUtils.hasElapsed(p.dispatchedAt, now, timeout)) {
                p.resolve(VerdictOutcome.TIMEOUT, 0.0);
                unresolved--;
                expired++;
            }
        }
        return expired;
    }

    /**
     * Removes and returns the resolved prefix, in packet order.
     */
    public List<ResolvedVerdict> drainReady() {
        if (pending.isEmpty()) {
            return Collections.emptyList();
        }
        List<ResolvedVerdict> ready = new ArrayList<>();
        Iterator<Pending> it = pending.values().iterator();
        while (it.hasNext()) {
            Pending p = it.next();
            if (p.outcome == null) {
                break;
            }
            ready.add(new ResolvedVerdict(p.packet, p.confidence, p.outcome));
            it.remove();
        }
        return ready;
    }

    /** Whether any request is unresolved or held back behind one. */
    public boolean hasOutstanding() {
        return !pending.isEmpty();
    }

    public int unresolvedCount() {
        return unresolved;
    }

    /** Forgets all pending requests; later replies for them are reported as duplicates. */
    public void clear() {
        pending.clear();
        unresolved = 0;
    }

    private static final class Pending {
        private final AudioPacket packet;
        private final Instant dispatchedAt;
        private VerdictOutcome outcome;
        private double confidence;

        private Pending(AudioPacket packet, Instant dispatchedAt) {
            this.packet = packet;
            this.dispatchedAt = dispatchedAt;
        }

        private void resolve(VerdictOutcome outcome, double confidence) {
            this.outcome = outcome;
            this.confidence = confidence;
        }
    }
}
