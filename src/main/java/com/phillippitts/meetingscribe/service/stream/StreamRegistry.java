package com.phillippitts.meetingscribe.service.stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the set of live streams.
 *
 * <p>Lookups are lock-free. Creation and removal are serialized by one lock, the only
 * synchronization shared across streams; tearing down a removed stream happens outside it.
 */
public class StreamRegistry {

    private static final Logger LOG = LogManager.getLogger(StreamRegistry.class);

    /** Identity of the single stream used in mixed mode. */
    public static final String MIXED_STREAM_ID = "__mixed__";

    private final Map<String, AudioStream> streams = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AudioStreamFactory factory;

    public StreamRegistry(AudioStreamFactory factory) {
        this.factory = factory;
    }

    /**
     * Returns the live stream for the id, creating it without conversation context if needed.
     */
    public AudioStream acquire(String streamId, String sessionId) {
        return acquire(streamId, sessionId, ConversationContext.disabled());
    }

    /**
     * Returns the live stream for the id, creating it if needed.
     *
     * @param sessionId session recorded on a newly created stream (nullable)
     * @param context   conversation context given to a newly created stream
     */
    public AudioStream acquire(String streamId, String sessionId, ConversationContext context) {
        AudioStream existing = streams.get(streamId);
        if (existing != null) {
            return existing;
        }
        lock.lock();
        try {
            existing = streams.get(streamId);
            if (existing != null) {
                return existing;
            }
            AudioStream created = factory.create(streamId, sessionId, context);
            streams.put(streamId, created);
            LOG.info("Created audio stream {} (active: {})", streamId, streams.size());
            return created;
        } finally {
            lock.unlock();
        }
    }

    public Optional<AudioStream> find(String streamId) {
        return Optional.ofNullable(streams.get(streamId));
    }

    /**
     * Removes and tears down a stream.
     *
     * @return false if no such stream was live (releasing twice is a no-op)
     */
    public boolean release(String streamId) {
        AudioStream removed;
        lock.lock();
        try {
            removed = streams.remove(streamId);
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        removed.release();
        LOG.info("Released audio stream {} (active: {})", streamId, streams.size());
        return true;
    }

    /**
     * Removes and tears down the stream if it is still the live instance for its id.
     *
     * @return false if the id is free or now maps to another stream
     */
    public boolean discard(AudioStream stream) {
        boolean removed;
        lock.lock();
        try {
            removed = streams.remove(stream.streamId(), stream);
        } finally {
            lock.unlock();
        }
        stream.release();
        if (removed) {
            LOG.info("Discarded audio stream {} (active: {})", stream.streamId(), streams.size());
        }
        return removed;
    }

    /**
     * Removes and tears down every stream.
     *
     * @return number of released streams
     */
    public int releaseAll() {
        List<AudioStream> removed;
        lock.lock();
        try {
            removed = new ArrayList<>(streams.values());
            streams.clear();
        } finally {
            lock.unlock();
        }
        removed.forEach(AudioStream::release);
        if (!removed.isEmpty()) {
            LOG.info("Released {} audio stream(s)", removed.size());
        }
        return removed.size();
    }

    public int size() {
        return streams.size();
    }

    public Collection<AudioStream> streams() {
        return List.copyOf(streams.values());
    }

    public List<StreamSnapshot> snapshots() {
        return streams.values().stream().map(AudioStream::snapshot).toList();
    }
}
