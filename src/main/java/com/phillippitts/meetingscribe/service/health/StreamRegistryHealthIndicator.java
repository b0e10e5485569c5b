package com.phillippitts.meetingscribe.service.health;

import com.phillippitts.meetingscribe.service.stream.StreamRegistry;
import com.phillippitts.meetingscribe.service.stream.StreamSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for live audio streams.
 *
 * <ul>
 *   <li>UP: every stream keeps up with its input</li>
 *   <li>DEGRADED: at least one stream mailbox is more than 80% full (frames may soon be dropped)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class StreamRegistryHealthIndicator implements HealthIndicator {

    static final double BACKLOG_THRESHOLD = 0.8;

    private final StreamRegistry registry;

    public StreamRegistryHealthIndicator(StreamRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        List<StreamSnapshot> snapshots = registry.snapshots();
        List<String> backlogged = snapshots.stream()
                .filter(s -> s.mailboxFill() > BACKLOG_THRESHOLD)
                .map(StreamSnapshot::streamId)
                .toList();

        Health.Builder builder = backlogged.isEmpty()
                ? Health.up().withDetail("status", "All streams keeping up")
                : Health.status("DEGRADED")
                        .withDetail("status", "Stream mailbox backlog")
                        .withDetail("backlogged", backlogged);
        return builder.withDetail("activeStreams", snapshots.size()).build();
    }
}
