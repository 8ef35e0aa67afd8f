package com.govsignal.event;

import com.govsignal.contract.ArtifactEvent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryArtifactEventStore implements ArtifactEventStore {

    private final Map<String, Entry> events = new LinkedHashMap<>();
    private long sequence;

    @Override
    public synchronized ArtifactEvent append(ArtifactEvent event) {
        if (events.containsKey(event.getId())) {
            throw new IllegalStateException("event already stored: " + event.getId());
        }
        events.put(event.getId(), new Entry(++sequence, event.copy()));
        return event;
    }

    @Override
    public synchronized boolean existsById(String eventId) {
        return events.containsKey(eventId);
    }

    @Override
    public synchronized Optional<ArtifactEvent> findById(String eventId) {
        Entry entry = events.get(eventId);
        return entry == null ? Optional.empty() : Optional.of(entry.event.copy());
    }

    @Override
    public synchronized List<ArtifactEvent> findUnprocessed(int limit, Instant now) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return events.values().stream()
            .filter(e -> !e.event.isProcessed())
            .filter(e -> !e.event.isQuarantined())
            .filter(e -> !e.event.isClaimedAt(now))
            .sorted(Comparator.comparing((Entry e) -> e.event.getCreatedAt())
                .thenComparingLong(e -> e.sequence))
            .limit(limit)
            .map(e -> e.event.copy())
            .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean claim(String eventId, String workerId, Instant now, Instant leaseUntil) {
        Entry entry = events.get(eventId);
        if (entry == null) {
            return false;
        }
        ArtifactEvent event = entry.event;
        if (event.isProcessed() || event.isQuarantined() || event.isClaimedAt(now)) {
            return false;
        }
        event.setClaimedBy(workerId);
        event.setClaimExpiresAt(leaseUntil);
        event.setAttempts(event.getAttempts() + 1);
        return true;
    }

    @Override
    public synchronized boolean markProcessed(String eventId, String workerId, Instant processedAt) {
        ArtifactEvent event = require(eventId);
        if (event.isProcessed() || !workerId.equals(event.getClaimedBy())) {
            return false;
        }
        event.setProcessedAt(processedAt);
        event.setProcessError(null);
        event.setClaimedBy(null);
        event.setClaimExpiresAt(null);
        return true;
    }

    @Override
    public synchronized boolean markFailed(String eventId, String workerId, String error, boolean quarantine,
                                           Instant now) {
        ArtifactEvent event = require(eventId);
        if (!workerId.equals(event.getClaimedBy())) {
            return false;
        }
        event.setProcessError(error);
        event.setClaimedBy(null);
        event.setClaimExpiresAt(null);
        if (quarantine) {
            event.setQuarantinedAt(now);
        }
        return true;
    }

    private ArtifactEvent require(String eventId) {
        Entry entry = events.get(eventId);
        if (entry == null) {
            throw new IllegalArgumentException("unknown event: " + eventId);
        }
        return entry.event;
    }

    private record Entry(long sequence, ArtifactEvent event) {}
}
