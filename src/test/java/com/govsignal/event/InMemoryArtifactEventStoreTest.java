package com.govsignal.event;

import com.govsignal.contract.ArtifactEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryArtifactEventStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-10T09:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(5);

    private final InMemoryArtifactEventStore store = new InMemoryArtifactEventStore();

    @Test
    void claim_isGrantedToOneWorkerOnly() {
        ArtifactEvent event = store.append(event(T0));

        assertTrue(store.claim(event.getId(), "w1", T0, T0.plus(LEASE)));
        assertFalse(store.claim(event.getId(), "w2", T0.plusSeconds(1), T0.plus(LEASE)));

        ArtifactEvent stored = store.findById(event.getId()).orElseThrow();
        assertEquals("w1", stored.getClaimedBy());
        assertEquals(1, stored.getAttempts());
    }

    @Test
    void expiredLease_canBeReclaimed() {
        ArtifactEvent event = store.append(event(T0));
        store.claim(event.getId(), "w1", T0, T0.plus(LEASE));

        Instant later = T0.plus(LEASE).plusSeconds(1);
        assertEquals(1, store.findUnprocessed(10, later).size());
        assertTrue(store.claim(event.getId(), "w2", later, later.plus(LEASE)));
        assertEquals(2, store.findById(event.getId()).orElseThrow().getAttempts());
    }

    @Test
    void liveClaim_hidesEventFromFetch() {
        ArtifactEvent event = store.append(event(T0));
        store.claim(event.getId(), "w1", T0, T0.plus(LEASE));

        assertTrue(store.findUnprocessed(10, T0.plusSeconds(30)).isEmpty());
    }

    @Test
    void processedAndQuarantinedEvents_cannotBeClaimed() {
        ArtifactEvent done = store.append(event(T0));
        ArtifactEvent parked = store.append(event(T0));
        store.claim(done.getId(), "w1", T0, T0.plus(LEASE));
        store.markProcessed(done.getId(), "w1", T0);
        store.claim(parked.getId(), "w1", T0, T0.plus(LEASE));
        store.markFailed(parked.getId(), "w1", "boom", true, T0);

        Instant later = T0.plus(Duration.ofHours(1));
        assertFalse(store.claim(done.getId(), "w2", later, later.plus(LEASE)));
        assertFalse(store.claim(parked.getId(), "w2", later, later.plus(LEASE)));
        assertTrue(store.findUnprocessed(10, later).isEmpty());
    }

    @Test
    void markProcessed_clearsErrorAndClaim() {
        ArtifactEvent event = store.append(event(T0));
        store.claim(event.getId(), "w1", T0, T0.plus(LEASE));
        store.markFailed(event.getId(), "w1", "first try failed", false, T0);
        store.claim(event.getId(), "w1", T0, T0.plus(LEASE));

        assertTrue(store.markProcessed(event.getId(), "w1", T0.plusSeconds(5)));

        ArtifactEvent stored = store.findById(event.getId()).orElseThrow();
        assertEquals(T0.plusSeconds(5), stored.getProcessedAt());
        assertNull(stored.getProcessError());
        assertNull(stored.getClaimedBy());
    }

    @Test
    @DisplayName("A worker whose lease was taken over cannot complete the event")
    void reclaimedEvent_rejectsStaleHolderCompletion() {
        ArtifactEvent event = store.append(event(T0));
        store.claim(event.getId(), "w1", T0, T0.plus(LEASE));
        Instant later = T0.plus(LEASE).plusSeconds(60);
        assertTrue(store.claim(event.getId(), "w2", later, later.plus(LEASE)));

        assertFalse(store.markProcessed(event.getId(), "w1", later.plusSeconds(1)));
        assertFalse(store.markFailed(event.getId(), "w1", "late failure", false, later.plusSeconds(1)));

        ArtifactEvent stored = store.findById(event.getId()).orElseThrow();
        assertNull(stored.getProcessedAt());
        assertNull(stored.getProcessError());
        assertEquals("w2", stored.getClaimedBy());

        assertTrue(store.markProcessed(event.getId(), "w2", later.plusSeconds(2)));
        assertFalse(store.markProcessed(event.getId(), "w2", later.plusSeconds(3)));
        assertEquals(later.plusSeconds(2), store.findById(event.getId()).orElseThrow().getProcessedAt());
    }

    @Test
    void fetch_isOldestFirstWithInsertionOrderForTies() {
        ArtifactEvent late = store.append(event(T0.plusSeconds(10)));
        ArtifactEvent tieA = store.append(event(T0));
        ArtifactEvent tieB = store.append(event(T0));

        List<String> ids = store.findUnprocessed(10, T0).stream().map(ArtifactEvent::getId).toList();

        assertEquals(List.of(tieA.getId(), tieB.getId(), late.getId()), ids);
    }

    @Test
    void returnedEvents_areDetachedCopies() {
        ArtifactEvent event = store.append(event(T0));

        store.findById(event.getId()).orElseThrow().setProcessedAt(T0);

        assertFalse(store.findById(event.getId()).orElseThrow().isProcessed());
    }

    @Test
    void duplicateId_isRejected() {
        ArtifactEvent event = store.append(event(T0));

        assertThrows(IllegalStateException.class, () -> store.append(event.copy()));
    }

    private static ArtifactEvent event(Instant createdAt) {
        return new ArtifactEvent(UUID.randomUUID().toString(), "proj-1", "charter-1", "project_charter",
            "updated", Map.of(), createdAt);
    }
}
