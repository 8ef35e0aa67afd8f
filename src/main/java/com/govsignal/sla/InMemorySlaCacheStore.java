package com.govsignal.sla;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps each run as an immutable snapshot and swaps the reference, so a
 * reader always sees one complete run.
 */
@Component
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySlaCacheStore implements SlaCacheStore {

    private final AtomicReference<Snapshot> current = new AtomicReference<>(new Snapshot(List.of(), List.of()));

    @Override
    public void replaceAll(List<SlaCacheRow> cacheRows, List<BottleneckRow> bottlenecks) {
        current.set(new Snapshot(List.copyOf(cacheRows), List.copyOf(bottlenecks)));
    }

    @Override
    public List<SlaCacheRow> findCacheRows() {
        return current.get().cacheRows();
    }

    @Override
    public List<BottleneckRow> findBottlenecks() {
        return current.get().bottlenecks();
    }

    private record Snapshot(List<SlaCacheRow> cacheRows, List<BottleneckRow> bottlenecks) {}
}
