package com.govsignal.sla;

import java.util.List;

/**
 * Holder of the materialized SLA cache and the approver bottleneck table.
 */
public interface SlaCacheStore {

    /**
     * Replaces the content of both tables in a single commit. Readers see either
     * the previous run or this one, never an empty or mixed state.
     */
    void replaceAll(List<SlaCacheRow> cacheRows, List<BottleneckRow> bottlenecks);

    List<SlaCacheRow> findCacheRows();

    List<BottleneckRow> findBottlenecks();
}
