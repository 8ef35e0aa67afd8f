package com.govsignal.api;

import com.govsignal.sla.BottleneckRow;
import com.govsignal.sla.RebuildResult;
import com.govsignal.sla.SlaCacheBuilder;
import com.govsignal.sla.SlaCacheRow;
import com.govsignal.sla.SlaCacheStore;
import com.govsignal.sla.SlaStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * POST /v1/sla/cache/rebuild
 * GET  /v1/sla/cache?status=breached
 * GET  /v1/sla/bottlenecks
 */
@RestController
@RequestMapping("/v1/sla")
public class SlaController {

    private final SlaCacheBuilder cacheBuilder;
    private final SlaCacheStore cacheStore;

    public SlaController(SlaCacheBuilder cacheBuilder, SlaCacheStore cacheStore) {
        this.cacheBuilder = cacheBuilder;
        this.cacheStore = cacheStore;
    }

    @PostMapping("/cache/rebuild")
    public RebuildResult rebuild() {
        return cacheBuilder.rebuild();
    }

    @GetMapping("/cache")
    public List<SlaCacheRow> cache(@RequestParam(required = false) String status) {
        List<SlaCacheRow> rows = cacheStore.findCacheRows();
        if (status == null || status.isBlank()) {
            return rows;
        }
        SlaStatus wanted = SlaStatus.fromValue(status.trim());
        return rows.stream().filter(r -> r.slaStatus() == wanted).toList();
    }

    @GetMapping("/bottlenecks")
    public List<BottleneckRow> bottlenecks() {
        return cacheStore.findBottlenecks();
    }
}
