package com.govsignal.api;

import com.govsignal.orchestrator.BatchResult;
import com.govsignal.orchestrator.OrchestratorWorker;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual or scheduler trigger for one orchestrator batch.
 *
 * POST /v1/orchestrator/runs?limit=10&dryRun=false
 */
@RestController
@RequestMapping("/v1/orchestrator")
public class OrchestratorController {

    private final OrchestratorWorker worker;

    public OrchestratorController(OrchestratorWorker worker) {
        this.worker = worker;
    }

    @PostMapping("/runs")
    public BatchResult run(@RequestParam(required = false) Integer limit,
                           @RequestParam(defaultValue = "false") boolean dryRun) {
        return worker.runBatch(limit, dryRun);
    }
}
