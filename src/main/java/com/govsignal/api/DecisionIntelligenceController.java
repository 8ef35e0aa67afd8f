package com.govsignal.api;

import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionIntelligenceReport;
import com.govsignal.decision.DecisionIntelligenceService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * On-demand analysis of a project's decision log. Never writes.
 *
 * POST takes the decisions in the body, GET reads the stored log.
 */
@RestController
@RequestMapping("/v1/projects/{projectId}/decision-intelligence")
public class DecisionIntelligenceController {

    private final DecisionIntelligenceService intelligenceService;

    public DecisionIntelligenceController(DecisionIntelligenceService intelligenceService) {
        this.intelligenceService = intelligenceService;
    }

    @PostMapping
    public DecisionIntelligenceReport analyze(@PathVariable String projectId,
                                              @RequestBody AnalysisRequest request) {
        if (request == null || request.decisions() == null) {
            throw new IllegalArgumentException("decisions array is required");
        }
        return intelligenceService.analyze(projectId, request.decisions());
    }

    @GetMapping
    public DecisionIntelligenceReport analyzeStored(@PathVariable String projectId) {
        return intelligenceService.analyzeStored(projectId);
    }

    public record AnalysisRequest(List<Decision> decisions) {}
}
