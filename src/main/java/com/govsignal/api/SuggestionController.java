package com.govsignal.api;

import com.govsignal.suggestion.EscalationResult;
import com.govsignal.suggestion.Suggestion;
import com.govsignal.suggestion.SuggestionEscalationService;
import com.govsignal.suggestion.SuggestionStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET  /v1/projects/{projectId}/suggestions
 * POST /v1/projects/{projectId}/suggestions/escalations?days=7
 */
@RestController
@RequestMapping("/v1/projects/{projectId}/suggestions")
public class SuggestionController {

    private final SuggestionStore suggestionStore;
    private final SuggestionEscalationService escalationService;

    public SuggestionController(SuggestionStore suggestionStore, SuggestionEscalationService escalationService) {
        this.suggestionStore = suggestionStore;
        this.escalationService = escalationService;
    }

    @GetMapping
    public List<Suggestion> list(@PathVariable String projectId) {
        return suggestionStore.findByProject(projectId);
    }

    @PostMapping("/escalations")
    public EscalationResult escalate(@PathVariable String projectId,
                                     @RequestParam(required = false) Integer days) {
        return escalationService.escalateStale(projectId, days);
    }
}
