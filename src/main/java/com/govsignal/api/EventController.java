package com.govsignal.api;

import com.govsignal.contract.ArtifactEvent;
import com.govsignal.event.ArtifactEventService;
import com.govsignal.suggestion.Suggestion;
import com.govsignal.suggestion.SuggestionStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Ingestion of artifact lifecycle events.
 *
 * POST /v1/events
 * GET  /v1/events/{eventId}
 * GET  /v1/events/{eventId}/suggestions
 */
@RestController
@RequestMapping("/v1/events")
public class EventController {

    private final ArtifactEventService eventService;
    private final SuggestionStore suggestionStore;

    public EventController(ArtifactEventService eventService, SuggestionStore suggestionStore) {
        this.eventService = eventService;
        this.suggestionStore = suggestionStore;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> append(@RequestBody ArtifactEvent event) {
        ArtifactEvent appended = eventService.append(event);
        return Map.of(
            "status", "accepted",
            "event_id", appended.getId(),
            "created_at", appended.getCreatedAt().toString()
        );
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<ArtifactEvent> get(@PathVariable String eventId) {
        return eventService.find(eventId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{eventId}/suggestions")
    public List<Suggestion> suggestions(@PathVariable String eventId) {
        return suggestionStore.findBySourceEvent(eventId);
    }
}
