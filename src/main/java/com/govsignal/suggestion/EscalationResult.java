package com.govsignal.suggestion;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EscalationResult(int scanned, int created, int days, List<Suggestion> createdSuggestions) {}
