package my.form15cb.app.dto;

import my.form15cb.app.model.ReconciliationEvent;

import java.util.List;
import java.util.Map;

public record SuggestionResponseDto(
		Map<String, String> suggestions,
		List<ReconciliationEvent> events,
		Map<String, String> merged
) {
}
