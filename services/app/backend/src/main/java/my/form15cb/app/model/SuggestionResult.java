package my.form15cb.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SuggestionResult(
		Map<String, String> suggestions,
		List<ReconciliationEvent> events
) {
	public SuggestionResult {
		suggestions = suggestions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(suggestions));
		events = events == null ? List.of() : List.copyOf(events);
	}

	public Map<String, String> applyTo(Map<String, String> fields) {
		return FormFields.merge(fields, suggestions);
	}
}
