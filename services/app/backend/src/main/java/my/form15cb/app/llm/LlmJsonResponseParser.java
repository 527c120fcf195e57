package my.form15cb.app.llm;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls one JSON object out of free-form model output. Tries a fenced code block, then the whole
 * text, then the span from the first '{' to the last '}'. A top-level array yields its first object.
 */
public class LlmJsonResponseParser {
	private static final String FENCE = "```";

	private final ObjectMapper jsonMapper;

	public LlmJsonResponseParser() {
		this.jsonMapper = JsonMapper.builder().build();
	}

	public Optional<Map<String, Object>> parse(String reply) {
		if (reply == null || reply.isBlank()) {
			return Optional.empty();
		}
		String text = reply.trim();
		return fromFencedBlock(text)
				.or(() -> fromWholeText(text))
				.or(() -> fromBraceSlice(text));
	}

	Optional<Map<String, Object>> fromFencedBlock(String text) {
		if (!text.contains(FENCE)) {
			return Optional.empty();
		}
		for (String part : text.split(FENCE)) {
			String candidate = stripLanguageTag(part.trim());
			if (candidate.startsWith("{") && candidate.endsWith("}")) {
				Optional<Map<String, Object>> parsed = readObject(candidate);
				if (parsed.isPresent()) {
					return parsed;
				}
			}
		}
		return Optional.empty();
	}

	Optional<Map<String, Object>> fromWholeText(String text) {
		return readObject(text);
	}

	Optional<Map<String, Object>> fromBraceSlice(String text) {
		int start = text.indexOf('{');
		int end = text.lastIndexOf('}');
		if (start < 0 || end <= start) {
			return Optional.empty();
		}
		return readObject(text.substring(start, end + 1));
	}

	private Optional<Map<String, Object>> readObject(String candidate) {
		Object value;
		try {
			value = jsonMapper.readValue(candidate, Object.class);
		} catch (JacksonException ex) {
			return Optional.empty();
		}
		if (value instanceof List<?> items) {
			value = items.stream().filter(Map.class::isInstance).findFirst().orElse(null);
		}
		if (!(value instanceof Map<?, ?> map)) {
			return Optional.empty();
		}
		Map<String, Object> result = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			result.put(String.valueOf(entry.getKey()), entry.getValue());
		}
		return Optional.of(result);
	}

	private static String stripLanguageTag(String part) {
		if (part.toLowerCase(Locale.ROOT).startsWith("json")) {
			return part.substring(4).trim();
		}
		return part;
	}
}
