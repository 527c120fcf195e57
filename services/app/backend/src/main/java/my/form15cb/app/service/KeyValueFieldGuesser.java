package my.form15cb.app.service;

import my.form15cb.app.model.FormFields;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code Key: value} lines whose key names an extraction field, ignoring case, spaces and
 * punctuation in the key. The first occurrence of a key wins.
 */
@Service
public class KeyValueFieldGuesser implements FieldGuesser {
	private static final Pattern KEY_VALUE = Pattern.compile("^\\s*([A-Za-z0-9_.\\s-]+?)\\s*:\\s*(.+)$");
	private static final Map<String, String> KEYS_BY_LOOKUP = keysByLookup();

	@Override
	public Map<String, String> guess(String documentText) {
		Map<String, String> values = new HashMap<>();
		if (documentText == null || documentText.isBlank()) {
			return FormFields.blankExtraction();
		}
		for (String line : documentText.split("\\R")) {
			Matcher matcher = KEY_VALUE.matcher(line);
			if (!matcher.matches()) {
				continue;
			}
			String key = KEYS_BY_LOOKUP.get(normalizeKey(matcher.group(1)));
			String value = matcher.group(2).trim();
			if (key == null || value.isBlank()) {
				continue;
			}
			values.putIfAbsent(key, value);
		}
		return FormFields.completeExtraction(values);
	}

	@Override
	public String name() {
		return "key-value";
	}

	private static String normalizeKey(String raw) {
		return raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
	}

	private static Map<String, String> keysByLookup() {
		Map<String, String> keys = new HashMap<>();
		for (String key : FormFields.EXTRACTION_KEYS) {
			keys.put(normalizeKey(key), key);
		}
		return keys;
	}
}
