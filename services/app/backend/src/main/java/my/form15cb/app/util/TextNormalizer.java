package my.form15cb.app.util;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class TextNormalizer {
	private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private TextNormalizer() {
	}

	/**
	 * Canonical lookup form of free text: lower-case ASCII letters and digits separated by single spaces.
	 * Never fails; {@code null} and empty input yield an empty string.
	 */
	public static String normalize(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String lowered = text.toLowerCase(Locale.ROOT).strip();
		String cleaned = NON_ALPHANUMERIC.matcher(lowered).replaceAll(" ");
		return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
	}

	public static Set<String> tokens(String text) {
		String normalized = normalize(text);
		if (normalized.isEmpty()) {
			return Set.of();
		}
		Set<String> tokens = new LinkedHashSet<>();
		for (String token : normalized.split(" ")) {
			tokens.add(token);
		}
		return tokens;
	}
}
