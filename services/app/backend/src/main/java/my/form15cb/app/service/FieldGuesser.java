package my.form15cb.app.service;

import java.util.Map;

/**
 * Produces a first draft of the field dictionary from raw document text. The result always holds
 * every extraction key, blank when nothing was found.
 */
public interface FieldGuesser {
	Map<String, String> guess(String documentText);

	String name();
}
