package my.form15cb.app.masterdata;

import my.form15cb.app.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-domain raw text to canonical text overrides. Keys are stored normalized, values are kept as
 * written and normalized by the resolver on use.
 */
public final class AliasTables {
	private static final Logger logger = LoggerFactory.getLogger(AliasTables.class);

	private final Map<LookupDomain, Map<String, String>> tables;

	private AliasTables(Map<LookupDomain, Map<String, String>> tables) {
		this.tables = tables;
	}

	public static AliasTables empty() {
		return of(Map.of());
	}

	public static AliasTables of(Map<LookupDomain, Map<String, String>> rawTables) {
		Map<LookupDomain, Map<String, String>> tables = new EnumMap<>(LookupDomain.class);
		for (LookupDomain domain : LookupDomain.values()) {
			Map<String, String> raw = rawTables == null ? null : rawTables.get(domain);
			tables.put(domain, Collections.unmodifiableMap(normalizeKeys(domain, raw)));
		}
		return new AliasTables(Collections.unmodifiableMap(tables));
	}

	public Optional<String> lookup(LookupDomain domain, String normalizedKey) {
		if (normalizedKey == null || normalizedKey.isEmpty()) {
			return Optional.empty();
		}
		return Optional.ofNullable(tables.get(domain).get(normalizedKey));
	}

	public Map<String, String> table(LookupDomain domain) {
		return tables.get(domain);
	}

	public int size(LookupDomain domain) {
		return tables.get(domain).size();
	}

	private static Map<String, String> normalizeKeys(LookupDomain domain, Map<String, String> raw) {
		Map<String, String> normalized = new LinkedHashMap<>();
		if (raw == null) {
			return normalized;
		}
		for (Map.Entry<String, String> entry : raw.entrySet()) {
			String key = TextNormalizer.normalize(entry.getKey());
			String target = entry.getValue();
			if (key.isEmpty() || target == null || target.isBlank()) {
				continue;
			}
			String existing = normalized.putIfAbsent(key, target);
			if (existing != null && !existing.equals(target)) {
				logger.warn("Duplicate {} alias '{}' ignored (kept '{}', dropped '{}')",
						domain.code(), key, existing, target);
			}
		}
		return normalized;
	}
}
