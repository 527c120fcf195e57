package my.form15cb.app.masterdata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the reference dataset and the alias tables. Both accept JSON, or YAML when the resource name
 * ends in {@code .yml}/{@code .yaml}.
 */
public class MasterDataLoader {
	private static final Logger logger = LoggerFactory.getLogger(MasterDataLoader.class);
	private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
	};

	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public MasterDataLoader() {
		this.jsonMapper = JsonMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();

		this.yamlMapper = YAMLMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public MasterDataset loadDataset(Resource resource) {
		if (resource == null || !resource.exists()) {
			throw new MasterDataLoadException("Master data not found: " + describe(resource));
		}
		try (InputStream in = resource.getInputStream()) {
			MasterDataset dataset = mapperFor(resource).readValue(in, MasterDataset.class);
			if (dataset == null) {
				throw new MasterDataLoadException("Master data is empty: " + describe(resource));
			}
			logger.info("Loaded master data from {}.", describe(resource));
			return dataset;
		} catch (IOException | JacksonException ex) {
			throw new MasterDataLoadException("Failed to read master data: " + describe(resource), ex);
		}
	}

	public MasterDataset parseDataset(String content) {
		try {
			MasterDataset dataset = jsonMapper.readValue(content, MasterDataset.class);
			return dataset == null ? MasterDataset.empty() : dataset;
		} catch (JacksonException ex) {
			throw new MasterDataLoadException("Failed to parse master data", ex);
		}
	}

	/**
	 * A missing resource yields empty tables; a present but unreadable one fails.
	 */
	public AliasTables loadAliases(Resource resource) {
		if (resource == null || !resource.exists()) {
			logger.info("No alias file at {}; alias tables are empty.", describe(resource));
			return AliasTables.empty();
		}
		try (InputStream in = resource.getInputStream()) {
			Map<String, Object> raw = mapperFor(resource).readValue(in, OBJECT_MAP);
			AliasTables tables = toAliasTables(raw);
			logger.info("Loaded alias tables from {}.", describe(resource));
			return tables;
		} catch (IOException | JacksonException ex) {
			throw new MasterDataLoadException("Failed to read aliases: " + describe(resource), ex);
		}
	}

	public AliasTables parseAliases(String content) {
		try {
			return toAliasTables(jsonMapper.readValue(content, OBJECT_MAP));
		} catch (JacksonException ex) {
			throw new MasterDataLoadException("Failed to parse aliases", ex);
		}
	}

	private AliasTables toAliasTables(Map<String, Object> raw) {
		Map<LookupDomain, Map<String, String>> tables = new EnumMap<>(LookupDomain.class);
		if (raw == null) {
			return AliasTables.of(tables);
		}
		for (LookupDomain domain : LookupDomain.values()) {
			Object section = raw.get(domain.aliasSection());
			if (section == null) {
				continue;
			}
			if (!(section instanceof Map<?, ?> entries)) {
				logger.warn("Alias section '{}' is not an object; ignoring it.", domain.aliasSection());
				continue;
			}
			Map<String, String> table = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : entries.entrySet()) {
				if (entry.getKey() instanceof String key && entry.getValue() instanceof String value) {
					table.put(key, value);
				}
			}
			tables.put(domain, table);
		}
		return AliasTables.of(tables);
	}

	private ObjectMapper mapperFor(Resource resource) {
		String name = resource.getFilename();
		if (name != null) {
			String lower = name.toLowerCase(Locale.ROOT);
			if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
				return yamlMapper;
			}
		}
		return jsonMapper;
	}

	private static String describe(Resource resource) {
		return resource == null ? "<none>" : resource.getDescription();
	}
}
