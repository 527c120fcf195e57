package my.form15cb.app.masterdata;

import my.form15cb.app.util.CsvParsing;
import my.form15cb.app.util.TextNormalizer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bank name to RBI bank code, read from a {@code code,bank_name} CSV and keyed by normalized bank name.
 */
public final class BankCodeLookup {
	private static final Logger logger = LoggerFactory.getLogger(BankCodeLookup.class);
	private static final String CODE_COLUMN = "code";
	private static final String NAME_COLUMN = "bank_name";

	private final Map<String, String> codesByName;

	private BankCodeLookup(Map<String, String> codesByName) {
		this.codesByName = Collections.unmodifiableMap(codesByName);
	}

	public static BankCodeLookup empty() {
		return new BankCodeLookup(new LinkedHashMap<>());
	}

	public static BankCodeLookup load(Resource resource) {
		if (resource == null || !resource.exists()) {
			logger.info("No bank code table found; bank codes fall back to bank names.");
			return empty();
		}
		try (InputStream in = resource.getInputStream()) {
			BankCodeLookup lookup = parse(CsvParsing.decodeUtf8(in.readAllBytes()));
			logger.info("Loaded {} bank codes from {}.", lookup.size(), resource.getDescription());
			return lookup;
		} catch (IOException exc) {
			throw new MasterDataLoadException("Failed to read bank codes: " + resource.getDescription(), exc);
		}
	}

	public static BankCodeLookup parse(String content) {
		Map<String, String> codes = new LinkedHashMap<>();
		if (content == null || content.isBlank()) {
			return new BankCodeLookup(codes);
		}
		String csv = CsvParsing.stripBom(content);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(CsvParsing.sniffDelimiter(csv))
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreSurroundingSpaces(true)
				.setIgnoreEmptyLines(true)
				.build();
		try (CSVParser parser = CSVParser.parse(new StringReader(csv), format)) {
			Map<String, Integer> header = parser.getHeaderMap();
			if (!header.containsKey(CODE_COLUMN) || !header.containsKey(NAME_COLUMN)) {
				throw new IllegalArgumentException("Bank code CSV needs columns 'code' and 'bank_name'");
			}
			for (CSVRecord record : parser) {
				if (!record.isSet(CODE_COLUMN) || !record.isSet(NAME_COLUMN)) {
					continue;
				}
				String code = record.get(CODE_COLUMN).trim();
				String name = TextNormalizer.normalize(record.get(NAME_COLUMN));
				if (code.isEmpty() || name.isEmpty()) {
					continue;
				}
				codes.putIfAbsent(name, code);
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read bank code CSV: " + exc.getMessage(), exc);
		}
		return new BankCodeLookup(codes);
	}

	public Optional<String> codeFor(String bankName) {
		String key = TextNormalizer.normalize(bankName);
		if (key.isEmpty()) {
			return Optional.empty();
		}
		return Optional.ofNullable(codesByName.get(key));
	}

	public int size() {
		return codesByName.size();
	}
}
