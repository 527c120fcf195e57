package my.form15cb.app.masterdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reference dataset as stored in {@code master_data.json}. Null sections and null entries are dropped;
 * the order of {@code banks_by_party} is the order of the source document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MasterDataset(
		@JsonProperty("indian_companies") List<IndianCompany> indianCompanies,
		@JsonProperty("foreign_companies") List<ForeignCompany> foreignCompanies,
		@JsonProperty("banks_by_party") Map<String, List<BankRow>> banksByParty,
		@JsonProperty("nature_map") List<NatureMapping> natureMap,
		@JsonProperty("dtaa_rates") List<DtaaRate> dtaaRates,
		@JsonProperty("reasons") List<Object> reasons
) {
	public MasterDataset {
		indianCompanies = compact(indianCompanies);
		foreignCompanies = compact(foreignCompanies);
		banksByParty = compact(banksByParty);
		natureMap = compact(natureMap);
		dtaaRates = compact(dtaaRates);
		reasons = compact(reasons);
	}

	public static MasterDataset empty() {
		return new MasterDataset(null, null, null, null, null, null);
	}

	private static <T> List<T> compact(List<T> values) {
		if (values == null) {
			return List.of();
		}
		return values.stream().filter(Objects::nonNull).toList();
	}

	private static Map<String, List<BankRow>> compact(Map<String, List<BankRow>> values) {
		if (values == null) {
			return Map.of();
		}
		Map<String, List<BankRow>> copy = new LinkedHashMap<>();
		for (Map.Entry<String, List<BankRow>> entry : values.entrySet()) {
			if (entry.getKey() == null) {
				continue;
			}
			copy.put(entry.getKey(), compact(entry.getValue()));
		}
		return Collections.unmodifiableMap(copy);
	}
}
