package my.form15cb.app.masterdata;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LookupDomain {
	INDIAN("indian", "indian_company_aliases", "master.indian_companies"),
	FOREIGN("foreign", "foreign_party_aliases", "master.foreign_companies"),
	PARTY("party", "party_bank_aliases", "master.banks_by_party"),
	NATURE("nature", "nature_aliases", "master.nature_map"),
	COUNTRY("country", "country_aliases", "master.dtaa_rates");

	private final String code;
	private final String aliasSection;
	private final String source;

	LookupDomain(String code, String aliasSection, String source) {
		this.code = code;
		this.aliasSection = aliasSection;
		this.source = source;
	}

	@JsonValue
	public String code() {
		return code;
	}

	/**
	 * Top-level key of this domain's table in {@code aliases.json}.
	 */
	public String aliasSection() {
		return aliasSection;
	}

	public String source() {
		return source;
	}
}
