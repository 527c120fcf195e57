package my.form15cb.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.form15cb.app.masterdata.LookupDomain;
import my.form15cb.app.masterdata.MatchType;

/**
 * Audit record of one master-data lookup made while building suggestions.
 */
public record ReconciliationEvent(
		@JsonProperty("lookup_domain") LookupDomain lookupDomain,
		@JsonProperty("input") String input,
		@JsonProperty("resolved") String resolved,
		@JsonProperty("match_type") MatchType matchType,
		@JsonProperty("source") String source
) {
	public static ReconciliationEvent of(LookupDomain domain, String input, String resolved, MatchType matchType) {
		return new ReconciliationEvent(domain, input, resolved, matchType, domain.source());
	}
}
