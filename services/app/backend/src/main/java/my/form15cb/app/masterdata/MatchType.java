package my.form15cb.app.masterdata;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {
	MATCHED("matched"),
	ALIAS_MATCHED("alias_matched"),
	NOT_FOUND("not_found");

	private final String code;

	MatchType(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}
}
