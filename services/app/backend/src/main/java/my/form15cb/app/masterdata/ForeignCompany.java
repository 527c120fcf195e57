package my.form15cb.app.masterdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ForeignCompany(
		String name
) {
}
