package my.form15cb.app.masterdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NatureMapping(
		@JsonProperty("invoice_nature") String invoiceNature,
		@JsonProperty("agreement_nature") String agreementNature,
		@JsonProperty("service_category") String serviceCategory,
		@JsonProperty("purpose_code") String purposeCode
) {
}
