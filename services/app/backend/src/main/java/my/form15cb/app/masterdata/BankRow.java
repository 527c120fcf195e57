package my.form15cb.app.masterdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BankRow(
		@JsonProperty("bank_name") String bankName,
		@JsonProperty("bsr_code") String bsrCode,
		String branch
) {
}
