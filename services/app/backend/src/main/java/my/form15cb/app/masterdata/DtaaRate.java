package my.form15cb.app.masterdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Treaty withholding rate for one country; {@code rate} is a fraction (0.1 means 10%), kept as read
 * from the dataset.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DtaaRate(
		String country,
		String article,
		String rate
) {
	/**
	 * The rate as a number, empty when it is missing or not numeric.
	 */
	public Optional<BigDecimal> fraction() {
		if (rate == null || rate.isBlank()) {
			return Optional.empty();
		}
		try {
			return Optional.of(new BigDecimal(rate.trim()));
		} catch (NumberFormatException ex) {
			return Optional.empty();
		}
	}
}
