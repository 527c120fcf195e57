package my.form15cb.app.validation;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Format checks for the codified Form 15CB fields. All of them accept {@code null} and answer {@code false}.
 */
public final class FieldValidators {
	private static final Pattern PAN = Pattern.compile("^[A-Z]{5}[0-9]{4}[A-Z]$");
	private static final Pattern BSR_CODE = Pattern.compile("^\\d{7}$");
	private static final Pattern PURPOSE_CODE = Pattern.compile("^RB-\\d{2}\\.\\d(-S\\d{4})?$");
	private static final Pattern NON_DIGIT = Pattern.compile("\\D");
	private static final BigDecimal MAX_RATE = BigDecimal.valueOf(100);

	private FieldValidators() {
	}

	public static boolean validatePan(String pan) {
		return PAN.matcher(upperTrim(pan)).matches();
	}

	public static boolean validateBsrCode(String bsrCode) {
		return BSR_CODE.matcher(digitsOnly(bsrCode)).matches();
	}

	public static boolean validatePurposeCode(String purposeCode) {
		return PURPOSE_CODE.matcher(upperTrim(purposeCode)).matches();
	}

	/**
	 * Percentage between 0 and 100 inclusive.
	 */
	public static boolean validateDtaaRate(String rate) {
		String value = rate == null ? "" : rate.trim();
		if (value.isEmpty()) {
			return false;
		}
		BigDecimal parsed;
		try {
			parsed = new BigDecimal(value);
		} catch (NumberFormatException ex) {
			return false;
		}
		return parsed.signum() >= 0 && parsed.compareTo(MAX_RATE) <= 0;
	}

	public static String digitsOnly(String value) {
		return value == null ? "" : NON_DIGIT.matcher(value).replaceAll("");
	}

	private static String upperTrim(String value) {
		return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
	}
}
