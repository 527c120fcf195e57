package my.form15cb.app.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValidatorsTest {
	@Test
	void panIsCheckedCaseInsensitively() {
		assertThat(FieldValidators.validatePan("ABCDE1234F")).isTrue();
		assertThat(FieldValidators.validatePan("abcde1234f")).isTrue();
		assertThat(FieldValidators.validatePan("1234ABCDE")).isFalse();
		assertThat(FieldValidators.validatePan(" aabcb5678k ")).isTrue();
		assertThat(FieldValidators.validatePan("AAAC1234F")).isFalse();
		assertThat(FieldValidators.validatePan("AAACA12345")).isFalse();
		assertThat(FieldValidators.validatePan(null)).isFalse();
	}

	@Test
	void bsrCodeIgnoresSeparators() {
		assertThat(FieldValidators.validateBsrCode("0510001")).isTrue();
		assertThat(FieldValidators.validateBsrCode("12-34-567")).isTrue();
		assertThat(FieldValidators.validateBsrCode("123456")).isFalse();
		assertThat(FieldValidators.validateBsrCode("051000")).isFalse();
		assertThat(FieldValidators.validateBsrCode("05100011")).isFalse();
		assertThat(FieldValidators.validateBsrCode("")).isFalse();
	}

	@Test
	void purposeCodeAcceptsOptionalSubCode() {
		assertThat(FieldValidators.validatePurposeCode("RB-08.1")).isTrue();
		assertThat(FieldValidators.validatePurposeCode("rb-10.3-S1023")).isTrue();
		assertThat(FieldValidators.validatePurposeCode("RB-8.1")).isFalse();
		assertThat(FieldValidators.validatePurposeCode("S1023")).isFalse();
	}

	@ParameterizedTest
	@ValueSource(strings = {"0", "10", "12.5", "100", " 15 "})
	void dtaaRateAcceptsPercentages(String rate) {
		assertThat(FieldValidators.validateDtaaRate(rate)).isTrue();
	}

	@ParameterizedTest
	@ValueSource(strings = {"-1", "100.01", "ten", "10%", ""})
	void dtaaRateRejectsEverythingElse(String rate) {
		assertThat(FieldValidators.validateDtaaRate(rate)).isFalse();
	}

	@Test
	void digitsOnlyStripsEverythingButDigits() {
		assertThat(FieldValidators.digitsOnly("05-10 001")).isEqualTo("0510001");
		assertThat(FieldValidators.digitsOnly(null)).isEmpty();
	}
}
