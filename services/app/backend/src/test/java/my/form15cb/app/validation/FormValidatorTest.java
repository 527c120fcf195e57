package my.form15cb.app.validation;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormValidatorTest {
	private final FormValidator validator = new FormValidator();

	@Test
	void completeFormHasNoErrors() {
		assertThat(validator.validate(validFields())).isEmpty();
	}

	@Test
	void blankMandatoryFieldsAreReportedInOrder() {
		Map<String, String> fields = validFields();
		fields.put("FormName", " ");
		fields.remove("NameRemitter");

		assertThat(validator.missingMandatoryFields(fields)).containsExactly("FormName", "NameRemitter");
		assertThat(validator.validate(fields)).containsExactly("FormName is required", "NameRemitter is required");
	}

	@Test
	void formatErrorsAreReportedForFilledFieldsOnly() {
		Map<String, String> fields = validFields();
		fields.put("RemitterPAN", "BAD");
		fields.put("BsrCode", "123");
		fields.put("RevPurCode", "S1023");
		fields.put("RateTdsADtaa", "150");
		fields.put("RateTdsSecB", "");

		assertThat(validator.validate(fields)).containsExactly(
				"RemitterPAN must look like AAAAA9999A",
				"BsrCode must have exactly 7 digits",
				"RevPurCode must look like RB-99.9 or RB-99.9-S9999",
				"RateTdsADtaa must be a number between 0 and 100"
		);
	}

	@Test
	void requireValidThrowsWithAllErrors() {
		Map<String, String> fields = validFields();
		fields.put("AssessmentYear", "");
		fields.put("RateTdsSecB", "abc");

		assertThatThrownBy(() -> validator.requireValid(fields))
				.isInstanceOfSatisfying(FormValidationException.class, ex ->
						assertThat(ex.getErrors()).containsExactly(
								"AssessmentYear is required",
								"RateTdsSecB must be a number between 0 and 100"));
	}

	@Test
	void nullFieldsMissEveryMandatoryField() {
		assertThat(validator.missingMandatoryFields(null)).containsExactlyElementsOf(FormValidator.MANDATORY_FIELDS);
	}

	private static Map<String, String> validFields() {
		Map<String, String> fields = new HashMap<>();
		fields.put("SWVersionNo", "1");
		fields.put("FormName", "FORM15CB");
		fields.put("AssessmentYear", "2025");
		fields.put("RemitterPAN", "AAACA1234F");
		fields.put("NameRemitter", "Acme India Private Limited");
		fields.put("BsrCode", "0510001");
		fields.put("RevPurCode", "RB-08.1");
		fields.put("RateTdsADtaa", "10");
		return fields;
	}
}
