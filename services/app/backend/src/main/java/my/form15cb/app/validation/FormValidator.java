package my.form15cb.app.validation;

import my.form15cb.app.model.FormFields;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class FormValidator {
	public static final List<String> MANDATORY_FIELDS = List.of(
			FormFields.SW_VERSION_NO,
			FormFields.FORM_NAME,
			FormFields.ASSESSMENT_YEAR,
			FormFields.REMITTER_PAN,
			FormFields.NAME_REMITTER
	);

	public List<String> validate(Map<String, String> fields) {
		List<String> errors = new ArrayList<>();
		for (String key : missingMandatoryFields(fields)) {
			errors.add(key + " is required");
		}

		String pan = FormFields.value(fields, FormFields.REMITTER_PAN);
		if (!pan.isEmpty() && !FieldValidators.validatePan(pan)) {
			errors.add(FormFields.REMITTER_PAN + " must look like AAAAA9999A");
		}
		String bsr = FormFields.value(fields, FormFields.BSR_CODE);
		if (!bsr.isEmpty() && !FieldValidators.validateBsrCode(bsr)) {
			errors.add(FormFields.BSR_CODE + " must have exactly 7 digits");
		}
		String purpose = FormFields.value(fields, FormFields.REV_PUR_CODE);
		if (!purpose.isEmpty() && !FieldValidators.validatePurposeCode(purpose)) {
			errors.add(FormFields.REV_PUR_CODE + " must look like RB-99.9 or RB-99.9-S9999");
		}
		for (String rateKey : List.of(FormFields.RATE_TDS_A_DTAA, FormFields.RATE_TDS_SEC_B)) {
			String rate = FormFields.value(fields, rateKey);
			if (!rate.isEmpty() && !FieldValidators.validateDtaaRate(rate)) {
				errors.add(rateKey + " must be a number between 0 and 100");
			}
		}
		return errors;
	}

	/**
	 * Mandatory keys that are absent or blank, in declaration order.
	 */
	public List<String> missingMandatoryFields(Map<String, String> fields) {
		List<String> missing = new ArrayList<>();
		for (String key : MANDATORY_FIELDS) {
			if (FormFields.value(fields, key).isEmpty()) {
				missing.add(key);
			}
		}
		return missing;
	}

	public void requireValid(Map<String, String> fields) {
		List<String> errors = validate(fields);
		if (!errors.isEmpty()) {
			throw new FormValidationException(errors);
		}
	}
}
