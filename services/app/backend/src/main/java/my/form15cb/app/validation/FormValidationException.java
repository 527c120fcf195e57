package my.form15cb.app.validation;

import java.util.List;

public class FormValidationException extends RuntimeException {
	private final List<String> errors;

	public FormValidationException(List<String> errors) {
		this("Form validation failed: " + String.join("; ", errors), errors);
	}

	public FormValidationException(String message, List<String> errors) {
		super(message);
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
