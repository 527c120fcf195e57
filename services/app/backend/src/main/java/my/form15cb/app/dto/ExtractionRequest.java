package my.form15cb.app.dto;

import jakarta.validation.constraints.NotBlank;

public record ExtractionRequest(
		@NotBlank String text
) {
}
