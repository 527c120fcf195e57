package my.form15cb.app.dto;

import java.util.List;

public record ValidationResultDto(
		boolean valid,
		List<String> errors
) {
}
