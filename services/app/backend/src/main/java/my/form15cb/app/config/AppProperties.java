package my.form15cb.app.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@NotNull MasterData masterData,
		@NotNull Form form,
		Llm llm
) {
	public record MasterData(
			@NotBlank String dataset,
			String aliases,
			String bankCodes
	) {
	}

	public record Form(
			@NotBlank String template,
			@NotBlank String outputDir,
			String assessmentYear,
			String intermediaryCity
	) {
	}

	public record Llm(
			@NotBlank String provider,
			boolean extractionEnabled,
			Integer maxInputChars,
			OpenAi openai
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer maxOutputTokens,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}
}
