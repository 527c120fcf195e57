package my.form15cb.app.config;

import my.form15cb.app.llm.LlmClient;
import my.form15cb.app.llm.LlmJsonResponseParser;
import my.form15cb.app.llm.NoopLlmClient;
import my.form15cb.app.llm.OpenAiLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openai")
	public OpenAiLlmClient openAiLlmClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = properties.llm() == null ? null : properties.llm().openai();
		if (openai == null || openai.apiKey() == null || openai.apiKey().isBlank()) {
			throw new IllegalStateException("app.llm.openai.api-key is required for provider openai");
		}
		String baseUrl = openai.baseUrl() == null || openai.baseUrl().isBlank()
				? "https://api.openai.com/v1"
				: openai.baseUrl();
		String model = openai.model() == null || openai.model().isBlank() ? "gpt-4o-mini" : openai.model();
		int maxOutputTokens = openai.maxOutputTokens() == null ? 4000 : openai.maxOutputTokens();
		Integer connectTimeoutSeconds = openai.connectTimeoutSeconds();
		Integer readTimeoutSeconds = openai.readTimeoutSeconds();
		logger.info("LLM client enabled (provider=openai, model={}).", model);
		return new OpenAiLlmClient(baseUrl, openai.apiKey(), model, maxOutputTokens,
				connectTimeoutSeconds == null ? null : Duration.ofSeconds(connectTimeoutSeconds),
				readTimeoutSeconds == null ? null : Duration.ofSeconds(readTimeoutSeconds));
	}

	@Bean
	@ConditionalOnMissingBean(LlmClient.class)
	public NoopLlmClient noopLlmClient() {
		logger.info("LLM client disabled (provider=noop).");
		return new NoopLlmClient();
	}

	@Bean
	public LlmJsonResponseParser llmJsonResponseParser() {
		return new LlmJsonResponseParser();
	}
}
