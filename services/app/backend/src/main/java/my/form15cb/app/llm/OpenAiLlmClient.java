package my.form15cb.app.llm;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions client that requests JSON-object output at temperature 0.
 */
public class OpenAiLlmClient implements LlmClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(3);

	private final RestClient restClient;
	private final String model;
	private final int maxOutputTokens;

	public OpenAiLlmClient(String baseUrl, String apiKey, String model, int maxOutputTokens,
						   Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.model = model;
		this.maxOutputTokens = maxOutputTokens;
	}

	@Override
	public LlmReply completeJson(String prompt) {
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("temperature", 0);
		request.put("max_tokens", maxOutputTokens);
		request.put("response_format", Map.of("type", "json_object"));
		request.put("messages", List.of(
				Map.of("role", "system", "content", "Respond in JSON only. Do not wrap in Markdown code fences."),
				Map.of("role", "user", "content", prompt)
		));

		Map<?, ?> response;
		try {
			response = restClient.post().uri("/chat/completions").body(request).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new LlmRequestException(safeMessage(ex), ex.getStatusCode().value(), isRetryable(ex), ex);
		} catch (ResourceAccessException ex) {
			throw new LlmRequestException(safeMessage(ex), null, true, ex);
		}
		return new LlmReply(extractContent(response), model);
	}

	private String extractContent(Map<?, ?> response) {
		if (response == null || !(response.get("choices") instanceof List<?> choices) || choices.isEmpty()) {
			return "";
		}
		if (!(choices.get(0) instanceof Map<?, ?> choice)) {
			return "";
		}
		if (!(choice.get("message") instanceof Map<?, ?> message)) {
			return "";
		}
		Object content = message.get("content");
		return content == null ? "" : content.toString();
	}

	private boolean isRetryable(RestClientResponseException ex) {
		int status = ex.getStatusCode().value();
		return status == 408 || status == 429 || status >= 500;
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
