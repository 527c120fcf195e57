package my.form15cb.app.llm;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmClientTest {
	private HttpServer server;

	@AfterEach
	void stopServer() {
		if (server != null) {
			server.stop(0);
		}
	}

	@Test
	void noopClientReturnsEmptyReply() {
		LlmReply reply = new NoopLlmClient().completeJson("prompt");

		assertThat(reply.isEmpty()).isTrue();
		assertThat(reply.model()).contains("disabled");
	}

	@Test
	@SuppressWarnings("unchecked")
	void openAiClientRequestsJsonObjectOutput() throws IOException {
		ObjectMapper mapper = JsonMapper.builder().build();
		AtomicReference<Map<String, Object>> captured = new AtomicReference<>();
		AtomicReference<String> authorization = new AtomicReference<>();
		start(exchange -> {
			captured.set(mapper.readValue(exchange.getRequestBody().readAllBytes(), Map.class));
			authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
			respond(exchange, 200, "{\"choices\":[{\"message\":{\"content\":\"{\\\"NameRemittee\\\": \\\"Acme Global GmbH\\\"}\"}}]}");
		});

		LlmReply reply = client().completeJson("extract this");

		assertThat(reply.content()).isEqualTo("{\"NameRemittee\": \"Acme Global GmbH\"}");
		assertThat(reply.model()).isEqualTo("gpt-test");
		assertThat(authorization.get()).isEqualTo("Bearer test-key");
		Map<String, Object> request = captured.get();
		assertThat(request).containsEntry("model", "gpt-test").containsEntry("temperature", 0);
		assertThat((Map<String, Object>) request.get("response_format")).containsEntry("type", "json_object");
	}

	@Test
	void openAiClientReturnsEmptyReplyWithoutChoices() throws IOException {
		start(exchange -> respond(exchange, 200, "{\"choices\":[]}"));

		assertThat(client().completeJson("prompt").isEmpty()).isTrue();
	}

	@Test
	void openAiClientReturnsEmptyReplyForInvalidChoiceShape() throws IOException {
		start(exchange -> respond(exchange, 200, "{\"choices\":[\"text\"]}"));

		assertThat(client().completeJson("prompt").isEmpty()).isTrue();
	}

	@Test
	void openAiClientWrapsServerErrors() throws IOException {
		start(exchange -> respond(exchange, 503, "{\"error\":\"overloaded\"}"));

		assertThatThrownBy(() -> client().completeJson("prompt"))
				.isInstanceOfSatisfying(LlmRequestException.class, ex -> {
					assertThat(ex.getStatusCode()).isEqualTo(503);
					assertThat(ex.isRetryable()).isTrue();
				});
	}

	@Test
	void openAiClientDoesNotRetryBadRequests() throws IOException {
		start(exchange -> respond(exchange, 400, "{\"error\":\"bad request\"}"));

		assertThatThrownBy(() -> client().completeJson("prompt"))
				.isInstanceOfSatisfying(LlmRequestException.class, ex -> {
					assertThat(ex.getStatusCode()).isEqualTo(400);
					assertThat(ex.isRetryable()).isFalse();
				});
	}

	private void start(ExchangeHandler handler) throws IOException {
		server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> handler.handle(exchange));
		server.start();
	}

	private OpenAiLlmClient client() {
		int port = server.getAddress().getPort();
		return new OpenAiLlmClient("http://localhost:" + port, "test-key", "gpt-test", 512,
				Duration.ofSeconds(5), Duration.ofSeconds(5));
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream os = exchange.getResponseBody()) {
			os.write(bytes);
		}
	}

	@FunctionalInterface
	private interface ExchangeHandler {
		void handle(HttpExchange exchange) throws IOException;
	}
}
