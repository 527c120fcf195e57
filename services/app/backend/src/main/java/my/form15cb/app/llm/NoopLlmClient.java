package my.form15cb.app.llm;

public class NoopLlmClient implements LlmClient {
	@Override
	public LlmReply completeJson(String prompt) {
		return new LlmReply("", "LLM disabled");
	}
}
