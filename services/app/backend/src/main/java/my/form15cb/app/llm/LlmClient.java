package my.form15cb.app.llm;

public interface LlmClient {
	/**
	 * Sends a prompt that asks for a single JSON object and returns the raw reply text.
	 */
	LlmReply completeJson(String prompt);
}
