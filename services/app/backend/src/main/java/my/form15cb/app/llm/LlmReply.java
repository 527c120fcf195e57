package my.form15cb.app.llm;

public record LlmReply(
		String content,
		String model
) {
	public boolean isEmpty() {
		return content == null || content.isBlank();
	}
}
