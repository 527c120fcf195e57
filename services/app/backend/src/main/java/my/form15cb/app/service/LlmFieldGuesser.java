package my.form15cb.app.service;

import my.form15cb.app.config.AppProperties;
import my.form15cb.app.llm.LlmClient;
import my.form15cb.app.llm.LlmJsonResponseParser;
import my.form15cb.app.llm.LlmReply;
import my.form15cb.app.llm.LlmRequestException;
import my.form15cb.app.model.FormFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

@Service
@Primary
@ConditionalOnProperty(name = "app.llm.extraction-enabled", havingValue = "true")
public class LlmFieldGuesser implements FieldGuesser {
	private static final Logger logger = LoggerFactory.getLogger(LlmFieldGuesser.class);
	static final int MIN_TEXT_CHARS = 50;
	static final int DEFAULT_MAX_INPUT_CHARS = 60000;

	private final LlmClient llmClient;
	private final LlmJsonResponseParser responseParser;
	private final int maxInputChars;

	public LlmFieldGuesser(LlmClient llmClient, LlmJsonResponseParser responseParser, AppProperties properties) {
		this.llmClient = llmClient;
		this.responseParser = responseParser;
		Integer configured = properties.llm() == null ? null : properties.llm().maxInputChars();
		this.maxInputChars = configured == null || configured <= 0 ? DEFAULT_MAX_INPUT_CHARS : configured;
	}

	@Override
	public Map<String, String> guess(String documentText) {
		String document = documentText == null ? "" : documentText.strip();
		if (document.length() < MIN_TEXT_CHARS) {
			logger.warn("Document text too short for extraction ({} chars); returning blanks.", document.length());
			return FormFields.blankExtraction();
		}
		if (document.length() > maxInputChars) {
			document = document.substring(0, maxInputChars);
		}

		LlmReply reply;
		try {
			reply = llmClient.completeJson(buildPrompt(document));
		} catch (LlmRequestException ex) {
			logger.warn("LLM extraction request failed (status={}, retryable={}): {}",
					ex.getStatusCode(), ex.isRetryable(), ex.getMessage());
			return FormFields.blankExtraction();
		}
		if (reply == null || reply.isEmpty()) {
			logger.warn("LLM returned no content ({}); returning blanks.", reply == null ? "null" : reply.model());
			return FormFields.blankExtraction();
		}

		Optional<Map<String, Object>> parsed = responseParser.parse(reply.content());
		if (parsed.isEmpty()) {
			logger.warn("LLM output was not a JSON object; returning blanks.");
			return FormFields.blankExtraction();
		}
		Map<String, String> fields = FormFields.completeExtraction(parsed.get());
		long populated = fields.values().stream().filter(value -> !value.isEmpty()).count();
		logger.info("LLM extraction populated {}/{} fields (model={}).",
				populated, FormFields.EXTRACTION_KEYS.size(), reply.model());
		return fields;
	}

	@Override
	public String name() {
		return "llm";
	}

	String buildPrompt(String document) {
		String keys = String.join(", ", FormFields.EXTRACTION_KEYS);
		return "You are extracting fields from an Indian Form 15CB (Accountant Certificate) document.\n"
				+ "Return ONLY a single JSON object.\n"
				+ "Rules:\n"
				+ "- Keys MUST be exactly these (no extra keys): " + keys + "\n"
				+ "- For missing values, use empty string \"\".\n"
				+ "- Do NOT add explanations.\n"
				+ "- Keep numeric fields as digits only (remove commas, currency symbols).\n"
				+ "- Convert dates to YYYY-MM-DD if present.\n"
				+ "- For Y/N fields: output Y or N.\n"
				+ "- For code fields (country/currency/bank/purpose/nature): output the code IF the text clearly "
				+ "indicates it; otherwise output the descriptive value as seen.\n"
				+ "\n"
				+ "Document text:\n"
				+ document;
	}
}
