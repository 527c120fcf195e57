package my.form15cb.app.xml;

import my.form15cb.app.model.FormFields;
import my.form15cb.app.validation.FormValidationException;
import my.form15cb.app.validation.FormValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{FieldName}}} placeholders of the Form 15CB template and writes the result as a new file.
 * Placeholders without a supplied value are removed.
 */
public class Form15cbXmlGenerator {
	private static final Logger logger = LoggerFactory.getLogger(Form15cbXmlGenerator.class);
	private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]+)\\}\\}");

	private final Resource template;
	private final Path outputDir;
	private final FormValidator formValidator = new FormValidator();

	public Form15cbXmlGenerator(Resource template, Path outputDir) {
		this.template = template;
		this.outputDir = outputDir;
	}

	public Path generate(Map<String, String> fields) {
		return generate(fields, template);
	}

	public Path generate(Map<String, String> fields, Resource templateResource) {
		List<String> missing = formValidator.missingMandatoryFields(fields);
		if (!missing.isEmpty()) {
			throw new FormValidationException(
					"XML generation failed: missing or empty mandatory fields: " + String.join(", ", missing),
					missing);
		}

		String content = render(readTemplate(templateResource), FormFields.withoutPrivateKeys(fields));
		Path target = outputDir.resolve(newFileName());
		try {
			Files.createDirectories(outputDir);
			Files.writeString(target, content, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new DocumentWriteException(target, ex);
		}
		logger.info("Generated Form 15CB document {}.", target.getFileName());
		return target;
	}

	public Path getOutputDir() {
		return outputDir;
	}

	/**
	 * Replaces each placeholder with the escaped value of its field, or with nothing.
	 */
	static String render(String template, Map<String, String> fields) {
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder out = new StringBuilder(template.length());
		while (matcher.find()) {
			String value = fields.get(matcher.group(1));
			matcher.appendReplacement(out, Matcher.quoteReplacement(escape(value)));
		}
		matcher.appendTail(out);
		return out.toString();
	}

	public static String escape(String value) {
		if (value == null) {
			return "";
		}
		return value
				.replace("&", "&amp;")
				.replace("<", "&lt;")
				.replace(">", "&gt;")
				.replace("\"", "&quot;")
				.replace("'", "&apos;");
	}

	private static String readTemplate(Resource resource) {
		if (resource == null || !resource.exists()) {
			throw new TemplateMissingException("XML template not found: "
					+ (resource == null ? "<none>" : resource.getDescription()));
		}
		try {
			return resource.getContentAsString(StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read XML template: " + resource.getDescription(), ex);
		}
	}

	private static String newFileName() {
		String hex = UUID.randomUUID().toString().replace("-", "");
		return "generated_" + hex.substring(0, 12) + ".xml";
	}
}
