package my.form15cb.app.xml;

import my.form15cb.app.validation.FormValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Form15cbXmlGeneratorTest {
	@TempDir
	Path tempDir;

	@Test
	void generateWritesFilledTemplate() throws IOException {
		Form15cbXmlGenerator generator = generator(tempDir.resolve("out"));
		Map<String, String> fields = mandatoryFields();
		fields.put("NameRemittee", "Acme Global GmbH & Co <Germany>");
		fields.put("BsrCode", "0510001");

		Path generated = generator.generate(fields);

		assertThat(generated.getParent()).isEqualTo(tempDir.resolve("out"));
		assertThat(generated.getFileName().toString()).matches("generated_[0-9a-f]{12}\\.xml");
		String xml = Files.readString(generated, StandardCharsets.UTF_8);
		assertThat(xml).contains("<FORM15CB:NameRemitter>Acme India Private Limited</FORM15CB:NameRemitter>");
		assertThat(xml).contains("<FORM15CB:NameRemittee>Acme Global GmbH &amp; Co &lt;Germany&gt;</FORM15CB:NameRemittee>");
		assertThat(xml).contains("<FORM15CB:BsrCode>0510001</FORM15CB:BsrCode>");
		assertThat(xml).contains("<FORM15CB:RateTdsSecB></FORM15CB:RateTdsSecB>");
		assertThat(xml).doesNotContain("{{");
	}

	@Test
	void eachCallWritesANewFile() {
		Form15cbXmlGenerator generator = generator(tempDir);

		Path first = generator.generate(mandatoryFields());
		Path second = generator.generate(mandatoryFields());

		assertThat(first).isNotEqualTo(second);
		assertThat(first).exists();
		assertThat(second).exists();
	}

	@Test
	void missingMandatoryFieldsAreRejectedBeforeWriting() {
		Path outputDir = tempDir.resolve("never-created");
		Form15cbXmlGenerator generator = generator(outputDir);
		Map<String, String> fields = mandatoryFields();
		fields.put("RemitterPAN", "  ");
		fields.remove("FormName");

		assertThatThrownBy(() -> generator.generate(fields))
				.isInstanceOfSatisfying(FormValidationException.class, ex -> {
					assertThat(ex.getErrors()).containsExactly("FormName", "RemitterPAN");
					assertThat(ex.getMessage()).contains("missing or empty mandatory fields: FormName, RemitterPAN");
				});
		assertThat(outputDir).doesNotExist();
	}

	@Test
	void missingTemplateIsReported() {
		Form15cbXmlGenerator generator = new Form15cbXmlGenerator(
				new ClassPathResource("templates/no_such_template.xml"), tempDir);

		assertThatThrownBy(() -> generator.generate(mandatoryFields()))
				.isInstanceOf(TemplateMissingException.class)
				.hasMessageContaining("no_such_template.xml");
	}

	@Test
	void renderSkipsPrivateKeysAndDoesNotExpandValues() {
		Map<String, String> fields = new HashMap<>();
		fields.put("NameRemitter", "{{FormName}}");
		fields.put("FormName", "FORM15CB");

		String rendered = Form15cbXmlGenerator.render("<a>{{NameRemitter}}</a><b>{{_note}}</b><c>{{Unknown}}</c>", fields);

		assertThat(rendered).isEqualTo("<a>{{FormName}}</a><b></b><c></c>");
	}

	@Test
	void escapeHandlesAllMarkupCharacters() {
		assertThat(Form15cbXmlGenerator.escape("A & B < C")).isEqualTo("A &amp; B &lt; C");
		assertThat(Form15cbXmlGenerator.escape("a&b<c>d\"e'f")).isEqualTo("a&amp;b&lt;c&gt;d&quot;e&apos;f");
		assertThat(Form15cbXmlGenerator.escape("&amp;")).isEqualTo("&amp;amp;");
		assertThat(Form15cbXmlGenerator.escape(null)).isEmpty();
	}

	private static Form15cbXmlGenerator generator(Path outputDir) {
		return new Form15cbXmlGenerator(new ClassPathResource("templates/form15cb_template.xml"), outputDir);
	}

	private static Map<String, String> mandatoryFields() {
		Map<String, String> fields = new HashMap<>();
		fields.put("SWVersionNo", "1");
		fields.put("FormName", "FORM15CB");
		fields.put("AssessmentYear", "2025");
		fields.put("RemitterPAN", "AAACA1234F");
		fields.put("NameRemitter", "Acme India Private Limited");
		return fields;
	}
}
