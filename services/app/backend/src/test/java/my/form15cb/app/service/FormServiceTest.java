package my.form15cb.app.service;

import my.form15cb.app.config.AppProperties;
import my.form15cb.app.dto.ExtractionResponseDto;
import my.form15cb.app.dto.GeneratedDocumentDto;
import my.form15cb.app.dto.ImportedDocumentDto;
import my.form15cb.app.dto.SuggestionResponseDto;
import my.form15cb.app.dto.ValidationResultDto;
import my.form15cb.app.masterdata.LookupDomain;
import my.form15cb.app.masterdata.MatchType;
import my.form15cb.app.model.FormFields;
import my.form15cb.app.model.ReconciliationEvent;
import my.form15cb.app.model.SuggestionResult;
import my.form15cb.app.validation.FormValidationException;
import my.form15cb.app.validation.FormValidator;
import my.form15cb.app.xml.Form15cbXmlGenerator;
import my.form15cb.app.xml.Form15cbXmlParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FormServiceTest {
	@Mock
	private SuggestionService suggestionService;

	@Mock
	private Form15cbXmlGenerator xmlGenerator;

	@Mock
	private Form15cbXmlParser xmlParser;

	@Mock
	private FieldGuesser fieldGuesser;

	private FormService formService;

	@BeforeEach
	void setUp() {
		AppProperties properties = new AppProperties(
				new AppProperties.MasterData("classpath:master/master_data.json", null, null),
				new AppProperties.Form("classpath:templates/form15cb_template.xml", "target/forms", "2025", "Delhi"),
				null
		);
		formService = new FormService(suggestionService, new FormValidator(), new FormDefaults(properties),
				xmlGenerator, xmlParser, fieldGuesser);
	}

	@Test
	void suggestReturnsSuggestionsEventsAndMergedFields() {
		Map<String, String> fields = Map.of("NameRemitter", "Acme India Pvt Ltd", "BsrCode", "");
		ReconciliationEvent event = ReconciliationEvent.of(LookupDomain.INDIAN, "Acme India Pvt Ltd",
				"Acme India Private Limited", MatchType.ALIAS_MATCHED);
		when(suggestionService.suggest(fields)).thenReturn(new SuggestionResult(
				Map.of("NameRemitter", "Acme India Private Limited"), List.of(event)));

		SuggestionResponseDto response = formService.suggest(fields);

		assertThat(response.suggestions()).containsEntry("NameRemitter", "Acme India Private Limited");
		assertThat(response.events()).containsExactly(event);
		assertThat(response.merged())
				.containsEntry("NameRemitter", "Acme India Private Limited")
				.containsEntry("BsrCode", "");
	}

	@Test
	void validateReportsErrors() {
		ValidationResultDto result = formService.validate(Map.of("RemitterPAN", "BAD"));

		assertThat(result.valid()).isFalse();
		assertThat(result.errors()).contains("NameRemitter is required", "RemitterPAN must look like AAAAA9999A");
	}

	@Test
	@SuppressWarnings("unchecked")
	void generateAppliesDefaultsBeforeWriting() {
		when(xmlGenerator.generate(anyMap())).thenReturn(Path.of("data", "output", "generated_0123456789ab.xml"));

		GeneratedDocumentDto result = formService.generate(Map.of(
				"NameRemitter", "Acme India Private Limited",
				"RemitterPAN", "AAACA1234F"));

		assertThat(result.filename()).isEqualTo("generated_0123456789ab.xml");
		assertThat(result.path()).endsWith("generated_0123456789ab.xml");
		ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
		verify(xmlGenerator).generate(captor.capture());
		assertThat(captor.getValue())
				.containsEntry("FormName", "FORM15CB")
				.containsEntry("AssessmentYear", "2025")
				.containsEntry("NameRemitter", "Acme India Private Limited");
	}

	@Test
	void generateRejectsInvalidFieldsWithoutWriting() {
		Map<String, String> fields = new HashMap<>();
		fields.put("NameRemitter", "Acme India Private Limited");
		fields.put("RemitterPAN", "AAACA1234");

		assertThatThrownBy(() -> formService.generate(fields))
				.isInstanceOfSatisfying(FormValidationException.class, ex ->
						assertThat(ex.getErrors()).containsExactly("RemitterPAN must look like AAAAA9999A"));
		verifyNoInteractions(xmlGenerator);
	}

	@Test
	void importDocumentParsesAndReconciles() {
		MockMultipartFile file = new MockMultipartFile("file", "form.xml", "application/xml",
				"<FORM15CB:FORM15CB/>".getBytes(StandardCharsets.UTF_8));
		Map<String, String> parsed = Map.of("NameRemittee", "acme global");
		when(xmlParser.parse(any(InputStream.class))).thenReturn(parsed);
		when(suggestionService.suggest(parsed)).thenReturn(new SuggestionResult(
				Map.of("NameRemittee", "Acme Global GmbH"), List.of()));

		ImportedDocumentDto result = formService.importDocument(file);

		assertThat(result.filename()).isEqualTo("form.xml");
		assertThat(result.fields()).containsEntry("NameRemittee", "acme global");
		assertThat(result.merged()).containsEntry("NameRemittee", "Acme Global GmbH");
	}

	@Test
	void importDocumentRequiresAFile() {
		MockMultipartFile empty = new MockMultipartFile("file", "form.xml", "application/xml", new byte[0]);

		assertThatThrownBy(() -> formService.importDocument(empty))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("file is required");
		assertThatThrownBy(() -> formService.importDocument(null))
				.isInstanceOf(IllegalArgumentException.class);
		verifyNoInteractions(xmlParser);
	}

	@Test
	void extractCountsPopulatedFieldsAndReconciles() {
		Map<String, String> guessed = new HashMap<>(FormFields.blankExtraction());
		guessed.put("NameRemitter", "Acme India Pvt Ltd");
		guessed.put("BsrCode", "0510001");
		when(fieldGuesser.guess("document text")).thenReturn(guessed);
		when(fieldGuesser.name()).thenReturn("key-value");
		when(suggestionService.suggest(guessed)).thenReturn(new SuggestionResult(
				Map.of("NameRemitter", "Acme India Private Limited"), List.of()));

		ExtractionResponseDto result = formService.extract("document text");

		assertThat(result.extractor()).isEqualTo("key-value");
		assertThat(result.populated()).isEqualTo(2);
		assertThat(result.merged()).containsEntry("NameRemitter", "Acme India Private Limited");
	}

	@Test
	void resetDtaaClearsTreatyFields() {
		Map<String, String> reset = formService.resetDtaa(Map.of("TaxResidCert", "Y", "NameRemitter", "Acme"));

		assertThat(reset).containsEntry("TaxResidCert", "N").containsEntry("NameRemitter", "Acme");
	}
}
