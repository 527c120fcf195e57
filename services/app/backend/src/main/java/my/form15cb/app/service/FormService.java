package my.form15cb.app.service;

import my.form15cb.app.dto.ExtractionResponseDto;
import my.form15cb.app.dto.GeneratedDocumentDto;
import my.form15cb.app.dto.ImportedDocumentDto;
import my.form15cb.app.dto.SuggestionResponseDto;
import my.form15cb.app.dto.ValidationResultDto;
import my.form15cb.app.model.FormFields;
import my.form15cb.app.model.SuggestionResult;
import my.form15cb.app.util.PanMasker;
import my.form15cb.app.validation.FormValidationException;
import my.form15cb.app.validation.FormValidator;
import my.form15cb.app.xml.Form15cbXmlGenerator;
import my.form15cb.app.xml.Form15cbXmlParser;
import my.form15cb.app.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Service
public class FormService {
	private static final Logger logger = LoggerFactory.getLogger(FormService.class);

	private final SuggestionService suggestionService;
	private final FormValidator formValidator;
	private final FormDefaults formDefaults;
	private final Form15cbXmlGenerator xmlGenerator;
	private final Form15cbXmlParser xmlParser;
	private final FieldGuesser fieldGuesser;

	public FormService(SuggestionService suggestionService,
					   FormValidator formValidator,
					   FormDefaults formDefaults,
					   Form15cbXmlGenerator xmlGenerator,
					   Form15cbXmlParser xmlParser,
					   FieldGuesser fieldGuesser) {
		this.suggestionService = suggestionService;
		this.formValidator = formValidator;
		this.formDefaults = formDefaults;
		this.xmlGenerator = xmlGenerator;
		this.xmlParser = xmlParser;
		this.fieldGuesser = fieldGuesser;
	}

	public SuggestionResponseDto suggest(Map<String, String> fields) {
		SuggestionResult result = suggestionService.suggest(fields);
		return new SuggestionResponseDto(result.suggestions(), result.events(), result.applyTo(fields));
	}

	public ValidationResultDto validate(Map<String, String> fields) {
		List<String> errors = formValidator.validate(fields);
		return new ValidationResultDto(errors.isEmpty(), errors);
	}

	public GeneratedDocumentDto generate(Map<String, String> fields) {
		Map<String, String> completed = formDefaults.apply(fields);
		String maskedPan = PanMasker.mask(FormFields.value(completed, FormFields.REMITTER_PAN));
		List<String> errors = formValidator.validate(completed);
		if (!errors.isEmpty()) {
			logger.warn("Rejected XML generation (pan={}): {}", maskedPan, errors);
			throw new FormValidationException(errors);
		}
		Path path = xmlGenerator.generate(completed);
		logger.info("Generated Form 15CB XML {} (pan={}).", path.getFileName(), maskedPan);
		return new GeneratedDocumentDto(path.toString(), path.getFileName().toString());
	}

	public ImportedDocumentDto importDocument(MultipartFile file) {
		if (file == null || file.isEmpty()) {
			throw new IllegalArgumentException("file is required");
		}
		Map<String, String> fields;
		try (InputStream in = file.getInputStream()) {
			fields = xmlParser.parse(in);
		} catch (IOException ex) {
			throw new XmlParseException("Failed to read uploaded XML", ex);
		}
		logger.info("Imported {} fields from {} (pan={}).", fields.size(), file.getOriginalFilename(),
				PanMasker.mask(FormFields.value(fields, FormFields.REMITTER_PAN)));
		SuggestionResult result = suggestionService.suggest(fields);
		return new ImportedDocumentDto(file.getOriginalFilename(), fields, result.suggestions(), result.events(),
				result.applyTo(fields));
	}

	public ExtractionResponseDto extract(String documentText) {
		Map<String, String> guessed = fieldGuesser.guess(documentText);
		int populated = (int) guessed.values().stream().filter(value -> value != null && !value.isEmpty()).count();
		SuggestionResult result = suggestionService.suggest(guessed);
		return new ExtractionResponseDto(fieldGuesser.name(), guessed, populated, result.suggestions(), result.events(),
				result.applyTo(guessed));
	}

	public Map<String, String> resetDtaa(Map<String, String> fields) {
		return FormFields.resetDtaaFields(fields);
	}
}
