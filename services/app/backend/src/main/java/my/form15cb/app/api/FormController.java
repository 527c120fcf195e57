package my.form15cb.app.api;

import jakarta.validation.Valid;
import my.form15cb.app.dto.ExtractionRequest;
import my.form15cb.app.dto.ExtractionResponseDto;
import my.form15cb.app.dto.GeneratedDocumentDto;
import my.form15cb.app.dto.ImportedDocumentDto;
import my.form15cb.app.dto.SuggestionResponseDto;
import my.form15cb.app.dto.ValidationResultDto;
import my.form15cb.app.service.FormService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.Map;

@RestController
@RequestMapping("/api/forms")
public class FormController {
	private final FormService formService;

	public FormController(FormService formService) {
		this.formService = formService;
	}

	@PostMapping("/suggestions")
	public SuggestionResponseDto suggest(@RequestBody Map<String, String> fields) {
		return formService.suggest(fields);
	}

	@PostMapping("/validation")
	public ValidationResultDto validate(@RequestBody Map<String, String> fields) {
		return formService.validate(fields);
	}

	@PostMapping("/xml")
	@ResponseStatus(HttpStatus.CREATED)
	public GeneratedDocumentDto generate(@RequestBody Map<String, String> fields) {
		return formService.generate(fields);
	}

	@PostMapping(path = "/xml/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ImportedDocumentDto importDocument(@RequestParam("file") MultipartFile file) {
		return formService.importDocument(file);
	}

	@PostMapping("/extraction")
	public ExtractionResponseDto extract(@Valid @RequestBody ExtractionRequest request) {
		return formService.extract(request.text());
	}

	@PostMapping("/dtaa/reset")
	public Map<String, String> resetDtaa(@RequestBody Map<String, String> fields) {
		return formService.resetDtaa(fields);
	}
}
