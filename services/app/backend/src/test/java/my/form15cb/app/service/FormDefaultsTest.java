package my.form15cb.app.service;

import my.form15cb.app.config.AppProperties;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FormDefaultsTest {
	@Test
	void fillsHeaderFieldsFromConfiguration() {
		FormDefaults defaults = new FormDefaults(properties("2026", "Mumbai"));

		Map<String, String> fields = defaults.apply(Map.of("NameRemitter", "Acme India Private Limited"));

		assertThat(fields)
				.containsEntry("NameRemitter", "Acme India Private Limited")
				.containsEntry("SWVersionNo", "1")
				.containsEntry("FormName", "FORM15CB")
				.containsEntry("AssessmentYear", "2026")
				.containsEntry("IntermediaryCity", "Mumbai")
				.containsEntry("SchemaVer", "Ver1.1")
				.containsEntry("IorWe", "02")
				.containsEntry("XMLCreationDate", LocalDate.now().toString());
	}

	@Test
	void suppliedValuesAreKept() {
		FormDefaults defaults = new FormDefaults(properties(null, null));
		Map<String, String> fields = new HashMap<>();
		fields.put("AssessmentYear", "2024");
		fields.put("FormName", "");

		Map<String, String> completed = defaults.apply(fields);

		assertThat(completed).containsEntry("AssessmentYear", "2024").containsEntry("FormName", "");
		assertThat(fields).hasSize(2);
	}

	@Test
	void blankConfigurationFallsBackToBuiltInValues() {
		FormDefaults defaults = new FormDefaults(properties(" ", null));

		assertThat(defaults.defaults())
				.containsEntry("AssessmentYear", FormDefaults.DEFAULT_ASSESSMENT_YEAR)
				.containsEntry("IntermediaryCity", FormDefaults.DEFAULT_INTERMEDIARY_CITY)
				.containsEntry("SWCreatedBy", FormDefaults.CREATED_BY);
	}

	private static AppProperties properties(String assessmentYear, String intermediaryCity) {
		return new AppProperties(
				new AppProperties.MasterData("classpath:master/master_data.json", null, null),
				new AppProperties.Form("classpath:templates/form15cb_template.xml", "target/forms",
						assessmentYear, intermediaryCity),
				null
		);
	}
}
