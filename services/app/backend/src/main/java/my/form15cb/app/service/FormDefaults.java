package my.form15cb.app.service;

import my.form15cb.app.config.AppProperties;
import my.form15cb.app.model.FormFields;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creation-info and form-header values every generated document needs. Supplied values are never overwritten.
 */
@Component
public class FormDefaults {
	static final String DEFAULT_ASSESSMENT_YEAR = "2025";
	static final String DEFAULT_INTERMEDIARY_CITY = "Delhi";
	static final String CREATED_BY = "DIT-EFILING-JAVA";

	private final String assessmentYear;
	private final String intermediaryCity;

	public FormDefaults(AppProperties properties) {
		AppProperties.Form form = properties.form();
		this.assessmentYear = isBlank(form.assessmentYear()) ? DEFAULT_ASSESSMENT_YEAR : form.assessmentYear();
		this.intermediaryCity = isBlank(form.intermediaryCity()) ? DEFAULT_INTERMEDIARY_CITY : form.intermediaryCity();
	}

	public Map<String, String> apply(Map<String, String> fields) {
		Map<String, String> out = new LinkedHashMap<>();
		if (fields != null) {
			out.putAll(fields);
		}
		defaults().forEach(out::putIfAbsent);
		return out;
	}

	public Map<String, String> defaults() {
		Map<String, String> values = new LinkedHashMap<>();
		values.put(FormFields.SW_VERSION_NO, "1");
		values.put(FormFields.SW_CREATED_BY, CREATED_BY);
		values.put(FormFields.XML_CREATED_BY, CREATED_BY);
		values.put(FormFields.XML_CREATION_DATE, LocalDate.now().toString());
		values.put(FormFields.INTERMEDIARY_CITY, intermediaryCity);
		values.put(FormFields.FORM_NAME, "FORM15CB");
		values.put(FormFields.DESCRIPTION, "FORM15CB");
		values.put(FormFields.ASSESSMENT_YEAR, assessmentYear);
		values.put(FormFields.SCHEMA_VER, "Ver1.1");
		values.put(FormFields.FORM_VER, "1");
		values.put(FormFields.IOR_WE, "02");
		values.put(FormFields.REMITTER_HONORIFIC, "03");
		values.put(FormFields.BENEFICIARY_HONORIFIC, "03");
		return values;
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
