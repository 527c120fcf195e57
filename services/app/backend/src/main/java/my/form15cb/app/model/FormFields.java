package my.form15cb.app.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key vocabulary of the flat Form 15CB field dictionary and helpers over it.
 * Keys starting with {@code _} are scratch state of the reviewer and never reach a document.
 */
public final class FormFields {
	public static final String PRIVATE_PREFIX = "_";

	public static final String SW_VERSION_NO = "SWVersionNo";
	public static final String SW_CREATED_BY = "SWCreatedBy";
	public static final String XML_CREATED_BY = "XMLCreatedBy";
	public static final String XML_CREATION_DATE = "XMLCreationDate";
	public static final String INTERMEDIARY_CITY = "IntermediaryCity";
	public static final String FORM_NAME = "FormName";
	public static final String DESCRIPTION = "Description";
	public static final String ASSESSMENT_YEAR = "AssessmentYear";
	public static final String SCHEMA_VER = "SchemaVer";
	public static final String FORM_VER = "FormVer";
	public static final String IOR_WE = "IorWe";
	public static final String REMITTER_HONORIFIC = "RemitterHonorific";
	public static final String BENEFICIARY_HONORIFIC = "BeneficiaryHonorific";

	public static final String NAME_REMITTER = "NameRemitter";
	public static final String REMITTER_PAN = "RemitterPAN";
	public static final String NAME_REMITTEE = "NameRemittee";
	public static final String REMITTEE_TOWN_CITY_DISTRICT = "RemitteeTownCityDistrict";
	public static final String COUNTRY_REM_MADE_SECB = "CountryRemMadeSecb";
	public static final String NAME_BANK_CODE = "NameBankCode";
	public static final String BRANCH_NAME = "BranchName";
	public static final String BSR_CODE = "BsrCode";
	public static final String NATURE_REM_CATEGORY = "NatureRemCategory";
	public static final String REV_PUR_CATEGORY = "RevPurCategory";
	public static final String REV_PUR_CODE = "RevPurCode";
	public static final String RELEVANT_DTAA = "RelevantDtaa";
	public static final String RELEVANT_ART_DTAA = "RelevantArtDtaa";
	public static final String RATE_TDS_A_DTAA = "RateTdsADtaa";
	public static final String RATE_TDS_SEC_B = "RateTdsSecB";

	/**
	 * Keys an extractor is asked to fill from document text.
	 */
	public static final List<String> EXTRACTION_KEYS = List.of(
			"NameRemittee",
			"RemitteeFlatDoorBuilding",
			"RemitteeAreaLocality",
			"RemitteeTownCityDistrict",
			"RemitteeZipCode",
			"RemitteeState",
			"RemitteeCountryCode",
			"CountryRemMadeSecb",
			"CurrencySecbCode",
			"AmtPayForgnRem",
			"AmtPayIndRem",
			"NameBankCode",
			"BranchName",
			"BsrCode",
			"PropDateRem",
			"NatureRemCategory",
			"RevPurCategory",
			"RevPurCode",
			"TaxPayGrossSecb",
			"RemittanceCharIndia",
			"SecRemCovered",
			"AmtIncChrgIt",
			"TaxLiablIt",
			"BasisDeterTax",
			"TaxResidCert",
			"RelevantDtaa",
			"RelevantArtDtaa",
			"TaxIncDtaa",
			"TaxLiablDtaa",
			"RemForRoyFlg",
			"ArtDtaa",
			"RateTdsADtaa",
			"RemAcctBusIncFlg",
			"IncLiabIndiaFlg",
			"RemOnCapGainFlg",
			"OtherRemDtaa",
			"TaxIndDtaaFlg",
			"RelArtDetlDDtaa",
			"AmtPayForgnTds",
			"AmtPayIndianTds",
			"RateTdsSecbFlg",
			"RateTdsSecB",
			"ActlAmtTdsForgn",
			"DednDateTds",
			"NameAcctnt",
			"NameFirmAcctnt",
			"PremisesBuildingVillage",
			"AcctntTownCityDistrict",
			"AcctntFlatDoorBuilding",
			"AcctntAreaLocality",
			"AcctntPincode",
			"AcctntState",
			"AcctntRoadStreet",
			"AcctntCountryCode",
			"MembershipNumber",
			"RemitterPAN",
			"NameRemitter"
	);

	private static final Map<String, String> DTAA_RESET_VALUES = dtaaResetValues();

	private FormFields() {
	}

	public static boolean isPrivateKey(String key) {
		return key != null && key.startsWith(PRIVATE_PREFIX);
	}

	public static Map<String, String> withoutPrivateKeys(Map<String, String> fields) {
		Map<String, String> out = new LinkedHashMap<>();
		if (fields == null) {
			return out;
		}
		for (Map.Entry<String, String> entry : fields.entrySet()) {
			if (entry.getKey() != null && !isPrivateKey(entry.getKey())) {
				out.put(entry.getKey(), entry.getValue());
			}
		}
		return out;
	}

	/**
	 * New dictionary holding {@code fields} overlaid with {@code suggestions}; neither input is modified.
	 */
	public static Map<String, String> merge(Map<String, String> fields, Map<String, String> suggestions) {
		Map<String, String> merged = new LinkedHashMap<>();
		if (fields != null) {
			merged.putAll(fields);
		}
		if (suggestions != null) {
			merged.putAll(suggestions);
		}
		return merged;
	}

	/**
	 * Treaty section back to "no treaty claimed": flags to {@code N}, free text cleared.
	 */
	public static Map<String, String> resetDtaaFields(Map<String, String> fields) {
		Map<String, String> out = new LinkedHashMap<>();
		if (fields != null) {
			out.putAll(fields);
		}
		out.putAll(DTAA_RESET_VALUES);
		return out;
	}

	/**
	 * Every extraction key, taking values from {@code values} (trimmed) or blank when absent.
	 */
	public static Map<String, String> completeExtraction(Map<String, ?> values) {
		Map<String, String> out = new LinkedHashMap<>();
		for (String key : EXTRACTION_KEYS) {
			Object value = values == null ? null : values.get(key);
			out.put(key, value == null ? "" : String.valueOf(value).trim());
		}
		return out;
	}

	public static Map<String, String> blankExtraction() {
		return completeExtraction(Map.of());
	}

	public static String value(Map<String, String> fields, String key) {
		if (fields == null) {
			return "";
		}
		String value = fields.get(key);
		return value == null ? "" : value.trim();
	}

	private static Map<String, String> dtaaResetValues() {
		Map<String, String> values = new LinkedHashMap<>();
		values.put("TaxResidCert", "N");
		values.put("RelevantDtaa", "");
		values.put("RelevantArtDtaa", "");
		values.put("TaxIncDtaa", "");
		values.put("TaxLiablDtaa", "");
		values.put("RemForRoyFlg", "N");
		values.put("ArtDtaa", "");
		values.put("RateTdsADtaa", "");
		values.put("RemAcctBusIncFlg", "N");
		values.put("IncLiabIndiaFlg", "N");
		values.put("RemOnCapGainFlg", "N");
		values.put("OtherRemDtaa", "N");
		values.put("RelArtDetlDDtaa", "");
		values.put("_inc_liab_india_detail", "");
		return values;
	}
}
