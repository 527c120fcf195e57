package my.form15cb.app.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Element path, relative to the document root, of every field a Form 15CB document carries.
 * Paths use the {@code Form:} and {@code FORM15CB:} prefixes.
 */
public final class Form15cbTagMap {
	public static final String FORM_NAMESPACE = "http://incometaxindiaefiling.gov.in/common";
	public static final String FORM15CB_NAMESPACE = "http://incometaxindiaefiling.gov.in/FORM15CAB";

	public static final Map<String, String> NAMESPACES = Map.of(
			"Form", FORM_NAMESPACE,
			"FORM15CB", FORM15CB_NAMESPACE
	);

	private static final List<TagPath> PATHS = List.of(
			entry("Form:CreationInfo/Form:SWVersionNo", "SWVersionNo"),
			entry("Form:CreationInfo/Form:SWCreatedBy", "SWCreatedBy"),
			entry("Form:CreationInfo/Form:XMLCreatedBy", "XMLCreatedBy"),
			entry("Form:CreationInfo/Form:XMLCreationDate", "XMLCreationDate"),
			entry("Form:CreationInfo/Form:IntermediaryCity", "IntermediaryCity"),
			entry("Form:Form_Details/Form:FormName", "FormName"),
			entry("Form:Form_Details/Form:Description", "Description"),
			entry("Form:Form_Details/Form:AssessmentYear", "AssessmentYear"),
			entry("Form:Form_Details/Form:SchemaVer", "SchemaVer"),
			entry("Form:Form_Details/Form:FormVer", "FormVer"),
			entry("FORM15CB:RemitterDetails/FORM15CB:IorWe", "IorWe"),
			entry("FORM15CB:RemitterDetails/FORM15CB:RemitterHonorific", "RemitterHonorific"),
			entry("FORM15CB:RemitterDetails/FORM15CB:NameRemitter", "NameRemitter"),
			entry("FORM15CB:RemitterDetails/FORM15CB:PAN", "RemitterPAN"),
			entry("FORM15CB:RemitterDetails/FORM15CB:BeneficiaryHonorific", "BeneficiaryHonorific"),
			entry("FORM15CB:RemitteeDetls/FORM15CB:NameRemittee", "NameRemittee"),
			entry("FORM15CB:RemitteeDetls/FORM15CB:RemitteeAddrs/FORM15CB:TownCityDistrict", "RemitteeTownCityDistrict"),
			entry("FORM15CB:RemitteeDetls/FORM15CB:RemitteeAddrs/FORM15CB:FlatDoorBuilding", "RemitteeFlatDoorBuilding"),
			entry("FORM15CB:RemitteeDetls/FORM15CB:RemitteeAddrs/FORM15CB:AreaLocality", "RemitteeAreaLocality"),
			entry("FORM15CB:RemitteeDetls/FORM15CB:RemitteeAddrs/FORM15CB:ZipCode", "RemitteeZipCode"),
			entry("FORM15CB:RemitteeDetls/FORM15CB:RemitteeAddrs/Form:State", "RemitteeState"),
			entry("FORM15CB:RemitteeDetls/FORM15CB:RemitteeAddrs/FORM15CB:Country", "RemitteeCountryCode"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:CountryRemMadeSecb", "CountryRemMadeSecb"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:CurrencySecbCode", "CurrencySecbCode"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:AmtPayForgnRem", "AmtPayForgnRem"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:AmtPayIndRem", "AmtPayIndRem"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:NameBankCode", "NameBankCode"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:BranchName", "BranchName"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:BsrCode", "BsrCode"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:PropDateRem", "PropDateRem"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:NatureRemCategory", "NatureRemCategory"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:RevPurCategory", "RevPurCategory"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:RevPurCode", "RevPurCode"),
			entry("FORM15CB:RemittanceDetails/FORM15CB:TaxPayGrossSecb", "TaxPayGrossSecb"),
			entry("FORM15CB:ItActDetails/FORM15CB:RemittanceCharIndia", "RemittanceCharIndia"),
			entry("FORM15CB:ItActDetails/FORM15CB:SecRemCovered", "SecRemCovered"),
			entry("FORM15CB:ItActDetails/FORM15CB:AmtIncChrgIt", "AmtIncChrgIt"),
			entry("FORM15CB:ItActDetails/FORM15CB:TaxLiablIt", "TaxLiablIt"),
			entry("FORM15CB:ItActDetails/FORM15CB:BasisDeterTax", "BasisDeterTax"),
			entry("FORM15CB:DTAADetails/FORM15CB:TaxResidCert", "TaxResidCert"),
			entry("FORM15CB:DTAADetails/FORM15CB:RelevantDtaa", "RelevantDtaa"),
			entry("FORM15CB:DTAADetails/FORM15CB:RelevantArtDtaa", "RelevantArtDtaa"),
			entry("FORM15CB:DTAADetails/FORM15CB:TaxIncDtaa", "TaxIncDtaa"),
			entry("FORM15CB:DTAADetails/FORM15CB:TaxLiablDtaa", "TaxLiablDtaa"),
			entry("FORM15CB:DTAADetails/FORM15CB:RemForRoyFlg", "RemForRoyFlg"),
			entry("FORM15CB:DTAADetails/FORM15CB:ArtDtaa", "ArtDtaa"),
			entry("FORM15CB:DTAADetails/FORM15CB:RateTdsADtaa", "RateTdsADtaa"),
			entry("FORM15CB:DTAADetails/FORM15CB:RemAcctBusIncFlg", "RemAcctBusIncFlg"),
			entry("FORM15CB:DTAADetails/FORM15CB:IncLiabIndiaFlg", "IncLiabIndiaFlg"),
			entry("FORM15CB:DTAADetails/FORM15CB:RemOnCapGainFlg", "RemOnCapGainFlg"),
			entry("FORM15CB:DTAADetails/FORM15CB:OtherRemDtaa", "OtherRemDtaa"),
			entry("FORM15CB:DTAADetails/FORM15CB:TaxIndDtaaFlg", "TaxIndDtaaFlg"),
			entry("FORM15CB:DTAADetails/FORM15CB:RelArtDetlDDtaa", "RelArtDetlDDtaa"),
			entry("FORM15CB:TDSDetails/FORM15CB:AmtPayForgnTds", "AmtPayForgnTds"),
			entry("FORM15CB:TDSDetails/FORM15CB:AmtPayIndianTds", "AmtPayIndianTds"),
			entry("FORM15CB:TDSDetails/FORM15CB:RateTdsSecbFlg", "RateTdsSecbFlg"),
			entry("FORM15CB:TDSDetails/FORM15CB:RateTdsSecB", "RateTdsSecB"),
			entry("FORM15CB:TDSDetails/FORM15CB:ActlAmtTdsForgn", "ActlAmtTdsForgn"),
			entry("FORM15CB:TDSDetails/FORM15CB:DednDateTds", "DednDateTds"),
			entry("FORM15CB:AcctntDetls/FORM15CB:NameAcctnt", "NameAcctnt"),
			entry("FORM15CB:AcctntDetls/FORM15CB:NameFirmAcctnt", "NameFirmAcctnt"),
			entry("FORM15CB:AcctntDetls/FORM15CB:AcctntAddrs/FORM15CB:PremisesBuildingVillage", "PremisesBuildingVillage"),
			entry("FORM15CB:AcctntDetls/FORM15CB:AcctntAddrs/FORM15CB:TownCityDistrict", "AcctntTownCityDistrict"),
			entry("FORM15CB:AcctntDetls/FORM15CB:AcctntAddrs/FORM15CB:FlatDoorBuilding", "AcctntFlatDoorBuilding"),
			entry("FORM15CB:AcctntDetls/FORM15CB:AcctntAddrs/FORM15CB:AreaLocality", "AcctntAreaLocality"),
			entry("FORM15CB:AcctntDetls/FORM15CB:AcctntAddrs/FORM15CB:Pincode", "AcctntPincode"),
			entry("FORM15CB:AcctntDetls/FORM15CB:AcctntAddrs/Form:State", "AcctntState"),
			entry("FORM15CB:AcctntDetls/FORM15CB:AcctntAddrs/FORM15CB:RoadStreet", "AcctntRoadStreet"),
			entry("FORM15CB:AcctntDetls/FORM15CB:AcctntAddrs/FORM15CB:Country", "AcctntCountryCode"),
			entry("FORM15CB:AcctntDetls/FORM15CB:MembershipNumber", "MembershipNumber")
	);

	private Form15cbTagMap() {
	}

	public static List<TagPath> paths() {
		return PATHS;
	}

	/**
	 * Field keys in document order.
	 */
	public static List<String> fieldKeys() {
		List<String> keys = new ArrayList<>();
		for (TagPath path : PATHS) {
			keys.add(path.fieldKey());
		}
		return Collections.unmodifiableList(keys);
	}

	public static Map<String, String> asMap() {
		Map<String, String> map = new LinkedHashMap<>();
		for (TagPath path : PATHS) {
			map.put(path.path(), path.fieldKey());
		}
		return Collections.unmodifiableMap(map);
	}

	private static TagPath entry(String path, String fieldKey) {
		List<QualifiedName> steps = new ArrayList<>();
		for (String step : path.split("/")) {
			int colon = step.indexOf(':');
			String namespace = colon < 0 ? null : NAMESPACES.get(step.substring(0, colon));
			if (namespace == null) {
				throw new IllegalStateException("Unknown prefix in tag path " + path);
			}
			steps.add(new QualifiedName(namespace, step.substring(colon + 1)));
		}
		return new TagPath(path, fieldKey, List.copyOf(steps));
	}

	public record TagPath(String path, String fieldKey, List<QualifiedName> steps) {
	}

	public record QualifiedName(String namespace, String localName) {
	}
}
