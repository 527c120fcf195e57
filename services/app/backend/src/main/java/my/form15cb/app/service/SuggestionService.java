package my.form15cb.app.service;

import my.form15cb.app.masterdata.BankCodeLookup;
import my.form15cb.app.masterdata.BankRow;
import my.form15cb.app.masterdata.DtaaRate;
import my.form15cb.app.masterdata.ForeignCompany;
import my.form15cb.app.masterdata.IndianCompany;
import my.form15cb.app.masterdata.LookupDomain;
import my.form15cb.app.masterdata.MasterDataResolver;
import my.form15cb.app.masterdata.MatchType;
import my.form15cb.app.masterdata.NatureMapping;
import my.form15cb.app.model.FormFields;
import my.form15cb.app.model.ReconciliationEvent;
import my.form15cb.app.model.SuggestionResult;
import my.form15cb.app.validation.FieldValidators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Looks the current field values up in master data and proposes canonical replacements.
 * Runs remitter, remittee, bank, nature and treaty lookups in that order; later steps may use
 * what earlier steps suggested. The input dictionary is never modified.
 */
@Service
public class SuggestionService {
	private static final Logger logger = LoggerFactory.getLogger(SuggestionService.class);
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
	static final String ALL_PARTIES_SOURCE = LookupDomain.PARTY.source() + ".all_parties";

	private final MasterDataResolver resolver;
	private final BankCodeLookup bankCodeLookup;

	public SuggestionService(MasterDataResolver resolver, BankCodeLookup bankCodeLookup) {
		this.resolver = resolver;
		this.bankCodeLookup = bankCodeLookup;
	}

	public SuggestionResult suggest(Map<String, String> fields) {
		return suggestFromMaster(fields, bankCodeLookup);
	}

	public SuggestionResult suggestFromMaster(Map<String, String> fields, BankCodeLookup codes) {
		Map<String, String> suggestions = new LinkedHashMap<>();
		List<ReconciliationEvent> events = new ArrayList<>();

		suggestRemitter(fields, suggestions, events);
		suggestRemittee(fields, suggestions, events);
		suggestBank(fields, codes == null ? BankCodeLookup.empty() : codes, suggestions, events);
		suggestNature(fields, suggestions, events);
		suggestTreatyRate(fields, suggestions, events);

		for (ReconciliationEvent event : events) {
			logger.debug("Reconciliation {} '{}' -> '{}' ({})",
					event.lookupDomain().code(), event.input(), event.resolved(), event.matchType().code());
		}
		return new SuggestionResult(suggestions, events);
	}

	private void suggestRemitter(Map<String, String> fields, Map<String, String> suggestions,
								 List<ReconciliationEvent> events) {
		String input = raw(fields, FormFields.NAME_REMITTER);
		if (input.isBlank()) {
			return;
		}
		Optional<IndianCompany> match = resolver.findIndianCompany(input);
		if (match.isEmpty()) {
			events.add(notFound(LookupDomain.INDIAN, input));
			return;
		}
		String name = trim(match.get().name());
		String pan = trim(match.get().pan()).toUpperCase(Locale.ROOT);
		putIfPresent(suggestions, FormFields.NAME_REMITTER, name);
		putIfPresent(suggestions, FormFields.REMITTER_PAN, pan);
		events.add(found(LookupDomain.INDIAN, input, name.isEmpty() ? input : name));
	}

	private void suggestRemittee(Map<String, String> fields, Map<String, String> suggestions,
								 List<ReconciliationEvent> events) {
		String input = raw(fields, FormFields.NAME_REMITTEE);
		if (input.isBlank()) {
			return;
		}
		Optional<ForeignCompany> match = resolver.findForeignCompany(input);
		if (match.isEmpty()) {
			events.add(notFound(LookupDomain.FOREIGN, input));
			return;
		}
		String name = trim(match.get().name());
		putIfPresent(suggestions, FormFields.NAME_REMITTEE, name);
		events.add(found(LookupDomain.FOREIGN, input, name.isEmpty() ? input : name));
	}

	private void suggestBank(Map<String, String> fields, BankCodeLookup codes, Map<String, String> suggestions,
							 List<ReconciliationEvent> events) {
		String party = suggestions.get(FormFields.NAME_REMITTER);
		if (party == null || party.isBlank()) {
			party = raw(fields, FormFields.NAME_REMITTER);
		}
		if (party.isBlank()) {
			return;
		}

		List<BankRow> partyRows = resolver.findPartyBanks(party);
		String bankHint = bankNameHint(fields);
		Optional<BankRow> match;
		if (bankHint.isEmpty()) {
			match = partyRows.stream().findFirst();
		} else {
			match = resolver.findBankByName(bankHint, party);
		}
		if (match.isEmpty()) {
			events.add(notFound(LookupDomain.PARTY, party));
			return;
		}

		BankRow row = match.get();
		String bankName = trim(row.bankName());
		putIfPresent(suggestions, FormFields.NAME_BANK_CODE, codes.codeFor(bankName).orElse(bankName));
		putIfPresent(suggestions, FormFields.BRANCH_NAME, trim(row.branch()));
		putIfPresent(suggestions, FormFields.BSR_CODE, FieldValidators.digitsOnly(row.bsrCode()));
		if (partyRows.contains(row)) {
			events.add(found(LookupDomain.PARTY, party, bankName));
		} else {
			// row belongs to another party
			events.add(new ReconciliationEvent(LookupDomain.PARTY, party, bankName, MatchType.MATCHED,
					ALL_PARTIES_SOURCE));
		}
	}

	private void suggestNature(Map<String, String> fields, Map<String, String> suggestions,
							   List<ReconciliationEvent> events) {
		String input = raw(fields, FormFields.NATURE_REM_CATEGORY);
		if (input.isBlank()) {
			return;
		}
		Optional<NatureMapping> match = resolver.findNatureRow(input);
		if (match.isEmpty()) {
			events.add(notFound(LookupDomain.NATURE, input));
			return;
		}
		NatureMapping mapping = match.get();
		String agreementNature = trim(mapping.agreementNature());
		putIfPresent(suggestions, FormFields.NATURE_REM_CATEGORY, agreementNature);
		putIfPresent(suggestions, FormFields.REV_PUR_CATEGORY, trim(mapping.serviceCategory()));
		putIfPresent(suggestions, FormFields.REV_PUR_CODE, trim(mapping.purposeCode()));
		events.add(found(LookupDomain.NATURE, input, agreementNature.isEmpty() ? input : agreementNature));
	}

	private void suggestTreatyRate(Map<String, String> fields, Map<String, String> suggestions,
								   List<ReconciliationEvent> events) {
		String input = raw(fields, FormFields.COUNTRY_REM_MADE_SECB);
		if (input.isBlank()) {
			input = raw(fields, FormFields.REMITTEE_TOWN_CITY_DISTRICT);
		}
		if (input.isBlank()) {
			return;
		}
		Optional<DtaaRate> match = resolver.findDtaa(input);
		if (match.isEmpty()) {
			events.add(notFound(LookupDomain.COUNTRY, input));
			return;
		}
		DtaaRate rate = match.get();
		String country = trim(rate.country());
		putIfPresent(suggestions, FormFields.RELEVANT_DTAA, country);
		putIfPresent(suggestions, FormFields.RELEVANT_ART_DTAA, trim(rate.article()));
		Optional<BigDecimal> fraction = rate.fraction();
		if (fraction.isPresent()) {
			suggestions.put(FormFields.RATE_TDS_A_DTAA, formatPercent(fraction.get()));
		} else if (rate.rate() != null) {
			logger.warn("Ignoring non-numeric treaty rate '{}' for {}.", rate.rate(), country);
		}
		events.add(found(LookupDomain.COUNTRY, input, country.isEmpty() ? input : country));
	}

	/**
	 * Fraction to percentage text: two decimals at most, no trailing zeros.
	 */
	static String formatPercent(BigDecimal fraction) {
		return fraction.multiply(HUNDRED)
				.setScale(2, RoundingMode.HALF_UP)
				.stripTrailingZeros()
				.toPlainString();
	}

	private String bankNameHint(Map<String, String> fields) {
		String hint = raw(fields, FormFields.NAME_BANK_CODE).trim();
		if (hint.isEmpty() || FieldValidators.digitsOnly(hint).equals(hint)) {
			return "";
		}
		return hint;
	}

	private ReconciliationEvent found(LookupDomain domain, String input, String resolved) {
		MatchType matchType = resolver.matchType(input, domain, true);
		return ReconciliationEvent.of(domain, input, resolved, matchType);
	}

	private ReconciliationEvent notFound(LookupDomain domain, String input) {
		return ReconciliationEvent.of(domain, input, "", MatchType.NOT_FOUND);
	}

	private static void putIfPresent(Map<String, String> target, String key, String value) {
		if (value != null && !value.isEmpty()) {
			target.put(key, value);
		}
	}

	private static String raw(Map<String, String> fields, String key) {
		if (fields == null) {
			return "";
		}
		String value = fields.get(key);
		return value == null ? "" : value;
	}

	private static String trim(String value) {
		return value == null ? "" : value.trim();
	}
}
