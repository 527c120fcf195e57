package my.form15cb.app.masterdata;

import my.form15cb.app.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup tables over the reference dataset, keyed by normalized name.
 * When two records normalize to the same key the first one in dataset order is kept.
 */
public final class MasterIndex {
	private static final Logger logger = LoggerFactory.getLogger(MasterIndex.class);

	private final MasterDataset dataset;
	private final Map<String, IndianCompany> indianCompanies;
	private final Map<String, ForeignCompany> foreignCompanies;
	private final Map<String, PartyBanks> partyBanks;
	private final Map<String, NatureMapping> natureMappings;
	private final Map<String, DtaaRate> dtaaRates;

	private MasterIndex(MasterDataset dataset,
						Map<String, IndianCompany> indianCompanies,
						Map<String, ForeignCompany> foreignCompanies,
						Map<String, PartyBanks> partyBanks,
						Map<String, NatureMapping> natureMappings,
						Map<String, DtaaRate> dtaaRates) {
		this.dataset = dataset;
		this.indianCompanies = Collections.unmodifiableMap(indianCompanies);
		this.foreignCompanies = Collections.unmodifiableMap(foreignCompanies);
		this.partyBanks = Collections.unmodifiableMap(partyBanks);
		this.natureMappings = Collections.unmodifiableMap(natureMappings);
		this.dtaaRates = Collections.unmodifiableMap(dtaaRates);
	}

	public static MasterIndex build(MasterDataset dataset) {
		MasterDataset source = dataset == null ? MasterDataset.empty() : dataset;

		Map<String, IndianCompany> indian = new LinkedHashMap<>();
		for (IndianCompany company : source.indianCompanies()) {
			putFirst(indian, LookupDomain.INDIAN, company.name(), company);
		}

		Map<String, ForeignCompany> foreign = new LinkedHashMap<>();
		for (ForeignCompany company : source.foreignCompanies()) {
			putFirst(foreign, LookupDomain.FOREIGN, company.name(), company);
		}

		Map<String, PartyBanks> banks = new LinkedHashMap<>();
		for (Map.Entry<String, List<BankRow>> entry : source.banksByParty().entrySet()) {
			putFirst(banks, LookupDomain.PARTY, entry.getKey(), new PartyBanks(entry.getKey(), entry.getValue()));
		}

		Map<String, NatureMapping> nature = new LinkedHashMap<>();
		for (NatureMapping mapping : source.natureMap()) {
			putFirst(nature, LookupDomain.NATURE, mapping.invoiceNature(), mapping);
			putFirst(nature, LookupDomain.NATURE, mapping.agreementNature(), mapping);
		}

		Map<String, DtaaRate> dtaa = new LinkedHashMap<>();
		for (DtaaRate rate : source.dtaaRates()) {
			putFirst(dtaa, LookupDomain.COUNTRY, rate.country(), rate);
		}

		MasterIndex index = new MasterIndex(source, indian, foreign, banks, nature, dtaa);
		logger.info("Master index built (indian={}, foreign={}, parties={}, nature={}, dtaa={}).",
				indian.size(), foreign.size(), banks.size(), nature.size(), dtaa.size());
		return index;
	}

	public Optional<IndianCompany> indianCompany(String key) {
		return Optional.ofNullable(indianCompanies.get(key));
	}

	public Optional<ForeignCompany> foreignCompany(String key) {
		return Optional.ofNullable(foreignCompanies.get(key));
	}

	public Optional<PartyBanks> partyBanks(String key) {
		return Optional.ofNullable(partyBanks.get(key));
	}

	public Optional<NatureMapping> natureMapping(String key) {
		return Optional.ofNullable(natureMappings.get(key));
	}

	public Optional<DtaaRate> dtaaRate(String key) {
		return Optional.ofNullable(dtaaRates.get(key));
	}

	/**
	 * All parties keyed by normalized party name, in dataset order.
	 */
	public Map<String, PartyBanks> allPartyBanks() {
		return partyBanks;
	}

	public MasterDataset dataset() {
		return dataset;
	}

	public int size(LookupDomain domain) {
		return switch (domain) {
			case INDIAN -> indianCompanies.size();
			case FOREIGN -> foreignCompanies.size();
			case PARTY -> partyBanks.size();
			case NATURE -> natureMappings.size();
			case COUNTRY -> dtaaRates.size();
		};
	}

	private static <T> void putFirst(Map<String, T> index, LookupDomain domain, String name, T value) {
		String key = TextNormalizer.normalize(name);
		if (key.isEmpty()) {
			return;
		}
		T existing = index.putIfAbsent(key, value);
		if (existing != null && existing != value) {
			logger.warn("Duplicate {} key '{}' in master data; keeping the first record.", domain.code(), key);
		}
	}
}
