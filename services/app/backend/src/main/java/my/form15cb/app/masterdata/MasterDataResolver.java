package my.form15cb.app.masterdata;

import my.form15cb.app.util.TextNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class MasterDataResolver {
	private final MasterIndex index;
	private final AliasTables aliases;

	public MasterDataResolver(MasterIndex index, AliasTables aliases) {
		this.index = index;
		this.aliases = aliases == null ? AliasTables.empty() : aliases;
	}

	/**
	 * Normalizes {@code raw} and applies at most one alias hop for the given domain.
	 */
	public String resolve(String raw, LookupDomain domain) {
		String canonical = TextNormalizer.normalize(raw);
		return aliases.lookup(domain, canonical)
				.map(TextNormalizer::normalize)
				.orElse(canonical);
	}

	public Optional<IndianCompany> findIndianCompany(String name) {
		return index.indianCompany(resolve(name, LookupDomain.INDIAN));
	}

	public Optional<ForeignCompany> findForeignCompany(String name) {
		return index.foreignCompany(resolve(name, LookupDomain.FOREIGN));
	}

	public List<BankRow> findPartyBanks(String partyName) {
		return index.partyBanks(resolve(partyName, LookupDomain.PARTY))
				.map(PartyBanks::rows)
				.orElse(List.of());
	}

	public Optional<NatureMapping> findNatureRow(String nature) {
		return index.natureMapping(resolve(nature, LookupDomain.NATURE));
	}

	public Optional<DtaaRate> findDtaa(String country) {
		return index.dtaaRate(resolve(country, LookupDomain.COUNTRY));
	}

	public Optional<BankRow> findBankByName(String bankName, String partyName) {
		String query = TextNormalizer.normalize(bankName);
		if (query.isEmpty()) {
			return Optional.empty();
		}

		for (BankRow row : findPartyBanks(partyName)) {
			String candidate = TextNormalizer.normalize(row.bankName());
			if (!candidate.isEmpty() && candidate.contains(query)) {
				return Optional.of(row);
			}
		}

		List<Map.Entry<String, PartyBanks>> parties = new ArrayList<>(index.allPartyBanks().entrySet());
		parties.sort(Map.Entry.comparingByKey());

		for (Map.Entry<String, PartyBanks> party : parties) {
			for (BankRow row : party.getValue().rows()) {
				if (query.equals(TextNormalizer.normalize(row.bankName()))) {
					return Optional.of(row);
				}
			}
		}

		return bestScoredRow(query, parties);
	}

	/**
	 * Match classification for one lookup: whether the alias table moved the key, and whether the
	 * domain's index knows the resolved key.
	 */
	public MatchType matchType(String raw, LookupDomain domain, boolean found) {
		if (!found) {
			return MatchType.NOT_FOUND;
		}
		String normalized = TextNormalizer.normalize(raw);
		return resolve(raw, domain).equals(normalized) ? MatchType.MATCHED : MatchType.ALIAS_MATCHED;
	}

	public MasterIndex index() {
		return index;
	}

	/**
	 * Only rows whose normalized name contains the query take part; shared tokens rank them.
	 */
	private Optional<BankRow> bestScoredRow(String query, List<Map.Entry<String, PartyBanks>> parties) {
		Set<String> queryTokens = TextNormalizer.tokens(query);
		List<ScoredRow> candidates = new ArrayList<>();
		int order = 0;
		for (Map.Entry<String, PartyBanks> party : parties) {
			for (BankRow row : party.getValue().rows()) {
				String candidate = TextNormalizer.normalize(row.bankName());
				if (!candidate.isEmpty() && candidate.contains(query)) {
					int shared = 0;
					for (String token : TextNormalizer.tokens(candidate)) {
						if (queryTokens.contains(token)) {
							shared += 1;
						}
					}
					candidates.add(new ScoredRow(row, shared, order));
				}
				order += 1;
			}
		}
		return candidates.stream()
				.min(Comparator.comparingInt(ScoredRow::score).reversed()
						.thenComparingInt(ScoredRow::order))
				.map(ScoredRow::row);
	}

	private record ScoredRow(BankRow row, int score, int order) {
	}
}
