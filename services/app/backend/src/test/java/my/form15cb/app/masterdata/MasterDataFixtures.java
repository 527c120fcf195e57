package my.form15cb.app.masterdata;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MasterDataFixtures {
	private MasterDataFixtures() {
	}

	public static MasterDataset dataset() {
		Map<String, List<BankRow>> banks = new LinkedHashMap<>();
		banks.put("Acme India Private Limited", List.of(
				new BankRow("State Bank of India", "000-1234", "Fort, Mumbai"),
				new BankRow("HDFC Bank Ltd", "0510001", "Nariman Point")
		));
		banks.put("Chennai Components Pvt Ltd", List.of(
				new BankRow("Deutsche Bank AG", "0180002", "Anna Salai, Chennai")
		));
		return new MasterDataset(
				List.of(
						new IndianCompany("Acme India Private Limited", "aaaca1234f"),
						new IndianCompany("Chennai Components Pvt Ltd", "AADCC9012M")
				),
				List.of(new ForeignCompany("Acme Global GmbH")),
				banks,
				List.of(new NatureMapping("Software subscription", "Software license fee",
						"Computer services", "RB-08.1")),
				List.of(
						new DtaaRate("Germany", "Article 12", "0.10"),
						new DtaaRate("United States of America", "Article 12", "0.15"),
						new DtaaRate("Singapore", "Article 12", "0.125")
				),
				List.of("Treaty benefit claimed")
		);
	}

	public static AliasTables aliases() {
		Map<LookupDomain, Map<String, String>> tables = new EnumMap<>(LookupDomain.class);
		tables.put(LookupDomain.INDIAN, Map.of("Acme India Pvt Ltd", "Acme India Private Limited"));
		tables.put(LookupDomain.FOREIGN, Map.of("Acme Global", "Acme Global GmbH"));
		tables.put(LookupDomain.PARTY, Map.of("Acme India Pvt Ltd", "Acme India Private Limited"));
		tables.put(LookupDomain.NATURE, Map.of("SaaS fees", "Software subscription"));
		tables.put(LookupDomain.COUNTRY, Map.of("USA", "United States of America"));
		return AliasTables.of(tables);
	}

	public static MasterDataResolver resolver() {
		return new MasterDataResolver(MasterIndex.build(dataset()), aliases());
	}
}
