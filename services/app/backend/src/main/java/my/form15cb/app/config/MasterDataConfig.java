package my.form15cb.app.config;

import my.form15cb.app.masterdata.AliasTables;
import my.form15cb.app.masterdata.BankCodeLookup;
import my.form15cb.app.masterdata.LookupDomain;
import my.form15cb.app.masterdata.MasterDataLoader;
import my.form15cb.app.masterdata.MasterDataResolver;
import my.form15cb.app.masterdata.MasterIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class MasterDataConfig {
	private static final Logger logger = LoggerFactory.getLogger(MasterDataConfig.class);

	@Bean
	public MasterDataLoader masterDataLoader() {
		return new MasterDataLoader();
	}

	@Bean
	public MasterIndex masterIndex(MasterDataLoader loader, AppProperties properties, ResourceLoader resourceLoader) {
		Resource dataset = resourceLoader.getResource(properties.masterData().dataset());
		return MasterIndex.build(loader.loadDataset(dataset));
	}

	@Bean
	public AliasTables aliasTables(MasterDataLoader loader, AppProperties properties, ResourceLoader resourceLoader) {
		String location = properties.masterData().aliases();
		if (location == null || location.isBlank()) {
			return AliasTables.empty();
		}
		AliasTables tables = loader.loadAliases(resourceLoader.getResource(location));
		for (LookupDomain domain : LookupDomain.values()) {
			logger.info("Alias table {} has {} entries.", domain.code(), tables.size(domain));
		}
		return tables;
	}

	@Bean
	public BankCodeLookup bankCodeLookup(AppProperties properties, ResourceLoader resourceLoader) {
		String location = properties.masterData().bankCodes();
		if (location == null || location.isBlank()) {
			return BankCodeLookup.empty();
		}
		return BankCodeLookup.load(resourceLoader.getResource(location));
	}

	@Bean
	public MasterDataResolver masterDataResolver(MasterIndex masterIndex, AliasTables aliasTables) {
		return new MasterDataResolver(masterIndex, aliasTables);
	}
}
