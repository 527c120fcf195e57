package my.form15cb.app.api;

import my.form15cb.app.dto.BankLookupResponseDto;
import my.form15cb.app.masterdata.BankRow;
import my.form15cb.app.masterdata.MasterDataResolver;
import my.form15cb.app.masterdata.MasterDataset;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/master-data")
public class MasterDataController {
	private final MasterDataResolver resolver;

	public MasterDataController(MasterDataResolver resolver) {
		this.resolver = resolver;
	}

	@GetMapping
	public MasterDataset masterData() {
		return resolver.index().dataset();
	}

	@GetMapping("/banks")
	public BankLookupResponseDto banks(@RequestParam(value = "party", required = false) String party,
									   @RequestParam(value = "bank", required = false) String bank) {
		if (isBlank(party) && isBlank(bank)) {
			throw new IllegalArgumentException("party or bank is required");
		}
		List<BankRow> rows;
		if (isBlank(bank)) {
			rows = resolver.findPartyBanks(party);
		} else {
			rows = resolver.findBankByName(bank, party).map(List::of).orElse(List.of());
		}
		return new BankLookupResponseDto(party, bank, rows);
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
