package my.form15cb.app.masterdata;

import java.util.List;

public record PartyBanks(
		String partyName,
		List<BankRow> rows
) {
	public PartyBanks {
		rows = rows == null ? List.of() : List.copyOf(rows);
	}
}
