package my.form15cb.app.dto;

import my.form15cb.app.masterdata.BankRow;

import java.util.List;

public record BankLookupResponseDto(
		String party,
		String bank,
		List<BankRow> rows
) {
}
