package my.form15cb.app.util;

import java.nio.charset.StandardCharsets;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		String header = firstLine(sample);
		int commas = count(header, ',');
		int semicolons = count(header, ';');
		return semicolons > commas ? ';' : ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	private static String firstLine(String sample) {
		int end = sample.indexOf('\n');
		return end < 0 ? sample : sample.substring(0, end);
	}

	private static int count(String value, char needle) {
		int total = 0;
		for (int i = 0; i < value.length(); i++) {
			if (value.charAt(i) == needle) {
				total += 1;
			}
		}
		return total;
	}
}
