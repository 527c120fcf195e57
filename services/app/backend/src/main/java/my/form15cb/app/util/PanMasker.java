package my.form15cb.app.util;

import java.util.Locale;

public final class PanMasker {
	private PanMasker() {
	}

	public static String mask(String pan) {
		String value = pan == null ? "" : pan.trim().toUpperCase(Locale.ROOT);
		if (value.length() != 10) {
			return value;
		}
		return value.substring(0, 2) + "******" + value.substring(8);
	}
}
