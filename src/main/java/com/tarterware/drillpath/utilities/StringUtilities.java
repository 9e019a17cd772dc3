package com.tarterware.drillpath.utilities;

import java.math.BigDecimal;

public class StringUtilities {
	/**
	 * Test if string is null, empty, or blank.
	 * @param str String to be evaluated
	 * @return true if the string is null, empty, or blank.
	 */
	public static boolean isNullEmptyOrBlank(String str) {
		return (str == null) || str.isBlank();
	}

	/**
	 * Render a number without exponent notation and without trailing zeros,
	 * e.g. 19.0 as "19" and 1.0E-4 as "0.0001".
	 * @param value Finite number to render.
	 * @return Plain decimal text that parses back to the same double.
	 */
	public static String toPlainDecimal(double value) {
		if (!Double.isFinite(value)) {
			throw new IllegalArgumentException("Not a finite number: " + value);
		}
		if (value == 0.0) {
			return "0";
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	/**
	 * Strip the directory and the last extension from a file name.
	 * @param fileName File name or path, with either separator.
	 * @return The bare base name.
	 */
	public static String baseName(String fileName) {
		String name = fileName;
		int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
		if (slash >= 0) {
			name = name.substring(slash + 1);
		}
		int dot = name.lastIndexOf('.');
		if (dot > 0) {
			name = name.substring(0, dot);
		}
		return name;
	}
}
