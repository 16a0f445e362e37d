package works.toon.codec.literal;

import java.util.regex.Pattern;

/**
 * What an unquoted token denotes.
 * <p>
 * This classification decides both how the decoder reads a bare token
 * and whether the encoder must quote a string to keep it from being read as something else.
 */
public enum ScalarKind {
	NULL,
	BOOL,
	INT,
	FLOAT,
	STRING;

	static final Pattern INT_PATTERN = Pattern.compile("-?(?:0|[1-9][0-9]*)");
	static final Pattern FLOAT_PATTERN = Pattern.compile("-?[0-9]+\\.[0-9]+(?:[eE][+-]?[0-9]+)?");

	/**
	 * @param bare an unquoted token with surrounding whitespace already removed
	 */
	public static ScalarKind classify(String bare) {
		if (bare.isEmpty()) {
			return STRING;
		}
		char first = bare.charAt(0);
		if (first == 'n' && bare.equals("null")) {
			return NULL;
		} else if ((first == 't' && bare.equals("true")) || (first == 'f' && bare.equals("false"))) {
			return BOOL;
		} else if (first != '-' && (first < '0' || first > '9')) {
			// Cheap exit for the common case of words
			return STRING;
		} else if (INT_PATTERN.matcher(bare).matches()) {
			return INT;
		} else if (FLOAT_PATTERN.matcher(bare).matches()) {
			return FLOAT;
		} else {
			return STRING;
		}
	}
}
