package works.toon.codec.literal;

import java.math.BigInteger;
import works.toon.exceptions.CellTypeException;
import works.toon.value.BoolValue;
import works.toon.value.IntValue;
import works.toon.value.NullValue;
import works.toon.value.StringValue;
import works.toon.value.Value;

import static works.toon.codec.literal.ScalarKind.FLOAT_PATTERN;
import static works.toon.codec.literal.ScalarKind.INT_PATTERN;

/**
 * The converter fixed for one column of a table.
 * <p>
 * A table's first row decides each column's type via {@link #infer};
 * after that, every cell in the column goes through that type's {@link #convert}
 * without being classified again.
 * A cell the converter rejects is an error, not a reason to change the column's type.
 * <p>
 * Every converter accepts the bare literal {@code null}.
 */
public enum ColumnType {
	INT {
		@Override
		Value convertBare(String token, int lineNumber) {
			if (INT_PATTERN.matcher(token).matches()) {
				return new IntValue(new BigInteger(token));
			} else {
				throw mismatch(token, lineNumber);
			}
		}
	},
	FLOAT {
		@Override
		Value convertBare(String token, int lineNumber) {
			if (FLOAT_PATTERN.matcher(token).matches()) {
				return Literals.parseFloat(token, lineNumber);
			} else {
				throw mismatch(token, lineNumber);
			}
		}
	},
	BOOL {
		@Override
		Value convertBare(String token, int lineNumber) {
			return switch (token) {
				case "true" -> BoolValue.TRUE;
				case "false" -> BoolValue.FALSE;
				default -> throw mismatch(token, lineNumber);
			};
		}
	},

	/**
	 * Accepts anything: quoted tokens are unescaped, and bare tokens are taken verbatim,
	 * even if they look like numbers.
	 */
	STRING {
		@Override
		Value convertBare(String token, int lineNumber) {
			return new StringValue(token);
		}
	};

	/**
	 * @param token a raw cell, with surrounding whitespace already removed
	 * @return the column type implied by {@code token},
	 * or null if it's the literal {@code null}, which implies nothing
	 */
	public static ColumnType infer(String token) {
		if (Literals.isQuoted(token)) {
			return STRING;
		}
		return switch (ScalarKind.classify(token)) {
			case NULL -> null;
			case BOOL -> BOOL;
			case INT -> INT;
			case FLOAT -> FLOAT;
			case STRING -> STRING;
		};
	}

	/**
	 * @throws CellTypeException if {@code token} isn't a literal of this type
	 */
	public final Value convert(String token, int lineNumber) {
		if (Literals.isQuoted(token)) {
			if (this == STRING) {
				return new StringValue(Literals.unquote(token, lineNumber));
			} else {
				throw mismatch(token, lineNumber);
			}
		} else if (token.equals("null")) {
			return NullValue.NULL;
		} else {
			return convertBare(token, lineNumber);
		}
	}

	abstract Value convertBare(String token, int lineNumber);

	CellTypeException mismatch(String token, int lineNumber) {
		return new CellTypeException(lineNumber, "Expected " + this + " cell but found '" + token + "'");
	}
}
