package works.toon.codec.literal;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import works.toon.exceptions.ToonSyntaxException;
import works.toon.value.BoolValue;
import works.toon.value.FloatValue;
import works.toon.value.IntValue;
import works.toon.value.NullValue;
import works.toon.value.StringValue;
import works.toon.value.Value;

/**
 * The scalar lexical grammar: the one place that decides what a literal looks like.
 * The encoder and decoder both go through here, which is what lets
 * {@code parse(format(v))} equal {@code v} for every scalar.
 */
public final class Literals {
	private Literals() { }

	/**
	 * @throws IllegalArgumentException if {@code value} is a list or map
	 */
	public static String format(Value value) {
		if (value instanceof NullValue) {
			return "null";
		} else if (value instanceof BoolValue b) {
			return b.value() ? "true" : "false";
		} else if (value instanceof IntValue i) {
			return i.value().toString();
		} else if (value instanceof FloatValue f) {
			return Double.toString(f.value());
		} else if (value instanceof StringValue s) {
			return formatString(s.value());
		} else {
			throw new IllegalArgumentException("Not a scalar: " + value.getClass().getSimpleName());
		}
	}

	public static String formatString(String s) {
		return needsQuoting(s) ? quote(s) : s;
	}

	/**
	 * Keys are always strings, so unlike {@link #formatString},
	 * this doesn't quote keys that happen to look like numbers or keywords.
	 */
	public static String formatKey(String key) {
		return keyNeedsQuoting(key) ? quote(key) : key;
	}

	/**
	 * @return true if {@code s}, written bare, would not read back as the same string
	 */
	public static boolean needsQuoting(String s) {
		return keyNeedsQuoting(s) || ScalarKind.classify(s) != ScalarKind.STRING;
	}

	public static boolean keyNeedsQuoting(String s) {
		if (s.isEmpty()) {
			return true;
		}
		char first = s.charAt(0);
		if (Character.isWhitespace(first) || Character.isWhitespace(s.charAt(s.length() - 1))) {
			return true;
		}
		if (first == '#' || s.equals("-") || s.startsWith("- ")) {
			// Would read as a comment or a list bullet
			return true;
		}
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (isReserved(c) || Character.isISOControl(c)) {
				return true;
			}
		}
		return false;
	}

	public static boolean isReserved(char c) {
		return switch (c) {
			case ',', ':', '{', '}', '[', ']', '"', '\\' -> true;
			default -> false;
		};
	}

	public static String quote(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\t': sb.append("\\t"); break;
				default:
					if (Character.isISOControl(c)) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		sb.append('"');
		return sb.toString();
	}

	public static boolean isQuoted(String token) {
		return !token.isEmpty() && token.charAt(0) == '"';
	}

	/**
	 * @param token a complete quoted token, including both quotes
	 * @throws ToonSyntaxException if the token is unterminated, has a bad escape,
	 * or has anything after its closing quote
	 */
	public static String unquote(String token, int lineNumber) {
		int end = endOfQuoted(token, 0, lineNumber);
		if (end != token.length()) {
			throw new ToonSyntaxException(lineNumber, "Unexpected characters after closing quote: " + token);
		}
		return unescape(token, 1, end - 1, lineNumber);
	}

	/**
	 * @param start the index of the opening quote
	 * @return the index just past the closing quote
	 */
	public static int endOfQuoted(String text, int start, int lineNumber) {
		assert text.charAt(start) == '"';
		int i = start + 1;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\\') {
				i += 2;
			} else if (c == '"') {
				return i + 1;
			} else {
				i++;
			}
		}
		throw new ToonSyntaxException(lineNumber, "Unterminated quoted string: " + text.substring(start));
	}

	private static String unescape(String text, int from, int to, int lineNumber) {
		if (text.indexOf('\\', from) == -1) {
			return text.substring(from, to);
		}
		StringBuilder sb = new StringBuilder(to - from);
		int i = from;
		while (i < to) {
			char c = text.charAt(i++);
			if (c != '\\') {
				sb.append(c);
				continue;
			}
			char esc = text.charAt(i++);
			switch (esc) {
				case '"', '\\', '/' -> sb.append(esc);
				case 'b' -> sb.append('\b');
				case 'f' -> sb.append('\f');
				case 'n' -> sb.append('\n');
				case 'r' -> sb.append('\r');
				case 't' -> sb.append('\t');
				case 'u' -> {
					if (i + 4 > to) {
						throw new ToonSyntaxException(lineNumber, "Incomplete Unicode escape sequence");
					}
					int value = 0;
					for (int j = 0; j < 4; j++) {
						int digit = Character.digit(text.charAt(i++), 16);
						if (digit == -1) {
							throw new ToonSyntaxException(lineNumber, "Invalid Unicode escape sequence");
						}
						value = (value << 4) | digit;
					}
					sb.append((char) value);
				}
				default -> throw new ToonSyntaxException(lineNumber, "Invalid escape: \\" + esc);
			}
		}
		return sb.toString();
	}

	/**
	 * Reads a single scalar token.
	 * Quoted tokens are always strings; bare tokens are classified by {@link ScalarKind}.
	 *
	 * @param token with surrounding whitespace already removed
	 */
	public static Value parse(String token, int lineNumber) {
		if (isQuoted(token)) {
			return new StringValue(unquote(token, lineNumber));
		}
		return switch (ScalarKind.classify(token)) {
			case NULL -> NullValue.NULL;
			case BOOL -> BoolValue.of(token.equals("true"));
			case INT -> new IntValue(new BigInteger(token));
			case FLOAT -> parseFloat(token, lineNumber);
			case STRING -> new StringValue(token);
		};
	}

	static FloatValue parseFloat(String token, int lineNumber) {
		double d = Double.parseDouble(token);
		if (Double.isInfinite(d)) {
			throw new ToonSyntaxException(lineNumber, "Float literal out of range: " + token);
		}
		return new FloatValue(d);
	}

	/**
	 * @param token with surrounding whitespace already removed
	 */
	public static String parseKey(String token, int lineNumber) {
		if (isQuoted(token)) {
			return unquote(token, lineNumber);
		} else if (token.isEmpty()) {
			throw new ToonSyntaxException(lineNumber, "Empty key");
		} else {
			return token;
		}
	}

	/**
	 * Splits a table row or inline list on commas that aren't inside quotes.
	 * A quote only opens a quoted token at the start of that token;
	 * elsewhere it's an ordinary character.
	 *
	 * @return the tokens, each with surrounding whitespace removed;
	 * never empty, since even blank text holds one (empty) token
	 */
	public static List<String> split(String text, int lineNumber) {
		List<String> result = new ArrayList<>();
		int start = 0;
		boolean atTokenStart = true;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '"' && atTokenStart) {
				i = endOfQuoted(text, i, lineNumber);
				atTokenStart = false;
			} else if (c == ',') {
				result.add(text.substring(start, i).strip());
				start = ++i;
				atTokenStart = true;
			} else {
				if (!Character.isWhitespace(c)) {
					atTokenStart = false;
				}
				i++;
			}
		}
		result.add(text.substring(start).strip());
		return result;
	}
}
