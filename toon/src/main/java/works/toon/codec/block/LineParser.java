package works.toon.codec.block;

import java.util.ArrayList;
import java.util.List;
import works.toon.codec.block.Statement.ArrayHeader;
import works.toon.codec.block.Statement.Entry;
import works.toon.codec.block.Statement.Scalar;
import works.toon.codec.literal.Literals;
import works.toon.exceptions.ToonSyntaxException;

/**
 * Works out the shape of one line's content.
 * <p>
 * A colon separates a key only when followed by whitespace or the end of the line,
 * so that bare text like {@code http://example.com} or {@code 10:00} reads as a scalar.
 * An opening bracket after a key always starts an array header.
 */
final class LineParser {
	private LineParser() { }

	static Statement parse(String content, int lineNumber) {
		if (content.charAt(0) == '"') {
			int end = Literals.endOfQuoted(content, 0, lineNumber);
			if (end < content.length() && content.charAt(end) == '[') {
				return parseHeader(Literals.unquote(content.substring(0, end), lineNumber), content, end, lineNumber);
			} else if (isKeySeparator(content, end)) {
				return new Entry(Literals.unquote(content.substring(0, end), lineNumber), null, content.substring(end + 1).strip());
			} else {
				return new Scalar(content);
			}
		} else if (content.charAt(0) == '[') {
			return parseHeader(null, content, 0, lineNumber);
		}
		for (int i = 0; i < content.length(); i++) {
			char c = content.charAt(i);
			if (c == '[') {
				return parseHeader(content.substring(0, i).strip(), content, i, lineNumber);
			} else if (isKeySeparator(content, i)) {
				String key = content.substring(0, i).strip();
				if (key.isEmpty()) {
					throw new ToonSyntaxException(lineNumber, "Missing key before ':'");
				}
				return new Entry(key, null, content.substring(i + 1).strip());
			}
		}
		return new Scalar(content);
	}

	private static boolean isKeySeparator(String content, int i) {
		return i < content.length()
			&& content.charAt(i) == ':'
			&& (i + 1 == content.length() || Character.isWhitespace(content.charAt(i + 1)));
	}

	/**
	 * @param open the index of the {@code [}
	 */
	private static Entry parseHeader(String key, String content, int open, int lineNumber) {
		int close = content.indexOf(']', open);
		if (close == -1) {
			throw new ToonSyntaxException(lineNumber, "Unterminated array length: " + content);
		}
		int length = parseLength(content.substring(open + 1, close).strip(), lineNumber);
		int i = close + 1;
		List<String> columns = null;
		if (i < content.length() && content.charAt(i) == '{') {
			int closeBrace = endOfColumns(content, i + 1, lineNumber);
			columns = parseColumns(content.substring(i + 1, closeBrace), lineNumber);
			i = closeBrace + 1;
		}
		if (i == content.length()) {
			if (columns != null) {
				// Table headers are recognizable without their colon
				return new Entry(key, new ArrayHeader(length, columns), "");
			}
			throw new ToonSyntaxException(lineNumber, "Expected ':' after array header: " + content);
		} else if (content.charAt(i) != ':') {
			throw new ToonSyntaxException(lineNumber, "Unexpected '" + content.charAt(i) + "' after array header: " + content);
		}
		return new Entry(key, new ArrayHeader(length, columns), content.substring(i + 1).strip());
	}

	private static int parseLength(String text, int lineNumber) {
		if (text.isEmpty()) {
			throw new ToonSyntaxException(lineNumber, "Missing array length");
		}
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c < '0' || c > '9') {
				throw new ToonSyntaxException(lineNumber, "Malformed array length: " + text);
			}
		}
		try {
			return Integer.parseInt(text);
		} catch (NumberFormatException e) {
			throw new ToonSyntaxException(lineNumber, "Array length too large: " + text);
		}
	}

	/**
	 * @return the index of the {@code }} closing the column list
	 */
	private static int endOfColumns(String content, int start, int lineNumber) {
		int i = start;
		while (i < content.length()) {
			char c = content.charAt(i);
			if (c == '"') {
				i = Literals.endOfQuoted(content, i, lineNumber);
			} else if (c == '}') {
				return i;
			} else {
				i++;
			}
		}
		throw new ToonSyntaxException(lineNumber, "Unterminated column list: " + content);
	}

	private static List<String> parseColumns(String text, int lineNumber) {
		List<String> result = new ArrayList<>();
		for (String token : Literals.split(text, lineNumber)) {
			if (token.isEmpty()) {
				throw new ToonSyntaxException(lineNumber, "Empty column name in {" + text + "}");
			}
			result.add(Literals.parseKey(token, lineNumber));
		}
		return result;
	}
}
