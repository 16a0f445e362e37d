package works.toon.codec.block;

import java.util.List;

/**
 * What a single line says, independent of its surroundings.
 * Produced by {@link LineParser}.
 */
sealed interface Statement permits Statement.Entry, Statement.Scalar {

	/**
	 * A line that introduces a value: {@code key: value}, {@code key:},
	 * or an array header with or without a key.
	 *
	 * @param key null for an array header with no key, as at the root or in a list element
	 * @param header null unless the line has an array header
	 * @param rest the text after the colon, with surrounding whitespace removed; possibly empty
	 */
	record Entry(String key, ArrayHeader header, String rest) implements Statement {
		public Entry {
			assert key != null || header != null;
		}
	}

	/**
	 * A line holding nothing but a literal.
	 */
	record Scalar(String text) implements Statement { }

	/**
	 * The bracketed part of {@code key[n]{c1,c2}:}.
	 *
	 * @param columns null for a bulleted or flat list; the column names, unquoted, for a table
	 */
	record ArrayHeader(int length, List<String> columns) {
		boolean isTable() {
			return columns != null;
		}
	}
}
