package works.toon.codec;

import static java.util.Objects.requireNonNull;

/**
 * One logical line of a TOON document.
 *
 * @param content the text after the indentation, with trailing whitespace removed; never empty
 *                for lines read from input, though the decoder may build virtual lines of its own
 * @param depth the number of indentation units preceding {@code content}
 * @param number the 1-based physical line number, for diagnostics
 */
public record Line(String content, int depth, int number) {
	public Line {
		requireNonNull(content);
		if (depth < 0) {
			throw new IllegalArgumentException("Negative depth: " + depth);
		}
	}

	/**
	 * @return a line with the same number but different content and depth,
	 * used to re-present part of this line as though it appeared on its own
	 */
	public Line withContent(String content, int depth) {
		return new Line(content, depth, number);
	}
}
