package works.toon.codec;

/**
 * Knobs that affect the text a {@link Codec} produces and the documents it accepts.
 *
 * @param indentWidth spaces per nesting level in encoder output
 * @param inlineListWidth longest joined text, in characters, that a list of scalars may have
 *                        and still be written on a single line; longer lists are written one element per line
 * @param maxDepth deepest nesting the decoder will follow before giving up on a document
 */
public record Settings(
	int indentWidth,
	int inlineListWidth,
	int maxDepth
) {
	public static final Settings DEFAULT = new Settings(2, Integer.MAX_VALUE, 1000);

	public Settings {
		if (indentWidth < 1) {
			throw new IllegalArgumentException("Indent width must be positive: " + indentWidth);
		}
		if (inlineListWidth < 0) {
			throw new IllegalArgumentException("Inline list width must be non-negative: " + inlineListWidth);
		}
		if (maxDepth < 1) {
			throw new IllegalArgumentException("Max depth must be positive: " + maxDepth);
		}
	}

	public Settings withIndentWidth(int indentWidth) {
		return new Settings(indentWidth, inlineListWidth, maxDepth);
	}

	public Settings withInlineListWidth(int inlineListWidth) {
		return new Settings(indentWidth, inlineListWidth, maxDepth);
	}

	public Settings withMaxDepth(int maxDepth) {
		return new Settings(indentWidth, inlineListWidth, maxDepth);
	}
}
