package works.toon.codec.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.toon.codec.Line;
import works.toon.codec.LineSource;
import works.toon.exceptions.ToonSyntaxException;

import static java.util.Objects.requireNonNull;

/**
 * The logic shared by all {@link LineSource}s:
 * skipping insignificant lines, measuring indentation, and the pushback slot.
 * Subclasses supply only the physical lines.
 */
public abstract class IndentedLineSource implements LineSource {
	private Line pending = null;
	private int lineNumber = 0;
	private int indentUnit = 0;

	/**
	 * @return the next physical line without its terminator, or null at end of input
	 */
	protected abstract String readPhysicalLine();

	@Override
	public final Line next() {
		if (pending != null) {
			Line result = pending;
			pending = null;
			return result;
		}
		String raw;
		while ((raw = readPhysicalLine()) != null) {
			lineNumber++;
			Line line = measure(raw);
			if (line != null) {
				return line;
			}
		}
		return null;
	}

	@Override
	public final void pushback(Line line) {
		requireNonNull(line);
		if (pending != null) {
			throw new IllegalStateException("Line " + pending.number() + " has already been pushed back");
		}
		pending = line;
	}

	/**
	 * @return null if the line is blank or a comment
	 */
	private Line measure(String raw) {
		int spaces = 0;
		while (spaces < raw.length() && raw.charAt(spaces) == ' ') {
			spaces++;
		}
		String content = raw.substring(spaces).stripTrailing();
		if (content.isEmpty() || content.charAt(0) == '#') {
			return null;
		}
		if (content.charAt(0) == '\t') {
			throw new ToonSyntaxException(lineNumber, "Tab not allowed in indentation (use spaces)");
		}
		if (spaces == 0) {
			return new Line(content, 0, lineNumber);
		}
		if (indentUnit == 0) {
			indentUnit = spaces;
			LOGGER.debug("Indentation unit is {} spaces, from line {}", indentUnit, lineNumber);
		}
		if (spaces % indentUnit != 0) {
			throw new ToonSyntaxException(lineNumber,
				"Indentation of " + spaces + " spaces is not a multiple of " + indentUnit);
		}
		return new Line(content, spaces / indentUnit, lineNumber);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(IndentedLineSource.class);
}
