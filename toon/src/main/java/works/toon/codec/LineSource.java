package works.toon.codec;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.Iterator;
import works.toon.codec.io.IteratorLineSource;
import works.toon.codec.io.ReaderLineSource;

/**
 * A forward-only cursor over the significant lines of a TOON document.
 * <p>
 * Lines are produced lazily, one at a time; implementations never materialize
 * the whole document, so decoding needs memory proportional to nesting depth
 * rather than document size.
 * <p>
 * Blank lines and comment lines (whose first non-space character is {@code #})
 * are skipped and never returned.
 * <p>
 * The indentation unit is the width of the first indented line.
 * Every later line must be indented by a multiple of that unit.
 */
public interface LineSource extends AutoCloseable {
	@Override void close(); // No throws Exception

	/**
	 * @return a new LineSource that reads from the given reader.
	 * The reader will be closed when the source is closed.
	 */
	static LineSource create(Reader reader) {
		if (reader instanceof BufferedReader br) {
			return new ReaderLineSource(br);
		} else {
			return new ReaderLineSource(new BufferedReader(reader));
		}
	}

	static LineSource create(String text) {
		return create(new StringReader(text));
	}

	/**
	 * @param physicalLines each element is one line of text, without its line terminator
	 */
	static LineSource create(Iterator<String> physicalLines) {
		return new IteratorLineSource(physicalLines);
	}

	/**
	 * If a line has been {@link #pushback pushed back}, returns that line;
	 * otherwise, reads the next significant line from the input.
	 *
	 * @return the next line, or null at end of input
	 * @throws works.toon.exceptions.ToonSyntaxException if the line's indentation is invalid
	 */
	Line next();

	/**
	 * Arranges for {@code line} to be the result of the next call to {@link #next}.
	 * Only one line can be pending at a time.
	 *
	 * @throws IllegalStateException if a line has already been pushed back
	 * and not yet returned by {@link #next}
	 */
	void pushback(Line line);

	/**
	 * @return the line the next call to {@link #next} will return, without consuming it
	 */
	default Line peek() {
		Line result = next();
		if (result != null) {
			pushback(result);
		}
		return result;
	}
}
