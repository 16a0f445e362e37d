package works.toon.codec;

import java.io.Reader;
import works.toon.value.Value;

/**
 * Creates a {@link Value} tree from TOON text.
 *
 * @see works.toon.exceptions.ToonFormatException
 */
public interface Decoder {
	/**
	 * Consumes {@code lines} to its end.
	 * The caller remains responsible for closing it.
	 */
	Value decode(LineSource lines);

	default Value decode(String text) {
		try (LineSource lines = LineSource.create(text)) {
			return decode(lines);
		}
	}

	/**
	 * The reader is consumed lazily, one line at a time, and closed when decoding ends.
	 */
	default Value decode(Reader reader) {
		try (LineSource lines = LineSource.create(reader)) {
			return decode(lines);
		}
	}
}
