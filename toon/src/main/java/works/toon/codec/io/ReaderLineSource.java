package works.toon.codec.io;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * A {@link works.toon.codec.LineSource LineSource} that reads lines on demand from a {@link BufferedReader}.
 * Holds at most one buffer's worth of characters at a time,
 * regardless of how large the document is.
 */
public final class ReaderLineSource extends IndentedLineSource {
	final BufferedReader reader;

	public ReaderLineSource(BufferedReader reader) {
		this.reader = reader;
	}

	@Override
	protected String readPhysicalLine() {
		try {
			return reader.readLine();
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
	}

	@Override
	public void close() {
		try {
			reader.close();
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
	}
}
