package works.toon.codec.io;

import java.util.Iterator;

/**
 * A {@link works.toon.codec.LineSource LineSource} over physical lines
 * supplied by an {@link Iterator}, pulled only as they are needed.
 * Useful when lines come from somewhere other than a character stream,
 * like a {@link java.util.stream.Stream#iterator() stream} of records being rendered on the fly.
 */
public final class IteratorLineSource extends IndentedLineSource {
	final Iterator<String> lines;

	public IteratorLineSource(Iterator<String> lines) {
		this.lines = lines;
	}

	@Override
	protected String readPhysicalLine() {
		return lines.hasNext() ? lines.next() : null;
	}

	@Override
	public void close() {

	}
}
