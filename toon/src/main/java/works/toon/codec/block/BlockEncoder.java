package works.toon.codec.block;

import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.toon.codec.Encoder;
import works.toon.codec.Settings;
import works.toon.codec.literal.Literals;
import works.toon.exceptions.EncodingInvariantException;
import works.toon.value.ListValue;
import works.toon.value.MapValue;
import works.toon.value.Value;

import static java.util.stream.Collectors.joining;

/**
 * Writes a {@link Value} tree as indented TOON text.
 * Lines are separated by {@code \n}, with no newline after the last one.
 */
public class BlockEncoder implements Encoder {
	private final Settings settings;

	public BlockEncoder(Settings settings) {
		this.settings = settings;
	}

	@Override
	public void encode(Writer out, Value value) {
		LOGGER.debug("Encoding TOON text for {}", value.getClass().getSimpleName());
		PrintWriter printWriter;
		if (out instanceof PrintWriter pw) {
			printWriter = pw;
		} else {
			printWriter = new PrintWriter(out);
		}
		new Session(printWriter, settings).encodeRoot(value);
		printWriter.flush();
		if (printWriter.checkError()) {
			throw new IllegalStateException("Unable to write TOON text");
		}
	}

	static final class Session {
		final PrintWriter out;
		final String indentUnit;
		final int inlineListWidth;
		boolean atStart = true;

		/**
		 * When set, the next line written is a list element:
		 * it's prefixed with {@code - } and outdented by one level to make room for it.
		 */
		boolean bulletPending = false;

		Session(PrintWriter out, Settings settings) {
			this.out = out;
			this.indentUnit = " ".repeat(settings.indentWidth());
			this.inlineListWidth = settings.inlineListWidth();
		}

		void encodeRoot(Value value) {
			if (value instanceof MapValue map) {
				writeEntries(map, 0);
			} else if (value instanceof ListValue list) {
				writeList("", list, 0);
			} else {
				writeLine(0, Literals.format(value));
			}
		}

		private void writeEntries(MapValue map, int depth) {
			map.entries().forEach((key, value) -> writeEntry(depth, key, value));
		}

		private void writeEntry(int depth, String key, Value value) {
			String formattedKey = Literals.formatKey(key);
			if (value instanceof MapValue map) {
				writeLine(depth, formattedKey + ":");
				writeEntries(map, depth + 1);
			} else if (value instanceof ListValue list) {
				writeList(formattedKey, list, depth);
			} else {
				writeLine(depth, formattedKey + ": " + Literals.format(value));
			}
		}

		/**
		 * @param prefix the formatted key, or empty for a list with no key
		 */
		private void writeList(String prefix, ListValue list, int depth) {
			ListShape shape = ListShape.of(list);
			LOGGER.trace("List '{}' with {} elements is {}", prefix, list.size(), shape);
			String header = prefix + "[" + list.size() + "]";
			switch (shape) {
				case TABULAR -> writeTable(header, list, depth);
				case FLAT_SCALAR -> writeFlat(header, list, depth);
				case BULLETED -> writeBulleted(header, list, depth);
			}
		}

		private void writeTable(String header, ListValue list, int depth) {
			List<String> columns = ((MapValue) list.get(0)).keys();
			writeLine(depth, header + columns.stream()
				.map(Literals::formatKey)
				.collect(joining(",", "{", "}:")));
			for (int i = 0; i < list.size(); i++) {
				if (!(list.get(i) instanceof MapValue row) || !ListShape.hasKeys(row, columns)) {
					throw new EncodingInvariantException("Element " + i + " does not have the table's columns " + columns);
				}
				StringBuilder sb = new StringBuilder();
				for (Value cell : row.entries().values()) {
					if (!cell.isScalar()) {
						throw new EncodingInvariantException("Element " + i + " has a non-scalar cell");
					}
					if (sb.length() != 0) {
						sb.append(',');
					}
					sb.append(Literals.format(cell));
				}
				writeLine(depth + 1, sb.toString());
			}
		}

		private void writeFlat(String header, ListValue list, int depth) {
			if (list.isEmpty()) {
				writeLine(depth, header + ":");
				return;
			}
			String joined = list.elements().stream()
				.map(Literals::format)
				.collect(joining(", "));
			if (joined.length() <= inlineListWidth) {
				writeLine(depth, header + ": " + joined);
			} else {
				writeBulleted(header, list, depth);
			}
		}

		private void writeBulleted(String header, ListValue list, int depth) {
			writeLine(depth, header + ":");
			for (Value element : list.elements()) {
				writeElement(element, depth + 1);
			}
		}

		/**
		 * The element's content is written one level deeper than its bullet,
		 * so a map's entries after the first line up beneath the first.
		 */
		private void writeElement(Value element, int depth) {
			bulletPending = true;
			int contentDepth = depth + 1;
			if (element instanceof MapValue map) {
				if (map.isEmpty()) {
					writeLine(contentDepth, "");
				} else {
					writeEntries(map, contentDepth);
				}
			} else if (element instanceof ListValue list) {
				writeList("", list, contentDepth);
			} else {
				writeLine(contentDepth, Literals.format(element));
			}
		}

		private void writeLine(int depth, String text) {
			if (atStart) {
				atStart = false;
			} else {
				out.print('\n');
			}
			if (bulletPending) {
				bulletPending = false;
				out.print(indentUnit.repeat(depth - 1));
				out.print(text.isEmpty() ? "-" : "- " + text);
			} else {
				out.print(indentUnit.repeat(depth));
				out.print(text);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BlockEncoder.class);
}
