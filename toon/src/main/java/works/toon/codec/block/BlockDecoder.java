package works.toon.codec.block;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.toon.codec.Decoder;
import works.toon.codec.Line;
import works.toon.codec.LineSource;
import works.toon.codec.Settings;
import works.toon.codec.block.Statement.ArrayHeader;
import works.toon.codec.block.Statement.Entry;
import works.toon.codec.literal.ColumnType;
import works.toon.codec.literal.Literals;
import works.toon.exceptions.CellTypeException;
import works.toon.exceptions.SchemaMismatchException;
import works.toon.exceptions.ToonException;
import works.toon.exceptions.ToonSyntaxException;
import works.toon.value.ListValue;
import works.toon.value.MapValue;
import works.toon.value.NullValue;
import works.toon.value.Value;

import static java.lang.Math.min;

/**
 * Rebuilds a {@link Value} tree by recursive descent over indentation depth.
 * <p>
 * Each block reads lines at its own depth until it meets a shallower line or the end of input,
 * and pushes that line back for its caller.
 * A deeper line where none is expected is a syntax error.
 */
public class BlockDecoder implements Decoder {
	private final Settings settings;

	public BlockDecoder(Settings settings) {
		this.settings = settings;
	}

	@Override
	public Value decode(LineSource lines) {
		LOGGER.debug("Decoding TOON document from {}", lines.getClass().getSimpleName());
		return new Session(lines, settings.maxDepth()).decodeDocument();
	}

	/**
	 * A single decoding operation, consuming lines from a given {@link LineSource}.
	 */
	static final class Session {
		final LineSource lines;
		final int maxDepth;

		Session(LineSource lines, int maxDepth) {
			this.lines = lines;
			this.maxDepth = maxDepth;
		}

		Value decodeDocument() {
			Line first = lines.next();
			if (first == null) {
				// What an empty root map encodes to
				return MapValue.EMPTY;
			} else if (first.depth() != 0) {
				throw new ToonSyntaxException(first.number(), "Unexpected indentation at start of document");
			}
			Statement statement = LineParser.parse(first.content(), first.number());
			if (statement instanceof Entry entry && entry.key() != null) {
				lines.pushback(first);
				return decodeMap(0);
			}
			Value result;
			if (statement instanceof Entry entry) {
				result = decodeRootArray(entry, first);
			} else {
				result = Literals.parse(first.content(), first.number());
			}
			Line extra = lines.next();
			if (extra != null) {
				throw new ToonSyntaxException(extra.number(), (extra.depth() == 0)
					? "Unexpected content after root value"
					: "Unexpected indentation");
			}
			return result;
		}

		/**
		 * A root table owns the whole document, so its rows may also sit at depth zero
		 * beneath an unindented header.
		 */
		private ListValue decodeRootArray(Entry entry, Line headerLine) {
			if (entry.header().isTable() && entry.rest().isEmpty()) {
				Line next = lines.peek();
				if (next != null && next.depth() == 0) {
					LOGGER.debug("Root table rows are unindented, from line {}", next.number());
					return decodeTable(entry.header(), 0, headerLine);
				}
			}
			return decodeArray(entry.header(), entry.rest(), headerLine);
		}

		/**
		 * Reads consecutive entry lines at {@code depth}.
		 */
		MapValue decodeMap(int depth) {
			MapValue.Builder builder = MapValue.builder();
			Line line;
			while ((line = lines.next()) != null) {
				if (line.depth() < depth) {
					lines.pushback(line);
					break;
				} else if (line.depth() > depth) {
					throw unexpectedIndentation(line);
				}
				checkDepth(depth, line);
				Statement statement = LineParser.parse(line.content(), line.number());
				if (!(statement instanceof Entry)) {
					throw new ToonSyntaxException(line.number(), "Expected 'key: value' but found '" + line.content() + "'");
				}
				Entry entry = (Entry) statement;
				if (entry.key() == null) {
					throw new ToonSyntaxException(line.number(), "Array header without a key inside a map: " + line.content());
				} else if (builder.containsKey(entry.key())) {
					throw new ToonSyntaxException(line.number(), "Duplicate key '" + entry.key() + "'");
				}
				builder.put(entry.key(), decodeEntryValue(entry, line));
			}
			return builder.build();
		}

		private Value decodeEntryValue(Entry entry, Line line) {
			if (entry.header() != null) {
				return decodeArray(entry.header(), entry.rest(), line);
			} else if (entry.rest().isEmpty()) {
				return decodeNested(line.depth() + 1);
			} else {
				return decodeInline(entry.rest(), line);
			}
		}

		/**
		 * The block that follows a bare {@code key:} or {@code -}.
		 * If nothing is indented beneath it, that's an empty map.
		 */
		private MapValue decodeNested(int depth) {
			Line next = lines.peek();
			if (next == null || next.depth() < depth) {
				return MapValue.EMPTY;
			} else {
				return decodeMap(depth);
			}
		}

		/**
		 * A value written on the same line as its key.
		 * Besides scalars, this accepts the inline array forms {@code []} and {@code [n]: v1, v2}.
		 */
		private Value decodeInline(String rest, Line line) {
			if (rest.equals("[]")) {
				return ListValue.EMPTY;
			} else if (rest.charAt(0) == '[') {
				Entry entry = (Entry) LineParser.parse(rest, line.number());
				return decodeArray(entry.header(), entry.rest(), line);
			} else {
				return Literals.parse(rest, line.number());
			}
		}

		/**
		 * @param headerLine the line holding {@code header}; its elements, if any, are one level deeper
		 */
		private ListValue decodeArray(ArrayHeader header, String rest, Line headerLine) {
			int childDepth = headerLine.depth() + 1;
			checkDepth(childDepth, headerLine);
			if (header.isTable()) {
				if (!rest.isEmpty()) {
					throw new ToonSyntaxException(headerLine.number(), "Unexpected content after table header: " + rest);
				}
				return decodeTable(header, childDepth, headerLine);
			} else if (!rest.isEmpty()) {
				return decodeFlat(header.length(), rest, headerLine);
			} else {
				return decodeBulleted(header.length(), childDepth, headerLine);
			}
		}

		/**
		 * Reads exactly {@code header.length()} rows.
		 * Column types come from the first row;
		 * a column whose first cell is {@code null} takes its type from its first non-null cell.
		 */
		private ListValue decodeTable(ArrayHeader header, int childDepth, Line headerLine) {
			List<String> columns = header.columns();
			Set<String> seen = new HashSet<>();
			for (String column : columns) {
				if (!seen.add(column)) {
					throw new SchemaMismatchException(headerLine.number(), "Duplicate column '" + column + "'");
				}
			}
			int expectedRows = header.length();
			ColumnType[] types = new ColumnType[columns.size()];
			List<Value> rows = new ArrayList<>(min(expectedRows, 1024));
			for (int r = 0; r < expectedRows; r++) {
				Line line = lines.next();
				if (line == null || line.depth() < childDepth) {
					if (line != null) {
						lines.pushback(line);
					}
					throw new SchemaMismatchException(headerLine.number(),
						"Table declares " + expectedRows + " rows but has " + r);
				} else if (line.depth() > childDepth) {
					throw unexpectedIndentation(line);
				}
				List<String> cells = Literals.split(line.content(), line.number());
				if (cells.size() != columns.size()) {
					throw new SchemaMismatchException(line.number(),
						"Expected " + columns.size() + " cells but found " + cells.size());
				}
				MapValue.Builder row = MapValue.builder();
				for (int c = 0; c < types.length; c++) {
					String cell = cells.get(c);
					if (types[c] == null) {
						types[c] = ColumnType.infer(cell);
						if (types[c] != null) {
							LOGGER.trace("Column '{}' is {}, from line {}", columns.get(c), types[c], line.number());
						}
					}
					row.put(columns.get(c), convertCell(types[c], cell, columns.get(c), line));
				}
				rows.add(row.build());
			}
			Line extra = lines.peek();
			if (extra != null && extra.depth() == childDepth) {
				throw new SchemaMismatchException(extra.number(),
					"Table declares " + expectedRows + " rows but has more");
			} else if (extra != null && extra.depth() > childDepth) {
				throw unexpectedIndentation(extra);
			}
			return new ListValue(rows);
		}

		private static Value convertCell(ColumnType type, String cell, String column, Line line) {
			if (type == null) {
				return NullValue.NULL;
			}
			try {
				return type.convert(cell, line.number());
			} catch (CellTypeException e) {
				throw ToonException.wrap(e, "Column '" + column + "'");
			}
		}

		private ListValue decodeFlat(int expectedLength, String rest, Line line) {
			List<String> tokens = Literals.split(rest, line.number());
			if (tokens.size() != expectedLength) {
				throw new SchemaMismatchException(line.number(),
					"Inline list declares " + expectedLength + " values but has " + tokens.size());
			}
			List<Value> values = new ArrayList<>(tokens.size());
			for (String token : tokens) {
				values.add(Literals.parse(token, line.number()));
			}
			return new ListValue(values);
		}

		private ListValue decodeBulleted(int expectedLength, int childDepth, Line headerLine) {
			List<Value> elements = new ArrayList<>(min(expectedLength, 1024));
			Line line;
			while ((line = lines.next()) != null) {
				if (line.depth() < childDepth) {
					lines.pushback(line);
					break;
				} else if (line.depth() > childDepth) {
					throw unexpectedIndentation(line);
				}
				String content = line.content();
				if (!content.equals("-") && !content.startsWith("- ")) {
					throw new ToonSyntaxException(line.number(), "Expected list element starting with '- ' but found '" + content + "'");
				} else if (elements.size() == expectedLength) {
					throw new SchemaMismatchException(line.number(),
						"List declares " + expectedLength + " elements but has more");
				}
				elements.add(decodeListElement(line));
			}
			if (elements.size() != expectedLength) {
				throw new SchemaMismatchException(headerLine.number(),
					"List declares " + expectedLength + " elements but has " + elements.size());
			}
			return new ListValue(elements);
		}

		/**
		 * Whatever follows the bullet is read as though it were a line of its own, one level deeper,
		 * so a map element's remaining entries line up beneath its first one.
		 */
		private Value decodeListElement(Line line) {
			String rest = line.content().substring(1).strip();
			int elementDepth = line.depth() + 1;
			checkDepth(elementDepth, line);
			if (rest.isEmpty()) {
				return decodeNested(elementDepth);
			}
			Statement statement = LineParser.parse(rest, line.number());
			if (statement instanceof Entry entry) {
				Line virtual = line.withContent(rest, elementDepth);
				if (entry.key() != null) {
					lines.pushback(virtual);
					return decodeMap(elementDepth);
				} else {
					return decodeArray(entry.header(), entry.rest(), virtual);
				}
			} else {
				return Literals.parse(rest, line.number());
			}
		}

		private void checkDepth(int depth, Line line) {
			if (depth > maxDepth) {
				throw new ToonSyntaxException(line.number(), "Nesting deeper than " + maxDepth + " levels");
			}
		}

		private static ToonSyntaxException unexpectedIndentation(Line line) {
			return new ToonSyntaxException(line.number(), "Unexpected indentation");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BlockDecoder.class);
}
