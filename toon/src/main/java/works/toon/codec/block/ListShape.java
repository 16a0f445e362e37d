package works.toon.codec.block;

import java.util.Iterator;
import java.util.List;
import works.toon.codec.literal.ScalarKind;
import works.toon.value.BoolValue;
import works.toon.value.FloatValue;
import works.toon.value.IntValue;
import works.toon.value.ListValue;
import works.toon.value.MapValue;
import works.toon.value.NullValue;
import works.toon.value.StringValue;
import works.toon.value.Value;

/**
 * The form in which the encoder writes a list.
 * <p>
 * {@link #of} is a pure function of the list's contents,
 * recomputed every time a list is encoded, and independent of any writer.
 */
public enum ListShape {
	/**
	 * A header naming the columns, then one comma-separated row per element.
	 */
	TABULAR,

	/**
	 * All elements on one line, comma-separated.
	 */
	FLAT_SCALAR,

	/**
	 * One element per line, each introduced by {@code - }.
	 */
	BULLETED;

	/**
	 * Priority order: a table if {@link #isUniform uniform} with {@link #hasConsistentColumns consistent columns};
	 * otherwise flat if every element is a scalar (including the empty list);
	 * otherwise bulleted.
	 */
	public static ListShape of(ListValue list) {
		if (isUniform(list) && hasConsistentColumns(list)) {
			return TABULAR;
		} else if (list.elements().stream().allMatch(Value::isScalar)) {
			return FLAT_SCALAR;
		} else {
			return BULLETED;
		}
	}

	/**
	 * The structural test for tabular eligibility:
	 * the list is non-empty, every element is a map,
	 * all maps have the same non-empty keys in the same order,
	 * and every value in every map is a scalar.
	 */
	public static boolean isUniform(ListValue list) {
		if (list.isEmpty() || !(list.get(0) instanceof MapValue first) || first.isEmpty()) {
			return false;
		}
		List<String> columns = first.keys();
		for (Value element : list.elements()) {
			if (!(element instanceof MapValue row) || !hasKeys(row, columns)) {
				return false;
			}
			for (Value cell : row.entries().values()) {
				if (!cell.isScalar()) {
					return false;
				}
			}
		}
		return true;
	}

	/**
	 * The decoder gives each column one type, taken from the first row that has a non-null cell there,
	 * and rejects cells of any other type.
	 * So a uniform list can only be written as a table if, in every column,
	 * all the non-null cells are of the same {@link ScalarKind}.
	 *
	 * @param list must be {@link #isUniform uniform}
	 */
	public static boolean hasConsistentColumns(ListValue list) {
		MapValue first = (MapValue) list.get(0);
		for (String column : first.entries().keySet()) {
			ScalarKind columnKind = null;
			for (Value element : list.elements()) {
				ScalarKind cellKind = kindOf(((MapValue) element).get(column));
				if (cellKind == ScalarKind.NULL) {
					continue;
				} else if (columnKind == null) {
					columnKind = cellKind;
				} else if (columnKind != cellKind) {
					return false;
				}
			}
		}
		return true;
	}

	static boolean hasKeys(MapValue map, List<String> keys) {
		if (map.size() != keys.size()) {
			return false;
		}
		Iterator<String> expected = keys.iterator();
		for (String key : map.entries().keySet()) {
			if (!key.equals(expected.next())) {
				return false;
			}
		}
		return true;
	}

	static ScalarKind kindOf(Value scalar) {
		if (scalar instanceof NullValue) {
			return ScalarKind.NULL;
		} else if (scalar instanceof BoolValue) {
			return ScalarKind.BOOL;
		} else if (scalar instanceof IntValue) {
			return ScalarKind.INT;
		} else if (scalar instanceof FloatValue) {
			return ScalarKind.FLOAT;
		} else if (scalar instanceof StringValue) {
			return ScalarKind.STRING;
		} else {
			throw new IllegalArgumentException("Not a scalar: " + scalar.getClass().getSimpleName());
		}
	}
}
