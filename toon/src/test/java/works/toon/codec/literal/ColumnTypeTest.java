package works.toon.codec.literal;

import org.junit.jupiter.api.Test;
import works.toon.exceptions.CellTypeException;
import works.toon.value.BoolValue;
import works.toon.value.FloatValue;
import works.toon.value.IntValue;
import works.toon.value.NullValue;
import works.toon.value.StringValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.toon.codec.literal.ColumnType.BOOL;
import static works.toon.codec.literal.ColumnType.FLOAT;
import static works.toon.codec.literal.ColumnType.INT;
import static works.toon.codec.literal.ColumnType.STRING;

class ColumnTypeTest {

	@Test
	void infer() {
		assertEquals(INT, ColumnType.infer("12"));
		assertEquals(FLOAT, ColumnType.infer("1.2"));
		assertEquals(BOOL, ColumnType.infer("false"));
		assertEquals(STRING, ColumnType.infer("Alice"));
		assertEquals(STRING, ColumnType.infer("\"12\""));
		assertNull(ColumnType.infer("null"));
	}

	@Test
	void convert() {
		assertEquals(IntValue.of(12), INT.convert("12", 1));
		assertEquals(new FloatValue(1.2), FLOAT.convert("1.2", 1));
		assertEquals(BoolValue.TRUE, BOOL.convert("true", 1));
		assertEquals(new StringValue("12"), STRING.convert("12", 1));
		assertEquals(new StringValue("a,b"), STRING.convert("\"a,b\"", 1));
	}

	@Test
	void everyTypeAcceptsNull() {
		for (ColumnType type : ColumnType.values()) {
			assertEquals(NullValue.NULL, type.convert("null", 1), type::toString);
		}
	}

	@Test
	void mismatches_throw() {
		CellTypeException e = assertThrows(CellTypeException.class, () -> INT.convert("x", 5));
		assertEquals(5, e.lineNumber());
		assertEquals("Line 5: Expected INT cell but found 'x'", e.getMessage());

		assertThrows(CellTypeException.class, () -> INT.convert("1.0", 1));
		assertThrows(CellTypeException.class, () -> INT.convert("\"1\"", 1));
		assertThrows(CellTypeException.class, () -> FLOAT.convert("1", 1));
		assertThrows(CellTypeException.class, () -> BOOL.convert("yes", 1));
		assertThrows(CellTypeException.class, () -> BOOL.convert("\"true\"", 1));
	}
}
