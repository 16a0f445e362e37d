package works.toon.codec.block;

import org.junit.jupiter.api.Test;
import works.toon.value.ListValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.toon.TestUtils.fromJson;
import static works.toon.codec.block.ListShape.BULLETED;
import static works.toon.codec.block.ListShape.FLAT_SCALAR;
import static works.toon.codec.block.ListShape.TABULAR;

class ListShapeTest {

	@Test
	void tabular() {
		assertEquals(TABULAR, shapeOf("[{\"a\": 1, \"b\": \"x\"}, {\"a\": 2, \"b\": \"y\"}]"));
		assertEquals(TABULAR, shapeOf("[{\"a\": null}, {\"a\": true}, {\"a\": null}]"));
		assertEquals(TABULAR, shapeOf("[{\"a\": null}]"));
	}

	@Test
	void flat() {
		assertEquals(FLAT_SCALAR, shapeOf("[]"));
		assertEquals(FLAT_SCALAR, shapeOf("[1, \"two\", null, 4.5, false]"));
	}

	@Test
	void bulleted() {
		assertEquals(BULLETED, shapeOf("[[]]"));
		assertEquals(BULLETED, shapeOf("[{}]"));
		assertEquals(BULLETED, shapeOf("[{}, {}]"));
		assertEquals(BULLETED, shapeOf("[1, {\"a\": 1}]"));
		assertEquals(BULLETED, shapeOf("[{\"a\": 1}, {\"a\": 1, \"b\": 2}]"));
		assertEquals(BULLETED, shapeOf("[{\"a\": 1}, {\"b\": 1}]"));
		assertEquals(BULLETED, shapeOf("[{\"a\": 1, \"b\": 2}, {\"b\": 2, \"a\": 1}]"));
		assertEquals(BULLETED, shapeOf("[{\"a\": [1]}, {\"a\": [2]}]"));
		assertEquals(BULLETED, shapeOf("[{\"a\": 1}, {\"a\": 1.0}]"));
	}

	@Test
	void uniformButInconsistent() {
		ListValue list = (ListValue) fromJson("[{\"a\": 1}, {\"a\": \"1\"}]");
		assertTrue(ListShape.isUniform(list));
		assertFalse(ListShape.hasConsistentColumns(list));
	}

	private static ListShape shapeOf(String json) {
		return ListShape.of((ListValue) fromJson(json));
	}
}
