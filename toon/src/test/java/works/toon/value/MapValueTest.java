package works.toon.value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MapValueTest {

	@Test
	void keyOrderMatters() {
		MapValue ab = MapValue.builder().put("a", Value.of(1)).put("b", Value.of(2)).build();
		MapValue ba = MapValue.builder().put("b", Value.of(2)).put("a", Value.of(1)).build();
		assertNotEquals(ab, ba);
		assertEquals(ab.entries(), ba.entries(), "Same entries, different order");
		assertEquals(List.of("a", "b"), ab.keys());
		assertEquals(ab, MapValue.builder().put("a", Value.of(1)).put("b", Value.of(2)).build());
	}

	@Test
	void copiesItsInput() {
		Map<String, Value> source = new LinkedHashMap<>();
		source.put("a", NullValue.NULL);
		MapValue map = new MapValue(source);
		source.put("b", NullValue.NULL);
		assertEquals(1, map.size());
		assertThrows(UnsupportedOperationException.class, () -> map.entries().put("c", NullValue.NULL));
	}

	@Test
	void absentIsNotNull() {
		MapValue map = MapValue.builder().put("a", NullValue.NULL).build();
		assertEquals(NullValue.NULL, map.get("a"));
		assertNull(map.get("b"));
	}

	@Test
	void duplicateKey_throws() {
		MapValue.Builder builder = MapValue.builder().put("a", Value.of(1));
		assertThrows(IllegalArgumentException.class, () -> builder.put("a", Value.of(2)));
	}

	@Test
	void nulls_throw() {
		assertThrows(NullPointerException.class, () -> MapValue.builder().put(null, NullValue.NULL));
		assertThrows(NullPointerException.class, () -> MapValue.builder().put("a", null));
	}

	@Test
	void scalarsAreChecked() {
		assertThrows(IllegalArgumentException.class, () -> new FloatValue(Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> new FloatValue(Double.POSITIVE_INFINITY));
		assertEquals(NullValue.NULL, Value.of((String) null));
		assertNotEquals(new FloatValue(0.0), new FloatValue(-0.0));
	}
}
