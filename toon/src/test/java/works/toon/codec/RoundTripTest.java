package works.toon.codec;

import java.util.Random;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.Parameter;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.toon.value.IntValue;
import works.toon.value.ListValue;
import works.toon.value.MapValue;
import works.toon.value.StringValue;
import works.toon.value.Value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.toon.TestUtils.ONE_OF_EACH;
import static works.toon.TestUtils.fromJson;
import static works.toon.TestUtils.randomValue;

@ParameterizedClass
@MethodSource("settings")
class RoundTripTest {
	@Parameter
	Settings settings;

	static Stream<Settings> settings() {
		return Stream.of(
			Settings.DEFAULT,
			Settings.DEFAULT.withIndentWidth(4),
			Settings.DEFAULT.withInlineListWidth(0)
		);
	}

	@Test
	void oneOfEach() {
		assertRoundTrip(fromJson(ONE_OF_EACH));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{}",
		"[]",
		"[[]]",
		"[{}]",
		"[[[1]]]",
		"\"\"",
		"\"- \"",
		"\"# not a comment\"",
		"{\"\": {\"\": [\"\"]}}",
		"{\"k\": [{\"a\": 1}, {\"a\": 2.0}]}",
		"{\"k\": [{\"a\": [1]}, {\"a\": {}}]}",
		"{\"k\": [{\"a\": null}, {\"a\": null}]}",
		"[{\"t\": [{\"x\": 1}]}, {\"t\": []}]",
		"{\"k\": [\"a, b\", \" c \", \"-\", \"null\", \"#\"]}",
	})
	void awkwardShapes(String json) {
		assertRoundTrip(fromJson(json));
	}

	@Test
	void escapedStrings() {
		assertRoundTrip(MapValue.builder()
			.put("quote", new StringValue("He said, \"hi\""))
			.put("control", new StringValue("\u0000\u0007\u001f\u007f\n\r\t"))
			.put("unicode", new StringValue("😎 é \u2028"))
			.put("key\nwith\tcontrols", IntValue.of(1))
			.build());
	}

	@ParameterizedTest
	@MethodSource("seeds")
	void random(long seed) {
		Random random = new Random(seed);
		assertRoundTrip(randomValue(random, 4));
	}

	static LongStream seeds() {
		return LongStream.range(0, 200);
	}

	@Test
	void deepNesting() {
		Value value = IntValue.of(1);
		for (int i = 0; i < 50; i++) {
			value = (i % 2 == 0)
				? MapValue.builder().put("k" + i, value).build()
				: ListValue.of(value, IntValue.of(i));
		}
		assertRoundTrip(value);
	}

	void assertRoundTrip(Value value) {
		Codec codec = CodecBuilder.using(settings).build();
		String text = codec.encoder().encode(value);
		assertEquals(value, codec.decoder().decode(text), () -> "Text was:\n" + text);
		assertEquals(text, codec.encoder().encode(codec.decoder().decode(text)), "Encoding is deterministic");
	}
}
