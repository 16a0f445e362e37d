package works.toon.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SettingsTest {

	@Test
	void defaults() {
		assertEquals(new Settings(2, Integer.MAX_VALUE, 1000), Settings.DEFAULT);
	}

	@Test
	void withers() {
		Settings s = Settings.DEFAULT
			.withIndentWidth(3)
			.withInlineListWidth(80)
			.withMaxDepth(10);
		assertEquals(new Settings(3, 80, 10), s);
	}

	@Test
	void invalid_throws() {
		assertThrows(IllegalArgumentException.class, () -> Settings.DEFAULT.withIndentWidth(0));
		assertThrows(IllegalArgumentException.class, () -> Settings.DEFAULT.withInlineListWidth(-1));
		assertThrows(IllegalArgumentException.class, () -> Settings.DEFAULT.withMaxDepth(0));
	}

	@Test
	void builtCodecUsesSettings() {
		Codec codec = CodecBuilder.using(Settings.DEFAULT.withIndentWidth(3)).build();
		assertEquals("a:\n   b: 1", codec.encoder().encode(codec.decoder().decode("a:\n  b: 1")));
	}
}
