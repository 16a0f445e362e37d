package works.toon.codec;

import works.toon.codec.block.BlockDecoder;
import works.toon.codec.block.BlockEncoder;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Codec} according to the user's instructions.
 */
public class CodecBuilder {
	private final Settings settings;

	private CodecBuilder(Settings settings) {
		this.settings = requireNonNull(settings);
	}

	public static CodecBuilder using(Settings settings) {
		return new CodecBuilder(settings);
	}

	public Codec build() {
		Encoder encoder = new BlockEncoder(settings);
		Decoder decoder = new BlockDecoder(settings);
		return new Codec() {
			@Override
			public Encoder encoder() {
				return encoder;
			}

			@Override
			public Decoder decoder() {
				return decoder;
			}

			@Override
			public String toString() {
				return "Codec(" + settings + ")";
			}
		};
	}
}
