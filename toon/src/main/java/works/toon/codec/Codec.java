package works.toon.codec;

/**
 * A matched {@link Encoder} and {@link Decoder} built from the same {@link Settings}.
 * Accessible via {@link CodecBuilder}.
 * <p>
 * Both halves are stateless and may be shared between threads;
 * every call works on its own cursor and recursion stack.
 */
public interface Codec {
	Encoder encoder();
	Decoder decoder();
}
