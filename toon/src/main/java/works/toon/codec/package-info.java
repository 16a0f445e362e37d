/**
 * Reading and writing TOON text.
 * Start with {@link works.toon.codec.CodecBuilder};
 * the decoder's input is a {@link works.toon.codec.LineSource}.
 */
package works.toon.codec;
