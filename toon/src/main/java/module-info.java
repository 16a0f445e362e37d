/**
 * TOON, the Token Oriented Object Notation: a compact, line-oriented encoding of JSON-like data.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.toon.value}, the immutable document tree;
 *     </li>
 *     <li>
 *         {@link works.toon.codec}, whose {@link works.toon.codec.CodecBuilder CodecBuilder}
 *         produces encoders and decoders; and
 *     </li>
 *     <li>
 *         {@link works.toon.exceptions}, describing what can go wrong.
 *     </li>
 * </ul>
 */
module works.toon {
	requires org.slf4j;

	exports works.toon.codec;
	exports works.toon.codec.block;
	exports works.toon.codec.io;
	exports works.toon.codec.literal;
	exports works.toon.exceptions;
	exports works.toon.value;
}
