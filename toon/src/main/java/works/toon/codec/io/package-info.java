/**
 * Implementations of {@link works.toon.codec.LineSource},
 * the lazy line cursor that feeds the decoder.
 * Not really meant to be used directly;
 * use the factory methods on {@link works.toon.codec.LineSource} instead.
 */
package works.toon.codec.io;
