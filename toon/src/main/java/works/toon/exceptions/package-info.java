/**
 * Exceptions thrown by the TOON codec.
 * {@link works.toon.exceptions.ToonFormatException} and its subtypes indicate bad input text;
 * {@link works.toon.exceptions.EncodingInvariantException} indicates a bug in the encoder.
 */
package works.toon.exceptions;
