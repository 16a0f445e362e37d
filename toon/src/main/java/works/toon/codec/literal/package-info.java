/**
 * The scalar lexical grammar shared by the encoder and decoder:
 * literal classification, quoting and escaping, cell splitting,
 * and the per-column converters used for tables.
 */
package works.toon.codec.literal;
