/**
 * The codec engine: {@link works.toon.codec.block.BlockEncoder} and {@link works.toon.codec.block.BlockDecoder},
 * which map between {@link works.toon.value.Value} trees and indented blocks of text.
 * The choice of how to write each list is made up front by {@link works.toon.codec.block.ListShape}.
 */
package works.toon.codec.block;
