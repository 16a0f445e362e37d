package works.toon.codec;

import java.io.StringWriter;
import java.io.Writer;
import works.toon.value.Value;

/**
 * Emits TOON text corresponding to a {@link Value} tree.
 * Output is a pure function of the tree: equal trees produce identical text.
 */
public interface Encoder {
	/**
	 * @throws IllegalStateException if {@code out} throws {@link java.io.IOException}
	 */
	void encode(Writer out, Value value);

	default String encode(Value value) {
		StringWriter sw = new StringWriter();
		encode(sw, value);
		return sw.toString();
	}
}
