package works.toon.value;

/**
 * A finite double-precision number.
 * <p>
 * NaN and the infinities have no TOON literal, so they are rejected here
 * rather than producing text that can't be read back.
 * <p>
 * Equality follows {@link Double#compare}, so {@code -0.0} and {@code 0.0} differ.
 */
public record FloatValue(double value) implements Value {
	public FloatValue {
		if (!Double.isFinite(value)) {
			throw new IllegalArgumentException("Float value must be finite: " + value);
		}
	}

	@Override
	public String toString() {
		return Double.toString(value);
	}
}
