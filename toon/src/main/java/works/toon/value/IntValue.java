package works.toon.value;

import java.math.BigInteger;

import static java.util.Objects.requireNonNull;

/**
 * An integer of arbitrary magnitude.
 * Integers and floats are distinguished by literal shape, not by range,
 * so a value too large for a {@code long} is still an {@code IntValue}.
 */
public record IntValue(BigInteger value) implements Value {
	public IntValue {
		requireNonNull(value);
	}

	public static IntValue of(long value) {
		return new IntValue(BigInteger.valueOf(value));
	}

	/**
	 * @throws ArithmeticException if the value doesn't fit in a {@code long}
	 */
	public long longValue() {
		return value.longValueExact();
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
