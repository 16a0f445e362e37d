package works.toon.value;

/**
 * An immutable node of a TOON document tree.
 * <p>
 * Both directions of the codec speak this model:
 * the {@link works.toon.codec.Encoder Encoder} walks it,
 * and the {@link works.toon.codec.Decoder Decoder} builds it.
 * Values have no identity beyond structural equality.
 */
public sealed interface Value permits
	NullValue,
	BoolValue,
	IntValue,
	FloatValue,
	StringValue,
	ListValue,
	MapValue
{
	/**
	 * @return true for everything except {@link ListValue} and {@link MapValue}
	 */
	default boolean isScalar() {
		return !(this instanceof ListValue || this instanceof MapValue);
	}

	static Value of(boolean value) {
		return BoolValue.of(value);
	}

	static Value of(long value) {
		return IntValue.of(value);
	}

	static Value of(double value) {
		return new FloatValue(value);
	}

	/**
	 * @return {@link NullValue#NULL} if {@code value} is null
	 */
	static Value of(String value) {
		return (value == null) ? NullValue.NULL : new StringValue(value);
	}
}
