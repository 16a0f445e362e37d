package works.toon.value;

public record BoolValue(boolean value) implements Value {
	public static final BoolValue TRUE = new BoolValue(true);
	public static final BoolValue FALSE = new BoolValue(false);

	public static BoolValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
