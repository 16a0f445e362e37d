package works.toon.value;

import static java.util.Objects.requireNonNull;

public record StringValue(String value) implements Value {
	public StringValue {
		requireNonNull(value);
	}

	@Override
	public String toString() {
		return value;
	}
}
