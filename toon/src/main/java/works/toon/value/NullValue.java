package works.toon.value;

public enum NullValue implements Value {
	NULL;

	@Override
	public String toString() {
		return "null";
	}
}
