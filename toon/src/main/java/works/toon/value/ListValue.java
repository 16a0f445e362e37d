package works.toon.value;

import java.util.Arrays;
import java.util.List;

public record ListValue(List<Value> elements) implements Value {
	public static final ListValue EMPTY = new ListValue(List.of());

	/**
	 * @throws NullPointerException if any element is null;
	 * use {@link NullValue#NULL} instead.
	 */
	public ListValue {
		elements = List.copyOf(elements);
	}

	public static ListValue of(Value... elements) {
		return new ListValue(Arrays.asList(elements));
	}

	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	public Value get(int index) {
		return elements.get(index);
	}

	@Override
	public String toString() {
		return elements.toString();
	}
}
