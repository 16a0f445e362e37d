package works.toon.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An ordered map from string keys to values.
 * <p>
 * Key order is significant: it determines the order of emitted lines and table columns,
 * and it participates in {@link #equals}, unlike {@link Map#equals}.
 */
public record MapValue(Map<String, Value> entries) implements Value {
	public static final MapValue EMPTY = new MapValue(Map.of());

	/**
	 * @param entries is copied in its iteration order
	 */
	public MapValue {
		LinkedHashMap<String, Value> copy = new LinkedHashMap<>();
		entries.forEach((k, v) -> copy.put(requireNonNull(k), requireNonNull(v)));
		entries = Collections.unmodifiableMap(copy);
	}

	public static Builder builder() {
		return new Builder();
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/**
	 * @return the value for {@code key}, or Java null if absent
	 * (which is distinct from {@link NullValue#NULL})
	 */
	public Value get(String key) {
		return entries.get(key);
	}

	public List<String> keys() {
		return List.copyOf(entries.keySet());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof MapValue other) {
			return entries.equals(other.entries)
				&& new ArrayList<>(entries.keySet()).equals(new ArrayList<>(other.entries.keySet()));
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}

	public static final class Builder {
		private final LinkedHashMap<String, Value> entries = new LinkedHashMap<>();

		private Builder() { }

		/**
		 * @throws IllegalArgumentException if {@code key} is already present
		 */
		public Builder put(String key, Value value) {
			requireNonNull(key);
			requireNonNull(value);
			if (entries.putIfAbsent(key, value) != null) {
				throw new IllegalArgumentException("Duplicate key: " + key);
			}
			return this;
		}

		public boolean containsKey(String key) {
			return entries.containsKey(key);
		}

		public MapValue build() {
			return new MapValue(entries);
		}
	}
}
