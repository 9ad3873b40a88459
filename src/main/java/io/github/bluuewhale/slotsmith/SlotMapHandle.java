package io.github.bluuewhale.slotsmith;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Pointer-like reference to one value of a {@link SlotMap}.
 *
 * <p>Holds the map and a key, never the value itself: every access resolves the key again,
 * so the handle follows the value across growth and swap-removes of other values.
 */
public final class SlotMapHandle<V> {

	private final SlotMap<V> map; // null when unbound
	private final SlotMapKey key;

	private SlotMapHandle(SlotMap<V> map, SlotMapKey key) {
		this.map = map;
		this.key = Objects.requireNonNull(key, "key");
	}

	/**
	 * @param map owning map, or {@code null} for a handle that is not bound to any map
	 */
	public static <V> SlotMapHandle<V> of(SlotMap<V> map, SlotMapKey key) {
		return new SlotMapHandle<>(map, key);
	}

	public static <V> SlotMapHandle<V> unbound(SlotMapKey key) {
		return new SlotMapHandle<>(null, key);
	}

	/**
	 * @throws NullPointerException if the handle is not bound to a map
	 * @throws NoSuchElementException if the key no longer identifies a live value
	 */
	public V get() {
		return boundMap().get(key);
	}

	/**
	 * Replaces the referenced value.
	 *
	 * @return the previous value
	 * @throws NullPointerException if the handle is not bound to a map
	 * @throws NoSuchElementException if the key no longer identifies a live value
	 */
	public V set(V value) {
		return boundMap().replace(key, value);
	}

	public Optional<V> tryGet() {
		return (map == null) ? Optional.empty() : map.tryGet(key);
	}

	public boolean isBound() {
		return map != null;
	}

	public boolean isValid() {
		return map != null && map.contains(key);
	}

	public SlotMapKey key() {
		return key;
	}

	private SlotMap<V> boundMap() {
		if (map == null) throw new NullPointerException("Handle is not bound to a slot map");
		return map;
	}

	/* Identity of the map, value equality of the key. */
	@Override
	public boolean equals(Object o) {
		if (o == this) return true;
		if (!(o instanceof SlotMapHandle<?> other)) return false;
		return map == other.map && key.equals(other.key);
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(map) + key.hashCode();
	}

	@Override
	public String toString() {
		return "SlotMapHandle[" + key + (map == null ? ", unbound]" : "]");
	}
}
