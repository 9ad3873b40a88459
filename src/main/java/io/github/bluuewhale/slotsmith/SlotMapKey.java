package io.github.bluuewhale.slotsmith;

/**
 * Opaque handle to a value stored in a {@link SlotMap}.
 *
 * <p>{@code index} names a slot; {@code generation} must equal that slot's current generation
 * for the key to resolve. Keys are plain values: copy, store, compare and hash them freely.
 * A key is only meaningful against the map that issued it.
 */
public record SlotMapKey(int index, int generation) implements Comparable<SlotMapKey> {

	/** Default key; never returned by {@link SlotMap#insert}. */
	public static final SlotMapKey INVALID = new SlotMapKey(-1, 0);

	public boolean isValid() {
		return index >= 0;
	}

	@Override
	public int compareTo(SlotMapKey other) {
		int c = Integer.compare(index, other.index);
		return (c != 0) ? c : Integer.compare(generation, other.generation);
	}

	@Override
	public int hashCode() {
		return Hashing.keyHash(index, generation);
	}
}
