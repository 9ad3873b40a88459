package io.github.bluuewhale.slotsmith;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dense slot map (null values NOT allowed).
 *
 * <p>Values live packed in {@code [0, size)} of a single array and are addressed by
 * {@link SlotMapKey}s, which stay valid until their value is erased or the map is cleared.
 * Lookups go through an indirection table of slots; erase is a swap-remove that moves the
 * last value into the hole and patches its slot through the back-map.
 *
 * <p>Slot layout (struct-of-arrays):
 * <ul>
 *   <li>{@code slotIndex[id]}: next free slot id while free (the tail points at itself),
 *       dense position of the owned value while occupied.</li>
 *   <li>{@code slotGeneration[id]}: bumped on every erase and on clear, never reset.</li>
 *   <li>{@code backMap[pos]}: slot id owning dense position {@code pos}.</li>
 * </ul>
 *
 * <p>Not thread-safe. The dense position of a value is only stable until the next
 * insert, erase or clear.
 */
public final class SlotMap<V> implements Iterable<V> {

	private static final Logger LOGGER = LoggerFactory.getLogger(SlotMap.class);

	/* Defaults */
	public static final int DEFAULT_CAPACITY = 8;
	static final int MAX_CAPACITY = 1 << 30;

	/* Free-list sentinel and "not found" marker */
	private static final int NONE = -1;

	private static final int[] EMPTY_INTS = new int[0];
	private static final Object[] EMPTY_VALUES = new Object[0];

	/* Slot table */
	private int[] slotIndex;
	private int[] slotGeneration;
	private int firstFree;
	private int lastFree;

	/* Dense store */
	private Object[] values;
	private int[] backMap;
	private int size;
	private int capacity;

	public SlotMap() {
		this(DEFAULT_CAPACITY);
	}

	public SlotMap(int initialCapacity) {
		if (initialCapacity < 0 || initialCapacity > MAX_CAPACITY) {
			throw new IllegalArgumentException("initialCapacity must be in [0, " + MAX_CAPACITY + "]: " + initialCapacity);
		}
		int cap = Math.max(1, initialCapacity);
		this.slotIndex = new int[cap];
		this.slotGeneration = new int[cap];
		this.values = new Object[cap];
		this.backMap = new int[cap];
		this.capacity = cap;
		linkFreeRun(0, cap);
	}

	private SlotMap(int[] slotIndex, int[] slotGeneration, Object[] values, int[] backMap,
			int firstFree, int lastFree, int size) {
		this.slotIndex = slotIndex;
		this.slotGeneration = slotGeneration;
		this.values = values;
		this.backMap = backMap;
		this.firstFree = firstFree;
		this.lastFree = lastFree;
		this.size = size;
		this.capacity = slotIndex.length;
	}

	/**
	 * Shallow copy: the new map holds the same value references under the same keys.
	 */
	public static <V> SlotMap<V> copyOf(SlotMap<V> source) {
		return copyOf(source, UnaryOperator.identity());
	}

	/**
	 * Copies {@code source}, passing every value through {@code valueCopier}.
	 * Keys issued by {@code source} resolve to the corresponding copies in the result.
	 */
	public static <V> SlotMap<V> copyOf(SlotMap<V> source, UnaryOperator<V> valueCopier) {
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(valueCopier, "valueCopier");
		Object[] copiedValues = new Object[source.capacity];
		for (int i = 0; i < source.size; i++) {
			V v = valueCopier.apply(source.castValue(source.values[i]));
			if (v == null) throw new NullPointerException("valueCopier returned null");
			copiedValues[i] = v;
		}
		SlotMap<V> copy = new SlotMap<>(
			source.slotIndex.clone(),
			source.slotGeneration.clone(),
			copiedValues,
			source.backMap.clone(),
			source.firstFree,
			source.lastFree,
			source.size);
		LOGGER.trace("Copied slot map (size={}, capacity={})", copy.size, copy.capacity);
		return copy;
	}

	/**
	 * Transfers all storage of {@code source} into a new map. Keys issued by {@code source}
	 * belong to the returned map afterwards; {@code source} is left empty with zero capacity
	 * and grows again on its next insert.
	 */
	public static <V> SlotMap<V> moveFrom(SlotMap<V> source) {
		Objects.requireNonNull(source, "source");
		SlotMap<V> moved = new SlotMap<>(
			source.slotIndex,
			source.slotGeneration,
			source.values,
			source.backMap,
			source.firstFree,
			source.lastFree,
			source.size);
		source.resetToEmpty();
		LOGGER.trace("Moved slot map (size={}, capacity={})", moved.size, moved.capacity);
		return moved;
	}

	/* ------------ Key API ------------ */

	/**
	 * Stores {@code value} and returns the key that identifies it until it is erased
	 * or the map is cleared. Grows the map when it is full.
	 */
	public SlotMapKey insert(V value) {
		if (value == null) throw new NullPointerException("Null values not supported");
		if (size == capacity) grow();

		int pos = size;
		int id = acquireSlot();
		values[pos] = value;
		slotIndex[id] = pos;
		backMap[pos] = id;
		size++;
		return new SlotMapKey(id, slotGeneration[id]);
	}

	/**
	 * Removes the value identified by {@code key}.
	 *
	 * @return {@code false} if the key does not identify a live value (nothing changes)
	 */
	public boolean erase(SlotMapKey key) {
		int pos = densePosition(key);
		if (pos == NONE) return false;
		removeAt(pos);
		return true;
	}

	/**
	 * @throws NoSuchElementException if the key does not identify a live value
	 */
	public V get(SlotMapKey key) {
		return castValue(values[checkedPosition(key)]);
	}

	public Optional<V> tryGet(SlotMapKey key) {
		int pos = densePosition(key);
		return (pos == NONE) ? Optional.empty() : Optional.of(castValue(values[pos]));
	}

	public boolean contains(SlotMapKey key) {
		return densePosition(key) != NONE;
	}

	/**
	 * Replaces the value identified by {@code key}, keeping the key valid.
	 *
	 * @return the previous value
	 * @throws NoSuchElementException if the key does not identify a live value
	 */
	public V replace(SlotMapKey key, V value) {
		if (value == null) throw new NullPointerException("Null values not supported");
		int pos = checkedPosition(key);
		V old = castValue(values[pos]);
		values[pos] = value;
		return old;
	}

	/**
	 * Drops every value. Every key issued so far becomes permanently invalid;
	 * capacity is kept.
	 */
	public void clear() {
		int cleared = size;
		Arrays.fill(values, 0, size, null);
		for (int id = 0; id < capacity; id++) {
			slotGeneration[id]++;
		}
		size = 0;
		if (capacity > 0) linkFreeRun(0, capacity);
		LOGGER.debug("Cleared {} values (capacity={})", cleared, capacity);
	}

	/* ------------ Dense (index) API ------------ */

	/**
	 * Direct access to dense position {@code index}; no key or generation check.
	 *
	 * @throws IndexOutOfBoundsException unless {@code 0 <= index < size()}
	 */
	public V at(int index) {
		Objects.checkIndex(index, size);
		return castValue(values[index]);
	}

	/**
	 * Overwrites the value at dense position {@code index}; its key stays valid.
	 *
	 * @return the previous value
	 */
	public V setAt(int index, V value) {
		Objects.checkIndex(index, size);
		if (value == null) throw new NullPointerException("Null values not supported");
		V old = castValue(values[index]);
		values[index] = value;
		return old;
	}

	/**
	 * Key currently owning dense position {@code index}.
	 */
	public SlotMapKey keyAt(int index) {
		Objects.checkIndex(index, size);
		int id = backMap[index];
		return new SlotMapKey(id, slotGeneration[id]);
	}

	/**
	 * Erases the value at dense position {@code index}. The last value moves into {@code index}.
	 *
	 * @return the removed value
	 */
	public V eraseAt(int index) {
		Objects.checkIndex(index, size);
		return removeAt(index);
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	public int capacity() {
		return capacity;
	}

	/* ------------ Bulk views ------------ */

	/**
	 * Iterates values in dense order. {@link Iterator#remove()} is supported.
	 */
	@Override
	public Iterator<V> iterator() {
		return new ValueIterator();
	}

	public void forEach(BiConsumer<? super SlotMapKey, ? super V> action) {
		Objects.requireNonNull(action, "action");
		for (int i = 0; i < size; i++) {
			int id = backMap[i];
			action.accept(new SlotMapKey(id, slotGeneration[id]), castValue(values[i]));
		}
	}

	/**
	 * Snapshot of the live keys in dense order.
	 */
	public List<SlotMapKey> keys() {
		List<SlotMapKey> out = new ArrayList<>(size);
		for (int i = 0; i < size; i++) {
			int id = backMap[i];
			out.add(new SlotMapKey(id, slotGeneration[id]));
		}
		return out;
	}

	public void replaceAll(UnaryOperator<V> function) {
		Objects.requireNonNull(function, "function");
		for (int i = 0; i < size; i++) {
			V next = function.apply(castValue(values[i]));
			if (next == null) throw new NullPointerException("replaceAll function returned null");
			values[i] = next;
		}
	}

	public Stream<V> stream() {
		return Arrays.stream(values, 0, size).map(this::castValue);
	}

	@Override
	public String toString() {
		if (size == 0) return "{}";
		StringBuilder sb = new StringBuilder();
		sb.append('{');
		for (int i = 0; i < size; i++) {
			if (i > 0) sb.append(',').append(' ');
			int id = backMap[i];
			Object v = values[i];
			sb.append(id).append('v').append(slotGeneration[id]);
			sb.append('=');
			sb.append(v == this ? "(this SlotMap)" : v);
		}
		return sb.append('}').toString();
	}

	/* ------------ Slot table / free list ------------ */

	/* Chains [from, to) into one free run and makes it the whole free list. */
	private void linkFreeRun(int from, int to) {
		int last = to - 1;
		for (int id = from; id < last; id++) {
			slotIndex[id] = id + 1;
		}
		slotIndex[last] = last;
		firstFree = from;
		lastFree = last;
	}

	private int acquireSlot() {
		int id = firstFree;
		int next = slotIndex[id];
		if (next == id) {
			firstFree = NONE;
			lastFree = NONE;
		} else {
			firstFree = next;
		}
		return id;
	}

	/* Appends at the tail so a freed slot is reused as late as possible. */
	private void releaseSlot(int id) {
		slotGeneration[id]++;
		slotIndex[id] = id;
		if (lastFree == NONE) {
			firstFree = id;
		} else {
			slotIndex[lastFree] = id;
		}
		lastFree = id;
	}

	/* ------------ Dense store ------------ */

	private V removeAt(int pos) {
		int id = backMap[pos];
		V old = castValue(values[pos]);
		int last = size - 1;
		if (pos != last) {
			int movedId = backMap[last];
			values[pos] = values[last];
			backMap[pos] = movedId;
			slotIndex[movedId] = pos;
		}
		values[last] = null;
		releaseSlot(id);
		size--;
		return old;
	}

	/*
	 * Dense position of a live key, or NONE. A slot is occupied iff its index points at a
	 * live position whose back-map entry points back at the slot.
	 */
	private int densePosition(SlotMapKey key) {
		Objects.requireNonNull(key, "key");
		int id = key.index();
		if (id < 0 || id >= capacity) return NONE;
		if (slotGeneration[id] != key.generation()) return NONE;
		int pos = slotIndex[id];
		return (pos < size && backMap[pos] == id) ? pos : NONE;
	}

	private int checkedPosition(SlotMapKey key) {
		int pos = densePosition(key);
		if (pos == NONE) throw new NoSuchElementException("Invalid key: " + key);
		return pos;
	}

	/* ------------ Growth ------------ */

	private void grow() {
		int oldCapacity = capacity;
		if (oldCapacity >= MAX_CAPACITY) {
			throw new IllegalStateException("SlotMap cannot grow beyond " + MAX_CAPACITY + " slots");
		}
		// precondition: size == capacity, so the free list is empty and the new run becomes all of it
		assert firstFree == NONE && lastFree == NONE;
		int newCapacity = (oldCapacity == 0)
			? DEFAULT_CAPACITY
			: (int) Math.min((long) oldCapacity << 1, MAX_CAPACITY);

		slotIndex = Arrays.copyOf(slotIndex, newCapacity);
		slotGeneration = Arrays.copyOf(slotGeneration, newCapacity);
		values = Arrays.copyOf(values, newCapacity);
		backMap = Arrays.copyOf(backMap, newCapacity);
		capacity = newCapacity;
		linkFreeRun(oldCapacity, newCapacity);

		LOGGER.debug("Grew slot map from {} to {} slots (size={})", oldCapacity, newCapacity, size);
	}

	private void resetToEmpty() {
		slotIndex = EMPTY_INTS;
		slotGeneration = EMPTY_INTS;
		values = EMPTY_VALUES;
		backMap = EMPTY_INTS;
		firstFree = NONE;
		lastFree = NONE;
		size = 0;
		capacity = 0;
	}

	@SuppressWarnings("unchecked")
	private V castValue(Object value) {
		return (V) value;
	}

	/* ------------ Iterator ------------ */

	private final class ValueIterator implements Iterator<V> {
		private int nextIdx;
		private int lastIdx = NONE;

		@Override
		public boolean hasNext() {
			return nextIdx < size;
		}

		@Override
		public V next() {
			if (nextIdx >= size) throw new NoSuchElementException();
			lastIdx = nextIdx++;
			return castValue(values[lastIdx]);
		}

		@Override
		public void remove() {
			if (lastIdx == NONE) throw new IllegalStateException();
			removeAt(lastIdx);
			// the former last value now sits at lastIdx and has not been visited yet
			nextIdx = lastIdx;
			lastIdx = NONE;
		}
	}
}
