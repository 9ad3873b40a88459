package io.github.bluuewhale.slotsmith;

import java.util.HashMap;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * SlotMap against id-keyed hash maps. The hash maps use a sequential int id as key,
 * which is what a slot key replaces.
 */
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class SlotMapBenchmark {

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "100", "1000", "10000" })
		int size;

		SlotMap<Integer> slot;
		HashMap<Integer, Integer> jdk;
		Int2ObjectOpenHashMap<Integer> fastutil;
		SlotMapKey[] keys;
		SlotMapKey[] stale;
		Random rnd;

		@Setup(Level.Trial)
		public void setup() {
			rnd = new Random(123);
			slot = new SlotMap<>();
			jdk = new HashMap<>();
			fastutil = new Int2ObjectOpenHashMap<>();
			keys = new SlotMapKey[size];
			stale = new SlotMapKey[size];
			for (int i = 0; i < size; i++) {
				stale[i] = slot.insert(-i);
			}
			for (int i = 0; i < size; i++) {
				slot.erase(stale[i]);
			}
			for (int i = 0; i < size; i++) {
				keys[i] = slot.insert(i);
				jdk.put(i, i);
				fastutil.put(i, Integer.valueOf(i));
			}
		}

		int nextId() { return rnd.nextInt(size); }
	}

	@State(Scope.Thread)
	public static class MutateState {
		@Param({ "100", "1000", "10000" })
		int size;

		SlotMap<Integer> slot;
		HashMap<Integer, Integer> jdk;
		Int2ObjectOpenHashMap<Integer> fastutil;
		SlotMapKey[] keys;
		int nextId;

		@Setup(Level.Invocation)
		public void resetMaps() {
			slot = new SlotMap<>();
			jdk = new HashMap<>();
			fastutil = new Int2ObjectOpenHashMap<>();
			keys = new SlotMapKey[size];
			for (int i = 0; i < size; i++) {
				keys[i] = slot.insert(i);
				jdk.put(i, i);
				fastutil.put(i, Integer.valueOf(i));
			}
			nextId = size;
		}
	}

	// ------- get hit/miss -------
	@Benchmark
	public int slotGetHit(ReadState s) {
		return s.slot.get(s.keys[s.nextId()]);
	}

	@Benchmark
	public int jdkGetHit(ReadState s) {
		return s.jdk.get(s.nextId());
	}

	@Benchmark
	public int fastutilGetHit(ReadState s) {
		return s.fastutil.get(s.nextId());
	}

	@Benchmark
	public boolean slotGetStale(ReadState s) {
		return s.slot.contains(s.stale[s.nextId()]);
	}

	// ------- iterate -------
	@Benchmark
	public long slotIterate(ReadState s) {
		long sum = 0;
		for (int v : s.slot) sum += v;
		return sum;
	}

	@Benchmark
	public long slotIterateIndexed(ReadState s) {
		long sum = 0;
		var slot = s.slot;
		for (int i = 0, n = slot.size(); i < n; i++) sum += slot.at(i);
		return sum;
	}

	@Benchmark
	public long jdkIterate(ReadState s) {
		long sum = 0;
		for (var v : s.jdk.values()) sum += v;
		return sum;
	}

	@Benchmark
	public long fastutilIterate(ReadState s) {
		long sum = 0;
		for (var v : s.fastutil.values()) sum += v;
		return sum;
	}

	// ------- mutating: erase then insert -------
	@Benchmark
	public SlotMapKey slotEraseInsert(MutateState s) {
		s.slot.erase(s.keys[0]);
		return s.slot.insert(s.nextId++);
	}

	@Benchmark
	public Integer jdkEraseInsert(MutateState s) {
		s.jdk.remove(0);
		return s.jdk.put(s.nextId, s.nextId++);
	}

	@Benchmark
	public Integer fastutilEraseInsert(MutateState s) {
		s.fastutil.remove(0);
		return s.fastutil.put(s.nextId, Integer.valueOf(s.nextId++));
	}
}
