package io.github.bluuewhale.chaintable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

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

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class TableBenchmark {

	/* Entries per bucket at fill time */
	private static final int LOAD = 4;

	static ChainedHashTable<Integer, Integer> newTable(int size) {
		return ChainedHashTable.<Integer, Integer>create(Math.max(1, size / LOAD), Hashers.smeared(), KeyComparators.natural());
	}

	static int[] missesFor(Random rnd, Set<Integer> keySet, int size) {
		int[] misses = new int[size];
		for (int i = 0; i < size; i++) {
			int miss;
			do { miss = rnd.nextInt(); } while (keySet.contains(miss));
			misses[i] = miss;
		}
		return misses;
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "100", "1000", "10000" })
		int size;

		ChainedHashTable<Integer, Integer> chained;
		HashMap<Integer, Integer> jdk;
		int[] keys;
		int[] misses;
		Random rnd;

		@Setup(Level.Trial)
		public void setup() {
			rnd = new Random(123);
			keys = new int[size];
			Set<Integer> keySet = new HashSet<>(size * 2);
			for (int i = 0; i < size; i++) {
				int k = rnd.nextInt();
				keys[i] = k;
				keySet.add(k);
			}
			misses = missesFor(rnd, keySet, size);
			chained = newTable(size);
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				chained.insert(keys[i], i);
				jdk.put(keys[i], i);
			}
		}

		int nextKey() { return keys[rnd.nextInt(keys.length)]; }
		int nextMiss() { return misses[rnd.nextInt(misses.length)]; }
	}

	@State(Scope.Thread)
	public static class MutateState {
		@Param({ "100", "1000", "10000" })
		int size;

		int[] keys;
		int[] misses;
		int putValue;
		ChainedHashTable<Integer, Integer> chained;
		HashMap<Integer, Integer> jdk;

		@Setup(Level.Trial)
		public void initKeys() {
			var rnd = new Random(456);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
			misses = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
		}

		@Setup(Level.Iteration)
		public void resetTables() {
			chained = newTable(size);
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				chained.insert(keys[i], i);
				jdk.put(keys[i], i);
			}
			putValue = 0;
		}

		int existingKey(int i) { return keys[i % keys.length]; }
		int missingKey(int i) { return misses[i % misses.length]; }
		int nextValue() { return ++putValue; }
	}

	@State(Scope.Thread)
	public static class RemoveState {
		@Param({ "100", "1000", "10000" })
		int size;

		ChainedHashTable<Integer, Integer> chained;
		HashMap<Integer, Integer> jdk;
		int[] keys;
		int[] misses;
		Random rnd;

		@Setup(Level.Trial)
		public void initData() {
			rnd = new Random(789);
			keys = new int[size];
			Set<Integer> keySet = new HashSet<>(size * 2);
			for (int i = 0; i < size; i++) {
				int k = rnd.nextInt();
				keys[i] = k;
				keySet.add(k);
			}
			misses = missesFor(rnd, keySet, size);
		}

		@Setup(Level.Invocation)
		public void resetTables() {
			chained = newTable(size);
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				chained.insert(keys[i], i);
				jdk.put(keys[i], i);
			}
		}

		int hitKey() { return keys[rnd.nextInt(keys.length)]; }
		int missKey() { return misses[rnd.nextInt(misses.length)]; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public int chainedGetHit(ReadState s) {
		return s.chained.get(s.nextKey());
	}

	@Benchmark
	public int jdkGetHit(ReadState s) {
		return s.jdk.get(s.nextKey());
	}

	@Benchmark
	public int chainedGetMiss(ReadState s) {
		Integer v = s.chained.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	@Benchmark
	public int jdkGetMiss(ReadState s) {
		Integer v = s.jdk.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	// ------- iterate -------
	@Benchmark
	public long chainedIterate(ReadState s) {
		long[] sum = new long[1];
		s.chained.forEach((k, v) -> sum[0] += v);
		return sum[0];
	}

	@Benchmark
	public long jdkIterate(ReadState s) {
		long sum = 0;
		for (var e : s.jdk.entrySet()) sum += e.getValue();
		return sum;
	}

	// ------- mutating: insert hit/miss -------
	@Benchmark
	public TableStatus chainedInsertHit(MutateState s) {
		return s.chained.insert(s.existingKey(0), s.nextValue());
	}

	@Benchmark
	public int jdkPutHit(MutateState s) {
		return s.jdk.put(s.existingKey(0), s.nextValue());
	}

	@Benchmark
	public TableStatus chainedInsertMiss(MutateState s) {
		int k = s.missingKey(s.putValue);
		return s.chained.insert(k, s.nextValue());
	}

	@Benchmark
	public int jdkPutMiss(MutateState s) {
		int k = s.missingKey(s.putValue);
		Integer prev = s.jdk.put(k, s.nextValue());
		return prev == null ? -1 : prev;
	}

	// ------- remove hit/miss -------
	@Benchmark
	public TableStatus chainedRemoveHit(RemoveState s) {
		return s.chained.remove(s.hitKey());
	}

	@Benchmark
	public int jdkRemoveHit(RemoveState s) {
		Integer prev = s.jdk.remove(s.hitKey());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public TableStatus chainedRemoveMiss(RemoveState s) {
		return s.chained.remove(s.missKey());
	}

	@Benchmark
	public int jdkRemoveMiss(RemoveState s) {
		Integer prev = s.jdk.remove(s.missKey());
		return prev == null ? -1 : prev;
	}
}
