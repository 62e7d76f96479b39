/*
 * Copyright (C) 2026 Cubico contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.cubico.cube.aggregation;

import io.cubico.cube.DataType;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.Set;

/**
 * Built-in aggregators over a dimension position.
 * <p>
 * Absent values never contribute. Text values take part in numeric aggregates only when they parse as numbers.
 */
public final class Aggregators {
	private Aggregators() {
	}

	public static Aggregator<?> sum(int index) {
		return new SumAggregator(index);
	}

	public static Aggregator<?> count(int index) {
		return new CountAggregator(index);
	}

	public static Aggregator<?> countAll() {
		return new CountAggregator(-1);
	}

	public static Aggregator<?> countUnique(int index, DataType dataType) {
		return new CountUniqueAggregator(index, dataType);
	}

	public static Aggregator<?> average(int index) {
		return new AverageAggregator(index);
	}

	public static Aggregator<?> min(int index) {
		return new ExtremumAggregator(index, true);
	}

	public static Aggregator<?> max(int index) {
		return new ExtremumAggregator(index, false);
	}

	@Nullable
	private static Number numberAt(Object[] record, int index) {
		Object value = record[index];
		return value != null ? DataType.toNumber(value) : null;
	}

	static final class RunningTotal {
		double total;
		int count;
	}

	private static final class SumAggregator implements Aggregator<RunningTotal> {
		private final int index;

		SumAggregator(int index) {
			this.index = index;
		}

		@Override
		public RunningTotal createState() {
			return new RunningTotal();
		}

		@Override
		public Object fold(Object[] record, RunningTotal state) {
			Number number = numberAt(record, index);
			if (number != null) {
				state.total += number.doubleValue();
			}
			return state.total;
		}
	}

	private static final class AverageAggregator implements Aggregator<RunningTotal> {
		private final int index;

		AverageAggregator(int index) {
			this.index = index;
		}

		@Override
		public RunningTotal createState() {
			return new RunningTotal();
		}

		@Nullable
		@Override
		public Object fold(Object[] record, RunningTotal state) {
			Number number = numberAt(record, index);
			if (number != null) {
				state.total += number.doubleValue();
				state.count++;
			}
			return state.count != 0 ? state.total / state.count : null;
		}
	}

	static final class RunningCount {
		int count;
	}

	private static final class CountAggregator implements Aggregator<RunningCount> {
		private final int index;

		// negative index counts every record
		CountAggregator(int index) {
			this.index = index;
		}

		@Override
		public RunningCount createState() {
			return new RunningCount();
		}

		@Override
		public Object fold(Object[] record, RunningCount state) {
			if (index < 0 || record[index] != null) {
				state.count++;
			}
			return state.count;
		}
	}

	private static final class CountUniqueAggregator implements Aggregator<Set<Object>> {
		private final int index;
		private final DataType dataType;

		CountUniqueAggregator(int index, DataType dataType) {
			this.index = index;
			this.dataType = dataType;
		}

		@Override
		public Set<Object> createState() {
			return new HashSet<>();
		}

		@Override
		public Object fold(Object[] record, Set<Object> state) {
			Object value = record[index];
			if (value != null) {
				state.add(dataType.toKey(value));
			}
			return state.size();
		}
	}

	static final class RunningExtremum {
		double value;
		boolean seen;
	}

	private static final class ExtremumAggregator implements Aggregator<RunningExtremum> {
		private final int index;
		private final boolean min;

		ExtremumAggregator(int index, boolean min) {
			this.index = index;
			this.min = min;
		}

		@Override
		public RunningExtremum createState() {
			return new RunningExtremum();
		}

		@Nullable
		@Override
		public Object fold(Object[] record, RunningExtremum state) {
			Number number = numberAt(record, index);
			if (number != null) {
				double v = number.doubleValue();
				if (!state.seen) {
					state.value = v;
					state.seen = true;
				} else {
					state.value = min ? Math.min(state.value, v) : Math.max(state.value, v);
				}
			}
			return state.seen ? state.value : null;
		}
	}
}
