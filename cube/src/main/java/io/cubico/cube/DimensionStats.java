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


package io.cubico.cube;

/**
 * Running statistics of a single dimension, folded in one value at a time.
 * <p>
 * Only the non-absent count is kept for text dimensions.
 */
public final class DimensionStats {
	private final DataType dataType;

	private int nonNullCount;
	private double summation;
	private double summationOfSquares;
	private double min = Double.POSITIVE_INFINITY;
	private double max = Double.NEGATIVE_INFINITY;

	DimensionStats(DataType dataType) {
		this.dataType = dataType;
	}

	void observe(Object value) {
		if (value == null)
			return;
		nonNullCount++;
		if (dataType == DataType.NUMERIC) {
			double v = ((Number) value).doubleValue();
			summation += v;
			summationOfSquares += v * v;
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
	}

	public int getNonNullCount() {
		return nonNullCount;
	}

	public double getSummation() {
		return summation;
	}

	public double getSummationOfSquares() {
		return summationOfSquares;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	@Override
	public String toString() {
		return "DimensionStats{" +
				"nonNullCount=" + nonNullCount +
				", summation=" + summation +
				", summationOfSquares=" + summationOfSquares +
				", min=" + min +
				", max=" + max +
				'}';
	}
}
