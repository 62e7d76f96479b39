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

import org.jetbrains.annotations.Nullable;

/**
 * A named, typed column of a cube.
 * <p>
 * The position of a dimension never changes once it is registered.
 * Each dimension owns its running statistics and the value index of its column.
 */
public final class Dimension {
	private final String name;
	private final DataType dataType;
	private final int index;
	private final DimensionStats stats;
	private final ValueIndex valueIndex = new ValueIndex();

	@Nullable
	private Double cachedStdDev;

	Dimension(String name, DataType dataType, int index) {
		this.name = name;
		this.dataType = dataType;
		this.index = index;
		this.stats = new DimensionStats(dataType);
	}

	void observe(@Nullable Object value, int position) {
		if (value == null)
			return;
		stats.observe(value);
		valueIndex.add(dataType.toKey(value), position);
		cachedStdDev = null;
	}

	public String getName() {
		return name;
	}

	public DataType getDataType() {
		return dataType;
	}

	public boolean isNumeric() {
		return dataType == DataType.NUMERIC;
	}

	public int getIndex() {
		return index;
	}

	public DimensionStats getStats() {
		return stats;
	}

	public ValueIndex getValueIndex() {
		return valueIndex;
	}

	public int getDistinctValueCount() {
		return valueIndex.size();
	}

	@Nullable
	Double getCachedStdDev() {
		return cachedStdDev;
	}

	void setCachedStdDev(double stdDev) {
		this.cachedStdDev = stdDev;
	}

	@Override
	public String toString() {
		return "Dimension{" +
				"name='" + name + '\'' +
				", dataType=" + dataType +
				", index=" + index +
				'}';
	}
}
