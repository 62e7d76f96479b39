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

import io.cubico.cube.Cube;
import io.cubico.cube.Dimension;
import io.cubico.cube.exception.UnknownAggregationException;

/**
 * The built-in aggregations a measure can name.
 */
public enum AggregationKind {
	SUM("sum"),
	COUNT("count"),
	COUNT_UNIQUE("countUnique"),
	AVERAGE("average"),
	MIN("min"),
	MAX("max");

	/**
	 * Dimension name that makes {@link #COUNT} count every record.
	 */
	public static final String ALL = "*";

	private final String key;

	AggregationKind(String key) {
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	public static AggregationKind of(String key) {
		for (AggregationKind kind : values()) {
			if (kind.key.equals(key)) return kind;
		}
		throw new UnknownAggregationException(key);
	}

	public Aggregator<?> create(Cube cube, String dimensionName) {
		if (this == COUNT && ALL.equals(dimensionName))
			return Aggregators.countAll();
		Dimension dimension = cube.getDimension(dimensionName);
		int index = dimension.getIndex();
		switch (this) {
			case SUM:
				return Aggregators.sum(index);
			case COUNT:
				return Aggregators.count(index);
			case COUNT_UNIQUE:
				return Aggregators.countUnique(index, dimension.getDataType());
			case AVERAGE:
				return Aggregators.average(index);
			case MIN:
				return Aggregators.min(index);
			case MAX:
				return Aggregators.max(index);
			default:
				throw new UnknownAggregationException(key);
		}
	}

	@Override
	public String toString() {
		return key;
	}
}
