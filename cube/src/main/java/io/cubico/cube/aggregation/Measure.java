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
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A value computed per group: either a built-in aggregation of a dimension, such as {@code sum} of {@code income},
 * or a caller supplied {@link Aggregator}.
 * <p>
 * Built-in kinds are resolved against a cube only when the aggregation runs.
 */
public final class Measure {
	@Nullable
	private final String kind;
	@Nullable
	private final String dimension;
	@Nullable
	private final String name;
	@Nullable
	private final Aggregator<?> aggregator;

	private Measure(@Nullable String kind, @Nullable String dimension, @Nullable String name, @Nullable Aggregator<?> aggregator) {
		this.kind = kind;
		this.dimension = dimension;
		this.name = name;
		this.aggregator = aggregator;
	}

	public static Measure of(String kind, String dimension) {
		return new Measure(checkNotNull(kind), checkNotNull(dimension), null, null);
	}

	public static Measure of(AggregationKind kind, String dimension) {
		return of(kind.getKey(), dimension);
	}

	public static Measure sum(String dimension) {
		return of(AggregationKind.SUM, dimension);
	}

	public static Measure count(String dimension) {
		return of(AggregationKind.COUNT, dimension);
	}

	public static Measure countAll() {
		return of(AggregationKind.COUNT, AggregationKind.ALL);
	}

	public static Measure countUnique(String dimension) {
		return of(AggregationKind.COUNT_UNIQUE, dimension);
	}

	public static Measure average(String dimension) {
		return of(AggregationKind.AVERAGE, dimension);
	}

	public static Measure min(String dimension) {
		return of(AggregationKind.MIN, dimension);
	}

	public static Measure max(String dimension) {
		return of(AggregationKind.MAX, dimension);
	}

	/**
	 * A custom measure; it is given a synthetic unique name in the aggregated cube.
	 */
	public static Measure custom(Aggregator<?> aggregator) {
		return new Measure(null, null, null, checkNotNull(aggregator));
	}

	public static Measure custom(String name, Aggregator<?> aggregator) {
		return new Measure(null, null, checkNotNull(name), checkNotNull(aggregator));
	}

	public boolean isCustom() {
		return aggregator != null;
	}

	/**
	 * Name of the measure's dimension in the aggregated cube, or {@code null} when one has to be generated.
	 */
	@Nullable
	public String getName() {
		return isCustom() ? name : kind + "_" + dimension;
	}

	@Nullable
	public String getKind() {
		return kind;
	}

	@Nullable
	public String getDimension() {
		return dimension;
	}

	Aggregator<?> resolve(Cube cube) {
		if (aggregator != null)
			return aggregator;
		return AggregationKind.of(kind).create(cube, dimension);
	}

	@Override
	public String toString() {
		return isCustom() ? "custom(" + (name != null ? name : aggregator) + ")" : kind + "(" + dimension + ")";
	}
}
