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


package io.cubico.cube.slice;

import io.cubico.cube.exception.InvalidCriterionException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single filter condition of a slice: either a (dimension, operator, value) triple
 * or an opaque predicate over whole records.
 * <p>
 * Triples are only validated against a cube when the slice is performed.
 */
public abstract class Criterion {
	private Criterion() {
	}

	public static Criterion of(String dimension, String operator, @Nullable Object value) {
		return new OfDimension(checkNotNull(dimension), checkNotNull(operator), value);
	}

	public static Criterion of(String dimension, Operator operator, @Nullable Object value) {
		return new OfDimension(checkNotNull(dimension), operator.getSymbol(), value);
	}

	/**
	 * Reads a criterion from its tuple form {@code [dimension, operator, value]}.
	 */
	public static Criterion of(Object[] tuple) {
		if (tuple == null || tuple.length != 3)
			throw new InvalidCriterionException("Criterion is bad formed, expected [dimension, operator, value]");
		if (!(tuple[0] instanceof String))
			throw new InvalidCriterionException("Criterion dimension must be a name, got " + tuple[0]);
		if (!(tuple[1] instanceof String))
			throw new InvalidCriterionException("Criterion operator must be a symbol, got " + tuple[1]);
		return new OfDimension((String) tuple[0], (String) tuple[1], tuple[2]);
	}

	public static Criterion matching(Predicate<Object[]> predicate) {
		return new OfPredicate(checkNotNull(predicate));
	}

	public static Criterion eq(String dimension, @Nullable Object value) {
		return of(dimension, Operator.EQ, value);
	}

	public static Criterion ne(String dimension, @Nullable Object value) {
		return of(dimension, Operator.NE, value);
	}

	public static Criterion lt(String dimension, Object value) {
		return of(dimension, Operator.LT, value);
	}

	public static Criterion le(String dimension, Object value) {
		return of(dimension, Operator.LE, value);
	}

	public static Criterion gt(String dimension, Object value) {
		return of(dimension, Operator.GT, value);
	}

	public static Criterion ge(String dimension, Object value) {
		return of(dimension, Operator.GE, value);
	}

	/**
	 * Turns {@code {dimensionX: valueX, dimensionY: valueY}} into equality criteria, in map iteration order.
	 */
	public static List<Criterion> fromMap(Map<String, ?> criteria) {
		List<Criterion> result = new ArrayList<>(criteria.size());
		for (Map.Entry<String, ?> entry : criteria.entrySet()) {
			result.add(eq(entry.getKey(), entry.getValue()));
		}
		return result;
	}

	public static final class OfDimension extends Criterion {
		private final String dimension;
		private final String operator;
		@Nullable
		private final Object value;

		private OfDimension(String dimension, String operator, @Nullable Object value) {
			this.dimension = dimension;
			this.operator = operator;
			this.value = value;
		}

		public String getDimension() {
			return dimension;
		}

		public String getOperator() {
			return operator;
		}

		@Nullable
		public Object getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			OfDimension that = (OfDimension) o;

			if (!dimension.equals(that.dimension)) return false;
			if (!operator.equals(that.operator)) return false;
			return Objects.equals(value, that.value);
		}

		@Override
		public int hashCode() {
			int result = dimension.hashCode();
			result = 31 * result + operator.hashCode();
			result = 31 * result + Objects.hashCode(value);
			return result;
		}

		@Override
		public String toString() {
			return dimension + operator + value;
		}
	}

	public static final class OfPredicate extends Criterion {
		private final Predicate<Object[]> predicate;

		private OfPredicate(Predicate<Object[]> predicate) {
			this.predicate = predicate;
		}

		public Predicate<Object[]> getPredicate() {
			return predicate;
		}

		@Override
		public String toString() {
			return "PREDICATE " + predicate;
		}
	}
}
