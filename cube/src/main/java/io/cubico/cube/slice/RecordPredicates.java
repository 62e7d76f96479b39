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

import io.cubico.cube.DataType;
import io.cubico.cube.Dimension;
import io.cubico.cube.exception.InvalidCriterionException;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Predicate;

/**
 * Compiles criteria into record predicates bound to a dimension position.
 * <p>
 * An absent record value satisfies {@code !=} and nothing else.
 */
public final class RecordPredicates {
	private RecordPredicates() {
	}

	public static Predicate<Object[]> compile(Operator operator, Dimension dimension, @Nullable Object value) {
		int index = dimension.getIndex();
		DataType dataType = dimension.getDataType();
		if (value == null) {
			if (operator.isOrdering())
				throw new InvalidCriterionException("Operator " + operator + " needs a value (dimension '" + dimension.getName() + "')");
			return operator == Operator.EQ ? isAbsent(index) : isPresent(index);
		}
		Object operand = toOperand(dimension, value);
		switch (operator) {
			case EQ:
				return equalTo(index, dataType, operand);
			case NE:
				return equalTo(index, dataType, operand).negate();
			case LT:
				return compareTo(index, dataType, operand, c -> c < 0);
			case LE:
				return compareTo(index, dataType, operand, c -> c <= 0);
			case GT:
				return compareTo(index, dataType, operand, c -> c > 0);
			case GE:
				return compareTo(index, dataType, operand, c -> c >= 0);
			default:
				throw new IllegalArgumentException("Unknown operator " + operator);
		}
	}

	/**
	 * Returns the value a criterion is compared with, in the normalized form of the dimension's value index.
	 */
	public static Object toOperand(Dimension dimension, Object value) {
		if (dimension.isNumeric()) {
			Number number = DataType.toNumber(value);
			if (number == null)
				throw new InvalidCriterionException("Value '" + value + "' cannot be compared with numeric dimension '" + dimension.getName() + "'");
			return DataType.NUMERIC.toKey(number);
		}
		return DataType.TEXT.toKey(value);
	}

	public static boolean matchesAll(Object[] record, List<Predicate<Object[]>> predicates) {
		for (Predicate<Object[]> predicate : predicates) {
			if (!predicate.test(record))
				return false;
		}
		return true;
	}

	private static Predicate<Object[]> isAbsent(int index) {
		return record -> record[index] == null;
	}

	private static Predicate<Object[]> isPresent(int index) {
		return record -> record[index] != null;
	}

	private static Predicate<Object[]> equalTo(int index, DataType dataType, Object operand) {
		return record -> {
			Object value = record[index];
			return value != null && operand.equals(dataType.toKey(value));
		};
	}

	private interface ComparisonTest {
		boolean test(int comparison);
	}

	@SuppressWarnings("unchecked")
	private static Predicate<Object[]> compareTo(int index, DataType dataType, Object operand, ComparisonTest test) {
		Comparable<Object> comparableOperand = (Comparable<Object>) operand;
		return record -> {
			Object value = record[index];
			return value != null && test.test(((Comparable<Object>) dataType.toKey(value)).compareTo(comparableOperand));
		};
	}
}
