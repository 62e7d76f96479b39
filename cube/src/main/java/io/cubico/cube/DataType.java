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

import com.google.common.base.CharMatcher;
import com.google.common.primitives.Doubles;
import io.cubico.cube.exception.InvalidDataTypeException;
import org.jetbrains.annotations.Nullable;

/**
 * Type of a cube dimension.
 */
public enum DataType {
	NUMERIC(1),
	TEXT(2);

	private final int code;

	DataType(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}

	public static DataType of(int code) {
		for (DataType dataType : values()) {
			if (dataType.code == code) return dataType;
		}
		throw new InvalidDataTypeException(code);
	}

	public static DataType of(String name) {
		for (DataType dataType : values()) {
			if (dataType.name().equalsIgnoreCase(name)) return dataType;
		}
		throw new InvalidDataTypeException(name);
	}

	/**
	 * Guesses the type of a dimension from the first value seen for it.
	 * Absent values are treated as numeric.
	 */
	public static DataType infer(@Nullable Object value) {
		if (value == null) return NUMERIC;
		return toNumber(value) != null ? NUMERIC : TEXT;
	}

	/**
	 * Returns the key under which the value is stored in a value index and compared by equality criteria.
	 * Numeric values collapse to {@link Double}, so {@code 1} and {@code 1.0} are the same key;
	 * everything else is keyed by its string form.
	 */
	public Object toKey(Object value) {
		if (this == NUMERIC) {
			double d = ((Number) value).doubleValue();
			return d == 0.0 ? 0.0 : d;
		}
		return value.toString();
	}

	private static final CharMatcher DECIMAL_CHARS = CharMatcher.inRange('0', '9').or(CharMatcher.anyOf("+-.eE"));

	/**
	 * Returns the value as a number, or {@code null} when it is neither a {@link Number}
	 * nor a string in plain decimal or scientific notation.
	 */
	@Nullable
	public static Number toNumber(Object value) {
		if (value instanceof Number) {
			return (Number) value;
		}
		if (value instanceof String) {
			String s = ((String) value).trim();
			if (s.isEmpty() || !DECIMAL_CHARS.matchesAllOf(s)) return null;
			return Doubles.tryParse(s);
		}
		return null;
	}
}
