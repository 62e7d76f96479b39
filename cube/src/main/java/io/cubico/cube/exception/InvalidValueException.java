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


package io.cubico.cube.exception;

/**
 * Thrown when a record carries a value that its dimension cannot hold,
 * such as text that is not a number in a numeric dimension.
 */
public final class InvalidValueException extends CubeException {
	private final String dimension;
	private final Object value;

	public InvalidValueException(String dimension, Object value) {
		super("Value '" + value + "' is not valid for numeric dimension '" + dimension + "'");
		this.dimension = dimension;
		this.value = value;
	}

	public String getDimension() {
		return dimension;
	}

	public Object getValue() {
		return value;
	}
}
