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

import io.cubico.cube.exception.InvalidOperatorException;

public enum Operator {
	EQ("="),
	NE("!="),
	LT("<"),
	LE("<="),
	GT(">"),
	GE(">=");

	private final String symbol;

	Operator(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	public boolean isOrdering() {
		return this != EQ && this != NE;
	}

	public static Operator of(String symbol) {
		for (Operator operator : values()) {
			if (operator.symbol.equals(symbol)) return operator;
		}
		throw new InvalidOperatorException(symbol);
	}

	@Override
	public String toString() {
		return symbol;
	}
}
