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

/**
 * A streaming per-group accumulator.
 * <p>
 * Every group gets its own state from {@link #createState()}; {@link #fold} is then called once for
 * each record of the group, in scan order, and its return value is the aggregate so far.
 *
 * @param <S> type of the per-group state
 */
public interface Aggregator<S> {
	S createState();

	@Nullable
	Object fold(Object[] record, S state);

	/**
	 * Type of the dimension that holds the aggregated values.
	 */
	default DataType getResultType() {
		return DataType.NUMERIC;
	}
}
