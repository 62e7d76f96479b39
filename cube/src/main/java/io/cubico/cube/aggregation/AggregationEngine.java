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
import io.cubico.cube.DataType;
import io.cubico.cube.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups the records of a cube by some of its dimensions and computes measures per group.
 * <p>
 * The result is a new cube whose leading dimensions are the group-by dimensions, with their
 * original types, followed by one dimension per measure. It holds one record per group, in the
 * order groups were first met.
 */
public final class AggregationEngine {
	private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);

	private final Cube source;

	private AggregationEngine(Cube source) {
		this.source = source;
	}

	public static AggregationEngine create(Cube source) {
		return new AggregationEngine(source);
	}

	public Cube aggregate(List<String> groupBy, List<Measure> measures) {
		return reduce(groupBy, measures).toCube();
	}

	Result reduce(List<String> groupBy, List<Measure> measures) {
		Cube result = Cube.create();

		int[] keyIndexes = new int[groupBy.size()];
		DataType[] keyTypes = new DataType[groupBy.size()];
		for (int i = 0; i < groupBy.size(); i++) {
			Dimension dimension = source.getDimension(groupBy.get(i));
			keyIndexes[i] = dimension.getIndex();
			keyTypes[i] = dimension.getDataType();
			result.addDimension(dimension.getName(), dimension.getDataType());
		}

		Set<String> usedNames = new HashSet<>(groupBy);
		for (Measure measure : measures) {
			if (measure.getName() != null) usedNames.add(measure.getName());
		}

		List<Aggregator<?>> aggregators = new ArrayList<>(measures.size());
		int sequence = 0;
		for (Measure measure : measures) {
			Aggregator<?> aggregator = measure.resolve(source);
			String name = measure.getName();
			if (name == null) {
				do {
					name = "custom_" + sequence++;
				} while (usedNames.contains(name));
				usedNames.add(name);
			}
			result.addDimension(name, aggregator.getResultType());
			aggregators.add(aggregator);
		}

		GroupReducer reducer = new GroupReducer(keyIndexes, keyTypes, aggregators);
		for (Object[] record : source.getRecords()) {
			reducer.onRecord(record);
		}

		logger.debug("Aggregated {} records by {} into {} groups with measures {}, {} records without group",
				source.getNbrOfRecords(), groupBy, reducer.getGroups().size(), measures, reducer.getSkipped());
		return new Result(result, reducer);
	}

	static final class Result {
		private final Cube cube;
		private final GroupReducer reducer;

		Result(Cube cube, GroupReducer reducer) {
			this.cube = cube;
			this.reducer = reducer;
		}

		GroupReducer getReducer() {
			return reducer;
		}

		Cube toCube() {
			for (GroupReducer.Group group : reducer.getGroups()) {
				cube.addRecord(group.getRow(), false);
			}
			return cube;
		}
	}

	@Override
	public String toString() {
		return "AggregationEngine{source=" + source + '}';
	}
}
