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

import io.cubico.cube.Cube;
import io.cubico.cube.Dimension;
import io.cubico.cube.exception.UnknownDimensionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Filters a cube into a new one holding the records that satisfy every criterion.
 * <p>
 * Among the equality criteria whose value is present in its dimension's value index,
 * the one with the fewest records narrows the scan to those records. Every compiled
 * predicate is still evaluated against each candidate.
 */
public final class SliceEngine {
	private static final Logger logger = LoggerFactory.getLogger(SliceEngine.class);

	private final Cube source;
	private final boolean useValueIndex;

	private SliceEngine(Cube source, boolean useValueIndex) {
		this.source = source;
		this.useValueIndex = useValueIndex;
	}

	public static SliceEngine create(Cube source, boolean useValueIndex) {
		return new SliceEngine(source, useValueIndex);
	}

	public Cube slice(List<Criterion> criteria) {
		List<Predicate<Object[]>> predicates = new ArrayList<>(criteria.size());

		Dimension smallerDimension = null;
		Object smallerKey = null;
		int smallerCount = Integer.MAX_VALUE;

		for (Criterion criterion : criteria) {
			if (criterion instanceof Criterion.OfPredicate) {
				predicates.add(((Criterion.OfPredicate) criterion).getPredicate());
				continue;
			}
			Criterion.OfDimension tuple = (Criterion.OfDimension) criterion;
			if (!source.hasDimension(tuple.getDimension()))
				throw new UnknownDimensionException(tuple.getDimension());
			Dimension dimension = source.getDimension(tuple.getDimension());
			Operator operator = Operator.of(tuple.getOperator());

			predicates.add(RecordPredicates.compile(operator, dimension, tuple.getValue()));

			if (useValueIndex && operator == Operator.EQ && tuple.getValue() != null) {
				Object key = RecordPredicates.toOperand(dimension, tuple.getValue());
				int count = dimension.getValueIndex().count(key);
				if (dimension.getValueIndex().contains(key) && count < smallerCount) {
					smallerCount = count;
					smallerDimension = dimension;
					smallerKey = key;
				}
			}
		}

		Cube result = source.cloneWithoutRecords();
		int scanned = 0;
		if (smallerDimension != null) {
			for (int position : smallerDimension.getValueIndex().get(smallerKey)) {
				scanned++;
				Object[] record = source.getRecord(position);
				if (RecordPredicates.matchesAll(record, predicates)) {
					result.addRecord(record, false);
				}
			}
		} else {
			for (Object[] record : source.getRecords()) {
				scanned++;
				if (RecordPredicates.matchesAll(record, predicates)) {
					result.addRecord(record, false);
				}
			}
		}

		if (logger.isDebugEnabled()) {
			logger.debug("Sliced {} criteria using {}: scanned {} of {} records, matched {}",
					criteria.size(),
					smallerDimension != null ? "index of '" + smallerDimension.getName() + "'" : "full scan",
					scanned, source.getNbrOfRecords(), result.getNbrOfRecords());
		}
		return result;
	}

	@Override
	public String toString() {
		return "SliceEngine{" +
				"source=" + source +
				", useValueIndex=" + useValueIndex +
				'}';
	}
}
