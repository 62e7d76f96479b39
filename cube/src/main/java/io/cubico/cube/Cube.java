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

import io.cubico.cube.aggregation.AggregationEngine;
import io.cubico.cube.aggregation.Measure;
import io.cubico.cube.exception.*;
import io.cubico.cube.slice.Criterion;
import io.cubico.cube.slice.SliceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static java.util.Collections.unmodifiableList;

/**
 * An in-memory cube of uniformly shaped records that can be sliced and aggregated.
 * <p>
 * A cube only grows: dimensions and records are added, never updated or removed.
 * Adding a dimension extends every stored record with an absent value. Slicing and
 * aggregating never modify this cube, they return a new one.
 * <p>
 * Absent ({@code null}) values take no part in statistics, value indexes or group keys.
 * <p>
 * A cube is not thread-safe. It may be read by several threads as long as no thread modifies it.
 */
public final class Cube {
	private static final Logger logger = LoggerFactory.getLogger(Cube.class);

	private static final CubeSettings SETTINGS = CubeSettings.fromSystemProperties();

	public static final boolean COPY_ON_INSERT = SETTINGS.isCopyOnInsert();
	public static final boolean USE_VALUE_INDEX = SETTINGS.isUseValueIndex();
	public static final int INITIAL_CAPACITY = SETTINGS.getInitialCapacity();

	private final List<Dimension> dimensions = new ArrayList<>();
	private final Map<String, Dimension> dimensionMap = new HashMap<>();
	private final List<Object[]> records;

	private boolean copyOnInsert = COPY_ON_INSERT;
	private boolean useValueIndex = USE_VALUE_INDEX;

	private Cube(int initialCapacity) {
		this.records = new ArrayList<>(initialCapacity);
	}

	public static Cube create() {
		return new Cube(INITIAL_CAPACITY);
	}

	public static Cube create(CubeSettings settings) {
		Cube cube = new Cube(settings.getInitialCapacity());
		cube.copyOnInsert = settings.isCopyOnInsert();
		cube.useValueIndex = settings.isUseValueIndex();
		return cube;
	}

	public Cube withCopyOnInsert(boolean copyOnInsert) {
		this.copyOnInsert = copyOnInsert;
		return this;
	}

	public Cube withValueIndex(boolean useValueIndex) {
		this.useValueIndex = useValueIndex;
		return this;
	}

	public Cube withDimension(String name, DataType dataType) {
		addDimension(name, dataType);
		return this;
	}

	// region schema
	public Dimension addDimension(String name, DataType dataType) {
		checkNotNull(name, "Dimension name");
		if (dataType == null)
			throw new InvalidDataTypeException(null);
		if (dimensionMap.containsKey(name))
			throw new DuplicateDimensionException(name);

		Dimension dimension = new Dimension(name, dataType, dimensions.size());
		dimensions.add(dimension);
		dimensionMap.put(name, dimension);

		int width = dimensions.size();
		for (int i = 0; i < records.size(); i++) {
			records.set(i, Arrays.copyOf(records.get(i), width));
		}
		return dimension;
	}

	public boolean hasDimension(String name) {
		return dimensionMap.containsKey(name);
	}

	public Dimension getDimension(String name) {
		Dimension dimension = dimensionMap.get(name);
		if (dimension == null)
			throw new UnknownDimensionException(name);
		return dimension;
	}

	public int getDimensionIndex(String name) {
		return getDimension(name).getIndex();
	}

	public List<Dimension> getDimensions() {
		return unmodifiableList(dimensions);
	}

	public List<String> getDimensionNames() {
		List<String> names = new ArrayList<>(dimensions.size());
		for (Dimension dimension : dimensions) {
			names.add(dimension.getName());
		}
		return names;
	}

	public int getNbrOfDimensions() {
		return dimensions.size();
	}
	// endregion

	// region records
	public int getNbrOfRecords() {
		return records.size();
	}

	/**
	 * Returns the stored records. The arrays may be shared with other cubes and must not be modified.
	 */
	public List<Object[]> getRecords() {
		return unmodifiableList(records);
	}

	public Object[] getRecord(int position) {
		return records.get(position);
	}

	/**
	 * Adds a record given as an array, a list or a map of dimension names to values.
	 */
	@SuppressWarnings("unchecked")
	public Cube addRecord(Object record) {
		if (record instanceof Object[])
			return addRecord((Object[]) record);
		if (record instanceof List)
			return addRecord((List<?>) record);
		if (record instanceof Map) {
			for (Object key : ((Map<?, ?>) record).keySet()) {
				if (!(key instanceof String))
					throw new InvalidRecordShapeException("Dimension names must be strings, got " + key);
			}
			return addRecord((Map<String, ?>) record);
		}
		throw InvalidRecordShapeException.of(record);
	}

	public Cube addRecord(Object[] values) {
		return addRecord(values, copyOnInsert);
	}

	public Cube addRecord(List<?> values) {
		return addRecord(values.toArray(), false);
	}

	/**
	 * Adds a positional record.
	 *
	 * @param copy whether to store a copy of the array rather than the array itself
	 */
	public Cube addRecord(Object[] values, boolean copy) {
		if (values == null)
			throw InvalidRecordShapeException.of(null);
		if (values.length != dimensions.size())
			throw new DimensionalityMismatchException(dimensions.size(), values.length);
		for (Dimension dimension : dimensions) {
			Object value = values[dimension.getIndex()];
			if (value != null && dimension.isNumeric() && !(value instanceof Number))
				throw new InvalidValueException(dimension.getName(), value);
		}

		Object[] record = copy ? values.clone() : values;
		int position = records.size();
		records.add(record);
		for (Dimension dimension : dimensions) {
			dimension.observe(record[dimension.getIndex()], position);
		}
		return this;
	}

	/**
	 * Adds a labeled record. Dimensions missing from this cube are created, numeric when the value
	 * is a number or text that parses as one, text otherwise.
	 */
	public Cube addRecord(Map<String, ?> values) {
		if (values == null)
			throw InvalidRecordShapeException.of(null);

		Map<String, Object> converted = new LinkedHashMap<>();
		Map<String, DataType> newDimensions = new LinkedHashMap<>();
		for (Map.Entry<String, ?> entry : values.entrySet()) {
			String name = checkNotNull(entry.getKey(), "Dimension name");
			Object value = entry.getValue();
			Dimension dimension = dimensionMap.get(name);
			DataType dataType = dimension != null ? dimension.getDataType() : DataType.infer(value);
			if (dimension == null) {
				newDimensions.put(name, dataType);
			}
			if (value != null && dataType == DataType.NUMERIC) {
				Number number = DataType.toNumber(value);
				if (number == null)
					throw new InvalidValueException(name, value);
				value = number;
			}
			converted.put(name, value);
		}

		for (Map.Entry<String, DataType> entry : newDimensions.entrySet()) {
			addDimension(entry.getKey(), entry.getValue());
		}

		Object[] record = new Object[dimensions.size()];
		for (Map.Entry<String, Object> entry : converted.entrySet()) {
			record[dimensionMap.get(entry.getKey()).getIndex()] = entry.getValue();
		}
		return addRecord(record, false);
	}
	// endregion

	// region queries
	public Cube slice(List<Criterion> criteria) {
		return SliceEngine.create(this, useValueIndex).slice(criteria);
	}

	public Cube slice(Criterion... criteria) {
		return slice(asList(criteria));
	}

	/**
	 * Slices on equality of every given dimension with its value.
	 */
	public Cube slice(Map<String, ?> criteria) {
		return slice(Criterion.fromMap(criteria));
	}

	public Cube aggregate(List<String> groupBy, List<Measure> measures) {
		return AggregationEngine.create(this).aggregate(groupBy, measures);
	}

	public Cube aggregate(List<String> groupBy, Measure... measures) {
		return aggregate(groupBy, asList(measures));
	}

	public Cube aggregate(String groupBy, Measure... measures) {
		return aggregate(singletonList(groupBy), asList(measures));
	}
	// endregion

	// region statistics
	public double sum(String dimension) {
		return getNumericDimension(dimension).getStats().getSummation();
	}

	public double sumOfSquares(String dimension) {
		return getNumericDimension(dimension).getStats().getSummationOfSquares();
	}

	/**
	 * Smallest value of a numeric dimension, {@code +Infinity} when it holds none.
	 */
	public double min(String dimension) {
		return getNumericDimension(dimension).getStats().getMin();
	}

	/**
	 * Largest value of a numeric dimension, {@code -Infinity} when it holds none.
	 */
	public double max(String dimension) {
		return getNumericDimension(dimension).getStats().getMax();
	}

	/**
	 * Number of distinct non-absent values of a dimension.
	 */
	public int countUnique(String dimension) {
		return getDimension(dimension).getDistinctValueCount();
	}

	/**
	 * Number of records holding a value for a dimension.
	 */
	public int nonNullCount(String dimension) {
		return getDimension(dimension).getStats().getNonNullCount();
	}

	public double average(String dimension) {
		DimensionStats stats = getNumericDimension(dimension).getStats();
		return stats.getNonNullCount() > 0 ? stats.getSummation() / stats.getNonNullCount() : 0;
	}

	public double stdDev(String dimension) {
		return stdDev(dimension, false);
	}

	/**
	 * Population standard deviation of a numeric dimension.
	 * <p>
	 * The approximate form is computed from the running sums as {@code sqrt(n*S2 - S1^2) / n}; it loses
	 * precision for large magnitudes. The exact form makes a second pass over the records and is cached
	 * until a record adds a value to the dimension.
	 */
	public double stdDev(String dimension, boolean approximate) {
		Dimension dim = getNumericDimension(dimension);
		DimensionStats stats = dim.getStats();
		int count = stats.getNonNullCount();
		if (count == 0)
			return 0;

		if (approximate)
			return Math.sqrt(count * stats.getSummationOfSquares() - Math.pow(stats.getSummation(), 2)) / count;

		Double cached = dim.getCachedStdDev();
		if (cached != null)
			return cached;

		double average = stats.getSummation() / count;
		int index = dim.getIndex();
		double squares = 0;
		for (Object[] record : records) {
			Object value = record[index];
			if (value != null) {
				double delta = ((Number) value).doubleValue() - average;
				squares += delta * delta;
			}
		}
		double stdDev = Math.sqrt(squares / count);
		logger.debug("Computed exact standard deviation of '{}' over {} values: {}", dimension, count, stdDev);
		dim.setCachedStdDev(stdDev);
		return stdDev;
	}

	public double variance(String dimension) {
		return variance(dimension, false);
	}

	public double variance(String dimension, boolean approximate) {
		return Math.pow(stdDev(dimension, approximate), 2);
	}

	/**
	 * Covariance of two numeric dimensions over the records holding both values,
	 * normalized by the larger of their non-absent counts.
	 */
	public double covariance(String dimension1, String dimension2) {
		Dimension dim1 = getNumericDimension(dimension1);
		Dimension dim2 = getNumericDimension(dimension2);
		int count = Math.max(dim1.getStats().getNonNullCount(), dim2.getStats().getNonNullCount());
		if (count == 0)
			return 0;

		double avg1 = average(dimension1);
		double avg2 = average(dimension2);
		int index1 = dim1.getIndex();
		int index2 = dim2.getIndex();
		double covariance = 0;
		for (Object[] record : records) {
			Object value1 = record[index1];
			Object value2 = record[index2];
			if (value1 != null && value2 != null) {
				covariance += (((Number) value1).doubleValue() - avg1) * (((Number) value2).doubleValue() - avg2);
			}
		}
		return covariance / count;
	}

	private Dimension getNumericDimension(String name) {
		Dimension dimension = getDimension(name);
		if (!dimension.isNumeric())
			throw new NonNumericDimensionException(name);
		return dimension;
	}
	// endregion

	// region copies
	/**
	 * Returns an empty cube with the same dimensions and settings.
	 */
	public Cube cloneWithoutRecords() {
		Cube cube = new Cube(INITIAL_CAPACITY);
		cube.copyOnInsert = copyOnInsert;
		cube.useValueIndex = useValueIndex;
		for (Dimension dimension : dimensions) {
			cube.addDimension(dimension.getName(), dimension.getDataType());
		}
		return cube;
	}

	/**
	 * Returns a cube with the same dimensions and a copy of every record.
	 */
	public Cube copy() {
		Cube cube = cloneWithoutRecords();
		for (Object[] record : records) {
			cube.addRecord(record, true);
		}
		return cube;
	}
	// endregion

	public <T> T render(CubeRenderer<T> renderer) {
		return renderer.render(getDimensionNames(), getRecords());
	}

	@Override
	public String toString() {
		return "Cube{" +
				"dimensions=" + getDimensionNames() +
				", records=" + records.size() +
				'}';
	}
}
