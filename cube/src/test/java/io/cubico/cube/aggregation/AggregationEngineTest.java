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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.cubico.cube.Cube;
import io.cubico.cube.DataType;
import io.cubico.cube.exception.DuplicateDimensionException;
import io.cubico.cube.exception.UnknownAggregationException;
import io.cubico.cube.exception.UnknownDimensionException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.cubico.cube.DataType.NUMERIC;
import static io.cubico.cube.DataType.TEXT;
import static io.cubico.cube.aggregation.Measure.*;
import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static org.junit.Assert.*;

public class AggregationEngineTest {
	@Rule
	public final ExpectedException exception = ExpectedException.none();

	private Cube cube;

	@Before
	public void before() {
		cube = Cube.create();
		cube.addRecord(ImmutableMap.of("country", "AR", "gender", "F", "income", 100));
		cube.addRecord(ImmutableMap.of("country", "AR", "gender", "M", "income", 300));
		cube.addRecord(ImmutableMap.of("country", "US", "gender", "F", "income", 50));
		cube.addRecord(ImmutableMap.of("country", "AR", "gender", "F", "income", 200));
		cube.addRecord(ImmutableMap.of("country", "BR", "gender", "M"));
	}

	@Test
	public void testSumByCountry() {
		Cube simple = Cube.create();
		simple.addRecord(ImmutableMap.of("country", "AR", "income", 100));
		simple.addRecord(ImmutableMap.of("country", "AR", "income", 300));
		simple.addRecord(ImmutableMap.of("country", "US", "income", 50));

		Cube result = simple.aggregate("country", Measure.of("sum", "income"));

		assertEquals(ImmutableList.of("country", "sum_income"), result.getDimensionNames());
		assertEquals(2, result.getNbrOfRecords());
		assertArrayEquals(new Object[]{"AR", 400.0}, result.getRecord(0));
		assertArrayEquals(new Object[]{"US", 50.0}, result.getRecord(1));
	}

	@Test
	public void testBuiltInMeasures() {
		Cube result = cube.aggregate(singletonList("country"),
				countAll(), count("income"), countUnique("gender"), average("income"), min("income"), max("income"));

		assertEquals(ImmutableList.of("country", "count_*", "count_income", "countUnique_gender",
				"average_income", "min_income", "max_income"), result.getDimensionNames());
		assertArrayEquals(new Object[]{"AR", 3, 3, 2, 200.0, 100.0, 300.0}, result.getRecord(0));
		assertArrayEquals(new Object[]{"US", 1, 1, 1, 50.0, 50.0, 50.0}, result.getRecord(1));
		assertArrayEquals(new Object[]{"BR", 1, 0, 1, null, null, null}, result.getRecord(2));
	}

	@Test
	public void testGroupByDimensionsKeepTheirTypes() {
		Cube result = cube.aggregate(asList("gender", "country"), sum("income"));

		assertEquals(TEXT, result.getDimension("gender").getDataType());
		assertEquals(TEXT, result.getDimension("country").getDataType());
		assertEquals(NUMERIC, result.getDimension("sum_income").getDataType());
	}

	@Test
	public void testGroupsAreDistinctCombinationsInDiscoveryOrder() {
		Cube result = cube.aggregate(asList("country", "gender"), sum("income"));

		Set<List<Object>> combinations = new HashSet<>();
		for (Object[] record : cube.getRecords()) {
			combinations.add(asList(record[0], record[1]));
		}
		assertEquals(combinations.size(), result.getNbrOfRecords());

		List<List<Object>> keys = new ArrayList<>();
		for (Object[] record : result.getRecords()) {
			keys.add(asList(record[0], record[1]));
		}
		assertEquals(ImmutableList.of(asList("AR", "F"), asList("AR", "M"), asList("US", "F"), asList("BR", "M")), keys);
		assertArrayEquals(new Object[]{"AR", "F", 300.0}, result.getRecord(0));
	}

	@Test
	public void testNoGroupByYieldsSingleRow() {
		Cube result = cube.aggregate(ImmutableList.of(), countAll(), sum("income"));

		assertEquals(1, result.getNbrOfRecords());
		assertArrayEquals(new Object[]{5, 650.0}, result.getRecord(0));
	}

	@Test
	public void testNumericKeysAreCompared() {
		Cube numbers = Cube.create()
				.withDimension("bucket", NUMERIC)
				.withDimension("value", NUMERIC)
				.addRecord(new Object[]{1, 10})
				.addRecord(new Object[]{1.0, 20})
				.addRecord(new Object[]{2L, 30});

		Cube result = numbers.aggregate("bucket", sum("value"));

		assertEquals(2, result.getNbrOfRecords());
		assertArrayEquals(new Object[]{1, 30.0}, result.getRecord(0));
		assertArrayEquals(new Object[]{2L, 30.0}, result.getRecord(1));
	}

	@Test
	public void testKeysDoNotCollideAcrossDimensions() {
		Cube texts = Cube.create()
				.withDimension("a", TEXT)
				.withDimension("b", TEXT)
				.addRecord(new Object[]{"1", "7x"})
				.addRecord(new Object[]{"17", "x"})
				.addRecord(new Object[]{"1_7", ""})
				.addRecord(new Object[]{"1", "_7"});

		assertEquals(4, texts.aggregate(asList("a", "b"), countAll()).getNbrOfRecords());
	}

	@Test
	public void testRecordsWithAbsentKeyJoinNoGroup() {
		Cube result = cube.aggregate("income", countAll());

		assertEquals(4, result.getNbrOfRecords());
		int total = 0;
		for (Object[] record : result.getRecords()) {
			total += (Integer) record[1];
		}
		assertEquals(4, total);
	}

	@Test
	public void testCustomMeasures() {
		Aggregator<StringBuilder> genders = new Aggregator<StringBuilder>() {
			@Override
			public StringBuilder createState() {
				return new StringBuilder();
			}

			@Override
			public Object fold(Object[] record, StringBuilder state) {
				state.append(record[1]);
				return state.toString();
			}

			@Override
			public DataType getResultType() {
				return TEXT;
			}
		};
		Aggregator<int[]> calls = new Aggregator<int[]>() {
			@Override
			public int[] createState() {
				return new int[1];
			}

			@Override
			public Object fold(Object[] record, int[] state) {
				return ++state[0];
			}
		};

		Cube result = cube.aggregate(singletonList("country"), custom(genders), custom("calls", calls), custom(calls));

		assertEquals(ImmutableList.of("country", "custom_0", "calls", "custom_1"), result.getDimensionNames());
		assertEquals(TEXT, result.getDimension("custom_0").getDataType());
		assertArrayEquals(new Object[]{"AR", "FMF", 3, 3}, result.getRecord(0));
		assertArrayEquals(new Object[]{"US", "F", 1, 1}, result.getRecord(1));
	}

	@Test
	public void testSyntheticNamesAvoidTakenNames() {
		Aggregator<int[]> calls = new Aggregator<int[]>() {
			@Override
			public int[] createState() {
				return new int[1];
			}

			@Override
			public Object fold(Object[] record, int[] state) {
				return ++state[0];
			}
		};

		Cube result = cube.aggregate(singletonList("country"), custom("custom_0", calls), custom(calls));

		assertEquals(ImmutableList.of("country", "custom_0", "custom_1"), result.getDimensionNames());
	}

	@Test
	public void testGroupsRetainTheirRecords() {
		AggregationEngine.Result result = AggregationEngine.create(cube).reduce(singletonList("country"), singletonList(sum("income")));

		List<GroupReducer.Group> groups = new ArrayList<>(result.getReducer().getGroups());
		assertEquals(3, groups.size());
		assertEquals(3, groups.get(0).getChildren().size());
		assertSame(cube.getRecord(3), groups.get(0).getChildren().get(2));
		assertEquals("AR", groups.get(0).getKey().get(0));
	}

	@Test
	public void testSourceIsNotModified() {
		List<String> names = cube.getDimensionNames();
		cube.aggregate("country", sum("income"));

		assertEquals(names, cube.getDimensionNames());
		assertEquals(5, cube.getNbrOfRecords());
		assertEquals(650, cube.sum("income"), 0.0);
	}

	@Test
	public void testUnknownAggregation() {
		exception.expect(UnknownAggregationException.class);
		cube.aggregate("country", Measure.of("median", "income"));
	}

	@Test
	public void testUnknownGroupByDimension() {
		exception.expect(UnknownDimensionException.class);
		cube.aggregate("city", countAll());
	}

	@Test
	public void testUnknownMeasureDimension() {
		exception.expect(UnknownDimensionException.class);
		cube.aggregate("country", sum("salary"));
	}

	@Test
	public void testRepeatedMeasure() {
		exception.expect(DuplicateDimensionException.class);
		cube.aggregate("country", sum("income"), sum("income"));
	}

	@Test
	public void testAggregatedCubeCanBeQueried() {
		Cube result = cube.aggregate("country", sum("income"));

		assertEquals(650, result.sum("sum_income"), 0.0);
		assertEquals(1, result.slice(io.cubico.cube.slice.Criterion.gt("sum_income", 100)).getNbrOfRecords());
	}
}
