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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.cubico.cube.Cube;
import io.cubico.cube.exception.InvalidCriterionException;
import io.cubico.cube.exception.InvalidOperatorException;
import io.cubico.cube.exception.UnknownDimensionException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import java.util.ArrayList;
import java.util.List;

import static io.cubico.cube.DataType.NUMERIC;
import static io.cubico.cube.DataType.TEXT;
import static io.cubico.cube.slice.Criterion.*;
import static java.util.Arrays.asList;
import static org.junit.Assert.*;

public class SliceEngineTest {
	@Rule
	public final ExpectedException exception = ExpectedException.none();

	private Cube cube;

	@Before
	public void before() {
		cube = Cube.create()
				.withDimension("country", TEXT)
				.withDimension("city", TEXT)
				.withDimension("income", NUMERIC)
				.addRecord(new Object[]{"AR", "Rosario", 100})
				.addRecord(new Object[]{"AR", "Cordoba", 300})
				.addRecord(new Object[]{"US", "Boston", 50})
				.addRecord(new Object[]{"AR", "Rosario", 200})
				.addRecord(new Object[]{"US", null, 75})
				.addRecord(new Object[]{"BR", "Recife", null});
	}

	private static List<Object> column(Cube cube, String dimension) {
		int index = cube.getDimensionIndex(dimension);
		List<Object> values = new ArrayList<>();
		for (Object[] record : cube.getRecords()) {
			values.add(record[index]);
		}
		return values;
	}

	@Test
	public void testSliceByMap() {
		Cube slice = cube.slice(ImmutableMap.of("country", "AR"));

		assertEquals(3, slice.getNbrOfRecords());
		assertEquals(cube.getDimensionNames(), slice.getDimensionNames());
		assertEquals(cube.getDimension("income").getDataType(), slice.getDimension("income").getDataType());
		assertEquals(600, slice.sum("income"), 0.0);
	}

	@Test
	public void testOperators() {
		assertEquals(ImmutableList.of(100, 300, 200), column(cube.slice(eq("country", "AR")), "income"));
		assertEquals(asList(50, 75, null), column(cube.slice(ne("country", "AR")), "income"));
		assertEquals(ImmutableList.of(50, 75), column(cube.slice(lt("income", 100)), "income"));
		assertEquals(ImmutableList.of(100, 50, 75), column(cube.slice(le("income", 100)), "income"));
		assertEquals(ImmutableList.of(300, 200), column(cube.slice(gt("income", 100)), "income"));
		assertEquals(ImmutableList.of(100, 300, 200), column(cube.slice(ge("income", 100.0)), "income"));
		assertEquals(ImmutableList.of("Cordoba", "Boston"), column(cube.slice(lt("city", "Recife")), "city"));
	}

	@Test
	public void testOperatorSymbols() {
		Cube slice = cube.slice(of("income", ">=", 200), Criterion.of(new Object[]{"country", "=", "AR"}));
		assertEquals(ImmutableList.of(300, 200), column(slice, "income"));
	}

	@Test
	public void testAbsentValues() {
		assertEquals(ImmutableList.of(75), column(cube.slice(eq("city", null)), "income"));
		assertEquals(5, cube.slice(ne("city", null)).getNbrOfRecords());
		assertEquals(1, cube.slice(ne("income", 1000)).slice(eq("income", null)).getNbrOfRecords());
		assertEquals(0, cube.slice(eq("country", "BR"), gt("income", 0)).getNbrOfRecords());
	}

	@Test
	public void testNumericCriterionAcceptsNumericText() {
		assertEquals(ImmutableList.of(300), column(cube.slice(eq("income", "300")), "income"));
	}

	@Test
	public void testCustomPredicate() {
		Cube slice = cube.slice(matching(record -> record[1] != null && ((String) record[1]).startsWith("R")),
				eq("country", "AR"));
		assertEquals(ImmutableList.of(100, 200), column(slice, "income"));
	}

	@Test
	public void testIndexedSliceMatchesFullScan() {
		Cube fullScan = cube.copy().withValueIndex(false);
		List<Object> lookups = ImmutableList.of("AR", "US", "BR", "CL", "Rosario", "Boston");
		for (Object lookup : lookups) {
			for (String dimension : new String[]{"country", "city"}) {
				assertEquals(column(fullScan.slice(eq(dimension, lookup)), "income"),
						column(cube.slice(eq(dimension, lookup)), "income"));
			}
		}
		for (Object lookup : ImmutableList.of(50, 75.0, 300L, 999)) {
			assertEquals(column(fullScan.slice(eq("income", lookup)), "city"),
					column(cube.slice(eq("income", lookup)), "city"));
		}
	}

	@Test
	public void testEveryCriterionIsCheckedOnIndexedCandidates() {
		Cube slice = cube.slice(eq("country", "AR"), eq("city", "Rosario"), gt("income", 150));
		assertEquals(ImmutableList.of(200), column(slice, "income"));
	}

	@Test
	public void testChainedSlicesEqualSingleSlice() {
		Cube chained = cube.slice(eq("country", "AR")).slice(gt("income", 150));
		Cube single = cube.slice(gt("income", 150), eq("country", "AR"));

		assertEquals(column(single, "income"), column(chained, "income"));
		assertEquals(column(single, "city"), column(chained, "city"));
	}

	@Test
	public void testSourceIsNotModified() {
		double sum = cube.sum("income");
		int distinct = cube.countUnique("country");

		cube.slice(eq("country", "AR"), lt("income", 250));

		assertEquals(6, cube.getNbrOfRecords());
		assertEquals(sum, cube.sum("income"), 0.0);
		assertEquals(distinct, cube.countUnique("country"));
	}

	@Test
	public void testSliceSharesRecords() {
		Cube slice = cube.slice(eq("city", "Boston"));
		assertSame(cube.getRecord(2), slice.getRecord(0));
	}

	@Test
	public void testEmptyCriteriaKeepEverything() {
		assertEquals(6, cube.slice(ImmutableList.of()).getNbrOfRecords());
	}

	@Test
	public void testUnknownDimension() {
		exception.expect(UnknownDimensionException.class);
		cube.slice(eq("planet", "Earth"));
	}

	@Test
	public void testInvalidOperator() {
		exception.expect(InvalidOperatorException.class);
		cube.slice(of("income", "<>", 100));
	}

	@Test
	public void testUnknownDimensionIsReportedBeforeOperator() {
		exception.expect(UnknownDimensionException.class);
		cube.slice(of("planet", "<>", 100));
	}

	@Test
	public void testMalformedTuple() {
		exception.expect(InvalidCriterionException.class);
		Criterion.of(new Object[]{"country", "="});
	}

	@Test
	public void testOrderingNeedsValue() {
		exception.expect(InvalidCriterionException.class);
		cube.slice(lt("income", null));
	}

	@Test
	public void testNumericDimensionNeedsNumber() {
		exception.expect(InvalidCriterionException.class);
		cube.slice(gt("income", "lots"));
	}
}
