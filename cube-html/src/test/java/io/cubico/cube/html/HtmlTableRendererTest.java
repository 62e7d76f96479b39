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


package io.cubico.cube.html;

import com.google.common.collect.ImmutableList;
import io.cubico.cube.Cube;
import org.junit.Test;

import static io.cubico.cube.DataType.NUMERIC;
import static io.cubico.cube.DataType.TEXT;
import static io.cubico.cube.aggregation.Measure.sum;
import static org.junit.Assert.assertEquals;

public class HtmlTableRendererTest {
	@Test
	public void testRenderCube() {
		Cube cube = Cube.create()
				.withDimension("country", TEXT)
				.withDimension("income", NUMERIC)
				.addRecord(new Object[]{"AR", 100})
				.addRecord(new Object[]{"US", null});

		String html = cube.render(HtmlTableRenderer.create());

		assertEquals("<table>" +
				"<tr><th>country</th><th>income</th></tr>" +
				"<tr><td>AR</td><td>100</td></tr>" +
				"<tr><td>US</td><td></td></tr>" +
				"</table>", html);
	}

	@Test
	public void testEscapesAndNullText() {
		String html = HtmlTableRenderer.create()
				.withNullText("-")
				.render(ImmutableList.of("a<b"), ImmutableList.of(new Object[]{"x & y"}, new Object[]{null}));

		assertEquals("<table>" +
				"<tr><th>a&lt;b</th></tr>" +
				"<tr><td>x &amp; y</td></tr>" +
				"<tr><td>-</td></tr>" +
				"</table>", html);
	}

	@Test
	public void testRenderAggregatedCube() {
		Cube cube = Cube.create()
				.withDimension("country", TEXT)
				.withDimension("income", NUMERIC)
				.addRecord(new Object[]{"AR", 100})
				.addRecord(new Object[]{"AR", 300});

		String html = cube.aggregate("country", sum("income")).render(HtmlTableRenderer.create());

		assertEquals("<table>" +
				"<tr><th>country</th><th>sum_income</th></tr>" +
				"<tr><td>AR</td><td>400.0</td></tr>" +
				"</table>", html);
	}
}
