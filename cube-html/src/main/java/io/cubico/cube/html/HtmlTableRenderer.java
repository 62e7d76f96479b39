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

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import io.cubico.cube.CubeRenderer;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Renders a cube as a plain HTML table: a header row of dimension names followed by one row per record.
 */
public final class HtmlTableRenderer implements CubeRenderer<String> {
	private static final Escaper ESCAPER = HtmlEscapers.htmlEscaper();

	private String nullText = "";

	private HtmlTableRenderer() {
	}

	public static HtmlTableRenderer create() {
		return new HtmlTableRenderer();
	}

	/**
	 * Text shown in the cells of absent values, empty by default.
	 */
	public HtmlTableRenderer withNullText(String nullText) {
		this.nullText = checkNotNull(nullText);
		return this;
	}

	@Override
	public String render(List<String> dimensionNames, List<Object[]> records) {
		StringBuilder sb = new StringBuilder("<table>");

		sb.append("<tr>");
		for (String name : dimensionNames) {
			sb.append("<th>").append(ESCAPER.escape(name)).append("</th>");
		}
		sb.append("</tr>");

		for (Object[] record : records) {
			sb.append("<tr>");
			for (int i = 0; i < dimensionNames.size(); i++) {
				Object value = i < record.length ? record[i] : null;
				sb.append("<td>").append(ESCAPER.escape(value != null ? value.toString() : nullText)).append("</td>");
			}
			sb.append("</tr>");
		}

		return sb.append("</table>").toString();
	}
}
