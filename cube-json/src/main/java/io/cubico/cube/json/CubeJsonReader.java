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


package io.cubico.cube.json;

import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.cubico.cube.Cube;
import io.cubico.cube.exception.InvalidRecordShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads labeled records from JSON into a cube.
 * <p>
 * The input is either one object or an array of objects; each object becomes one record, its
 * properties naming the dimensions. Nested arrays and objects are kept as their JSON text.
 */
public final class CubeJsonReader {
	private static final Logger logger = LoggerFactory.getLogger(CubeJsonReader.class);

	private boolean lenient;

	private CubeJsonReader() {
	}

	public static CubeJsonReader create() {
		return new CubeJsonReader();
	}

	public CubeJsonReader withLenient(boolean lenient) {
		this.lenient = lenient;
		return this;
	}

	public Cube read(String json) throws IOException {
		return read(new StringReader(json));
	}

	public Cube read(Reader reader) throws IOException {
		Cube cube = Cube.create();
		readInto(cube, reader);
		return cube;
	}

	/**
	 * Adds every record of the input to the given cube.
	 *
	 * @return number of records added
	 */
	public int readInto(Cube cube, Reader reader) throws IOException {
		JsonReader in = new JsonReader(reader);
		in.setLenient(lenient);
		int count = 0;
		JsonToken token = in.peek();
		if (token == JsonToken.BEGIN_OBJECT) {
			cube.addRecord(readRecord(in));
			count++;
		} else if (token == JsonToken.BEGIN_ARRAY) {
			in.beginArray();
			while (in.hasNext()) {
				JsonToken element = in.peek();
				if (element != JsonToken.BEGIN_OBJECT)
					throw new InvalidRecordShapeException("Record #" + count + " is not an object but " + element);
				cube.addRecord(readRecord(in));
				count++;
			}
			in.endArray();
		} else {
			throw new InvalidRecordShapeException("Expected an object or an array of objects, got " + token);
		}
		logger.debug("Read {} records into {}", count, cube);
		return count;
	}

	private static Map<String, Object> readRecord(JsonReader in) throws IOException {
		Map<String, Object> record = new LinkedHashMap<>();
		in.beginObject();
		while (in.hasNext()) {
			String name = in.nextName();
			record.put(name, readValue(in));
		}
		in.endObject();
		return record;
	}

	private static Object readValue(JsonReader in) throws IOException {
		switch (in.peek()) {
			case NULL:
				in.nextNull();
				return null;
			case NUMBER:
				return in.nextDouble();
			case BOOLEAN:
				return in.nextBoolean();
			case STRING:
				return in.nextString();
			default:
				return JsonParser.parseReader(in).toString();
		}
	}
}
