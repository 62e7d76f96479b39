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


package io.cubico.cube.exception;

public final class InvalidRecordShapeException extends CubeException {
	public InvalidRecordShapeException(String message) {
		super(message);
	}

	public static InvalidRecordShapeException of(Object record) {
		return new InvalidRecordShapeException("Record has to be an array, a list or a map only, got " +
				(record == null ? "null" : record.getClass().getName()));
	}
}
