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

/**
 * Base class of every validation failure raised by a cube.
 * <p>
 * All of them are detected synchronously at the offending call, before any state is changed,
 * so a cube that threw one of these is left exactly as it was.
 */
public abstract class CubeException extends RuntimeException {
	protected CubeException(String message) {
		super(message);
	}

	protected CubeException(String message, Throwable cause) {
		super(message, cause);
	}
}
