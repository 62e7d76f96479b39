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

import java.util.List;

/**
 * Produces a display artifact from the contents of a cube. Implementations must not modify the records.
 *
 * @param <T> type of the produced artifact
 */
@FunctionalInterface
public interface CubeRenderer<T> {
	T render(List<String> dimensionNames, List<Object[]> records);
}
