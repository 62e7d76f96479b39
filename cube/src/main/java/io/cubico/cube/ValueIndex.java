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

import java.util.*;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

/**
 * Maps every distinct value of a dimension to the positions of the records holding it,
 * in insertion order. Supports equality lookups only.
 */
public final class ValueIndex {
	private final Map<Object, List<Integer>> positions = new HashMap<>();

	boolean add(Object key, int position) {
		List<Integer> list = positions.get(key);
		boolean added = list == null;
		if (added) {
			list = new ArrayList<>();
			positions.put(key, list);
		}
		list.add(position);
		return added;
	}

	public boolean contains(Object key) {
		return positions.containsKey(key);
	}

	public List<Integer> get(Object key) {
		List<Integer> list = positions.get(key);
		return list != null ? unmodifiableList(list) : emptyList();
	}

	public int count(Object key) {
		List<Integer> list = positions.get(key);
		return list != null ? list.size() : 0;
	}

	public Set<Object> keys() {
		return Collections.unmodifiableSet(positions.keySet());
	}

	public int size() {
		return positions.size();
	}

	@Override
	public String toString() {
		return "ValueIndex{size=" + positions.size() + '}';
	}
}
