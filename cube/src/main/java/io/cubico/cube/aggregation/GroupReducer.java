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

import io.cubico.cube.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static java.util.Collections.unmodifiableCollection;
import static java.util.Collections.unmodifiableList;

/**
 * Folds records into groups keyed by the values of the group-by dimensions.
 * <p>
 * Groups keep their discovery order. A record with an absent group-by value joins no group.
 */
public final class GroupReducer {
	private static final Logger logger = LoggerFactory.getLogger(GroupReducer.class);

	public static final class Group {
		private final GroupKey key;
		private final Object[] row;
		private final Object[] states;
		private final List<Object[]> children = new ArrayList<>();

		private Group(GroupKey key, Object[] row, Object[] states) {
			this.key = key;
			this.row = row;
			this.states = states;
		}

		public GroupKey getKey() {
			return key;
		}

		public Object[] getRow() {
			return row;
		}

		public List<Object[]> getChildren() {
			return unmodifiableList(children);
		}
	}

	private final int[] keyIndexes;
	private final DataType[] keyTypes;
	private final List<Aggregator<Object>> aggregators;

	private final LinkedHashMap<GroupKey, Group> groups = new LinkedHashMap<>();
	private int skipped;

	@SuppressWarnings("unchecked")
	GroupReducer(int[] keyIndexes, DataType[] keyTypes, List<Aggregator<?>> aggregators) {
		this.keyIndexes = keyIndexes;
		this.keyTypes = keyTypes;
		this.aggregators = new ArrayList<>(aggregators.size());
		for (Aggregator<?> aggregator : aggregators) {
			this.aggregators.add((Aggregator<Object>) aggregator);
		}
	}

	public void onRecord(Object[] record) {
		Object[] keyValues = new Object[keyIndexes.length];
		for (int i = 0; i < keyIndexes.length; i++) {
			Object value = record[keyIndexes[i]];
			if (value == null) {
				logger.trace("Record {} has no value for group-by position {}, skipped", record, keyIndexes[i]);
				skipped++;
				return;
			}
			keyValues[i] = keyTypes[i].toKey(value);
		}
		GroupKey key = new GroupKey(keyValues);

		Group group = groups.get(key);
		if (group == null) {
			Object[] row = new Object[keyIndexes.length + aggregators.size()];
			for (int i = 0; i < keyIndexes.length; i++) {
				row[i] = record[keyIndexes[i]];
			}
			Object[] states = new Object[aggregators.size()];
			for (int i = 0; i < aggregators.size(); i++) {
				states[i] = aggregators.get(i).createState();
			}
			group = new Group(key, row, states);
			groups.put(key, group);
		}

		group.children.add(record);
		int position = keyIndexes.length;
		for (int i = 0; i < aggregators.size(); i++) {
			group.row[position++] = aggregators.get(i).fold(record, group.states[i]);
		}
	}

	public Collection<Group> getGroups() {
		return unmodifiableCollection(groups.values());
	}

	public int getSkipped() {
		return skipped;
	}

	@Override
	public String toString() {
		return "GroupReducer{" +
				"keys=" + Arrays.toString(keyIndexes) +
				", aggregators=" + aggregators.size() +
				", groups=" + groups.size() +
				", skipped=" + skipped +
				'}';
	}
}
