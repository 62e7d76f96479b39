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

import com.google.common.primitives.Ints;
import org.jetbrains.annotations.Nullable;

import java.util.Properties;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Defaults a new {@link Cube} starts with.
 * <p>
 * Each setting is looked up as {@code io.cubico.cube.Cube.<name>} first, then as {@code Cube.<name>},
 * for example {@code -DCube.useValueIndex=false}.
 */
public final class CubeSettings {
	public static final String COPY_ON_INSERT = "copyOnInsert";
	public static final String USE_VALUE_INDEX = "useValueIndex";
	public static final String INITIAL_CAPACITY = "initialCapacity";

	public static final CubeSettings DEFAULTS = new CubeSettings(true, true, 16);

	private final boolean copyOnInsert;
	private final boolean useValueIndex;
	private final int initialCapacity;

	private CubeSettings(boolean copyOnInsert, boolean useValueIndex, int initialCapacity) {
		this.copyOnInsert = copyOnInsert;
		this.useValueIndex = useValueIndex;
		this.initialCapacity = initialCapacity;
	}

	public static CubeSettings fromSystemProperties() {
		return fromProperties(System.getProperties());
	}

	/**
	 * Reads the settings present in {@code properties}, falling back to {@link #DEFAULTS} for the others.
	 *
	 * @throws IllegalArgumentException if a setting is present but malformed
	 */
	public static CubeSettings fromProperties(Properties properties) {
		return new CubeSettings(
				toBoolean(COPY_ON_INSERT, lookup(properties, COPY_ON_INSERT), DEFAULTS.copyOnInsert),
				toBoolean(USE_VALUE_INDEX, lookup(properties, USE_VALUE_INDEX), DEFAULTS.useValueIndex),
				toCapacity(lookup(properties, INITIAL_CAPACITY), DEFAULTS.initialCapacity));
	}

	@Nullable
	private static String lookup(Properties properties, String name) {
		String value = properties.getProperty(Cube.class.getName() + "." + name);
		if (value == null)
			value = properties.getProperty(Cube.class.getSimpleName() + "." + name);
		return value != null ? value.trim() : null;
	}

	private static boolean toBoolean(String name, @Nullable String value, boolean defValue) {
		if (value == null)
			return defValue;
		checkArgument(value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false"),
				"Cube.%s must be true or false, got '%s'", name, value);
		return Boolean.parseBoolean(value);
	}

	private static int toCapacity(@Nullable String value, int defValue) {
		if (value == null)
			return defValue;
		Integer capacity = Ints.tryParse(value);
		checkArgument(capacity != null && capacity >= 0,
				"Cube.%s must be a non-negative integer, got '%s'", INITIAL_CAPACITY, value);
		return capacity;
	}

	public boolean isCopyOnInsert() {
		return copyOnInsert;
	}

	public boolean isUseValueIndex() {
		return useValueIndex;
	}

	public int getInitialCapacity() {
		return initialCapacity;
	}

	@Override
	public String toString() {
		return "CubeSettings{" +
				"copyOnInsert=" + copyOnInsert +
				", useValueIndex=" + useValueIndex +
				", initialCapacity=" + initialCapacity +
				'}';
	}
}
