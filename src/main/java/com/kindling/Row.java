/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
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

package com.kindling;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One row of statement output: an ordered sequence of {@link Value}s, one per output column.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Row {
	@NonNull
	private final List<@NonNull Value> values;

	Row(@NonNull List<@NonNull Value> values) {
		requireNonNull(values);
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	/**
	 * Factory method for providing {@link Row} instances.
	 *
	 * @param values the values of the row, in column order
	 * @return a row instance
	 */
	@NonNull
	public static Row of(@NonNull List<@NonNull Value> values) {
		requireNonNull(values);
		return new Row(values);
	}

	/**
	 * Number of columns in this row.
	 *
	 * @return the number of columns
	 */
	public int size() {
		return this.values.size();
	}

	/**
	 * Gets the typed value at the given 0-based column index.
	 *
	 * @param index 0-based column index
	 * @return the value at {@code index}
	 * @throws IndexOutOfBoundsException if there is no such column
	 */
	@NonNull
	public Value get(int index) {
		return this.values.get(index);
	}

	/**
	 * Gets the plain Java value at the given 0-based column index, as described by {@link Value#getObject()}.
	 *
	 * @param index 0-based column index
	 * @return the Java value at {@code index}, or {@code null} for SQL {@code NULL}
	 * @throws IndexOutOfBoundsException if there is no such column
	 */
	@Nullable
	public Object getObject(int index) {
		return get(index).getObject();
	}

	@NonNull
	public List<@NonNull Value> getValues() {
		return this.values;
	}

	/**
	 * The plain Java values of this row, in column order.
	 *
	 * @return the Java values of this row
	 */
	@NonNull
	public List<@Nullable Object> toList() {
		List<Object> objects = new ArrayList<>(this.values.size());

		for (Value value : this.values)
			objects.add(value.getObject());

		return Collections.unmodifiableList(objects);
	}

	/**
	 * Projects this row onto a label-keyed map, iterating in column order.
	 * <p>
	 * If two columns share a label, the later column wins.
	 *
	 * @param columnLabels the column labels, one per value
	 * @return the label-keyed projection of this row
	 */
	@NonNull
	Map<@NonNull String, @Nullable Object> toMap(@NonNull List<@NonNull String> columnLabels) {
		requireNonNull(columnLabels);

		if (columnLabels.size() != this.values.size())
			throw new IllegalArgumentException(format("Row has %d values but %d column labels were provided",
					this.values.size(), columnLabels.size()));

		Map<String, Object> map = new LinkedHashMap<>(columnLabels.size());

		for (int i = 0; i < columnLabels.size(); ++i)
			map.put(columnLabels.get(i), this.values.get(i).getObject());

		return Collections.unmodifiableMap(map);
	}

	@Override
	public int hashCode() {
		return this.values.hashCode();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Row))
			return false;

		return ((Row) object).values.equals(this.values);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s%s", getClass().getSimpleName(), toList());
	}
}
