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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;

/**
 * Options for {@link ResultSet#fetch(FetchOptions)}.
 * <p>
 * An unset fetch size defers to the next level of defaults: the result set's default fetch options, then the
 * attachment's, then {@link #DEFAULT_FETCH_SIZE}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class FetchOptions {
	/**
	 * Number of rows fetched per call when no level of configuration specifies one.
	 */
	public static final int DEFAULT_FETCH_SIZE = 200;

	@NonNull
	private static final FetchOptions EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new FetchOptions(null);
	}

	@Nullable
	private final Integer fetchSize;

	private FetchOptions(@Nullable Integer fetchSize) {
		if (fetchSize != null && fetchSize < 1)
			throw new IllegalArgumentException(format("Fetch size must be at least 1, got %d", fetchSize));

		this.fetchSize = fetchSize;
	}

	/**
	 * Acquires options with no fetch size set.
	 *
	 * @return options with no fetch size set
	 */
	@NonNull
	public static FetchOptions empty() {
		return EMPTY_INSTANCE;
	}

	/**
	 * Acquires options with the given fetch size.
	 *
	 * @param fetchSize maximum number of rows per fetch, at least 1
	 * @return options with the given fetch size
	 */
	@NonNull
	public static FetchOptions withFetchSize(int fetchSize) {
		return new FetchOptions(fetchSize);
	}

	@NonNull
	public Optional<Integer> getFetchSize() {
		return Optional.ofNullable(this.fetchSize);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(this.fetchSize);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof FetchOptions))
			return false;

		return Objects.equals(((FetchOptions) object).fetchSize, this.fetchSize);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{fetchSize=%s}", getClass().getSimpleName(), this.fetchSize);
	}
}
