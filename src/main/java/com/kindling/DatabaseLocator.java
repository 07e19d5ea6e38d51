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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Composes the locator string an {@link Engine} uses to find a database: {@code host/port:path}, {@code host:path}
 * or just {@code path} for a local database.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class DatabaseLocator {
	@NonNull
	private final String path;
	@Nullable
	private final String host;
	@Nullable
	private final Integer port;

	private DatabaseLocator(@NonNull Builder builder) {
		requireNonNull(builder);

		this.path = requireNonNull(builder.path);
		this.host = builder.host;
		this.port = builder.port;

		if (this.path.trim().length() == 0)
			throw new IllegalArgumentException("Database path cannot be blank");

		if (this.port != null && this.host == null)
			throw new IllegalArgumentException("A port requires a host");

		if (this.port != null && (this.port < 1 || this.port > 65535))
			throw new IllegalArgumentException(format("Illegal port %d", this.port));
	}

	/**
	 * Creates a {@link DatabaseLocator} builder for the given database path (or alias).
	 *
	 * @param path the database path on the server
	 * @return a {@link DatabaseLocator} builder
	 */
	@NonNull
	public static Builder withPath(@NonNull String path) {
		requireNonNull(path);
		return new Builder(path);
	}

	/**
	 * The engine locator string for this database.
	 *
	 * @return the locator string
	 */
	@NonNull
	public String toLocatorString() {
		if (this.host == null)
			return this.path;

		if (this.port == null)
			return format("%s:%s", this.host, this.path);

		return format("%s/%d:%s", this.host, this.port, this.path);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPath(), getHost(), getPort());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DatabaseLocator))
			return false;

		DatabaseLocator databaseLocator = (DatabaseLocator) object;

		return Objects.equals(databaseLocator.getPath(), getPath())
				&& Objects.equals(databaseLocator.getHost(), getHost())
				&& Objects.equals(databaseLocator.getPort(), getPort());
	}

	@Override
	@NonNull
	public String toString() {
		return toLocatorString();
	}

	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	public Optional<Integer> getPort() {
		return Optional.ofNullable(this.port);
	}

	/**
	 * Builder used to construct instances of {@link DatabaseLocator}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String path;
		@Nullable
		private String host;
		@Nullable
		private Integer port;

		private Builder(@NonNull String path) {
			this.path = requireNonNull(path);
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		@NonNull
		public DatabaseLocator build() {
			return new DatabaseLocator(this);
		}
	}
}
