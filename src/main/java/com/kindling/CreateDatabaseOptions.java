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
 * Options used to create a new database.
 * <p>
 * Options passed to {@link Client#createDatabase(String, CreateDatabaseOptions)} are merged field by field over the
 * client's {@link Client#getDefaultCreateDatabaseOptions()}: any field set on the call options wins.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class CreateDatabaseOptions {
	@NonNull
	private static final CreateDatabaseOptions EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new Builder().build();
	}

	@Nullable
	private final String username;
	@Nullable
	private final String password;
	@Nullable
	private final Boolean forcedWrite;
	@Nullable
	private final Integer pageSize;

	private CreateDatabaseOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.username = builder.username;
		this.password = builder.password;
		this.forcedWrite = builder.forcedWrite;
		this.pageSize = builder.pageSize;

		if (this.pageSize != null && this.pageSize < 1)
			throw new IllegalArgumentException(format("Page size must be positive, got %d", this.pageSize));
	}

	/**
	 * Acquires options with no fields set.
	 *
	 * @return options with no fields set
	 */
	@NonNull
	public static CreateDatabaseOptions empty() {
		return EMPTY_INSTANCE;
	}

	/**
	 * Creates a {@link CreateDatabaseOptions} builder for the given username.
	 *
	 * @param username the user who will own the new database
	 * @return a {@link CreateDatabaseOptions} builder
	 */
	@NonNull
	public static Builder withUsername(@Nullable String username) {
		return new Builder().username(username);
	}

	/**
	 * Merges these options over {@code defaults}: fields set here win, unset fields fall back to {@code defaults}.
	 *
	 * @param defaults the options to fall back to
	 * @return the merged options
	 */
	@NonNull
	CreateDatabaseOptions mergedOver(@NonNull CreateDatabaseOptions defaults) {
		requireNonNull(defaults);

		return new Builder()
				.username(this.username != null ? this.username : defaults.username)
				.password(this.password != null ? this.password : defaults.password)
				.forcedWrite(this.forcedWrite != null ? this.forcedWrite : defaults.forcedWrite)
				.pageSize(this.pageSize != null ? this.pageSize : defaults.pageSize)
				.build();
	}

	/**
	 * The subset of these options which also applies when attaching, used to connect to the newly-created database.
	 *
	 * @return the corresponding connect options
	 */
	@NonNull
	public ConnectOptions toConnectOptions() {
		return ConnectOptions.withUsername(this.username).password(this.password).build();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getUsername(), getPassword(), getForcedWrite(), getPageSize());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof CreateDatabaseOptions))
			return false;

		CreateDatabaseOptions createDatabaseOptions = (CreateDatabaseOptions) object;

		return Objects.equals(createDatabaseOptions.getUsername(), getUsername())
				&& Objects.equals(createDatabaseOptions.getPassword(), getPassword())
				&& Objects.equals(createDatabaseOptions.getForcedWrite(), getForcedWrite())
				&& Objects.equals(createDatabaseOptions.getPageSize(), getPageSize());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{username=%s, password=%s, forcedWrite=%s, pageSize=%s}", getClass().getSimpleName(),
				this.username, this.password == null ? null : "[redacted]", this.forcedWrite, this.pageSize);
	}

	@NonNull
	public Optional<String> getUsername() {
		return Optional.ofNullable(this.username);
	}

	@NonNull
	public Optional<String> getPassword() {
		return Optional.ofNullable(this.password);
	}

	/**
	 * Should the database write pages synchronously to disk?
	 *
	 * @return whether forced writes are enabled, or empty to use the engine default
	 */
	@NonNull
	public Optional<Boolean> getForcedWrite() {
		return Optional.ofNullable(this.forcedWrite);
	}

	@NonNull
	public Optional<Integer> getPageSize() {
		return Optional.ofNullable(this.pageSize);
	}

	/**
	 * Builder used to construct instances of {@link CreateDatabaseOptions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private String username;
		@Nullable
		private String password;
		@Nullable
		private Boolean forcedWrite;
		@Nullable
		private Integer pageSize;

		private Builder() {
			// Use CreateDatabaseOptions.withUsername(...)
		}

		@NonNull
		public Builder username(@Nullable String username) {
			this.username = username;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		@NonNull
		public Builder forcedWrite(@Nullable Boolean forcedWrite) {
			this.forcedWrite = forcedWrite;
			return this;
		}

		@NonNull
		public Builder pageSize(@Nullable Integer pageSize) {
			this.pageSize = pageSize;
			return this;
		}

		@NonNull
		public CreateDatabaseOptions build() {
			return new CreateDatabaseOptions(this);
		}
	}
}
