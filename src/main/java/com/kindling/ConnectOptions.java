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
 * Options used to attach to an existing database.
 * <p>
 * Options passed to {@link Client#connect(String, ConnectOptions)} are merged field by field over the client's
 * {@link Client#getDefaultConnectOptions()}: any field set on the call options wins.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ConnectOptions {
	@NonNull
	private static final ConnectOptions EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new Builder().build();
	}

	@Nullable
	private final String username;
	@Nullable
	private final String password;
	@Nullable
	private final String role;

	private ConnectOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.username = builder.username;
		this.password = builder.password;
		this.role = builder.role;
	}

	/**
	 * Acquires options with no fields set.
	 *
	 * @return options with no fields set
	 */
	@NonNull
	public static ConnectOptions empty() {
		return EMPTY_INSTANCE;
	}

	/**
	 * Creates a {@link ConnectOptions} builder for the given username.
	 *
	 * @param username the user to attach as
	 * @return a {@link ConnectOptions} builder
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
	ConnectOptions mergedOver(@NonNull ConnectOptions defaults) {
		requireNonNull(defaults);

		return new Builder()
				.username(this.username != null ? this.username : defaults.username)
				.password(this.password != null ? this.password : defaults.password)
				.role(this.role != null ? this.role : defaults.role)
				.build();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getUsername(), getPassword(), getRole());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ConnectOptions))
			return false;

		ConnectOptions connectOptions = (ConnectOptions) object;

		return Objects.equals(connectOptions.getUsername(), getUsername())
				&& Objects.equals(connectOptions.getPassword(), getPassword())
				&& Objects.equals(connectOptions.getRole(), getRole());
	}

	@Override
	@NonNull
	public String toString() {
		// Never include the password
		return format("%s{username=%s, password=%s, role=%s}", getClass().getSimpleName(), this.username,
				this.password == null ? null : "[redacted]", this.role);
	}

	@NonNull
	public Optional<String> getUsername() {
		return Optional.ofNullable(this.username);
	}

	@NonNull
	public Optional<String> getPassword() {
		return Optional.ofNullable(this.password);
	}

	@NonNull
	public Optional<String> getRole() {
		return Optional.ofNullable(this.role);
	}

	/**
	 * Builder used to construct instances of {@link ConnectOptions}.
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
		private String role;

		private Builder() {
			// Use ConnectOptions.withUsername(...)
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
		public Builder role(@Nullable String role) {
			this.role = role;
			return this;
		}

		@NonNull
		public ConnectOptions build() {
			return new ConnectOptions(this);
		}
	}
}
