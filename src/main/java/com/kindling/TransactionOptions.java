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
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Options used to start a {@link Transaction}.
 * <p>
 * Defaults are {@link TransactionIsolation#SNAPSHOT}, {@link AccessMode#READ_WRITE}, {@link WaitMode#WAIT} and no
 * lock timeout.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class TransactionOptions {
	@NonNull
	private static final TransactionOptions DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = withIsolation(TransactionIsolation.SNAPSHOT).build();
	}

	@NonNull
	private final TransactionIsolation isolation;
	@NonNull
	private final AccessMode accessMode;
	@NonNull
	private final WaitMode waitMode;
	@Nullable
	private final Duration lockTimeout;

	private TransactionOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.isolation = requireNonNull(builder.isolation);
		this.accessMode = builder.accessMode == null ? AccessMode.READ_WRITE : builder.accessMode;
		this.waitMode = builder.waitMode == null ? WaitMode.WAIT : builder.waitMode;
		this.lockTimeout = builder.lockTimeout;

		if (this.lockTimeout != null && this.lockTimeout.isNegative())
			throw new IllegalArgumentException(format("Lock timeout cannot be negative, got %s", this.lockTimeout));

		if (this.lockTimeout != null && this.waitMode == WaitMode.NO_WAIT)
			throw new IllegalArgumentException(format("A lock timeout is meaningless with %s.%s",
					WaitMode.class.getSimpleName(), WaitMode.NO_WAIT.name()));
	}

	/**
	 * Acquires the default set of transaction options.
	 *
	 * @return the default options
	 */
	@NonNull
	public static TransactionOptions defaultOptions() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Creates a {@link TransactionOptions} builder for the given isolation level.
	 *
	 * @param isolation the isolation level
	 * @return a {@link TransactionOptions} builder
	 */
	@NonNull
	public static Builder withIsolation(@NonNull TransactionIsolation isolation) {
		requireNonNull(isolation);
		return new Builder(isolation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getIsolation(), getAccessMode(), getWaitMode(), getLockTimeout());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof TransactionOptions))
			return false;

		TransactionOptions transactionOptions = (TransactionOptions) object;

		return Objects.equals(transactionOptions.getIsolation(), getIsolation())
				&& Objects.equals(transactionOptions.getAccessMode(), getAccessMode())
				&& Objects.equals(transactionOptions.getWaitMode(), getWaitMode())
				&& Objects.equals(transactionOptions.getLockTimeout(), getLockTimeout());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{isolation=%s, accessMode=%s, waitMode=%s, lockTimeout=%s}", getClass().getSimpleName(),
				getIsolation().name(), getAccessMode().name(), getWaitMode().name(), getLockTimeout().orElse(null));
	}

	@NonNull
	public TransactionIsolation getIsolation() {
		return this.isolation;
	}

	@NonNull
	public AccessMode getAccessMode() {
		return this.accessMode;
	}

	@NonNull
	public WaitMode getWaitMode() {
		return this.waitMode;
	}

	/**
	 * How long to wait for a conflicting lock when {@link WaitMode#WAIT} is in effect; empty means wait indefinitely.
	 *
	 * @return the lock timeout, or empty if none
	 */
	@NonNull
	public Optional<Duration> getLockTimeout() {
		return Optional.ofNullable(this.lockTimeout);
	}

	/**
	 * Builder used to construct instances of {@link TransactionOptions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final TransactionIsolation isolation;
		@Nullable
		private AccessMode accessMode;
		@Nullable
		private WaitMode waitMode;
		@Nullable
		private Duration lockTimeout;

		private Builder(@NonNull TransactionIsolation isolation) {
			this.isolation = requireNonNull(isolation);
		}

		@NonNull
		public Builder accessMode(@Nullable AccessMode accessMode) {
			this.accessMode = accessMode;
			return this;
		}

		@NonNull
		public Builder waitMode(@Nullable WaitMode waitMode) {
			this.waitMode = waitMode;
			return this;
		}

		@NonNull
		public Builder lockTimeout(@Nullable Duration lockTimeout) {
			this.lockTimeout = lockTimeout;
			return this;
		}

		@NonNull
		public TransactionOptions build() {
			return new TransactionOptions(this);
		}
	}
}
