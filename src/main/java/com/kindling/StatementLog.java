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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A collection of SQL statement execution diagnostics.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final StatementContext statementContext;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration fetchDuration;
	@Nullable
	private final Integer rowCount;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statementContext = requireNonNull(builder.statementContext);
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.fetchDuration = builder.fetchDuration;
		this.rowCount = builder.rowCount;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.fetchDuration != null)
			totalDuration = totalDuration.plus(this.fetchDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code statementContext}.
	 *
	 * @param statementContext current SQL context
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withStatementContext(@NonNull StatementContext statementContext) {
		requireNonNull(statementContext);
		return new Builder(statementContext);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(7);

		components.add(format("statementContext=%s", getStatementContext()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		Duration preparationDuration = getPreparationDuration().orElse(null);

		if (preparationDuration != null)
			components.add(format("preparationDuration=%s", preparationDuration));

		Duration executionDuration = getExecutionDuration().orElse(null);

		if (executionDuration != null)
			components.add(format("executionDuration=%s", executionDuration));

		Duration fetchDuration = getFetchDuration().orElse(null);

		if (fetchDuration != null)
			components.add(format("fetchDuration=%s", fetchDuration));

		Integer rowCount = getRowCount().orElse(null);

		if (rowCount != null)
			components.add(format("rowCount=%s", rowCount));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getStatementContext(), statementLog.getStatementContext())
				&& Objects.equals(getPreparationDuration(), statementLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getFetchDuration(), statementLog.getFetchDuration())
				&& Objects.equals(getRowCount(), statementLog.getRowCount())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatementContext(), getPreparationDuration(), getExecutionDuration(), getFetchDuration(),
				getRowCount(), getException());
	}

	/**
	 * How long did it take to prepare the statement, or to convert and bind its parameters?
	 *
	 * @return the preparation time, if available
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	/**
	 * How long did the engine take to execute the statement?
	 *
	 * @return the execution time, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to fetch and convert a batch of rows from a cursor?
	 *
	 * @return the fetch time, if available
	 */
	@NonNull
	public Optional<Duration> getFetchDuration() {
		return Optional.ofNullable(this.fetchDuration);
	}

	/**
	 * How long did the operation take in total?
	 * <p>
	 * This is the sum of {@link #getPreparationDuration()} + {@link #getExecutionDuration()} +
	 * {@link #getFetchDuration()}.
	 *
	 * @return how long the operation took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public StatementContext getStatementContext() {
		return this.statementContext;
	}

	/**
	 * Number of rows produced by the operation.
	 *
	 * @return the number of rows, if applicable
	 */
	@NonNull
	public Optional<Integer> getRowCount() {
		return Optional.ofNullable(this.rowCount);
	}

	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final StatementContext statementContext;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration fetchDuration;
		@Nullable
		private Integer rowCount;
		@Nullable
		private Exception exception;

		private Builder(@NonNull StatementContext statementContext) {
			requireNonNull(statementContext);
			this.statementContext = statementContext;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder fetchDuration(@Nullable Duration fetchDuration) {
			this.fetchDuration = fetchDuration;
			return this;
		}

		@NonNull
		public Builder rowCount(@Nullable Integer rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
