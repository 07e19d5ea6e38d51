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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that represents one SQL operation: which statement, with which parameters, doing what.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementContext {
	/**
	 * The kinds of operation which are logged.
	 */
	public enum Operation {
		PREPARE,
		EXECUTE,
		EXECUTE_QUERY,
		EXECUTE_RETURNING,
		FETCH
	}

	@NonNull
	private final String sql;
	@NonNull
	private final Operation operation;
	@NonNull
	private final List<@Nullable Object> parameters;

	private StatementContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sql = requireNonNull(builder.sql);
		this.operation = requireNonNull(builder.operation);
		this.parameters = builder.parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.parameters));
	}

	/**
	 * Creates a {@link StatementContext} builder for the given SQL and operation.
	 *
	 * @param sql       the SQL text
	 * @param operation what is being done with the SQL
	 * @return a {@link StatementContext} builder
	 */
	@NonNull
	public static Builder with(@NonNull String sql,
														 @NonNull Operation operation) {
		requireNonNull(sql);
		requireNonNull(operation);

		return new Builder(sql, operation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getOperation(), getParameters());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementContext))
			return false;

		StatementContext statementContext = (StatementContext) object;

		return Objects.equals(statementContext.getSql(), getSql())
				&& Objects.equals(statementContext.getOperation(), getOperation())
				&& Objects.equals(statementContext.getParameters(), getParameters());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(3);

		components.add(format("sql=%s", getSql()));
		components.add(format("operation=%s", getOperation().name()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public Operation getOperation() {
		return this.operation;
	}

	/**
	 * The parameters as supplied by the caller, before conversion to native values.
	 *
	 * @return the caller-supplied parameters
	 */
	@NonNull
	public List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	/**
	 * Builder used to construct instances of {@link StatementContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String sql;
		@NonNull
		private final Operation operation;
		@Nullable
		private List<@Nullable Object> parameters;

		private Builder(@NonNull String sql,
										@NonNull Operation operation) {
			this.sql = requireNonNull(sql);
			this.operation = requireNonNull(operation);
		}

		@NonNull
		public Builder parameters(@Nullable List<@Nullable Object> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public StatementContext build() {
			return new StatementContext(this);
		}
	}
}
