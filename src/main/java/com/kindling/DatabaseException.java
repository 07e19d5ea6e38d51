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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when an error occurs when interacting with a database through Kindling.
 * <p>
 * If the {@code cause} of this exception is an {@link EngineException} (or a {@link SQLException}), the
 * {@link #getErrorCode()} accessor is shorthand for retrieving the engine's error code.
 * <p>
 * More specific failures are reported via subclasses: {@link ConnectionException}, {@link SyntaxException},
 * {@link ParameterException}, {@link RuntimeQueryException}, {@link DisposedResourceException} and
 * {@link ConcurrentOperationException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 * <p>
	 * The message of this exception is the message of {@code cause}, unmodified.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		Integer errorCode = null;
		String sqlState = null;

		if (cause != null) {
			if (cause instanceof EngineException engineException) {
				errorCode = engineException.getErrorCode().orElse(null);

				// JDBC-backed engines carry the driver exception along
				if (engineException.getCause() instanceof SQLException sqlException)
					sqlState = sqlException.getSQLState();
			} else if (cause instanceof SQLException sqlException) {
				errorCode = sqlException.getErrorCode();
				sqlState = sqlException.getSQLState();
			} else if (cause instanceof DatabaseException databaseException) {
				errorCode = databaseException.getErrorCode().orElse(null);
				sqlState = databaseException.getSqlState().orElse(null);
			}
		}

		this.errorCode = errorCode;
		this.sqlState = sqlState;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(3);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Shorthand for {@link EngineException#getErrorCode()} if this exception was caused by an {@link EngineException}.
	 *
	 * @return the engine's error code, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was ultimately caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}
}
