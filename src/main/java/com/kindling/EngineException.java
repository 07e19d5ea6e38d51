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
import java.util.Optional;

import static java.lang.String.format;

/**
 * Thrown by an {@link Engine} implementation when the database server (or native library) reports a failure.
 * <p>
 * The message is the engine's diagnostic text, which is frequently multi-line, for example:
 * <pre>
 * Dynamic SQL Error
 * -SQL error code = -104
 * -Token unknown - line 1, column 8
 * -select</pre>
 * Kindling never rewrites this text; it becomes the message of the {@link DatabaseException} handed to callers.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class EngineException extends Exception {
	@Nullable
	private final Integer errorCode;

	/**
	 * Creates an {@code EngineException} with the given diagnostic text and no error code.
	 *
	 * @param message the engine's diagnostic text
	 */
	public EngineException(@Nullable String message) {
		this(message, null, null);
	}

	/**
	 * Creates an {@code EngineException} with the given diagnostic text and SQL error code.
	 *
	 * @param message   the engine's diagnostic text
	 * @param errorCode the engine's SQL error code
	 */
	public EngineException(@Nullable String message,
												 @Nullable Integer errorCode) {
		this(message, errorCode, null);
	}

	/**
	 * Creates an {@code EngineException} with the given diagnostic text, SQL error code and underlying cause.
	 *
	 * @param message   the engine's diagnostic text
	 * @param errorCode the engine's SQL error code
	 * @param cause     the underlying cause, e.g. a driver-level exception
	 */
	public EngineException(@Nullable String message,
												 @Nullable Integer errorCode,
												 @Nullable Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}

	/**
	 * The engine's SQL error code, if it reported one.
	 *
	 * @return the SQL error code, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	@Override
	public String toString() {
		return format("%s{errorCode=%s, message=%s}", getClass().getSimpleName(), this.errorCode, getMessage());
	}
}
