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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when statement parameters cannot be bound, e.g. the wrong number of parameters was supplied or a value
 * cannot be converted to the type the engine expects.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ParameterException extends DatabaseException {
	/**
	 * Creates a {@code ParameterException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public ParameterException(@Nullable String message) {
		super(message);
	}

	/**
	 * Creates a {@code ParameterException} which wraps the given {@code cause}, keeping its message unmodified.
	 *
	 * @param cause the cause of this exception
	 */
	public ParameterException(@Nullable Throwable cause) {
		super(cause);
	}

	/**
	 * Creates a {@code ParameterException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public ParameterException(@Nullable String message,
	                          @Nullable Throwable cause) {
		super(message, cause);
	}
}
