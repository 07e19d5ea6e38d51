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
 * Thrown when an operation is attempted on a resource which has already been released: a committed or rolled back
 * {@link Transaction}, a disposed {@link Statement}, a closed {@link ResultSet} or {@link Blob}, a cancelled
 * {@link EventSubscription} or a disconnected {@link Attachment}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class DisposedResourceException extends DatabaseException {
	/**
	 * Creates a {@code DisposedResourceException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DisposedResourceException(@Nullable String message) {
		super(message);
	}
}
