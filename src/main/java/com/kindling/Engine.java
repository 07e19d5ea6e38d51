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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Contract for the low-level component that actually talks to a database server (via a wire protocol, a native client
 * library, JDBC ...).
 * <p>
 * Kindling owns all session, transaction, statement, cursor, blob and event bookkeeping; engines only perform the
 * individual calls. Engine calls are blocking and are always made from the {@link Client}'s executor.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public interface Engine {
	/**
	 * Creates a new database at the given locator and attaches to it.
	 *
	 * @param locator engine-specific database locator, e.g. {@code localhost/3050:/data/test.fdb}
	 * @param options options for the new database
	 * @return an attachment to the newly-created database
	 * @throws EngineException if the database could not be created
	 */
	@NonNull
	EngineAttachment createDatabase(@NonNull String locator,
																	@NonNull CreateDatabaseOptions options) throws EngineException;

	/**
	 * Attaches to an existing database.
	 *
	 * @param locator engine-specific database locator
	 * @param options connection options
	 * @return an attachment to the database
	 * @throws EngineException if the attachment could not be established
	 */
	@NonNull
	EngineAttachment connect(@NonNull String locator,
													 @NonNull ConnectOptions options) throws EngineException;

	/**
	 * Releases any engine-wide resources. Called once, by {@link Client#dispose()}.
	 *
	 * @throws EngineException if the engine failed to release its resources
	 */
	void dispose() throws EngineException;
}
