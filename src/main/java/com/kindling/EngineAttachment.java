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

import java.util.Map;

/**
 * Engine-side handle for one attachment (connection) to a database.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface EngineAttachment {
	@NonNull
	EngineTransaction startTransaction(@NonNull TransactionOptions options) throws EngineException;

	/**
	 * Prepares (parses and describes) a SQL statement.
	 * <p>
	 * The returned statement may later be executed under any transaction of this attachment, not only the one it was
	 * prepared under.
	 *
	 * @param transaction the transaction to prepare under
	 * @param sql         the SQL to prepare
	 * @return the prepared statement
	 * @throws EngineException if the SQL is invalid; the message is the engine's diagnostic text
	 */
	@NonNull
	EngineStatement prepare(@NonNull EngineTransaction transaction,
													@NonNull String sql) throws EngineException;

	/**
	 * Creates a new, empty blob open for writing.
	 *
	 * @param transaction the transaction the blob belongs to
	 * @return the blob
	 * @throws EngineException if the blob could not be created
	 */
	@NonNull
	EngineBlob createBlob(@NonNull EngineTransaction transaction) throws EngineException;

	/**
	 * Opens an existing blob for reading.
	 *
	 * @param transaction the transaction to read under
	 * @param blobId      the blob to open
	 * @return the blob
	 * @throws EngineException if the blob could not be opened
	 */
	@NonNull
	EngineBlob openBlob(@NonNull EngineTransaction transaction,
											@NonNull BlobId blobId) throws EngineException;

	/**
	 * Registers interest in the given events.
	 * <p>
	 * The registration fires {@code listener} exactly once, possibly from within this call itself, as soon as the count of any event exceeds its value in {@code baselineCounts}. The listener receives the absolute
	 * counts of every registered event. To keep listening, callers register again with the received counts as the new
	 * baseline. A baseline of {@code -1} fires immediately with the current counts.
	 *
	 * @param baselineCounts event names mapped to the counts already seen
	 * @param listener       the listener to fire
	 * @return the registration, which can be cancelled before it fires
	 * @throws EngineException if the engine does not support events or the registration failed
	 */
	@NonNull
	EngineEventRegistration queueEvents(@NonNull Map<@NonNull String, @NonNull Long> baselineCounts,
																			@NonNull EngineEventListener listener) throws EngineException;

	void disconnect() throws EngineException;

	/**
	 * Drops the attached database. On success the attachment is also released.
	 *
	 * @throws EngineException if the database could not be dropped
	 */
	void dropDatabase() throws EngineException;
}
