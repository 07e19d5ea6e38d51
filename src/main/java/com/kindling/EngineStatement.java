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

import java.util.List;

/**
 * Engine-side handle for one prepared statement.
 * <p>
 * Parameter and row values are in the engine's native representations, as documented on {@link SqlType}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface EngineStatement {
	@NonNull
	List<@NonNull ColumnDescriptor> getInputDescriptors();

	/**
	 * Descriptors of the statement's output columns, empty for statements that return nothing.
	 *
	 * @return the output column descriptors
	 */
	@NonNull
	List<@NonNull ColumnDescriptor> getOutputDescriptors();

	void execute(@NonNull EngineTransaction transaction,
							 @NonNull List<@Nullable Object> parameters) throws EngineException;

	/**
	 * Executes the statement and returns its single output row.
	 *
	 * @param transaction the transaction to execute under
	 * @param parameters  native parameter values
	 * @return the native values of the single row, or {@code null} if the statement produced no row
	 * @throws EngineException if execution failed or more than one row was produced
	 */
	@Nullable
	List<@Nullable Object> executeSingleton(@NonNull EngineTransaction transaction,
																					@NonNull List<@Nullable Object> parameters) throws EngineException;

	@NonNull
	EngineCursor openCursor(@NonNull EngineTransaction transaction,
													@NonNull List<@Nullable Object> parameters) throws EngineException;

	void free() throws EngineException;
}
