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

import java.util.List;

/**
 * Engine-side handle for an open cursor.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface EngineCursor {
	/**
	 * Fetches the next row.
	 * <p>
	 * Engines may evaluate lazily, so a failure here can follow any number of successfully fetched rows.
	 *
	 * @return native values of the next row, or {@code null} at end of data
	 * @throws EngineException if the row could not be produced
	 */
	@Nullable
	List<@Nullable Object> fetchNext() throws EngineException;

	void close() throws EngineException;
}
