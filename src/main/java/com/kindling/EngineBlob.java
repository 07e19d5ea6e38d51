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

/**
 * Engine-side handle for an open blob, either being written or being read.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface EngineBlob {
	@NonNull
	BlobId getId();

	/**
	 * Appends one segment to a blob open for writing.
	 *
	 * @param bytes  source buffer
	 * @param offset offset into {@code bytes}
	 * @param length number of bytes to write, at most {@link Blob#MAXIMUM_SEGMENT_SIZE}
	 * @throws EngineException if the segment could not be written
	 */
	void write(@NonNull byte[] bytes,
						 int offset,
						 int length) throws EngineException;

	/**
	 * Reads from a blob open for reading. Fewer bytes than requested may be returned.
	 *
	 * @param bytes  destination buffer
	 * @param offset offset into {@code bytes}
	 * @param length maximum number of bytes to read
	 * @return the number of bytes read, or {@code -1} at end of blob
	 * @throws EngineException if the blob could not be read
	 */
	int read(@NonNull byte[] bytes,
					 int offset,
					 int length) throws EngineException;

	long length() throws EngineException;

	/**
	 * Closes the blob. For a blob being written, this finalizes its content.
	 *
	 * @throws EngineException if the blob could not be closed
	 */
	void close() throws EngineException;

	/**
	 * Discards a blob being written without finalizing it.
	 *
	 * @throws EngineException if the blob could not be cancelled
	 */
	void cancel() throws EngineException;
}
