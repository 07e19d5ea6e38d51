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
import java.util.Objects;

import static java.lang.String.format;

/**
 * Engine-assigned locator of a binary large object.
 * <p>
 * A {@code BlobId} is what a {@link SqlType#BLOB} column yields when fetched, and what a blob-typed parameter is bound
 * with. Its content is read through {@link Attachment#openBlob(Transaction, BlobId)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class BlobId {
	private final long value;

	private BlobId(long value) {
		this.value = value;
	}

	/**
	 * Factory method for providing {@link BlobId} instances.
	 *
	 * @param value the engine's blob locator value
	 * @return a blob id instance
	 */
	@NonNull
	public static BlobId of(long value) {
		return new BlobId(value);
	}

	public long getValue() {
		return this.value;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getValue());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BlobId))
			return false;

		return ((BlobId) object).getValue() == getValue();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{value=%s}", getClass().getSimpleName(), getValue());
	}
}
