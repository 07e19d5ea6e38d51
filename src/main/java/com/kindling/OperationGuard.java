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
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fail-fast marker for "an operation is in flight on this resource".
 * <p>
 * Acquiring a guard that is already held throws {@link ConcurrentOperationException} immediately instead of waiting.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class OperationGuard {
	@NonNull
	private final String description;
	@NonNull
	private final AtomicBoolean busy;

	OperationGuard(@NonNull String description) {
		this.description = requireNonNull(description);
		this.busy = new AtomicBoolean(false);
	}

	void acquire() {
		if (!this.busy.compareAndSet(false, true))
			throw new ConcurrentOperationException(format("Another operation is already in progress on %s. "
					+ "Operations must be awaited one at a time.", this.description));
	}

	void release() {
		this.busy.set(false);
	}

	boolean isBusy() {
		return this.busy.get();
	}

	/**
	 * Acquires every guard in order; if any is busy, the ones already acquired are released before throwing.
	 */
	static void acquireAll(@NonNull List<@NonNull OperationGuard> operationGuards) {
		requireNonNull(operationGuards);

		int acquired = 0;

		try {
			for (OperationGuard operationGuard : operationGuards) {
				operationGuard.acquire();
				++acquired;
			}
		} catch (ConcurrentOperationException e) {
			for (int i = 0; i < acquired; ++i)
				operationGuards.get(i).release();

			throw e;
		}
	}

	static void releaseAll(@NonNull List<@NonNull OperationGuard> operationGuards) {
		requireNonNull(operationGuards);

		for (OperationGuard operationGuard : operationGuards)
			operationGuard.release();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{description=%s, busy=%s}", getClass().getSimpleName(), this.description, isBusy());
	}
}
