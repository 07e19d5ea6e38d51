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
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Base for everything an {@link Attachment} hands out: transactions, statements, result sets, blobs and event
 * subscriptions.
 * <p>
 * Each resource is registered in its attachment's resource table under a numeric handle. Releasing a resource, either
 * explicitly or because its attachment went away, happens exactly once.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
abstract class AttachmentResource {
	@NonNull
	private final Attachment attachment;
	@NonNull
	private final Long handle;
	@NonNull
	private final OperationGuard operationGuard;
	@NonNull
	private final AtomicBoolean released;
	@NonNull
	private final Logger logger;

	AttachmentResource(@NonNull Attachment attachment) {
		requireNonNull(attachment);

		this.attachment = attachment;
		this.handle = attachment.nextHandle();
		this.operationGuard = new OperationGuard(format("%s %d", getClass().getSimpleName(), this.handle));
		this.released = new AtomicBoolean(false);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Releases whatever the engine holds for this resource. Invoked at most once.
	 *
	 * @throws EngineException if the engine failed to release the resource
	 */
	abstract void releaseEngineResources() throws EngineException;

	/**
	 * Marks this resource as released and removes it from its attachment's resource table.
	 *
	 * @return {@code true} if this call released the resource, {@code false} if it had already been released
	 */
	boolean markReleased() {
		if (!this.released.compareAndSet(false, true))
			return false;

		getAttachment().unregister(this);
		return true;
	}

	/**
	 * Forcibly releases this resource on behalf of its attachment. Failures are logged, never thrown.
	 */
	void invalidate() {
		if (!markReleased())
			return;

		try {
			releaseEngineResources();
		} catch (Exception e) {
			logger.log(WARNING, format("Unable to release %s", this), e);
		}
	}

	void ensureNotReleased() {
		if (isReleased())
			throw new DisposedResourceException(format("%s %d has already been released", getClass().getSimpleName(), getHandle()));
	}

	boolean isReleased() {
		return this.released.get();
	}

	@NonNull
	Attachment getAttachment() {
		return this.attachment;
	}

	@NonNull
	Long getHandle() {
		return this.handle;
	}

	@NonNull
	OperationGuard getOperationGuard() {
		return this.operationGuard;
	}
}
