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

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A binary large object being written (via {@link Attachment#createBlob(Transaction)}) or read (via
 * {@link Attachment#openBlob(Transaction, BlobId)}). A blob is in exactly one of those modes for its whole life.
 * <p>
 * Writes are split into engine segments of at most {@link #MAXIMUM_SEGMENT_SIZE} bytes. Reads may return fewer bytes
 * than requested; {@code -1} signals the end of the blob.
 * <p>
 * Calling a write operation on a read-mode blob (or vice versa) throws {@link IllegalStateException} immediately.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Blob extends AttachmentResource {
	/**
	 * Largest number of bytes handed to the engine in one blob write.
	 */
	public static final int MAXIMUM_SEGMENT_SIZE = 65_535;

	enum Mode {
		WRITE,
		READ
	}

	@NonNull
	private final Transaction transaction;
	@NonNull
	private final EngineBlob engineBlob;
	@NonNull
	private final Mode mode;
	@NonNull
	private final BlobId id;
	@NonNull
	private final Logger logger;

	@Nullable
	private volatile Long length;
	private volatile boolean finished;

	Blob(@NonNull Attachment attachment,
			 @NonNull Transaction transaction,
			 @NonNull EngineBlob engineBlob,
			 @NonNull Mode mode) {
		super(attachment);

		requireNonNull(transaction);
		requireNonNull(engineBlob);
		requireNonNull(mode);

		this.transaction = transaction;
		this.engineBlob = engineBlob;
		this.mode = mode;
		this.id = requireNonNull(engineBlob.getId());
		this.logger = Logger.getLogger(Blob.class.getName());
		this.finished = false;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{handle=%s, id=%s, mode=%s, closed=%s}", getClass().getSimpleName(), getHandle(),
				getId().getValue(), this.mode.name(), isClosed());
	}

	@NonNull
	public CompletableFuture<Void> write(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return write(bytes, 0, bytes.length);
	}

	/**
	 * Appends bytes to a blob opened for writing.
	 *
	 * @param bytes  source buffer
	 * @param offset offset into {@code bytes}
	 * @param length number of bytes to append
	 * @return a future which completes when the bytes have been written
	 * @throws IllegalStateException if this blob was opened for reading
	 */
	@NonNull
	public CompletableFuture<Void> write(@NonNull byte[] bytes,
																			 int offset,
																			 int length) {
		requireNonNull(bytes);
		checkBounds(bytes, offset, length);
		ensureMode(Mode.WRITE, "write to");

		return getAttachment().getClient().perform(List.of(getOperationGuard(), getTransaction().getOperationGuard()), () -> {
			ensureUsable();

			try {
				for (int written = 0; written < length; written += MAXIMUM_SEGMENT_SIZE)
					getEngineBlob().write(bytes, offset + written, Math.min(MAXIMUM_SEGMENT_SIZE, length - written));
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			return null;
		});
	}

	@NonNull
	public CompletableFuture<Integer> read(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return read(bytes, 0, bytes.length);
	}

	/**
	 * Reads bytes from a blob opened for reading. Fewer bytes than requested may be returned.
	 *
	 * @param bytes  destination buffer
	 * @param offset offset into {@code bytes}
	 * @param length maximum number of bytes to read
	 * @return a future for the number of bytes read, or {@code -1} at the end of the blob
	 * @throws IllegalStateException if this blob was opened for writing
	 */
	@NonNull
	public CompletableFuture<Integer> read(@NonNull byte[] bytes,
																				 int offset,
																				 int length) {
		requireNonNull(bytes);
		checkBounds(bytes, offset, length);
		ensureMode(Mode.READ, "read from");

		return getAttachment().getClient().perform(List.of(getOperationGuard(), getTransaction().getOperationGuard()), () -> {
			ensureUsable();

			if (length == 0)
				return 0;

			try {
				return getEngineBlob().read(bytes, offset, length);
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}
		});
	}

	/**
	 * Reads the remainder of a blob opened for reading.
	 *
	 * @return a future for the remaining content
	 * @throws IllegalStateException if this blob was opened for writing
	 */
	@NonNull
	public CompletableFuture<byte[]> readAll() {
		ensureMode(Mode.READ, "read from");

		return getAttachment().getClient().perform(List.of(getOperationGuard(), getTransaction().getOperationGuard()), () -> {
			ensureUsable();

			long expectedLength = lengthInternal();
			ByteArrayOutputStream content = new ByteArrayOutputStream((int) Math.min(expectedLength, Integer.MAX_VALUE - 8));
			byte[] buffer = new byte[MAXIMUM_SEGMENT_SIZE];

			try {
				int read;

				while ((read = getEngineBlob().read(buffer, 0, buffer.length)) != -1)
					content.write(buffer, 0, read);
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			return content.toByteArray();
		});
	}

	/**
	 * Total length of a blob opened for reading. Queried from the engine once, then cached.
	 *
	 * @return a future for the length in bytes
	 * @throws IllegalStateException if this blob was opened for writing
	 */
	@NonNull
	public CompletableFuture<Long> length() {
		ensureMode(Mode.READ, "query the length of");

		Long length = this.length;

		if (length != null)
			return CompletableFuture.completedFuture(length);

		return getAttachment().getClient().perform(List.of(getOperationGuard(), getTransaction().getOperationGuard()), () -> {
			ensureUsable();
			return lengthInternal();
		});
	}

	/**
	 * Closes this blob. For a write-mode blob this finalizes its content, after which it may be bound to a blob-typed
	 * parameter via this object or {@link #getId()}. Closing an already-closed blob is a no-op. If the blob's
	 * transaction has already ended, only the handle is released.
	 *
	 * @return a future which completes when the blob has been closed
	 */
	@NonNull
	public CompletableFuture<Void> close() {
		return getAttachment().getClient().perform(List.of(getOperationGuard(), getTransaction().getOperationGuard()), () -> {
			if (!markReleased())
				return null;

			// The engine already dropped blobs of a finished transaction
			if (getTransaction().isActive()) {
				try {
					getEngineBlob().close();
				} catch (EngineException e) {
					throw new DatabaseException(e);
				}

				if (this.mode == Mode.WRITE)
					this.finished = true;
			}

			logger.finer(format("Closed blob %d", getHandle()));

			return null;
		});
	}

	/**
	 * Discards a write-mode blob without finalizing it.
	 *
	 * @return a future which completes when the blob has been discarded
	 * @throws IllegalStateException if this blob was opened for reading
	 */
	@NonNull
	public CompletableFuture<Void> cancel() {
		ensureMode(Mode.WRITE, "cancel");

		return getAttachment().getClient().perform(List.of(getOperationGuard(), getTransaction().getOperationGuard()), () -> {
			ensureNotReleased();

			try {
				getEngineBlob().cancel();
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			markReleased();
			return null;
		});
	}

	/**
	 * The engine identifier of this blob: for a write-mode blob, what gets stored in a blob column.
	 *
	 * @return the blob identifier
	 */
	@NonNull
	public BlobId getId() {
		return this.id;
	}

	@NonNull
	public Boolean isWritable() {
		return this.mode == Mode.WRITE;
	}

	@NonNull
	public Boolean isClosed() {
		return isReleased();
	}

	/**
	 * Can this blob be bound as a parameter? True for read-mode blobs and for write-mode blobs which have been closed.
	 */
	boolean isBindable() {
		return this.mode == Mode.READ || this.finished;
	}

	private long lengthInternal() {
		Long length = this.length;

		if (length == null) {
			try {
				length = getEngineBlob().length();
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			this.length = length;
		}

		return length;
	}

	@Override
	void releaseEngineResources() throws EngineException {
		if (this.mode == Mode.WRITE)
			getEngineBlob().cancel();
		else
			getEngineBlob().close();
	}

	private void ensureUsable() {
		ensureNotReleased();
		getTransaction().ensureActive();
	}

	private void ensureMode(@NonNull Mode mode,
													@NonNull String action) {
		if (this.mode != mode)
			throw new IllegalStateException(format("Unable to %s blob %d: it was opened for %s", action, getHandle(),
					this.mode == Mode.WRITE ? "writing" : "reading"));
	}

	private static void checkBounds(@NonNull byte[] bytes,
																	int offset,
																	int length) {
		if (offset < 0 || length < 0 || offset > bytes.length - length)
			throw new IndexOutOfBoundsException(format("Illegal range offset=%d, length=%d for array of length %d",
					offset, length, bytes.length));
	}

	@NonNull
	Transaction getTransaction() {
		return this.transaction;
	}

	@NonNull
	EngineBlob getEngineBlob() {
		return this.engineBlob;
	}
}
