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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Represents a database transaction, started via {@link Attachment#startTransaction(TransactionOptions)}.
 * <p>
 * {@link #commit()} and {@link #rollback()} end the transaction; any later operation on it fails with
 * {@link DisposedResourceException}. {@link #commitRetaining()} and {@link #rollbackRetaining()} end the current unit
 * of work but keep the transaction usable, incrementing its {@link #getGeneration() generation}; statements prepared
 * earlier remain valid across these boundaries.
 * <p>
 * Only one operation may be in flight per transaction. Starting a second one before the first completes fails with
 * {@link ConcurrentOperationException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Transaction extends AttachmentResource {
	@NonNull
	private final TransactionOptions options;
	@NonNull
	private final EngineTransaction engineTransaction;
	@NonNull
	private final AtomicLong generation;
	@NonNull
	private final Logger logger;

	Transaction(@NonNull Attachment attachment,
							@NonNull TransactionOptions options,
							@NonNull EngineTransaction engineTransaction) {
		super(attachment);

		requireNonNull(options);
		requireNonNull(engineTransaction);

		this.options = options;
		this.engineTransaction = engineTransaction;
		this.generation = new AtomicLong(0);
		this.logger = Logger.getLogger(Transaction.class.getName());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{handle=%s, isolation=%s, generation=%s, active=%s}", getClass().getSimpleName(), getHandle(),
				getIsolation().name(), getGeneration(), isActive());
	}

	/**
	 * Commits the transaction and ends it.
	 *
	 * @return a future which completes when the transaction has been committed
	 */
	@NonNull
	public CompletableFuture<Void> commit() {
		return getAttachment().getClient().perform(List.of(getOperationGuard()), () -> {
			ensureActive();

			logger.finer(format("Committing transaction %d...", getHandle()));

			try {
				getEngineTransaction().commit();
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			markReleased();
			logger.finer(format("Transaction %d committed.", getHandle()));

			return null;
		});
	}

	/**
	 * Commits the current unit of work, keeping the transaction (and its context) open for further use.
	 *
	 * @return a future which completes when the unit of work has been committed
	 */
	@NonNull
	public CompletableFuture<Void> commitRetaining() {
		return getAttachment().getClient().perform(List.of(getOperationGuard()), () -> {
			ensureActive();

			try {
				getEngineTransaction().commitRetaining();
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			long newGeneration = this.generation.incrementAndGet();
			logger.finer(format("Transaction %d committed (retaining), now at generation %d.", getHandle(), newGeneration));

			return null;
		});
	}

	/**
	 * Rolls back the transaction and ends it.
	 *
	 * @return a future which completes when the transaction has been rolled back
	 */
	@NonNull
	public CompletableFuture<Void> rollback() {
		return getAttachment().getClient().perform(List.of(getOperationGuard()), () -> {
			ensureActive();

			logger.finer(format("Rolling back transaction %d...", getHandle()));

			try {
				getEngineTransaction().rollback();
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			markReleased();
			logger.finer(format("Transaction %d rolled back.", getHandle()));

			return null;
		});
	}

	/**
	 * Rolls back the current unit of work, keeping the transaction (and its context) open for further use.
	 *
	 * @return a future which completes when the unit of work has been rolled back
	 */
	@NonNull
	public CompletableFuture<Void> rollbackRetaining() {
		return getAttachment().getClient().perform(List.of(getOperationGuard()), () -> {
			ensureActive();

			try {
				getEngineTransaction().rollbackRetaining();
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			long newGeneration = this.generation.incrementAndGet();
			logger.finer(format("Transaction %d rolled back (retaining), now at generation %d.", getHandle(), newGeneration));

			return null;
		});
	}

	/**
	 * Number of retaining commits and rollbacks performed so far; {@code 0} for a fresh transaction.
	 *
	 * @return the generation of this transaction
	 */
	@NonNull
	public Long getGeneration() {
		return this.generation.get();
	}

	/**
	 * Has this transaction been neither committed nor rolled back (nor invalidated by its attachment)?
	 *
	 * @return {@code true} if the transaction is usable
	 */
	@NonNull
	public Boolean isActive() {
		return !isReleased();
	}

	@NonNull
	public TransactionIsolation getIsolation() {
		return getOptions().getIsolation();
	}

	@NonNull
	public TransactionOptions getOptions() {
		return this.options;
	}

	@Override
	void releaseEngineResources() throws EngineException {
		logger.finer(format("Rolling back transaction %d on behalf of its attachment", getHandle()));
		getEngineTransaction().rollback();
	}

	void ensureActive() {
		if (!isActive())
			throw new DisposedResourceException(format("Transaction %d has already been committed or rolled back", getHandle()));
	}

	@NonNull
	EngineTransaction getEngineTransaction() {
		return this.engineTransaction;
	}
}
