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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * An open connection to one database, acquired via {@link Client#connect(String, ConnectOptions)} or
 * {@link Client#createDatabase(String, CreateDatabaseOptions)}.
 * <p>
 * The attachment owns every {@link Transaction}, {@link Statement}, {@link ResultSet}, {@link Blob} and
 * {@link EventSubscription} created through it. When the attachment is disconnected or its database dropped, those
 * resources are released in a fixed order (result sets, blobs, statements, event subscriptions, then transactions,
 * which are rolled back) and any later use of them fails with {@link DisposedResourceException}.
 * <p>
 * Different transactions of one attachment may be used concurrently.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Attachment {
	@NonNull
	private static final List<@NonNull Class<? extends AttachmentResource>> RELEASE_ORDER;

	static {
		RELEASE_ORDER = List.of(ResultSet.class, Blob.class, Statement.class, EventSubscription.class, Transaction.class);
	}

	@NonNull
	private final Client client;
	@NonNull
	private final String locator;
	@NonNull
	private final EngineAttachment engineAttachment;
	@NonNull
	private final Map<@NonNull Long, @NonNull AttachmentResource> resources;
	@NonNull
	private final AtomicLong handleGenerator;
	@NonNull
	private final AtomicBoolean open;
	@NonNull
	private final Logger logger;

	@NonNull
	private volatile TransactionOptions defaultTransactionOptions;
	@NonNull
	private volatile FetchOptions defaultFetchOptions;

	Attachment(@NonNull Client client,
						 @NonNull String locator,
						 @NonNull EngineAttachment engineAttachment) {
		requireNonNull(client);
		requireNonNull(locator);
		requireNonNull(engineAttachment);

		this.client = client;
		this.locator = locator;
		this.engineAttachment = engineAttachment;
		this.resources = new ConcurrentHashMap<>();
		this.handleGenerator = new AtomicLong(0);
		this.open = new AtomicBoolean(true);
		this.logger = Logger.getLogger(getClass().getName());
		this.defaultTransactionOptions = TransactionOptions.defaultOptions();
		this.defaultFetchOptions = FetchOptions.empty();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{locator=%s, open=%s, resources=%d}", getClass().getSimpleName(), getLocator(), isValid(),
				this.resources.size());
	}

	/**
	 * Starts a transaction using {@link #getDefaultTransactionOptions()}.
	 *
	 * @return a future for the new transaction
	 */
	@NonNull
	public CompletableFuture<Transaction> startTransaction() {
		return startTransaction(getDefaultTransactionOptions());
	}

	/**
	 * Starts a transaction.
	 *
	 * @param options options for the transaction
	 * @return a future for the new transaction
	 */
	@NonNull
	public CompletableFuture<Transaction> startTransaction(@NonNull TransactionOptions options) {
		requireNonNull(options);

		return getClient().perform(List.of(), () -> startTransactionInternal(options));
	}

	/**
	 * Prepares a statement which can later be executed under any transaction of this attachment.
	 *
	 * @param transaction the transaction to prepare under
	 * @param sql         the SQL to prepare
	 * @return a future for the prepared statement, failing with {@link SyntaxException} if the SQL was rejected
	 */
	@NonNull
	public CompletableFuture<Statement> prepare(@NonNull Transaction transaction,
																							@NonNull String sql) {
		requireNonNull(transaction);
		requireNonNull(sql);

		ensureOwned(transaction);

		return getClient().perform(List.of(transaction.getOperationGuard()), () -> prepareInternal(transaction, sql));
	}

	@NonNull
	public CompletableFuture<Void> execute(@NonNull Transaction transaction,
																				 @NonNull String sql) {
		return execute(transaction, sql, List.of());
	}

	/**
	 * Prepares, executes and disposes of a statement.
	 *
	 * @param transaction the transaction to execute under
	 * @param sql         the SQL to execute
	 * @param parameters  positional parameters
	 * @return a future which completes when the statement has executed
	 */
	@NonNull
	public CompletableFuture<Void> execute(@NonNull Transaction transaction,
																				 @NonNull String sql,
																				 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(sql);
		requireNonNull(parameters);

		ensureOwned(transaction);

		return getClient().perform(List.of(transaction.getOperationGuard()), () -> {
			withTemporaryStatement(transaction, sql, statement -> {
				statement.executeInternal(transaction, parameters);
				return null;
			});

			return null;
		});
	}

	@NonNull
	public CompletableFuture<ResultSet> executeQuery(@NonNull Transaction transaction,
																									 @NonNull String sql) {
		return executeQuery(transaction, sql, List.of());
	}

	/**
	 * Prepares a statement and opens a cursor over its results.
	 * <p>
	 * The statement is owned by the returned {@link ResultSet} and is disposed of when the result set is closed.
	 *
	 * @param transaction the transaction to execute under
	 * @param sql         the query to execute
	 * @param parameters  positional parameters
	 * @return a future for the open result set
	 */
	@NonNull
	public CompletableFuture<ResultSet> executeQuery(@NonNull Transaction transaction,
																									 @NonNull String sql,
																									 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(sql);
		requireNonNull(parameters);

		ensureOwned(transaction);

		return getClient().perform(List.of(transaction.getOperationGuard()), () -> {
			Statement statement = prepareInternal(transaction, sql);

			try {
				return statement.executeQueryInternal(transaction, parameters, true);
			} catch (RuntimeException e) {
				freeQuietly(statement, e);
				throw e;
			}
		});
	}

	@NonNull
	public CompletableFuture<Row> executeReturning(@NonNull Transaction transaction,
																								 @NonNull String sql) {
		return executeReturning(transaction, sql, List.of());
	}

	/**
	 * Executes a statement which produces at most one row, e.g. {@code INSERT ... RETURNING} or a singleton
	 * {@code SELECT}, and returns that row.
	 * <p>
	 * If the statement produces no row, the result has one {@link Value#nullValue()} per output column.
	 *
	 * @param transaction the transaction to execute under
	 * @param sql         the SQL to execute
	 * @param parameters  positional parameters
	 * @return a future for the returned row
	 */
	@NonNull
	public CompletableFuture<Row> executeReturning(@NonNull Transaction transaction,
																								 @NonNull String sql,
																								 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(sql);
		requireNonNull(parameters);

		ensureOwned(transaction);

		return getClient().perform(List.of(transaction.getOperationGuard()), () ->
				withTemporaryStatement(transaction, sql, statement -> statement.executeReturningInternal(transaction, parameters)));
	}

	@NonNull
	public CompletableFuture<Map<@NonNull String, @Nullable Object>> executeReturningAsObject(@NonNull Transaction transaction,
																																												 @NonNull String sql) {
		return executeReturningAsObject(transaction, sql, List.of());
	}

	/**
	 * Like {@link #executeReturning(Transaction, String, List)}, but projects the row onto a map keyed by column label
	 * in column order. If two columns share a label, the later column wins.
	 *
	 * @param transaction the transaction to execute under
	 * @param sql         the SQL to execute
	 * @param parameters  positional parameters
	 * @return a future for the label-keyed row
	 */
	@NonNull
	public CompletableFuture<Map<@NonNull String, @Nullable Object>> executeReturningAsObject(@NonNull Transaction transaction,
																																												 @NonNull String sql,
																																												 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(sql);
		requireNonNull(parameters);

		ensureOwned(transaction);

		return getClient().perform(List.of(transaction.getOperationGuard()), () ->
				withTemporaryStatement(transaction, sql, statement ->
						statement.executeReturningInternal(transaction, parameters).toMap(statement.getColumnLabels())));
	}

	/**
	 * Runs {@code transactionalOperation} in a new transaction, committing if it succeeds and rolling back if it fails.
	 * <p>
	 * On failure the original failure is propagated; a rollback failure is attached to it as a suppressed exception.
	 * If the operation itself commits or rolls back the transaction, nothing further is done to it.
	 *
	 * @param options                options for the transaction
	 * @param transactionalOperation the work to perform
	 * @param <T>                    the type of result of the work
	 * @return a future for the result of the work
	 */
	@NonNull
	public <T> CompletableFuture<T> executeTransaction(@NonNull TransactionOptions options,
																										 @NonNull TransactionalOperation<T> transactionalOperation) {
		requireNonNull(options);
		requireNonNull(transactionalOperation);

		return startTransaction(options).thenCompose(transaction -> {
			CompletableFuture<T> operationFuture;

			try {
				operationFuture = requireNonNull(transactionalOperation.perform(transaction));
			} catch (Throwable t) {
				operationFuture = CompletableFuture.failedFuture(t);
			}

			return operationFuture.<CompletableFuture<T>>handle((result, failure) -> {
				if (failure == null) {
					if (!transaction.isActive())
						return CompletableFuture.completedFuture(result);

					return transaction.commit().thenApply(ignored -> result);
				}

				Throwable thrown = unwrapCompletionException(failure);

				if (!transaction.isActive())
					return CompletableFuture.<T>failedFuture(thrown);

				return transaction.rollback().<T>handle((ignored, rollbackFailure) -> {
					if (rollbackFailure != null) {
						Throwable cleanupFailure = unwrapCompletionException(rollbackFailure);
						logger.log(WARNING, "Unable to roll back transaction", cleanupFailure);
						thrown.addSuppressed(cleanupFailure);
					}

					throw new CompletionException(thrown);
				});
			}).thenCompose(Function.identity());
		});
	}

	@NonNull
	public <T> CompletableFuture<T> executeTransaction(@NonNull TransactionalOperation<T> transactionalOperation) {
		return executeTransaction(getDefaultTransactionOptions(), transactionalOperation);
	}

	/**
	 * Creates a new blob, open for writing. Once written and closed, the blob can be bound to a blob-typed parameter.
	 *
	 * @param transaction the transaction the blob belongs to
	 * @return a future for the write-mode blob
	 */
	@NonNull
	public CompletableFuture<Blob> createBlob(@NonNull Transaction transaction) {
		requireNonNull(transaction);

		ensureOwned(transaction);

		return getClient().perform(List.of(transaction.getOperationGuard()), () -> {
			ensureOpen();
			transaction.ensureActive();

			EngineBlob engineBlob;

			try {
				engineBlob = getEngineAttachment().createBlob(transaction.getEngineTransaction());
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			return register(new Blob(this, transaction, engineBlob, Blob.Mode.WRITE));
		});
	}

	/**
	 * Opens an existing blob for reading.
	 *
	 * @param transaction the transaction to read under
	 * @param blobId      the blob to read, as fetched from a blob column
	 * @return a future for the read-mode blob
	 */
	@NonNull
	public CompletableFuture<Blob> openBlob(@NonNull Transaction transaction,
																					@NonNull BlobId blobId) {
		requireNonNull(transaction);
		requireNonNull(blobId);

		ensureOwned(transaction);

		return getClient().perform(List.of(transaction.getOperationGuard()), () -> {
			ensureOpen();
			transaction.ensureActive();

			EngineBlob engineBlob;

			try {
				engineBlob = getEngineAttachment().openBlob(transaction.getEngineTransaction(), blobId);
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}

			return register(new Blob(this, transaction, engineBlob, Blob.Mode.READ));
		});
	}

	/**
	 * Subscribes to database events posted (e.g. via {@code POST_EVENT}) by any connection.
	 * <p>
	 * {@code eventHandler} is invoked serially, on the client executor, with the number of times each event was posted
	 * since the previous invocation. Events whose count did not change are omitted from a batch.
	 *
	 * @param eventNames   names of the events to listen for
	 * @param eventHandler receives batches of event counts
	 * @return a future for the active subscription
	 */
	@NonNull
	public CompletableFuture<EventSubscription> queueEvents(@NonNull Set<@NonNull String> eventNames,
																													@NonNull EventHandler eventHandler) {
		requireNonNull(eventNames);
		requireNonNull(eventHandler);

		if (eventNames.size() == 0)
			throw new IllegalArgumentException("At least one event name is required");

		Set<String> orderedEventNames = Collections.unmodifiableSet(new LinkedHashSet<>(eventNames));

		return getClient().perform(List.of(), () -> {
			ensureOpen();

			EventSubscription eventSubscription = register(new EventSubscription(this, orderedEventNames, eventHandler));

			try {
				eventSubscription.start();
			} catch (RuntimeException e) {
				eventSubscription.markReleased();
				throw e;
			}

			return eventSubscription;
		});
	}

	/**
	 * Drops the attached database, after releasing every resource of this attachment. The attachment is closed
	 * afterward.
	 *
	 * @return a future which completes when the database has been dropped
	 */
	@NonNull
	public CompletableFuture<Void> dropDatabase() {
		return getClient().perform(List.of(), () -> {
			close("drop database", () -> getEngineAttachment().dropDatabase());
			return null;
		});
	}

	/**
	 * Disconnects, after releasing every resource of this attachment.
	 *
	 * @return a future which completes when the attachment has been disconnected
	 */
	@NonNull
	public CompletableFuture<Void> disconnect() {
		return getClient().perform(List.of(), () -> {
			close("disconnect", () -> getEngineAttachment().disconnect());
			return null;
		});
	}

	/**
	 * Is this attachment still open?
	 *
	 * @return {@code true} if the attachment has been neither disconnected nor dropped
	 */
	@NonNull
	public Boolean isValid() {
		return this.open.get();
	}

	@NonNull
	Transaction startTransactionInternal(@NonNull TransactionOptions options) {
		requireNonNull(options);

		ensureOpen();

		EngineTransaction engineTransaction;

		try {
			engineTransaction = getEngineAttachment().startTransaction(options);
		} catch (EngineException e) {
			throw new DatabaseException(e);
		}

		Transaction transaction = register(new Transaction(this, options, engineTransaction));
		logger.finer(format("Started transaction %d with %s", transaction.getHandle(), options));

		return transaction;
	}

	@NonNull
	Statement prepareInternal(@NonNull Transaction transaction,
														@NonNull String sql) {
		requireNonNull(transaction);
		requireNonNull(sql);

		ensureOpen();
		transaction.ensureActive();

		StatementContext statementContext = StatementContext.with(sql, StatementContext.Operation.PREPARE).build();
		long startTime = nanoTime();
		Duration preparationDuration = null;
		RuntimeException exception = null;

		try {
			EngineStatement engineStatement;

			try {
				engineStatement = getEngineAttachment().prepare(transaction.getEngineTransaction(), sql);
			} catch (EngineException e) {
				throw new SyntaxException(e);
			}

			preparationDuration = Duration.ofNanos(nanoTime() - startTime);

			return register(new Statement(this, sql, engineStatement));
		} catch (RuntimeException e) {
			exception = e;
			throw e;
		} finally {
			getClient().logStatement(StatementLog.withStatementContext(statementContext)
					.preparationDuration(preparationDuration)
					.exception(exception)
					.build(), exception);
		}
	}

	@Nullable
	private <T> T withTemporaryStatement(@NonNull Transaction transaction,
																			 @NonNull String sql,
																			 @NonNull Function<@NonNull Statement, T> function) {
		Statement statement = prepareInternal(transaction, sql);
		T result;

		try {
			result = function.apply(statement);
		} catch (RuntimeException e) {
			freeQuietly(statement, e);
			throw e;
		}

		statement.free();
		return result;
	}

	private void freeQuietly(@NonNull Statement statement,
													 @NonNull Throwable thrown) {
		try {
			statement.free();
		} catch (Exception cleanupException) {
			thrown.addSuppressed(cleanupException);
		}
	}

	@FunctionalInterface
	private interface EngineCloseOperation {
		void perform() throws EngineException;
	}

	private void close(@NonNull String description,
										 @NonNull EngineCloseOperation engineCloseOperation) {
		if (!this.open.compareAndSet(true, false))
			throw new DisposedResourceException(format("Unable to %s: attachment to %s is already closed", description, getLocator()));

		logger.finer(format("Performing %s for %s...", description, getLocator()));

		try {
			releaseResources();

			try {
				engineCloseOperation.perform();
			} catch (EngineException e) {
				throw new DatabaseException(e);
			}
		} finally {
			getClient().unregisterAttachment(this);
		}

		logger.finer(format("Finished %s for %s.", description, getLocator()));
	}

	/**
	 * Forcibly closes this attachment on behalf of its client. Failures are logged, never thrown.
	 */
	void invalidate() {
		if (!this.open.compareAndSet(true, false))
			return;

		try {
			releaseResources();

			try {
				getEngineAttachment().disconnect();
			} catch (Exception e) {
				logger.log(WARNING, format("Unable to disconnect from %s", getLocator()), e);
			}
		} finally {
			getClient().unregisterAttachment(this);
		}
	}

	private void releaseResources() {
		for (Class<? extends AttachmentResource> resourceType : RELEASE_ORDER) {
			List<AttachmentResource> matchingResources = new ArrayList<>();

			for (AttachmentResource resource : this.resources.values())
				if (resourceType.isInstance(resource))
					matchingResources.add(resource);

			if (matchingResources.size() > 0)
				logger.finer(format("Releasing %d %s[s] of %s", matchingResources.size(), resourceType.getSimpleName(), getLocator()));

			for (AttachmentResource resource : matchingResources)
				resource.invalidate();
		}
	}

	@NonNull
	<T extends AttachmentResource> T register(@NonNull T resource) {
		requireNonNull(resource);

		this.resources.put(resource.getHandle(), resource);

		// Lost a race with disconnect/drop
		if (!isValid()) {
			resource.invalidate();
			throw new DisposedResourceException(format("Attachment to %s was closed", getLocator()));
		}

		return resource;
	}

	void unregister(@NonNull AttachmentResource resource) {
		requireNonNull(resource);
		this.resources.remove(resource.getHandle());
	}

	@NonNull
	Long nextHandle() {
		return this.handleGenerator.incrementAndGet();
	}

	void ensureOpen() {
		if (!isValid())
			throw new DisposedResourceException(format("Attachment to %s has been closed", getLocator()));
	}

	void ensureOwned(@NonNull Transaction transaction) {
		requireNonNull(transaction);

		if (transaction.getAttachment() != this)
			throw new IllegalArgumentException(format("%s does not belong to %s", transaction, this));
	}

	@NonNull
	static Throwable unwrapCompletionException(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		while (throwable instanceof CompletionException && throwable.getCause() != null)
			throwable = throwable.getCause();

		return throwable;
	}

	/**
	 * Transaction options used by {@link #startTransaction()}.
	 *
	 * @return the default transaction options
	 */
	@NonNull
	public TransactionOptions getDefaultTransactionOptions() {
		return this.defaultTransactionOptions;
	}

	public void setDefaultTransactionOptions(@NonNull TransactionOptions defaultTransactionOptions) {
		requireNonNull(defaultTransactionOptions);
		this.defaultTransactionOptions = defaultTransactionOptions;
	}

	/**
	 * Fetch options consulted by result sets of this attachment when neither the fetch call nor the result set
	 * specifies a fetch size.
	 *
	 * @return the default fetch options
	 */
	@NonNull
	public FetchOptions getDefaultFetchOptions() {
		return this.defaultFetchOptions;
	}

	public void setDefaultFetchOptions(@NonNull FetchOptions defaultFetchOptions) {
		requireNonNull(defaultFetchOptions);
		this.defaultFetchOptions = defaultFetchOptions;
	}

	@NonNull
	public String getLocator() {
		return this.locator;
	}

	@NonNull
	Client getClient() {
		return this.client;
	}

	@NonNull
	EngineAttachment getEngineAttachment() {
		return this.engineAttachment;
	}

	@NonNull
	Integer getResourceCount() {
		return this.resources.size();
	}
}
