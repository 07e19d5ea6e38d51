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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Main entry point: creates and attaches to databases through an {@link Engine}.
 * <p>
 * Every operation Kindling exposes is asynchronous. The blocking engine calls behind an operation run on the client's
 * {@link ExecutorService} and the returned {@link CompletableFuture} completes with the result, or exceptionally with a
 * {@link DatabaseException}.
 * <p>
 * Example:
 * <pre>{@code
 * Client client = Client.withEngine(engine).build();
 * Attachment attachment = client.connect("localhost:/data/employee.fdb").join();
 * Transaction transaction = attachment.startTransaction().join();
 *
 * try {
 *   ResultSet resultSet = attachment.executeQuery(transaction, "SELECT * FROM employee").join();
 *   List<Row> rows = resultSet.fetch().join();
 *   resultSet.close().join();
 *   transaction.commit().join();
 * } catch (CompletionException e) {
 *   transaction.rollback().join();
 *   throw e;
 * } finally {
 *   attachment.disconnect().join();
 *   client.dispose().join();
 * }
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Client {
	@NonNull
	private static final AtomicInteger CLIENT_ID_GENERATOR;

	static {
		CLIENT_ID_GENERATOR = new AtomicInteger(0);
	}

	@NonNull
	private final Engine engine;
	@NonNull
	private final ExecutorService executorService;
	@NonNull
	private final Boolean executorServiceOwned;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final TypeMarshaller typeMarshaller;
	@NonNull
	private final Set<@NonNull Attachment> attachments;
	@NonNull
	private final AtomicBoolean disposed;
	@NonNull
	private final Logger logger;

	@NonNull
	private volatile ConnectOptions defaultConnectOptions;
	@NonNull
	private volatile CreateDatabaseOptions defaultCreateDatabaseOptions;

	private Client(@NonNull Builder builder) {
		requireNonNull(builder);

		this.engine = requireNonNull(builder.engine);
		this.executorServiceOwned = builder.executorService == null;
		this.executorService = builder.executorService == null ? createDefaultExecutorService() : builder.executorService;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.typeMarshaller = new TypeMarshaller(builder.timeZone == null ? ZoneId.systemDefault() : builder.timeZone);
		this.defaultConnectOptions = builder.defaultConnectOptions == null ? ConnectOptions.empty() : builder.defaultConnectOptions;
		this.defaultCreateDatabaseOptions = builder.defaultCreateDatabaseOptions == null ? CreateDatabaseOptions.empty() : builder.defaultCreateDatabaseOptions;
		this.attachments = ConcurrentHashMap.newKeySet();
		this.disposed = new AtomicBoolean(false);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Provides a {@link Client} builder for the given {@link Engine}.
	 *
	 * @param engine the engine which performs the actual database calls
	 * @return a {@link Client} builder
	 */
	@NonNull
	public static Builder withEngine(@NonNull Engine engine) {
		requireNonNull(engine);
		return new Builder(engine);
	}

	/**
	 * Creates a new database and attaches to it, using {@link #getDefaultCreateDatabaseOptions()}.
	 *
	 * @param locator the engine locator of the database to create
	 * @return a future for the attachment to the new database
	 */
	@NonNull
	public CompletableFuture<Attachment> createDatabase(@NonNull String locator) {
		return createDatabase(locator, CreateDatabaseOptions.empty());
	}

	/**
	 * Creates a new database and attaches to it.
	 * <p>
	 * {@code options} are merged over {@link #getDefaultCreateDatabaseOptions()}; fields set on {@code options} win.
	 *
	 * @param locator the engine locator of the database to create
	 * @param options options for the new database
	 * @return a future for the attachment to the new database, failing with {@link ConnectionException} if the
	 * database could not be created
	 */
	@NonNull
	public CompletableFuture<Attachment> createDatabase(@NonNull String locator,
																											@NonNull CreateDatabaseOptions options) {
		requireNonNull(locator);
		requireNonNull(options);

		CreateDatabaseOptions mergedOptions = options.mergedOver(getDefaultCreateDatabaseOptions());

		return perform(List.of(), () -> {
			logger.finer(format("Creating database %s...", locator));

			EngineAttachment engineAttachment;

			try {
				engineAttachment = getEngine().createDatabase(locator, mergedOptions);
			} catch (EngineException e) {
				throw new ConnectionException(e);
			}

			logger.finer(format("Created database %s.", locator));
			return registerAttachment(locator, engineAttachment);
		});
	}

	@NonNull
	public CompletableFuture<Attachment> createDatabase(@NonNull DatabaseLocator locator,
																											@NonNull CreateDatabaseOptions options) {
		requireNonNull(locator);
		return createDatabase(locator.toLocatorString(), options);
	}

	/**
	 * Attaches to an existing database using {@link #getDefaultConnectOptions()}.
	 *
	 * @param locator the engine locator of the database
	 * @return a future for the attachment
	 */
	@NonNull
	public CompletableFuture<Attachment> connect(@NonNull String locator) {
		return connect(locator, ConnectOptions.empty());
	}

	/**
	 * Attaches to an existing database.
	 * <p>
	 * {@code options} are merged over {@link #getDefaultConnectOptions()}; fields set on {@code options} win.
	 *
	 * @param locator the engine locator of the database
	 * @param options connection options
	 * @return a future for the attachment, failing with {@link ConnectionException} if the attachment could not be
	 * established
	 */
	@NonNull
	public CompletableFuture<Attachment> connect(@NonNull String locator,
																							 @NonNull ConnectOptions options) {
		requireNonNull(locator);
		requireNonNull(options);

		ConnectOptions mergedOptions = options.mergedOver(getDefaultConnectOptions());

		return perform(List.of(), () -> {
			logger.finer(format("Connecting to %s...", locator));

			EngineAttachment engineAttachment;

			try {
				engineAttachment = getEngine().connect(locator, mergedOptions);
			} catch (EngineException e) {
				throw new ConnectionException(e);
			}

			logger.finer(format("Connected to %s.", locator));
			return registerAttachment(locator, engineAttachment);
		});
	}

	@NonNull
	public CompletableFuture<Attachment> connect(@NonNull DatabaseLocator locator,
																							 @NonNull ConnectOptions options) {
		requireNonNull(locator);
		return connect(locator.toLocatorString(), options);
	}

	/**
	 * Disposes of this client: attachments still open are forcibly invalidated (their transactions rolled back), the
	 * engine is disposed and, if the client created its own executor, that executor is shut down.
	 * <p>
	 * Disposing more than once is a no-op. Failures while releasing resources are logged, not thrown.
	 *
	 * @return a future which completes when disposal has finished
	 */
	@NonNull
	public CompletableFuture<Void> dispose() {
		if (!this.disposed.compareAndSet(false, true))
			return CompletableFuture.completedFuture(null);

		CompletableFuture<Void> future = new CompletableFuture<>();
		Runnable disposal = () -> {
			try {
				performDisposal();
				future.complete(null);
			} catch (Throwable t) {
				future.completeExceptionally(t);
			}
		};

		try {
			getExecutorService().execute(disposal);
		} catch (RejectedExecutionException e) {
			// Caller-supplied executor already shut down; dispose on the calling thread
			disposal.run();
		}

		return future;
	}

	private void performDisposal() {
		logger.finer("Disposing client...");

		List<Attachment> openAttachments = new ArrayList<>(this.attachments);

		if (openAttachments.size() > 0)
			logger.finer(format("Invalidating %d attachment[s] which were not disconnected", openAttachments.size()));

		for (Attachment attachment : openAttachments)
			attachment.invalidate();

		try {
			getEngine().dispose();
		} catch (Exception e) {
			logger.log(WARNING, "Unable to dispose of engine", e);
		}

		if (isExecutorServiceOwned())
			getExecutorService().shutdown();

		logger.finer("Client disposed.");
	}

	/**
	 * Has this client not been disposed yet?
	 *
	 * @return {@code true} if this client is usable, {@code false} if it has been disposed
	 */
	@NonNull
	public Boolean isValid() {
		return !this.disposed.get();
	}

	@NonNull
	private Attachment registerAttachment(@NonNull String locator,
																				@NonNull EngineAttachment engineAttachment) {
		requireNonNull(locator);
		requireNonNull(engineAttachment);

		Attachment attachment = new Attachment(this, locator, engineAttachment);
		this.attachments.add(attachment);

		// Lost a race with dispose()
		if (this.disposed.get()) {
			attachment.invalidate();
			throw new DisposedResourceException("Client was disposed while the attachment was being established");
		}

		return attachment;
	}

	void unregisterAttachment(@NonNull Attachment attachment) {
		requireNonNull(attachment);
		this.attachments.remove(attachment);
	}

	/**
	 * Runs {@code databaseOperation} on the executor while holding {@code operationGuards}.
	 * <p>
	 * Guards are acquired on the calling thread, so a conflicting operation fails immediately with
	 * {@link ConcurrentOperationException}. Guards are released before the returned future completes.
	 */
	@NonNull
	<T> CompletableFuture<T> perform(@NonNull List<@NonNull OperationGuard> operationGuards,
																	 @NonNull DatabaseOperation<T> databaseOperation) {
		requireNonNull(operationGuards);
		requireNonNull(databaseOperation);

		if (this.disposed.get())
			return CompletableFuture.failedFuture(new DisposedResourceException("Client has been disposed"));

		try {
			OperationGuard.acquireAll(operationGuards);
		} catch (ConcurrentOperationException e) {
			return CompletableFuture.failedFuture(e);
		}

		CompletableFuture<T> future = new CompletableFuture<>();

		try {
			getExecutorService().execute(() -> {
				T result = null;
				Throwable failure = null;

				try {
					result = databaseOperation.perform();
				} catch (Throwable t) {
					failure = t;
				} finally {
					OperationGuard.releaseAll(operationGuards);
				}

				if (failure == null)
					future.complete(result);
				else
					future.completeExceptionally(translateFailure(failure));
			});
		} catch (RejectedExecutionException e) {
			OperationGuard.releaseAll(operationGuards);
			future.completeExceptionally(new DisposedResourceException("Client has been disposed"));
		}

		return future;
	}

	@NonNull
	private Throwable translateFailure(@NonNull Throwable failure) {
		requireNonNull(failure);

		if (failure instanceof DatabaseException || failure instanceof RuntimeException || failure instanceof Error)
			return failure;

		return new DatabaseException(failure);
	}

	/**
	 * Hands {@code statementLog} to the configured {@link StatementLogger}. A logger failure is attached to
	 * {@code thrown} if the operation failed, otherwise it is logged and dropped.
	 */
	void logStatement(@NonNull StatementLog statementLog,
										@Nullable Throwable thrown) {
		requireNonNull(statementLog);

		try {
			getStatementLogger().log(statementLog);
		} catch (Throwable loggerFailure) {
			if (thrown != null)
				thrown.addSuppressed(loggerFailure);
			else
				logger.log(WARNING, "Statement logger failed", loggerFailure);
		}
	}

	@NonNull
	private static ExecutorService createDefaultExecutorService() {
		int clientId = CLIENT_ID_GENERATOR.incrementAndGet();
		AtomicInteger threadIdGenerator = new AtomicInteger(0);

		ThreadFactory threadFactory = (runnable) -> {
			Thread thread = new Thread(runnable, format("kindling-%d-worker-%d", clientId, threadIdGenerator.incrementAndGet()));
			thread.setDaemon(true);
			return thread;
		};

		return Executors.newCachedThreadPool(threadFactory);
	}

	@NonNull
	public ConnectOptions getDefaultConnectOptions() {
		return this.defaultConnectOptions;
	}

	public void setDefaultConnectOptions(@NonNull ConnectOptions defaultConnectOptions) {
		requireNonNull(defaultConnectOptions);
		this.defaultConnectOptions = defaultConnectOptions;
	}

	@NonNull
	public CreateDatabaseOptions getDefaultCreateDatabaseOptions() {
		return this.defaultCreateDatabaseOptions;
	}

	public void setDefaultCreateDatabaseOptions(@NonNull CreateDatabaseOptions defaultCreateDatabaseOptions) {
		requireNonNull(defaultCreateDatabaseOptions);
		this.defaultCreateDatabaseOptions = defaultCreateDatabaseOptions;
	}

	/**
	 * Attachments created by this client which have not been disconnected yet.
	 *
	 * @return the open attachments
	 */
	@NonNull
	public Set<@NonNull Attachment> getAttachments() {
		return Collections.unmodifiableSet(this.attachments);
	}

	@NonNull
	Engine getEngine() {
		return this.engine;
	}

	@NonNull
	ExecutorService getExecutorService() {
		return this.executorService;
	}

	@NonNull
	Boolean isExecutorServiceOwned() {
		return this.executorServiceOwned;
	}

	@NonNull
	StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	TypeMarshaller getTypeMarshaller() {
		return this.typeMarshaller;
	}

	/**
	 * Builder used to construct instances of {@link Client}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Engine engine;
		@Nullable
		private ExecutorService executorService;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private ConnectOptions defaultConnectOptions;
		@Nullable
		private CreateDatabaseOptions defaultCreateDatabaseOptions;

		private Builder(@NonNull Engine engine) {
			this.engine = requireNonNull(engine);
		}

		/**
		 * Executor on which engine calls run. If none is supplied, the client creates (and on disposal shuts down) a cached
		 * pool of daemon threads.
		 * <p>
		 * A supplied executor is owned by the caller. Each active {@link EventSubscription} occupies one of its threads.
		 *
		 * @param executorService the executor to use
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder executorService(@Nullable ExecutorService executorService) {
			this.executorService = executorService;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		/**
		 * Zone used to convert zoned parameter values ({@link java.util.Date}, {@link java.time.Instant} ...) to the
		 * engine's local date/time types. Defaults to the system zone.
		 *
		 * @param timeZone the zone to use
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		@NonNull
		public Builder defaultConnectOptions(@Nullable ConnectOptions defaultConnectOptions) {
			this.defaultConnectOptions = defaultConnectOptions;
			return this;
		}

		@NonNull
		public Builder defaultCreateDatabaseOptions(@Nullable CreateDatabaseOptions defaultCreateDatabaseOptions) {
			this.defaultCreateDatabaseOptions = defaultCreateDatabaseOptions;
			return this;
		}

		@NonNull
		public Client build() {
			return new Client(this);
		}
	}
}
