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

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * In-memory {@link Engine} whose statements return scripted results.
 * <p>
 * Unscripted SQL fails to prepare the way a real engine reports a syntax error. Events are delivered on a dedicated
 * engine thread, never on the thread which registered for them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class ScriptedEngine implements Engine {
	public static final int SYNTAX_ERROR_CODE = -104;
	public static final int UNAVAILABLE_DATABASE_ERROR_CODE = -902;

	@NonNull
	private final Map<@NonNull String, @NonNull ScriptedDatabase> databases;
	@NonNull
	private final Map<@NonNull String, @NonNull Script> scripts;
	@NonNull
	private final ExecutorService eventExecutorService;
	@NonNull
	private final AtomicLong idGenerator;
	@NonNull
	private final AtomicReference<String> nextCommitFailure;
	@NonNull
	private final AtomicInteger commitCount;
	@NonNull
	private final AtomicInteger rollbackCount;
	@NonNull
	private final AtomicInteger freedStatementCount;
	@NonNull
	private final AtomicInteger closedCursorCount;
	@NonNull
	private final AtomicInteger cancelledBlobCount;
	@NonNull
	private final AtomicInteger cancelledRegistrationCount;
	@NonNull
	private final AtomicInteger disconnectCount;
	@NonNull
	private final AtomicInteger disposeCount;
	private volatile boolean synchronousEventFiring;

	public ScriptedEngine() {
		this.databases = new ConcurrentHashMap<>();
		this.scripts = new ConcurrentHashMap<>();
		this.eventExecutorService = Executors.newSingleThreadExecutor((runnable) -> {
			Thread thread = new Thread(runnable, "scripted-engine-events");
			thread.setDaemon(true);
			return thread;
		});
		this.idGenerator = new AtomicLong(0);
		this.nextCommitFailure = new AtomicReference<>();
		this.commitCount = new AtomicInteger(0);
		this.rollbackCount = new AtomicInteger(0);
		this.freedStatementCount = new AtomicInteger(0);
		this.closedCursorCount = new AtomicInteger(0);
		this.cancelledBlobCount = new AtomicInteger(0);
		this.cancelledRegistrationCount = new AtomicInteger(0);
		this.disconnectCount = new AtomicInteger(0);
		this.disposeCount = new AtomicInteger(0);
		this.synchronousEventFiring = false;
	}

	/**
	 * Registers (or replaces) the behavior of the given SQL.
	 *
	 * @param sql the SQL to script
	 * @return the script, for configuration
	 */
	@NonNull
	public Script script(@NonNull String sql) {
		requireNonNull(sql);

		Script script = new Script(sql);
		this.scripts.put(sql, script);
		return script;
	}

	/**
	 * When enabled, registrations fire on the calling thread, including from inside the registering call itself.
	 */
	public void synchronousEventFiring(boolean synchronousEventFiring) {
		this.synchronousEventFiring = synchronousEventFiring;
	}

	/**
	 * Number of registrations in the given database which are waiting for a posting.
	 */
	@NonNull
	public Integer getPendingRegistrationCount(@NonNull String locator) {
		requireNonNull(locator);

		ScriptedDatabase database = this.databases.get(locator);
		return database == null ? 0 : database.getPendingRegistrationCount();
	}

	/**
	 * Posts {@code eventName} {@code times} times in the given database, as if by a committed transaction.
	 */
	public void postEvent(@NonNull String locator,
												@NonNull String eventName,
												long times) {
		requireNonNull(locator);
		requireNonNull(eventName);

		ScriptedDatabase database = this.databases.get(locator);

		if (database == null)
			throw new IllegalArgumentException(format("No database at %s", locator));

		database.post(eventName, times);
	}

	/**
	 * The next engine-level commit fails with the given message.
	 */
	public void failNextCommit(@NonNull String message) {
		requireNonNull(message);
		this.nextCommitFailure.set(message);
	}

	public boolean databaseExists(@NonNull String locator) {
		return this.databases.containsKey(locator);
	}

	@Override
	@NonNull
	public EngineAttachment createDatabase(@NonNull String locator,
																				 @NonNull CreateDatabaseOptions options) throws EngineException {
		requireNonNull(locator);
		requireNonNull(options);

		ScriptedDatabase database = new ScriptedDatabase(locator);

		if (this.databases.putIfAbsent(locator, database) != null)
			throw new EngineException(format("I/O error during \"create\" operation for file \"%s\"\nDatabase already exists", locator),
					UNAVAILABLE_DATABASE_ERROR_CODE);

		return new ScriptedAttachment(database);
	}

	@Override
	@NonNull
	public EngineAttachment connect(@NonNull String locator,
																	@NonNull ConnectOptions options) throws EngineException {
		requireNonNull(locator);
		requireNonNull(options);

		ScriptedDatabase database = this.databases.get(locator);

		if (database == null)
			throw new EngineException(format("I/O error during \"open\" operation for file \"%s\"\nError while trying to open file", locator),
					UNAVAILABLE_DATABASE_ERROR_CODE);

		return new ScriptedAttachment(database);
	}

	@Override
	public void dispose() {
		this.disposeCount.incrementAndGet();
		this.eventExecutorService.shutdownNow();
	}

	@NonNull
	public Integer getCommitCount() {
		return this.commitCount.get();
	}

	@NonNull
	public Integer getRollbackCount() {
		return this.rollbackCount.get();
	}

	@NonNull
	public Integer getFreedStatementCount() {
		return this.freedStatementCount.get();
	}

	@NonNull
	public Integer getClosedCursorCount() {
		return this.closedCursorCount.get();
	}

	@NonNull
	public Integer getCancelledBlobCount() {
		return this.cancelledBlobCount.get();
	}

	@NonNull
	public Integer getCancelledRegistrationCount() {
		return this.cancelledRegistrationCount.get();
	}

	@NonNull
	public Integer getDisconnectCount() {
		return this.disconnectCount.get();
	}

	@NonNull
	public Integer getDisposeCount() {
		return this.disposeCount.get();
	}

	/**
	 * Scripted behavior for one SQL string.
	 */
	@ThreadSafe
	public static class Script {
		@NonNull
		private final String sql;
		@NonNull
		private volatile List<@NonNull ColumnDescriptor> parameters;
		@NonNull
		private volatile List<@NonNull ColumnDescriptor> columns;
		@NonNull
		private volatile List<@NonNull List<@Nullable Object>> rows;
		@Nullable
		private volatile Integer failingRowIndex;
		@Nullable
		private volatile EngineException rowFailure;
		@Nullable
		private volatile EngineException prepareFailure;
		@Nullable
		private volatile CountDownLatch executionLatch;
		@NonNull
		private final List<@NonNull List<@Nullable Object>> executedParameters;

		private Script(@NonNull String sql) {
			this.sql = requireNonNull(sql);
			this.parameters = List.of();
			this.columns = List.of();
			this.rows = List.of();
			this.executedParameters = new CopyOnWriteArrayList<>();
		}

		@NonNull
		public Script parameters(@NonNull ColumnDescriptor... parameters) {
			this.parameters = List.of(parameters);
			return this;
		}

		@NonNull
		public Script columns(@NonNull ColumnDescriptor... columns) {
			this.columns = List.of(columns);
			return this;
		}

		@NonNull
		public Script rows(@NonNull List<@NonNull List<@Nullable Object>> rows) {
			this.rows = List.copyOf(rows);
			return this;
		}

		@NonNull
		public Script row(@Nullable Object... values) {
			List<List<Object>> rows = new ArrayList<>(this.rows);
			rows.add(Collections.unmodifiableList(Arrays.asList(values)));
			this.rows = Collections.unmodifiableList(rows);
			return this;
		}

		/**
		 * Cursors fail when asked for the row at {@code rowIndex}.
		 */
		@NonNull
		public Script failAtRow(int rowIndex,
														@NonNull String message,
														int errorCode) {
			this.failingRowIndex = rowIndex;
			this.rowFailure = new EngineException(message, errorCode);
			return this;
		}

		@NonNull
		public Script failPrepare(@NonNull String message,
															int errorCode) {
			this.prepareFailure = new EngineException(message, errorCode);
			return this;
		}

		/**
		 * Executions block until {@code executionLatch} is released.
		 */
		@NonNull
		public Script blockExecutionUntil(@NonNull CountDownLatch executionLatch) {
			this.executionLatch = requireNonNull(executionLatch);
			return this;
		}

		/**
		 * Native parameter values of every execution so far, in order.
		 */
		@NonNull
		public List<@NonNull List<@Nullable Object>> getExecutedParameters() {
			return Collections.unmodifiableList(this.executedParameters);
		}

		private void recordExecution(@NonNull List<@Nullable Object> parameters) throws EngineException {
			CountDownLatch executionLatch = this.executionLatch;

			if (executionLatch != null) {
				try {
					if (!executionLatch.await(10, TimeUnit.SECONDS))
						throw new EngineException("Timed out waiting for the execution latch");
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new EngineException("Interrupted while waiting for the execution latch", null, e);
				}
			}

			this.executedParameters.add(Collections.unmodifiableList(new ArrayList<>(parameters)));
		}
	}

	@ThreadSafe
	private class ScriptedDatabase {
		@NonNull
		private final String locator;
		@NonNull
		private final Map<@NonNull BlobId, @NonNull byte[]> blobs;
		@GuardedBy("this")
		@NonNull
		private final Map<@NonNull String, @NonNull Long> eventCounts;
		@GuardedBy("this")
		@NonNull
		private final List<@NonNull ScriptedEventRegistration> pendingRegistrations;

		private ScriptedDatabase(@NonNull String locator) {
			this.locator = requireNonNull(locator);
			this.blobs = new ConcurrentHashMap<>();
			this.eventCounts = new LinkedHashMap<>();
			this.pendingRegistrations = new ArrayList<>();
		}

		@NonNull
		synchronized ScriptedEventRegistration register(@NonNull Map<@NonNull String, @NonNull Long> baselineCounts,
																										@NonNull EngineEventListener listener) {
			ScriptedEventRegistration registration = new ScriptedEventRegistration(new LinkedHashMap<>(baselineCounts), listener);

			if (isTriggered(registration))
				fire(registration);
			else
				this.pendingRegistrations.add(registration);

			return registration;
		}

		synchronized void post(@NonNull String eventName,
													 long times) {
			this.eventCounts.merge(eventName, times, Long::sum);

			for (ScriptedEventRegistration registration : new ArrayList<>(this.pendingRegistrations)) {
				if (isTriggered(registration)) {
					this.pendingRegistrations.remove(registration);
					fire(registration);
				}
			}
		}

		synchronized void cancel(@NonNull ScriptedEventRegistration registration) {
			this.pendingRegistrations.remove(registration);
		}

		@GuardedBy("this")
		private boolean isTriggered(@NonNull ScriptedEventRegistration registration) {
			for (Map.Entry<String, Long> entry : registration.getBaselineCounts().entrySet())
				if (this.eventCounts.getOrDefault(entry.getKey(), 0L) > entry.getValue())
					return true;

			return false;
		}

		@GuardedBy("this")
		private void fire(@NonNull ScriptedEventRegistration registration) {
			Map<String, Long> counts = new LinkedHashMap<>();

			for (String eventName : registration.getBaselineCounts().keySet())
				counts.put(eventName, this.eventCounts.getOrDefault(eventName, 0L));

			Runnable firing = () -> {
				if (!registration.isCancelled())
					registration.getListener().onEvents(Collections.unmodifiableMap(counts));
			};

			if (synchronousEventFiring)
				firing.run();
			else
				eventExecutorService.execute(firing);
		}

		synchronized int getPendingRegistrationCount() {
			return this.pendingRegistrations.size();
		}

		@NonNull
		String getLocator() {
			return this.locator;
		}

		@NonNull
		Map<@NonNull BlobId, @NonNull byte[]> getBlobs() {
			return this.blobs;
		}
	}

	@ThreadSafe
	private class ScriptedEventRegistration implements EngineEventRegistration {
		@NonNull
		private final Map<@NonNull String, @NonNull Long> baselineCounts;
		@NonNull
		private final EngineEventListener listener;
		private volatile boolean cancelled;
		@Nullable
		private volatile ScriptedDatabase database;

		private ScriptedEventRegistration(@NonNull Map<@NonNull String, @NonNull Long> baselineCounts,
																			@NonNull EngineEventListener listener) {
			this.baselineCounts = requireNonNull(baselineCounts);
			this.listener = requireNonNull(listener);
		}

		@Override
		public void cancel() {
			this.cancelled = true;
			cancelledRegistrationCount.incrementAndGet();

			ScriptedDatabase database = this.database;

			if (database != null)
				database.cancel(this);
		}

		boolean isCancelled() {
			return this.cancelled;
		}

		@NonNull
		Map<@NonNull String, @NonNull Long> getBaselineCounts() {
			return this.baselineCounts;
		}

		@NonNull
		EngineEventListener getListener() {
			return this.listener;
		}

		void setDatabase(@NonNull ScriptedDatabase database) {
			this.database = database;
		}
	}

	@ThreadSafe
	private class ScriptedAttachment implements EngineAttachment {
		@NonNull
		private final ScriptedDatabase database;

		private ScriptedAttachment(@NonNull ScriptedDatabase database) {
			this.database = requireNonNull(database);
		}

		@Override
		@NonNull
		public EngineTransaction startTransaction(@NonNull TransactionOptions options) {
			return new ScriptedTransaction();
		}

		@Override
		@NonNull
		public EngineStatement prepare(@NonNull EngineTransaction transaction,
																	 @NonNull String sql) throws EngineException {
			ensureActive(transaction);

			Script script = scripts.get(sql);

			if (script == null) {
				String token = sql.trim().split("\\s+")[0];
				throw new EngineException(format("Dynamic SQL Error\nSQL error code = -104\nToken unknown - line 1, column 1\n%s", token),
						SYNTAX_ERROR_CODE);
			}

			EngineException prepareFailure = script.prepareFailure;

			if (prepareFailure != null)
				throw prepareFailure;

			return new ScriptedStatement(script);
		}

		@Override
		@NonNull
		public EngineBlob createBlob(@NonNull EngineTransaction transaction) throws EngineException {
			ensureActive(transaction);
			return new ScriptedBlob(this.database, BlobId.of(idGenerator.incrementAndGet()), null);
		}

		@Override
		@NonNull
		public EngineBlob openBlob(@NonNull EngineTransaction transaction,
															 @NonNull BlobId blobId) throws EngineException {
			ensureActive(transaction);

			byte[] content = this.database.getBlobs().get(blobId);

			if (content == null)
				throw new EngineException(format("invalid BLOB ID %d", blobId.getValue()), -904);

			return new ScriptedBlob(this.database, blobId, content);
		}

		@Override
		@NonNull
		public EngineEventRegistration queueEvents(@NonNull Map<@NonNull String, @NonNull Long> baselineCounts,
																							 @NonNull EngineEventListener listener) {
			ScriptedEventRegistration registration = this.database.register(baselineCounts, listener);
			registration.setDatabase(this.database);
			return registration;
		}

		@Override
		public void disconnect() {
			disconnectCount.incrementAndGet();
		}

		@Override
		public void dropDatabase() {
			databases.remove(this.database.getLocator());
			disconnectCount.incrementAndGet();
		}

		private void ensureActive(@NonNull EngineTransaction transaction) throws EngineException {
			if (!((ScriptedTransaction) transaction).isActive())
				throw new EngineException("invalid transaction handle (expecting explicit transaction start)", -901);
		}
	}

	@ThreadSafe
	private class ScriptedTransaction implements EngineTransaction {
		private volatile boolean active = true;

		@Override
		public void commit() throws EngineException {
			commitRetaining();
			this.active = false;
		}

		@Override
		public void commitRetaining() throws EngineException {
			String failure = nextCommitFailure.getAndSet(null);

			if (failure != null)
				throw new EngineException(failure, -913);

			commitCount.incrementAndGet();
		}

		@Override
		public void rollback() {
			rollbackRetaining();
			this.active = false;
		}

		@Override
		public void rollbackRetaining() {
			rollbackCount.incrementAndGet();
		}

		boolean isActive() {
			return this.active;
		}
	}

	@ThreadSafe
	private class ScriptedStatement implements EngineStatement {
		@NonNull
		private final Script script;

		private ScriptedStatement(@NonNull Script script) {
			this.script = requireNonNull(script);
		}

		@Override
		@NonNull
		public List<@NonNull ColumnDescriptor> getInputDescriptors() {
			return this.script.parameters;
		}

		@Override
		@NonNull
		public List<@NonNull ColumnDescriptor> getOutputDescriptors() {
			return this.script.columns;
		}

		@Override
		public void execute(@NonNull EngineTransaction transaction,
												@NonNull List<@Nullable Object> parameters) throws EngineException {
			this.script.recordExecution(parameters);
		}

		@Override
		@Nullable
		public List<@Nullable Object> executeSingleton(@NonNull EngineTransaction transaction,
																									 @NonNull List<@Nullable Object> parameters) throws EngineException {
			this.script.recordExecution(parameters);

			List<List<Object>> rows = this.script.rows;

			if (rows.size() > 1)
				throw new EngineException("multiple rows in singleton select", -811);

			return rows.size() == 0 ? null : rows.get(0);
		}

		@Override
		@NonNull
		public EngineCursor openCursor(@NonNull EngineTransaction transaction,
																	 @NonNull List<@Nullable Object> parameters) throws EngineException {
			this.script.recordExecution(parameters);
			return new ScriptedCursor(this.script.rows, this.script.failingRowIndex, this.script.rowFailure);
		}

		@Override
		public void free() {
			freedStatementCount.incrementAndGet();
		}
	}

	private class ScriptedCursor implements EngineCursor {
		@NonNull
		private final List<@NonNull List<@Nullable Object>> rows;
		@Nullable
		private final Integer failingRowIndex;
		@Nullable
		private final EngineException rowFailure;
		private int rowIndex;

		private ScriptedCursor(@NonNull List<@NonNull List<@Nullable Object>> rows,
													 @Nullable Integer failingRowIndex,
													 @Nullable EngineException rowFailure) {
			this.rows = requireNonNull(rows);
			this.failingRowIndex = failingRowIndex;
			this.rowFailure = rowFailure;
			this.rowIndex = 0;
		}

		@Override
		@Nullable
		public List<@Nullable Object> fetchNext() throws EngineException {
			if (this.failingRowIndex != null && this.rowIndex == this.failingRowIndex && this.rowFailure != null) {
				++this.rowIndex;
				throw this.rowFailure;
			}

			if (this.rowIndex >= this.rows.size())
				return null;

			return this.rows.get(this.rowIndex++);
		}

		@Override
		public void close() {
			closedCursorCount.incrementAndGet();
		}
	}

	private class ScriptedBlob implements EngineBlob {
		@NonNull
		private final ScriptedDatabase database;
		@NonNull
		private final BlobId id;
		@Nullable
		private final byte[] content;
		@NonNull
		private final ByteArrayOutputStream written;
		private int position;

		private ScriptedBlob(@NonNull ScriptedDatabase database,
												 @NonNull BlobId id,
												 @Nullable byte[] content) {
			this.database = requireNonNull(database);
			this.id = requireNonNull(id);
			this.content = content;
			this.written = new ByteArrayOutputStream();
			this.position = 0;
		}

		@Override
		@NonNull
		public BlobId getId() {
			return this.id;
		}

		@Override
		public void write(@NonNull byte[] bytes,
											int offset,
											int length) {
			this.written.write(bytes, offset, length);
		}

		@Override
		public int read(@NonNull byte[] bytes,
										int offset,
										int length) throws EngineException {
			if (this.content == null)
				throw new EngineException("BLOB is open for writing", -904);

			if (this.position >= this.content.length)
				return -1;

			int count = Math.min(length, this.content.length - this.position);
			System.arraycopy(this.content, this.position, bytes, offset, count);
			this.position += count;

			return count;
		}

		@Override
		public long length() {
			return this.content == null ? this.written.size() : this.content.length;
		}

		@Override
		public void close() {
			if (this.content == null)
				this.database.getBlobs().put(this.id, this.written.toByteArray());
		}

		@Override
		public void cancel() {
			cancelledBlobCount.incrementAndGet();
		}
	}
}
