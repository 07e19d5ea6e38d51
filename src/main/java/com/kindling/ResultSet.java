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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * An open cursor over the output of a query, fetched in batches.
 * <p>
 * Each {@link #fetch()} returns up to the resolved fetch size of rows. Once the cursor is exhausted, further fetches
 * return an empty list without calling the engine. The fetch size is resolved, in order, from the options passed to
 * the fetch call, {@link #getDefaultFetchOptions()}, the attachment's {@link Attachment#getDefaultFetchOptions()} and
 * finally {@link FetchOptions#DEFAULT_FETCH_SIZE}.
 * <p>
 * If the engine fails partway through a batch, the rows produced before the failure are returned and the failure is
 * reported by the next fetch, as a {@link RuntimeQueryException}. Rows already returned are never retracted.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ResultSet extends AttachmentResource {
	@NonNull
	private final Statement statement;
	@NonNull
	private final Transaction transaction;
	@NonNull
	private final EngineCursor engineCursor;
	@NonNull
	private final Boolean statementOwned;
	@NonNull
	private final Logger logger;

	@NonNull
	private volatile FetchOptions defaultFetchOptions;
	// Only touched while the operation guard is held
	private boolean finished;
	@Nullable
	private EngineException pendingFailure;

	ResultSet(@NonNull Attachment attachment,
						@NonNull Statement statement,
						@NonNull Transaction transaction,
						@NonNull EngineCursor engineCursor,
						boolean statementOwned) {
		super(attachment);

		requireNonNull(statement);
		requireNonNull(transaction);
		requireNonNull(engineCursor);

		this.statement = statement;
		this.transaction = transaction;
		this.engineCursor = engineCursor;
		this.statementOwned = statementOwned;
		this.logger = Logger.getLogger(ResultSet.class.getName());
		this.defaultFetchOptions = FetchOptions.empty();
		this.finished = false;
		this.pendingFailure = null;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{handle=%s, sql=%s, closed=%s}", getClass().getSimpleName(), getHandle(),
				getStatement().getSql(), isClosed());
	}

	@NonNull
	public CompletableFuture<List<@NonNull Row>> fetch() {
		return fetch(FetchOptions.empty());
	}

	/**
	 * Fetches the next batch of rows.
	 *
	 * @param options options for this fetch only
	 * @return a future for the fetched rows; empty once the cursor is exhausted
	 */
	@NonNull
	public CompletableFuture<List<@NonNull Row>> fetch(@NonNull FetchOptions options) {
		requireNonNull(options);

		return getAttachment().getClient().perform(List.of(getOperationGuard(), getTransaction().getOperationGuard()),
				() -> fetchInternal(resolveFetchSize(options)));
	}

	@NonNull
	public CompletableFuture<List<@NonNull Map<@NonNull String, @Nullable Object>>> fetchAsObject() {
		return fetchAsObject(FetchOptions.empty());
	}

	/**
	 * Fetches the next batch of rows, each projected onto a map keyed by column label in column order. If two columns
	 * share a label, the later column wins.
	 *
	 * @param options options for this fetch only
	 * @return a future for the fetched rows; empty once the cursor is exhausted
	 */
	@NonNull
	public CompletableFuture<List<@NonNull Map<@NonNull String, @Nullable Object>>> fetchAsObject(@NonNull FetchOptions options) {
		requireNonNull(options);

		return fetch(options).thenApply(rows -> {
			List<Map<String, Object>> objects = new ArrayList<>(rows.size());

			for (Row row : rows)
				objects.add(row.toMap(getColumnLabels()));

			return Collections.unmodifiableList(objects);
		});
	}

	/**
	 * Closes the cursor and, for result sets produced by {@link Attachment#executeQuery(Transaction, String, List)},
	 * disposes of the underlying statement.
	 * <p>
	 * Closing an already-closed result set is a no-op. A fetch failure that has not been reported yet is discarded.
	 *
	 * @return a future which completes when the cursor has been closed
	 */
	@NonNull
	public CompletableFuture<Void> close() {
		return getAttachment().getClient().perform(List.of(getOperationGuard(), getTransaction().getOperationGuard()), () -> {
			if (!markReleased())
				return null;

			RuntimeException failure = null;

			try {
				// The engine already dropped cursors of a finished transaction
				if (getTransaction().isActive())
					releaseEngineResources();
			} catch (EngineException e) {
				failure = new DatabaseException(e);
			}

			if (isStatementOwned()) {
				try {
					getStatement().free();
				} catch (RuntimeException e) {
					if (failure == null)
						failure = e;
					else
						failure.addSuppressed(e);
				}
			}

			if (failure != null)
				throw failure;

			logger.finer(format("Closed result set %d", getHandle()));
			return null;
		});
	}

	@NonNull
	public FetchOptions getDefaultFetchOptions() {
		return this.defaultFetchOptions;
	}

	/**
	 * Sets the options used by fetches that do not specify their own; takes effect on the next fetch.
	 *
	 * @param defaultFetchOptions the new default fetch options
	 */
	public void setDefaultFetchOptions(@NonNull FetchOptions defaultFetchOptions) {
		requireNonNull(defaultFetchOptions);
		this.defaultFetchOptions = defaultFetchOptions;
	}

	@NonNull
	public List<@NonNull String> getColumnLabels() {
		return getStatement().getColumnLabels();
	}

	@NonNull
	public Boolean isClosed() {
		return isReleased();
	}

	@NonNull
	private List<@NonNull Row> fetchInternal(int fetchSize) {
		StatementContext statementContext = StatementContext.with(getStatement().getSql(), StatementContext.Operation.FETCH).build();
		long startTime = nanoTime();
		List<Row> rows = new ArrayList<>(Math.min(fetchSize, FetchOptions.DEFAULT_FETCH_SIZE));
		RuntimeException exception = null;

		try {
			ensureNotReleased();
			getTransaction().ensureActive();

			if (this.pendingFailure != null) {
				EngineException pendingFailure = this.pendingFailure;
				this.pendingFailure = null;
				this.finished = true;
				throw new RuntimeQueryException(pendingFailure);
			}

			if (this.finished)
				return List.of();

			TypeMarshaller typeMarshaller = getAttachment().getClient().getTypeMarshaller();
			List<ColumnDescriptor> columns = getStatement().getColumns();

			while (rows.size() < fetchSize) {
				List<Object> nativeRow;

				try {
					nativeRow = getEngineCursor().fetchNext();
				} catch (EngineException e) {
					if (rows.size() == 0) {
						this.finished = true;
						throw new RuntimeQueryException(e);
					}

					// Deliver what we have, report the failure on the next fetch
					this.pendingFailure = e;
					break;
				}

				if (nativeRow == null) {
					this.finished = true;
					break;
				}

				rows.add(typeMarshaller.toRow(columns, nativeRow));
			}

			return Collections.unmodifiableList(rows);
		} catch (RuntimeException e) {
			exception = e;
			throw e;
		} finally {
			getAttachment().getClient().logStatement(StatementLog.withStatementContext(statementContext)
					.fetchDuration(Duration.ofNanos(nanoTime() - startTime))
					.rowCount(rows.size())
					.exception(exception)
					.build(), exception);
		}
	}

	int resolveFetchSize(@NonNull FetchOptions options) {
		requireNonNull(options);

		return options.getFetchSize()
				.or(() -> getDefaultFetchOptions().getFetchSize())
				.or(() -> getAttachment().getDefaultFetchOptions().getFetchSize())
				.orElse(FetchOptions.DEFAULT_FETCH_SIZE);
	}

	@Override
	void releaseEngineResources() throws EngineException {
		getEngineCursor().close();
	}

	@Override
	void invalidate() {
		super.invalidate();

		if (isStatementOwned())
			getStatement().invalidate();
	}

	@NonNull
	Statement getStatement() {
		return this.statement;
	}

	@NonNull
	Transaction getTransaction() {
		return this.transaction;
	}

	@NonNull
	EngineCursor getEngineCursor() {
		return this.engineCursor;
	}

	@NonNull
	Boolean isStatementOwned() {
		return this.statementOwned;
	}
}
