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
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A prepared SQL statement, acquired via {@link Attachment#prepare(Transaction, String)}.
 * <p>
 * A statement belongs to its attachment, not to the transaction it was prepared under: it may be executed any number
 * of times, under any transaction of the attachment, until it is disposed of.
 * <p>
 * Parameters are positional and are converted to the engine's native types as described on {@link TypeMarshaller}.
 * For blob-typed parameters, {@code byte[]} and {@link String} (UTF-8) values are streamed into a new blob in the
 * executing transaction; a {@link Blob} created via {@link Attachment#createBlob(Transaction)} may be bound once it
 * has been closed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Statement extends AttachmentResource {
	@NonNull
	private final String sql;
	@NonNull
	private final EngineStatement engineStatement;
	@NonNull
	private final List<@NonNull ColumnDescriptor> inputDescriptors;
	@NonNull
	private final List<@NonNull ColumnDescriptor> outputDescriptors;
	@NonNull
	private final List<@NonNull String> columnLabels;
	@NonNull
	private final Logger logger;

	Statement(@NonNull Attachment attachment,
						@NonNull String sql,
						@NonNull EngineStatement engineStatement) {
		super(attachment);

		requireNonNull(sql);
		requireNonNull(engineStatement);

		this.sql = sql;
		this.engineStatement = engineStatement;
		this.inputDescriptors = List.copyOf(engineStatement.getInputDescriptors());
		this.outputDescriptors = List.copyOf(engineStatement.getOutputDescriptors());

		List<String> columnLabels = new ArrayList<>(this.outputDescriptors.size());

		for (ColumnDescriptor outputDescriptor : this.outputDescriptors)
			columnLabels.add(outputDescriptor.getLabel());

		this.columnLabels = Collections.unmodifiableList(columnLabels);
		this.logger = Logger.getLogger(Statement.class.getName());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{handle=%s, sql=%s}", getClass().getSimpleName(), getHandle(), getSql());
	}

	@NonNull
	public CompletableFuture<Void> execute(@NonNull Transaction transaction) {
		return execute(transaction, List.of());
	}

	/**
	 * Executes this statement, discarding any output.
	 *
	 * @param transaction the transaction to execute under
	 * @param parameters  positional parameters
	 * @return a future which completes when the statement has executed, failing with {@link ParameterException} for
	 * unbindable parameters or {@link RuntimeQueryException} if execution failed
	 */
	@NonNull
	public CompletableFuture<Void> execute(@NonNull Transaction transaction,
																				 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(parameters);

		getAttachment().ensureOwned(transaction);

		return getAttachment().getClient().perform(List.of(getOperationGuard(), transaction.getOperationGuard()), () -> {
			executeInternal(transaction, parameters);
			return null;
		});
	}

	@NonNull
	public CompletableFuture<ResultSet> executeQuery(@NonNull Transaction transaction) {
		return executeQuery(transaction, List.of());
	}

	/**
	 * Executes this statement and opens a cursor over its output.
	 * <p>
	 * The statement stays usable; it is not owned by the returned result set.
	 *
	 * @param transaction the transaction to execute under
	 * @param parameters  positional parameters
	 * @return a future for the open result set
	 */
	@NonNull
	public CompletableFuture<ResultSet> executeQuery(@NonNull Transaction transaction,
																									 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(parameters);

		getAttachment().ensureOwned(transaction);

		return getAttachment().getClient().perform(List.of(getOperationGuard(), transaction.getOperationGuard()),
				() -> executeQueryInternal(transaction, parameters, false));
	}

	@NonNull
	public CompletableFuture<Row> executeReturning(@NonNull Transaction transaction) {
		return executeReturning(transaction, List.of());
	}

	/**
	 * Executes this statement and returns its single output row, or a row of nulls if it produced none.
	 *
	 * @param transaction the transaction to execute under
	 * @param parameters  positional parameters
	 * @return a future for the output row
	 */
	@NonNull
	public CompletableFuture<Row> executeReturning(@NonNull Transaction transaction,
																								 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(parameters);

		getAttachment().ensureOwned(transaction);

		return getAttachment().getClient().perform(List.of(getOperationGuard(), transaction.getOperationGuard()),
				() -> executeReturningInternal(transaction, parameters));
	}

	@NonNull
	public CompletableFuture<Map<@NonNull String, @Nullable Object>> executeReturningAsObject(@NonNull Transaction transaction) {
		return executeReturningAsObject(transaction, List.of());
	}

	/**
	 * Like {@link #executeReturning(Transaction, List)}, but projects the row onto a map keyed by column label in
	 * column order. If two columns share a label, the later column wins.
	 *
	 * @param transaction the transaction to execute under
	 * @param parameters  positional parameters
	 * @return a future for the label-keyed row
	 */
	@NonNull
	public CompletableFuture<Map<@NonNull String, @Nullable Object>> executeReturningAsObject(@NonNull Transaction transaction,
																																												 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(parameters);

		getAttachment().ensureOwned(transaction);

		return getAttachment().getClient().perform(List.of(getOperationGuard(), transaction.getOperationGuard()),
				() -> executeReturningInternal(transaction, parameters).toMap(getColumnLabels()));
	}

	/**
	 * Releases the prepared statement. Disposing of an already-disposed statement is a no-op.
	 *
	 * @return a future which completes when the statement has been released
	 */
	@NonNull
	public CompletableFuture<Void> dispose() {
		return getAttachment().getClient().perform(List.of(getOperationGuard()), () -> {
			free();
			return null;
		});
	}

	/**
	 * Labels of the output columns (aliases where given), in column order; empty for statements without output.
	 *
	 * @return the output column labels
	 */
	@NonNull
	public List<@NonNull String> getColumnLabels() {
		return this.columnLabels;
	}

	@NonNull
	public List<@NonNull ColumnDescriptor> getColumns() {
		return this.outputDescriptors;
	}

	@NonNull
	public List<@NonNull ColumnDescriptor> getParameters() {
		return this.inputDescriptors;
	}

	@NonNull
	public Integer getParameterCount() {
		return this.inputDescriptors.size();
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public Boolean isDisposed() {
		return isReleased();
	}

	void executeInternal(@NonNull Transaction transaction,
											 @NonNull List<@Nullable Object> parameters) {
		performStatementOperation(StatementContext.Operation.EXECUTE, transaction, parameters, (nativeParameters) -> {
			try {
				getEngineStatement().execute(transaction.getEngineTransaction(), nativeParameters);
			} catch (EngineException e) {
				throw new RuntimeQueryException(e);
			}

			return null;
		});
	}

	@NonNull
	ResultSet executeQueryInternal(@NonNull Transaction transaction,
																 @NonNull List<@Nullable Object> parameters,
																 boolean ownsStatement) {
		EngineCursor engineCursor = performStatementOperation(StatementContext.Operation.EXECUTE_QUERY, transaction, parameters, (nativeParameters) -> {
			try {
				return getEngineStatement().openCursor(transaction.getEngineTransaction(), nativeParameters);
			} catch (EngineException e) {
				throw new RuntimeQueryException(e);
			}
		});

		try {
			return getAttachment().register(new ResultSet(getAttachment(), this, transaction, engineCursor, ownsStatement));
		} catch (RuntimeException e) {
			try {
				engineCursor.close();
			} catch (EngineException cleanupException) {
				e.addSuppressed(cleanupException);
			}

			throw e;
		}
	}

	@NonNull
	Row executeReturningInternal(@NonNull Transaction transaction,
															 @NonNull List<@Nullable Object> parameters) {
		List<Object> nativeRow = performStatementOperation(StatementContext.Operation.EXECUTE_RETURNING, transaction, parameters, (nativeParameters) -> {
			try {
				return getEngineStatement().executeSingleton(transaction.getEngineTransaction(), nativeParameters);
			} catch (EngineException e) {
				throw new RuntimeQueryException(e);
			}
		});

		if (nativeRow == null) {
			List<Value> nulls = new ArrayList<>(this.outputDescriptors.size());

			for (int i = 0; i < this.outputDescriptors.size(); ++i)
				nulls.add(Value.nullValue());

			return new Row(nulls);
		}

		return getAttachment().getClient().getTypeMarshaller().toRow(this.outputDescriptors, nativeRow);
	}

	/**
	 * Marks this statement as released and frees the engine handle.
	 */
	void free() {
		if (!markReleased())
			return;

		try {
			releaseEngineResources();
		} catch (EngineException e) {
			throw new DatabaseException(e);
		}

		logger.finer(format("Disposed of statement %d", getHandle()));
	}

	@Override
	void releaseEngineResources() throws EngineException {
		getEngineStatement().free();
	}

	@FunctionalInterface
	private interface EngineStatementOperation<T> {
		@Nullable
		T perform(@NonNull List<@Nullable Object> nativeParameters);
	}

	@Nullable
	private <T> T performStatementOperation(StatementContext.@NonNull Operation operation,
																					@NonNull Transaction transaction,
																					@NonNull List<@Nullable Object> parameters,
																					@NonNull EngineStatementOperation<T> engineStatementOperation) {
		requireNonNull(operation);
		requireNonNull(transaction);
		requireNonNull(parameters);
		requireNonNull(engineStatementOperation);

		StatementContext statementContext = StatementContext.with(getSql(), operation).parameters(parameters).build();
		Duration preparationDuration = null;
		Duration executionDuration = null;
		RuntimeException exception = null;

		try {
			ensureNotReleased();
			getAttachment().ensureOpen();
			transaction.ensureActive();

			long startTime = nanoTime();
			List<Object> nativeParameters = bindParameters(transaction, parameters);
			preparationDuration = Duration.ofNanos(nanoTime() - startTime);

			startTime = nanoTime();
			T result = engineStatementOperation.perform(nativeParameters);
			executionDuration = Duration.ofNanos(nanoTime() - startTime);

			return result;
		} catch (RuntimeException e) {
			exception = e;
			throw e;
		} finally {
			getAttachment().getClient().logStatement(StatementLog.withStatementContext(statementContext)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.exception(exception)
					.build(), exception);
		}
	}

	@NonNull
	private List<@Nullable Object> bindParameters(@NonNull Transaction transaction,
																								@NonNull List<@Nullable Object> parameters) {
		requireNonNull(transaction);
		requireNonNull(parameters);

		if (parameters.size() != this.inputDescriptors.size())
			throw new ParameterException(format("Statement expects %d parameter[s] but %d were provided",
					this.inputDescriptors.size(), parameters.size()));

		TypeMarshaller typeMarshaller = getAttachment().getClient().getTypeMarshaller();
		List<Object> nativeParameters = new ArrayList<>(parameters.size());

		for (int i = 0; i < parameters.size(); ++i) {
			ColumnDescriptor inputDescriptor = this.inputDescriptors.get(i);
			Object parameter = parameters.get(i);

			if (inputDescriptor.getType() == SqlType.BLOB)
				parameter = toBlobParameter(transaction, i, parameter);

			try {
				nativeParameters.add(typeMarshaller.toNative(inputDescriptor, parameter));
			} catch (ParameterException e) {
				throw new ParameterException(format("Unable to bind parameter %d: %s", i + 1, e.getMessage()), e);
			}
		}

		return nativeParameters;
	}

	@Nullable
	private Object toBlobParameter(@NonNull Transaction transaction,
																 int index,
																 @Nullable Object parameter) {
		if (parameter instanceof Value value)
			parameter = value.getObject();

		if (parameter instanceof Blob blob) {
			if (!blob.isBindable())
				throw new ParameterException(format("Unable to bind parameter %d: the blob must be closed before it is bound", index + 1));

			return blob.getId();
		}

		if (parameter instanceof byte[] bytes)
			return writeBlob(transaction, bytes);

		if (parameter instanceof String string)
			return writeBlob(transaction, string.getBytes(UTF_8));

		return parameter;
	}

	@NonNull
	private BlobId writeBlob(@NonNull Transaction transaction,
													 @NonNull byte[] bytes) {
		EngineBlob engineBlob;

		try {
			engineBlob = getAttachment().getEngineAttachment().createBlob(transaction.getEngineTransaction());
		} catch (EngineException e) {
			throw new DatabaseException(e);
		}

		try {
			for (int offset = 0; offset < bytes.length; offset += Blob.MAXIMUM_SEGMENT_SIZE)
				engineBlob.write(bytes, offset, Math.min(Blob.MAXIMUM_SEGMENT_SIZE, bytes.length - offset));

			engineBlob.close();
		} catch (EngineException e) {
			DatabaseException databaseException = new DatabaseException(e);

			try {
				engineBlob.cancel();
			} catch (EngineException cleanupException) {
				databaseException.addSuppressed(cleanupException);
			}

			throw databaseException;
		}

		return engineBlob.getId();
	}

	@NonNull
	EngineStatement getEngineStatement() {
		return this.engineStatement;
	}
}
