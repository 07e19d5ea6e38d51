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
import javax.sql.DataSource;
import javax.sql.rowset.serial.SerialBlob;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * {@link Engine} implementation which runs on top of any JDBC {@link DataSource}.
 * <p>
 * Each attachment holds a control connection (opened at attach time, used for dropping the database) plus one JDBC
 * connection per transaction, with auto-commit disabled. Isolation levels map to JDBC as follows:
 * {@link TransactionIsolation#SNAPSHOT} to {@link Connection#TRANSACTION_REPEATABLE_READ},
 * {@link TransactionIsolation#READ_COMMITTED} to {@link Connection#TRANSACTION_READ_COMMITTED} and
 * {@link TransactionIsolation#CONSISTENCY} to {@link Connection#TRANSACTION_SERIALIZABLE}. JDBC has no standard
 * equivalent of {@link WaitMode} or lock timeouts, so those options are not applied.
 * <p>
 * Database events are not supported.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class JdbcEngine implements Engine {
	/**
	 * Error code reported when a singleton execution produces more than one row.
	 */
	public static final int MULTIPLE_ROWS_ERROR_CODE = -811;
	/**
	 * Default largest number of bytes read from a JDBC blob at once.
	 */
	public static final int DEFAULT_BLOB_SEGMENT_SIZE = Blob.MAXIMUM_SEGMENT_SIZE;

	@NonNull
	private final DataSourceFactory dataSourceFactory;
	@Nullable
	private final String dropDatabaseSql;
	@NonNull
	private final Integer blobSegmentSize;
	@NonNull
	private final AtomicLong blobIdGenerator;
	@NonNull
	private final Logger logger;

	private JdbcEngine(@NonNull Builder builder) {
		requireNonNull(builder);

		this.dataSourceFactory = requireNonNull(builder.dataSourceFactory);
		this.dropDatabaseSql = builder.dropDatabaseSql;
		this.blobSegmentSize = builder.blobSegmentSize == null ? DEFAULT_BLOB_SEGMENT_SIZE : builder.blobSegmentSize;
		this.blobIdGenerator = new AtomicLong(0);
		this.logger = Logger.getLogger(getClass().getName());

		if (this.blobSegmentSize < 1)
			throw new IllegalArgumentException(format("Blob segment size must be positive, got %d", this.blobSegmentSize));
	}

	/**
	 * Provides a {@link JdbcEngine} builder for the given {@link DataSourceFactory}.
	 *
	 * @param dataSourceFactory maps database locators and credentials to data sources
	 * @return a {@link JdbcEngine} builder
	 */
	@NonNull
	public static Builder withDataSourceFactory(@NonNull DataSourceFactory dataSourceFactory) {
		requireNonNull(dataSourceFactory);
		return new Builder(dataSourceFactory);
	}

	/**
	 * Contract for turning a database locator into a {@link DataSource}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@FunctionalInterface
	public interface DataSourceFactory {
		/**
		 * Provides a data source for the given database.
		 *
		 * @param locator  the database locator
		 * @param username the user to connect as, if any
		 * @param password the password to connect with, if any
		 * @param create   {@code true} if the database is being created, {@code false} if it must already exist
		 * @return a data source for the database
		 * @throws SQLException if no data source can be provided
		 */
		@NonNull
		DataSource dataSourceFor(@NonNull String locator,
														 @Nullable String username,
														 @Nullable String password,
														 boolean create) throws SQLException;
	}

	@Override
	@NonNull
	public EngineAttachment createDatabase(@NonNull String locator,
																				 @NonNull CreateDatabaseOptions options) throws EngineException {
		requireNonNull(locator);
		requireNonNull(options);

		if (options.getPageSize().isPresent() || options.getForcedWrite().isPresent())
			logger.finer(format("Page size and forced writes are not applicable to JDBC, ignoring them for %s", locator));

		return attach(locator, options.getUsername().orElse(null), options.getPassword().orElse(null), true);
	}

	@Override
	@NonNull
	public EngineAttachment connect(@NonNull String locator,
																	@NonNull ConnectOptions options) throws EngineException {
		requireNonNull(locator);
		requireNonNull(options);

		return attach(locator, options.getUsername().orElse(null), options.getPassword().orElse(null), false);
	}

	@Override
	public void dispose() {
		// Nothing engine-wide to release
	}

	@NonNull
	private EngineAttachment attach(@NonNull String locator,
																	@Nullable String username,
																	@Nullable String password,
																	boolean create) throws EngineException {
		try {
			DataSource dataSource = getDataSourceFactory().dataSourceFor(locator, username, password, create);
			Connection controlConnection = dataSource.getConnection();
			return new JdbcAttachment(this, locator, dataSource, controlConnection);
		} catch (SQLException e) {
			throw toEngineException(e);
		}
	}

	@NonNull
	static EngineException toEngineException(@NonNull SQLException e) {
		requireNonNull(e);
		return new EngineException(e.getMessage(), e.getErrorCode(), e);
	}

	@NonNull
	BlobId nextBlobId() {
		return BlobId.of(this.blobIdGenerator.incrementAndGet());
	}

	@NonNull
	DataSourceFactory getDataSourceFactory() {
		return this.dataSourceFactory;
	}

	@NonNull
	Optional<String> getDropDatabaseSql() {
		return Optional.ofNullable(this.dropDatabaseSql);
	}

	@NonNull
	Integer getBlobSegmentSize() {
		return this.blobSegmentSize;
	}

	/**
	 * Builder used to construct instances of {@link JdbcEngine}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DataSourceFactory dataSourceFactory;
		@Nullable
		private String dropDatabaseSql;
		@Nullable
		private Integer blobSegmentSize;

		private Builder(@NonNull DataSourceFactory dataSourceFactory) {
			this.dataSourceFactory = requireNonNull(dataSourceFactory);
		}

		/**
		 * SQL run on the control connection to drop the attached database, e.g. {@code SHUTDOWN} for an in-memory HSQLDB
		 * database. If not set, dropping databases is unsupported.
		 *
		 * @param dropDatabaseSql the SQL which drops the database
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder dropDatabaseSql(@Nullable String dropDatabaseSql) {
			this.dropDatabaseSql = dropDatabaseSql;
			return this;
		}

		@NonNull
		public Builder blobSegmentSize(@Nullable Integer blobSegmentSize) {
			this.blobSegmentSize = blobSegmentSize;
			return this;
		}

		@NonNull
		public JdbcEngine build() {
			return new JdbcEngine(this);
		}
	}

	@ThreadSafe
	static final class JdbcAttachment implements EngineAttachment {
		@NonNull
		private final JdbcEngine engine;
		@NonNull
		private final String locator;
		@NonNull
		private final DataSource dataSource;
		@NonNull
		private final Connection controlConnection;
		@NonNull
		private final Set<@NonNull JdbcTransaction> transactions;
		@NonNull
		private final Logger logger;

		JdbcAttachment(@NonNull JdbcEngine engine,
									 @NonNull String locator,
									 @NonNull DataSource dataSource,
									 @NonNull Connection controlConnection) {
			this.engine = requireNonNull(engine);
			this.locator = requireNonNull(locator);
			this.dataSource = requireNonNull(dataSource);
			this.controlConnection = requireNonNull(controlConnection);
			this.transactions = ConcurrentHashMap.newKeySet();
			this.logger = Logger.getLogger(getClass().getName());
		}

		@Override
		@NonNull
		public EngineTransaction startTransaction(@NonNull TransactionOptions options) throws EngineException {
			requireNonNull(options);

			Connection connection = null;

			try {
				connection = this.dataSource.getConnection();
				connection.setAutoCommit(false);
				connection.setTransactionIsolation(jdbcIsolationLevel(options.getIsolation()));

				if (options.getAccessMode() == AccessMode.READ_ONLY)
					connection.setReadOnly(true);
			} catch (SQLException e) {
				EngineException engineException = toEngineException(e);

				if (connection != null) {
					try {
						connection.close();
					} catch (SQLException cleanupException) {
						engineException.addSuppressed(cleanupException);
					}
				}

				throw engineException;
			}

			JdbcTransaction transaction = new JdbcTransaction(this, connection);
			this.transactions.add(transaction);

			return transaction;
		}

		@Override
		@NonNull
		public EngineStatement prepare(@NonNull EngineTransaction transaction,
																	 @NonNull String sql) throws EngineException {
			requireNonNull(transaction);
			requireNonNull(sql);

			JdbcTransaction jdbcTransaction = jdbcTransaction(transaction);

			try {
				PreparedStatement preparedStatement = jdbcTransaction.getConnection().prepareStatement(sql);

				try {
					ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();
					ResultSetMetaData resultSetMetaData = preparedStatement.getMetaData();
					JdbcStatement statement = new JdbcStatement(this, sql, describeParameters(parameterMetaData), jdbcTypes(parameterMetaData),
							describeColumns(resultSetMetaData), jdbcTypes(resultSetMetaData));
					statement.cachePreparedStatement(jdbcTransaction.getConnection(), preparedStatement);
					return statement;
				} catch (SQLException | RuntimeException e) {
					try {
						preparedStatement.close();
					} catch (SQLException cleanupException) {
						e.addSuppressed(cleanupException);
					}

					throw e;
				}
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		@NonNull
		public EngineBlob createBlob(@NonNull EngineTransaction transaction) throws EngineException {
			requireNonNull(transaction);

			try {
				JdbcTransaction jdbcTransaction = jdbcTransaction(transaction);
				java.sql.Blob blob = jdbcTransaction.getConnection().createBlob();
				return new JdbcBlob(jdbcTransaction, this.engine.nextBlobId(), blob, true);
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		@NonNull
		public EngineBlob openBlob(@NonNull EngineTransaction transaction,
															 @NonNull BlobId blobId) throws EngineException {
			requireNonNull(transaction);
			requireNonNull(blobId);

			JdbcTransaction jdbcTransaction = jdbcTransaction(transaction);
			java.sql.Blob blob = jdbcTransaction.getBlob(blobId);

			if (blob == null)
				throw new EngineException(format("Unknown blob %d", blobId.getValue()));

			return new JdbcBlob(jdbcTransaction, blobId, blob, false);
		}

		@Override
		@NonNull
		public EngineEventRegistration queueEvents(@NonNull Map<@NonNull String, @NonNull Long> baselineCounts,
																							 @NonNull EngineEventListener listener) throws EngineException {
			throw new EngineException("Database events are not supported over JDBC");
		}

		@Override
		public void disconnect() throws EngineException {
			closeTransactionConnections();

			try {
				this.controlConnection.close();
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		public void dropDatabase() throws EngineException {
			String dropDatabaseSql = this.engine.getDropDatabaseSql().orElse(null);

			if (dropDatabaseSql == null)
				throw new EngineException(format("Dropping databases is not supported: no drop SQL was configured for %s", this.locator));

			closeTransactionConnections();

			try (java.sql.Statement statement = this.controlConnection.createStatement()) {
				statement.execute(dropDatabaseSql);
			} catch (SQLException e) {
				throw toEngineException(e);
			}

			disconnect();
		}

		private void closeTransactionConnections() {
			for (JdbcTransaction transaction : new ArrayList<>(this.transactions)) {
				try {
					transaction.rollback();
				} catch (EngineException e) {
					logger.log(WARNING, format("Unable to roll back abandoned transaction on %s", this.locator), e);
				}
			}
		}

		@NonNull
		JdbcTransaction jdbcTransaction(@NonNull EngineTransaction transaction) throws EngineException {
			if (!(transaction instanceof JdbcTransaction jdbcTransaction) || jdbcTransaction.getAttachment() != this)
				throw new EngineException(format("Transaction %s does not belong to this attachment", transaction));

			if (!jdbcTransaction.isOpen())
				throw new EngineException("Transaction has already ended");

			return jdbcTransaction;
		}

		@NonNull
		private List<@NonNull ColumnDescriptor> describeParameters(@Nullable ParameterMetaData parameterMetaData) throws SQLException {
			if (parameterMetaData == null)
				return List.of();

			List<ColumnDescriptor> parameters = new ArrayList<>(parameterMetaData.getParameterCount());

			for (int i = 1; i <= parameterMetaData.getParameterCount(); ++i)
				parameters.add(describe("", parameterMetaData.getParameterType(i), parameterMetaData.getPrecision(i),
						parameterMetaData.getScale(i), parameterMetaData.isNullable(i) != ParameterMetaData.parameterNoNulls));

			return Collections.unmodifiableList(parameters);
		}

		@NonNull
		private int[] jdbcTypes(@Nullable ParameterMetaData parameterMetaData) throws SQLException {
			if (parameterMetaData == null)
				return new int[0];

			int[] jdbcTypes = new int[parameterMetaData.getParameterCount()];

			for (int i = 0; i < jdbcTypes.length; ++i)
				jdbcTypes[i] = parameterMetaData.getParameterType(i + 1);

			return jdbcTypes;
		}

		@NonNull
		private int[] jdbcTypes(@Nullable ResultSetMetaData resultSetMetaData) throws SQLException {
			if (resultSetMetaData == null)
				return new int[0];

			int[] jdbcTypes = new int[resultSetMetaData.getColumnCount()];

			for (int i = 0; i < jdbcTypes.length; ++i)
				jdbcTypes[i] = resultSetMetaData.getColumnType(i + 1);

			return jdbcTypes;
		}

		@NonNull
		private List<@NonNull ColumnDescriptor> describeColumns(@Nullable ResultSetMetaData resultSetMetaData) throws SQLException {
			if (resultSetMetaData == null)
				return List.of();

			List<ColumnDescriptor> columns = new ArrayList<>(resultSetMetaData.getColumnCount());

			for (int i = 1; i <= resultSetMetaData.getColumnCount(); ++i)
				columns.add(describe(resultSetMetaData.getColumnLabel(i), resultSetMetaData.getColumnType(i),
						resultSetMetaData.getPrecision(i), resultSetMetaData.getScale(i),
						resultSetMetaData.isNullable(i) != ResultSetMetaData.columnNoNulls));

			return Collections.unmodifiableList(columns);
		}

		@NonNull
		private ColumnDescriptor describe(@Nullable String label,
																			int jdbcType,
																			int precision,
																			int scale,
																			boolean nullable) {
			SqlType sqlType = sqlTypeFor(jdbcType, precision, scale);
			ColumnDescriptor.Builder builder = ColumnDescriptor.withType(sqlType)
					.label(label)
					.nullable(nullable);

			if (sqlType.isScalable())
				builder.scale(-Math.max(scale, 0));

			if (sqlType == SqlType.CHAR || sqlType == SqlType.VARCHAR)
				builder.length(Math.max(precision, 0));

			return builder.build();
		}

		@NonNull
		private SqlType sqlTypeFor(int jdbcType,
															 int precision,
															 int scale) {
			switch (jdbcType) {
				case Types.TINYINT:
				case Types.SMALLINT:
					return SqlType.SMALLINT;
				case Types.INTEGER:
					return SqlType.INTEGER;
				case Types.BIGINT:
					return SqlType.BIGINT;
				case Types.DECIMAL:
				case Types.NUMERIC:
					// Drivers report 0 when the precision is unknown
					if (precision <= 0)
						return SqlType.DECFLOAT34;
					if (precision <= 4)
						return SqlType.SMALLINT;
					if (precision <= 9)
						return SqlType.INTEGER;
					if (precision <= 18)
						return SqlType.BIGINT;
					if (precision <= 38)
						return SqlType.INT128;

					return SqlType.DECFLOAT34;
				case Types.REAL:
					return SqlType.FLOAT;
				case Types.FLOAT:
				case Types.DOUBLE:
					return SqlType.DOUBLE;
				case Types.DATE:
					return SqlType.DATE;
				case Types.TIME:
				case Types.TIME_WITH_TIMEZONE:
					return SqlType.TIME;
				case Types.TIMESTAMP:
				case Types.TIMESTAMP_WITH_TIMEZONE:
					return SqlType.TIMESTAMP;
				case Types.BOOLEAN:
				case Types.BIT:
					return SqlType.BOOLEAN;
				case Types.CHAR:
				case Types.NCHAR:
					return SqlType.CHAR;
				case Types.BLOB:
				case Types.BINARY:
				case Types.VARBINARY:
				case Types.LONGVARBINARY:
					return SqlType.BLOB;
				default:
					// VARCHAR, CLOB and anything without a closer native counterpart travel as text
					return SqlType.VARCHAR;
			}
		}

		private int jdbcIsolationLevel(@NonNull TransactionIsolation isolation) {
			switch (isolation) {
				case SNAPSHOT:
					return Connection.TRANSACTION_REPEATABLE_READ;
				case READ_COMMITTED:
					return Connection.TRANSACTION_READ_COMMITTED;
				case CONSISTENCY:
					return Connection.TRANSACTION_SERIALIZABLE;
				default:
					throw new IllegalStateException(format("Unhandled %s value %s", TransactionIsolation.class.getSimpleName(), isolation.name()));
			}
		}

		void unregisterTransaction(@NonNull JdbcTransaction transaction) {
			this.transactions.remove(transaction);
		}

		@NonNull
		JdbcEngine getEngine() {
			return this.engine;
		}
	}

	@ThreadSafe
	static final class JdbcTransaction implements EngineTransaction {
		@NonNull
		private final JdbcAttachment attachment;
		@NonNull
		private final Connection connection;
		// Blobs fetched or written under this transaction, addressable by id until it ends
		@NonNull
		private final Map<@NonNull BlobId, java.sql.@NonNull Blob> blobs;
		private volatile boolean open;

		JdbcTransaction(@NonNull JdbcAttachment attachment,
										@NonNull Connection connection) {
			this.attachment = requireNonNull(attachment);
			this.connection = requireNonNull(connection);
			this.blobs = new ConcurrentHashMap<>();
			this.open = true;
		}

		@Override
		public void commit() throws EngineException {
			try {
				getConnection().commit();
			} catch (SQLException e) {
				throw toEngineException(e);
			}

			end();
		}

		@Override
		public void commitRetaining() throws EngineException {
			try {
				getConnection().commit();
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		public void rollback() throws EngineException {
			try {
				getConnection().rollback();
			} catch (SQLException e) {
				throw toEngineException(e);
			}

			end();
		}

		@Override
		public void rollbackRetaining() throws EngineException {
			try {
				getConnection().rollback();
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		private void end() throws EngineException {
			this.open = false;
			this.blobs.clear();
			getAttachment().unregisterTransaction(this);

			try {
				getConnection().close();
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@NonNull
		BlobId registerBlob(java.sql.@NonNull Blob blob) {
			BlobId blobId = getAttachment().getEngine().nextBlobId();
			this.blobs.put(blobId, blob);
			return blobId;
		}

		void registerBlob(@NonNull BlobId blobId,
											java.sql.@NonNull Blob blob) {
			this.blobs.put(blobId, blob);
		}

		java.sql.@Nullable Blob getBlob(@NonNull BlobId blobId) {
			return this.blobs.get(blobId);
		}

		int getBlobCount() {
			return this.blobs.size();
		}

		boolean isOpen() {
			return this.open;
		}

		@NonNull
		JdbcAttachment getAttachment() {
			return this.attachment;
		}

		@NonNull
		Connection getConnection() {
			return this.connection;
		}
	}

	@ThreadSafe
	static final class JdbcStatement implements EngineStatement {
		@NonNull
		private final JdbcAttachment attachment;
		@NonNull
		private final String sql;
		@NonNull
		private final List<@NonNull ColumnDescriptor> inputDescriptors;
		@NonNull
		private final List<@NonNull ColumnDescriptor> outputDescriptors;
		// Driver-reported types, needed to tell binary columns apart from true blobs
		@NonNull
		private final int[] inputJdbcTypes;
		@NonNull
		private final int[] outputJdbcTypes;
		@NonNull
		private final Map<@NonNull Connection, @NonNull PreparedStatement> preparedStatementsByConnection;

		JdbcStatement(@NonNull JdbcAttachment attachment,
									@NonNull String sql,
									@NonNull List<@NonNull ColumnDescriptor> inputDescriptors,
									@NonNull int[] inputJdbcTypes,
									@NonNull List<@NonNull ColumnDescriptor> outputDescriptors,
									@NonNull int[] outputJdbcTypes) {
			this.attachment = requireNonNull(attachment);
			this.sql = requireNonNull(sql);
			this.inputDescriptors = requireNonNull(inputDescriptors);
			this.inputJdbcTypes = requireNonNull(inputJdbcTypes);
			this.outputDescriptors = requireNonNull(outputDescriptors);
			this.outputJdbcTypes = requireNonNull(outputJdbcTypes);
			this.preparedStatementsByConnection = new ConcurrentHashMap<>();
		}

		@Override
		@NonNull
		public List<@NonNull ColumnDescriptor> getInputDescriptors() {
			return this.inputDescriptors;
		}

		@Override
		@NonNull
		public List<@NonNull ColumnDescriptor> getOutputDescriptors() {
			return this.outputDescriptors;
		}

		@Override
		public void execute(@NonNull EngineTransaction transaction,
												@NonNull List<@Nullable Object> parameters) throws EngineException {
			requireNonNull(transaction);
			requireNonNull(parameters);

			JdbcTransaction jdbcTransaction = getAttachment().jdbcTransaction(transaction);

			try {
				PreparedStatement preparedStatement = preparedStatementFor(jdbcTransaction);
				bind(preparedStatement, jdbcTransaction, parameters);

				if (preparedStatement.execute())
					preparedStatement.getResultSet().close();
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		@Nullable
		public List<@Nullable Object> executeSingleton(@NonNull EngineTransaction transaction,
																									 @NonNull List<@Nullable Object> parameters) throws EngineException {
			requireNonNull(transaction);
			requireNonNull(parameters);

			JdbcTransaction jdbcTransaction = getAttachment().jdbcTransaction(transaction);

			try {
				PreparedStatement preparedStatement = preparedStatementFor(jdbcTransaction);
				bind(preparedStatement, jdbcTransaction, parameters);

				if (!preparedStatement.execute())
					return null;

				try (java.sql.ResultSet resultSet = preparedStatement.getResultSet()) {
					if (!resultSet.next())
						return null;

					List<Object> row = readRow(resultSet, jdbcTransaction);

					if (resultSet.next())
						throw new EngineException("multiple rows in singleton select", MULTIPLE_ROWS_ERROR_CODE);

					return row;
				}
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		@NonNull
		public EngineCursor openCursor(@NonNull EngineTransaction transaction,
																	 @NonNull List<@Nullable Object> parameters) throws EngineException {
			requireNonNull(transaction);
			requireNonNull(parameters);

			JdbcTransaction jdbcTransaction = getAttachment().jdbcTransaction(transaction);

			// Each cursor gets its own JDBC statement so cursors of one prepared statement stay independent
			PreparedStatement preparedStatement = null;

			try {
				preparedStatement = jdbcTransaction.getConnection().prepareStatement(getSql());
				bind(preparedStatement, jdbcTransaction, parameters);

				if (!preparedStatement.execute())
					throw new EngineException("Statement does not produce a result set");

				return new JdbcCursor(this, jdbcTransaction, preparedStatement, preparedStatement.getResultSet());
			} catch (SQLException | EngineException | RuntimeException e) {
				if (preparedStatement != null) {
					try {
						preparedStatement.close();
					} catch (SQLException cleanupException) {
						e.addSuppressed(cleanupException);
					}
				}

				if (e instanceof SQLException sqlException)
					throw toEngineException(sqlException);
				if (e instanceof EngineException engineException)
					throw engineException;

				throw (RuntimeException) e;
			}
		}

		@Override
		public void free() throws EngineException {
			SQLException failure = null;

			for (PreparedStatement preparedStatement : new ArrayList<>(this.preparedStatementsByConnection.values())) {
				try {
					preparedStatement.close();
				} catch (SQLException e) {
					if (failure == null)
						failure = e;
					else
						failure.addSuppressed(e);
				}
			}

			this.preparedStatementsByConnection.clear();

			if (failure != null)
				throw toEngineException(failure);
		}

		void cachePreparedStatement(@NonNull Connection connection,
																@NonNull PreparedStatement preparedStatement) {
			this.preparedStatementsByConnection.put(connection, preparedStatement);
		}

		@NonNull
		private PreparedStatement preparedStatementFor(@NonNull JdbcTransaction transaction) throws SQLException {
			Connection connection = transaction.getConnection();
			PreparedStatement preparedStatement = this.preparedStatementsByConnection.get(connection);

			if (preparedStatement != null && !preparedStatement.isClosed())
				return preparedStatement;

			// Drop statements whose transactions have ended
			this.preparedStatementsByConnection.entrySet().removeIf(entry -> {
				try {
					return entry.getKey().isClosed();
				} catch (SQLException e) {
					return true;
				}
			});

			preparedStatement = connection.prepareStatement(getSql());
			this.preparedStatementsByConnection.put(connection, preparedStatement);

			return preparedStatement;
		}

		private void bind(@NonNull PreparedStatement preparedStatement,
											@NonNull JdbcTransaction transaction,
											@NonNull List<@Nullable Object> parameters) throws SQLException, EngineException {
			if (parameters.size() != this.inputDescriptors.size())
				throw new EngineException(format("Expected %d parameter[s] but got %d", this.inputDescriptors.size(), parameters.size()));

			for (int i = 0; i < parameters.size(); ++i)
				bindParameter(preparedStatement, transaction, i + 1, this.inputDescriptors.get(i), this.inputJdbcTypes[i], parameters.get(i));
		}

		private void bindParameter(@NonNull PreparedStatement preparedStatement,
															 @NonNull JdbcTransaction transaction,
															 int parameterIndex,
															 @NonNull ColumnDescriptor descriptor,
															 int jdbcType,
															 @Nullable Object parameter) throws SQLException, EngineException {
			if (parameter == null) {
				preparedStatement.setNull(parameterIndex, jdbcTypeFor(descriptor.getType()));
				return;
			}

			switch (descriptor.getType()) {
				case SMALLINT:
				case INTEGER:
				case BIGINT: {
					long unscaled = (Long) parameter;

					if (descriptor.getScale() == 0)
						preparedStatement.setLong(parameterIndex, unscaled);
					else
						preparedStatement.setBigDecimal(parameterIndex, BigDecimal.valueOf(unscaled, -descriptor.getScale()));

					break;
				}
				case INT128:
					preparedStatement.setBigDecimal(parameterIndex, new BigDecimal((BigInteger) parameter, -descriptor.getScale()));
					break;
				case DECFLOAT16:
				case DECFLOAT34:
					preparedStatement.setBigDecimal(parameterIndex, (BigDecimal) parameter);
					break;
				case FLOAT:
				case DOUBLE:
					preparedStatement.setDouble(parameterIndex, (Double) parameter);
					break;
				case DATE:
					preparedStatement.setObject(parameterIndex, TypeMarshaller.decodeDate((Integer) parameter));
					break;
				case TIME:
					preparedStatement.setObject(parameterIndex, TypeMarshaller.decodeTime((Integer) parameter));
					break;
				case TIMESTAMP:
					preparedStatement.setObject(parameterIndex, TypeMarshaller.decodeTimestamp((Long) parameter));
					break;
				case BOOLEAN:
					preparedStatement.setBoolean(parameterIndex, (Boolean) parameter);
					break;
				case CHAR:
				case VARCHAR:
					preparedStatement.setString(parameterIndex, (String) parameter);
					break;
				case BLOB: {
					BlobId blobId = (BlobId) parameter;
					java.sql.Blob blob = transaction.getBlob(blobId);

					if (blob == null)
						throw new EngineException(format("Unknown blob %d", blobId.getValue()));

					if (jdbcType == Types.BLOB)
						preparedStatement.setBlob(parameterIndex, blob);
					else
						preparedStatement.setBytes(parameterIndex, blob.getBytes(1, Math.toIntExact(blob.length())));

					break;
				}
				default:
					throw new EngineException(format("Unable to bind parameters of type %s", descriptor.getType().name()));
			}
		}

		@NonNull
		List<@Nullable Object> readRow(java.sql.@NonNull ResultSet resultSet,
																	 @NonNull JdbcTransaction transaction) throws SQLException {
			List<Object> row = new ArrayList<>(this.outputDescriptors.size());

			for (int i = 0; i < this.outputDescriptors.size(); ++i)
				row.add(readColumn(resultSet, transaction, i + 1, this.outputDescriptors.get(i), this.outputJdbcTypes[i]));

			return row;
		}

		@Nullable
		private Object readColumn(java.sql.@NonNull ResultSet resultSet,
															@NonNull JdbcTransaction transaction,
															int columnIndex,
															@NonNull ColumnDescriptor descriptor,
															int jdbcType) throws SQLException {
			switch (descriptor.getType()) {
				case SMALLINT:
				case INTEGER:
				case BIGINT: {
					if (descriptor.getScale() == 0) {
						long value = resultSet.getLong(columnIndex);
						return resultSet.wasNull() ? null : value;
					}

					BigDecimal value = resultSet.getBigDecimal(columnIndex);
					return value == null ? null : value.setScale(-descriptor.getScale()).unscaledValue().longValueExact();
				}
				case INT128: {
					BigDecimal value = resultSet.getBigDecimal(columnIndex);
					return value == null ? null : value.setScale(-descriptor.getScale()).unscaledValue();
				}
				case DECFLOAT16:
				case DECFLOAT34:
					return resultSet.getBigDecimal(columnIndex);
				case FLOAT:
				case DOUBLE: {
					double value = resultSet.getDouble(columnIndex);
					return resultSet.wasNull() ? null : value;
				}
				case DATE: {
					LocalDate value = resultSet.getObject(columnIndex, LocalDate.class);
					return value == null ? null : TypeMarshaller.encodeDate(value);
				}
				case TIME: {
					LocalTime value = resultSet.getObject(columnIndex, LocalTime.class);
					return value == null ? null : TypeMarshaller.encodeTime(value);
				}
				case TIMESTAMP: {
					LocalDateTime value = resultSet.getObject(columnIndex, LocalDateTime.class);
					return value == null ? null : TypeMarshaller.encodeTimestamp(value);
				}
				case BOOLEAN: {
					boolean value = resultSet.getBoolean(columnIndex);
					return resultSet.wasNull() ? null : value;
				}
				case CHAR:
				case VARCHAR:
					return resultSet.getString(columnIndex);
				case BLOB: {
					if (jdbcType != Types.BLOB) {
						byte[] bytes = resultSet.getBytes(columnIndex);
						return bytes == null ? null : transaction.registerBlob(new SerialBlob(bytes));
					}

					java.sql.Blob blob = resultSet.getBlob(columnIndex);
					return blob == null ? null : transaction.registerBlob(blob);
				}
				default:
					return resultSet.getString(columnIndex);
			}
		}

		private int jdbcTypeFor(@NonNull SqlType sqlType) {
			switch (sqlType) {
				case SMALLINT:
					return Types.SMALLINT;
				case INTEGER:
					return Types.INTEGER;
				case BIGINT:
					return Types.BIGINT;
				case INT128:
				case DECFLOAT16:
				case DECFLOAT34:
					return Types.DECIMAL;
				case FLOAT:
					return Types.REAL;
				case DOUBLE:
					return Types.DOUBLE;
				case DATE:
					return Types.DATE;
				case TIME:
					return Types.TIME;
				case TIMESTAMP:
					return Types.TIMESTAMP;
				case BOOLEAN:
					return Types.BOOLEAN;
				case CHAR:
					return Types.CHAR;
				case BLOB:
					return Types.BLOB;
				default:
					return Types.VARCHAR;
			}
		}

		@NonNull
		JdbcAttachment getAttachment() {
			return this.attachment;
		}

		@NonNull
		String getSql() {
			return this.sql;
		}
	}

	@NotThreadSafe
	static final class JdbcCursor implements EngineCursor {
		@NonNull
		private final JdbcStatement statement;
		@NonNull
		private final JdbcTransaction transaction;
		@NonNull
		private final PreparedStatement preparedStatement;
		private final java.sql.@NonNull ResultSet resultSet;

		JdbcCursor(@NonNull JdbcStatement statement,
							 @NonNull JdbcTransaction transaction,
							 @NonNull PreparedStatement preparedStatement,
							 java.sql.@NonNull ResultSet resultSet) {
			this.statement = requireNonNull(statement);
			this.transaction = requireNonNull(transaction);
			this.preparedStatement = requireNonNull(preparedStatement);
			this.resultSet = requireNonNull(resultSet);
		}

		@Override
		@Nullable
		public List<@Nullable Object> fetchNext() throws EngineException {
			try {
				if (!this.resultSet.next())
					return null;

				return this.statement.readRow(this.resultSet, this.transaction);
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		public void close() throws EngineException {
			try {
				this.resultSet.close();
				this.preparedStatement.close();
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}
	}

	@NotThreadSafe
	static final class JdbcBlob implements EngineBlob {
		@NonNull
		private final JdbcTransaction transaction;
		@NonNull
		private final BlobId id;
		private final java.sql.@NonNull Blob blob;
		private final boolean writable;
		// 0-based offset of the next read or write
		private long position;

		JdbcBlob(@NonNull JdbcTransaction transaction,
						 @NonNull BlobId id,
						 java.sql.@NonNull Blob blob,
						 boolean writable) {
			this.transaction = requireNonNull(transaction);
			this.id = requireNonNull(id);
			this.blob = requireNonNull(blob);
			this.writable = writable;
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
											int length) throws EngineException {
			if (!this.writable)
				throw new EngineException("Blob is open for reading");

			try {
				// JDBC blob positions are 1-based
				this.blob.setBytes(this.position + 1, bytes, offset, length);
				this.position += length;
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		public int read(@NonNull byte[] bytes,
										int offset,
										int length) throws EngineException {
			if (this.writable)
				throw new EngineException("Blob is open for writing");

			try {
				long remaining = this.blob.length() - this.position;

				if (remaining <= 0)
					return -1;

				int segmentLength = (int) Math.min(Math.min(length, remaining), this.transaction.getAttachment().getEngine().getBlobSegmentSize());
				byte[] segment = this.blob.getBytes(this.position + 1, segmentLength);

				System.arraycopy(segment, 0, bytes, offset, segment.length);
				this.position += segment.length;

				return segment.length;
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		public long length() throws EngineException {
			try {
				return this.blob.length();
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}

		@Override
		public void close() {
			// A finished blob becomes bindable by id
			if (this.writable)
				this.transaction.registerBlob(this.id, this.blob);
		}

		@Override
		public void cancel() throws EngineException {
			try {
				this.blob.free();
			} catch (SQLException e) {
				throw toEngineException(e);
			}
		}
	}
}
