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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.kindling.FutureAssertions.assertFailsWith;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class ClientTests {
	@Test
	public void testCreateAndConnect() {
		ScriptedEngine engine = new ScriptedEngine();
		Client client = Client.withEngine(engine).build();

		Attachment created = client.createDatabase("employees.fdb").join();
		Attachment connected = client.connect(DatabaseLocator.withPath("employees.fdb").build(), ConnectOptions.empty()).join();

		Assertions.assertEquals("employees.fdb", connected.getLocator());
		Assertions.assertEquals(2, client.getAttachments().size(), "Both attachments should be tracked");

		created.disconnect().join();
		Assertions.assertFalse(created.isValid());
		Assertions.assertEquals(1, client.getAttachments().size(), "Disconnected attachment should no longer be tracked");

		connected.disconnect().join();
		client.dispose().join();
	}

	@Test
	public void testConnectToMissingDatabase() {
		ScriptedEngine engine = new ScriptedEngine();
		Client client = Client.withEngine(engine).build();

		ConnectionException e = assertFailsWith(ConnectionException.class, client.connect("missing.fdb"));

		Assertions.assertEquals(Optional.of(ScriptedEngine.UNAVAILABLE_DATABASE_ERROR_CODE), e.getErrorCode());
		Assertions.assertTrue(e.getMessage().contains("missing.fdb"), "Engine diagnostics should be preserved");
		Assertions.assertEquals(0, client.getAttachments().size());

		client.dispose().join();
	}

	@Test
	public void testDisposeInvalidatesEverythingAndIsIdempotent() {
		ScriptedEngine engine = new ScriptedEngine();
		Client client = Client.withEngine(engine).build();
		Attachment attachment = client.createDatabase("dispose.fdb").join();
		Transaction transaction = attachment.startTransaction().join();

		client.dispose().join();

		Assertions.assertFalse(client.isValid());
		Assertions.assertFalse(attachment.isValid());
		Assertions.assertFalse(transaction.isActive());
		Assertions.assertEquals(1, engine.getRollbackCount(), "Open transaction should have been rolled back");
		Assertions.assertEquals(1, engine.getDisconnectCount());
		Assertions.assertEquals(1, engine.getDisposeCount());

		client.dispose().join();

		Assertions.assertEquals(1, engine.getDisposeCount(), "Second dispose should be a no-op");
		assertFailsWith(DisposedResourceException.class, client.connect("dispose.fdb"));
		assertFailsWith(DisposedResourceException.class, transaction.commit());
	}

	@Test
	public void testCallerSuppliedExecutorIsNotShutDown() {
		ExecutorService executorService = Executors.newFixedThreadPool(2);

		try {
			Client client = Client.withEngine(new ScriptedEngine()).executorService(executorService).build();
			client.createDatabase("executor.fdb").join();
			client.dispose().join();

			Assertions.assertFalse(executorService.isShutdown(), "Caller-supplied executor belongs to the caller");
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void testConcurrentOperationsOnOneTransactionAreRejected() {
		ScriptedEngine engine = new ScriptedEngine();
		CountDownLatch executionLatch = new CountDownLatch(1);
		ScriptedEngine.Script script = engine.script("UPDATE EMPLOYEE SET SALARY = SALARY * 2").blockExecutionUntil(executionLatch);

		Client client = Client.withEngine(engine).build();
		Attachment attachment = client.createDatabase("guard.fdb").join();
		Transaction transaction = attachment.startTransaction().join();

		CompletableFuture<Void> first = attachment.execute(transaction, "UPDATE EMPLOYEE SET SALARY = SALARY * 2");
		ConcurrentOperationException e = assertFailsWith(ConcurrentOperationException.class,
				attachment.execute(transaction, "UPDATE EMPLOYEE SET SALARY = SALARY * 2"));

		Assertions.assertTrue(e.getMessage().contains("one at a time"));

		// Other transactions of the same attachment are unaffected
		Transaction other = attachment.startTransaction().join();
		Assertions.assertTrue(other.isActive());

		executionLatch.countDown();
		first.join();

		attachment.execute(transaction, "UPDATE EMPLOYEE SET SALARY = SALARY * 2").join();
		Assertions.assertEquals(2, script.getExecutedParameters().size(), "Rejected operation should never have reached the engine");

		client.dispose().join();
	}

	@Test
	public void testClosingCompetesForTheTransaction() {
		ScriptedEngine engine = new ScriptedEngine();
		CountDownLatch executionLatch = new CountDownLatch(1);
		engine.script("SELECT ID FROM EMPLOYEE").columns(ColumnDescriptor.withType(SqlType.INTEGER).label("ID").build()).row(1L);
		engine.script("UPDATE EMPLOYEE SET SALARY = SALARY * 2").blockExecutionUntil(executionLatch);

		Client client = Client.withEngine(engine).build();
		Attachment attachment = client.createDatabase("closing.fdb").join();
		Transaction transaction = attachment.startTransaction().join();

		ResultSet resultSet = attachment.executeQuery(transaction, "SELECT ID FROM EMPLOYEE").join();
		Blob blob = attachment.createBlob(transaction).join();

		CompletableFuture<Void> update = attachment.execute(transaction, "UPDATE EMPLOYEE SET SALARY = SALARY * 2");

		assertFailsWith(ConcurrentOperationException.class, resultSet.close());
		assertFailsWith(ConcurrentOperationException.class, blob.close());
		assertFailsWith(ConcurrentOperationException.class, blob.cancel());
		Assertions.assertFalse(resultSet.isClosed());
		Assertions.assertFalse(blob.isClosed());

		executionLatch.countDown();
		update.join();

		resultSet.close().join();
		blob.close().join();

		Assertions.assertTrue(resultSet.isClosed());
		Assertions.assertTrue(blob.isClosed());

		client.dispose().join();
	}

	@Test
	public void testStatementLoggerFailureIsSuppressed() {
		ScriptedEngine engine = new ScriptedEngine();
		engine.script("SELECT 1 FROM RDB$DATABASE").columns(ColumnDescriptor.withType(SqlType.INTEGER).label("CONSTANT").build()).row(1L);

		RuntimeException loggerFailure = new RuntimeException("logger failed");
		Client client = Client.withEngine(engine)
				.statementLogger((statementLog) -> {
					throw loggerFailure;
				})
				.build();

		Attachment attachment = client.createDatabase("logger.fdb").join();
		Transaction transaction = attachment.startTransaction().join();

		SyntaxException e = assertFailsWith(SyntaxException.class, attachment.prepare(transaction, "SELEC 1 FROM RDB$DATABASE"));

		Assertions.assertEquals("Dynamic SQL Error\nSQL error code = -104\nToken unknown - line 1, column 1\nSELEC", e.getMessage(),
				"Engine message should be preserved verbatim");
		Assertions.assertEquals(Optional.of(ScriptedEngine.SYNTAX_ERROR_CODE), e.getErrorCode());
		Assertions.assertTrue(Arrays.stream(e.getSuppressed()).anyMatch(suppressed -> suppressed == loggerFailure),
				"Expected statement logger failure to be suppressed");

		// A logger failure never fails an otherwise successful operation
		Row row = attachment.executeReturning(transaction, "SELECT 1 FROM RDB$DATABASE").join();
		Assertions.assertEquals(1L, row.getObject(0));

		client.dispose().join();
	}

	@Test
	public void testStatementLogsDescribeEachStep() {
		ScriptedEngine engine = new ScriptedEngine();
		engine.script("SELECT NAME FROM EMPLOYEE WHERE DEPT = ?")
				.parameters(ColumnDescriptor.withType(SqlType.INTEGER).build())
				.columns(ColumnDescriptor.withType(SqlType.VARCHAR).label("NAME").build())
				.row("Ada")
				.row("Grace");

		List<StatementLog> statementLogs = Collections.synchronizedList(new ArrayList<>());
		Client client = Client.withEngine(engine).statementLogger(statementLogs::add).build();
		Attachment attachment = client.createDatabase("logs.fdb").join();
		Transaction transaction = attachment.startTransaction().join();

		ResultSet resultSet = attachment.executeQuery(transaction, "SELECT NAME FROM EMPLOYEE WHERE DEPT = ?", List.of(42)).join();
		Assertions.assertEquals(2, resultSet.fetch().join().size());
		resultSet.close().join();

		Assertions.assertEquals(List.of(StatementContext.Operation.PREPARE, StatementContext.Operation.EXECUTE_QUERY,
				StatementContext.Operation.FETCH), statementLogs.stream().map(statementLog -> statementLog.getStatementContext().getOperation()).toList());

		StatementLog executionLog = statementLogs.get(1);
		Assertions.assertEquals(List.of(42), executionLog.getStatementContext().getParameters());
		Assertions.assertTrue(executionLog.getExecutionDuration().isPresent());
		Assertions.assertEquals(Optional.of(2), statementLogs.get(2).getRowCount());

		String formatted = new DefaultStatementLogger().formatStatementLog(executionLog);
		Assertions.assertTrue(formatted.startsWith("[EXECUTE_QUERY] SELECT NAME FROM EMPLOYEE WHERE DEPT = ?"), formatted);
		Assertions.assertTrue(formatted.contains("Parameters: 42"), formatted);

		client.dispose().join();
	}

	@Test
	public void testDefaultStatementLoggerParameterFormatting() {
		DefaultStatementLogger statementLogger = new DefaultStatementLogger();

		Assertions.assertEquals("null", statementLogger.formatParameter(null));
		Assertions.assertEquals("[byte array of length 3]", statementLogger.formatParameter(new byte[3]));
		Assertions.assertEquals("'" + "x".repeat(100) + "...'", statementLogger.formatParameter("x".repeat(150)));
		Assertions.assertEquals("'Ada'", statementLogger.formatParameter(Value.ofText("Ada")));
	}
}
