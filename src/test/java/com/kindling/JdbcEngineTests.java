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

import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.kindling.FutureAssertions.assertFailsWith;
import static java.lang.String.format;

/**
 * Exercises the full stack against an in-memory HSQLDB database.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class JdbcEngineTests {
	private Client client;
	private Attachment attachment;

	@BeforeEach
	public void setUp() {
		this.client = Client.withEngine(createEngine()).build();
		this.attachment = this.client.createDatabase(format("kindling_%s", UUID.randomUUID().toString().replace("-", ""))).join();
	}

	@AfterEach
	public void tearDown() {
		if (this.attachment.isValid())
			this.attachment.dropDatabase().join();

		this.client.dispose().join();
	}

	@Test
	public void testValuesRoundTrip() {
		Transaction transaction = attachment.startTransaction().join();

		attachment.execute(transaction, "CREATE TABLE EMPLOYEE (ID INTEGER PRIMARY KEY, NAME VARCHAR(100), SALARY DECIMAL(10,2), "
				+ "RATING DOUBLE, HIRED DATE, SHIFT_START TIME, LAST_LOGIN TIMESTAMP, ACTIVE BOOLEAN, BONUS DECIMAL(30,4))").join();

		attachment.execute(transaction, "INSERT INTO EMPLOYEE VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)", List.of(1, "Ada Lovelace",
				new BigDecimal("1234.56"), 4.5, LocalDate.of(1843, 7, 1), LocalTime.of(9, 30),
				LocalDateTime.of(2024, 1, 2, 3, 4, 5, 123_000_000), true, new BigDecimal("12345678901234567890.1234"))).join();

		ResultSet resultSet = attachment.executeQuery(transaction, "SELECT * FROM EMPLOYEE WHERE ID = ?", List.of(1)).join();

		Assertions.assertEquals(List.of("ID", "NAME", "SALARY", "RATING", "HIRED", "SHIFT_START", "LAST_LOGIN", "ACTIVE", "BONUS"),
				resultSet.getColumnLabels());

		List<Row> rows = resultSet.fetch().join();
		resultSet.close().join();

		Assertions.assertEquals(1, rows.size());

		Row row = rows.get(0);

		Assertions.assertEquals(1L, row.getObject(0));
		Assertions.assertEquals("Ada Lovelace", row.getObject(1));
		Assertions.assertEquals(new BigDecimal("1234.56"), row.getObject(2));
		Assertions.assertEquals(4.5, row.getObject(3));
		Assertions.assertEquals(LocalDate.of(1843, 7, 1), row.getObject(4));
		Assertions.assertEquals(LocalTime.of(9, 30), row.getObject(5));
		Assertions.assertEquals(LocalDateTime.of(2024, 1, 2, 3, 4, 5, 123_000_000), row.getObject(6));
		Assertions.assertEquals(Boolean.TRUE, row.getObject(7));
		Assertions.assertEquals(new BigDecimal("12345678901234567890.1234"), row.getObject(8));

		transaction.commit().join();
	}

	@Test
	public void testMultiByteTextAndPreciseValuesRoundTrip() {
		Transaction transaction = attachment.startTransaction().join();

		attachment.execute(transaction, "CREATE TABLE LEDGER (ID INTEGER, MEMO VARCHAR(50), ADJUSTMENT DECIMAL(10,2), "
				+ "BALANCE DECIMAL(15,4), POSTED_AT TIME(3))").join();

		String memo = "ção 中文 😀";

		attachment.execute(transaction, "INSERT INTO LEDGER VALUES (?, ?, ?, ?, ?)", List.of(1, memo, new BigDecimal("-1234.56"),
				new BigDecimal("12345678901.2345"), LocalTime.of(10, 11, 12, 345_000_000))).join();

		Row row = attachment.executeReturning(transaction, "SELECT MEMO, ADJUSTMENT, BALANCE, POSTED_AT FROM LEDGER WHERE ID = ?",
				List.of(1)).join();

		Assertions.assertEquals(memo, row.getObject(0));
		Assertions.assertEquals(new BigDecimal("-1234.56"), row.getObject(1));
		Assertions.assertEquals(new BigDecimal("12345678901.2345"), row.getObject(2));
		Assertions.assertEquals(LocalTime.of(10, 11, 12, 345_000_000), row.getObject(3));

		transaction.commit().join();
	}

	@Test
	public void testNullsRoundTrip() {
		Transaction transaction = attachment.startTransaction().join();

		attachment.execute(transaction, "CREATE TABLE NOTE (ID INTEGER, BODY VARCHAR(20), WRITTEN DATE)").join();
		attachment.execute(transaction, "INSERT INTO NOTE VALUES (?, ?, ?)", Arrays.asList(1, null, null)).join();

		Map<String, Object> note = attachment.executeReturningAsObject(transaction, "SELECT * FROM NOTE").join();

		Assertions.assertEquals(1L, note.get("ID"));
		Assertions.assertTrue(note.containsKey("BODY"));
		Assertions.assertNull(note.get("BODY"));
		Assertions.assertNull(note.get("WRITTEN"));

		transaction.commit().join();
	}

	@Test
	public void testLargeBlob() {
		Transaction transaction = attachment.startTransaction().join();
		byte[] content = new byte[180_000];

		for (int i = 0; i < content.length; ++i)
			content[i] = (byte) (i % 251);

		attachment.execute(transaction, "CREATE TABLE DOCUMENT (ID INTEGER, CONTENT BLOB(1M))").join();
		attachment.execute(transaction, "INSERT INTO DOCUMENT VALUES (?, ?)", List.of(1, content)).join();

		Row row = attachment.executeReturning(transaction, "SELECT CONTENT FROM DOCUMENT WHERE ID = ?", List.of(1)).join();
		Assertions.assertEquals(Value.Kind.BLOB, row.get(0).getKind());

		Blob blob = attachment.openBlob(transaction, (BlobId) row.getObject(0)).join();
		Assertions.assertEquals(180_000L, blob.length().join());

		ByteArrayOutputStream readContent = new ByteArrayOutputStream();
		byte[] buffer = new byte[100_000];
		int reads = 0;
		int read;

		while ((read = blob.read(buffer).join()) != -1) {
			readContent.write(buffer, 0, read);
			++reads;
		}

		blob.close().join();

		Assertions.assertTrue(reads >= 3, "Reads should be capped at the segment size");
		Assertions.assertArrayEquals(content, readContent.toByteArray());

		Blob secondReader = attachment.openBlob(transaction, (BlobId) row.getObject(0)).join();
		Assertions.assertArrayEquals(content, secondReader.readAll().join());
		secondReader.close().join();

		transaction.commit().join();
	}

	@Test
	public void testFetchedBlobsAreReleasedWithTheirTransaction() {
		Transaction setup = attachment.startTransaction().join();
		attachment.execute(setup, "CREATE TABLE DOCUMENT (ID INTEGER, CONTENT VARBINARY(100))").join();

		for (int i = 0; i < 10; ++i)
			attachment.execute(setup, "INSERT INTO DOCUMENT VALUES (?, ?)", List.of(i, new byte[]{(byte) i})).join();

		setup.commit().join();

		Transaction transaction = attachment.startTransaction().join();
		JdbcEngine.JdbcTransaction jdbcTransaction = (JdbcEngine.JdbcTransaction) transaction.getEngineTransaction();

		ResultSet resultSet = attachment.executeQuery(transaction, "SELECT CONTENT FROM DOCUMENT").join();
		List<Row> rows = resultSet.fetch().join();
		resultSet.close().join();

		Assertions.assertEquals(10, rows.size());
		Assertions.assertEquals(10, jdbcTransaction.getBlobCount());

		transaction.commit().join();

		Assertions.assertEquals(0, jdbcTransaction.getBlobCount(), "Ending the transaction should drop its blobs");

		Transaction later = attachment.startTransaction().join();
		assertFailsWith(DatabaseException.class, attachment.openBlob(later, (BlobId) rows.get(0).getObject(0)));
		later.rollback().join();
	}

	@Test
	public void testWrittenBlobCanBeBound() {
		Transaction transaction = attachment.startTransaction().join();

		attachment.execute(transaction, "CREATE TABLE DOCUMENT (ID INTEGER, CONTENT BLOB(1M))").join();

		Blob blob = attachment.createBlob(transaction).join();
		blob.write("first ".getBytes()).join();
		blob.write("second".getBytes()).join();
		blob.close().join();

		attachment.execute(transaction, "INSERT INTO DOCUMENT VALUES (?, ?)", List.of(1, blob)).join();

		BlobId blobId = (BlobId) attachment.executeReturning(transaction, "SELECT CONTENT FROM DOCUMENT").join().getObject(0);
		Blob reader = attachment.openBlob(transaction, blobId).join();

		Assertions.assertEquals("first second", new String(reader.readAll().join()));

		reader.close().join();
		transaction.commit().join();
	}

	@Test
	public void testFetchSizes() {
		Transaction transaction = attachment.startTransaction().join();

		attachment.execute(transaction, "CREATE TABLE NUMBERS (N INTEGER)").join();

		Statement insert = attachment.prepare(transaction, "INSERT INTO NUMBERS (N) VALUES (?)").join();
		Assertions.assertEquals(1, insert.getParameterCount());

		for (int i = 0; i < 50; ++i)
			insert.execute(transaction, List.of(i)).join();

		insert.dispose().join();

		ResultSet resultSet = attachment.executeQuery(transaction, "SELECT N FROM NUMBERS ORDER BY N").join();
		List<Row> rows = new ArrayList<>();

		for (int fetchSize : new int[]{5, 2, 5, 36}) {
			List<Row> batch = resultSet.fetch(FetchOptions.withFetchSize(fetchSize)).join();
			Assertions.assertEquals(fetchSize, batch.size());
			rows.addAll(batch);
		}

		List<Row> remainder = resultSet.fetch().join();
		Assertions.assertEquals(2, remainder.size());
		rows.addAll(remainder);

		Assertions.assertEquals(0, resultSet.fetch().join().size());
		resultSet.close().join();

		for (int i = 0; i < rows.size(); ++i)
			Assertions.assertEquals((long) i, rows.get(i).getObject(0));

		transaction.commit().join();
	}

	@Test
	public void testRetainingCommit() {
		Transaction transaction = attachment.startTransaction().join();

		attachment.execute(transaction, "CREATE TABLE COUNTER (C INTEGER)").join();
		attachment.execute(transaction, "INSERT INTO COUNTER VALUES (?)", List.of(1)).join();
		transaction.commitRetaining().join();

		Assertions.assertEquals(1L, transaction.getGeneration());

		Row row = attachment.executeReturning(transaction, "SELECT C FROM COUNTER").join();
		Assertions.assertEquals(1L, row.getObject(0), "Retained transaction should remain usable");

		transaction.commit().join();

		assertFailsWith(DisposedResourceException.class, attachment.executeReturning(transaction, "SELECT C FROM COUNTER"));
	}

	@Test
	public void testPreparedStatementSurvivesRetainingCommit() {
		Transaction transaction = attachment.startTransaction().join();
		attachment.execute(transaction, "CREATE TABLE COUNTER (C INTEGER)").join();

		Statement insert = attachment.prepare(transaction, "INSERT INTO COUNTER VALUES (?)").join();

		insert.execute(transaction, List.of(1)).join();
		transaction.commitRetaining().join();
		insert.execute(transaction, List.of(2)).join();

		ResultSet resultSet = attachment.executeQuery(transaction, "SELECT C FROM COUNTER ORDER BY C").join();
		List<Row> rows = resultSet.fetch().join();
		resultSet.close().join();

		Assertions.assertEquals(2, rows.size());
		Assertions.assertEquals(1L, rows.get(0).getObject(0));
		Assertions.assertEquals(2L, rows.get(1).getObject(0));

		transaction.commit().join();

		assertFailsWith(DisposedResourceException.class, insert.execute(transaction, List.of(3)));

		insert.dispose().join();
	}

	@Test
	public void testRollbackDiscardsWork() {
		Transaction setup = attachment.startTransaction().join();
		attachment.execute(setup, "CREATE TABLE COUNTER (C INTEGER)").join();
		setup.commit().join();

		Transaction transaction = attachment.startTransaction().join();
		attachment.execute(transaction, "INSERT INTO COUNTER VALUES (?)", List.of(1)).join();
		transaction.rollback().join();

		Long count = attachment.executeTransaction(verification ->
				attachment.executeReturning(verification, "SELECT COUNT(*) FROM COUNTER").thenApply(result -> (Long) result.getObject(0))).join();

		Assertions.assertEquals(0L, count);
	}

	@Test
	public void testExecuteReturning() {
		Transaction transaction = attachment.startTransaction().join();

		Row row = attachment.executeReturning(transaction, "SELECT 11 AS N1, 11 * 2 AS N2 FROM (VALUES (0)) AS T(X)").join();
		Assertions.assertEquals(List.of(11L, 22L), row.toList());

		Map<String, Object> object = attachment.executeReturningAsObject(transaction, "SELECT 11 AS N1, 11 * 2 AS N2 FROM (VALUES (0)) AS T(X)").join();
		Assertions.assertEquals(Map.of("N1", 11L, "N2", 22L), object);

		Statement statement = attachment.prepare(transaction, "SELECT 11 AS N1, 11 * 2 AS N2 FROM (VALUES (0)) AS T(X)").join();
		Assertions.assertEquals(List.of("N1", "N2"), statement.getColumnLabels());
		Assertions.assertEquals(SqlType.INTEGER, statement.getColumns().get(0).getType());
		statement.dispose().join();

		RuntimeQueryException e = assertFailsWith(RuntimeQueryException.class,
				attachment.executeReturning(transaction, "SELECT X FROM (VALUES (1), (2)) AS T(X)"));
		Assertions.assertEquals(Optional.of(JdbcEngine.MULTIPLE_ROWS_ERROR_CODE), e.getErrorCode());

		transaction.commit().join();
	}

	@Test
	public void testSyntaxError() {
		Transaction transaction = attachment.startTransaction().join();

		SyntaxException e = assertFailsWith(SyntaxException.class, attachment.prepare(transaction, "SELEC 1 FROM (VALUES (0)) AS T(X)"));

		Assertions.assertTrue(e.getErrorCode().isPresent(), "Driver error code should be carried along");
		Assertions.assertTrue(e.getSqlState().isPresent(), "Driver SQL state should be carried along");
		Assertions.assertTrue(transaction.isActive(), "A rejected statement should not end the transaction");

		transaction.rollback().join();
	}

	@Test
	public void testReadOnlyTransaction() {
		Transaction setup = attachment.startTransaction().join();
		attachment.execute(setup, "CREATE TABLE COUNTER (C INTEGER)").join();
		setup.commit().join();

		Transaction transaction = attachment.startTransaction(TransactionOptions.withIsolation(TransactionIsolation.CONSISTENCY)
				.accessMode(AccessMode.READ_ONLY)
				.build()).join();

		DatabaseException e = assertFailsWith(DatabaseException.class, attachment.execute(transaction, "INSERT INTO COUNTER VALUES (?)", List.of(1)));
		Assertions.assertTrue(e.getSqlState().isPresent(), "Driver SQL state should be carried along");

		transaction.rollback().join();
	}

	@Test
	public void testConnectToMissingDatabase() {
		assertFailsWith(ConnectionException.class, client.connect(format("missing_%s", UUID.randomUUID().toString().replace("-", ""))));
	}

	@Test
	public void testEventsAreUnsupported() {
		assertFailsWith(DatabaseException.class, attachment.queueEvents(Set.of("EMPLOYEE_HIRED"), (counts) -> {}));
		Assertions.assertTrue(attachment.isValid(), "Failed subscription should not affect the attachment");
	}

	@Test
	public void testSecondAttachmentSeesCommittedData() {
		Transaction transaction = attachment.startTransaction().join();
		attachment.execute(transaction, "CREATE TABLE COUNTER (C INTEGER)").join();
		attachment.execute(transaction, "INSERT INTO COUNTER VALUES (?)", List.of(42)).join();
		transaction.commit().join();

		Attachment second = client.connect(attachment.getLocator()).join();

		Long value = second.executeTransaction(readTransaction ->
				second.executeReturning(readTransaction, "SELECT C FROM COUNTER").thenApply(row -> (Long) row.getObject(0))).join();

		Assertions.assertEquals(42L, value);

		second.disconnect().join();
	}

	@NonNull
	private JdbcEngine createEngine() {
		return JdbcEngine.withDataSourceFactory((locator, username, password, create) -> {
					JDBCDataSource dataSource = new JDBCDataSource();
					dataSource.setUrl(format("jdbc:hsqldb:mem:%s%s", locator, create ? "" : ";ifexists=true"));
					dataSource.setUser(username == null ? "sa" : username);
					dataSource.setPassword(password == null ? "" : password);

					return dataSource;
				})
				.dropDatabaseSql("SHUTDOWN")
				.build();
	}
}
