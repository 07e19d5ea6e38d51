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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.kindling.FutureAssertions.assertFailsWith;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ResultSetTests {
	private static final String SELECT_EMPLOYEES = "SELECT ID, NAME FROM EMPLOYEE ORDER BY ID";

	private ScriptedEngine engine;
	private Client client;
	private Attachment attachment;
	private Transaction transaction;

	@BeforeEach
	public void setUp() {
		this.engine = new ScriptedEngine();
		this.client = Client.withEngine(this.engine).build();
		this.attachment = this.client.createDatabase("result-sets.fdb").join();
		this.transaction = this.attachment.startTransaction().join();
	}

	@AfterEach
	public void tearDown() {
		this.client.dispose().join();
	}

	@Test
	public void testFetchSizes() {
		scriptEmployees(50);

		ResultSet resultSet = attachment.executeQuery(transaction, SELECT_EMPLOYEES).join();
		List<Row> rows = new ArrayList<>();

		rows.addAll(assertFetchCount(5, resultSet.fetch(FetchOptions.withFetchSize(5)).join()));
		rows.addAll(assertFetchCount(2, resultSet.fetch(FetchOptions.withFetchSize(2)).join()));
		rows.addAll(assertFetchCount(5, resultSet.fetch(FetchOptions.withFetchSize(5)).join()));
		rows.addAll(assertFetchCount(36, resultSet.fetch(FetchOptions.withFetchSize(36)).join()));
		rows.addAll(assertFetchCount(2, resultSet.fetch().join()));
		assertFetchCount(0, resultSet.fetch().join());

		for (int i = 0; i < rows.size(); ++i)
			Assertions.assertEquals((long) i, rows.get(i).getObject(0), "Rows should arrive in cursor order");

		resultSet.close().join();
	}

	@Test
	public void testFetchSizeDefaults() {
		scriptEmployees(10);
		attachment.setDefaultFetchOptions(FetchOptions.withFetchSize(4));

		ResultSet resultSet = attachment.executeQuery(transaction, SELECT_EMPLOYEES).join();

		assertFetchCount(4, resultSet.fetch().join());

		resultSet.setDefaultFetchOptions(FetchOptions.withFetchSize(3));
		assertFetchCount(3, resultSet.fetch().join());
		assertFetchCount(1, resultSet.fetch(FetchOptions.withFetchSize(1)).join());
		assertFetchCount(2, resultSet.fetch().join());

		Assertions.assertThrows(IllegalArgumentException.class, () -> FetchOptions.withFetchSize(0));

		resultSet.close().join();
	}

	@Test
	public void testFailureMidBatchIsDeferred() {
		scriptEmployees(10).failAtRow(5, "arithmetic exception, numeric overflow, or string truncation", -802);

		ResultSet resultSet = attachment.executeQuery(transaction, SELECT_EMPLOYEES).join();

		assertFetchCount(3, resultSet.fetch(FetchOptions.withFetchSize(3)).join());
		assertFetchCount(2, resultSet.fetch(FetchOptions.withFetchSize(10)).join());

		RuntimeQueryException e = assertFailsWith(RuntimeQueryException.class, resultSet.fetch());
		Assertions.assertEquals(Optional.of(-802), e.getErrorCode());

		assertFetchCount(0, resultSet.fetch().join());

		resultSet.close().join();
	}

	@Test
	public void testFailureOnFirstRowIsImmediate() {
		scriptEmployees(10).failAtRow(0, "lock conflict on no wait transaction", -901);

		ResultSet resultSet = attachment.executeQuery(transaction, SELECT_EMPLOYEES).join();

		assertFailsWith(RuntimeQueryException.class, resultSet.fetch());
		assertFetchCount(0, resultSet.fetch().join());

		resultSet.close().join();
	}

	@Test
	public void testFetchAsObjectAndColumnLabels() {
		engine.script("SELECT ID, NAME AS LABEL, TITLE AS LABEL FROM EMPLOYEE")
				.columns(ColumnDescriptor.withType(SqlType.INTEGER).label("ID").build(),
						ColumnDescriptor.withType(SqlType.VARCHAR).label("LABEL").build(),
						ColumnDescriptor.withType(SqlType.VARCHAR).label("LABEL").build())
				.row(1L, "Ada", "Engineer");

		ResultSet resultSet = attachment.executeQuery(transaction, "SELECT ID, NAME AS LABEL, TITLE AS LABEL FROM EMPLOYEE").join();

		Assertions.assertEquals(List.of("ID", "LABEL", "LABEL"), resultSet.getColumnLabels());

		List<Map<String, Object>> objects = resultSet.fetchAsObject().join();

		Assertions.assertEquals(1, objects.size());
		Assertions.assertEquals(List.of("ID", "LABEL"), new ArrayList<>(objects.get(0).keySet()), "Keys should follow column order");
		Assertions.assertEquals("Engineer", objects.get(0).get("LABEL"), "Later duplicate label should win");

		resultSet.close().join();
	}

	@Test
	public void testCloseReleasesOwnedStatementAndIsIdempotent() {
		scriptEmployees(3);

		ResultSet resultSet = attachment.executeQuery(transaction, SELECT_EMPLOYEES).join();
		resultSet.close().join();
		resultSet.close().join();

		Assertions.assertTrue(resultSet.isClosed());
		Assertions.assertEquals(1, engine.getClosedCursorCount());
		Assertions.assertEquals(1, engine.getFreedStatementCount(), "Statement owned by the result set should be freed with it");
		assertFailsWith(DisposedResourceException.class, resultSet.fetch());
	}

	@Test
	public void testPreparedStatementOutlivesItsResultSets() {
		scriptEmployees(3);

		Statement statement = attachment.prepare(transaction, SELECT_EMPLOYEES).join();

		for (int i = 0; i < 2; ++i) {
			ResultSet resultSet = statement.executeQuery(transaction).join();
			assertFetchCount(3, resultSet.fetch().join());
			resultSet.close().join();
		}

		Assertions.assertFalse(statement.isDisposed());
		Assertions.assertEquals(0, engine.getFreedStatementCount());

		statement.dispose().join();
		statement.dispose().join();

		Assertions.assertTrue(statement.isDisposed());
		Assertions.assertEquals(1, engine.getFreedStatementCount());
		assertFailsWith(DisposedResourceException.class, statement.executeQuery(transaction));
	}

	@Test
	public void testParameterArityIsChecked() {
		engine.script("SELECT NAME FROM EMPLOYEE WHERE ID = ?")
				.parameters(ColumnDescriptor.withType(SqlType.INTEGER).build())
				.columns(ColumnDescriptor.withType(SqlType.VARCHAR).label("NAME").build());

		ParameterException e = assertFailsWith(ParameterException.class,
				attachment.executeQuery(transaction, "SELECT NAME FROM EMPLOYEE WHERE ID = ?", List.of(1, 2)));

		Assertions.assertEquals("Statement expects 1 parameter[s] but 2 were provided", e.getMessage());
		Assertions.assertEquals(1, engine.getFreedStatementCount(), "Temporary statement should be freed on failure");
	}

	private ScriptedEngine.@NonNull Script scriptEmployees(int count) {
		ScriptedEngine.Script script = engine.script(SELECT_EMPLOYEES)
				.columns(ColumnDescriptor.withType(SqlType.INTEGER).label("ID").build(),
						ColumnDescriptor.withType(SqlType.VARCHAR).label("NAME").build());

		for (long i = 0; i < count; ++i)
			script.row(i, "Employee " + i);

		return script;
	}

	@NonNull
	private List<Row> assertFetchCount(int expectedCount,
																		 @NonNull List<Row> rows) {
		Assertions.assertEquals(expectedCount, rows.size(), "Wrong number of rows fetched");
		return rows;
	}
}
