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

package com.tabula;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

public class DatabaseTests {
	@Test
	public void testLastStatementResultIsReturned() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("last_result").build()) {
			Table table = database.query("CREATE TABLE car (id INTEGER, color VARCHAR(32));"
					+ "INSERT INTO car VALUES (1, 'red');"
					+ "INSERT INTO car VALUES (2, 'blue');"
					+ "SELECT id, color FROM car ORDER BY id").orElseThrow();

			Assertions.assertEquals(Table.withColumnNames("id", "color")
					.row(1, "red")
					.row(2, "blue")
					.build(), table);
		}
	}

	@Test
	public void testOnlyLastStatementResultIsKept() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("only_last").build()) {
			Table table = database.query("SELECT 1 AS a; SELECT 2 AS b").orElseThrow();

			Assertions.assertEquals(List.of("b"), table.getColumnNames());
			Assertions.assertEquals(1, table.getRowCount());
			Assertions.assertEquals(2, table.getValue(0, "b"));
		}
	}

	@Test
	public void testNoResultWhenLastStatementProducesNoRows() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("no_result").build()) {
			Optional<Table> result = database.query("CREATE TABLE t (id INTEGER); SELECT * FROM t; INSERT INTO t VALUES (1)");

			Assertions.assertTrue(result.isEmpty(), "Expected no result when last statement is an INSERT");
			Assertions.assertEquals(1, database.query("SELECT * FROM t").orElseThrow().getRowCount());
		}
	}

	@Test
	public void testEmptyResultSetIsStillAResult() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("empty_result").build()) {
			database.query("CREATE TABLE t (id INTEGER, name VARCHAR(10))");

			Table table = database.query("SELECT id, name FROM t").orElseThrow();

			Assertions.assertEquals(List.of("id", "name"), table.getColumnNames());
			Assertions.assertTrue(table.isEmpty());
		}
	}

	@Test
	public void testBlankSqlNeverTouchesTheConnection() {
		AtomicInteger connectionCount = new AtomicInteger();
		String jdbcUrl = InMemoryDatabases.jdbcUrl("blank");

		try (Database database = Database.withConfiguration(DatabaseConfiguration.withJdbcUrl(jdbcUrl).build())
				.connectionFactory((configuration) -> {
					connectionCount.incrementAndGet();
					return InMemoryDatabases.createInMemoryDataSource(jdbcUrl).getConnection();
				})
				.build()) {
			Assertions.assertTrue(database.query("").isEmpty());
			Assertions.assertTrue(database.query("  ;\n ; ").isEmpty());
			Assertions.assertEquals(0, connectionCount.get());
		}
	}

	@Test
	public void testFailedCallIsRolledBackInFull() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("atomic").build()) {
			database.query("CREATE TABLE account (id INTEGER PRIMARY KEY, balance INTEGER)");
			database.query("INSERT INTO account VALUES (1, 100)");

			QueryException exception = Assertions.assertThrows(QueryException.class, () ->
					database.query("UPDATE account SET balance = 0 WHERE id = 1;"
							+ "INSERT INTO account VALUES (2, 50);"
							+ "INSERT INTO missing_table VALUES (3);"
							+ "INSERT INTO account VALUES (4, 75)"));

			Assertions.assertEquals(3, exception.getStatementIndex());
			Assertions.assertEquals(4, exception.getStatementCount());
			Assertions.assertEquals("INSERT INTO missing_table VALUES (3)", exception.getStatement());
			Assertions.assertTrue(exception.getCause() instanceof SQLException);
			Assertions.assertTrue(exception.getSqlState().isPresent());

			Table accounts = database.query("SELECT id, balance FROM account ORDER BY id").orElseThrow();
			Assertions.assertEquals(Table.withColumnNames("id", "balance").row(1, 100).build(), accounts);
		}
	}

	@Test
	public void testSingleStatementFailureIndex() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("single_failure").build()) {
			QueryException exception = Assertions.assertThrows(QueryException.class, () -> database.query("SELECT * FROM nope"));

			Assertions.assertEquals(1, exception.getStatementIndex());
			Assertions.assertEquals(1, exception.getStatementCount());

			// The instance stays usable after a failure
			Assertions.assertEquals(1, database.query("SELECT 1 AS one").orElseThrow().getValue(0, "one"));
		}
	}

	@Test
	public void testManualCommitAndRollbackWhenAutoCommitIsOff() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("manual").build()) {
			database.query("CREATE TABLE event (id INTEGER)");
			database.setAutoCommit(false);

			Assertions.assertFalse(database.isAutoCommit());

			database.query("INSERT INTO event VALUES (1)");
			database.rollback();
			Assertions.assertEquals(0, countRows(database, "event"));

			database.query("INSERT INTO event VALUES (2)");
			database.commit();
			database.rollback();
			Assertions.assertEquals(1, countRows(database, "event"));
		}
	}

	@Test
	public void testFailedCallKeepsEarlierUncommittedWorkWhenAutoCommitIsOff() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("manual_failure").build()) {
			database.query("CREATE TABLE event (id INTEGER)");
			database.setAutoCommit(false);

			database.query("INSERT INTO event VALUES (1)");

			QueryException exception = Assertions.assertThrows(QueryException.class, () ->
					database.query("INSERT INTO event VALUES (2); INSERT INTO missing_table VALUES (3)"));

			Assertions.assertEquals(2, exception.getStatementIndex());
			Assertions.assertEquals(1, countRows(database, "event"), "Only the failed call's own work should be undone");

			database.commit();
			database.setAutoCommit(true);

			Assertions.assertEquals(List.of(1), database.query("SELECT id FROM event").orElseThrow().getColumn("id").orElseThrow().getValues());
		}
	}

	@Test
	public void testRollbackStillDiscardsEverythingPendingAfterAFailedCall() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("manual_failure_rollback").build()) {
			database.query("CREATE TABLE event (id INTEGER)");
			database.setAutoCommit(false);

			database.query("INSERT INTO event VALUES (1)");
			Assertions.assertThrows(QueryException.class, () -> database.query("SELECT * FROM missing_table"));
			database.rollback();

			Assertions.assertEquals(0, countRows(database, "event"));
		}
	}

	@Test
	public void testUncommittedWorkIsNotVisibleToOtherConnections() {
		String jdbcUrl = InMemoryDatabases.jdbcUrl("visibility");
		DatabaseConfiguration configuration = DatabaseConfiguration.withJdbcUrl(jdbcUrl).user("sa").password("").build();

		try (Database writer = Database.withConfiguration(configuration).autoCommit(false).build();
				 Database reader = Database.withConfiguration(configuration).build()) {
			writer.query("CREATE TABLE event (id INTEGER)");
			writer.query("INSERT INTO event VALUES (1)");

			Assertions.assertEquals(0, countRows(reader, "event"));

			writer.commit();

			Assertions.assertEquals(1, countRows(reader, "event"));
		}
	}

	@Test
	public void testCloseIsIdempotentAndInstanceReopens() {
		Database database = InMemoryDatabases.createInMemoryDatabase("reopen").build();

		database.query("CREATE TABLE t (id INTEGER); INSERT INTO t VALUES (1)");
		database.close();
		database.close();

		Assertions.assertEquals(1, countRows(database, "t"));
		database.close();
	}

	@Test
	public void testCloseCommitsWhenAutoCommitIsOn() {
		String jdbcUrl = InMemoryDatabases.jdbcUrl("close_commit");
		DatabaseConfiguration configuration = DatabaseConfiguration.withJdbcUrl(jdbcUrl).user("sa").password("").build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			database.query("CREATE TABLE t (id INTEGER)");
			database.setAutoCommit(false);
			database.query("INSERT INTO t VALUES (1)");
			database.setAutoCommit(true);
		}

		try (Database database = Database.withConfiguration(configuration).build()) {
			Assertions.assertEquals(1, countRows(database, "t"));
		}
	}

	@Test
	public void testConnectionFailure() {
		DatabaseConfiguration configuration = DatabaseConfiguration.withHost("unreachable.invalid")
				.databaseName("db")
				.user("etl")
				.password("s3cret")
				.build();

		try (Database database = Database.withConfiguration(configuration)
				.connectionFactory((ignored) -> {
					throw new SQLException("Connection refused", "08001");
				})
				.build()) {
			ConnectionException exception = Assertions.assertThrows(ConnectionException.class, () -> database.query("SELECT 1"));

			Assertions.assertEquals("jdbc:postgresql://unreachable.invalid:5432/db", exception.getTarget());
			Assertions.assertEquals("08001", exception.getSqlState().orElse(null));
			Assertions.assertFalse(exception.getMessage().contains("s3cret"));
		}
	}

	@Test
	public void testConnectionIsReopenedWhenClosedUnderneath() throws SQLException {
		AtomicInteger connectionCount = new AtomicInteger();
		Connection[] lastConnection = new Connection[1];
		String jdbcUrl = InMemoryDatabases.jdbcUrl("reconnect");

		try (Database database = Database.withConfiguration(DatabaseConfiguration.withJdbcUrl(jdbcUrl).build())
				.connectionFactory((configuration) -> {
					connectionCount.incrementAndGet();
					lastConnection[0] = InMemoryDatabases.createInMemoryDataSource(jdbcUrl).getConnection();
					return lastConnection[0];
				})
				.build()) {
			database.query("SELECT 1");
			Assertions.assertFalse(lastConnection[0].getAutoCommit(), "JDBC auto-commit should be switched off");

			lastConnection[0].close();
			database.query("SELECT 1");

			Assertions.assertEquals(2, connectionCount.get());
		}
	}

	@Test
	public void testDefaultConnectionFactory() {
		DatabaseConfiguration configuration = DatabaseConfiguration.withJdbcUrl(InMemoryDatabases.jdbcUrl("driver_manager"))
				.user("sa")
				.password("")
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			Assertions.assertEquals(42, database.query("SELECT 42 AS answer").orElseThrow().getValue(0, "answer"));
		}
	}

	@Test
	public void testSchemaOperations() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("schemas").build()) {
			Assertions.assertFalse(database.schemaExists("analytics"));

			database.createSchema("analytics");
			database.createSchema("analytics");
			database.createSchema("select");

			Assertions.assertTrue(database.schemaExists("analytics"));
			Assertions.assertTrue(database.schemaExists("select"));

			List<Object> schemaNames = database.listSchemas().getColumn("schema_name").orElseThrow().getValues();
			Assertions.assertEquals(List.of("analytics", "public", "select"), schemaNames);

			database.query("CREATE TABLE analytics.event (id INTEGER)");

			Assertions.assertThrows(QueryException.class, () -> database.dropSchema("analytics"),
					"Dropping a non-empty schema without cascade should fail");

			database.dropSchema("analytics", true);
			database.dropSchema("analytics", true);

			Assertions.assertFalse(database.schemaExists("analytics"));
		}
	}

	@Test
	public void testSchemaNamesAreUsedExactlyAsGiven() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("schema_whitespace").build()) {
			database.createSchema(" hr");

			Assertions.assertTrue(database.schemaExists(" hr"));
			Assertions.assertFalse(database.schemaExists("hr"));

			database.dropSchema(" hr");

			Assertions.assertFalse(database.schemaExists(" hr"));
			Assertions.assertThrows(InvalidIdentifierException.class, () -> database.createSchema("  "));
			Assertions.assertThrows(InvalidIdentifierException.class, () -> database.dropSchema(""));
		}
	}

	@Test
	public void testTableCatalog() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("catalog").build()) {
			database.query("CREATE TABLE zebra (id INTEGER NOT NULL, label VARCHAR(40) DEFAULT 'none');"
					+ "CREATE TABLE apple (id INTEGER);"
					+ "CREATE SCHEMA other; CREATE TABLE other.pear (id INTEGER)");

			Table tables = database.listTables();
			Assertions.assertEquals(List.of("table_name", "table_type"), tables.getColumnNames());
			Assertions.assertEquals(List.of("apple", "zebra"), tables.getColumn("table_name").orElseThrow().getValues());
			Assertions.assertEquals(List.of("pear"), database.listTables("other").getColumn("table_name").orElseThrow().getValues());

			Assertions.assertTrue(database.tableExists("zebra"));
			Assertions.assertTrue(database.tableExists("public.zebra"));
			Assertions.assertTrue(database.tableExists("pear", "other"));
			Assertions.assertFalse(database.tableExists("pear"));

			Table description = database.describeTable("zebra");
			Assertions.assertEquals(List.of("column_name", "data_type", "is_nullable", "column_default", "character_maximum_length"),
					description.getColumnNames());
			Assertions.assertEquals(List.of("id", "label"), description.getColumn("column_name").orElseThrow().getValues());
			Assertions.assertEquals("NO", description.getValue(0, "is_nullable"));
			Assertions.assertEquals("YES", description.getValue(1, "is_nullable"));
			Assertions.assertEquals(40, ((Number) description.getValue(1, "character_maximum_length")).intValue());
			Assertions.assertEquals(description, database.describeTable("zebra", "public"));

			Assertions.assertTrue(database.describeTable("missing").isEmpty());
		}
	}

	@Test
	public void testCatalogLookupsBindNames() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("catalog_binding").build()) {
			Assertions.assertFalse(database.tableExists("x' OR '1'='1", "public"));
			Assertions.assertFalse(database.schemaExists("public' OR 'a'='a"));
		}
	}

	private int countRows(Database database, String table) {
		return ((Number) database.query("SELECT COUNT(*) AS total FROM " + table).orElseThrow().getValue(0, "total")).intValue();
	}
}
