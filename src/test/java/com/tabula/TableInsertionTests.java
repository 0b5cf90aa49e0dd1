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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

public class TableInsertionTests {
	enum Status {
		ACTIVE,
		SUSPENDED
	}

	@Test
	public void testRoundTripPreservesValues() {
		String longText = "lorem ipsum ".repeat(40);
		LocalDateTime createdAt = LocalDateTime.of(2024, 3, 15, 9, 30, 15);

		Table people = Table.withColumnNames("id", "name", "score", "active", "created_at", "status", "notes", "big")
				.row(1, "O'Brien", 1.5, true, createdAt, Status.ACTIVE, longText, 5_000_000_000L)
				.row(2, "say \"hi\"", null, false, null, Status.SUSPENDED, "line one\nline two", null)
				.row(3, null, -2.25, null, createdAt.plusDays(1), null, null, -1L)
				.row(4, "Zoë ✓ 日本", 0.0, true, createdAt, Status.ACTIVE, "", 0L)
				.build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("round_trip").build()) {
			database.insertTable(people, "people");

			Table result = database.query("SELECT * FROM people ORDER BY id").orElseThrow();

			Assertions.assertEquals(people.getColumnNames(), result.getColumnNames());
			Assertions.assertEquals(4, result.getRowCount());

			for (String columnName : List.of("id", "name", "score", "active", "created_at", "notes", "big"))
				Assertions.assertEquals(people.getColumn(columnName).orElseThrow().getValues(),
						result.getColumn(columnName).orElseThrow().getValues(), columnName);

			Assertions.assertEquals(Arrays.asList("ACTIVE", "SUSPENDED", null, "ACTIVE"),
					result.getColumn("status").orElseThrow().getValues(), "Enums should be stored by name");
		}
	}

	@Test
	public void testTimestampWithTimeZoneRoundTrip() {
		OffsetDateTime happenedAt = OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.ofHours(-5));

		Table table = Table.withColumnNames("id", "happened_at")
				.row(1, happenedAt)
				.row(2, null)
				.build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("timestamptz").build()) {
			database.insertTable(table, "occurrence");

			Table result = database.query("SELECT happened_at FROM occurrence ORDER BY id").orElseThrow();
			Object value = result.getValue(0, "happened_at");

			Assertions.assertTrue(value instanceof OffsetDateTime, String.valueOf(value));
			Assertions.assertEquals(happenedAt.toInstant(), ((OffsetDateTime) value).toInstant());
			Assertions.assertNull(result.getValue(1, "happened_at"));
		}
	}

	@Test
	public void testZonedValuesAndDeclaredTypes() {
		Instant instant = Instant.parse("2024-01-01T00:00:00Z");
		ZonedDateTime zonedDateTime = ZonedDateTime.of(2024, 1, 1, 9, 0, 0, 0, ZoneId.of("Asia/Tokyo"));

		Table table = Table.of(
				Column.of("happened_at", instant, zonedDateTime),
				Column.of("legacy", new Date(0L), null),
				Column.of("quantity", Integer.class, Arrays.asList(null, null)));

		try (Database database = InMemoryDatabases.createInMemoryDatabase("zoned").build()) {
			database.insertTable(table, "zoned");

			Table result = database.query("SELECT * FROM zoned ORDER BY legacy NULLS LAST").orElseThrow();

			for (int i = 0; i < 2; ++i)
				Assertions.assertEquals(instant, ((OffsetDateTime) result.getValue(i, "happened_at")).toInstant());

			Assertions.assertTrue(result.getValue(0, "legacy") instanceof LocalDateTime);
			Assertions.assertEquals(Arrays.asList(null, null), result.getColumn("quantity").orElseThrow().getValues());
			Assertions.assertEquals("integer", database.describeTable("zoned").getValue(2, "data_type").toString().toLowerCase(Locale.ENGLISH));
		}
	}

	@Test
	public void testReservedAndSpecialNames() {
		Table table = Table.withColumnNames("select", "from", "user name", "weird\"quote", "semi;colon")
				.row(1, "a", "b", "c", "d")
				.row(2, "e", "f", "g", "h")
				.build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("special_names").build()) {
			database.insertTable(table, "\"my schema\".\"select\"");

			Assertions.assertTrue(database.schemaExists("my schema"));
			Assertions.assertTrue(database.tableExists("select", "my schema"));

			Table result = database.query("SELECT * FROM \"my schema\".\"select\" ORDER BY \"select\"").orElseThrow();

			Assertions.assertEquals(table, result);
		}
	}

	@Test
	public void testHostileTableNameIsNotExecuted() {
		Table table = Table.withColumnNames("id").row(1).build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("hostile").build()) {
			database.query("CREATE TABLE victim (id INTEGER); INSERT INTO victim VALUES (1)");
			database.insertTable(table, "\"x; DROP TABLE victim; --\"");

			Assertions.assertTrue(database.tableExists("victim"));
			Assertions.assertTrue(database.tableExists("x; DROP TABLE victim; --", "public"));
		}
	}

	@Test
	public void testSchemaIsCreatedOnDemand() {
		Table table = Table.withColumnNames("id").row(1).build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("schema_on_demand").build()) {
			Assertions.assertFalse(database.schemaExists("analytics"));

			database.insertTable(table, "analytics.events");

			Assertions.assertTrue(database.schemaExists("analytics"));
			Assertions.assertEquals(List.of("events"), database.listTables("analytics").getColumn("table_name").orElseThrow().getValues());
			Assertions.assertEquals(List.of("id"), database.describeTable("analytics.events").getColumn("column_name").orElseThrow().getValues());
		}
	}

	@Test
	public void testExistingTableIsTruncatedByDefault() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("truncate").build()) {
			database.insertTable(Table.withColumnNames("id").row(1).row(2).row(3).build(), "numbers");
			database.insertTable(Table.withColumnNames("id").row(10).row(20).build(), "numbers");

			Table result = database.query("SELECT id FROM numbers ORDER BY id").orElseThrow();

			Assertions.assertEquals(List.of(10, 20), result.getColumn("id").orElseThrow().getValues());
		}
	}

	@Test
	public void testOverwriteRecreatesTable() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("overwrite").build()) {
			database.insertTable(Table.withColumnNames("id", "amount").row(1, 10).build(), "ledger");
			database.insertTable(Table.withColumnNames("label").row("fresh").build(), "ledger", true);

			Assertions.assertEquals(List.of("label"), database.describeTable("ledger").getColumn("column_name").orElseThrow().getValues());
			Assertions.assertEquals(Table.withColumnNames("label").row("fresh").build(),
					database.query("SELECT * FROM ledger").orElseThrow());
		}
	}

	@Test
	public void testFailPolicyLeavesExistingTableUntouched() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("fail_policy")
				.existingTablePolicy(ExistingTablePolicy.FAIL)
				.build()) {
			database.insertTable(Table.withColumnNames("id").row(1).row(2).build(), "kept");

			TableAlreadyExistsException exception = Assertions.assertThrows(TableAlreadyExistsException.class,
					() -> database.insertTable(Table.withColumnNames("id").row(3).build(), "kept"));

			Assertions.assertEquals(QualifiedName.of("public", "kept"), exception.getQualifiedName());
			Assertions.assertEquals(List.of(1, 2), database.query("SELECT id FROM kept ORDER BY id").orElseThrow()
					.getColumn("id").orElseThrow().getValues());

			// Overwrite still applies under the fail policy
			database.insertTable(Table.withColumnNames("id").row(3).build(), "kept", true);
			Assertions.assertEquals(List.of(3), database.query("SELECT id FROM kept").orElseThrow().getColumn("id").orElseThrow().getValues());
		}
	}

	@Test
	public void testEmptyTableIsNoOp() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("empty_insert").build()) {
			database.insertTable(Table.withColumnNames("id", "name").build(), "nothing.here");

			Assertions.assertFalse(database.schemaExists("nothing"));
			Assertions.assertFalse(database.tableExists("here", "nothing"));
		}
	}

	@Test
	public void testRowsAreInsertedInBatches() {
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();
		List<Object> ids = new ArrayList<>();
		List<Object> labels = new ArrayList<>();

		for (int i = 0; i < 2500; ++i) {
			ids.add(i);
			labels.add("row " + i);
		}

		Table table = Table.of(Column.of("id", ids), Column.of("label", labels));

		try (Database database = InMemoryDatabases.createInMemoryDatabase("batches")
				.statementLogger(statementLogs::add)
				.build()) {
			database.insertTable(table, "bulk", false, 1000);

			List<Integer> batchSizes = new ArrayList<>();

			for (StatementLog statementLog : statementLogs)
				statementLog.getBatchSize().ifPresent(batchSizes::add);

			Assertions.assertEquals(List.of(1000, 1000, 500), batchSizes);

			Table result = database.query("SELECT id, label FROM bulk ORDER BY id").orElseThrow();

			Assertions.assertEquals(2500, result.getRowCount());

			for (int i : List.of(0, 999, 1000, 1999, 2000, 2499)) {
				Assertions.assertEquals(i, result.getValue(i, "id"));
				Assertions.assertEquals("row " + i, result.getValue(i, "label"));
			}
		}
	}

	@Test
	public void testConfiguredBatchSizeIsDefault() {
		List<Integer> batchSizes = new CopyOnWriteArrayList<>();
		Table table = Table.withColumnNames("id").row(1).row(2).row(3).row(4).row(5).build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("configured_batches")
				.batchSize(2)
				.statementLogger(statementLog -> statementLog.getBatchSize().ifPresent(batchSizes::add))
				.build()) {
			database.insertTable(table, "five");

			Assertions.assertEquals(List.of(2, 2, 1), batchSizes);
			Assertions.assertEquals(2, database.getBatchSize());
		}
	}

	@Test
	public void testFailingBatchKeepsEarlierBatches() {
		List<Object> ids = new ArrayList<>();

		for (int i = 0; i < 2500; ++i)
			ids.add(i);

		try (Database database = InMemoryDatabases.createInMemoryDatabase("failing_batch").build()) {
			database.query("CREATE TABLE limited (id INTEGER CHECK (id < 1500))");

			InsertException exception = Assertions.assertThrows(InsertException.class,
					() -> database.insertTable(Table.of(Column.of("id", ids)), "limited", false, 1000));

			Assertions.assertEquals(2, exception.getBatchIndex());
			Assertions.assertEquals(QualifiedName.of("public", "limited"), exception.getQualifiedName());
			Assertions.assertEquals(1000L, ((Number) database.query("SELECT COUNT(*) AS total FROM limited")
					.orElseThrow().getValue(0, "total")).longValue());
		}
	}

	@Test
	public void testSchemaWithSurroundingWhitespaceIsCreatedAsGiven() {
		Table table = Table.withColumnNames("id").row(1).row(2).build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("schema_whitespace_insert").build()) {
			database.insertTable(table, "\" hr\".events");
			database.insertTable(table, "\" hr\".events");

			Assertions.assertTrue(database.schemaExists(" hr"));
			Assertions.assertFalse(database.schemaExists("hr"));
			Assertions.assertTrue(database.tableExists("events", " hr"));
			Assertions.assertEquals(2, countRows(database, "\" hr\".events"));
		}
	}

	@Test
	public void testFailingBatchKeepsEarlierUncommittedBatchesWhenAutoCommitIsOff() {
		List<Object> ids = new ArrayList<>();

		for (int i = 0; i < 2500; ++i)
			ids.add(i);

		try (Database database = InMemoryDatabases.createInMemoryDatabase("failing_batch_manual").build()) {
			database.query("CREATE TABLE limited (id INTEGER CHECK (id < 1500))");
			database.setAutoCommit(false);

			InsertException exception = Assertions.assertThrows(InsertException.class,
					() -> database.insertTable(Table.of(Column.of("id", ids)), "limited", false, 1000));

			Assertions.assertEquals(2, exception.getBatchIndex());

			database.commit();
			database.setAutoCommit(true);

			Assertions.assertEquals(1000, countRows(database, "limited"));
		}
	}

	@Test
	public void testBinderFailureCarriesBatchIndex() {
		List<Object> ids = new ArrayList<>();

		for (int i = 0; i < 2500; ++i)
			ids.add(i);

		PreparedStatementBinder defaultBinder = PreparedStatementBinder.withDefaultConfiguration();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("binder_failure")
				.preparedStatementBinder((preparedStatement, parameterIndex, parameter, columnType) -> {
					if (Integer.valueOf(1500).equals(parameter))
						throw new IllegalArgumentException("Cannot bind 1500");

					defaultBinder.bindParameter(preparedStatement, parameterIndex, parameter, columnType);
				})
				.build()) {
			InsertException exception = Assertions.assertThrows(InsertException.class,
					() -> database.insertTable(Table.of(Column.of("id", ids)), "numbers", false, 1000));

			Assertions.assertEquals(2, exception.getBatchIndex());
			Assertions.assertEquals(QualifiedName.of("public", "numbers"), exception.getQualifiedName());
			Assertions.assertTrue(exception.getCause() instanceof IllegalArgumentException);
			Assertions.assertEquals(1000, countRows(database, "numbers"));
		}
	}

	@Test
	public void testUnquotedMixedCaseNameIsFoldedOnCreation() {
		Table table = Table.withColumnNames("id").row(1).build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("case_folding").build()) {
			database.insertTable(table, "Events");

			Assertions.assertTrue(database.tableExists("events"));
			Assertions.assertFalse(database.tableExists("Events"));
			Assertions.assertThrows(QueryException.class, () -> database.insertTable(table, "Events"));
			Assertions.assertThrows(QueryException.class, () -> database.insertTable(table, "\"Events\""));

			database.insertTable(table, "events");

			Assertions.assertEquals(1, countRows(database, "events"));
		}
	}

	@Test
	public void testArgumentValidation() {
		try (Database database = InMemoryDatabases.createInMemoryDatabase("validation").build()) {
			Table duplicateColumns = Table.of(Column.of("id", 1), Column.of("id", 2));
			Table table = Table.withColumnNames("id").row(1).build();

			Assertions.assertThrows(IllegalArgumentException.class, () -> database.insertTable(duplicateColumns, "dupes"));
			Assertions.assertThrows(IllegalArgumentException.class, () -> database.insertTable(table, "t", false, 0));
			Assertions.assertThrows(InvalidIdentifierException.class, () -> database.insertTable(table, "a.b.c"));
			Assertions.assertFalse(database.tableExists("dupes"));
		}
	}

	@Test
	public void testCustomReservedWords() {
		Table table = Table.withColumnNames("user", "order").row("alice", 1).build();

		try (Database database = InMemoryDatabases.createInMemoryDatabase("custom_reserved")
				.identifierEscaper(IdentifierEscaper.withAdditionalReservedWords(List.of("user", "order")))
				.build()) {
			database.insertTable(table, "purchase");

			Assertions.assertEquals(table, database.query("SELECT \"user\", \"order\" FROM purchase").orElseThrow());
		}
	}

	private int countRows(Database database, String table) {
		return ((Number) database.query("SELECT COUNT(*) AS total FROM " + table).orElseThrow().getValue(0, "total")).intValue();
	}
}
