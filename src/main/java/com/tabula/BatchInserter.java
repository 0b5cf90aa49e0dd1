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

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Savepoint;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Writes the rows of a {@link Table} with one parameterized {@code INSERT} per batch.
 * <p>
 * Each batch is its own unit of work: it is committed when auto-commit is on, and rolled back on failure.  With
 * auto-commit off, a failing batch rolls back only to the savepoint taken when it started.  Cell values
 * are always bound, never spliced into SQL.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class BatchInserter {
	@NonNull
	private final Database database;
	@NonNull
	private final Logger logger;

	@NonNull
	private DatabaseOperationSupportStatus executeLargeBatchSupported;

	BatchInserter(@NonNull Database database) {
		requireNonNull(database);

		this.database = database;
		this.logger = Logger.getLogger(BatchInserter.class.getName());
		this.executeLargeBatchSupported = DatabaseOperationSupportStatus.UNKNOWN;
	}

	/**
	 * Inserts every row of {@code table} into {@code qualifiedName}, which must already exist.
	 *
	 * @param table         the rows to insert
	 * @param qualifiedName the destination table
	 * @param columnTypes   the type of each column, in column order
	 * @param batchSize     maximum number of rows per batch
	 * @throws InsertException if a batch fails; batches before it stay committed when auto-commit is on
	 */
	void insert(@NonNull Table table,
							@NonNull QualifiedName qualifiedName,
							@NonNull List<@NonNull ColumnType> columnTypes,
							int batchSize) {
		requireNonNull(table);
		requireNonNull(qualifiedName);
		requireNonNull(columnTypes);

		if (batchSize < 1)
			throw new IllegalArgumentException(format("Batch size must be positive, but was %d", batchSize));

		if (columnTypes.size() != table.getColumnCount())
			throw new IllegalArgumentException(format("Expected %d column types but got %d", table.getColumnCount(), columnTypes.size()));

		int rowCount = table.getRowCount();

		if (rowCount == 0)
			return;

		String sql = insertSql(table, qualifiedName);
		int batchCount = (rowCount + batchSize - 1) / batchSize;
		Object callId = getDatabase().generateCallId();

		logger.fine(format("Inserting %d row[s] into %s in %d batch[es]", rowCount, qualifiedName, batchCount));

		for (int batchIndex = 1; batchIndex <= batchCount; ++batchIndex) {
			int fromRow = (batchIndex - 1) * batchSize;
			int toRow = Math.min(fromRow + batchSize, rowCount);
			Statement statement = Statement.of(callId, batchIndex, batchCount, sql);
			Savepoint savepoint;

			try {
				savepoint = getDatabase().beginUnitOfWork();
			} catch (DatabaseException e) {
				throw e instanceof ConnectionException ? e : new InsertException(qualifiedName, batchIndex, e);
			}

			try {
				performBatch(statement, qualifiedName, table, columnTypes, fromRow, toRow);

				try {
					getDatabase().completeUnitOfWork(savepoint);
				} catch (DatabaseException e) {
					throw new InsertException(qualifiedName, batchIndex, e);
				}
			} catch (RuntimeException e) {
				getDatabase().rollbackAfterFailure(e, savepoint);
				throw e;
			}
		}
	}

	@NonNull
	String insertSql(@NonNull Table table,
									 @NonNull QualifiedName qualifiedName) {
		requireNonNull(table);
		requireNonNull(qualifiedName);

		IdentifierEscaper identifierEscaper = getDatabase().getIdentifierEscaper();
		List<String> columnNames = new ArrayList<>(table.getColumnCount());
		List<String> placeholders = new ArrayList<>(table.getColumnCount());

		for (String columnName : table.getColumnNames()) {
			columnNames.add(identifierEscaper.escape(columnName));
			placeholders.add("?");
		}

		return format("INSERT INTO %s (%s) VALUES (%s)", qualifiedName.toSql(identifierEscaper),
				String.join(", ", columnNames), String.join(", ", placeholders));
	}

	protected void performBatch(@NonNull Statement statement,
															@NonNull QualifiedName qualifiedName,
															@NonNull Table table,
															@NonNull List<@NonNull ColumnType> columnTypes,
															int fromRow,
															int toRow) {
		requireNonNull(statement);
		requireNonNull(qualifiedName);
		requireNonNull(table);
		requireNonNull(columnTypes);

		long startTime = nanoTime();
		Duration connectionAcquisitionDuration = null;
		Duration executionDuration = null;
		RuntimeException thrown = null;

		try {
			boolean alreadyOpen = getDatabase().getManagedConnection().isOpen();
			Connection connection = getDatabase().getManagedConnection().getConnection();
			connectionAcquisitionDuration = alreadyOpen ? null : Duration.ofNanos(nanoTime() - startTime);

			try (PreparedStatement preparedStatement = connection.prepareStatement(statement.getSql())) {
				PreparedStatementBinder preparedStatementBinder = getDatabase().getPreparedStatementBinder();

				for (int row = fromRow; row < toRow; ++row) {
					for (int column = 0; column < table.getColumnCount(); ++column)
						preparedStatementBinder.bindParameter(preparedStatement, column + 1, table.getColumn(column).get(row), columnTypes.get(column));

					preparedStatement.addBatch();
				}

				startTime = nanoTime();
				executeBatch(preparedStatement);
				executionDuration = Duration.ofNanos(nanoTime() - startTime);
			}
		} catch (SQLException e) {
			thrown = new InsertException(qualifiedName, statement.getIndex(), e);
			throw thrown;
		} catch (InsertException | ConnectionException e) {
			thrown = e;
			throw e;
		} catch (RuntimeException e) {
			thrown = new InsertException(qualifiedName, statement.getIndex(), e);
			throw thrown;
		} finally {
			getDatabase().logStatement(StatementLog.withStatement(statement)
					.parameters(table.getRow(fromRow))
					.connectionAcquisitionDuration(connectionAcquisitionDuration)
					.executionDuration(executionDuration)
					.batchSize(toRow - fromRow)
					.exception(thrown)
					.build(), thrown);
		}
	}

	protected void executeBatch(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		// Use the "large" variant if we know the driver has it, and find out if we don't know yet
		switch (getExecuteLargeBatchSupported()) {
			case YES:
				preparedStatement.executeLargeBatch();
				return;
			case NO:
				preparedStatement.executeBatch();
				return;
			default:
				try {
					preparedStatement.executeLargeBatch();
					setExecuteLargeBatchSupported(DatabaseOperationSupportStatus.YES);
				} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
					setExecuteLargeBatchSupported(DatabaseOperationSupportStatus.NO);
					preparedStatement.executeBatch();
				}
		}
	}

	@NonNull
	Database getDatabase() {
		return this.database;
	}

	@NonNull
	DatabaseOperationSupportStatus getExecuteLargeBatchSupported() {
		return this.executeLargeBatchSupported;
	}

	void setExecuteLargeBatchSupported(@NonNull DatabaseOperationSupportStatus executeLargeBatchSupported) {
		requireNonNull(executeLargeBatchSupported);
		this.executeLargeBatchSupported = executeLargeBatchSupported;
	}

	enum DatabaseOperationSupportStatus {
		UNKNOWN,
		YES,
		NO
	}
}
