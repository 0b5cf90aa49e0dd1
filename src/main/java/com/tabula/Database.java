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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Main class for running SQL and moving {@link Table}s in and out of a database.
 * <p>
 * An instance owns exactly one connection, opened on first use.  JDBC auto-commit is always off on that connection;
 * instead, when this instance's own auto-commit toggle is on (the default) every successful operation is committed
 * and every failed one rolled back in full.  With the toggle off, work accumulates in one open transaction until
 * {@link #commit()} or {@link #rollback()}.
 * <pre>{@code  try (Database database = Database.withConfiguration(configuration).build()) {
 *   database.insertTable(table, "analytics.events");
 *   Optional<Table> counts = database.query("SELECT kind, COUNT(*) AS total FROM analytics.events GROUP BY kind");
 * }}</pre>
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class Database implements AutoCloseable {
	/**
	 * Rows per insert batch unless configured otherwise.
	 */
	public static final int DEFAULT_BATCH_SIZE = 1000;

	@NonNull
	private static final AtomicLong CALL_ID_GENERATOR;

	static {
		CALL_ID_GENERATOR = new AtomicLong(0);
	}

	@NonNull
	private final DatabaseConfiguration configuration;
	@NonNull
	private final ManagedConnection managedConnection;
	@NonNull
	private final Integer batchSize;
	@NonNull
	private final ExistingTablePolicy existingTablePolicy;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@NonNull
	private final ResultSetMapper resultSetMapper;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final IdentifierEscaper identifierEscaper;
	@NonNull
	private final ColumnTypeInferrer columnTypeInferrer;
	@NonNull
	private final TableProvisioner tableProvisioner;
	@NonNull
	private final BatchInserter batchInserter;
	@NonNull
	private final Logger logger;

	@NonNull
	private Boolean autoCommit;

	protected Database(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.batchSize < 1)
			throw new IllegalArgumentException(format("Batch size must be positive, but was %d", builder.batchSize));

		this.configuration = requireNonNull(builder.configuration);
		this.managedConnection = new ManagedConnection(builder.connectionFactory == null ? new DefaultConnectionFactory() : builder.connectionFactory, this.configuration);
		this.autoCommit = builder.autoCommit;
		this.batchSize = builder.batchSize;
		this.existingTablePolicy = builder.existingTablePolicy;
		this.preparedStatementBinder = builder.preparedStatementBinder == null ? PreparedStatementBinder.withDefaultConfiguration() : builder.preparedStatementBinder;
		this.resultSetMapper = builder.resultSetMapper == null ? ResultSetMapper.withDefaultConfiguration() : builder.resultSetMapper;
		this.statementLogger = builder.statementLogger == null ? StatementLogger.noop() : builder.statementLogger;
		this.identifierEscaper = builder.identifierEscaper == null ? IdentifierEscaper.defaultInstance() : builder.identifierEscaper;
		this.columnTypeInferrer = builder.columnTypeInferrer == null ? new ColumnTypeInferrer() : builder.columnTypeInferrer;
		this.tableProvisioner = new TableProvisioner(this);
		this.batchInserter = new BatchInserter(this);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Provides a {@link Database} builder for the given {@link DatabaseConfiguration}.
	 *
	 * @param configuration where and as whom to connect
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withConfiguration(@NonNull DatabaseConfiguration configuration) {
		requireNonNull(configuration);
		return new Builder(configuration);
	}

	/**
	 * Executes one or more {@code ;}-separated SQL statements as a single transaction.
	 * <p>
	 * Statements run in order on this instance's connection.  If any of them fails, everything the call did is rolled
	 * back and a {@link QueryException} identifying the failing statement is thrown.  Otherwise the call is committed if
	 * auto-commit is on.  With auto-commit off, a failing call rolls back to a savepoint taken when it started, so work
	 * from earlier calls stays pending until {@link #commit()} or {@link #rollback()}.
	 * <p>
	 * Splitting is purely lexical: a {@code ;} inside a string literal, comment or function body also ends a statement.
	 *
	 * @param sql the SQL to execute
	 * @return the rows produced by the last statement, or empty if the last statement produced no rows (or {@code sql}
	 * held no statements at all, in which case nothing is sent to the database)
	 * @throws QueryException      if a statement fails
	 * @throws ConnectionException if no connection could be opened
	 */
	@NonNull
	public Optional<Table> query(@NonNull String sql) {
		requireNonNull(sql);

		List<String> statementSqls = StatementSplitter.split(sql);

		return queryStatements(statementSqls);
	}

	/**
	 * Runs statements that are already separated as one call, with the same transaction semantics as
	 * {@link #query(String)}.  Generated SQL goes through here so that a {@code ;} inside a quoted identifier is not
	 * mistaken for a separator.
	 */
	@NonNull
	Optional<Table> queryStatements(@NonNull List<@NonNull String> statementSqls) {
		requireNonNull(statementSqls);

		if (statementSqls.size() == 0) {
			logger.finer("No statements to execute");
			return Optional.empty();
		}

		Object callId = generateCallId();
		List<Statement> statements = new ArrayList<>(statementSqls.size());

		for (int i = 0; i < statementSqls.size(); ++i)
			statements.add(Statement.of(callId, i + 1, statementSqls.size(), statementSqls.get(i)));

		return executeStatements(statements, List.of());
	}

	/**
	 * Writes {@code table} to the table named {@code name}, creating its schema and the table as needed.  If the table
	 * already exists, the configured {@link ExistingTablePolicy} applies.
	 *
	 * @param table the rows to write
	 * @param name  {@code table} or {@code schema.table}, either part optionally double-quoted; the schema defaults to
	 *              {@value QualifiedName#DEFAULT_SCHEMA}
	 * @see #insertTable(Table, String, Boolean, Integer)
	 */
	public void insertTable(@NonNull Table table,
													@NonNull String name) {
		insertTable(table, name, false);
	}

	/**
	 * Writes {@code table} to the table named {@code name}, dropping and recreating it first when {@code overwrite} is
	 * set and it already exists.
	 *
	 * @param table     the rows to write
	 * @param name      {@code table} or {@code schema.table}
	 * @param overwrite whether an existing table is dropped and recreated from {@code table}'s columns
	 * @see #insertTable(Table, String, Boolean, Integer)
	 */
	public void insertTable(@NonNull Table table,
													@NonNull String name,
													@NonNull Boolean overwrite) {
		insertTable(table, name, overwrite, getBatchSize());
	}

	/**
	 * Writes {@code table} to the table named {@code name}.
	 * <p>
	 * Column types are inferred from {@code table} (see {@link ColumnTypeInferrer}).  A table with no rows is a no-op:
	 * nothing is created and nothing is inserted.  Rows go out in parameterized batches of at most {@code batchSize};
	 * each batch is committed on its own when auto-commit is on, so a failing batch leaves the batches before it in
	 * place.
	 * <p>
	 * Names are used exactly as given, but a name that is a plain identifier goes into the DDL unquoted (see
	 * {@link IdentifierEscaper}), and PostgreSQL folds unquoted identifiers to lower case, while the existence check
	 * compares the given text literally.  A mixed-case name such as {@code Events} (quoted or not) therefore creates
	 * {@code events}, is not found on the next call, and the second {@code CREATE TABLE} fails with a
	 * {@link QueryException}.  Use lower-case table and schema names.
	 *
	 * @param table     the rows to write
	 * @param name      {@code table} or {@code schema.table}
	 * @param overwrite whether an existing table is dropped and recreated from {@code table}'s columns
	 * @param batchSize maximum number of rows per batch
	 * @throws InvalidIdentifierException   if {@code name} cannot be parsed
	 * @throws TableAlreadyExistsException  if the table exists, {@code overwrite} is off and the policy is
	 *                                      {@link ExistingTablePolicy#FAIL}
	 * @throws QueryException               if provisioning the schema or table fails
	 * @throws InsertException              if a batch fails
	 * @throws IllegalArgumentException     if {@code batchSize} is not positive or column names repeat
	 */
	public void insertTable(@NonNull Table table,
													@NonNull String name,
													@NonNull Boolean overwrite,
													@NonNull Integer batchSize) {
		requireNonNull(table);
		requireNonNull(name);
		requireNonNull(overwrite);
		requireNonNull(batchSize);

		if (batchSize < 1)
			throw new IllegalArgumentException(format("Batch size must be positive, but was %d", batchSize));

		QualifiedName qualifiedName = QualifiedName.parse(name);

		if (table.getRowCount() == 0) {
			logger.fine(format("No rows to insert into %s, skipping", qualifiedName));
			return;
		}

		Set<String> columnNames = new HashSet<>();

		for (String columnName : table.getColumnNames())
			if (!columnNames.add(columnName))
				throw new IllegalArgumentException(format("Column name '%s' appears more than once in %s", columnName, table.getColumnNames()));

		List<ColumnType> columnTypes = new ArrayList<>(getTableProvisioner().ensureTable(table, qualifiedName, overwrite).values());
		getBatchInserter().insert(table, qualifiedName, columnTypes, batchSize);
	}

	/**
	 * Lists user schemas, leaving out {@code information_schema} and the {@code pg_*} system schemas.
	 *
	 * @return a table with a single {@code schema_name} column, ordered by name
	 */
	@NonNull
	public Table listSchemas() {
		return queryCatalog("SELECT schema_name FROM information_schema.schemata "
				+ "WHERE schema_name NOT IN ('information_schema', 'pg_catalog', 'pg_toast') AND schema_name NOT LIKE 'pg\\_%' "
				+ "ORDER BY schema_name");
	}

	/**
	 * Creates the schema if it does not exist yet.
	 *
	 * @param name the unqualified schema name
	 */
	public void createSchema(@NonNull String name) {
		queryStatements(List.of(format("CREATE SCHEMA IF NOT EXISTS %s", escapeSchemaName(name))));
	}

	/**
	 * Drops the schema if it exists, failing if it still contains objects.
	 *
	 * @param name the unqualified schema name
	 */
	public void dropSchema(@NonNull String name) {
		dropSchema(name, false);
	}

	/**
	 * Drops the schema if it exists.
	 *
	 * @param name    the unqualified schema name
	 * @param cascade whether the schema's tables and other objects are dropped with it
	 */
	public void dropSchema(@NonNull String name,
												 @NonNull Boolean cascade) {
		requireNonNull(cascade);
		queryStatements(List.of(format("DROP SCHEMA IF EXISTS %s%s", escapeSchemaName(name), cascade ? " CASCADE" : "")));
	}

	@NonNull
	public Boolean schemaExists(@NonNull String name) {
		requireNonNull(name);
		return queryCatalog("SELECT 1 FROM information_schema.schemata WHERE schema_name = ?", name).getRowCount() > 0;
	}

	/**
	 * Lists the tables and views of the {@value QualifiedName#DEFAULT_SCHEMA} schema.
	 *
	 * @return a table with {@code table_name} and {@code table_type} columns, ordered by name
	 */
	@NonNull
	public Table listTables() {
		return listTables(QualifiedName.DEFAULT_SCHEMA);
	}

	/**
	 * Lists the tables and views of the given schema.
	 *
	 * @param schema the unqualified schema name
	 * @return a table with {@code table_name} and {@code table_type} columns, ordered by name
	 */
	@NonNull
	public Table listTables(@NonNull String schema) {
		requireNonNull(schema);
		return queryCatalog("SELECT table_name, table_type FROM information_schema.tables WHERE table_schema = ? ORDER BY table_name", schema);
	}

	/**
	 * Describes the columns of the named table.
	 *
	 * @param name {@code table} or {@code schema.table}
	 * @return a table with {@code column_name}, {@code data_type}, {@code is_nullable}, {@code column_default} and
	 * {@code character_maximum_length} columns, ordered by column position, with no rows if the table does not exist
	 */
	@NonNull
	public Table describeTable(@NonNull String name) {
		QualifiedName qualifiedName = QualifiedName.parse(name);
		return describeTable(qualifiedName.getTable(), qualifiedName.getSchema());
	}

	/**
	 * Describes the columns of {@code table} in {@code schema}.  Neither name is parsed or unquoted.
	 *
	 * @param table  the unqualified table name
	 * @param schema the unqualified schema name
	 * @return see {@link #describeTable(String)}
	 */
	@NonNull
	public Table describeTable(@NonNull String table,
														 @NonNull String schema) {
		requireNonNull(table);
		requireNonNull(schema);

		return queryCatalog("SELECT column_name, data_type, is_nullable, column_default, character_maximum_length "
				+ "FROM information_schema.columns WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position", schema, table);
	}

	/**
	 * Does the named table exist?
	 * <p>
	 * The lookup compares names literally, so a name created unquoted with upper-case letters is found only by its
	 * case-folded form.
	 *
	 * @param name {@code table} or {@code schema.table}
	 * @return {@code true} if the table exists
	 */
	@NonNull
	public Boolean tableExists(@NonNull String name) {
		QualifiedName qualifiedName = QualifiedName.parse(name);
		return tableExists(qualifiedName.getTable(), qualifiedName.getSchema());
	}

	@NonNull
	public Boolean tableExists(@NonNull String table,
														 @NonNull String schema) {
		requireNonNull(table);
		requireNonNull(schema);

		return queryCatalog("SELECT 1 FROM information_schema.tables WHERE table_schema = ? AND table_name = ?", schema, table).getRowCount() > 0;
	}

	/**
	 * Commits the open transaction, if any.  Only needed when auto-commit is off.
	 */
	public void commit() {
		getManagedConnection().commit();
	}

	/**
	 * Rolls back the open transaction, if any.  Only meaningful when auto-commit is off.
	 */
	public void rollback() {
		getManagedConnection().rollback();
	}

	@NonNull
	public Boolean isAutoCommit() {
		return this.autoCommit;
	}

	/**
	 * Turns auto-commit on or off for subsequent operations.
	 * <p>
	 * This does not touch the JDBC connection, whose own auto-commit stays off.  Work left uncommitted while auto-commit
	 * was off is committed with the next successful operation after it is turned back on.
	 *
	 * @param autoCommit whether operations commit themselves
	 */
	public void setAutoCommit(@NonNull Boolean autoCommit) {
		requireNonNull(autoCommit);
		this.autoCommit = autoCommit;
	}

	/**
	 * Commits if auto-commit is on, then closes the connection.
	 * <p>
	 * Failures are logged and never thrown.  Calling this again is harmless, and using the instance afterwards opens a
	 * new connection.
	 */
	@Override
	public void close() {
		if (isAutoCommit()) {
			try {
				getManagedConnection().commit();
			} catch (RuntimeException e) {
				logger.log(WARNING, "Unable to commit transaction while closing", e);
			}
		}

		try {
			getManagedConnection().close();
		} catch (RuntimeException e) {
			logger.log(WARNING, "Unable to close connection", e);
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{configuration=%s, autoCommit=%s, batchSize=%d, existingTablePolicy=%s}", getClass().getSimpleName(),
				getConfiguration(), isAutoCommit(), getBatchSize(), getExistingTablePolicy().name());
	}

	@NonNull
	protected Optional<Table> executeStatements(@NonNull List<Statement> statements,
																							@NonNull List<@Nullable Object> parameters) {
		requireNonNull(statements);
		requireNonNull(parameters);

		Table result = null;
		Savepoint savepoint = beginUnitOfWork();

		try {
			for (Statement statement : statements) {
				Table statementResult = performStatement(statement, parameters);

				if (statement.isLast())
					result = statementResult;
			}

			completeUnitOfWork(savepoint);
		} catch (RuntimeException e) {
			rollbackAfterFailure(e, savepoint);
			throw e;
		}

		return Optional.ofNullable(result);
	}

	/**
	 * Runs a single statement.  Only the last statement of a call has its rows read.
	 *
	 * @return the statement's rows, or {@code null} if it is not the last statement or produced no rows
	 */
	@Nullable
	protected Table performStatement(@NonNull Statement statement,
																	 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(statement);
		requireNonNull(parameters);

		long startTime = nanoTime();
		Duration connectionAcquisitionDuration = null;
		Duration executionDuration = null;
		Duration resultSetMappingDuration = null;
		RuntimeException thrown = null;
		Table result = null;

		try {
			boolean alreadyOpen = getManagedConnection().isOpen();
			Connection connection = getManagedConnection().getConnection();
			connectionAcquisitionDuration = alreadyOpen ? null : Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			try (java.sql.Statement jdbcStatement = parameters.size() == 0 ? connection.createStatement() : connection.prepareStatement(statement.getSql())) {
				boolean hasResultSet;

				if (jdbcStatement instanceof PreparedStatement preparedStatement) {
					for (int i = 0; i < parameters.size(); ++i)
						getPreparedStatementBinder().bindParameter(preparedStatement, i + 1, parameters.get(i), ColumnType.TEXT);

					hasResultSet = preparedStatement.execute();
				} else {
					hasResultSet = jdbcStatement.execute(statement.getSql());
				}

				executionDuration = Duration.ofNanos(nanoTime() - startTime);

				if (hasResultSet && statement.isLast()) {
					startTime = nanoTime();

					try (ResultSet resultSet = jdbcStatement.getResultSet()) {
						result = getResultSetMapper().map(resultSet);
					}

					resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
				}
			}
		} catch (SQLException e) {
			thrown = new QueryException(statement.getIndex(), statement.getCount(), statement.getSql(), e);
			throw thrown;
		} catch (RuntimeException e) {
			thrown = e;
			throw e;
		} finally {
			logStatement(StatementLog.withStatement(statement)
					.parameters(parameters)
					.connectionAcquisitionDuration(connectionAcquisitionDuration)
					.executionDuration(executionDuration)
					.resultSetMappingDuration(resultSetMappingDuration)
					.exception(thrown)
					.build(), thrown);
		}

		return result;
	}

	/**
	 * Hands {@code statementLog} to the statement logger.  If the statement failed, a logger failure is attached to
	 * {@code thrown}; otherwise it propagates.
	 */
	void logStatement(@NonNull StatementLog statementLog,
										@Nullable Throwable thrown) {
		requireNonNull(statementLog);

		try {
			getStatementLogger().log(statementLog);
		} catch (Throwable loggerFailure) {
			if (thrown != null)
				thrown.addSuppressed(loggerFailure);
			else if (loggerFailure instanceof RuntimeException runtimeException)
				throw runtimeException;
			else if (loggerFailure instanceof Error error)
				throw error;
			else
				throw new DatabaseException("Statement logger failed", loggerFailure);
		}
	}

	/**
	 * Starts a unit of work.  With auto-commit off the caller owns the transaction, so a savepoint marks where this unit
	 * began and a failure undoes only the unit's own work.
	 *
	 * @return the savepoint to return to on failure, or {@code null} when auto-commit is on
	 */
	@Nullable
	Savepoint beginUnitOfWork() {
		return isAutoCommit() ? null : getManagedConnection().setSavepoint();
	}

	/**
	 * Commits a successful unit of work if auto-commit is on, otherwise releases its savepoint and leaves the
	 * transaction open.
	 */
	void completeUnitOfWork(@Nullable Savepoint savepoint) {
		if (savepoint == null)
			getManagedConnection().commit();
		else
			getManagedConnection().releaseSavepoint(savepoint);
	}

	void rollbackAfterFailure(@NonNull Throwable failure,
														@Nullable Savepoint savepoint) {
		requireNonNull(failure);

		try {
			if (savepoint == null)
				getManagedConnection().rollback();
			else
				getManagedConnection().rollback(savepoint);
		} catch (RuntimeException rollbackException) {
			logger.log(WARNING, "Unable to roll back transaction", rollbackException);
			failure.addSuppressed(rollbackException);
		}
	}

	@NonNull
	protected Table queryCatalog(@NonNull String sql,
															 @NonNull Object... parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		Statement statement = Statement.of(generateCallId(), sql);

		return executeStatements(List.of(statement), Arrays.asList(parameters))
				.orElseThrow(() -> new DatabaseException(format("Catalog query returned no result set: %s", sql)));
	}

	@NonNull
	protected String escapeSchemaName(@NonNull String name) {
		requireNonNull(name);

		if (name.isBlank())
			throw new InvalidIdentifierException(name, "schema name is empty");

		return getIdentifierEscaper().escape(name);
	}

	@NonNull
	Object generateCallId() {
		return CALL_ID_GENERATOR.incrementAndGet();
	}

	@NonNull
	protected DatabaseConfiguration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	ManagedConnection getManagedConnection() {
		return this.managedConnection;
	}

	@NonNull
	public Integer getBatchSize() {
		return this.batchSize;
	}

	@NonNull
	public ExistingTablePolicy getExistingTablePolicy() {
		return this.existingTablePolicy;
	}

	@NonNull
	protected PreparedStatementBinder getPreparedStatementBinder() {
		return this.preparedStatementBinder;
	}

	@NonNull
	protected ResultSetMapper getResultSetMapper() {
		return this.resultSetMapper;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	protected IdentifierEscaper getIdentifierEscaper() {
		return this.identifierEscaper;
	}

	@NonNull
	protected ColumnTypeInferrer getColumnTypeInferrer() {
		return this.columnTypeInferrer;
	}

	@NonNull
	TableProvisioner getTableProvisioner() {
		return this.tableProvisioner;
	}

	@NonNull
	BatchInserter getBatchInserter() {
		return this.batchInserter;
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DatabaseConfiguration configuration;
		@Nullable
		private ConnectionFactory connectionFactory;
		@NonNull
		private Boolean autoCommit;
		@NonNull
		private Integer batchSize;
		@NonNull
		private ExistingTablePolicy existingTablePolicy;
		@Nullable
		private PreparedStatementBinder preparedStatementBinder;
		@Nullable
		private ResultSetMapper resultSetMapper;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private IdentifierEscaper identifierEscaper;
		@Nullable
		private ColumnTypeInferrer columnTypeInferrer;

		private Builder(@NonNull DatabaseConfiguration configuration) {
			this.configuration = requireNonNull(configuration);
			this.autoCommit = true;
			this.batchSize = DEFAULT_BATCH_SIZE;
			this.existingTablePolicy = ExistingTablePolicy.TRUNCATE;
		}

		/**
		 * Specifies how connections are opened.  Defaults to {@link DefaultConnectionFactory}.
		 *
		 * @param connectionFactory the connection factory to use, or {@code null} for the default
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder connectionFactory(@Nullable ConnectionFactory connectionFactory) {
			this.connectionFactory = connectionFactory;
			return this;
		}

		@NonNull
		public Builder autoCommit(@NonNull Boolean autoCommit) {
			requireNonNull(autoCommit);
			this.autoCommit = autoCommit;
			return this;
		}

		/**
		 * Specifies the default number of rows per insert batch.  Defaults to {@value Database#DEFAULT_BATCH_SIZE}.
		 *
		 * @param batchSize a positive number of rows
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder batchSize(@NonNull Integer batchSize) {
			requireNonNull(batchSize);
			this.batchSize = batchSize;
			return this;
		}

		@NonNull
		public Builder existingTablePolicy(@NonNull ExistingTablePolicy existingTablePolicy) {
			requireNonNull(existingTablePolicy);
			this.existingTablePolicy = existingTablePolicy;
			return this;
		}

		@NonNull
		public Builder preparedStatementBinder(@Nullable PreparedStatementBinder preparedStatementBinder) {
			this.preparedStatementBinder = preparedStatementBinder;
			return this;
		}

		@NonNull
		public Builder resultSetMapper(@Nullable ResultSetMapper resultSetMapper) {
			this.resultSetMapper = resultSetMapper;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Builder identifierEscaper(@Nullable IdentifierEscaper identifierEscaper) {
			this.identifierEscaper = identifierEscaper;
			return this;
		}

		@NonNull
		public Builder columnTypeInferrer(@Nullable ColumnTypeInferrer columnTypeInferrer) {
			this.columnTypeInferrer = columnTypeInferrer;
			return this;
		}

		@NonNull
		public Database build() {
			return new Database(this);
		}
	}
}
