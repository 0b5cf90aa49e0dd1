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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when an error occurs when interacting with a {@link Database}.
 * <p>
 * This is the root of the Tabula exception hierarchy.  If the {@code cause} chain contains a {@link SQLException}, the
 * {@link #getErrorCode()} and {@link #getSqlState()} accessors are shorthand for the corresponding
 * {@link SQLException} values.  PostgreSQL server errors additionally expose the fields of the server error message.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final String dbmsMessage;
	@Nullable
	private final String detail;
	@Nullable
	private final String hint;
	@Nullable
	private final Integer position;
	@Nullable
	private final String schema;
	@Nullable
	private final String table;
	@Nullable
	private final String column;
	@Nullable
	private final String constraint;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		Integer errorCode = null;
		String sqlState = null;
		String dbmsMessage = null;
		String detail = null;
		String hint = null;
		Integer position = null;
		String schema = null;
		String table = null;
		String column = null;
		String constraint = null;

		SQLException sqlException = findSqlException(cause);

		if (sqlException != null) {
			errorCode = sqlException.getErrorCode();
			sqlState = sqlException.getSQLState();

			// Postgres hands back a structured server message
			if ("org.postgresql.util.PSQLException".equals(sqlException.getClass().getName())) {
				org.postgresql.util.ServerErrorMessage serverErrorMessage = ((org.postgresql.util.PSQLException) sqlException).getServerErrorMessage();

				if (serverErrorMessage != null) {
					if (serverErrorMessage.getSQLState() != null)
						sqlState = serverErrorMessage.getSQLState();

					dbmsMessage = serverErrorMessage.getMessage();
					detail = serverErrorMessage.getDetail();
					hint = serverErrorMessage.getHint();
					position = serverErrorMessage.getPosition();
					schema = serverErrorMessage.getSchema();
					table = serverErrorMessage.getTable();
					column = serverErrorMessage.getColumn();
					constraint = serverErrorMessage.getConstraint();
				}
			}
		}

		this.errorCode = errorCode;
		this.sqlState = sqlState;
		this.dbmsMessage = dbmsMessage;
		this.detail = detail;
		this.hint = hint;
		this.position = position;
		this.schema = schema;
		this.table = table;
		this.column = column;
		this.constraint = constraint;
	}

	@Nullable
	private static SQLException findSqlException(@Nullable Throwable cause) {
		Throwable current = cause;

		while (current != null) {
			if (current instanceof SQLException sqlException)
				return sqlException;

			current = current.getCause();
		}

		return null;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(12);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));
		if (getDbmsMessage().isPresent())
			components.add(format("dbmsMessage=%s", getDbmsMessage().get()));
		if (getDetail().isPresent())
			components.add(format("detail=%s", getDetail().get()));
		if (getHint().isPresent())
			components.add(format("hint=%s", getHint().get()));
		if (getPosition().isPresent())
			components.add(format("position=%s", getPosition().get()));
		if (getSchema().isPresent())
			components.add(format("schema=%s", getSchema().get()));
		if (getTable().isPresent())
			components.add(format("table=%s", getTable().get()));
		if (getColumn().isPresent())
			components.add(format("column=%s", getColumn().get()));
		if (getConstraint().isPresent())
			components.add(format("constraint=%s", getConstraint().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	/**
	 * @return the primary error message reported by the database server, or empty if not available
	 */
	@NonNull
	public Optional<String> getDbmsMessage() {
		return Optional.ofNullable(this.dbmsMessage);
	}

	/**
	 * @return the error {@code detail}, or empty if not available
	 */
	@NonNull
	public Optional<String> getDetail() {
		return Optional.ofNullable(this.detail);
	}

	/**
	 * @return the error {@code hint}, or empty if not available
	 */
	@NonNull
	public Optional<String> getHint() {
		return Optional.ofNullable(this.hint);
	}

	/**
	 * @return the 1-based character position of the error in the statement text, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getPosition() {
		return Optional.ofNullable(this.position);
	}

	/**
	 * @return the value of the offending {@code schema}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	/**
	 * @return the value of the offending {@code table}, or empty if not available
	 */
	@NonNull
	public Optional<String> getTable() {
		return Optional.ofNullable(this.table);
	}

	/**
	 * @return the value of the offending {@code column}, or empty if not available
	 */
	@NonNull
	public Optional<String> getColumn() {
		return Optional.ofNullable(this.column);
	}

	/**
	 * @return the value of the offending {@code constraint}, or empty if not available
	 */
	@NonNull
	public Optional<String> getConstraint() {
		return Optional.ofNullable(this.constraint);
	}
}
