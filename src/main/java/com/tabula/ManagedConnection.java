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
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The one connection a {@link Database} owns.
 * <p>
 * The connection is opened lazily on first use and reopened whenever it has gone away.  JDBC auto-commit is always
 * switched off right after opening, so every statement runs inside a transaction that ends only with an explicit
 * {@link #commit()} or {@link #rollback()}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class ManagedConnection {
	@NonNull
	private static final AtomicLong ID_GENERATOR;

	static {
		ID_GENERATOR = new AtomicLong(0);
	}

	@NonNull
	private final Long id;
	@NonNull
	private final ConnectionFactory connectionFactory;
	@NonNull
	private final DatabaseConfiguration configuration;
	@NonNull
	private final Logger logger;

	@Nullable
	private Connection connection;

	ManagedConnection(@NonNull ConnectionFactory connectionFactory,
										@NonNull DatabaseConfiguration configuration) {
		requireNonNull(connectionFactory);
		requireNonNull(configuration);

		this.id = ID_GENERATOR.incrementAndGet();
		this.connectionFactory = connectionFactory;
		this.configuration = configuration;
		this.logger = Logger.getLogger(ManagedConnection.class.getName());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, target=%s, hasConnection=%s}", getClass().getSimpleName(), this.id,
				getConfiguration().getJdbcUrl(), this.connection != null);
	}

	/**
	 * Is there a connection which can be used right now without opening a new one?
	 *
	 * @return {@code true} if a live connection is held
	 */
	@NonNull
	Boolean isOpen() {
		if (this.connection == null)
			return false;

		try {
			return !this.connection.isClosed();
		} catch (SQLException e) {
			logger.log(Level.FINER, "Unable to determine whether connection is closed, treating it as closed", e);
			return false;
		}
	}

	/**
	 * Returns the held connection, opening a new one first if none is held or the held one is closed.
	 *
	 * @return a live connection with JDBC auto-commit off
	 * @throws ConnectionException if a connection cannot be opened
	 */
	@NonNull
	Connection getConnection() {
		if (isOpen())
			return this.connection;

		if (this.connection != null)
			logger.finer(format("Connection %s was closed, reopening...", this.id));
		else
			logger.finer(format("Opening connection %s to %s...", this.id, getConfiguration().getJdbcUrl()));

		Connection connection;

		try {
			connection = getConnectionFactory().connect(getConfiguration());
		} catch (SQLException e) {
			throw new ConnectionException(getConfiguration().getJdbcUrl(), e);
		}

		try {
			connection.setAutoCommit(false);
		} catch (SQLException e) {
			ConnectionException connectionException = new ConnectionException(getConfiguration().getJdbcUrl(), e);

			try {
				connection.close();
			} catch (SQLException closeException) {
				connectionException.addSuppressed(closeException);
			}

			throw connectionException;
		}

		this.connection = connection;
		logger.finer(format("Connection %s opened.", this.id));

		return connection;
	}

	void commit() {
		if (!isOpen()) {
			logger.finer("No open connection, so nothing to commit");
			return;
		}

		logger.finer("Committing transaction...");

		try {
			this.connection.commit();
			logger.finer("Transaction committed.");
		} catch (SQLException e) {
			throw new DatabaseException("Unable to commit transaction", e);
		}
	}

	void rollback() {
		if (!isOpen()) {
			logger.finer("No open connection, so nothing to roll back");
			return;
		}

		logger.finer("Rolling back transaction...");

		try {
			this.connection.rollback();
			logger.finer("Transaction rolled back.");
		} catch (SQLException e) {
			throw new DatabaseException("Unable to roll back transaction", e);
		}
	}

	/**
	 * Marks the current point of the open transaction, opening a connection first if needed.
	 *
	 * @return a savepoint that {@link #rollback(Savepoint)} can return to
	 */
	@NonNull
	Savepoint setSavepoint() {
		try {
			return getConnection().setSavepoint();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to set savepoint", e);
		}
	}

	/**
	 * Undoes everything done since {@code savepoint}, keeping earlier work of the transaction.
	 */
	void rollback(@NonNull Savepoint savepoint) {
		requireNonNull(savepoint);

		if (!isOpen()) {
			logger.finer("No open connection, so nothing to roll back");
			return;
		}

		logger.finer("Rolling back to savepoint...");

		try {
			this.connection.rollback(savepoint);
			logger.finer("Rolled back to savepoint.");
		} catch (SQLException e) {
			throw new DatabaseException("Unable to roll back to savepoint", e);
		}
	}

	void releaseSavepoint(@NonNull Savepoint savepoint) {
		requireNonNull(savepoint);

		if (!isOpen())
			return;

		try {
			this.connection.releaseSavepoint(savepoint);
		} catch (SQLException e) {
			throw new DatabaseException("Unable to release savepoint", e);
		}
	}

	/**
	 * Closes the held connection, if any.  Safe to call repeatedly; the next {@link #getConnection()} opens a new one.
	 */
	void close() {
		Connection connection = this.connection;

		if (connection == null)
			return;

		this.connection = null;

		logger.finer(format("Closing connection %s...", this.id));

		try {
			connection.close();
			logger.finer(format("Connection %s closed.", this.id));
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close connection", e);
		}
	}

	@NonNull
	ConnectionFactory getConnectionFactory() {
		return this.connectionFactory;
	}

	@NonNull
	DatabaseConfiguration getConfiguration() {
		return this.configuration;
	}
}
