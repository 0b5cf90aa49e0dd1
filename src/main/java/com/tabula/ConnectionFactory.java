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

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/**
 * Opens the single {@link Connection} a {@link Database} works on.
 * <p>
 * {@link DefaultConnectionFactory} goes through {@link java.sql.DriverManager}.  To connect through a pool or any
 * other {@link DataSource}, use {@link #fromDataSource(DataSource)}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionFactory {
	/**
	 * Opens a new connection.
	 *
	 * @param configuration where and as whom to connect
	 * @return a live connection, owned by the caller
	 * @throws SQLException if the connection cannot be opened
	 */
	@NonNull
	Connection connect(@NonNull DatabaseConfiguration configuration) throws SQLException;

	/**
	 * Acquires a factory which asks {@code dataSource} for connections, ignoring the configuration's URL and
	 * credentials.
	 *
	 * @param dataSource the data source to connect through
	 * @return a connection factory backed by {@code dataSource}
	 */
	@NonNull
	static ConnectionFactory fromDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return (configuration) -> dataSource.getConnection();
	}
}
