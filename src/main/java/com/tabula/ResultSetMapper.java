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

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Contract for materializing a {@link ResultSet} into a {@link Table}.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.  Or, implement
 * your own: <pre>{@code  ResultSetMapper myImpl = (resultSet) -> {
 *   // Pull column labels and values from resultSet
 *   return Table.withColumnNames("id").build();
 * };}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultSetMapper {
	/**
	 * Reads every remaining row of {@code resultSet} into a table whose columns are named by the result set's column
	 * labels, in result set order.
	 * <p>
	 * Implementations must not close the result set.
	 *
	 * @param resultSet provides raw row data to pull from
	 * @return a table holding the result set's rows, which has zero rows if the result set was empty
	 * @throws SQLException if an error occurs during mapping
	 */
	@NonNull
	Table map(@NonNull ResultSet resultSet) throws SQLException;

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ResultSetMapper withDefaultConfiguration() {
		return new DefaultResultSetMapper();
	}
}
