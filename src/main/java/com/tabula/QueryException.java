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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a statement executed via {@link Database#query(String)} fails.
 * <p>
 * By the time this exception is thrown, every statement of the call has been rolled back.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class QueryException extends DatabaseException {
	@NonNull
	private final Integer statementIndex;
	@NonNull
	private final Integer statementCount;
	@NonNull
	private final String statement;

	/**
	 * Creates a {@code QueryException} for the failing statement.
	 *
	 * @param statementIndex 1-based index of the failing statement
	 * @param statementCount how many statements the call contained
	 * @param statement      SQL text of the failing statement
	 * @param cause          the underlying driver error
	 */
	public QueryException(@NonNull Integer statementIndex,
												@NonNull Integer statementCount,
												@NonNull String statement,
												@NonNull Throwable cause) {
		super(format("Statement %d of %d failed: %s", requireNonNull(statementIndex), requireNonNull(statementCount),
				requireNonNull(cause).getMessage()), cause);

		this.statementIndex = statementIndex;
		this.statementCount = statementCount;
		this.statement = requireNonNull(statement);
	}

	/**
	 * @return the 1-based index of the statement that failed
	 */
	@NonNull
	public Integer getStatementIndex() {
		return this.statementIndex;
	}

	/**
	 * @return how many statements were part of the failed call
	 */
	@NonNull
	public Integer getStatementCount() {
		return this.statementCount;
	}

	/**
	 * @return the SQL text of the statement that failed
	 */
	@NonNull
	public String getStatement() {
		return this.statement;
	}
}
