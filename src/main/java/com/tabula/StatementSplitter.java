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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Splits raw SQL into the statements executed by {@link Database#query(String)}.
 * <p>
 * Splitting is purely lexical on {@code ;}.  A semicolon inside a string literal, comment or function body is treated
 * as a separator like any other, so SQL containing such semicolons must not be run through multi-statement mode.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementSplitter {
	private static final char STATEMENT_SEPARATOR = ';';

	private StatementSplitter() {}

	/**
	 * Splits {@code sql} on {@code ;}, strips whitespace from each piece and drops empty pieces.
	 *
	 * @param sql the SQL to split
	 * @return the statements in order, possibly empty
	 */
	@NonNull
	public static List<String> split(@NonNull String sql) {
		requireNonNull(sql);

		List<String> statements = new ArrayList<>();
		int start = 0;

		for (int i = 0; i <= sql.length(); ++i) {
			if (i == sql.length() || sql.charAt(i) == STATEMENT_SEPARATOR) {
				String statement = sql.substring(start, i).strip();

				if (statement.length() > 0)
					statements.add(statement);

				start = i + 1;
			}
		}

		return List.copyOf(statements);
	}
}
