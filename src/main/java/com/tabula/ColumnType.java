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

import java.sql.Types;

/**
 * Column types which Tabula declares when it creates a table.
 *
 * @since 1.0.0
 */
public enum ColumnType {
	INTEGER("INTEGER", Types.INTEGER),
	BIGINT("BIGINT", Types.BIGINT),
	DOUBLE_PRECISION("DOUBLE PRECISION", Types.DOUBLE),
	BOOLEAN("BOOLEAN", Types.BOOLEAN),
	TIMESTAMP("TIMESTAMP", Types.TIMESTAMP),
	TIMESTAMP_WITH_TIME_ZONE("TIMESTAMP WITH TIME ZONE", Types.TIMESTAMP_WITH_TIMEZONE),
	/**
	 * Bounded text, chosen when no value is longer than {@link #VARCHAR_MAXIMUM_LENGTH} characters.
	 */
	VARCHAR("VARCHAR(255)", Types.VARCHAR),
	TEXT("TEXT", Types.VARCHAR);

	/**
	 * The longest string, in characters, that fits a {@link #VARCHAR} column.
	 */
	public static final int VARCHAR_MAXIMUM_LENGTH = 255;

	@NonNull
	private final String declaration;
	private final int jdbcType;

	ColumnType(@NonNull String declaration,
						 int jdbcType) {
		this.declaration = declaration;
		this.jdbcType = jdbcType;
	}

	/**
	 * @return the type as written in a {@code CREATE TABLE} column definition
	 */
	@NonNull
	public String getDeclaration() {
		return this.declaration;
	}

	/**
	 * @return the {@link Types} constant used when binding {@code NULL} to a column of this type
	 */
	public int getJdbcType() {
		return this.jdbcType;
	}

	/**
	 * @return {@code true} for the text types, to which non-string values are bound as their string form
	 */
	public boolean isTextual() {
		return this == VARCHAR || this == TEXT;
	}
}
