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

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.Reader;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link ResultSetMapper}.
 * <p>
 * Driver-specific value types are normalized to their {@code java.time} equivalents ({@link Timestamp} becomes
 * {@link java.time.LocalDateTime}, {@code timestamptz} becomes {@link OffsetDateTime} and so on) and character large
 * objects are read into {@link String}s, so a {@link Table} never holds a value tied to an open connection.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultSetMapper implements ResultSetMapper {
	@Override
	@NonNull
	public Table map(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columnNames = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i)
			columnNames.add(resultSetMetaData.getColumnLabel(i));

		Table.Builder builder = Table.withColumnNames(columnNames);

		while (resultSet.next()) {
			Object[] row = new Object[columnCount];

			for (int i = 1; i <= columnCount; ++i)
				row[i - 1] = extractValue(resultSet, resultSetMetaData, i);

			builder.row(row);
		}

		return builder.build();
	}

	@Nullable
	protected Object extractValue(@NonNull ResultSet resultSet,
																@NonNull ResultSetMetaData resultSetMetaData,
																int columnIndex) throws SQLException {
		requireNonNull(resultSet);
		requireNonNull(resultSetMetaData);

		if (isTimestampWithTimeZone(resultSetMetaData, columnIndex))
			return resultSet.getObject(columnIndex, OffsetDateTime.class);

		return normalizeValue(resultSet.getObject(columnIndex));
	}

	@Nullable
	protected Object normalizeValue(@Nullable Object value) throws SQLException {
		if (value == null)
			return null;

		if (value instanceof Timestamp timestamp)
			return timestamp.toLocalDateTime();

		if (value instanceof java.sql.Date date)
			return date.toLocalDate();

		if (value instanceof Time time)
			return time.toLocalTime();

		if (value instanceof Clob clob)
			return readClob(clob);

		return value;
	}

	@NonNull
	protected Boolean isTimestampWithTimeZone(@NonNull ResultSetMetaData resultSetMetaData,
																						int columnIndex) throws SQLException {
		requireNonNull(resultSetMetaData);

		if (resultSetMetaData.getColumnType(columnIndex) == Types.TIMESTAMP_WITH_TIMEZONE)
			return true;

		// The Postgres driver reports timestamptz as Types.TIMESTAMP
		String columnTypeName = resultSetMetaData.getColumnTypeName(columnIndex);
		return columnTypeName != null && columnTypeName.toLowerCase(Locale.ENGLISH).equals("timestamptz");
	}

	@NonNull
	protected String readClob(@NonNull Clob clob) throws SQLException {
		requireNonNull(clob);

		StringBuilder stringBuilder = new StringBuilder();
		char[] buffer = new char[4096];

		try (Reader reader = clob.getCharacterStream()) {
			int charactersRead;

			while ((charactersRead = reader.read(buffer)) != -1)
				stringBuilder.append(buffer, 0, charactersRead);
		} catch (IOException e) {
			throw new SQLException("Unable to read character large object", e);
		} finally {
			clob.free();
		}

		return stringBuilder.toString();
	}
}
