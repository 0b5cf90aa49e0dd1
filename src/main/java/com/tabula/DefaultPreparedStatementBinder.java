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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link PreparedStatementBinder}.
 * <p>
 * Values are coerced to the Java type a JDBC driver expects for the destination {@link ColumnType}.
 * {@code null} is always bound with {@link PreparedStatement#setNull(int, int)}, never as a string.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultPreparedStatementBinder implements PreparedStatementBinder {
	@Override
	public void bindParameter(@NonNull PreparedStatement preparedStatement,
														@NonNull Integer parameterIndex,
														@Nullable Object parameter,
														@NonNull ColumnType columnType) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(columnType);

		if (parameter == null) {
			preparedStatement.setNull(parameterIndex, columnType.getJdbcType());
			return;
		}

		switch (columnType) {
			case INTEGER:
				preparedStatement.setInt(parameterIndex, numberValue(parameter, columnType).intValue());
				return;
			case BIGINT:
				bindBigint(preparedStatement, parameterIndex, numberValue(parameter, columnType));
				return;
			case DOUBLE_PRECISION:
				preparedStatement.setDouble(parameterIndex, numberValue(parameter, columnType).doubleValue());
				return;
			case BOOLEAN:
				if (!(parameter instanceof Boolean booleanValue))
					throw unsupportedValue(parameter, columnType);

				preparedStatement.setBoolean(parameterIndex, booleanValue);
				return;
			case TIMESTAMP:
				bindTimestamp(preparedStatement, parameterIndex, parameter);
				return;
			case TIMESTAMP_WITH_TIME_ZONE:
				bindTimestampWithTimeZone(preparedStatement, parameterIndex, parameter);
				return;
			default:
				// Text columns hold the string form of whatever was given, enums by name
				preparedStatement.setString(parameterIndex, parameter instanceof Enum<?> enumValue ? enumValue.name() : parameter.toString());
		}
	}

	protected void bindBigint(@NonNull PreparedStatement preparedStatement,
														@NonNull Integer parameterIndex,
														@NonNull Number number) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(number);

		// Out-of-range values are left for the database to reject
		if (number instanceof BigInteger bigInteger && bigInteger.bitLength() > 63)
			preparedStatement.setBigDecimal(parameterIndex, new BigDecimal(bigInteger));
		else
			preparedStatement.setLong(parameterIndex, number.longValue());
	}

	protected void bindTimestamp(@NonNull PreparedStatement preparedStatement,
															 @NonNull Integer parameterIndex,
															 @NonNull Object parameter) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(parameter);

		LocalDateTime localDateTime;

		if (parameter instanceof LocalDateTime value)
			localDateTime = value;
		else if (parameter instanceof Timestamp timestamp)
			localDateTime = timestamp.toLocalDateTime();
		else if (parameter instanceof Date date)
			localDateTime = new Timestamp(date.getTime()).toLocalDateTime();
		else
			throw unsupportedValue(parameter, ColumnType.TIMESTAMP);

		try {
			preparedStatement.setObject(parameterIndex, localDateTime);
		} catch (SQLFeatureNotSupportedException e) {
			preparedStatement.setTimestamp(parameterIndex, Timestamp.valueOf(localDateTime));
		}
	}

	protected void bindTimestampWithTimeZone(@NonNull PreparedStatement preparedStatement,
																					 @NonNull Integer parameterIndex,
																					 @NonNull Object parameter) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(parameter);

		OffsetDateTime offsetDateTime;

		if (parameter instanceof OffsetDateTime value)
			offsetDateTime = value;
		else if (parameter instanceof ZonedDateTime zonedDateTime)
			offsetDateTime = zonedDateTime.toOffsetDateTime();
		else if (parameter instanceof Instant instant)
			offsetDateTime = instant.atOffset(ZoneOffset.UTC);
		else
			throw unsupportedValue(parameter, ColumnType.TIMESTAMP_WITH_TIME_ZONE);

		try {
			preparedStatement.setObject(parameterIndex, offsetDateTime);
		} catch (SQLFeatureNotSupportedException e) {
			preparedStatement.setTimestamp(parameterIndex, Timestamp.from(offsetDateTime.toInstant()));
		}
	}

	@NonNull
	protected Number numberValue(@NonNull Object parameter,
															 @NonNull ColumnType columnType) {
		requireNonNull(parameter);
		requireNonNull(columnType);

		if (parameter instanceof Number number)
			return number;

		throw unsupportedValue(parameter, columnType);
	}

	@NonNull
	protected IllegalArgumentException unsupportedValue(@NonNull Object parameter,
																											@NonNull ColumnType columnType) {
		requireNonNull(parameter);
		requireNonNull(columnType);

		return new IllegalArgumentException(format("Cannot bind a value of type %s to a %s column",
				parameter.getClass().getName(), columnType.getDeclaration()));
	}
}
