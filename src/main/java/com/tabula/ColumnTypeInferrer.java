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
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Determines the {@link ColumnType} to declare for each column of a {@link Table}.
 * <p>
 * Rules, in priority order:
 * <ol>
 *   <li>integers: {@code INTEGER} if every value fits in 32 bits, otherwise {@code BIGINT}</li>
 *   <li>floating-point numbers (or integers mixed with floating-point numbers): {@code DOUBLE PRECISION}</li>
 *   <li>booleans: {@code BOOLEAN}</li>
 *   <li>timestamps without a zone ({@link LocalDateTime}, {@link Date}): {@code TIMESTAMP}</li>
 *   <li>timestamps with a zone or offset ({@link OffsetDateTime}, {@link ZonedDateTime}, {@link Instant}):
 *   {@code TIMESTAMP WITH TIME ZONE}</li>
 *   <li>enums: {@code TEXT}</li>
 *   <li>strings: {@code VARCHAR(255)} if no value is longer than 255 characters, otherwise {@code TEXT}</li>
 *   <li>anything else, including columns mixing the above: {@code TEXT}</li>
 * </ol>
 * A column's declared type wins over its values.  A column with neither a declared type nor any non-null value is
 * treated as text and gets {@code VARCHAR(255)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class ColumnTypeInferrer {
	@NonNull
	private static final BigInteger MINIMUM_INTEGER = BigInteger.valueOf(Integer.MIN_VALUE);
	@NonNull
	private static final BigInteger MAXIMUM_INTEGER = BigInteger.valueOf(Integer.MAX_VALUE);

	/**
	 * Infers the type of every column of {@code table}.
	 *
	 * @param table the table to inspect
	 * @return column name to type, in column order
	 */
	@NonNull
	public Map<@NonNull String, @NonNull ColumnType> inferTypes(@NonNull Table table) {
		requireNonNull(table);

		Map<String, ColumnType> columnTypes = new LinkedHashMap<>(table.getColumnCount());

		for (Column column : table.getColumns())
			columnTypes.put(column.getName(), inferType(column));

		return Collections.unmodifiableMap(columnTypes);
	}

	/**
	 * Infers the type of a single column.
	 *
	 * @param column the column to inspect
	 * @return the type to declare for {@code column}
	 */
	@NonNull
	public ColumnType inferType(@NonNull Column column) {
		requireNonNull(column);

		ValueKind valueKind = column.getDeclaredType().isPresent()
				? ValueKind.forType(column.getDeclaredType().get())
				: valueKindOf(column);

		switch (valueKind) {
			case INTEGER:
				return allValuesFitInInteger(column) ? ColumnType.INTEGER : ColumnType.BIGINT;
			case FLOATING_POINT:
				return ColumnType.DOUBLE_PRECISION;
			case BOOLEAN:
				return ColumnType.BOOLEAN;
			case TIMESTAMP:
				return ColumnType.TIMESTAMP;
			case TIMESTAMP_WITH_TIME_ZONE:
				return ColumnType.TIMESTAMP_WITH_TIME_ZONE;
			case CATEGORICAL:
				return ColumnType.TEXT;
			case TEXTUAL:
			case ABSENT:
				return maximumTextLength(column) <= ColumnType.VARCHAR_MAXIMUM_LENGTH ? ColumnType.VARCHAR : ColumnType.TEXT;
			default:
				return ColumnType.TEXT;
		}
	}

	@NonNull
	protected ValueKind valueKindOf(@NonNull Column column) {
		requireNonNull(column);

		ValueKind valueKind = ValueKind.ABSENT;

		for (Object value : column.getValues()) {
			if (value == null)
				continue;

			ValueKind currentValueKind = ValueKind.forType(value.getClass());

			if (valueKind == ValueKind.ABSENT || valueKind == currentValueKind)
				valueKind = currentValueKind;
			else if (isNumeric(valueKind) && isNumeric(currentValueKind))
				valueKind = ValueKind.FLOATING_POINT;
			else
				return ValueKind.OTHER;
		}

		return valueKind;
	}

	protected boolean allValuesFitInInteger(@NonNull Column column) {
		requireNonNull(column);

		for (Object value : column.getValues()) {
			if (value == null || value instanceof Integer || value instanceof Short || value instanceof Byte)
				continue;

			BigInteger integerValue = value instanceof BigInteger bigInteger
					? bigInteger
					: BigInteger.valueOf(((Number) value).longValue());

			if (integerValue.compareTo(MINIMUM_INTEGER) < 0 || integerValue.compareTo(MAXIMUM_INTEGER) > 0)
				return false;
		}

		return true;
	}

	protected int maximumTextLength(@NonNull Column column) {
		requireNonNull(column);

		int maximumTextLength = 0;

		for (Object value : column.getValues()) {
			if (value == null)
				continue;

			String string = value.toString();
			maximumTextLength = Math.max(maximumTextLength, string.codePointCount(0, string.length()));
		}

		return maximumTextLength;
	}

	private static boolean isNumeric(@NonNull ValueKind valueKind) {
		return valueKind == ValueKind.INTEGER || valueKind == ValueKind.FLOATING_POINT;
	}

	/**
	 * Broad classification of the Java types that can appear in a column.
	 */
	protected enum ValueKind {
		INTEGER,
		FLOATING_POINT,
		BOOLEAN,
		TIMESTAMP,
		TIMESTAMP_WITH_TIME_ZONE,
		CATEGORICAL,
		TEXTUAL,
		// Column has no non-null values
		ABSENT,
		OTHER;

		@NonNull
		static ValueKind forType(@Nullable Class<?> type) {
			if (type == null)
				return ABSENT;

			if (type == Integer.class || type == Long.class || type == Short.class || type == Byte.class
					|| BigInteger.class.isAssignableFrom(type))
				return INTEGER;

			if (type == Double.class || type == Float.class || BigDecimal.class.isAssignableFrom(type))
				return FLOATING_POINT;

			if (type == Boolean.class)
				return BOOLEAN;

			// java.sql.Timestamp is a java.util.Date
			if (type == LocalDateTime.class || Date.class.isAssignableFrom(type))
				return TIMESTAMP;

			if (type == OffsetDateTime.class || type == ZonedDateTime.class || type == Instant.class)
				return TIMESTAMP_WITH_TIME_ZONE;

			if (type.isEnum() || (type.getSuperclass() != null && type.getSuperclass().isEnum()))
				return CATEGORICAL;

			if (CharSequence.class.isAssignableFrom(type) || type == Character.class)
				return TEXTUAL;

			return OTHER;
		}
	}
}
