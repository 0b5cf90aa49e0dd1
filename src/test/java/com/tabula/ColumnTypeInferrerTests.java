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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class ColumnTypeInferrerTests {
	private final ColumnTypeInferrer columnTypeInferrer = new ColumnTypeInferrer();

	enum Color {
		RED,
		BLUE
	}

	@Test
	public void testIntegersPickNarrowestType() {
		Assertions.assertEquals(ColumnType.INTEGER, columnTypeInferrer.inferType(Column.of("a", 1, 2, null, -3)));
		Assertions.assertEquals(ColumnType.INTEGER, columnTypeInferrer.inferType(Column.of("a", (short) 1, (byte) 2, 3L)));
		Assertions.assertEquals(ColumnType.INTEGER, columnTypeInferrer.inferType(Column.of("a", (long) Integer.MAX_VALUE, (long) Integer.MIN_VALUE)));
		Assertions.assertEquals(ColumnType.BIGINT, columnTypeInferrer.inferType(Column.of("a", 1L, Integer.MAX_VALUE + 1L)));
		Assertions.assertEquals(ColumnType.BIGINT, columnTypeInferrer.inferType(Column.of("a", 1L, Integer.MIN_VALUE - 1L)));
		Assertions.assertEquals(ColumnType.BIGINT, columnTypeInferrer.inferType(Column.of("a", BigInteger.TEN.pow(12))));
	}

	@Test
	public void testFloatingPoint() {
		Assertions.assertEquals(ColumnType.DOUBLE_PRECISION, columnTypeInferrer.inferType(Column.of("a", 1.5, null, 2.0f)));
		Assertions.assertEquals(ColumnType.DOUBLE_PRECISION, columnTypeInferrer.inferType(Column.of("a", new BigDecimal("1.25"))));
		Assertions.assertEquals(ColumnType.DOUBLE_PRECISION, columnTypeInferrer.inferType(Column.of("a", 1, 2.5, 3L)),
				"Integers mixed with floating point should widen");
	}

	@Test
	public void testBooleanAndTemporalTypes() {
		Assertions.assertEquals(ColumnType.BOOLEAN, columnTypeInferrer.inferType(Column.of("a", true, null, false)));
		Assertions.assertEquals(ColumnType.TIMESTAMP, columnTypeInferrer.inferType(Column.of("a", LocalDateTime.of(2024, 1, 2, 3, 4))));
		Assertions.assertEquals(ColumnType.TIMESTAMP, columnTypeInferrer.inferType(Column.of("a", Timestamp.valueOf("2024-01-02 03:04:05"))));
		Assertions.assertEquals(ColumnType.TIMESTAMP_WITH_TIME_ZONE, columnTypeInferrer.inferType(Column.of("a",
				OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.ofHours(2)))));
		Assertions.assertEquals(ColumnType.TIMESTAMP_WITH_TIME_ZONE, columnTypeInferrer.inferType(Column.of("a",
				ZonedDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneId.of("Europe/Paris")), null)));
		Assertions.assertEquals(ColumnType.TIMESTAMP_WITH_TIME_ZONE, columnTypeInferrer.inferType(Column.of("a", Instant.EPOCH)));
	}

	@Test
	public void testCategoricalIsText() {
		Assertions.assertEquals(ColumnType.TEXT, columnTypeInferrer.inferType(Column.of("a", Color.RED, Color.BLUE)));
	}

	@Test
	public void testTextLengthThreshold() {
		String exactlyMaximum = "x".repeat(255);
		String overMaximum = "x".repeat(256);

		Assertions.assertEquals(ColumnType.VARCHAR, columnTypeInferrer.inferType(Column.of("a", "short", exactlyMaximum)));
		Assertions.assertEquals(ColumnType.TEXT, columnTypeInferrer.inferType(Column.of("a", "short", overMaximum)));
		Assertions.assertEquals(ColumnType.VARCHAR, columnTypeInferrer.inferType(Column.of("a", 'c')));

		// Length is counted in code points, so 255 emoji still fit
		String emoji = new String(Character.toChars(0x1F600)).repeat(255);
		Assertions.assertEquals(ColumnType.VARCHAR, columnTypeInferrer.inferType(Column.of("a", emoji)));
	}

	@Test
	public void testAllNullColumnIsVarchar() {
		Assertions.assertEquals(ColumnType.VARCHAR, columnTypeInferrer.inferType(Column.of("a", Arrays.asList(null, null))));
		Assertions.assertEquals(ColumnType.VARCHAR, columnTypeInferrer.inferType(Column.of("a", List.of())));
	}

	@Test
	public void testMixedAndUnknownKindsFallBackToText() {
		Assertions.assertEquals(ColumnType.TEXT, columnTypeInferrer.inferType(Column.of("a", 1, "two")));
		Assertions.assertEquals(ColumnType.TEXT, columnTypeInferrer.inferType(Column.of("a", true, 1)));
		Assertions.assertEquals(ColumnType.TEXT, columnTypeInferrer.inferType(Column.of("a", LocalDate.of(2024, 1, 2))));
	}

	@Test
	public void testDeclaredTypeTakesPrecedence() {
		Assertions.assertEquals(ColumnType.INTEGER, columnTypeInferrer.inferType(Column.of("a", Integer.class, Arrays.asList(null, null))));
		Assertions.assertEquals(ColumnType.BOOLEAN, columnTypeInferrer.inferType(Column.of("a", Boolean.class, List.of())));
		Assertions.assertEquals(ColumnType.TEXT, columnTypeInferrer.inferType(Column.of("a", Color.class, List.of(Color.RED))));
		Assertions.assertEquals(ColumnType.VARCHAR, columnTypeInferrer.inferType(Column.of("a", String.class, List.of("x"))));
	}

	@Test
	public void testInferTypesPreservesColumnOrder() {
		Table table = Table.withColumnNames("z", "a", "m")
				.row(1, "one", 1.0)
				.row(2, "two", 2.0)
				.build();

		Map<String, ColumnType> columnTypes = columnTypeInferrer.inferTypes(table);

		Assertions.assertEquals(List.of("z", "a", "m"), List.copyOf(columnTypes.keySet()));
		Assertions.assertEquals(List.of(ColumnType.INTEGER, ColumnType.VARCHAR, ColumnType.DOUBLE_PRECISION), List.copyOf(columnTypes.values()));
	}

	@Test
	public void testDeclarations() {
		Assertions.assertEquals("DOUBLE PRECISION", ColumnType.DOUBLE_PRECISION.getDeclaration());
		Assertions.assertEquals("TIMESTAMP WITH TIME ZONE", ColumnType.TIMESTAMP_WITH_TIME_ZONE.getDeclaration());
		Assertions.assertEquals("VARCHAR(255)", ColumnType.VARCHAR.getDeclaration());
	}
}
