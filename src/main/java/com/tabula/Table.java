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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An immutable in-memory table: ordered, named {@link Column}s of equal length.
 * <p>
 * Tables are returned by {@link Database#query(String)} and the catalog operations, and are accepted by
 * {@link Database#insertTable(Table, String)}.
 * <pre>
 * Table employees = Table.withColumnNames("id", "name", "active")
 *   .row(1, "Alice", true)
 *   .row(2, null, false)
 *   .build();
 *
 * Table sameEmployees = Table.of(
 *   Column.of("id", 1, 2),
 *   Column.of("name", "Alice", null),
 *   Column.of("active", true, false));
 * </pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Table {
	@NonNull
	private final List<@NonNull Column> columns;
	private final int rowCount;

	private Table(@NonNull List<@NonNull Column> columns) {
		requireNonNull(columns);

		int rowCount = columns.isEmpty() ? 0 : columns.get(0).size();

		for (Column column : columns) {
			requireNonNull(column);

			if (column.size() != rowCount)
				throw new IllegalArgumentException(format("Column '%s' has %d values but column '%s' has %d",
						column.getName(), column.size(), columns.get(0).getName(), rowCount));
		}

		this.columns = List.copyOf(columns);
		this.rowCount = rowCount;
	}

	/**
	 * Creates a table from its columns.
	 *
	 * @param columns the columns, in order
	 * @return a table
	 * @throws IllegalArgumentException if the columns have different lengths
	 */
	@NonNull
	public static Table of(@NonNull List<@NonNull Column> columns) {
		return new Table(columns);
	}

	/**
	 * Creates a table from its columns.
	 *
	 * @param columns the columns, in order
	 * @return a table
	 * @throws IllegalArgumentException if the columns have different lengths
	 */
	@NonNull
	public static Table of(@NonNull Column... columns) {
		requireNonNull(columns);
		return new Table(Arrays.asList(columns));
	}

	/**
	 * Provides a builder which accumulates a table row by row.
	 *
	 * @param columnNames the column names, in order
	 * @return a row-wise builder
	 */
	@NonNull
	public static Builder withColumnNames(@NonNull String... columnNames) {
		requireNonNull(columnNames);
		return new Builder(Arrays.asList(columnNames));
	}

	/**
	 * Provides a builder which accumulates a table row by row.
	 *
	 * @param columnNames the column names, in order
	 * @return a row-wise builder
	 */
	@NonNull
	public static Builder withColumnNames(@NonNull List<@NonNull String> columnNames) {
		requireNonNull(columnNames);
		return new Builder(columnNames);
	}

	@NonNull
	public List<@NonNull Column> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<@NonNull String> getColumnNames() {
		return this.columns.stream().map(Column::getName).collect(Collectors.toList());
	}

	/**
	 * Finds the first column with the given name.
	 *
	 * @param columnName the name to look for
	 * @return the column, or empty if there is none by that name
	 */
	@NonNull
	public Optional<Column> getColumn(@NonNull String columnName) {
		requireNonNull(columnName);
		return this.columns.stream().filter(column -> column.getName().equals(columnName)).findFirst();
	}

	@NonNull
	public Column getColumn(int columnIndex) {
		return this.columns.get(columnIndex);
	}

	public int getColumnCount() {
		return this.columns.size();
	}

	public int getRowCount() {
		return this.rowCount;
	}

	/**
	 * @return {@code true} if this table has no rows
	 */
	public boolean isEmpty() {
		return this.rowCount == 0;
	}

	/**
	 * Gets one row of this table.
	 *
	 * @param rowIndex 0-based row index
	 * @return the row's values in column order
	 */
	@NonNull
	public List<@Nullable Object> getRow(int rowIndex) {
		if (rowIndex < 0 || rowIndex >= this.rowCount)
			throw new IndexOutOfBoundsException(format("Row %d is outside of a table with %d rows", rowIndex, this.rowCount));

		List<Object> row = new ArrayList<>(this.columns.size());

		for (Column column : this.columns)
			row.add(column.get(rowIndex));

		return Collections.unmodifiableList(row);
	}

	/**
	 * Gets a single value of this table.
	 *
	 * @param rowIndex   0-based row index
	 * @param columnName name of the column
	 * @return the value, which may be {@code null}
	 * @throws IllegalArgumentException if there is no such column
	 */
	@Nullable
	public Object getValue(int rowIndex,
												 @NonNull String columnName) {
		requireNonNull(columnName);

		Column column = getColumn(columnName).orElseThrow(() ->
				new IllegalArgumentException(format("No column named '%s', columns are %s", columnName, getColumnNames())));

		return column.get(rowIndex);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Table))
			return false;

		Table table = (Table) object;

		return Objects.equals(table.getColumns(), getColumns());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumns());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{columns=%s, rowCount=%d}", getClass().getSimpleName(), getColumnNames(), getRowCount());
	}

	/**
	 * Builder used to construct {@link Table} instances one row at a time.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final List<@NonNull String> columnNames;
		@NonNull
		private final List<@NonNull List<@Nullable Object>> columnValues;

		private Builder(@NonNull List<@NonNull String> columnNames) {
			requireNonNull(columnNames);

			this.columnNames = List.copyOf(columnNames);
			this.columnValues = new ArrayList<>(columnNames.size());

			for (int i = 0; i < columnNames.size(); ++i)
				this.columnValues.add(new ArrayList<>());
		}

		/**
		 * Appends a row.
		 *
		 * @param values the row's values in column order
		 * @return this {@code Builder}, for chaining
		 * @throws IllegalArgumentException if the number of values does not match the number of columns
		 */
		@NonNull
		public Builder row(@Nullable Object... values) {
			List<Object> row = values == null ? Arrays.asList((Object) null) : Arrays.asList(values);

			if (row.size() != this.columnNames.size())
				throw new IllegalArgumentException(format("Row has %d values but there are %d columns %s",
						row.size(), this.columnNames.size(), this.columnNames));

			for (int i = 0; i < row.size(); ++i)
				this.columnValues.get(i).add(row.get(i));

			return this;
		}

		@NonNull
		public Table build() {
			List<Column> columns = new ArrayList<>(this.columnNames.size());

			for (int i = 0; i < this.columnNames.size(); ++i)
				columns.add(Column.of(this.columnNames.get(i), this.columnValues.get(i)));

			return new Table(columns);
		}
	}
}
