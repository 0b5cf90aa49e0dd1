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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A named, ordered list of values forming one column of a {@link Table}.
 * <p>
 * Values may be {@code null}.  A column may declare the Java type of its values, which then drives
 * {@link ColumnTypeInferrer type inference} even when every value is {@code null}; every non-null value must be an
 * instance of the declared type.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Column {
	@NonNull
	private final String name;
	@Nullable
	private final Class<?> declaredType;
	@NonNull
	private final List<@Nullable Object> values;

	private Column(@NonNull String name,
								 @Nullable Class<?> declaredType,
								 @NonNull List<?> values) {
		requireNonNull(name);
		requireNonNull(values);

		if (declaredType != null) {
			for (int i = 0; i < values.size(); ++i) {
				Object value = values.get(i);

				if (value != null && !declaredType.isInstance(value))
					throw new IllegalArgumentException(format("Value at row %d of column '%s' is a %s, expected %s",
							i, name, value.getClass().getName(), declaredType.getName()));
			}
		}

		this.name = name;
		this.declaredType = declaredType;
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	/**
	 * Creates a column whose value type is determined from its values.
	 *
	 * @param name   the column name
	 * @param values the column values, which may include {@code null}
	 * @return a column
	 */
	@NonNull
	public static Column of(@NonNull String name,
													@NonNull List<?> values) {
		return new Column(name, null, values);
	}

	/**
	 * Creates a column whose value type is determined from its values.
	 *
	 * @param name   the column name
	 * @param values the column values, which may include {@code null}
	 * @return a column
	 */
	@NonNull
	public static Column of(@NonNull String name,
													@Nullable Object... values) {
		requireNonNull(name);
		return new Column(name, null, values == null ? Arrays.asList((Object) null) : Arrays.asList(values));
	}

	/**
	 * Creates a column with an explicitly declared value type.
	 *
	 * @param name         the column name
	 * @param declaredType the type every non-null value must have
	 * @param values       the column values, which may include {@code null}
	 * @return a column
	 * @throws IllegalArgumentException if a value is not an instance of {@code declaredType}
	 */
	@NonNull
	public static Column of(@NonNull String name,
													@NonNull Class<?> declaredType,
													@NonNull List<?> values) {
		requireNonNull(declaredType);
		return new Column(name, declaredType, values);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public Optional<Class<?>> getDeclaredType() {
		return Optional.ofNullable(this.declaredType);
	}

	/**
	 * @return an unmodifiable view of this column's values
	 */
	@NonNull
	public List<@Nullable Object> getValues() {
		return this.values;
	}

	@Nullable
	public Object get(int rowIndex) {
		return this.values.get(rowIndex);
	}

	public int size() {
		return this.values.size();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Column))
			return false;

		Column column = (Column) object;

		return Objects.equals(column.getName(), getName())
				&& Objects.equals(column.getValues(), getValues());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getValues());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, declaredType=%s, size=%d}", getClass().getSimpleName(), getName(),
				getDeclaredType().map(Class::getSimpleName).orElse("none"), size());
	}
}
