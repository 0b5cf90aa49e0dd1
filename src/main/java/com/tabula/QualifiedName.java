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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@code (schema, table)} pair identifying a database relation.
 * <p>
 * Both components are stored unescaped.  Use {@link #toSql(IdentifierEscaper)} to render them into SQL text.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QualifiedName {
	/**
	 * The schema assumed when a name does not specify one.
	 */
	@NonNull
	public static final String DEFAULT_SCHEMA = "public";

	@NonNull
	private final String schema;
	@NonNull
	private final String table;

	private QualifiedName(@NonNull String schema,
												@NonNull String table) {
		requireNonNull(schema);
		requireNonNull(table);

		this.schema = schema;
		this.table = table;
	}

	/**
	 * Creates a qualified name from already-separated components.
	 *
	 * @param schema the schema name
	 * @param table  the table name
	 * @return a qualified name
	 * @throws InvalidIdentifierException if either component is empty or blank
	 */
	@NonNull
	public static QualifiedName of(@NonNull String schema,
																 @NonNull String table) {
		requireNonNull(schema);
		requireNonNull(table);

		if (schema.isBlank())
			throw new InvalidIdentifierException(format("%s.%s", schema, table), "schema name is empty");
		if (table.isBlank())
			throw new InvalidIdentifierException(format("%s.%s", schema, table), "table name is empty");

		return new QualifiedName(schema, table);
	}

	/**
	 * Parses {@code "schema.table"} or a bare {@code "table"}.
	 * <p>
	 * Surrounding double quotes are stripped from each component, so {@code "\"hr\".\"employees\""} parses the same as
	 * {@code "hr.employees"}.  A bare name lands in {@value #DEFAULT_SCHEMA}.  There is no quote-aware parsing: any
	 * {@code .} is a separator, so a name with more than one is rejected.
	 *
	 * @param rawName the name to parse
	 * @return the parsed name
	 * @throws InvalidIdentifierException if {@code rawName} has more than one {@code .} or an empty component
	 */
	@NonNull
	public static QualifiedName parse(@NonNull String rawName) {
		requireNonNull(rawName);

		String[] components = rawName.split("\\.", -1);

		if (components.length > 2)
			throw new InvalidIdentifierException(rawName, "expected 'table' or 'schema.table'");

		String schema = components.length == 2 ? stripQuotes(components[0]) : DEFAULT_SCHEMA;
		String table = stripQuotes(components[components.length - 1]);

		if (schema.isBlank())
			throw new InvalidIdentifierException(rawName, "schema name is empty");
		if (table.isBlank())
			throw new InvalidIdentifierException(rawName, "table name is empty");

		return new QualifiedName(schema, table);
	}

	@NonNull
	private static String stripQuotes(@NonNull String component) {
		requireNonNull(component);

		int start = 0;
		int end = component.length();

		while (start < end && component.charAt(start) == '"')
			++start;

		while (end > start && component.charAt(end - 1) == '"')
			--end;

		return component.substring(start, end);
	}

	/**
	 * Renders this name as {@code schema.table}, escaping each component independently.
	 *
	 * @param identifierEscaper the escaper to apply
	 * @return SQL text for this name
	 */
	@NonNull
	public String toSql(@NonNull IdentifierEscaper identifierEscaper) {
		requireNonNull(identifierEscaper);
		return format("%s.%s", identifierEscaper.escape(getSchema()), identifierEscaper.escape(getTable()));
	}

	@NonNull
	public String getSchema() {
		return this.schema;
	}

	@NonNull
	public String getTable() {
		return this.table;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QualifiedName))
			return false;

		QualifiedName qualifiedName = (QualifiedName) object;

		return Objects.equals(qualifiedName.getSchema(), getSchema())
				&& Objects.equals(qualifiedName.getTable(), getTable());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSchema(), getTable());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s.%s", getSchema(), getTable());
	}
}
