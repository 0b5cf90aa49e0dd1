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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Makes sure the destination of a table insert exists and is ready to receive rows.
 * <p>
 * The schema is created if missing.  A missing table is created from the inferred column types; an existing one is
 * dropped and recreated when overwriting, otherwise handled per the {@link ExistingTablePolicy}.  Generated statements
 * run with the same transaction semantics as {@link Database#query(String)}, so dropping and recreating is one call
 * that either fully succeeds or is rolled back.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class TableProvisioner {
	@NonNull
	private final Database database;
	@NonNull
	private final Logger logger;

	TableProvisioner(@NonNull Database database) {
		requireNonNull(database);

		this.database = database;
		this.logger = Logger.getLogger(TableProvisioner.class.getName());
	}

	/**
	 * Prepares {@code qualifiedName} to receive the rows of {@code table}.
	 *
	 * @param table         the rows about to be inserted
	 * @param qualifiedName the destination
	 * @param overwrite     whether an existing table is dropped and recreated
	 * @return the inferred column types, in column order
	 * @throws TableAlreadyExistsException if the table exists, {@code overwrite} is off and the policy is
	 *                                     {@link ExistingTablePolicy#FAIL}
	 */
	@NonNull
	Map<@NonNull String, @NonNull ColumnType> ensureTable(@NonNull Table table,
																												@NonNull QualifiedName qualifiedName,
																												@NonNull Boolean overwrite) {
		requireNonNull(table);
		requireNonNull(qualifiedName);
		requireNonNull(overwrite);

		Map<String, ColumnType> columnTypes = getDatabase().getColumnTypeInferrer().inferTypes(table);

		if (!getDatabase().schemaExists(qualifiedName.getSchema())) {
			logger.fine(format("Schema %s does not exist, creating it", qualifiedName.getSchema()));
			getDatabase().createSchema(qualifiedName.getSchema());
		}

		String tableSql = qualifiedName.toSql(getDatabase().getIdentifierEscaper());
		String createTableSql = createTableSql(tableSql, columnTypes);

		if (!getDatabase().tableExists(qualifiedName.getTable(), qualifiedName.getSchema())) {
			logger.fine(format("Creating table %s", qualifiedName));
			getDatabase().queryStatements(List.of(createTableSql));
			return columnTypes;
		}

		if (overwrite) {
			logger.fine(format("Table %s exists, dropping and recreating it", qualifiedName));
			getDatabase().queryStatements(List.of(format("DROP TABLE %s", tableSql), createTableSql));
			return columnTypes;
		}

		switch (getDatabase().getExistingTablePolicy()) {
			case TRUNCATE:
				logger.fine(format("Table %s exists, truncating it", qualifiedName));
				getDatabase().queryStatements(List.of(format("TRUNCATE TABLE %s", tableSql)));
				return columnTypes;
			case FAIL:
				throw new TableAlreadyExistsException(qualifiedName);
			default:
				throw new IllegalStateException(format("Unhandled %s value %s", ExistingTablePolicy.class.getSimpleName(),
						getDatabase().getExistingTablePolicy().name()));
		}
	}

	@NonNull
	String createTableSql(@NonNull String tableSql,
												@NonNull Map<@NonNull String, @NonNull ColumnType> columnTypes) {
		requireNonNull(tableSql);
		requireNonNull(columnTypes);

		List<String> columnDefinitions = new ArrayList<>(columnTypes.size());

		for (Map.Entry<String, ColumnType> entry : columnTypes.entrySet())
			columnDefinitions.add(format("%s %s", getDatabase().getIdentifierEscaper().escape(entry.getKey()), entry.getValue().getDeclaration()));

		return format("CREATE TABLE %s (%s)", tableSql, String.join(", ", columnDefinitions));
	}

	@NonNull
	Database getDatabase() {
		return this.database;
	}
}
