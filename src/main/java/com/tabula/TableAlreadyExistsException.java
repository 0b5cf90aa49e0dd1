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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link Database#insertTable(Table, String)} when the destination table exists, {@code overwrite} is
 * {@code false} and the database is configured with {@link ExistingTablePolicy#FAIL}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class TableAlreadyExistsException extends DatabaseException {
	@NonNull
	private final QualifiedName qualifiedName;

	public TableAlreadyExistsException(@NonNull QualifiedName qualifiedName) {
		super(format("Table %s already exists", requireNonNull(qualifiedName)));
		this.qualifiedName = qualifiedName;
	}

	@NonNull
	public QualifiedName getQualifiedName() {
		return this.qualifiedName;
	}
}
