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
 * Thrown when a schema or table name cannot be parsed into a {@link QualifiedName}.
 * <p>
 * This is always thrown before any SQL is sent to the database.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class InvalidIdentifierException extends DatabaseException {
	@NonNull
	private final String identifier;

	public InvalidIdentifierException(@NonNull String identifier,
																		@NonNull String reason) {
		super(format("Invalid identifier '%s': %s", requireNonNull(identifier), requireNonNull(reason)));
		this.identifier = identifier;
	}

	/**
	 * @return the raw identifier that was rejected
	 */
	@NonNull
	public String getIdentifier() {
		return this.identifier;
	}
}
