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
 * Thrown when a batch of rows cannot be inserted.
 * <p>
 * Only the failing batch is rolled back.  Batches before it stay committed when auto-commit is enabled.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class InsertException extends DatabaseException {
	@NonNull
	private final QualifiedName qualifiedName;
	@NonNull
	private final Integer batchIndex;

	/**
	 * @param qualifiedName the table being inserted into
	 * @param batchIndex    1-based index of the failing batch
	 * @param cause         the underlying driver error
	 */
	public InsertException(@NonNull QualifiedName qualifiedName,
												 @NonNull Integer batchIndex,
												 @NonNull Throwable cause) {
		super(format("Batch %d of insert into %s failed: %s", requireNonNull(batchIndex), requireNonNull(qualifiedName),
				requireNonNull(cause).getMessage()), cause);

		this.qualifiedName = qualifiedName;
		this.batchIndex = batchIndex;
	}

	@NonNull
	public QualifiedName getQualifiedName() {
		return this.qualifiedName;
	}

	/**
	 * @return the 1-based index of the batch that failed
	 */
	@NonNull
	public Integer getBatchIndex() {
		return this.batchIndex;
	}
}
