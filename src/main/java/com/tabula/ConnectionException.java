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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a connection to the database cannot be established.
 * <p>
 * Connection failures are never retried; they surface on the first operation that needs a connection.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ConnectionException extends DatabaseException {
	@NonNull
	private final String target;

	/**
	 * Creates a {@code ConnectionException} for the given connection {@code target}.
	 *
	 * @param target describes where we tried to connect, e.g. a JDBC URL (never includes credentials)
	 * @param cause  the cause of this exception
	 */
	public ConnectionException(@NonNull String target,
														 @NonNull Throwable cause) {
		super(String.format("Unable to connect to %s", requireNonNull(target)), requireNonNull(cause));
		this.target = target;
	}

	/**
	 * @return where we tried to connect, e.g. a JDBC URL
	 */
	@NonNull
	public String getTarget() {
		return this.target;
	}
}
