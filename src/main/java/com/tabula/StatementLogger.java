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

/**
 * Receives a {@link StatementLog} for every statement a {@link Database} executes, including each batch of a table
 * insert.
 * <p>
 * Implementations should be threadsafe.  An exception thrown here never hides a database failure; it is attached to
 * the database exception as suppressed instead.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface StatementLogger {
	/**
	 * Performs a logging operation on the given {@code statementLog}.
	 *
	 * @param statementLog the event to log
	 */
	void log(@NonNull StatementLog statementLog);

	/**
	 * Acquires a logger which discards every event.  This is what a {@link Database} uses unless told otherwise.
	 *
	 * @return a no-op statement logger
	 */
	@NonNull
	static StatementLogger noop() {
		return (statementLog) -> {
			// Nothing to do
		};
	}
}
