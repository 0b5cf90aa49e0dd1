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
 * One SQL statement as executed by a {@link Database}, along with where it sits in the call that issued it.
 * <p>
 * Statements split from the same {@link Database#query(String)} call share a {@code callId}, so log output for a
 * multi-statement call can be correlated.  Each batch of a table insert is likewise its own statement.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Statement {
	@NonNull
	private final Object callId;
	@NonNull
	private final Integer index;
	@NonNull
	private final Integer count;
	@NonNull
	private final String sql;

	private Statement(@NonNull Object callId,
										@NonNull Integer index,
										@NonNull Integer count,
										@NonNull String sql) {
		requireNonNull(callId);
		requireNonNull(index);
		requireNonNull(count);
		requireNonNull(sql);

		if (index < 1 || index > count)
			throw new IllegalArgumentException(format("Statement index %d is outside of 1..%d", index, count));

		this.callId = callId;
		this.index = index;
		this.count = count;
		this.sql = sql;
	}

	/**
	 * Creates a statement which is the only one in its call.
	 *
	 * @param callId identifies the call
	 * @param sql    the SQL text
	 * @return a statement instance
	 */
	@NonNull
	public static Statement of(@NonNull Object callId,
														 @NonNull String sql) {
		return new Statement(callId, 1, 1, sql);
	}

	/**
	 * Creates a statement which is one of several in its call.
	 *
	 * @param callId identifies the call
	 * @param index  1-based position of this statement in the call
	 * @param count  total number of statements in the call
	 * @param sql    the SQL text
	 * @return a statement instance
	 */
	@NonNull
	public static Statement of(@NonNull Object callId,
														 @NonNull Integer index,
														 @NonNull Integer count,
														 @NonNull String sql) {
		return new Statement(callId, index, count, sql);
	}

	/**
	 * Is this the final statement of its call?  Only the final statement's result is returned to the caller.
	 *
	 * @return {@code true} if this is the last statement of the call
	 */
	@NonNull
	public Boolean isLast() {
		return getIndex().equals(getCount());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getCallId(), getIndex(), getCount(), getSql());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Statement))
			return false;

		Statement statement = (Statement) object;

		return Objects.equals(statement.getCallId(), getCallId())
				&& Objects.equals(statement.getIndex(), getIndex())
				&& Objects.equals(statement.getCount(), getCount())
				&& Objects.equals(statement.getSql(), getSql());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{callId=%s, index=%d/%d, sql=%s}", getClass().getSimpleName(),
				getCallId(), getIndex(), getCount(), getSql().replaceAll("\\s*\n\\s*", " ").trim());
	}

	@NonNull
	public Object getCallId() {
		return this.callId;
	}

	/**
	 * @return 1-based position of this statement in its call
	 */
	@NonNull
	public Integer getIndex() {
		return this.index;
	}

	/**
	 * @return total number of statements in the call
	 */
	@NonNull
	public Integer getCount() {
		return this.count;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}
}
