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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for one executed {@link Statement}: what ran, with which parameters, how long each phase took and how
 * it failed, if it did.
 * <p>
 * For a batched insert, {@link #getParameters()} holds the first row of the batch and {@link #getBatchSize()} how many
 * rows the batch carried.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final Statement statement;
	@NonNull
	private final List<@Nullable Object> parameters;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultSetMappingDuration;
	@Nullable
	private final Integer batchSize;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statement = requireNonNull(builder.statement);
		this.parameters = Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.executionDuration = builder.executionDuration;
		this.resultSetMappingDuration = builder.resultSetMappingDuration;
		this.batchSize = builder.batchSize;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		for (Duration duration : new Duration[]{this.connectionAcquisitionDuration, this.executionDuration, this.resultSetMappingDuration})
			if (duration != null)
				totalDuration = totalDuration.plus(duration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code statement}.
	 *
	 * @param statement the statement that was executed
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withStatement(@NonNull Statement statement) {
		requireNonNull(statement);
		return new Builder(statement);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("statement=%s", getStatement()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		components.add(format("totalDuration=%s", getTotalDuration()));

		getConnectionAcquisitionDuration().ifPresent(duration -> components.add(format("connectionAcquisitionDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultSetMappingDuration().ifPresent(duration -> components.add(format("resultSetMappingDuration=%s", duration)));
		getBatchSize().ifPresent(batchSize -> components.add(format("batchSize=%s", batchSize)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getStatement(), statementLog.getStatement())
				&& Objects.equals(getParameters(), statementLog.getParameters())
				&& Objects.equals(getConnectionAcquisitionDuration(), statementLog.getConnectionAcquisitionDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getResultSetMappingDuration(), statementLog.getResultSetMappingDuration())
				&& Objects.equals(getBatchSize(), statementLog.getBatchSize())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatement(), getParameters(), getConnectionAcquisitionDuration(), getExecutionDuration(),
				getResultSetMappingDuration(), getBatchSize(), getException());
	}

	@NonNull
	public Statement getStatement() {
		return this.statement;
	}

	/**
	 * The values bound to the statement's placeholders, in order.
	 *
	 * @return the bound values, empty if the statement had none
	 */
	@NonNull
	public List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	/**
	 * How long did it take to open (or reopen) the managed {@link java.sql.Connection}?
	 *
	 * @return how long it took to acquire a connection, if a connection had to be opened for this statement
	 */
	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	/**
	 * @return how long it took to execute the SQL statement, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * @return how long it took to read the {@link java.sql.ResultSet} into a {@link Table}, if a result was read
	 */
	@NonNull
	public Optional<Duration> getResultSetMappingDuration() {
		return Optional.ofNullable(this.resultSetMappingDuration);
	}

	/**
	 * Sum of every phase duration that is present.
	 *
	 * @return how long the statement took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	/**
	 * @return how many rows the batch carried, if this statement was an insert batch
	 */
	@NonNull
	public Optional<Integer> getBatchSize() {
		return Optional.ofNullable(this.batchSize);
	}

	/**
	 * @return the exception that occurred during execution, if any
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Statement statement;
		@NonNull
		private List<@Nullable Object> parameters;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultSetMappingDuration;
		@Nullable
		private Integer batchSize;
		@Nullable
		private Exception exception;

		private Builder(@NonNull Statement statement) {
			requireNonNull(statement);
			this.statement = statement;
			this.parameters = List.of();
		}

		@NonNull
		public Builder parameters(@NonNull List<@Nullable Object> parameters) {
			requireNonNull(parameters);
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultSetMappingDuration(@Nullable Duration resultSetMappingDuration) {
			this.resultSetMappingDuration = resultSetMappingDuration;
			return this;
		}

		@NonNull
		public Builder batchSize(@Nullable Integer batchSize) {
			this.batchSize = batchSize;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		/**
		 * Constructs a {@code StatementLog} instance.
		 *
		 * @return a {@code StatementLog} instance
		 */
		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
