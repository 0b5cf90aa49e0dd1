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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Where and as whom a {@link Database} connects.
 * <p>
 * Either give an explicit JDBC URL via {@link #withJdbcUrl(String)}, or a host via {@link #withHost(String)} and let
 * a PostgreSQL URL be assembled from host, port and database name:
 * <pre>{@code  DatabaseConfiguration configuration = DatabaseConfiguration.withHost("localhost")
 *   .databaseName("analytics")
 *   .user("etl")
 *   .password("secret")
 *   .build();}</pre>
 * <p>
 * {@link #toString()} never includes the password.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DatabaseConfiguration {
	/**
	 * Port used when none is specified.
	 */
	public static final int DEFAULT_PORT = 5432;

	@NonNull
	public static final String HOST_ENVIRONMENT_KEY = "PG_HOST";
	@NonNull
	public static final String PORT_ENVIRONMENT_KEY = "PG_PORT";
	@NonNull
	public static final String DATABASE_NAME_ENVIRONMENT_KEY = "PG_DBNAME";
	@NonNull
	public static final String USER_ENVIRONMENT_KEY = "PG_USER";
	@NonNull
	public static final String PASSWORD_ENVIRONMENT_KEY = "PG_PASSWORD";

	@Nullable
	private final String host;
	@NonNull
	private final Integer port;
	@Nullable
	private final String databaseName;
	@Nullable
	private final String user;
	@Nullable
	private final String password;
	@Nullable
	private final String explicitJdbcUrl;
	@NonNull
	private final Map<@NonNull String, @NonNull String> properties;

	private DatabaseConfiguration(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.jdbcUrl == null) {
			if (builder.host == null || builder.host.isBlank())
				throw new IllegalArgumentException("A host is required when no JDBC URL is given");
			if (builder.databaseName == null || builder.databaseName.isBlank())
				throw new IllegalArgumentException("A database name is required when no JDBC URL is given");
		}

		if (builder.port < 1 || builder.port > 65535)
			throw new IllegalArgumentException(format("Port %d is out of range", builder.port));

		this.host = builder.host;
		this.port = builder.port;
		this.databaseName = builder.databaseName;
		this.user = builder.user;
		this.password = builder.password;
		this.explicitJdbcUrl = builder.jdbcUrl;
		this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
	}

	/**
	 * Acquires a builder for a configuration which connects to a PostgreSQL server on the given host.
	 *
	 * @param host the server's host name or address
	 * @return a {@code Builder}
	 */
	@NonNull
	public static Builder withHost(@NonNull String host) {
		requireNonNull(host);
		return new Builder().host(host);
	}

	/**
	 * Acquires a builder for a configuration which connects to the given JDBC URL, for any database.
	 *
	 * @param jdbcUrl the JDBC URL
	 * @return a {@code Builder}
	 */
	@NonNull
	public static Builder withJdbcUrl(@NonNull String jdbcUrl) {
		requireNonNull(jdbcUrl);
		return new Builder().jdbcUrl(jdbcUrl);
	}

	/**
	 * Builds a configuration from {@code PG_HOST}, {@code PG_PORT}, {@code PG_DBNAME}, {@code PG_USER} and
	 * {@code PG_PASSWORD}.
	 * <p>
	 * Pass {@link System#getenv()} to read the process environment.
	 *
	 * @param environment the variables to read from
	 * @return a configuration built from {@code environment}
	 * @throws IllegalArgumentException if any of the keys is missing or the port is not a number
	 */
	@NonNull
	public static DatabaseConfiguration fromEnvironment(@NonNull Map<String, String> environment) {
		requireNonNull(environment);

		List<String> missingKeys = new ArrayList<>();

		for (String key : List.of(HOST_ENVIRONMENT_KEY, PORT_ENVIRONMENT_KEY, DATABASE_NAME_ENVIRONMENT_KEY,
				USER_ENVIRONMENT_KEY, PASSWORD_ENVIRONMENT_KEY))
			if (environment.get(key) == null)
				missingKeys.add(key);

		if (missingKeys.size() > 0)
			throw new IllegalArgumentException(format("Missing required environment variable[s]: %s", String.join(", ", missingKeys)));

		String rawPort = environment.get(PORT_ENVIRONMENT_KEY).trim();
		int port;

		try {
			port = Integer.parseInt(rawPort);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(format("%s value '%s' is not a valid port", PORT_ENVIRONMENT_KEY, rawPort), e);
		}

		return withHost(environment.get(HOST_ENVIRONMENT_KEY))
				.port(port)
				.databaseName(environment.get(DATABASE_NAME_ENVIRONMENT_KEY))
				.user(environment.get(USER_ENVIRONMENT_KEY))
				.password(environment.get(PASSWORD_ENVIRONMENT_KEY))
				.build();
	}

	/**
	 * The URL to hand to the JDBC driver: the explicit one if given, otherwise
	 * {@code jdbc:postgresql://host:port/databaseName}.
	 *
	 * @return the JDBC URL
	 */
	@NonNull
	public String getJdbcUrl() {
		if (this.explicitJdbcUrl != null)
			return this.explicitJdbcUrl;

		return format("jdbc:postgresql://%s:%d/%s", this.host, this.port, this.databaseName);
	}

	/**
	 * Driver properties for {@link java.sql.DriverManager#getConnection(String, Properties)}: the extra properties plus
	 * {@code user} and {@code password}, where given.
	 *
	 * @return a fresh {@link Properties} instance
	 */
	@NonNull
	public Properties toDriverProperties() {
		Properties driverProperties = new Properties();
		driverProperties.putAll(getProperties());

		if (this.user != null)
			driverProperties.setProperty("user", this.user);
		if (this.password != null)
			driverProperties.setProperty("password", this.password);

		return driverProperties;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(4);

		components.add(format("jdbcUrl=%s", getJdbcUrl()));

		getUser().ifPresent(user -> components.add(format("user=%s", user)));

		if (this.password != null)
			components.add("password=[redacted]");

		if (getProperties().size() > 0)
			components.add(format("properties=%s", getProperties().keySet()));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DatabaseConfiguration))
			return false;

		DatabaseConfiguration configuration = (DatabaseConfiguration) object;

		return Objects.equals(getJdbcUrl(), configuration.getJdbcUrl())
				&& Objects.equals(this.user, configuration.user)
				&& Objects.equals(this.password, configuration.password)
				&& Objects.equals(getProperties(), configuration.getProperties());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getJdbcUrl(), this.user, this.password, getProperties());
	}

	@NonNull
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@NonNull
	public Optional<String> getDatabaseName() {
		return Optional.ofNullable(this.databaseName);
	}

	@NonNull
	public Optional<String> getUser() {
		return Optional.ofNullable(this.user);
	}

	/**
	 * @return extra driver properties, in insertion order
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> getProperties() {
		return this.properties;
	}

	/**
	 * Builder used to construct instances of {@link DatabaseConfiguration}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private String host;
		@NonNull
		private Integer port;
		@Nullable
		private String databaseName;
		@Nullable
		private String user;
		@Nullable
		private String password;
		@Nullable
		private String jdbcUrl;
		@NonNull
		private final Map<@NonNull String, @NonNull String> properties;

		private Builder() {
			this.port = DEFAULT_PORT;
			this.properties = new LinkedHashMap<>();
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder databaseName(@Nullable String databaseName) {
			this.databaseName = databaseName;
			return this;
		}

		@NonNull
		public Builder user(@Nullable String user) {
			this.user = user;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		/**
		 * Specifies an explicit JDBC URL, which takes precedence over host, port and database name.
		 *
		 * @param jdbcUrl the JDBC URL, or {@code null} to assemble one
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder jdbcUrl(@Nullable String jdbcUrl) {
			this.jdbcUrl = jdbcUrl;
			return this;
		}

		/**
		 * Adds a driver property, e.g. {@code sslmode} or {@code ApplicationName}.
		 *
		 * @param name  the property name
		 * @param value the property value
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder property(@NonNull String name,
														@NonNull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.properties.put(name, value);
			return this;
		}

		@NonNull
		public DatabaseConfiguration build() {
			return new DatabaseConfiguration(this);
		}
	}
}
