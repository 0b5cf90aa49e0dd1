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
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/**
 * {@link ConnectionFactory} which opens connections with {@link DriverManager}, passing the configuration's JDBC URL
 * and driver properties.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultConnectionFactory implements ConnectionFactory {
	@Override
	@NonNull
	public Connection connect(@NonNull DatabaseConfiguration configuration) throws SQLException {
		requireNonNull(configuration);
		return DriverManager.getConnection(configuration.getJdbcUrl(), configuration.toDriverProperties());
	}
}
