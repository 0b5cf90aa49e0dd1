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

/**
 * Tabula runs SQL against a JDBC database and moves in-memory {@link com.tabula.Table}s in and out of it, creating
 * schemas and tables on demand.
 *
 * <pre>
 * DatabaseConfiguration configuration = DatabaseConfiguration.fromEnvironment(System.getenv());
 *
 * try (Database database = Database.withConfiguration(configuration).build()) {
 *   // Several statements, one transaction; the last statement's rows come back
 *   Optional&lt;Table&gt; result = database.query("UPDATE account SET active = FALSE WHERE id = 1; SELECT * FROM account");
 *
 *   // Column types are inferred, the schema and table are created if missing
 *   Table cars = Table.withColumnNames("id", "color")
 *     .row(1, "red")
 *     .row(2, "blue")
 *     .build();
 *
 *   database.insertTable(cars, "inventory.car");
 *   Table columns = database.describeTable("inventory.car");
 * }</pre>
 *
 * @since 1.0.0
 */
package com.tabula;
