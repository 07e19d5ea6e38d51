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

package com.kindling;

/**
 * Isolation levels a {@link Transaction} can be started with.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum TransactionIsolation {
	/**
	 * Sees a stable snapshot of the database as of transaction start. The default.
	 */
	SNAPSHOT,

	/**
	 * Sees changes committed by other transactions as soon as they are committed.
	 */
	READ_COMMITTED,

	/**
	 * Snapshot with table-level locks: fully serialized access to the tables touched.
	 */
	CONSISTENCY
}
