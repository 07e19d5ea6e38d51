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
 * Column and parameter types as described by an {@link Engine}, along with the native Java representation the engine
 * uses to exchange values of each type with Kindling.
 * <p>
 * SQL {@code NULL} is always exchanged as Java {@code null}, regardless of type.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum SqlType {
	/**
	 * 16-bit integer, exchanged as an unscaled {@link Long}. A negative {@link ColumnDescriptor#getScale()} makes
	 * this a fixed-point numeric.
	 */
	SMALLINT,
	/**
	 * 32-bit integer, exchanged as an unscaled {@link Long}. A negative {@link ColumnDescriptor#getScale()} makes
	 * this a fixed-point numeric.
	 */
	INTEGER,
	/**
	 * 64-bit integer, exchanged as an unscaled {@link Long}. A negative {@link ColumnDescriptor#getScale()} makes
	 * this a fixed-point numeric.
	 */
	BIGINT,
	/**
	 * 128-bit integer, exchanged as an unscaled {@link java.math.BigInteger}. A negative
	 * {@link ColumnDescriptor#getScale()} makes this a fixed-point numeric.
	 */
	INT128,
	/**
	 * 16-digit decimal floating point, exchanged as a {@link java.math.BigDecimal}.
	 */
	DECFLOAT16,
	/**
	 * 34-digit decimal floating point, exchanged as a {@link java.math.BigDecimal}.
	 */
	DECFLOAT34,
	/**
	 * Single-precision floating point, exchanged as a {@link Double}.
	 */
	FLOAT,
	/**
	 * Double-precision floating point, exchanged as a {@link Double}.
	 */
	DOUBLE,
	/**
	 * Date, exchanged as an {@link Integer} count of days since {@code 1858-11-17}.
	 */
	DATE,
	/**
	 * Time of day, exchanged as an {@link Integer} count of ten-thousandths of a second since midnight.
	 */
	TIME,
	/**
	 * Timestamp, exchanged as a {@link Long} equal to {@code days * 864_000_000 + time}, using the {@link #DATE} and
	 * {@link #TIME} encodings.
	 */
	TIMESTAMP,
	/**
	 * Boolean, exchanged as a {@link Boolean}.
	 */
	BOOLEAN,
	/**
	 * Fixed-length text, exchanged as a {@link String} (space-padded by the engine).
	 */
	CHAR,
	/**
	 * Variable-length text, exchanged as a {@link String}.
	 */
	VARCHAR,
	/**
	 * Binary large object, exchanged as a {@link BlobId}.
	 */
	BLOB,
	/**
	 * The type of a literal {@code NULL} expression; values are always {@code null}.
	 */
	NULL;

	/**
	 * Does this type carry an unscaled integer which may have a decimal scale applied?
	 *
	 * @return {@code true} for the exact integer types, {@code false} otherwise
	 */
	public boolean isScalable() {
		return this == SMALLINT || this == INTEGER || this == BIGINT || this == INT128;
	}
}
