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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class TypeMarshallerTests {
	private final TypeMarshaller typeMarshaller = new TypeMarshaller(ZoneId.of("UTC"));

	@Test
	public void testDateEncoding() {
		Assertions.assertEquals(0, TypeMarshaller.encodeDate(LocalDate.of(1858, 11, 17)));
		Assertions.assertEquals(40587, TypeMarshaller.encodeDate(LocalDate.of(1970, 1, 1)), "Unix epoch should be day 40587");
		Assertions.assertEquals(-1, TypeMarshaller.encodeDate(LocalDate.of(1858, 11, 16)));
		Assertions.assertEquals(LocalDate.of(2024, 2, 29), TypeMarshaller.decodeDate(TypeMarshaller.encodeDate(LocalDate.of(2024, 2, 29))));
	}

	@Test
	public void testTimeEncoding() {
		Assertions.assertEquals(0, TypeMarshaller.encodeTime(LocalTime.MIDNIGHT));
		Assertions.assertEquals(10_000, TypeMarshaller.encodeTime(LocalTime.of(0, 0, 1)));
		Assertions.assertEquals(12_345, TypeMarshaller.encodeTime(LocalTime.of(0, 0, 1, 234_567_890)),
				"Sub-precision fractions should be truncated");
		Assertions.assertEquals(LocalTime.of(23, 59, 59, 999_900_000), TypeMarshaller.decodeTime((int) TypeMarshaller.TIME_UNITS_PER_DAY - 1));
	}

	@Test
	public void testTimestampEncoding() {
		LocalDateTime timestamp = LocalDateTime.of(2001, 9, 9, 1, 46, 40, 500_000_000);
		long encoded = TypeMarshaller.encodeTimestamp(timestamp);

		Assertions.assertEquals(TypeMarshaller.encodeDate(timestamp.toLocalDate()) * TypeMarshaller.TIME_UNITS_PER_DAY
				+ TypeMarshaller.encodeTime(timestamp.toLocalTime()), encoded);
		Assertions.assertEquals(timestamp, TypeMarshaller.decodeTimestamp(encoded));
		Assertions.assertEquals(LocalDateTime.of(1858, 11, 16, 23, 59, 59), TypeMarshaller.decodeTimestamp(-TypeMarshaller.TIME_UNITS_PER_SECOND),
				"Timestamps before the epoch should decode onto the previous day");
	}

	@Test
	public void testScaledIntegers() {
		ColumnDescriptor money = ColumnDescriptor.withType(SqlType.BIGINT).scale(-2).build();

		Assertions.assertEquals(1234L, typeMarshaller.toNative(money, new BigDecimal("12.34")));
		Assertions.assertEquals(1235L, typeMarshaller.toNative(money, new BigDecimal("12.345")), "Expected half-up rounding");
		Assertions.assertEquals(-345L, typeMarshaller.toNative(money, -3.45));
		Assertions.assertEquals(1200L, typeMarshaller.toNative(money, 12));
		Assertions.assertEquals(99L, typeMarshaller.toNative(money, " 0.99 "));

		Value value = typeMarshaller.fromNative(money, 1234L);
		Assertions.assertEquals(Value.Kind.DECIMAL, value.getKind());
		Assertions.assertEquals(new BigDecimal("12.34"), value.getObject());
		Assertions.assertEquals("12.34", ((Value.DecimalValue) value).asString());
	}

	@Test
	public void testIntegerRanges() {
		ColumnDescriptor smallint = ColumnDescriptor.withType(SqlType.SMALLINT).build();
		ColumnDescriptor integer = ColumnDescriptor.withType(SqlType.INTEGER).build();

		Assertions.assertEquals(32767L, typeMarshaller.toNative(smallint, 32767));
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(smallint, 32768));
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(integer, 3_000_000_000L));
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(integer, Double.NaN));
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(integer, "twelve"));
		Assertions.assertEquals(Value.ofInteger(42), typeMarshaller.fromNative(integer, 42L));
	}

	@Test
	public void testInt128() {
		ColumnDescriptor int128 = ColumnDescriptor.withType(SqlType.INT128).scale(-3).build();
		BigInteger maximum = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

		Assertions.assertEquals(new BigInteger("123456789012345678901234"),
				typeMarshaller.toNative(int128, new BigDecimal("123456789012345678901.234")));
		Assertions.assertEquals(maximum, typeMarshaller.toNative(int128, new BigDecimal(maximum, 3)));
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(int128, new BigDecimal(maximum.add(BigInteger.ONE), 3)));
		Assertions.assertEquals(new BigDecimal("1.500"), typeMarshaller.fromNative(int128, BigInteger.valueOf(1500)).getObject());
	}

	@Test
	public void testDecfloatRounding() {
		ColumnDescriptor decfloat16 = ColumnDescriptor.withType(SqlType.DECFLOAT16).build();
		ColumnDescriptor decfloat34 = ColumnDescriptor.withType(SqlType.DECFLOAT34).build();
		BigDecimal longValue = new BigDecimal("1.2345678901234567890123456789012345678");

		Assertions.assertEquals(16, ((BigDecimal) typeMarshaller.toNative(decfloat16, longValue)).precision());
		Assertions.assertEquals(34, ((BigDecimal) typeMarshaller.toNative(decfloat34, longValue)).precision());
	}

	@Test
	public void testTemporalParameters() {
		ColumnDescriptor date = ColumnDescriptor.withType(SqlType.DATE).build();
		ColumnDescriptor timestamp = ColumnDescriptor.withType(SqlType.TIMESTAMP).build();

		Assertions.assertEquals(TypeMarshaller.encodeDate(LocalDate.of(2020, 5, 17)), typeMarshaller.toNative(date, "2020-05-17"));
		Assertions.assertEquals(TypeMarshaller.encodeDate(LocalDate.of(2020, 5, 17)),
				typeMarshaller.toNative(date, java.sql.Date.valueOf(LocalDate.of(2020, 5, 17))));
		Assertions.assertEquals(TypeMarshaller.encodeTimestamp(LocalDateTime.of(1970, 1, 1, 0, 0)),
				typeMarshaller.toNative(timestamp, Instant.EPOCH), "Instants should be converted in the configured time zone");
		Assertions.assertEquals(TypeMarshaller.encodeTimestamp(LocalDateTime.of(1970, 1, 1, 0, 0)),
				typeMarshaller.toNative(timestamp, Instant.EPOCH.atOffset(ZoneOffset.ofHours(3))));
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(date, "not a date"));
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(date, 12));
	}

	@Test
	public void testTextAndBooleanParameters() {
		ColumnDescriptor varchar = ColumnDescriptor.withType(SqlType.VARCHAR).length(20).build();
		ColumnDescriptor bool = ColumnDescriptor.withType(SqlType.BOOLEAN).build();

		Assertions.assertEquals("1000", typeMarshaller.toNative(varchar, new BigDecimal("1E+3")), "Decimals should be rendered without exponents");
		Assertions.assertEquals("true", typeMarshaller.toNative(varchar, true));
		Assertions.assertEquals("READ_ONLY", typeMarshaller.toNative(varchar, AccessMode.READ_ONLY), "Enums should bind by name");
		Assertions.assertEquals(Boolean.TRUE, typeMarshaller.toNative(bool, Value.ofBoolean(true)), "Values should be unwrapped");
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(bool, "true"));
		Assertions.assertNull(typeMarshaller.toNative(bool, null));
		Assertions.assertNull(typeMarshaller.toNative(bool, Value.nullValue()));
	}

	@Test
	public void testBlobParameters() {
		ColumnDescriptor blob = ColumnDescriptor.withType(SqlType.BLOB).build();

		Assertions.assertEquals(BlobId.of(7), typeMarshaller.toNative(blob, BlobId.of(7)));
		Assertions.assertThrows(ParameterException.class, () -> typeMarshaller.toNative(blob, 7L));
	}

	@Test
	public void testRowConversion() {
		List<ColumnDescriptor> columns = List.of(
				ColumnDescriptor.withType(SqlType.INTEGER).label("ID").build(),
				ColumnDescriptor.withType(SqlType.VARCHAR).label("NAME").build(),
				ColumnDescriptor.withType(SqlType.DATE).label("BORN").build());

		Row row = typeMarshaller.toRow(columns, Arrays.asList(1L, "Ada", null));

		Assertions.assertEquals(3, row.size());
		Assertions.assertEquals(1L, row.getObject(0));
		Assertions.assertEquals("Ada", row.getObject(1));
		Assertions.assertTrue(row.get(2).isNull());
		Assertions.assertThrows(DatabaseException.class, () -> typeMarshaller.toRow(columns, List.of(1L, "Ada")),
				"Arity mismatches should be rejected");
		Assertions.assertThrows(DatabaseException.class, () -> typeMarshaller.fromNative(columns.get(0), "not a long"),
				"Values in the wrong native representation should be rejected");
	}
}
