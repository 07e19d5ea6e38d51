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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Converts between the engine's native value representations (see {@link SqlType}) and Kindling's {@link Value}
 * model, in both directions.
 * <p>
 * Instances hold no mutable state and perform no I/O.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class TypeMarshaller {
	/**
	 * Day zero of the native {@link SqlType#DATE} encoding.
	 */
	@NonNull
	public static final LocalDate DATE_EPOCH = LocalDate.of(1858, 11, 17);
	/**
	 * Native {@link SqlType#TIME} units per second.
	 */
	public static final long TIME_UNITS_PER_SECOND = 10_000L;
	/**
	 * Native {@link SqlType#TIME} units per day; also the multiplier of the days component of a native
	 * {@link SqlType#TIMESTAMP}.
	 */
	public static final long TIME_UNITS_PER_DAY = 86_400L * TIME_UNITS_PER_SECOND;

	private static final long NANOS_PER_TIME_UNIT = 1_000_000_000L / TIME_UNITS_PER_SECOND;
	@NonNull
	private static final BigInteger INT128_MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
	@NonNull
	private static final BigInteger INT128_MIN = BigInteger.ONE.shiftLeft(127).negate();

	@NonNull
	private final ZoneId timeZone;

	/**
	 * Creates a marshaller which interprets zoned Java types ({@link Date}, {@link Instant} ...) in the given zone.
	 *
	 * @param timeZone the zone in which zoned Java values are converted to local date/time values
	 */
	public TypeMarshaller(@NonNull ZoneId timeZone) {
		this.timeZone = requireNonNull(timeZone);
	}

	/**
	 * Converts a row of native engine values into a {@link Row}.
	 *
	 * @param columns      descriptors of the output columns
	 * @param nativeValues native values, one per column
	 * @return the converted row
	 */
	@NonNull
	public Row toRow(@NonNull List<@NonNull ColumnDescriptor> columns,
									 @NonNull List<@Nullable Object> nativeValues) {
		requireNonNull(columns);
		requireNonNull(nativeValues);

		if (columns.size() != nativeValues.size())
			throw new DatabaseException(format("Engine returned %d values for a statement with %d output columns",
					nativeValues.size(), columns.size()));

		List<Value> values = new ArrayList<>(columns.size());

		for (int i = 0; i < columns.size(); ++i)
			values.add(fromNative(columns.get(i), nativeValues.get(i)));

		return new Row(values);
	}

	/**
	 * Converts one native engine value into a {@link Value}.
	 *
	 * @param column      descriptor of the column the value belongs to
	 * @param nativeValue the native value, {@code null} for SQL {@code NULL}
	 * @return the converted value
	 * @throws DatabaseException if the native value does not match the column's declared native representation
	 */
	@NonNull
	public Value fromNative(@NonNull ColumnDescriptor column,
													@Nullable Object nativeValue) {
		requireNonNull(column);

		if (nativeValue == null)
			return Value.nullValue();

		try {
			switch (column.getType()) {
				case SMALLINT:
				case INTEGER:
				case BIGINT: {
					long unscaled = ((Long) nativeValue).longValue();
					return column.getScale() == 0 ? Value.ofInteger(unscaled) : Value.ofDecimal(BigDecimal.valueOf(unscaled, -column.getScale()));
				}
				case INT128:
					return Value.ofDecimal(new BigDecimal((BigInteger) nativeValue, -column.getScale()));
				case DECFLOAT16:
				case DECFLOAT34:
					return Value.ofDecimal((BigDecimal) nativeValue);
				case FLOAT:
				case DOUBLE:
					return Value.ofFloating(((Double) nativeValue).doubleValue());
				case DATE:
					return Value.ofDate(decodeDate(((Integer) nativeValue).intValue()));
				case TIME:
					return Value.ofTime(decodeTime(((Integer) nativeValue).intValue()));
				case TIMESTAMP:
					return Value.ofTimestamp(decodeTimestamp(((Long) nativeValue).longValue()));
				case BOOLEAN:
					return Value.ofBoolean(((Boolean) nativeValue).booleanValue());
				case CHAR:
				case VARCHAR:
					return Value.ofText((String) nativeValue);
				case BLOB:
					return Value.ofBlob((BlobId) nativeValue);
				case NULL:
					return Value.nullValue();
				default:
					throw new IllegalStateException(format("Unhandled %s value %s", SqlType.class.getSimpleName(), column.getType().name()));
			}
		} catch (ClassCastException e) {
			throw new DatabaseException(format("Engine returned a %s for %s, which is not its native representation",
					nativeValue.getClass().getName(), column), e);
		}
	}

	/**
	 * Converts a Java parameter value into the engine's native representation for the given parameter descriptor.
	 * <p>
	 * {@link Value} instances are unwrapped first. Blob-typed parameters accept only a {@link BlobId} here; callers
	 * are responsible for turning byte content into a blob beforehand.
	 *
	 * @param parameter descriptor of the input parameter
	 * @param value     the Java value, may be {@code null}
	 * @return the native value, or {@code null} for SQL {@code NULL}
	 * @throws ParameterException if the value cannot be represented as the parameter's type
	 */
	@Nullable
	public Object toNative(@NonNull ColumnDescriptor parameter,
												 @Nullable Object value) {
		requireNonNull(parameter);

		Object normalizedValue = normalizeParameter(value);

		if (normalizedValue == null)
			return null;

		switch (parameter.getType()) {
			case SMALLINT:
				return toUnscaledLong(parameter, normalizedValue, Short.MIN_VALUE, Short.MAX_VALUE);
			case INTEGER:
				return toUnscaledLong(parameter, normalizedValue, Integer.MIN_VALUE, Integer.MAX_VALUE);
			case BIGINT:
				return toUnscaledLong(parameter, normalizedValue, Long.MIN_VALUE, Long.MAX_VALUE);
			case INT128: {
				BigInteger unscaled = toUnscaled(parameter, normalizedValue);

				if (unscaled.compareTo(INT128_MIN) < 0 || unscaled.compareTo(INT128_MAX) > 0)
					throw outOfRange(parameter, normalizedValue);

				return unscaled;
			}
			case DECFLOAT16:
				return toBigDecimal(parameter, normalizedValue).round(MathContext.DECIMAL64);
			case DECFLOAT34:
				return toBigDecimal(parameter, normalizedValue).round(MathContext.DECIMAL128);
			case FLOAT:
			case DOUBLE:
				return toDouble(parameter, normalizedValue);
			case DATE:
				return encodeDate(toLocalDate(parameter, normalizedValue));
			case TIME:
				return encodeTime(toLocalTime(parameter, normalizedValue));
			case TIMESTAMP:
				return encodeTimestamp(toLocalDateTime(parameter, normalizedValue));
			case BOOLEAN:
				if (normalizedValue instanceof Boolean)
					return normalizedValue;

				throw unsupported(parameter, normalizedValue);
			case CHAR:
			case VARCHAR:
				return toText(parameter, normalizedValue);
			case BLOB:
				if (normalizedValue instanceof BlobId)
					return normalizedValue;

				throw unsupported(parameter, normalizedValue);
			case NULL:
				throw unsupported(parameter, normalizedValue);
			default:
				throw new IllegalStateException(format("Unhandled %s value %s", SqlType.class.getSimpleName(), parameter.getType().name()));
		}
	}

	/**
	 * Massages a parameter into one of the handful of Java types the conversion rules understand.
	 *
	 * @param parameter the parameter to (possibly) massage
	 * @return the result of the massaging process
	 */
	@Nullable
	Object normalizeParameter(@Nullable Object parameter) {
		if (parameter instanceof Value value)
			parameter = value.getObject();

		if (parameter == null)
			return null;

		// Coerce to java.time whenever possible
		if (parameter instanceof java.sql.Timestamp timestamp)
			return timestamp.toLocalDateTime();
		if (parameter instanceof java.sql.Date date)
			return date.toLocalDate();
		if (parameter instanceof java.sql.Time time)
			return time.toLocalTime();
		if (parameter instanceof Date date)
			return LocalDateTime.ofInstant(Instant.ofEpochMilli(date.getTime()), getTimeZone());
		if (parameter instanceof Instant instant)
			return LocalDateTime.ofInstant(instant, getTimeZone());
		if (parameter instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.withZoneSameInstant(getTimeZone()).toLocalDateTime();
		if (parameter instanceof OffsetDateTime offsetDateTime)
			return offsetDateTime.atZoneSameInstant(getTimeZone()).toLocalDateTime();
		if (parameter instanceof Enum)
			return ((Enum<?>) parameter).name();

		return parameter;
	}

	@NonNull
	public static LocalDate decodeDate(int days) {
		return DATE_EPOCH.plusDays(days);
	}

	public static int encodeDate(@NonNull LocalDate date) {
		requireNonNull(date);
		return Math.toIntExact(ChronoUnit.DAYS.between(DATE_EPOCH, date));
	}

	@NonNull
	public static LocalTime decodeTime(int units) {
		return LocalTime.ofNanoOfDay(units * NANOS_PER_TIME_UNIT);
	}

	public static int encodeTime(@NonNull LocalTime time) {
		requireNonNull(time);
		return (int) (time.toNanoOfDay() / NANOS_PER_TIME_UNIT);
	}

	@NonNull
	public static LocalDateTime decodeTimestamp(long value) {
		return LocalDateTime.of(decodeDate((int) Math.floorDiv(value, TIME_UNITS_PER_DAY)),
				decodeTime((int) Math.floorMod(value, TIME_UNITS_PER_DAY)));
	}

	public static long encodeTimestamp(@NonNull LocalDateTime timestamp) {
		requireNonNull(timestamp);
		return encodeDate(timestamp.toLocalDate()) * TIME_UNITS_PER_DAY + encodeTime(timestamp.toLocalTime());
	}

	@NonNull
	private Long toUnscaledLong(@NonNull ColumnDescriptor parameter,
															@NonNull Object value,
															long minimum,
															long maximum) {
		BigInteger unscaled = toUnscaled(parameter, value);

		if (unscaled.bitLength() > 63)
			throw outOfRange(parameter, value);

		long unscaledLong = unscaled.longValue();

		if (unscaledLong < minimum || unscaledLong > maximum)
			throw outOfRange(parameter, value);

		return unscaledLong;
	}

	@NonNull
	private BigInteger toUnscaled(@NonNull ColumnDescriptor parameter,
																@NonNull Object value) {
		return toBigDecimal(parameter, value)
				.setScale(-parameter.getScale(), RoundingMode.HALF_UP)
				.unscaledValue();
	}

	@NonNull
	private BigDecimal toBigDecimal(@NonNull ColumnDescriptor parameter,
																	@NonNull Object value) {
		if (value instanceof BigDecimal bigDecimal)
			return bigDecimal;
		if (value instanceof BigInteger bigInteger)
			return new BigDecimal(bigInteger);
		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
			return BigDecimal.valueOf(((Number) value).longValue());
		if (value instanceof Double || value instanceof Float) {
			double doubleValue = ((Number) value).doubleValue();

			if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue))
				throw outOfRange(parameter, value);

			// Decimal string form, so -3.45 stays -3.45 rather than its binary expansion
			return new BigDecimal(value.toString());
		}
		if (value instanceof String string) {
			try {
				return new BigDecimal(string.trim());
			} catch (NumberFormatException e) {
				throw new ParameterException(format("Unable to convert '%s' to %s", string, describe(parameter)), e);
			}
		}

		throw unsupported(parameter, value);
	}

	@NonNull
	private Double toDouble(@NonNull ColumnDescriptor parameter,
													@NonNull Object value) {
		if (value instanceof Number number)
			return number.doubleValue();

		if (value instanceof String string) {
			try {
				return Double.parseDouble(string.trim());
			} catch (NumberFormatException e) {
				throw new ParameterException(format("Unable to convert '%s' to %s", string, describe(parameter)), e);
			}
		}

		throw unsupported(parameter, value);
	}

	@NonNull
	private LocalDate toLocalDate(@NonNull ColumnDescriptor parameter,
																@NonNull Object value) {
		if (value instanceof LocalDate localDate)
			return localDate;
		if (value instanceof LocalDateTime localDateTime)
			return localDateTime.toLocalDate();
		if (value instanceof String string)
			return parse(parameter, string, () -> LocalDate.parse(string.trim()));

		throw unsupported(parameter, value);
	}

	@NonNull
	private LocalTime toLocalTime(@NonNull ColumnDescriptor parameter,
																@NonNull Object value) {
		if (value instanceof LocalTime localTime)
			return localTime;
		if (value instanceof LocalDateTime localDateTime)
			return localDateTime.toLocalTime();
		if (value instanceof String string)
			return parse(parameter, string, () -> LocalTime.parse(string.trim()));

		throw unsupported(parameter, value);
	}

	@NonNull
	private LocalDateTime toLocalDateTime(@NonNull ColumnDescriptor parameter,
																				@NonNull Object value) {
		if (value instanceof LocalDateTime localDateTime)
			return localDateTime;
		if (value instanceof LocalDate localDate)
			return localDate.atStartOfDay();
		if (value instanceof String string)
			return parse(parameter, string, () -> LocalDateTime.parse(string.trim()));

		throw unsupported(parameter, value);
	}

	@NonNull
	private String toText(@NonNull ColumnDescriptor parameter,
												@NonNull Object value) {
		if (value instanceof String string)
			return string;
		if (value instanceof BigDecimal bigDecimal)
			return bigDecimal.toPlainString();
		if (value instanceof Number || value instanceof Boolean || value instanceof Character
				|| value instanceof LocalDate || value instanceof LocalTime || value instanceof LocalDateTime)
			return value.toString();

		throw unsupported(parameter, value);
	}

	@NonNull
	private <T> T parse(@NonNull ColumnDescriptor parameter,
											@NonNull String string,
											@NonNull TemporalParser<T> temporalParser) {
		try {
			return temporalParser.parse();
		} catch (DateTimeParseException e) {
			throw new ParameterException(format("Unable to convert '%s' to %s", string, describe(parameter)), e);
		}
	}

	@NonNull
	private ParameterException unsupported(@NonNull ColumnDescriptor parameter,
																				 @NonNull Object value) {
		return new ParameterException(format("Unable to bind a value of type %s to %s",
				value.getClass().getName(), describe(parameter)));
	}

	@NonNull
	private ParameterException outOfRange(@NonNull ColumnDescriptor parameter,
																				@NonNull Object value) {
		return new ParameterException(format("Value %s is out of range for %s", value, describe(parameter)));
	}

	@NonNull
	private String describe(@NonNull ColumnDescriptor parameter) {
		return parameter.getScale() == 0
				? parameter.getType().name()
				: format("%s with scale %d", parameter.getType().name(), parameter.getScale());
	}

	@NonNull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	@FunctionalInterface
	private interface TemporalParser<T> {
		@NonNull
		T parse();
	}
}
