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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A typed column value: a closed set of cases, one per {@link Kind}.
 * <p>
 * Values are produced by {@link TypeMarshaller} from the engine's native representations and are exposed through
 * {@link Row}. Values may also be passed as statement parameters, in which case they are unwrapped via
 * {@link #getObject()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public sealed abstract class Value permits Value.NullValue, Value.IntegerValue, Value.DecimalValue, Value.FloatingValue,
		Value.BooleanValue, Value.TextValue, Value.DateValue, Value.TimeValue, Value.TimestampValue, Value.BlobValue {
	/**
	 * The cases of {@link Value}.
	 */
	public enum Kind {
		NULL,
		INTEGER,
		DECIMAL,
		FLOATING,
		BOOLEAN,
		TEXT,
		DATE,
		TIME,
		TIMESTAMP,
		BLOB
	}

	private Value() {}

	@NonNull
	public static Value nullValue() {
		return NullValue.INSTANCE;
	}

	@NonNull
	public static Value ofInteger(long value) {
		return new IntegerValue(value);
	}

	@NonNull
	public static Value ofDecimal(@NonNull BigDecimal value) {
		return new DecimalValue(value);
	}

	@NonNull
	public static Value ofFloating(double value) {
		return new FloatingValue(value);
	}

	@NonNull
	public static Value ofBoolean(boolean value) {
		return value ? BooleanValue.TRUE : BooleanValue.FALSE;
	}

	@NonNull
	public static Value ofText(@NonNull String value) {
		return new TextValue(value);
	}

	@NonNull
	public static Value ofDate(@NonNull LocalDate value) {
		return new DateValue(value);
	}

	@NonNull
	public static Value ofTime(@NonNull LocalTime value) {
		return new TimeValue(value);
	}

	@NonNull
	public static Value ofTimestamp(@NonNull LocalDateTime value) {
		return new TimestampValue(value);
	}

	@NonNull
	public static Value ofBlob(@NonNull BlobId value) {
		return new BlobValue(value);
	}

	/**
	 * Which case of {@link Value} is this?
	 *
	 * @return the kind of this value
	 */
	@NonNull
	public abstract Kind getKind();

	/**
	 * The plain Java representation of this value: {@link Long}, {@link BigDecimal}, {@link Double}, {@link Boolean},
	 * {@link String}, {@link LocalDate}, {@link LocalTime}, {@link LocalDateTime}, {@link BlobId} or {@code null}.
	 *
	 * @return the Java representation of this value
	 */
	@Nullable
	public abstract Object getObject();

	public boolean isNull() {
		return getKind() == Kind.NULL;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getKind(), getObject());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Value))
			return false;

		Value value = (Value) object;

		return value.getKind() == getKind() && Objects.equals(value.getObject(), getObject());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{%s}", getKind().name(), getObject());
	}

	@ThreadSafe
	public static final class NullValue extends Value {
		static final NullValue INSTANCE = new NullValue();

		private NullValue() {}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.NULL;
		}

		@Override
		@Nullable
		public Object getObject() {
			return null;
		}
	}

	@ThreadSafe
	public static final class IntegerValue extends Value {
		private final long value;

		private IntegerValue(long value) {
			this.value = value;
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.INTEGER;
		}

		@Override
		@NonNull
		public Long getObject() {
			return this.value;
		}

		public long getValue() {
			return this.value;
		}
	}

	/**
	 * Exact decimal: fixed-point numerics, 128-bit integers and decimal floating point.
	 */
	@ThreadSafe
	public static final class DecimalValue extends Value {
		@NonNull
		private final BigDecimal value;

		private DecimalValue(@NonNull BigDecimal value) {
			this.value = requireNonNull(value);
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.DECIMAL;
		}

		@Override
		@NonNull
		public BigDecimal getObject() {
			return this.value;
		}

		/**
		 * The exact decimal in plain (non-scientific) notation, e.g. {@code -45699999999999999999999999999999999.87}.
		 *
		 * @return the decimal as a string
		 */
		@NonNull
		public String asString() {
			return this.value.toPlainString();
		}
	}

	@ThreadSafe
	public static final class FloatingValue extends Value {
		private final double value;

		private FloatingValue(double value) {
			this.value = value;
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.FLOATING;
		}

		@Override
		@NonNull
		public Double getObject() {
			return this.value;
		}

		public double getValue() {
			return this.value;
		}
	}

	@ThreadSafe
	public static final class BooleanValue extends Value {
		static final BooleanValue TRUE = new BooleanValue(true);
		static final BooleanValue FALSE = new BooleanValue(false);

		private final boolean value;

		private BooleanValue(boolean value) {
			this.value = value;
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.BOOLEAN;
		}

		@Override
		@NonNull
		public Boolean getObject() {
			return this.value;
		}

		public boolean getValue() {
			return this.value;
		}
	}

	@ThreadSafe
	public static final class TextValue extends Value {
		@NonNull
		private final String value;

		private TextValue(@NonNull String value) {
			this.value = requireNonNull(value);
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.TEXT;
		}

		@Override
		@NonNull
		public String getObject() {
			return this.value;
		}
	}

	@ThreadSafe
	public static final class DateValue extends Value {
		@NonNull
		private final LocalDate value;

		private DateValue(@NonNull LocalDate value) {
			this.value = requireNonNull(value);
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.DATE;
		}

		@Override
		@NonNull
		public LocalDate getObject() {
			return this.value;
		}
	}

	@ThreadSafe
	public static final class TimeValue extends Value {
		@NonNull
		private final LocalTime value;

		private TimeValue(@NonNull LocalTime value) {
			this.value = requireNonNull(value);
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.TIME;
		}

		@Override
		@NonNull
		public LocalTime getObject() {
			return this.value;
		}
	}

	@ThreadSafe
	public static final class TimestampValue extends Value {
		@NonNull
		private final LocalDateTime value;

		private TimestampValue(@NonNull LocalDateTime value) {
			this.value = requireNonNull(value);
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.TIMESTAMP;
		}

		@Override
		@NonNull
		public LocalDateTime getObject() {
			return this.value;
		}
	}

	/**
	 * Reference to a blob; read its content via {@link Attachment#openBlob(Transaction, BlobId)}.
	 */
	@ThreadSafe
	public static final class BlobValue extends Value {
		@NonNull
		private final BlobId value;

		private BlobValue(@NonNull BlobId value) {
			this.value = requireNonNull(value);
		}

		@Override
		@NonNull
		public Kind getKind() {
			return Kind.BLOB;
		}

		@Override
		@NonNull
		public BlobId getObject() {
			return this.value;
		}
	}
}
