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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes one output column or input parameter of a prepared statement, as reported by the {@link Engine}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnDescriptor {
	@NonNull
	private final SqlType type;
	@NonNull
	private final String label;
	@NonNull
	private final Integer scale;
	@NonNull
	private final Integer length;
	@NonNull
	private final Boolean nullable;

	private ColumnDescriptor(@NonNull Builder builder) {
		requireNonNull(builder);

		this.type = requireNonNull(builder.type);
		this.label = builder.label == null ? "" : builder.label;
		this.scale = builder.scale == null ? 0 : builder.scale;
		this.length = builder.length == null ? 0 : builder.length;
		this.nullable = builder.nullable == null ? true : builder.nullable;

		if (this.scale > 0)
			throw new IllegalArgumentException(format("Scale must be zero or negative, got %d", this.scale));

		if (this.scale < 0 && !this.type.isScalable())
			throw new IllegalArgumentException(format("%s columns cannot have a scale", this.type.name()));
	}

	/**
	 * Creates a {@link ColumnDescriptor} builder for the given type.
	 *
	 * @param type the column type
	 * @return a {@link ColumnDescriptor} builder
	 */
	@NonNull
	public static Builder withType(@NonNull SqlType type) {
		requireNonNull(type);
		return new Builder(type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), getLabel(), getScale(), getLength(), getNullable());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnDescriptor))
			return false;

		ColumnDescriptor columnDescriptor = (ColumnDescriptor) object;

		return Objects.equals(columnDescriptor.getType(), getType())
				&& Objects.equals(columnDescriptor.getLabel(), getLabel())
				&& Objects.equals(columnDescriptor.getScale(), getScale())
				&& Objects.equals(columnDescriptor.getLength(), getLength())
				&& Objects.equals(columnDescriptor.getNullable(), getNullable());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{type=%s, label=%s, scale=%s, length=%s, nullable=%s}", getClass().getSimpleName(),
				getType().name(), getLabel(), getScale(), getLength(), getNullable());
	}

	@NonNull
	public SqlType getType() {
		return this.type;
	}

	/**
	 * The column label (alias if one was given, otherwise the column name); empty for input parameters.
	 *
	 * @return the column label
	 */
	@NonNull
	public String getLabel() {
		return this.label;
	}

	/**
	 * Decimal scale for the exact integer types, expressed as a power of ten: {@code -2} means two digits after the
	 * decimal point. Always {@code 0} for other types.
	 *
	 * @return the decimal scale
	 */
	@NonNull
	public Integer getScale() {
		return this.scale;
	}

	/**
	 * Declared length in characters for text types, {@code 0} when not applicable.
	 *
	 * @return the declared length
	 */
	@NonNull
	public Integer getLength() {
		return this.length;
	}

	@NonNull
	public Boolean getNullable() {
		return this.nullable;
	}

	/**
	 * Builder used to construct instances of {@link ColumnDescriptor}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final SqlType type;
		@Nullable
		private String label;
		@Nullable
		private Integer scale;
		@Nullable
		private Integer length;
		@Nullable
		private Boolean nullable;

		private Builder(@NonNull SqlType type) {
			this.type = requireNonNull(type);
		}

		@NonNull
		public Builder label(@Nullable String label) {
			this.label = label;
			return this;
		}

		@NonNull
		public Builder scale(@Nullable Integer scale) {
			this.scale = scale;
			return this;
		}

		@NonNull
		public Builder length(@Nullable Integer length) {
			this.length = length;
			return this;
		}

		@NonNull
		public Builder nullable(@Nullable Boolean nullable) {
			this.nullable = nullable;
			return this;
		}

		@NonNull
		public ColumnDescriptor build() {
			return new ColumnDescriptor(this);
		}
	}
}
