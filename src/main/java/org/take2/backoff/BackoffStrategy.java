/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.take2.backoff;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.springframework.util.Assert;
import org.take2.InvalidConfigurationValueException;
import org.take2.UnknownConfigurationKeyException;

/**
 * Immutable descriptor of a backoff table: the {@link BackoffStrategyKind kind}, the
 * start value, the growth factor (linear only) and the time unit the values are
 * expressed in. Tables are built from it by {@link BackoffGenerator}.
 *
 * 回退策略描述
 */
public final class BackoffStrategy {

	public static final String KIND = "kind";

	public static final String START = "start";

	public static final String FACTOR = "factor";

	public static final long DEFAULT_START = 1;

	public static final long DEFAULT_FACTOR = 1;

	private final BackoffStrategyKind kind;

	private final long start;

	private final long factor;

	private final TimeUnit unit;

	private BackoffStrategy(BackoffStrategyKind kind, long start, long factor, TimeUnit unit) {
		Assert.notNull(kind, "Backoff kind must not be null");
		Assert.notNull(unit, "Backoff unit must not be null");
		if (start < 0) {
			throw new InvalidConfigurationValueException(START, "must not be negative, was " + start);
		}
		if (factor < 0) {
			throw new InvalidConfigurationValueException(FACTOR, "must not be negative, was " + factor);
		}
		// 等待以毫秒为单位，更细的单位会被截断为0
		if (unit.compareTo(TimeUnit.MILLISECONDS) < 0) {
			throw new InvalidConfigurationValueException("unit", "must be milliseconds or coarser, was " + unit);
		}
		this.kind = kind;
		this.start = start;
		this.factor = factor;
		this.unit = unit;
	}

	public static BackoffStrategy constant(long start) {
		return new BackoffStrategy(BackoffStrategyKind.CONSTANT, start, DEFAULT_FACTOR, TimeUnit.SECONDS);
	}

	public static BackoffStrategy linear(long start, long factor) {
		return new BackoffStrategy(BackoffStrategyKind.LINEAR, start, factor, TimeUnit.SECONDS);
	}

	public static BackoffStrategy fibonacci(long start) {
		return new BackoffStrategy(BackoffStrategyKind.FIBONACCI, start, DEFAULT_FACTOR, TimeUnit.SECONDS);
	}

	public static BackoffStrategy exponential(long start) {
		return new BackoffStrategy(BackoffStrategyKind.EXPONENTIAL, start, DEFAULT_FACTOR, TimeUnit.SECONDS);
	}

	public static BackoffStrategy of(BackoffStrategyKind kind, long start, long factor) {
		return new BackoffStrategy(kind, start, factor, TimeUnit.SECONDS);
	}

	/**
	 * @param kind the declared kind name, e.g. {@code "fibonacci"}
	 * @param start the start value in seconds
	 * @return a new strategy
	 * @throws InvalidStrategyKindException if the kind is not recognised
	 */
	public static BackoffStrategy of(String kind, long start) {
		return of(kind, start, DEFAULT_FACTOR);
	}

	public static BackoffStrategy of(String kind, long start, long factor) {
		return new BackoffStrategy(BackoffStrategyKind.fromName(kind), start, factor, TimeUnit.SECONDS);
	}

	/**
	 * Build a strategy from a declaration of the form
	 * {@code {kind: "exponential", start: 3, factor: 1}}. {@code kind} is required,
	 * {@code start} and {@code factor} default to 1.
	 * @param options the declaration
	 * @return a new strategy
	 */
	public static BackoffStrategy fromOptions(Map<String, ?> options) {
		Assert.notNull(options, "Backoff options must not be null");
		Object kind = null;
		long start = DEFAULT_START;
		long factor = DEFAULT_FACTOR;
		for (Map.Entry<String, ?> entry : options.entrySet()) {
			String key = entry.getKey();
			if (KIND.equals(key)) {
				kind = entry.getValue();
			}
			else if (START.equals(key)) {
				start = toLong(START, entry.getValue());
			}
			else if (FACTOR.equals(key)) {
				factor = toLong(FACTOR, entry.getValue());
			}
			else {
				throw new UnknownConfigurationKeyException(key);
			}
		}
		if (kind instanceof BackoffStrategyKind) {
			return of((BackoffStrategyKind) kind, start, factor);
		}
		return of(kind != null ? kind.toString() : null, start, factor);
	}

	private static long toLong(String field, Object value) {
		if (!(value instanceof Number)) {
			throw new InvalidConfigurationValueException(field, "must be a number, was " + value);
		}
		return ((Number) value).longValue();
	}

	/**
	 * @param unit the unit the start value and generated intervals are expressed in,
	 * milliseconds or coarser
	 * @return a copy of this strategy using the given unit
	 * @throws InvalidConfigurationValueException if the unit is finer than milliseconds
	 */
	public BackoffStrategy withUnit(TimeUnit unit) {
		return new BackoffStrategy(this.kind, this.start, this.factor, unit);
	}

	public BackoffStrategyKind getKind() {
		return this.kind;
	}

	public long getStart() {
		return this.start;
	}

	public long getFactor() {
		return this.factor;
	}

	public TimeUnit getUnit() {
		return this.unit;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof BackoffStrategy)) {
			return false;
		}
		BackoffStrategy that = (BackoffStrategy) other;
		return this.kind == that.kind && this.start == that.start && this.factor == that.factor
				&& this.unit == that.unit;
	}

	@Override
	public int hashCode() {
		int result = this.kind.hashCode();
		result = 31 * result + Long.hashCode(this.start);
		result = 31 * result + Long.hashCode(this.factor);
		return 31 * result + this.unit.hashCode();
	}

	@Override
	public String toString() {
		return "BackoffStrategy[kind=" + this.kind.getName() + ", start=" + this.start + ", factor=" + this.factor
				+ ", unit=" + this.unit + "]";
	}

}
