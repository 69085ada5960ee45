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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.util.Assert;

/**
 * Builds backoff tables: ordered lists of the intervals to wait before each retry. The
 * interval at index {@code i} is the wait before retry {@code i + 1}.
 * <p>
 * Constant, linear and fibonacci tables are deterministic. Exponential tables add
 * random jitter so that callers failing together do not retry together; the value at
 * (1-based) position {@code i > 1} lies in {@code [2^i - 1, 2^(i+1) - 1)}.
 *
 * 回退间隔表生成器
 */
public final class BackoffGenerator {

	/**
	 * Number of intervals generated when no retry count is given.
	 */
	public static final int DEFAULT_TABLE_SIZE = 10;

	// 2^62 - 1 + (2^62 - 1) is the largest jittered value that still fits in a long
	static final int MAX_EXPONENTIAL_POSITION = 62;

	private BackoffGenerator() {
	}

	/**
	 * @param strategy the strategy descriptor
	 * @return a table of {@link #DEFAULT_TABLE_SIZE} intervals
	 */
	public static List<Duration> generate(BackoffStrategy strategy) {
		return generate(strategy, DEFAULT_TABLE_SIZE);
	}

	/**
	 * @param kind the strategy name, one of constant, linear, fibonacci, exponential
	 * @param start the start value in seconds
	 * @param factor the growth factor of linear tables
	 * @param retries the number of intervals to produce
	 * @return the table
	 * @throws InvalidStrategyKindException if the kind is not recognised
	 * @throws BackoffTableTooShortException if the strategy cannot produce that many
	 * intervals
	 */
	public static List<Duration> generate(String kind, long start, long factor, int retries) {
		return generate(BackoffStrategy.of(kind, start, factor), retries);
	}

	/**
	 * @param strategy the strategy descriptor
	 * @param retries the number of intervals to produce
	 * @return an unmodifiable table of exactly {@code retries} intervals
	 * @throws BackoffTableTooShortException if the strategy cannot produce that many
	 * intervals
	 */
	public static List<Duration> generate(BackoffStrategy strategy, int retries) {
		Assert.notNull(strategy, "Backoff strategy must not be null");
		Assert.isTrue(retries >= 0, "Number of retries must not be negative");
		long[] values;
		switch (strategy.getKind()) {
			case CONSTANT:
				values = constant(strategy.getStart(), retries);
				break;
			case LINEAR:
				values = linear(strategy.getStart(), strategy.getFactor(), retries);
				break;
			case FIBONACCI:
				values = fibonacci(strategy.getStart(), retries);
				break;
			case EXPONENTIAL:
				values = exponential(strategy.getStart(), retries);
				break;
			default:
				throw new InvalidStrategyKindException(strategy.getKind().getName());
		}
		return toDurations(strategy, values);
	}

	private static long[] constant(long start, int retries) {
		long[] values = new long[retries];
		for (int i = 0; i < retries; i++) {
			values[i] = start;
		}
		return values;
	}

	private static long[] linear(long start, long factor, int retries) {
		long[] values = new long[retries];
		for (int i = 0; i < retries; i++) {
			try {
				values[i] = Math.multiplyExact(Math.addExact(start, i), factor);
			}
			catch (ArithmeticException ex) {
				throw new BackoffTableTooShortException(BackoffStrategyKind.LINEAR, retries, i, ex);
			}
		}
		return values;
	}

	private static long[] fibonacci(long start, int retries) {
		long[] values = new long[retries];
		int count = 0;
		long previous = 0;
		long current = 1;
		while (count < retries) {
			if (current >= start) {
				values[count++] = current;
				if (count == retries) {
					break;
				}
			}
			try {
				long next = Math.addExact(previous, current);
				previous = current;
				current = next;
			}
			catch (ArithmeticException ex) {
				throw new BackoffTableTooShortException(BackoffStrategyKind.FIBONACCI, retries, count, ex);
			}
		}
		return values;
	}

	private static long[] exponential(long start, int retries) {
		if (retries > MAX_EXPONENTIAL_POSITION) {
			throw new BackoffTableTooShortException(BackoffStrategyKind.EXPONENTIAL, retries,
					MAX_EXPONENTIAL_POSITION);
		}
		long[] values = new long[retries];
		ThreadLocalRandom random = ThreadLocalRandom.current();
		for (int i = 0; i < retries; i++) {
			int position = i + 1;
			if (position == 1) {
				values[i] = start;
			}
			else {
				long power = 1L << position;
				values[i] = (power - 1) + random.nextLong(1, power);
			}
		}
		return values;
	}

	private static List<Duration> toDurations(BackoffStrategy strategy, long[] values) {
		List<Duration> intervals = new ArrayList<Duration>(values.length);
		for (int i = 0; i < values.length; i++) {
			try {
				intervals.add(Duration.of(values[i], strategy.getUnit().toChronoUnit()));
			}
			catch (ArithmeticException ex) {
				throw new BackoffTableTooShortException(strategy.getKind(), values.length, i, ex);
			}
		}
		return Collections.unmodifiableList(intervals);
	}

}
