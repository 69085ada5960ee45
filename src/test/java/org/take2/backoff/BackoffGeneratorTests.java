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
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class BackoffGeneratorTests {

	@Test
	public void constantRepeatsTheStartValue() {
		List<Duration> intervals = BackoffGenerator.generate("constant", 3, 1, 10);
		assertThat(intervals).hasSize(10).containsOnly(Duration.ofSeconds(3));
	}

	@Test
	public void defaultTableSizeIsTen() {
		assertThat(BackoffGenerator.generate(BackoffStrategy.constant(3))).hasSize(BackoffGenerator.DEFAULT_TABLE_SIZE);
	}

	@Test
	public void linearGrowsByFactor() {
		assertThat(BackoffGenerator.generate("linear", 1, 2, 4)).containsExactly(seconds(2, 4, 6, 8));
	}

	@Test
	public void linearStartsCountingFromTheStartValue() {
		assertThat(BackoffGenerator.generate(BackoffStrategy.linear(3, 1), 3)).containsExactly(seconds(3, 4, 5));
	}

	@Test
	public void fibonacciSkipsValuesBelowStart() {
		assertThat(BackoffGenerator.generate(BackoffStrategy.fibonacci(3), 5)).containsExactly(seconds(3, 5, 8, 13, 21));
	}

	@Test
	public void fibonacciFromZeroKeepsTheLeadingOnes() {
		assertThat(BackoffGenerator.generate(BackoffStrategy.fibonacci(0), 6)).containsExactly(seconds(1, 1, 2, 3, 5, 8));
	}

	@Test
	public void fibonacciGoesBeyondTwentyTerms() {
		List<Duration> intervals = BackoffGenerator.generate(BackoffStrategy.fibonacci(1), 30);
		assertThat(intervals).hasSize(30);
		assertThat(intervals.get(29)).isEqualTo(Duration.ofSeconds(832040));
	}

	@Test
	public void fibonacciFailsWhenTermsOverflow() {
		assertThatExceptionOfType(BackoffTableTooShortException.class)
			.isThrownBy(() -> BackoffGenerator.generate(BackoffStrategy.fibonacci(1), 100));
	}

	@Test
	public void exponentialStaysWithinJitterBounds() {
		for (int run = 0; run < 20; run++) {
			List<Duration> intervals = BackoffGenerator.generate(BackoffStrategy.exponential(3), 10);
			assertThat(intervals).hasSize(10);
			assertThat(intervals.get(0)).isEqualTo(Duration.ofSeconds(3));
			for (int i = 1; i < intervals.size(); i++) {
				int position = i + 1;
				long value = intervals.get(i).getSeconds();
				assertThat(value).isGreaterThanOrEqualTo((1L << position) - 1).isLessThan((1L << (position + 1)) - 1);
			}
		}
	}

	@Test
	public void exponentialFailsBeyondLongRange() {
		assertThat(BackoffGenerator.generate(BackoffStrategy.exponential(1), 62)).hasSize(62);
		assertThatExceptionOfType(BackoffTableTooShortException.class)
			.isThrownBy(() -> BackoffGenerator.generate(BackoffStrategy.exponential(1), 63));
	}

	@Test
	public void unknownKindIsRejected() {
		assertThatExceptionOfType(InvalidStrategyKindException.class)
			.isThrownBy(() -> BackoffGenerator.generate("quadratic", 1, 1, 3))
			.satisfies(ex -> assertThat(ex.getKind()).isEqualTo("quadratic"));
	}

	@Test
	public void zeroRetriesGiveAnEmptyTable() {
		assertThat(BackoffGenerator.generate(BackoffStrategy.fibonacci(5), 0)).isEmpty();
	}

	@Test
	public void negativeRetriesAreRejected() {
		assertThatIllegalArgumentException().isThrownBy(() -> BackoffGenerator.generate(BackoffStrategy.constant(1), -1));
	}

	@Test
	public void unitIsApplied() {
		List<Duration> intervals = BackoffGenerator.generate(BackoffStrategy.constant(250).withUnit(TimeUnit.MILLISECONDS), 2);
		assertThat(intervals).containsExactly(Duration.ofMillis(250), Duration.ofMillis(250));
	}

	@Test
	public void tablesAreUnmodifiable() {
		List<Duration> intervals = BackoffGenerator.generate(BackoffStrategy.constant(1), 2);
		assertThatExceptionOfType(UnsupportedOperationException.class)
			.isThrownBy(() -> intervals.add(Duration.ZERO));
	}

	private static Duration[] seconds(long... values) {
		Duration[] durations = new Duration[values.length];
		for (int i = 0; i < values.length; i++) {
			durations[i] = Duration.ofSeconds(values[i]);
		}
		return durations;
	}

}
