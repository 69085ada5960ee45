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

package org.take2.support;

import java.io.IOException;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;
import org.take2.InvalidConfigurationValueException;
import org.take2.RetriableResponseException;
import org.take2.RetryHook;
import org.take2.UnknownConfigurationKeyException;
import org.take2.backoff.BackoffStrategy;
import org.take2.backoff.DummySleeper;
import org.take2.config.RetryDefaults;
import org.take2.config.RetryOverrides;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class RetryTemplateTests {

	private final DummySleeper sleeper = new DummySleeper();

	private RetryTemplate template;

	@Before
	public void setUp() {
		RetryDefaults.reset();
		this.template = new RetryTemplate();
		this.template.setSleeper(this.sleeper);
	}

	@After
	public void tearDown() {
		RetryDefaults.reset();
	}

	@Test
	public void successfulCallRunsOnce() throws Exception {
		AtomicInteger attempts = new AtomicInteger();
		String result = this.template.execute(context -> {
			attempts.incrementAndGet();
			return "ok";
		});
		assertThat(result).isEqualTo("ok");
		assertThat(attempts.get()).isEqualTo(1);
		assertThat(this.sleeper.getBackOffs()).isEmpty();
	}

	@Test
	public void nonRetriableFailureIsRethrownAfterOneAttempt() {
		IllegalArgumentException failure = new IllegalArgumentException("bad input");
		AtomicInteger attempts = new AtomicInteger();
		Throwable thrown = catchThrowable(() -> this.template.execute(context -> {
			attempts.incrementAndGet();
			throw failure;
		}));
		assertThat(thrown).isSameAs(failure);
		assertThat(attempts.get()).isEqualTo(1);
		assertThat(this.sleeper.getBackOffs()).isEmpty();
	}

	@Test
	public void retriableFailureExhaustsTheRetries() {
		RetryHook hook = mock(RetryHook.class);
		this.template.setOnRetry(hook);
		SocketException failure = new SocketException("connection reset");
		AtomicInteger attempts = new AtomicInteger();
		Throwable thrown = catchThrowable(() -> this.template.execute(context -> {
			attempts.incrementAndGet();
			throw failure;
		}));
		assertThat(thrown).isSameAs(failure);
		assertThat(attempts.get()).isEqualTo(4);
		InOrder order = inOrder(hook);
		order.verify(hook).onRetry(same(failure), eq(3));
		order.verify(hook).onRetry(same(failure), eq(2));
		order.verify(hook).onRetry(same(failure), eq(1));
		order.verifyNoMoreInteractions();
		assertThat(this.sleeper.getBackOffs()).containsExactly(3000L, 3000L, 3000L);
	}

	@Test
	public void contextTracksTheAttempts() throws Exception {
		List<String> seen = new ArrayList<String>();
		String result = this.template.execute(context -> {
			seen.add(context.getAttemptCount() + "/" + context.getAttemptsRemaining());
			if (context.getAttemptCount() < 3) {
				throw new IOException("attempt " + context.getAttemptCount());
			}
			assertThat(context.getLastThrowable()).hasMessage("attempt 2");
			return "done";
		});
		assertThat(result).isEqualTo("done");
		assertThat(seen).containsExactly("1/3", "2/2", "3/1");
		assertThat(this.sleeper.getBackOffs()).hasSize(2);
	}

	@Test
	public void conditionPreventsRetry() {
		RetryHook hook = mock(RetryHook.class);
		this.template.setOnRetry(hook);
		this.template.setRetryCondition(e -> e instanceof RetriableResponseException
				&& ((RetriableResponseException) e).getStatus() == 404);
		RetriableResponseException failure = new RetriableResponseException(404, "not found");
		AtomicInteger attempts = new AtomicInteger();
		Throwable thrown = catchThrowable(() -> this.template.execute(context -> {
			attempts.incrementAndGet();
			throw failure;
		}));
		assertThat(thrown).isSameAs(failure);
		assertThat(attempts.get()).isEqualTo(1);
		verify(hook, never()).onRetry(any(), anyInt());
		assertThat(this.sleeper.getBackOffs()).isEmpty();
	}

	@Test
	public void conditionIsNotConsultedOnceRetriesAreExhausted() {
		AtomicInteger checks = new AtomicInteger();
		this.template.setRetryCondition(e -> {
			checks.incrementAndGet();
			return false;
		});
		this.template.setRetries(2);
		Throwable thrown = catchThrowable(() -> this.template.execute(context -> {
			throw new IOException("down");
		}));
		assertThat(thrown).isInstanceOf(IOException.class);
		assertThat(checks.get()).isEqualTo(2);
	}

	@Test
	public void sleepsFollowTheBackoffTable() {
		this.template.setBackoffIntervals(
				Arrays.asList(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));
		catchThrowable(() -> this.template.execute(context -> {
			throw new IOException("down");
		}));
		assertThat(this.sleeper.getBackOffs()).containsExactly(1000L, 2000L, 4000L);
	}

	@Test
	public void overridesApplyToOneCallOnly() {
		AtomicInteger attempts = new AtomicInteger();
		Throwable thrown = catchThrowable(() -> this.template.execute(context -> {
			attempts.incrementAndGet();
			throw new IllegalStateException("busy");
		}, RetryOverrides.create().retries(1).retriable(IllegalStateException.class).toMap()));
		assertThat(thrown).isInstanceOf(IllegalStateException.class);
		assertThat(attempts.get()).isEqualTo(2);

		attempts.set(0);
		catchThrowable(() -> this.template.execute(context -> {
			attempts.incrementAndGet();
			throw new IllegalStateException("busy");
		}));
		assertThat(attempts.get()).isEqualTo(1);
		assertThat(this.template.getConfiguration().getRetries()).isEqualTo(3);
	}

	@Test
	public void overrideBackoffIntervalsAreUsed() {
		catchThrowable(() -> this.template.execute(context -> {
			throw new IOException("down");
		}, RetryOverrides.create().retries(2).backoffIntervals(Duration.ofMillis(5), Duration.ofMillis(7)).toMap()));
		assertThat(this.sleeper.getBackOffs()).containsExactly(5L, 7L);
	}

	@Test
	public void longExponentialRunRethrowsTheOriginalFailure() {
		RetryTemplate longRun = RetryTemplate.builder()
			.retries(60)
			.backoff(BackoffStrategy.exponential(1))
			.sleeper(this.sleeper)
			.build();
		IOException failure = new IOException("boom");
		AtomicInteger attempts = new AtomicInteger();
		Throwable thrown = catchThrowable(() -> longRun.execute(context -> {
			attempts.incrementAndGet();
			throw failure;
		}));
		assertThat(thrown).isSameAs(failure);
		assertThat(attempts.get()).isEqualTo(61);
		List<Long> backOffs = this.sleeper.getBackOffs();
		assertThat(backOffs).hasSize(60);
		assertThat(backOffs.get(59)).isEqualTo(Long.MAX_VALUE);
	}

	@Test
	public void backOffPeriodSaturatesAtLongRange() {
		assertThat(RetryTemplate.toBackOffPeriod(Duration.ofMillis(1500))).isEqualTo(1500L);
		assertThat(RetryTemplate.toBackOffPeriod(Duration.ofSeconds(Long.MAX_VALUE / 10))).isEqualTo(Long.MAX_VALUE);
	}

	@Test
	public void invalidOverridesFailBeforeTheFirstAttempt() {
		AtomicInteger attempts = new AtomicInteger();
		assertThatExceptionOfType(UnknownConfigurationKeyException.class)
			.isThrownBy(() -> this.template.execute(context -> attempts.incrementAndGet(),
					Collections.singletonMap("retry", 2)));
		assertThatExceptionOfType(InvalidConfigurationValueException.class)
			.isThrownBy(() -> this.template.execute(context -> attempts.incrementAndGet(),
					Collections.singletonMap("retries", 0)));
		assertThat(attempts.get()).isZero();
	}

	@Test
	public void hookFailureAbortsTheRun() {
		IllegalStateException hookFailure = new IllegalStateException("hook failed");
		this.template.setOnRetry((e, remaining) -> {
			throw hookFailure;
		});
		AtomicInteger attempts = new AtomicInteger();
		Throwable thrown = catchThrowable(() -> this.template.execute(context -> {
			attempts.incrementAndGet();
			throw new IOException("down");
		}));
		assertThat(thrown).isSameAs(hookFailure);
		assertThat(attempts.get()).isEqualTo(1);
	}

	@Test
	public void interruptedSleepRethrowsTheFailure() {
		this.template.setSleeper(backOffPeriod -> {
			throw new InterruptedException();
		});
		IOException failure = new IOException("down");
		AtomicInteger attempts = new AtomicInteger();
		try {
			Throwable thrown = catchThrowable(() -> this.template.execute(context -> {
				attempts.incrementAndGet();
				throw failure;
			}));
			assertThat(thrown).isSameAs(failure);
			assertThat(attempts.get()).isEqualTo(1);
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		}
		finally {
			Thread.interrupted();
		}
	}

	@Test
	public void errorsAreNotRetriedByDefault() {
		AssertionError failure = new AssertionError("fatal");
		AtomicInteger attempts = new AtomicInteger();
		Throwable thrown = catchThrowable(() -> this.template.execute(context -> {
			attempts.incrementAndGet();
			throw failure;
		}));
		assertThat(thrown).isSameAs(failure);
		assertThat(attempts.get()).isEqualTo(1);
	}

	@Test
	public void concurrentRunsDoNotShareCounters() throws Exception {
		this.template.setRetries(2);
		List<Thread> threads = new ArrayList<Thread>();
		AtomicInteger attempts = new AtomicInteger();
		for (int i = 0; i < 4; i++) {
			threads.add(new Thread(() -> catchThrowable(() -> this.template.execute(context -> {
				attempts.incrementAndGet();
				throw new IOException("down");
			}))));
		}
		for (Thread thread : threads) {
			thread.start();
		}
		for (Thread thread : threads) {
			thread.join();
		}
		assertThat(attempts.get()).isEqualTo(12);
	}

}
