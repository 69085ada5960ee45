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

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.util.Assert;
import org.take2.RetryCallback;
import org.take2.RetryCondition;
import org.take2.RetryHook;
import org.take2.RetryOperations;
import org.take2.backoff.BackoffStrategy;
import org.take2.config.RetryConfiguration;
import org.take2.config.RetryDefaults;
import org.take2.context.RetryContextSupport;

/**
 * Template class that simplifies the execution of operations with retry semantics.
 * <p>
 * Retryable operations are encapsulated in implementations of the {@link RetryCallback}
 * interface and are executed using one of the supplied execute methods.
 * <p>
 * Each template owns the type-level {@link RetryConfiguration} of the code that uses it.
 * On creation that configuration is copied from {@link RetryDefaults#config()}, then
 * customised through the setters or {@link RetryTemplateBuilder}, e.g: <pre> {@code
 * RetryTemplate.builder()
 *                 .retries(5)
 *                 .retryOn(IOException.class)
 *                 .backoff(BackoffStrategy.exponential(3))
 *                 .build();
 * }</pre>
 * <p>
 * A failure is retried only when its type is one of the retriable kinds (or a subclass),
 * retries remain and the {@link RetryCondition} does not prevent it. Before each retry
 * the {@link RetryHook} is called and the thread sleeps for the backoff interval indexed
 * by the number of retries already consumed. In every other case the failure thrown by
 * the callback is rethrown as is.
 * <p>
 * This class is thread-safe and suitable for concurrent access when executing
 * operations. Configuration changes only affect runs started after them.
 *
 * 重试模板
 */
public class RetryTemplate implements RetryOperations {

	protected final Log logger = LogFactory.getLog(getClass());

	/**
	 * 类型级别的重试配置
	 */
	private final RetryConfiguration configuration;

	/**
	 * 暂停接口，默认线程休眠
	 */
	private volatile Sleeper sleeper = new ThreadWaitSleeper();

	/**
	 * Creates a template configured with a copy of the process-wide defaults.
	 */
	public RetryTemplate() {
		this(RetryDefaults.config().copy());
	}

	/**
	 * @param configuration the type-level configuration this template owns
	 */
	public RetryTemplate(RetryConfiguration configuration) {
		Assert.notNull(configuration, "RetryConfiguration must not be null");
		configuration.validate();
		this.configuration = configuration;
	}

	/**
	 * Main entry point to configure RetryTemplate using fluent API. See
	 * {@link RetryTemplateBuilder} for usage examples and details.
	 * @return a new instance of RetryTemplateBuilder seeded from the process-wide defaults
	 */
	public static RetryTemplateBuilder builder() {
		return new RetryTemplateBuilder();
	}

	/**
	 * @return a new instance of RetryTemplate with the process-wide default behaviour
	 */
	public static RetryTemplate defaultInstance() {
		return new RetryTemplateBuilder().build();
	}

	/**
	 * Setter for the {@link Sleeper} pausing between attempts.
	 * @param sleeper the {@link Sleeper}
	 */
	public void setSleeper(Sleeper sleeper) {
		Assert.notNull(sleeper, "Sleeper must not be null");
		this.sleeper = sleeper;
	}

	/**
	 * The type-level configuration. Changes made through it apply to subsequent runs.
	 * @return the configuration owned by this template
	 */
	public RetryConfiguration getConfiguration() {
		return this.configuration;
	}

	public void setRetries(int retries) {
		this.configuration.setRetries(retries);
	}

	@SafeVarargs
	public final void setRetriable(Class<? extends Throwable>... retriable) {
		this.configuration.setRetriable(retriable);
	}

	public void setRetryCondition(RetryCondition retryCondition) {
		this.configuration.setRetryCondition(retryCondition);
	}

	public void setOnRetry(RetryHook onRetry) {
		this.configuration.setOnRetry(onRetry);
	}

	public void setBackoffStrategy(BackoffStrategy backoffStrategy) {
		this.configuration.setBackoffStrategy(backoffStrategy);
	}

	public void setBackoffIntervals(List<Duration> backoffIntervals) {
		this.configuration.setBackoffIntervals(backoffIntervals);
	}

	/**
	 * Keep executing the callback until it either succeeds or the configuration dictates
	 * that we stop, in which case the most recent exception thrown by the callback will
	 * be rethrown.
	 *
	 * @see RetryOperations#execute(RetryCallback)
	 * @param retryCallback the {@link RetryCallback}
	 */
	@Override
	public final <T, E extends Throwable> T execute(RetryCallback<T, E> retryCallback) throws E {
		return doExecute(retryCallback, null);
	}

	/**
	 * Same as {@link #execute(RetryCallback)}, with the overrides merged onto the
	 * configuration for this call only.
	 *
	 * @see RetryOperations#execute(RetryCallback, Map)
	 * @param retryCallback the {@link RetryCallback}
	 * @param overrides configuration keys and values for this call
	 */
	@Override
	public final <T, E extends Throwable> T execute(RetryCallback<T, E> retryCallback, Map<String, ?> overrides)
			throws E {
		return doExecute(retryCallback, overrides);
	}

	/**
	 * Execute the callback until it succeeds or a terminal failure is reached.
	 * @param retryCallback the {@link RetryCallback}
	 * @param overrides per-call overrides, may be null or empty
	 * @param <T> the type of the return value
	 * @param <E> the exception type to throw
	 * @throws E an exception if the retry operation fails
	 * @return T the retried value
	 */
	protected <T, E extends Throwable> T doExecute(RetryCallback<T, E> retryCallback, Map<String, ?> overrides)
			throws E {

		Assert.notNull(retryCallback, "RetryCallback must not be null");

		// 有单次调用覆盖时合并出临时配置，否则直接使用类型配置的快照
		RetryConfiguration config = (overrides == null || overrides.isEmpty()) ? this.configuration.copy()
				: this.configuration.merge(overrides);
		List<Duration> intervals = config.getBackoffIntervals();
		RetryCondition retryCondition = config.getRetryCondition();
		RetryHook onRetry = config.getOnRetry();
		Sleeper sleeper = this.sleeper;

		RetryContextSupport context = new RetryContextSupport(config.getRetries());

		while (true) {
			try {
				if (this.logger.isDebugEnabled()) {
					this.logger.debug("Retry: attempt=" + context.getAttemptCount() + ", remaining="
							+ context.getAttemptsRemaining());
				}
				return retryCallback.doWithRetry(context);
			}
			catch (Throwable e) {

				context.registerThrowable(e);

				if (!config.classify(e)) {
					if (this.logger.isDebugEnabled()) {
						this.logger.debug("Rethrow non-retriable " + e.getClass().getName() + ": attempt="
								+ context.getAttemptCount());
					}
					throw RetryTemplate.<E>rethrow(e);
				}

				if (context.getAttemptsRemaining() == 0) {
					if (this.logger.isDebugEnabled()) {
						this.logger.debug("Retry failed last attempt: attempt=" + context.getAttemptCount());
					}
					throw RetryTemplate.<E>rethrow(e);
				}

				if (retryCondition.preventsRetry(e)) {
					if (this.logger.isDebugEnabled()) {
						this.logger.debug("Retry prevented by condition: attempt=" + context.getAttemptCount());
					}
					throw RetryTemplate.<E>rethrow(e);
				}

				onRetry.onRetry(e, context.getAttemptsRemaining());

				// 间隔表按已消耗的重试次数索引
				Duration interval = intervals.get(context.getRetriesConsumed());
				try {
					sleeper.sleep(toBackOffPeriod(interval));
				}
				catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					if (this.logger.isDebugEnabled()) {
						this.logger.debug("Abort retry because interrupted: attempt=" + context.getAttemptCount());
					}
					throw RetryTemplate.<E>rethrow(e);
				}

				context.consumeRetry();

				if (this.logger.isTraceEnabled()) {
					this.logger.trace("Retrying after " + interval + ": " + context);
				}
			}
		}

	}

	@Override
	public String toString() {
		return "RetryTemplate[" + this.configuration + "]";
	}

	/**
	 * @param interval the backoff interval
	 * @return the interval in milliseconds, saturated at {@link Long#MAX_VALUE}
	 */
	static long toBackOffPeriod(Duration interval) {
		try {
			return interval.toMillis();
		}
		catch (ArithmeticException ex) {
			// 超出毫秒范围的间隔按最大值等待
			return Long.MAX_VALUE;
		}
	}

	/**
	 * Rethrows the original throwable without wrapping it. The callback declared
	 * {@code E}; anything else it can throw is unchecked.
	 */
	@SuppressWarnings("unchecked")
	private static <E extends Throwable> E rethrow(Throwable throwable) {
		return (E) throwable;
	}

}
