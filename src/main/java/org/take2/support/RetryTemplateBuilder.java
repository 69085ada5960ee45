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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.retry.backoff.Sleeper;
import org.springframework.util.Assert;
import org.take2.RetryCondition;
import org.take2.RetryHook;
import org.take2.backoff.BackoffStrategy;
import org.take2.config.RetryConfiguration;
import org.take2.config.RetryDefaults;

/**
 * Fluent API to configure new instance of RetryTemplate. For detailed description of
 * each builder method - see it's doc.
 *
 * <p>
 * Examples: <pre>{@code
 * RetryTemplate.builder()
 *      .retries(10)
 *      .backoff(BackoffStrategy.fibonacci(1))
 *      .retryOn(IOException.class)
 *      .build();
 *
 * RetryTemplate.builder()
 *      .retries(2)
 *      .backoff("linear", 1, 2)
 *      .retryCondition(e -> e instanceof RetriableResponseException
 *              && ((RetriableResponseException) e).getStatus() < 500)
 *      .onRetry((e, remaining) -> log.warn("Retrying, " + remaining + " left", e))
 *      .build();
 * }</pre>
 *
 * <p>
 * Anything not set on the builder keeps the value of the configuration the builder is
 * seeded with, the process-wide default unless {@link #defaults(RetryConfiguration)} is
 * used. All values are validated together by {@link #build()}.
 * <p>
 * Not thread safe. Building should be performed in a single thread.
 */
public class RetryTemplateBuilder {

	private RetryConfiguration base;

	private final Map<String, Object> options = new LinkedHashMap<String, Object>();

	private BackoffStrategy backoffStrategy;

	private Sleeper sleeper;

	/**
	 * Seed the configuration from another one instead of the process-wide default.
	 * @param base the configuration to copy
	 * @return this
	 */
	public RetryTemplateBuilder defaults(RetryConfiguration base) {
		Assert.notNull(base, "Base configuration must not be null");
		this.base = base;
		return this;
	}

	/**
	 * @param retries the retry budget, not counting the first attempt
	 * @return this
	 */
	public RetryTemplateBuilder retries(int retries) {
		this.options.put(RetryConfiguration.RETRIES, retries);
		return this;
	}

	/**
	 * Replace the retriable failure kinds. Subclasses of the given types are retriable
	 * too.
	 * @param retriable the failure kinds
	 * @return this
	 */
	@SafeVarargs
	public final RetryTemplateBuilder retryOn(Class<? extends Throwable>... retriable) {
		this.options.put(RetryConfiguration.RETRIABLE, Arrays.asList(retriable));
		return this;
	}

	public RetryTemplateBuilder retryCondition(RetryCondition retryCondition) {
		this.options.put(RetryConfiguration.RETRY_CONDITION, retryCondition);
		return this;
	}

	public RetryTemplateBuilder onRetry(RetryHook onRetry) {
		this.options.put(RetryConfiguration.ON_RETRY, onRetry);
		return this;
	}

	public RetryTemplateBuilder backoffIntervals(Duration... backoffIntervals) {
		return backoffIntervals(Arrays.asList(backoffIntervals));
	}

	public RetryTemplateBuilder backoffIntervals(List<Duration> backoffIntervals) {
		this.backoffStrategy = null;
		this.options.put(RetryConfiguration.BACKOFF_INTERVALS, backoffIntervals);
		return this;
	}

	/**
	 * Generate the backoff table from a strategy. Replaces any explicit intervals.
	 * @param backoffStrategy the strategy
	 * @return this
	 */
	public RetryTemplateBuilder backoff(BackoffStrategy backoffStrategy) {
		Assert.notNull(backoffStrategy, "Backoff strategy must not be null");
		this.options.remove(RetryConfiguration.BACKOFF_INTERVALS);
		this.backoffStrategy = backoffStrategy;
		return this;
	}

	/**
	 * @param kind the strategy name, one of constant, linear, fibonacci, exponential
	 * @param start the start value in seconds
	 * @return this
	 * @throws org.take2.backoff.InvalidStrategyKindException if the kind is not
	 * recognised
	 */
	public RetryTemplateBuilder backoff(String kind, long start) {
		return backoff(BackoffStrategy.of(kind, start));
	}

	public RetryTemplateBuilder backoff(String kind, long start, long factor) {
		return backoff(BackoffStrategy.of(kind, start, factor));
	}

	public RetryTemplateBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Finish configuration and build resulting {@link RetryTemplate}.
	 * @return a new instance of {@link RetryTemplate}
	 * @throws org.take2.RetryConfigurationException if the collected values are not
	 * valid
	 */
	public RetryTemplate build() {
		RetryConfiguration seed = (this.base != null) ? this.base : RetryDefaults.config();
		RetryConfiguration configuration = seed.copy();
		// 先生成间隔表，随后合并的 retries 可以在策略基础上扩展间隔表
		if (this.backoffStrategy != null) {
			configuration.setBackoffStrategy(this.backoffStrategy);
		}
		configuration.mergeOptions(this.options);
		RetryTemplate template = new RetryTemplate(configuration);
		if (this.sleeper != null) {
			template.setSleeper(this.sleeper);
		}
		return template;
	}

}
