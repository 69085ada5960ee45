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

package org.take2.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.springframework.util.Assert;
import org.take2.InvalidConfigurationValueException;
import org.take2.RetriableResponseException;
import org.take2.RetryCondition;
import org.take2.RetryHook;
import org.take2.UnknownConfigurationKeyException;
import org.take2.backoff.BackoffGenerator;
import org.take2.backoff.BackoffStrategy;
import org.take2.classify.RetriableClassifier;

/**
 * The retry parameters of one configurable type: the retry budget, the retriable
 * failure kinds, the suppression condition, the pre-retry hook and the backoff table.
 * <p>
 * Values can be declared one at a time through the setters, applied in bulk from an
 * options map with {@link #mergeOptions(Map)}, or overlaid for a single call with
 * {@link #merge(Map)}, which leaves this instance untouched. Every path validates the
 * whole options map before applying any of it, and guarantees that the backoff table
 * holds at least one interval per retry.
 * <p>
 * The values are held in one immutable snapshot that is swapped on change, so any
 * number of threads may read a configuration while it is being used by retry runs.
 * Changes are serialised but are not expected to race with live runs.
 *
 * 重试配置
 */
public class RetryConfiguration {

	public static final String RETRIES = "retries";

	public static final String RETRIABLE = "retriable";

	public static final String RETRY_CONDITION = "retryCondition";

	public static final String ON_RETRY = "onRetry";

	public static final String BACKOFF_INTERVALS = "backoffIntervals";

	/**
	 * All recognised configuration keys.
	 */
	public static final List<String> CONFIG_KEYS = Collections
		.unmodifiableList(Arrays.asList(RETRIES, RETRIABLE, RETRY_CONDITION, ON_RETRY, BACKOFF_INTERVALS));

	public static final int DEFAULT_RETRIES = 3;

	public static final BackoffStrategy DEFAULT_BACKOFF = BackoffStrategy.constant(3);

	/**
	 * Transient I/O failures (connection resets included, as {@link java.net.SocketException}
	 * is an {@link IOException}) and retriable server responses.
	 */
	public static final List<Class<? extends Throwable>> DEFAULT_RETRIABLE = Collections
		.unmodifiableList(Arrays.<Class<? extends Throwable>>asList(IOException.class, UncheckedIOException.class,
				RetriableResponseException.class));

	private static final Log logger = LogFactory.getLog(RetryConfiguration.class);

	private volatile Settings settings;

	/**
	 * Create a configuration holding the built-in defaults.
	 */
	public RetryConfiguration() {
		this.settings = new Settings(DEFAULT_RETRIES, new RetriableClassifier(DEFAULT_RETRIABLE),
				RetryCondition.NEVER, RetryHook.NO_OP, BackoffGenerator.generate(DEFAULT_BACKOFF), DEFAULT_BACKOFF);
	}

	/**
	 * Create a configuration holding the built-in defaults overlaid with the options.
	 * @param options configuration keys and values
	 * @throws org.take2.RetryConfigurationException if the options are not valid
	 */
	public RetryConfiguration(Map<String, ?> options) {
		this();
		mergeOptions(options);
	}

	private RetryConfiguration(Settings settings) {
		this.settings = settings;
	}

	/**
	 * @return a new configuration holding the built-in defaults
	 */
	public static RetryConfiguration createDefault() {
		return new RetryConfiguration();
	}

	/**
	 * @return an independent copy of this configuration
	 */
	public RetryConfiguration copy() {
		return new RetryConfiguration(this.settings);
	}

	/**
	 * Overlay the options on a copy of this configuration.
	 * @param overrides configuration keys and values
	 * @return a new configuration, this one is not modified
	 * @throws UnknownConfigurationKeyException if a key is not recognised
	 * @throws InvalidConfigurationValueException if a value is not valid
	 */
	public RetryConfiguration merge(Map<String, ?> overrides) {
		RetryConfiguration merged = copy();
		merged.mergeOptions(overrides);
		return merged;
	}

	/**
	 * Apply the options to this configuration. Either all of them are applied or, when
	 * one of them is not valid, none.
	 * @param options configuration keys and values
	 * @return this configuration
	 * @throws UnknownConfigurationKeyException if a key is not recognised
	 * @throws InvalidConfigurationValueException if a value is not valid
	 */
	public synchronized RetryConfiguration mergeOptions(Map<String, ?> options) {
		Assert.notNull(options, "Options must not be null");
		for (String key : options.keySet()) {
			if (!CONFIG_KEYS.contains(key)) {
				throw new UnknownConfigurationKeyException(key);
			}
		}
		Settings current = this.settings;
		int retries = current.retries;
		RetriableClassifier classifier = current.classifier;
		RetryCondition retryCondition = current.retryCondition;
		RetryHook onRetry = current.onRetry;
		List<Duration> backoffIntervals = null;
		for (Map.Entry<String, ?> entry : options.entrySet()) {
			Object value = entry.getValue();
			switch (entry.getKey()) {
				case RETRIES:
					retries = toRetries(value);
					break;
				case RETRIABLE:
					classifier = new RetriableClassifier(toRetriable(value));
					break;
				case RETRY_CONDITION:
					retryCondition = toCallable(RETRY_CONDITION, value, RetryCondition.class);
					break;
				case ON_RETRY:
					onRetry = toCallable(ON_RETRY, value, RetryHook.class);
					break;
				default:
					backoffIntervals = toIntervals(value);
					break;
			}
		}
		BackoffStrategy backoffStrategy = current.backoffStrategy;
		if (backoffIntervals != null) {
			if (backoffIntervals.size() < retries) {
				throw new InvalidConfigurationValueException(BACKOFF_INTERVALS,
						"size must be greater or equal to number of retries (" + retries + ")");
			}
			backoffStrategy = null;
		}
		else {
			backoffIntervals = current.backoffIntervals;
			if (backoffIntervals.size() < retries) {
				// 显式指定的间隔表不能自动扩展
				if (backoffStrategy == null) {
					throw new InvalidConfigurationValueException(RETRIES,
							"must not exceed the size of the backoff table (" + backoffIntervals.size() + ")");
				}
				backoffIntervals = BackoffGenerator.generate(backoffStrategy, retries);
			}
		}
		this.settings = new Settings(retries, classifier, retryCondition, onRetry, backoffIntervals, backoffStrategy);
		return this;
	}

	/**
	 * Check the invariants of this configuration.
	 * @throws InvalidConfigurationValueException if an invariant does not hold
	 */
	public void validate() {
		Settings current = this.settings;
		if (current.retries <= 0) {
			throw new InvalidConfigurationValueException(RETRIES, "must be positive integer");
		}
		if (current.backoffIntervals.size() < current.retries) {
			throw new InvalidConfigurationValueException(BACKOFF_INTERVALS,
					"size must be greater or equal to number of retries (" + current.retries + ")");
		}
	}

	/**
	 * @param throwable the failure raised by an attempt
	 * @return true if the failure is of a retriable kind or a sub-kind of one
	 */
	public boolean classify(Throwable throwable) {
		return this.settings.classifier.classify(throwable);
	}

	/**
	 * Regenerate the backoff table from a strategy. The table holds at least
	 * {@link BackoffGenerator#DEFAULT_TABLE_SIZE} intervals and never fewer than the
	 * number of retries. The strategy is kept so that the table can grow with the
	 * retry budget.
	 * @param backoffStrategy the strategy
	 */
	public synchronized void setBackoffStrategy(BackoffStrategy backoffStrategy) {
		Assert.notNull(backoffStrategy, "Backoff strategy must not be null");
		Settings current = this.settings;
		List<Duration> intervals = BackoffGenerator.generate(backoffStrategy,
				Math.max(BackoffGenerator.DEFAULT_TABLE_SIZE, current.retries));
		if (logger.isDebugEnabled()) {
			logger.debug("Backoff table generated from " + backoffStrategy + ": " + intervals);
		}
		this.settings = new Settings(current.retries, current.classifier, current.retryCondition, current.onRetry,
				intervals, backoffStrategy);
	}

	public void setRetries(int retries) {
		mergeOptions(Collections.singletonMap(RETRIES, retries));
	}

	@SafeVarargs
	public final void setRetriable(Class<? extends Throwable>... retriable) {
		mergeOptions(Collections.singletonMap(RETRIABLE, retriable != null ? Arrays.asList(retriable) : null));
	}

	public void setRetryCondition(RetryCondition retryCondition) {
		mergeOptions(Collections.singletonMap(RETRY_CONDITION, retryCondition));
	}

	public void setOnRetry(RetryHook onRetry) {
		mergeOptions(Collections.singletonMap(ON_RETRY, onRetry));
	}

	public void setBackoffIntervals(List<Duration> backoffIntervals) {
		mergeOptions(Collections.singletonMap(BACKOFF_INTERVALS, backoffIntervals));
	}

	public int getRetries() {
		return this.settings.retries;
	}

	public Set<Class<? extends Throwable>> getRetriable() {
		return this.settings.classifier.getKinds();
	}

	public RetryCondition getRetryCondition() {
		return this.settings.retryCondition;
	}

	public RetryHook getOnRetry() {
		return this.settings.onRetry;
	}

	/**
	 * @return the unmodifiable backoff table, at least {@link #getRetries()} long
	 */
	public List<Duration> getBackoffIntervals() {
		return this.settings.backoffIntervals;
	}

	/**
	 * @return the strategy the backoff table was generated from, or null if the table
	 * was supplied explicitly
	 */
	public BackoffStrategy getBackoffStrategy() {
		return this.settings.backoffStrategy;
	}

	/**
	 * @return the current values keyed by {@link #CONFIG_KEYS}
	 */
	public Map<String, Object> asMap() {
		Settings current = this.settings;
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		map.put(RETRIES, current.retries);
		map.put(RETRIABLE, new ArrayList<Class<? extends Throwable>>(current.classifier.getKinds()));
		map.put(RETRY_CONDITION, current.retryCondition);
		map.put(ON_RETRY, current.onRetry);
		map.put(BACKOFF_INTERVALS, current.backoffIntervals);
		return Collections.unmodifiableMap(map);
	}

	@Override
	public String toString() {
		return "RetryConfiguration" + asMap();
	}

	private static int toRetries(Object value) {
		if (!(value instanceof Integer) || (Integer) value <= 0) {
			throw new InvalidConfigurationValueException(RETRIES, "must be positive integer, was " + value);
		}
		return (Integer) value;
	}

	@SuppressWarnings("unchecked")
	private static List<Class<? extends Throwable>> toRetriable(Object value) {
		Collection<?> candidates;
		if (value instanceof Object[]) {
			candidates = Arrays.asList((Object[]) value);
		}
		else if (value instanceof Collection) {
			candidates = (Collection<?>) value;
		}
		else {
			throw new InvalidConfigurationValueException(RETRIABLE, "must be array of retriable errors, was " + value);
		}
		List<Class<? extends Throwable>> kinds = new ArrayList<Class<? extends Throwable>>(candidates.size());
		for (Object candidate : candidates) {
			if (!(candidate instanceof Class) || !Throwable.class.isAssignableFrom((Class<?>) candidate)) {
				throw new InvalidConfigurationValueException(RETRIABLE,
						"must contain Throwable types only, found " + candidate);
			}
			kinds.add((Class<? extends Throwable>) candidate);
		}
		return kinds;
	}

	private static <T> T toCallable(String key, Object value, Class<T> type) {
		if (!type.isInstance(value)) {
			throw new InvalidConfigurationValueException(key, "must be a " + type.getSimpleName() + ", was " + value);
		}
		return type.cast(value);
	}

	private static List<Duration> toIntervals(Object value) {
		if (!(value instanceof List)) {
			throw new InvalidConfigurationValueException(BACKOFF_INTERVALS, "must be a list of intervals, was " + value);
		}
		List<?> candidates = (List<?>) value;
		List<Duration> intervals = new ArrayList<Duration>(candidates.size());
		for (Object candidate : candidates) {
			Duration interval = toInterval(candidate);
			if (interval == null || interval.isNegative()) {
				throw new InvalidConfigurationValueException(BACKOFF_INTERVALS,
						"must contain non-negative intervals only, found " + candidate);
			}
			intervals.add(interval);
		}
		return Collections.unmodifiableList(intervals);
	}

	// plain numbers are seconds, as in the generated tables
	private static Duration toInterval(Object candidate) {
		if (candidate instanceof Duration) {
			return (Duration) candidate;
		}
		if (candidate instanceof Integer || candidate instanceof Long || candidate instanceof Short
				|| candidate instanceof Byte) {
			return Duration.ofSeconds(((Number) candidate).longValue());
		}
		if (candidate instanceof Number) {
			return Duration.ofMillis(Math.round(((Number) candidate).doubleValue() * 1000));
		}
		return null;
	}

	private static final class Settings {

		private final int retries;

		private final RetriableClassifier classifier;

		private final RetryCondition retryCondition;

		private final RetryHook onRetry;

		private final List<Duration> backoffIntervals;

		private final BackoffStrategy backoffStrategy;

		private Settings(int retries, RetriableClassifier classifier, RetryCondition retryCondition,
				RetryHook onRetry, List<Duration> backoffIntervals, BackoffStrategy backoffStrategy) {
			this.retries = retries;
			this.classifier = classifier;
			this.retryCondition = retryCondition;
			this.onRetry = onRetry;
			this.backoffIntervals = backoffIntervals;
			this.backoffStrategy = backoffStrategy;
		}

	}

}
