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

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.take2.RetryCondition;
import org.take2.RetryHook;

/**
 * Typed builder for the per-call overrides map accepted by
 * {@link org.take2.RetryOperations#execute(org.take2.RetryCallback, Map)}.
 *
 * <pre class="code">
 * template.execute(callback, RetryOverrides.create().retries(5).onRetry(hook).toMap());
 * </pre>
 */
public final class RetryOverrides {

	private final Map<String, Object> options = new LinkedHashMap<String, Object>();

	private RetryOverrides() {
	}

	public static RetryOverrides create() {
		return new RetryOverrides();
	}

	public RetryOverrides retries(int retries) {
		this.options.put(RetryConfiguration.RETRIES, retries);
		return this;
	}

	@SafeVarargs
	public final RetryOverrides retriable(Class<? extends Throwable>... retriable) {
		this.options.put(RetryConfiguration.RETRIABLE, Arrays.asList(retriable));
		return this;
	}

	public RetryOverrides retryCondition(RetryCondition retryCondition) {
		this.options.put(RetryConfiguration.RETRY_CONDITION, retryCondition);
		return this;
	}

	public RetryOverrides onRetry(RetryHook onRetry) {
		this.options.put(RetryConfiguration.ON_RETRY, onRetry);
		return this;
	}

	public RetryOverrides backoffIntervals(Duration... backoffIntervals) {
		return backoffIntervals(Arrays.asList(backoffIntervals));
	}

	public RetryOverrides backoffIntervals(List<Duration> backoffIntervals) {
		this.options.put(RetryConfiguration.BACKOFF_INTERVALS, backoffIntervals);
		return this;
	}

	/**
	 * @return an unmodifiable view of the collected overrides
	 */
	public Map<String, Object> toMap() {
		return Collections.unmodifiableMap(this.options);
	}

}
