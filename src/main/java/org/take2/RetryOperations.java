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

package org.take2;

import java.util.Map;

/**
 * Defines the basic set of operations implemented by {@link RetryOperations} to execute
 * operations with configurable retry behaviour.
 *
 * 重试操作接口
 */
public interface RetryOperations {

	/**
	 * Execute the supplied {@link RetryCallback} with the configured retry semantics.
	 * When a retry is not possible the last exception thrown by the callback is
	 * rethrown unchanged.
	 * @param retryCallback the {@link RetryCallback}
	 * @param <T> the return value
	 * @param <E> the exception to throw
	 * @return the value returned by the {@link RetryCallback} upon successful invocation.
	 * @throws E any {@link Exception} raised by the {@link RetryCallback} upon
	 * unsuccessful retry.
	 */
	<T, E extends Throwable> T execute(RetryCallback<T, E> retryCallback) throws E;

	/**
	 * Execute the supplied {@link RetryCallback} with the configured retry semantics,
	 * overlaid with per-call overrides. The overrides apply to this invocation only.
	 * @param retryCallback the {@link RetryCallback}
	 * @param overrides configuration keys and values to apply to this call, may be empty
	 * @param <T> the return value
	 * @param <E> the exception to throw
	 * @return the value returned by the {@link RetryCallback} upon successful invocation.
	 * @throws E any {@link Exception} raised by the {@link RetryCallback} upon
	 * unsuccessful retry.
	 * @throws RetryConfigurationException if the overrides are not valid
	 */
	<T, E extends Throwable> T execute(RetryCallback<T, E> retryCallback, Map<String, ?> overrides) throws E;

}
